package com.proposalpilot.orchestrator.tool;

/**
 * What sort of external source a backend wraps. Informational; the gateway
 * treats every category the same way.
 */
public enum BackendCategory {
    WEB_SEARCH,
    BUSINESS_ANALYSIS,
    MARKET_DATA,
    DATASET_REGISTRY,
    CODE_HOST
}
