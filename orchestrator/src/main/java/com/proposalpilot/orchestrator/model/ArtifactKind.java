package com.proposalpilot.orchestrator.model;

/**
 * Kinds of typed output an agent can produce.
 * Downstream tasks look artifacts up by kind within their run.
 */
public enum ArtifactKind {
    RESEARCH_PROFILE,
    MARKET_TRENDS_REPORT,
    RESOURCE_BUNDLE,
    PROPOSAL_DOCUMENT
}
