package com.proposalpilot.orchestrator.tool;

/**
 * Provider ids agents address the gateway with.
 */
public final class ProviderIds {

    public static final String WEB_SEARCH        = "web_search";
    public static final String BUSINESS_ANALYSIS = "business_analysis";
    public static final String MARKET_TRENDS     = "market_trends";
    public static final String USE_CASES         = "use_cases";
    public static final String DATASET_SEARCH    = "dataset_search";
    public static final String CODE_SEARCH       = "code_search";
    public static final String KAGGLE_DATASETS   = "kaggle_datasets";   // optional, token-gated

    private ProviderIds() {}
}
