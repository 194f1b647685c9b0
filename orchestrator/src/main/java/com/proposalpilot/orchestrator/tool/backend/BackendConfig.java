package com.proposalpilot.orchestrator.tool.backend;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.proposalpilot.orchestrator.config.ProviderProperties;
import com.proposalpilot.orchestrator.tool.BackendCategory;
import com.proposalpilot.orchestrator.tool.BackendManifest;
import com.proposalpilot.orchestrator.tool.ProviderIds;
import com.proposalpilot.orchestrator.tool.ToolBackend;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Declares one bean per provider id. The gateway picks up every
 * {@link ToolBackend} bean, so adding a provider only takes a new method here.
 */
@Configuration
public class BackendConfig {

    @Bean
    ToolBackend webSearchBackend(ProviderProperties providers, ObjectMapper objectMapper) {
        return tavily(new BackendManifest(ProviderIds.WEB_SEARCH, "General web search (Tavily)",
                BackendCategory.WEB_SEARCH, 20), "general", "basic", providers, objectMapper);
    }

    @Bean
    ToolBackend businessAnalysisBackend(ProviderProperties providers, ObjectMapper objectMapper) {
        return tavily(new BackendManifest(ProviderIds.BUSINESS_ANALYSIS, "Financial and strategy sources (Tavily finance)",
                BackendCategory.BUSINESS_ANALYSIS, 20), "finance", "advanced", providers, objectMapper);
    }

    @Bean
    ToolBackend marketTrendsBackend(ProviderProperties providers, ObjectMapper objectMapper) {
        return tavily(new BackendManifest(ProviderIds.MARKET_TRENDS, "Recent industry and AI market news (Tavily news)",
                BackendCategory.MARKET_DATA, 20), "news", "basic", providers, objectMapper);
    }

    @Bean
    ToolBackend useCasesBackend(ProviderProperties providers, ObjectMapper objectMapper) {
        return tavily(new BackendManifest(ProviderIds.USE_CASES, "AI/ML use case write-ups (Tavily)",
                BackendCategory.MARKET_DATA, 20), "general", "advanced", providers, objectMapper);
    }

    @Bean
    ToolBackend huggingFaceDatasetBackend(ProviderProperties providers, ObjectMapper objectMapper) {
        return new HuggingFaceDatasetBackend(providers.huggingface().baseUrl(),
                providers.huggingface().token(), objectMapper);
    }

    @Bean
    ToolBackend gitHubRepositoryBackend(ProviderProperties providers, ObjectMapper objectMapper) {
        return new GitHubRepositoryBackend(providers.github().baseUrl(),
                providers.github().token(), objectMapper);
    }

    @Bean
    @ConditionalOnExpression("'${proposal.providers.kaggle.api-token:}' != ''")
    ToolBackend kaggleDatasetBackend(ProviderProperties providers, ObjectMapper objectMapper) {
        return new KaggleDatasetBackend(providers.kaggle().baseUrl(),
                providers.kaggle().apiToken(), objectMapper);
    }

    private static ToolBackend tavily(BackendManifest manifest, String topic, String depth,
                                      ProviderProperties providers, ObjectMapper objectMapper) {
        return new TavilySearchBackend(manifest, topic, depth,
                providers.tavily().baseUrl(), providers.tavily().apiKey(), objectMapper);
    }
}
