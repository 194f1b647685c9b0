package com.proposalpilot.orchestrator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Endpoints and credentials of the external providers, bound from
 * {@code proposal.providers.*}. Credentials come from the environment.
 */
@ConfigurationProperties(prefix = "proposal.providers")
public record ProviderProperties(Tavily tavily, HuggingFace huggingface, GitHub github, Kaggle kaggle) {

    public ProviderProperties {
        if (tavily      == null) tavily      = new Tavily(null, null);
        if (huggingface == null) huggingface = new HuggingFace(null, null);
        if (github      == null) github      = new GitHub(null, null);
        if (kaggle      == null) kaggle      = new Kaggle(null, null);
    }

    public record Tavily(String baseUrl, String apiKey) {
        public Tavily {
            if (baseUrl == null || baseUrl.isBlank()) baseUrl = "https://api.tavily.com";
        }
    }

    public record HuggingFace(String baseUrl, String token) {
        public HuggingFace {
            if (baseUrl == null || baseUrl.isBlank()) baseUrl = "https://huggingface.co";
        }
    }

    public record GitHub(String baseUrl, String token) {
        public GitHub {
            if (baseUrl == null || baseUrl.isBlank()) baseUrl = "https://api.github.com";
        }
    }

    /** Kaggle is optional: without a token the backend is not registered at all. */
    public record Kaggle(String baseUrl, String apiToken) {
        public Kaggle {
            if (baseUrl == null || baseUrl.isBlank()) baseUrl = "https://www.kaggle.com";
        }

        public boolean enabled() {
            return apiToken != null && !apiToken.isBlank();
        }
    }
}
