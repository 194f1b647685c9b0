package com.proposalpilot.orchestrator.tool.backend;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.proposalpilot.orchestrator.tool.BackendHttpException;
import com.proposalpilot.orchestrator.tool.BackendManifest;
import com.proposalpilot.orchestrator.tool.SearchResult;
import com.proposalpilot.orchestrator.tool.ToolQuery;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Web search through the Tavily API (POST /search).
 *
 * One class backs several provider ids; each instance pins its own topic
 * and search depth so that, e.g., "market_trends" searches news while
 * "business_analysis" searches finance sources.
 *
 * Reply shape: { "results": [ { "title", "url", "content", "score" }, ... ] }
 */
public class TavilySearchBackend extends HttpSearchBackend {

    private final BackendManifest manifest;
    private final String          topic;
    private final String          searchDepth;
    private final String          apiKey;

    public TavilySearchBackend(BackendManifest manifest, String topic, String searchDepth,
                               String baseUrl, String apiKey, ObjectMapper objectMapper) {
        super(baseUrl, objectMapper);
        this.manifest    = manifest;
        this.topic       = topic;
        this.searchDepth = searchDepth;
        this.apiKey      = apiKey;
    }

    @Override public BackendManifest manifest() { return manifest; }

    @Override
    public List<SearchResult> search(ToolQuery query) throws IOException, InterruptedException {
        if (apiKey == null || apiKey.isBlank()) {
            throw new BackendHttpException(401, "Tavily API key is not configured");
        }
        JsonNode reply = postJson("/search",
                Map.of("query",        query.text(),
                       "topic",        query.options().getOrDefault("topic", topic),
                       "search_depth", searchDepth,
                       "max_results",  query.maxResults()),
                Map.of("Authorization", "Bearer " + apiKey));

        JsonNode results = requireArray(reply.get("results"), "results");
        List<SearchResult> hits = new ArrayList<>();
        for (JsonNode r : results) {
            hits.add(new SearchResult(text(r, "title"), text(r, "url"), text(r, "content"),
                    manifest.providerId()));
        }
        return hits;
    }
}
