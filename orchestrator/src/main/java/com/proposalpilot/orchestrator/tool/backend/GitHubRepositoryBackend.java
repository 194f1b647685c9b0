package com.proposalpilot.orchestrator.tool.backend;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.proposalpilot.orchestrator.tool.BackendCategory;
import com.proposalpilot.orchestrator.tool.BackendManifest;
import com.proposalpilot.orchestrator.tool.MalformedPayloadException;
import com.proposalpilot.orchestrator.tool.ProviderIds;
import com.proposalpilot.orchestrator.tool.SearchResult;
import com.proposalpilot.orchestrator.tool.ToolQuery;

import java.io.IOException;
import java.net.http.HttpResponse;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Repository search on GitHub (GET /search/repositories), most-starred first.
 *
 * GitHub reports an exhausted rate limit as 403 with
 * {@code x-ratelimit-remaining: 0}; that is surfaced as 429 so the gateway
 * classifies it as RATE_LIMITED rather than AUTH_ERROR.
 *
 * Reply shape: { "items": [ { "full_name", "html_url", "description" }, ... ] }
 */
public class GitHubRepositoryBackend extends HttpSearchBackend {

    public static final String PROVIDER_ID = ProviderIds.CODE_SEARCH;

    private static final BackendManifest MANIFEST = new BackendManifest(
            PROVIDER_ID, "Repository search on GitHub",
            BackendCategory.CODE_HOST, 100);

    private final String token;

    public GitHubRepositoryBackend(String baseUrl, String token, ObjectMapper objectMapper) {
        super(baseUrl, objectMapper);
        this.token = token;
    }

    @Override public BackendManifest manifest() { return MANIFEST; }

    @Override
    public List<SearchResult> search(ToolQuery query) throws IOException, InterruptedException {
        Map<String, String> headers = new HashMap<>();
        headers.put("Accept", "application/vnd.github+json");
        headers.put("X-GitHub-Api-Version", "2022-11-28");
        if (token != null && !token.isBlank()) {
            headers.put("Authorization", "Bearer " + token);
        }
        JsonNode reply = getJson("/search/repositories?q=" + encode(query.text())
                + "&sort=stars&order=desc&per_page=" + query.maxResults(), headers);

        JsonNode items = reply.get("items");
        if (items == null) {
            throw new MalformedPayloadException("GitHub search reply has no 'items'");
        }
        List<SearchResult> hits = new ArrayList<>();
        for (JsonNode repo : requireArray(items, "items")) {
            hits.add(new SearchResult(text(repo, "full_name"), text(repo, "html_url"),
                    text(repo, "description"), PROVIDER_ID));
        }
        return hits;
    }

    @Override
    protected int effectiveStatus(HttpResponse<String> response) {
        boolean exhausted = response.headers()
                .firstValue("x-ratelimit-remaining")
                .map("0"::equals)
                .orElse(false);
        return response.statusCode() == 403 && exhausted ? 429 : response.statusCode();
    }
}
