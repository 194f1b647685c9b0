package com.proposalpilot.orchestrator.tool.backend;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.proposalpilot.orchestrator.tool.BackendCategory;
import com.proposalpilot.orchestrator.tool.BackendManifest;
import com.proposalpilot.orchestrator.tool.ProviderIds;
import com.proposalpilot.orchestrator.tool.SearchResult;
import com.proposalpilot.orchestrator.tool.ToolQuery;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Dataset search on Kaggle (GET /api/v1/datasets/list?search=...).
 *
 * Only registered when an API token is configured; the resource agent
 * treats it as an optional extra source.
 *
 * Reply shape: [ { "ref": "owner/slug", "title", "subtitle" }, ... ]
 */
public class KaggleDatasetBackend extends HttpSearchBackend {

    public static final String PROVIDER_ID = ProviderIds.KAGGLE_DATASETS;

    private static final BackendManifest MANIFEST = new BackendManifest(
            PROVIDER_ID, "Dataset search on Kaggle",
            BackendCategory.DATASET_REGISTRY, 20);

    private final String apiToken;

    public KaggleDatasetBackend(String baseUrl, String apiToken, ObjectMapper objectMapper) {
        super(baseUrl, objectMapper);
        this.apiToken = apiToken;
    }

    @Override public BackendManifest manifest() { return MANIFEST; }

    @Override
    public List<SearchResult> search(ToolQuery query) throws IOException, InterruptedException {
        JsonNode reply = getJson("/api/v1/datasets/list?search=" + encode(query.text()),
                Map.of("Authorization", "Bearer " + apiToken));

        List<SearchResult> hits = new ArrayList<>();
        for (JsonNode d : requireArray(reply, "dataset list")) {
            if (hits.size() >= query.maxResults()) break;   // the endpoint has no page-size parameter
            String ref = text(d, "ref");
            if (ref.isEmpty()) continue;
            String title = text(d, "title");
            hits.add(new SearchResult(title.isEmpty() ? ref : title, baseUrl + "/datasets/" + ref,
                    text(d, "subtitle"), PROVIDER_ID));
        }
        return hits;
    }
}
