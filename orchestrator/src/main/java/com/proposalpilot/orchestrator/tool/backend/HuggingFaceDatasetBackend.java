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
 * Dataset search on the Hugging Face Hub (GET /api/datasets?search=...).
 * Works anonymously; a token only raises the rate limit.
 *
 * Reply shape: [ { "id": "owner/name", "description", "tags": [...] }, ... ]
 */
public class HuggingFaceDatasetBackend extends HttpSearchBackend {

    public static final String PROVIDER_ID = ProviderIds.DATASET_SEARCH;

    private static final BackendManifest MANIFEST = new BackendManifest(
            PROVIDER_ID, "Dataset search on the Hugging Face Hub",
            BackendCategory.DATASET_REGISTRY, 50);

    private final String token;

    public HuggingFaceDatasetBackend(String baseUrl, String token, ObjectMapper objectMapper) {
        super(baseUrl, objectMapper);
        this.token = token;
    }

    @Override public BackendManifest manifest() { return MANIFEST; }

    @Override
    public List<SearchResult> search(ToolQuery query) throws IOException, InterruptedException {
        Map<String, String> headers = token == null || token.isBlank()
                ? Map.of()
                : Map.of("Authorization", "Bearer " + token);
        JsonNode reply = getJson("/api/datasets?search=" + encode(query.text())
                + "&limit=" + query.maxResults() + "&full=true", headers);

        List<SearchResult> hits = new ArrayList<>();
        for (JsonNode d : requireArray(reply, "dataset list")) {
            String id = text(d, "id");
            if (id.isEmpty()) continue;
            hits.add(new SearchResult(id, baseUrl + "/datasets/" + id, describe(d), PROVIDER_ID));
        }
        return hits;
    }

    private static String describe(JsonNode dataset) {
        String description = text(dataset, "description");
        if (!description.isEmpty()) return description;
        JsonNode tags = dataset.get("tags");
        if (tags == null || !tags.isArray()) return "";
        List<String> names = new ArrayList<>();
        tags.forEach(t -> names.add(t.asText()));
        return String.join(", ", names);
    }
}
