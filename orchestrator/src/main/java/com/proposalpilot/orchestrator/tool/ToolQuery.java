package com.proposalpilot.orchestrator.tool;

import java.util.Map;

/**
 * Structured query handed to a backend.
 *
 * @param text       free-text search terms
 * @param maxResults upper bound on the number of hits the backend should return
 * @param options    backend-specific extras (e.g. "topic"), validated against the manifest
 */
public record ToolQuery(String text, int maxResults, Map<String, String> options) {

    public ToolQuery {
        options = options == null ? Map.of() : Map.copyOf(options);
    }

    public static ToolQuery of(String text, int maxResults) {
        return new ToolQuery(text, maxResults, Map.of());
    }
}
