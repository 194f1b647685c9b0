package com.proposalpilot.orchestrator.tool;

/**
 * One normalised hit returned by a backend.
 *
 * Every backend, whatever its wire format, maps its results into this
 * shape so agents only handle one result type.
 *
 * @param title    display title (dataset name, repository full name, page title)
 * @param url      canonical link to the resource
 * @param snippet  short description or content excerpt; may be empty, never null
 * @param provider id of the provider that produced the hit
 */
public record SearchResult(String title, String url, String snippet, String provider) {

    public SearchResult {
        title   = title   == null ? "" : title.strip();
        url     = url     == null ? "" : url.strip();
        snippet = snippet == null ? "" : snippet.strip();
    }
}
