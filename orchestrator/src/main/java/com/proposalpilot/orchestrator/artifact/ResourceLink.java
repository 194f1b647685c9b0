package com.proposalpilot.orchestrator.artifact;

import com.proposalpilot.orchestrator.tool.SearchResult;

/**
 * A dataset or code repository the proposal links to.
 */
public record ResourceLink(String title, String url, String description, String provider, ResourceType type) {

    public static ResourceLink from(SearchResult hit, ResourceType type) {
        return new ResourceLink(hit.title(), hit.url(), hit.snippet(), hit.provider(), type);
    }
}
