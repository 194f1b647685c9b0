package com.proposalpilot.orchestrator.tool;

import java.util.Set;

/**
 * Identity and query schema of a backend.
 *
 * @param providerId      unique id agents use to address the backend (e.g. "dataset_search")
 * @param description     one-line description, logged at registration
 * @param category        kind of external source
 * @param maxResultsLimit largest {@link ToolQuery#maxResults()} the backend accepts
 * @param requiredOptions option keys every query must carry
 */
public record BackendManifest(
        String          providerId,
        String          description,
        BackendCategory category,
        int             maxResultsLimit,
        Set<String>     requiredOptions) {

    public BackendManifest {
        requiredOptions = requiredOptions == null ? Set.of() : Set.copyOf(requiredOptions);
    }

    public BackendManifest(String providerId, String description, BackendCategory category, int maxResultsLimit) {
        this(providerId, description, category, maxResultsLimit, Set.of());
    }
}
