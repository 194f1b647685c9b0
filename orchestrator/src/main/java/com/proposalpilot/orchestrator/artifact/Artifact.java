package com.proposalpilot.orchestrator.artifact;

import com.proposalpilot.orchestrator.model.ArtifactKind;

import java.util.List;

/**
 * Typed, immutable output of one successful agent execution.
 *
 * Implementations are records that copy their collections, so an
 * artifact can be handed to any number of downstream agents without locking.
 */
public interface Artifact {

    ArtifactKind kind();

    /**
     * Parts of this artifact that could not be gathered (sorted). Empty when
     * every lookup behind the artifact succeeded.
     */
    List<String> missingParts();

    default boolean isDegraded() {
        return !missingParts().isEmpty();
    }
}
