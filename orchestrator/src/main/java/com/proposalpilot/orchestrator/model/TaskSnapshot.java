package com.proposalpilot.orchestrator.model;

import java.time.Instant;
import java.util.Set;

/** Immutable view of an {@link AgentTask} at one point in time. */
public record TaskSnapshot(
        AgentKind         agent,
        TaskStatus        status,
        Set<ArtifactKind> dependencies,
        Set<ArtifactKind> degradedInputs,
        int               retries,
        String            lastError,
        Instant           startedAt,
        Instant           finishedAt) {
}
