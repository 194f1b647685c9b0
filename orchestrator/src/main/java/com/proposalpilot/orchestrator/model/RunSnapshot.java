package com.proposalpilot.orchestrator.model;

import com.proposalpilot.orchestrator.artifact.ProposalDocument;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Immutable view of a {@link PipelineRun}, safe to hand to any thread.
 *
 * @param document      the proposal, present only when {@code status.hasDocument()}
 * @param failureReason human-readable reason, present for FAILED and CANCELLED runs
 */
public record RunSnapshot(
        UUID               id,
        PipelineRequest    request,
        RunStatus          status,
        Instant            createdAt,
        Instant            startedAt,
        Instant            completedAt,
        List<TaskSnapshot> tasks,
        List<String>       missingSections,
        RunFailure         failure,
        String             failureReason,
        ProposalDocument   document) {

    public RunSnapshot {
        tasks           = List.copyOf(tasks);
        missingSections = List.copyOf(missingSections);
    }

    public Optional<TaskSnapshot> task(AgentKind agent) {
        return tasks.stream().filter(t -> t.agent() == agent).findFirst();
    }

    /** Wall time from start to completion, once the run has finished. */
    public Optional<Duration> elapsed() {
        if (startedAt == null || completedAt == null) return Optional.empty();
        return Optional.of(Duration.between(startedAt, completedAt));
    }
}
