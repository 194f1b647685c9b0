package com.proposalpilot.orchestrator.agent;

import com.proposalpilot.orchestrator.artifact.Artifact;
import com.proposalpilot.orchestrator.model.ArtifactKind;
import com.proposalpilot.orchestrator.model.PipelineRequest;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Everything an agent sees of its run.
 *
 * Upstream dependencies the task proceeds without are absent from
 * {@code inputs}; the driver records them on the task as degraded inputs.
 *
 * @param inputs upstream artifacts that SUCCEEDED before this task was dispatched
 * @param ledger task-local record of the tool calls made
 */
public record AgentContext(
        UUID                        runId,
        PipelineRequest             request,
        Map<ArtifactKind, Artifact> inputs,
        ToolCallLedger              ledger) {

    public AgentContext {
        inputs = inputs.isEmpty() ? Map.of() : Map.copyOf(new EnumMap<>(inputs));
    }

    public <T extends Artifact> Optional<T> input(ArtifactKind kind, Class<T> type) {
        return Optional.ofNullable(inputs.get(kind)).map(type::cast);
    }
}
