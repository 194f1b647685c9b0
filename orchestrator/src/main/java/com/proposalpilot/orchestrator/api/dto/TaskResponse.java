package com.proposalpilot.orchestrator.api.dto;

import com.proposalpilot.orchestrator.model.AgentKind;
import com.proposalpilot.orchestrator.model.ArtifactKind;
import com.proposalpilot.orchestrator.model.TaskSnapshot;
import com.proposalpilot.orchestrator.model.TaskStatus;

import java.time.Instant;
import java.util.List;

/**
 * Read-only view of one agent task returned by GET /runs/{id}/tasks.
 *
 * degradedInputs lists the upstream artifacts the agent ran without;
 * retries counts provider-call retries the agent spent.
 */
public record TaskResponse(
        AgentKind          agent,
        TaskStatus         status,
        List<ArtifactKind> dependencies,
        List<ArtifactKind> degradedInputs,
        int                retries,
        String             lastError,
        Instant            startedAt,
        Instant            finishedAt
) {
    public static TaskResponse from(TaskSnapshot t) {
        return new TaskResponse(
                t.agent(),
                t.status(),
                t.dependencies().stream().sorted().toList(),
                t.degradedInputs().stream().sorted().toList(),
                t.retries(),
                t.lastError(),
                t.startedAt(),
                t.finishedAt()
        );
    }
}
