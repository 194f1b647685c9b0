package com.proposalpilot.orchestrator.api.dto;

import com.proposalpilot.orchestrator.model.RunFailure;
import com.proposalpilot.orchestrator.model.RunSnapshot;
import com.proposalpilot.orchestrator.model.RunStatus;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Response body for POST /runs, GET /runs/{id} and DELETE /runs/{id}.
 * Contains enough information for the caller to poll run progress.
 */
public record RunResponse(
        UUID         id,
        String       companyName,
        String       industry,
        RunStatus    status,
        Instant      createdAt,
        Instant      startedAt,
        Instant      completedAt,
        List<String> missingSections,
        RunFailure   failure,
        String       failureReason
) {
    public static RunResponse from(RunSnapshot run) {
        return new RunResponse(
                run.id(),
                run.request().companyName(),
                run.request().industry(),
                run.status(),
                run.createdAt(),
                run.startedAt(),
                run.completedAt(),
                run.missingSections(),
                run.failure(),
                run.failureReason()
        );
    }
}
