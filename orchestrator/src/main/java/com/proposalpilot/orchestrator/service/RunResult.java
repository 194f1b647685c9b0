package com.proposalpilot.orchestrator.service;

import com.proposalpilot.orchestrator.artifact.ProposalDocument;
import com.proposalpilot.orchestrator.model.RunFailure;
import com.proposalpilot.orchestrator.model.RunSnapshot;
import com.proposalpilot.orchestrator.model.RunStatus;

/**
 * What {@link PipelineCoordinator#result} reports for a known run.
 */
public sealed interface RunResult {

    /** The run finished with a document (COMPLETED or PARTIALLY_FAILED). */
    record Ready(ProposalDocument document, RunSnapshot run) implements RunResult {}

    /** Still PENDING or RUNNING. */
    record NotReady(RunStatus status) implements RunResult {}

    record Failed(RunFailure failure, String reason) implements RunResult {}

    record Cancelled(String reason) implements RunResult {}

    static RunResult of(RunSnapshot run) {
        return switch (run.status()) {
            case PENDING, RUNNING             -> new NotReady(run.status());
            case COMPLETED, PARTIALLY_FAILED  -> new Ready(run.document(), run);
            case FAILED                       -> new Failed(run.failure(), run.failureReason());
            case CANCELLED                    -> new Cancelled(run.failureReason());
        };
    }
}
