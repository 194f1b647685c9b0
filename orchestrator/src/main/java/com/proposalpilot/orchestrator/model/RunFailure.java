package com.proposalpilot.orchestrator.model;

/**
 * Why a run ended in {@link RunStatus#FAILED}.
 *
 * Missing upstream artifacts never cause one of these: the final proposal
 * tolerates them. Only defects of the final stage itself, or the run
 * overrunning its maximum duration, do (or, as a last resort, a bug in
 * the driver loop).
 */
public enum RunFailure {
    DEPENDENCY_TIMEOUT,     // a Required dependency of the final stage never became available
    ASSEMBLER_DEFECT,       // the final proposal agent itself failed
    RUN_DEADLINE_EXCEEDED,  // the run overran the configured maximum duration
    COORDINATOR_ERROR       // the run driver itself hit an unexpected error
}
