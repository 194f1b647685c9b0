package com.proposalpilot.orchestrator.model;

/**
 * States of a PipelineRun.
 *
 * Transitions:
 *   PENDING → RUNNING → COMPLETED         (full document)
 *                     → PARTIALLY_FAILED  (document with flagged gaps)
 *                     → FAILED            (no document)
 *                     → CANCELLED         (cancelled by the caller)
 */
public enum RunStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    PARTIALLY_FAILED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this != PENDING && this != RUNNING;
    }

    /** True for the two states that come with a ProposalDocument. */
    public boolean hasDocument() {
        return this == COMPLETED || this == PARTIALLY_FAILED;
    }
}
