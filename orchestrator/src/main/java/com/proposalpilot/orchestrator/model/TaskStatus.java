package com.proposalpilot.orchestrator.model;

/**
 * Execution state of a single AgentTask.
 *
 * Transitions (all driven by the coordinator):
 *   WAITING → READY    (dependencies present or degradable)
 *   WAITING → SKIPPED  (a Required dependency is unavailable, or the run was cancelled)
 *   READY   → RUNNING  (handed to a worker)
 *   RUNNING → SUCCEEDED | FAILED
 */
public enum TaskStatus {
    WAITING,
    READY,
    RUNNING,
    SUCCEEDED,
    FAILED,
    SKIPPED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == SKIPPED;
    }
}
