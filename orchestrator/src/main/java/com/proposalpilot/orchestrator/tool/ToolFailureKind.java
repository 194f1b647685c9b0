package com.proposalpilot.orchestrator.tool;

/**
 * Uniform failure taxonomy surfaced by the gateway, whatever the backend.
 *
 * Agents decide on retries from this kind alone.
 */
public enum ToolFailureKind {
    RATE_LIMITED(true),
    AUTH_ERROR(false),
    NOT_FOUND(false),
    MALFORMED_RESPONSE(false),
    TIMEOUT(true),
    TRANSPORT_ERROR(true);

    private final boolean retryable;

    ToolFailureKind(boolean retryable) {
        this.retryable = retryable;
    }

    /** AUTH_ERROR and MALFORMED_RESPONSE are configuration or logic errors; NOT_FOUND will not change on retry. */
    public boolean isRetryable() {
        return retryable;
    }
}
