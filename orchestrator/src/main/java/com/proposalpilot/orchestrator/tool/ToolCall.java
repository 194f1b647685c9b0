package com.proposalpilot.orchestrator.tool;

import java.time.Duration;
import java.util.List;

/**
 * One invocation of an external provider and its outcome.
 *
 * Either {@code payload} is set (success) or {@code failure} is set;
 * never both. Timeouts are reported as {@link ToolFailureKind#TIMEOUT}.
 * Not persisted: agents fold the outcome into their own result.
 */
public record ToolCall(
        String          providerId,
        ToolQuery       query,
        int             attempt,
        List<SearchResult> payload,
        ToolFailureKind failure,
        String          detail,
        Duration        elapsed
) {
    public ToolCall {
        payload = payload == null ? null : List.copyOf(payload);
    }

    public static ToolCall success(String providerId, ToolQuery query, int attempt,
                                   List<SearchResult> payload, Duration elapsed) {
        return new ToolCall(providerId, query, attempt, payload, null, null, elapsed);
    }

    public static ToolCall failure(String providerId, ToolQuery query, int attempt,
                                   ToolFailureKind kind, String detail, Duration elapsed) {
        return new ToolCall(providerId, query, attempt, null, kind, detail, elapsed);
    }

    public boolean succeeded() {
        return failure == null;
    }

    /** Same call, stamped with the attempt number the caller assigned. */
    public ToolCall withAttempt(int attemptNumber) {
        return new ToolCall(providerId, query, attemptNumber, payload, failure, detail, elapsed);
    }

    /** Short human-readable description of the failure, e.g. "[RATE_LIMITED] HTTP 429". */
    public String describeFailure() {
        return succeeded() ? "" : "[" + failure + "] " + detail;
    }
}
