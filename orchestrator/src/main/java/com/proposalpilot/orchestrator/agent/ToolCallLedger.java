package com.proposalpilot.orchestrator.agent;

import com.proposalpilot.orchestrator.tool.ToolCall;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Task-local record of the final outcome of each tool call an agent made.
 * The coordinator reads it after the task finishes to fill in the task's
 * retry count and last error.
 */
public class ToolCallLedger {

    private final List<ToolCall> calls = new CopyOnWriteArrayList<>();

    public void record(ToolCall call) {
        calls.add(call);
    }

    public List<ToolCall> calls() {
        return List.copyOf(calls);
    }

    /** Attempts beyond the first, summed over all calls. */
    public int retries() {
        return calls.stream().mapToInt(c -> Math.max(0, c.attempt() - 1)).sum();
    }

    /** Description of the most recently recorded failed call, if any. */
    public Optional<String> lastFailure() {
        for (int i = calls.size() - 1; i >= 0; i--) {
            ToolCall c = calls.get(i);
            if (!c.succeeded()) {
                return Optional.of(c.providerId() + " " + c.describeFailure());
            }
        }
        return Optional.empty();
    }
}
