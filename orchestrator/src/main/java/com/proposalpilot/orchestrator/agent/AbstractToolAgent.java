package com.proposalpilot.orchestrator.agent;

import com.proposalpilot.orchestrator.tool.SearchResult;
import com.proposalpilot.orchestrator.tool.ToolCall;
import com.proposalpilot.orchestrator.tool.ToolCallContext;
import com.proposalpilot.orchestrator.tool.ToolQuery;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.stream.Collectors;

/**
 * Base for agents that gather their artifact from provider calls.
 *
 * Subclasses describe their calls as a plan; {@link #execute} issues them
 * all concurrently, joins them, records them in the ledger and applies the
 * failure rule: the agent fails only when every required call failed.
 * Failed optional calls (and failed required calls when another required
 * call succeeded) come back as missing parts for the subclass to flag.
 */
public abstract class AbstractToolAgent implements Agent {

    protected final RetryingToolCaller caller;
    protected final int                maxResults;

    protected AbstractToolAgent(RetryingToolCaller caller, int maxResults) {
        this.caller     = caller;
        this.maxResults = maxResults;
    }

    /**
     * One call in an agent's plan.
     *
     * @param part     name of the artifact part the call fills
     * @param required whether the call counts towards the agent's failure rule
     */
    protected record PlannedCall(String part, String providerId, ToolQuery query, boolean required) {}

    /** Outcomes of a plan, keyed by part. */
    protected record CallResults(Map<String, ToolCall> calls) {

        public List<SearchResult> hits(String part) {
            ToolCall call = calls.get(part);
            return call == null || !call.succeeded() ? List.of() : call.payload();
        }

        public boolean failed(String part) {
            ToolCall call = calls.get(part);
            return call != null && !call.succeeded();
        }

        public List<String> failedParts() {
            return calls.entrySet().stream()
                    .filter(e -> !e.getValue().succeeded())
                    .map(Map.Entry::getKey)
                    .sorted()
                    .toList();
        }

        public int totalHits() {
            return calls.values().stream()
                    .filter(ToolCall::succeeded)
                    .mapToInt(c -> c.payload().size())
                    .sum();
        }
    }

    protected ToolQuery query(String text) {
        return ToolQuery.of(text, maxResults);
    }

    protected CallResults execute(List<PlannedCall> plan, AgentContext ctx) {
        ToolCallContext callCtx = new ToolCallContext(ctx.runId(), kind());
        Map<String, CompletableFuture<ToolCall>> pending = new LinkedHashMap<>();
        for (PlannedCall p : plan) {
            pending.put(p.part(), caller.call(p.providerId(), p.query(), callCtx));
        }

        try {
            CompletableFuture.allOf(pending.values().toArray(CompletableFuture[]::new)).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pending.values().forEach(f -> f.cancel(true));
            throw new CancellationException(kind() + " interrupted while waiting for provider calls");
        } catch (ExecutionException e) {
            Throwable cause = unwrap(e);
            if (cause instanceof CancellationException ce) {
                throw ce;
            }
            throw AgentFailureException.internal(kind(), cause);
        }

        Map<String, ToolCall> calls = new LinkedHashMap<>();
        pending.forEach((part, future) -> {
            ToolCall call = future.join();
            calls.put(part, call);
            ctx.ledger().record(call);
        });

        List<PlannedCall> required = plan.stream().filter(PlannedCall::required).toList();
        boolean allRequiredFailed = !required.isEmpty()
                && required.stream().allMatch(p -> !calls.get(p.part()).succeeded());
        if (allRequiredFailed) {
            String detail = required.stream()
                    .map(p -> p.part() + "=" + calls.get(p.part()).describeFailure())
                    .collect(Collectors.joining("; "));
            throw AgentFailureException.exhausted(kind(), detail);
        }
        return new CallResults(calls);
    }

    private static Throwable unwrap(Throwable t) {
        Throwable cause = t;
        while ((cause instanceof ExecutionException || cause instanceof CompletionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }
}
