package com.proposalpilot.orchestrator.agent;

import com.proposalpilot.orchestrator.config.PipelineProperties;
import com.proposalpilot.orchestrator.tool.ToolCall;
import com.proposalpilot.orchestrator.tool.ToolCallContext;
import com.proposalpilot.orchestrator.tool.ToolGateway;
import com.proposalpilot.orchestrator.tool.ToolQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Per-call retry policy shared by the agents.
 *
 * RATE_LIMITED, TIMEOUT and TRANSPORT_ERROR are retried up to
 * {@code max-attempts} times with linear backoff; any other failure is
 * returned straight away. Backoff waits on the scheduler, never on a worker
 * thread, so a waiting retry holds no thread.
 */
@Component
public class RetryingToolCaller {

    private static final Logger log = LoggerFactory.getLogger(RetryingToolCaller.class);

    private final ToolGateway              gateway;
    private final ScheduledExecutorService scheduler;
    private final int                      maxAttempts;
    private final Duration                 backoff;

    public RetryingToolCaller(ToolGateway gateway,
                              @Qualifier("pipelineScheduler") ScheduledExecutorService scheduler,
                              PipelineProperties properties) {
        this.gateway     = gateway;
        this.scheduler   = scheduler;
        this.maxAttempts = properties.maxAttempts();
        this.backoff     = properties.retryBackoff();
    }

    /** Whether the provider is registered at all (optional providers may not be). */
    public boolean isAvailable(String providerId) {
        return gateway.isRegistered(providerId);
    }

    /**
     * Call the provider, retrying retryable failures. The future completes
     * with the last attempt's outcome, stamped with its attempt number.
     */
    public CompletableFuture<ToolCall> call(String providerId, ToolQuery query, ToolCallContext ctx) {
        return attempt(providerId, query, ctx, 1);
    }

    private CompletableFuture<ToolCall> attempt(String providerId, ToolQuery query, ToolCallContext ctx, int n) {
        return gateway.invokeAsync(providerId, query, ctx).thenCompose(raw -> {
            ToolCall call = raw.withAttempt(n);
            if (call.succeeded()) {
                return CompletableFuture.completedFuture(call);
            }
            if (!call.failure().isRetryable() || n >= maxAttempts) {
                log.warn("Provider '{}' gave up for run {} after {} attempt(s): {}",
                        providerId, ctx.runId(), n, call.describeFailure());
                return CompletableFuture.completedFuture(call);
            }
            Duration delay = backoff.multipliedBy(n);
            log.warn("Provider '{}' failed (attempt {}/{}), retrying in {} ms: {}",
                    providerId, n, maxAttempts, delay.toMillis(), call.describeFailure());
            Executor later = CompletableFuture.delayedExecutor(delay.toMillis(), TimeUnit.MILLISECONDS, scheduler);
            return CompletableFuture.supplyAsync(() -> n + 1, later)
                    .thenCompose(next -> attempt(providerId, query, ctx, next));
        });
    }
}
