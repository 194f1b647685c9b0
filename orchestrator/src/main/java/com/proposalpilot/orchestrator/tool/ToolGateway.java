package com.proposalpilot.orchestrator.tool;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.proposalpilot.orchestrator.config.PipelineProperties;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Single entry point for every external provider call.
 *
 * All {@link ToolBackend} beans are collected at startup. The gateway:
 * <ol>
 *   <li>looks the backend up by provider id and validates the query against its manifest,</li>
 *   <li>runs the backend call on its own executor and enforces the configured deadline,
 *       producing a {@link ToolFailureKind#TIMEOUT} outcome instead of hanging,</li>
 *   <li>maps every failure to the uniform {@link ToolFailureKind} taxonomy,</li>
 *   <li>times and counts every call.</li>
 * </ol>
 * It never retries; retry policy belongs to the calling agent.
 *
 * <pre>
 *   proposal.tool.calls{provider, outcome="success|rate_limited|...|cancelled"}
 *   proposal.tool.duration{provider}
 * </pre>
 */
@Component
public class ToolGateway {

    private static final Logger log = LoggerFactory.getLogger(ToolGateway.class);

    private final Map<String, ToolBackend> backends = new ConcurrentHashMap<>();

    // In-flight calls per run, so a cancelled run can abort them.
    private final Map<UUID, Set<InFlightCall>> inFlight = new ConcurrentHashMap<>();
    private final Set<UUID> cancelledRuns = ConcurrentHashMap.newKeySet();

    private final ExecutorService          executor;
    private final ScheduledExecutorService scheduler;
    private final Duration                 callTimeout;
    private final MeterRegistry            meterRegistry;

    public ToolGateway(List<ToolBackend> allBackends,
                       @Qualifier("toolCallExecutor") ExecutorService executor,
                       @Qualifier("pipelineScheduler") ScheduledExecutorService scheduler,
                       PipelineProperties properties,
                       MeterRegistry meterRegistry) {
        this.executor      = executor;
        this.scheduler     = scheduler;
        this.callTimeout   = properties.toolCallTimeout();
        this.meterRegistry = meterRegistry;
        for (ToolBackend backend : allBackends) {
            BackendManifest m = backend.manifest();
            if (backends.putIfAbsent(m.providerId(), backend) != null) {
                throw new IllegalStateException("Duplicate provider id: " + m.providerId());
            }
            log.info("Registered provider '{}' [{}]: {}", m.providerId(), m.category(), m.description());
        }
    }

    // ------------------------------------------------------------------
    // Lookup
    // ------------------------------------------------------------------

    public ToolBackend backend(String providerId) {
        ToolBackend backend = backends.get(providerId);
        if (backend == null) {
            throw new UnknownProviderException(providerId);
        }
        return backend;
    }

    public boolean isRegistered(String providerId) {
        return backends.containsKey(providerId);
    }

    /** Returns all registered provider ids (sorted). */
    public List<String> providerIds() {
        return backends.keySet().stream().sorted().toList();
    }

    // ------------------------------------------------------------------
    // Invocation
    // ------------------------------------------------------------------

    /**
     * Blocking form of {@link #invokeAsync}. Returns within the configured
     * call timeout (plus scheduling slack).
     *
     * @throws UnknownProviderException if no backend has this id
     * @throws InvalidQueryException    if the query violates the backend's manifest
     * @throws CancellationException    if the run was cancelled while the call was in flight
     */
    public ToolCall invoke(String providerId, ToolQuery query, ToolCallContext ctx) {
        try {
            return invokeAsync(providerId, query, ctx).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof CancellationException ce) {
                throw ce;
            }
            throw e;
        }
    }

    /**
     * Dispatch one call. The returned future always completes normally with a
     * {@link ToolCall} (success or normalised failure), except when the run is
     * cancelled, in which case it completes exceptionally with a
     * {@link CompletionException} caused by a {@link CancellationException}.
     * Metrics are recorded before the returned future completes.
     */
    public CompletableFuture<ToolCall> invokeAsync(String providerId, ToolQuery query, ToolCallContext ctx) {
        ToolBackend backend = backend(providerId);
        validate(backend.manifest(), query);

        if (cancelledRuns.contains(ctx.runId())) {
            CompletableFuture<ToolCall> refused = new CompletableFuture<>();
            refused.completeExceptionally(new CompletionException(
                    new CancellationException("Run " + ctx.runId() + " was cancelled")));
            return refused;
        }

        CompletableFuture<ToolCall> result = new CompletableFuture<>();

        long startNanos = System.nanoTime();
        Timer.Sample sample = Timer.start(meterRegistry);
        InFlightCall call = new InFlightCall(result);
        register(ctx.runId(), call);

        Map<String, String> callerMdc = MDC.getCopyOfContextMap();
        Future<?> task = executor.submit(() -> {
            if (callerMdc != null) MDC.setContextMap(callerMdc);
            try {
                List<SearchResult> hits = backend.search(query);
                result.complete(ToolCall.success(providerId, query, 1, hits, elapsedSince(startNanos)));
            } catch (InterruptedException e) {
                // Deadline or cancellation already completed the future; keep the flag for the pool.
                Thread.currentThread().interrupt();
                result.complete(ToolCall.failure(providerId, query, 1,
                        ToolFailureKind.TRANSPORT_ERROR, "Interrupted", elapsedSince(startNanos)));
            } catch (Exception e) {
                result.complete(normalise(providerId, query, e, elapsedSince(startNanos)));
            } finally {
                MDC.clear();
            }
        });
        call.attach(task);

        ScheduledFuture<?> deadline = scheduler.schedule(() -> {
            if (result.complete(ToolCall.failure(providerId, query, 1, ToolFailureKind.TIMEOUT,
                    "No response within " + callTimeout.toMillis() + " ms", elapsedSince(startNanos)))) {
                task.cancel(true);
            }
        }, callTimeout.toMillis(), TimeUnit.MILLISECONDS);

        return result.whenComplete((outcome, error) -> {
            deadline.cancel(false);
            unregister(ctx.runId(), call);
            String status = outcome == null ? "cancelled"
                    : outcome.succeeded() ? "success" : outcome.failure().name().toLowerCase(Locale.ROOT);
            sample.stop(meterRegistry.timer("proposal.tool.duration", "provider", providerId));
            meterRegistry.counter("proposal.tool.calls", "provider", providerId, "outcome", status).increment();
            if (outcome != null && !outcome.succeeded()) {
                log.debug("Provider '{}' failed for run {} ({}): {}",
                        providerId, ctx.runId(), ctx.agent(), outcome.describeFailure());
            }
        });
    }

    // ------------------------------------------------------------------
    // Cancellation
    // ------------------------------------------------------------------

    /**
     * Abort every in-flight call of a run and refuse new ones.
     * Callers waiting on those calls see a {@link CancellationException}.
     */
    public void cancelRun(UUID runId) {
        cancelledRuns.add(runId);
        Set<InFlightCall> calls = inFlight.remove(runId);
        if (calls == null) return;
        log.info("Aborting {} in-flight provider call(s) for cancelled run {}", calls.size(), runId);
        for (InFlightCall call : calls) {
            call.abort(new CancellationException("Run " + runId + " was cancelled"));
        }
    }

    /** Forget a run's cancellation marker once the run itself has been evicted. */
    public void releaseRun(UUID runId) {
        cancelledRuns.remove(runId);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static void validate(BackendManifest manifest, ToolQuery query) {
        String id = manifest.providerId();
        if (query == null) {
            throw new InvalidQueryException(id, "query is null");
        }
        if (query.text() == null || query.text().isBlank()) {
            throw new InvalidQueryException(id, "text must not be blank");
        }
        if (query.maxResults() < 1 || query.maxResults() > manifest.maxResultsLimit()) {
            throw new InvalidQueryException(id, "maxResults must be between 1 and "
                    + manifest.maxResultsLimit() + " but was " + query.maxResults());
        }
        for (String option : manifest.requiredOptions()) {
            String value = query.options().get(option);
            if (value == null || value.isBlank()) {
                throw new InvalidQueryException(id, "missing required option '" + option + "'");
            }
        }
    }

    /** Map any backend exception to the uniform taxonomy. */
    static ToolCall normalise(String providerId, ToolQuery query, Exception e, Duration elapsed) {
        ToolFailureKind kind;
        if (e instanceof BackendHttpException http) {
            kind = switch (http.statusCode()) {
                case 429      -> ToolFailureKind.RATE_LIMITED;
                case 401, 403 -> ToolFailureKind.AUTH_ERROR;
                case 404      -> ToolFailureKind.NOT_FOUND;
                default       -> http.statusCode() >= 500
                        ? ToolFailureKind.TRANSPORT_ERROR
                        : ToolFailureKind.MALFORMED_RESPONSE;   // request rejected as malformed
            };
        } else if (e instanceof JsonProcessingException || e instanceof MalformedPayloadException) {
            kind = ToolFailureKind.MALFORMED_RESPONSE;
        } else if (e instanceof HttpTimeoutException) {
            kind = ToolFailureKind.TIMEOUT;
        } else if (e instanceof IOException) {
            kind = ToolFailureKind.TRANSPORT_ERROR;
        } else {
            log.warn("Unexpected error from provider '{}': {}", providerId, e.toString());
            kind = ToolFailureKind.TRANSPORT_ERROR;
        }
        String detail = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
        return ToolCall.failure(providerId, query, 1, kind, detail, elapsed);
    }

    private void register(UUID runId, InFlightCall call) {
        inFlight.compute(runId, (id, calls) -> {
            Set<InFlightCall> set = calls == null ? ConcurrentHashMap.newKeySet() : calls;
            set.add(call);
            return set;
        });
    }

    private void unregister(UUID runId, InFlightCall call) {
        inFlight.computeIfPresent(runId, (id, calls) -> {
            calls.remove(call);
            return calls.isEmpty() ? null : calls;
        });
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    /** A dispatched call: its caller-facing future and the backend task behind it. */
    private static final class InFlightCall {
        private final CompletableFuture<ToolCall> result;
        private volatile Future<?> task;

        InFlightCall(CompletableFuture<ToolCall> result) {
            this.result = result;
        }

        void attach(Future<?> task) {
            this.task = task;
            if (result.isCompletedExceptionally()) {
                task.cancel(true);   // aborted before the task handle was known
            }
        }

        void abort(CancellationException reason) {
            result.completeExceptionally(reason);
            Future<?> t = task;
            if (t != null) t.cancel(true);
        }
    }
}
