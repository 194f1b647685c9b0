package com.proposalpilot.orchestrator.service;

import com.proposalpilot.orchestrator.agent.AgentContext;
import com.proposalpilot.orchestrator.agent.AgentFailureException;
import com.proposalpilot.orchestrator.agent.AgentRegistry;
import com.proposalpilot.orchestrator.agent.ToolCallLedger;
import com.proposalpilot.orchestrator.artifact.Artifact;
import com.proposalpilot.orchestrator.artifact.ProposalDocument;
import com.proposalpilot.orchestrator.config.PipelineProperties;
import com.proposalpilot.orchestrator.graph.StageGraph;
import com.proposalpilot.orchestrator.graph.StageGraph.Evaluation;
import com.proposalpilot.orchestrator.model.AgentKind;
import com.proposalpilot.orchestrator.model.ArtifactKind;
import com.proposalpilot.orchestrator.model.PipelineRun;
import com.proposalpilot.orchestrator.model.RunFailure;
import com.proposalpilot.orchestrator.model.RunStatus;
import com.proposalpilot.orchestrator.model.TaskStatus;
import com.proposalpilot.orchestrator.tool.ToolGateway;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Drives one run from PENDING to a terminal status.
 *
 * Loop: evaluate readiness, skip what can never run, hand ready tasks to the
 * shared worker pool, then block on the completion queue until a task
 * finishes or the next wait budget (or the run deadline) expires.
 *
 * Workers never touch the run: they only post a {@link Completion}. The
 * driver thread is the single writer of tasks and artifacts. Cancellation is
 * the one exception; it goes straight to the run (which is synchronised) and
 * then wakes the driver.
 */
final class RunDriver implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(RunDriver.class);

    /** A finished agent task, posted by a worker. {@code agent == null} is a wake-up. */
    private record Completion(AgentKind agent, Artifact artifact, Throwable error, ToolCallLedger ledger) {
        static final Completion WAKE_UP = new Completion(null, null, null, null);
    }

    private final PipelineRun        run;
    private final StageGraph         graph;
    private final AgentRegistry      agents;
    private final ToolGateway        gateway;
    private final ExecutorService    workers;
    private final PipelineProperties props;
    private final MeterRegistry      meterRegistry;
    private final Clock              clock;
    private final Runnable           onFinished;

    // Run deadline and wait budgets count from submission, queueing for a driver thread included.
    private final long submittedNanos;

    private final BlockingQueue<Completion> completions = new LinkedBlockingQueue<>();
    private final Map<AgentKind, Future<?>> running     = new ConcurrentHashMap<>();
    private volatile boolean cancelRequested;

    RunDriver(PipelineRun run, StageGraph graph, AgentRegistry agents, ToolGateway gateway,
              ExecutorService workers, PipelineProperties props, MeterRegistry meterRegistry,
              Clock clock, Runnable onFinished) {
        this.run           = run;
        this.graph         = graph;
        this.agents        = agents;
        this.gateway       = gateway;
        this.workers       = workers;
        this.props         = props;
        this.meterRegistry = meterRegistry;
        this.clock         = clock;
        this.onFinished    = onFinished;
        this.submittedNanos = System.nanoTime();
    }

    @Override
    public void run() {
        MDC.put("runId", run.getId().toString());
        try {
            if (run.getStatus().isTerminal()) {
                log.info("Run {} was {} before it started", run.getId(), run.getStatus());
                return;
            }
            run.start(clock.instant());
            log.info("Run {} started for '{}' / '{}' after {} ms in the queue",
                    run.getId(), run.getRequest().companyName(), run.getRequest().industry(),
                    Duration.ofNanos(System.nanoTime() - submittedNanos).toMillis());
            drive();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            run.cancel("Run driver interrupted", clock.instant());
        } catch (RuntimeException e) {
            log.error("Run {} driver failed unexpectedly", run.getId(), e);
            run.fail(RunFailure.COORDINATOR_ERROR, e.toString(), clock.instant());
        } finally {
            abandonRunningTasks();
            RunStatus status = run.getStatus();
            meterRegistry.counter("proposal.runs", "status", status.name().toLowerCase(Locale.ROOT)).increment();
            log.info("Run {} finished with status {}", run.getId(), status);
            MDC.clear();
            onFinished.run();
        }
    }

    /** Request cancellation from any thread. Returns false if the run was already terminal. */
    boolean cancel() {
        cancelRequested = true;
        boolean cancelled = run.cancel("Cancelled by request", clock.instant());
        if (cancelled) {
            log.info("Run {} cancelled, aborting {} running task(s)", run.getId(), running.size());
            gateway.cancelRun(run.getId());
            running.values().forEach(f -> f.cancel(true));
        }
        completions.offer(Completion.WAKE_UP);
        return cancelled;
    }

    private void drive() throws InterruptedException {
        Duration maxDuration = props.maxRunDuration();
        while (!run.getStatus().isTerminal() && !cancelRequested) {
            Duration elapsed = Duration.ofNanos(System.nanoTime() - submittedNanos);
            Duration left = maxDuration.minus(elapsed);
            if (left.isNegative() || left.isZero()) {
                log.error("Run {} exceeded its maximum duration of {} ms", run.getId(), maxDuration.toMillis());
                run.fail(RunFailure.RUN_DEADLINE_EXCEEDED,
                        "Run did not finish within " + maxDuration.toMillis() + " ms", clock.instant());
                return;
            }

            Evaluation evaluation = graph.evaluate(run.waitingAgents(),
                    StageGraph.artifactStates(taskStates()), elapsed, props);

            for (Map.Entry<AgentKind, String> skip : evaluation.skipped().entrySet()) {
                log.warn("Skipping {}: {}", skip.getKey(), skip.getValue());
                run.markSkipped(skip.getKey(), skip.getValue(), clock.instant());
                if (skip.getKey() == AgentKind.FINAL_PROPOSAL) {
                    run.fail(RunFailure.DEPENDENCY_TIMEOUT, skip.getValue(), clock.instant());
                    return;
                }
            }
            evaluation.ready().forEach(this::dispatch);
            if (evaluation.hasChanges()) {
                continue;   // a skip or dispatch may change what is ready
            }

            Duration wait = evaluation.nextDeadline()
                    .filter(d -> d.compareTo(left) < 0)
                    .orElse(left);
            Completion completion = completions.poll(Math.max(1, wait.toMillis()), TimeUnit.MILLISECONDS);
            while (completion != null) {
                record(completion);
                completion = completions.poll();
            }
        }
    }

    private void dispatch(AgentKind agent, Set<ArtifactKind> degraded) {
        run.markReady(agent, degraded);

        Map<ArtifactKind, Artifact> available = run.artifacts();
        Map<ArtifactKind, Artifact> inputs = new EnumMap<>(ArtifactKind.class);
        for (ArtifactKind dep : graph.dependenciesOf(agent).keySet()) {
            Artifact artifact = available.get(dep);
            if (artifact != null) inputs.put(dep, artifact);
        }
        ToolCallLedger ledger = new ToolCallLedger();
        AgentContext ctx = new AgentContext(run.getId(), run.getRequest(), inputs, ledger);

        if (degraded.isEmpty()) {
            log.info("Dispatching {}", agent);
        } else {
            log.warn("Dispatching {} degraded, without {}", agent, degraded);
        }
        run.markRunning(agent, clock.instant());

        String runId = run.getId().toString();
        Future<?> future = workers.submit(() -> {
            MDC.put("runId", runId);
            MDC.put("agent", agent.name());
            try {
                Artifact artifact = agents.get(agent).run(ctx);
                completions.offer(new Completion(agent, artifact, null, ledger));
            } catch (Throwable e) {
                completions.offer(new Completion(agent, null, e, ledger));
            } finally {
                MDC.clear();
            }
        });
        running.put(agent, future);
    }

    private void record(Completion completion) {
        AgentKind agent = completion.agent();
        if (agent == null) return;   // wake-up
        running.remove(agent);

        ToolCallLedger ledger = completion.ledger();
        int retries = ledger.retries();
        String lastError = ledger.lastFailure().orElse(null);

        if (completion.error() == null) {
            run.markSucceeded(agent, completion.artifact(), retries, lastError, clock.instant());
            if (completion.artifact().isDegraded()) {
                log.warn("{} succeeded with gaps {}", agent, completion.artifact().missingParts());
            } else {
                log.info("{} succeeded", agent);
            }
            if (agent == AgentKind.FINAL_PROPOSAL) {
                ProposalDocument document = (ProposalDocument) completion.artifact();
                run.complete(document, clock.instant());
            }
            return;
        }

        Throwable error = completion.error();
        if (error instanceof CancellationException && cancelRequested) {
            return;
        }
        String message = error.getMessage() == null ? error.toString() : error.getMessage();
        if (error instanceof AgentFailureException) {
            log.warn("{} failed: {}", agent, message);
        } else {
            log.warn("{} failed unexpectedly", agent, error);
        }
        run.markFailed(agent, retries, message, clock.instant());
        if (agent == AgentKind.FINAL_PROPOSAL) {
            log.error("Final proposal could not be assembled: {}", message);
            run.fail(RunFailure.ASSEMBLER_DEFECT, message, clock.instant());
        }
    }

    private Map<AgentKind, TaskStatus> taskStates() {
        Map<AgentKind, TaskStatus> states = new EnumMap<>(AgentKind.class);
        for (AgentKind agent : AgentKind.values()) {
            states.put(agent, run.taskStatus(agent));
        }
        return states;
    }

    /** Tasks whose output is no longer wanted: abort their provider calls and interrupt them. */
    private void abandonRunningTasks() {
        if (running.isEmpty()) return;
        log.info("Abandoning {} task(s) still running: {}", running.size(), running.keySet());
        gateway.cancelRun(run.getId());
        running.values().forEach(f -> f.cancel(true));
        running.clear();
    }
}
