package com.proposalpilot.orchestrator.service;

import com.proposalpilot.orchestrator.agent.AgentRegistry;
import com.proposalpilot.orchestrator.config.PipelineProperties;
import com.proposalpilot.orchestrator.graph.StageGraph;
import com.proposalpilot.orchestrator.model.PipelineRequest;
import com.proposalpilot.orchestrator.model.PipelineRun;
import com.proposalpilot.orchestrator.model.RunSnapshot;
import com.proposalpilot.orchestrator.repository.PipelineRunRepository;
import com.proposalpilot.orchestrator.tool.ToolGateway;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;

/**
 * Entry point for pipeline runs: submission, status, results, cancellation.
 *
 * Each submitted run gets its own {@link RunDriver} on the {@code runDrivers}
 * pool; when more runs are active than that pool has threads, new runs wait
 * in PENDING. All agent tasks share the {@code agentWorkers} pool.
 */
@Service
public class PipelineCoordinator {

    private static final Logger log = LoggerFactory.getLogger(PipelineCoordinator.class);

    private final PipelineRunRepository runRepo;
    private final StageGraph            graph;
    private final AgentRegistry         agents;
    private final ToolGateway           gateway;
    private final ExecutorService       drivers;
    private final ExecutorService       workers;
    private final PipelineProperties    props;
    private final MeterRegistry         meterRegistry;
    private final Clock                 clock;

    // Drivers of runs that have not finished yet, for cancellation.
    private final Map<UUID, RunDriver> active = new ConcurrentHashMap<>();

    public PipelineCoordinator(PipelineRunRepository runRepo,
                               StageGraph graph,
                               AgentRegistry agents,
                               ToolGateway gateway,
                               @Qualifier("runDrivers") ExecutorService drivers,
                               @Qualifier("agentWorkers") ExecutorService workers,
                               PipelineProperties props,
                               MeterRegistry meterRegistry,
                               Clock clock) {
        this.runRepo       = runRepo;
        this.graph         = graph;
        this.agents        = agents;
        this.gateway       = gateway;
        this.drivers       = drivers;
        this.workers       = workers;
        this.props         = props;
        this.meterRegistry = meterRegistry;
        this.clock         = clock;
    }

    // ------------------------------------------------------------------
    // Submission
    // ------------------------------------------------------------------

    /**
     * Create a run and start driving it. Returns immediately with the run in PENDING.
     *
     * @throws IllegalArgumentException if the company name or industry is blank
     */
    public RunSnapshot submit(String companyName, String industry) {
        PipelineRequest request = new PipelineRequest(companyName, industry);
        PipelineRun run = runRepo.save(new PipelineRun(UUID.randomUUID(), request,
                graph.dependencySets(), clock.instant()));
        UUID id = run.getId();

        RunDriver driver = new RunDriver(run, graph, agents, gateway, workers, props,
                meterRegistry, clock, () -> active.remove(id));
        active.put(id, driver);
        RunSnapshot snapshot = run.snapshot();
        drivers.execute(driver);
        log.info("Submitted run {} for '{}' / '{}'", id, request.companyName(), request.industry());
        return snapshot;
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    public Optional<RunSnapshot> status(UUID runId) {
        return runRepo.findById(runId).map(PipelineRun::snapshot);
    }

    /** The run's outcome, or empty when the run is unknown (or already evicted). */
    public Optional<RunResult> result(UUID runId) {
        return status(runId).map(RunResult::of);
    }

    // ------------------------------------------------------------------
    // Cancellation
    // ------------------------------------------------------------------

    /**
     * Cancel a run: abort its provider calls, stop dispatching, discard its
     * artifacts. A run that is already terminal is left as it is.
     *
     * @return the run after the request, or empty if the run is unknown
     */
    public Optional<RunSnapshot> cancel(UUID runId) {
        Optional<PipelineRun> run = runRepo.findById(runId);
        run.ifPresent(r -> {
            RunDriver driver = active.get(runId);
            if (driver != null) {
                driver.cancel();
            }
        });
        return run.map(PipelineRun::snapshot);
    }
}
