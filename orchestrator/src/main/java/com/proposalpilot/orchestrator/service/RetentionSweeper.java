package com.proposalpilot.orchestrator.service;

import com.proposalpilot.orchestrator.config.PipelineProperties;
import com.proposalpilot.orchestrator.model.PipelineRun;
import com.proposalpilot.orchestrator.repository.PipelineRunRepository;
import com.proposalpilot.orchestrator.tool.ToolGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Evicts terminal runs once they are older than the retention period.
 *
 * fixed delay: the next sweep starts a full interval after the previous one
 * finishes, so slow sweeps never pile up.
 */
@Component
public class RetentionSweeper {

    private static final Logger log = LoggerFactory.getLogger(RetentionSweeper.class);

    private final PipelineRunRepository runRepo;
    private final ToolGateway           gateway;
    private final PipelineProperties    props;
    private final Clock                 clock;

    public RetentionSweeper(PipelineRunRepository runRepo, ToolGateway gateway,
                            PipelineProperties props, Clock clock) {
        this.runRepo = runRepo;
        this.gateway = gateway;
        this.props   = props;
        this.clock   = clock;
    }

    @Scheduled(fixedDelayString = "${proposal.pipeline.retention-sweep-interval-ms:60000}")
    public void sweep() {
        Instant cutoff = clock.instant().minus(props.retention());
        List<PipelineRun> expired = runRepo.findFinishedBefore(cutoff);
        for (PipelineRun run : expired) {
            runRepo.deleteById(run.getId());
            gateway.releaseRun(run.getId());
        }
        if (!expired.isEmpty()) {
            log.info("Evicted {} run(s) finished before {}", expired.size(), cutoff);
        }
    }
}
