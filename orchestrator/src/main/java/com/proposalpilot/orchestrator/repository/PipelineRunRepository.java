package com.proposalpilot.orchestrator.repository;

import com.proposalpilot.orchestrator.model.PipelineRun;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Storage of pipeline runs, keyed by run id.
 */
public interface PipelineRunRepository {

    PipelineRun save(PipelineRun run);

    Optional<PipelineRun> findById(UUID id);

    /** Terminal runs that completed strictly before the cutoff. */
    List<PipelineRun> findFinishedBefore(Instant cutoff);

    void deleteById(UUID id);

    long count();
}
