package com.proposalpilot.orchestrator.repository;

import com.proposalpilot.orchestrator.model.PipelineRun;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local run store. Runs do not survive a restart; terminal runs are
 * evicted by the RetentionSweeper.
 */
@Repository
public class InMemoryPipelineRunRepository implements PipelineRunRepository {

    private final Map<UUID, PipelineRun> store = new ConcurrentHashMap<>();

    @Override
    public PipelineRun save(PipelineRun run) {
        store.put(run.getId(), run);
        return run;
    }

    @Override
    public Optional<PipelineRun> findById(UUID id) {
        return Optional.ofNullable(store.get(id));
    }

    @Override
    public List<PipelineRun> findFinishedBefore(Instant cutoff) {
        return store.values().stream()
                .filter(run -> run.getStatus().isTerminal())
                .filter(run -> run.getCompletedAt() != null && run.getCompletedAt().isBefore(cutoff))
                .toList();
    }

    @Override
    public void deleteById(UUID id) {
        store.remove(id);
    }

    @Override
    public long count() {
        return store.size();
    }
}
