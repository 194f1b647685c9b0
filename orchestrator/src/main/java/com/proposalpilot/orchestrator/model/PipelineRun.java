package com.proposalpilot.orchestrator.model;

import com.proposalpilot.orchestrator.artifact.Artifact;
import com.proposalpilot.orchestrator.artifact.ProposalDocument;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * One end-to-end execution of the pipeline for a single request.
 *
 * The run's driver thread is the only writer; HTTP threads and tests read
 * through {@link #snapshot()}. Every method is synchronised on the run, so
 * a snapshot never observes a half-applied transition.
 *
 * Once the status is terminal the run is frozen: further mutations are ignored.
 */
public class PipelineRun {

    private final UUID            id;
    private final PipelineRequest request;
    private final Instant         createdAt;

    private RunStatus  status = RunStatus.PENDING;
    private Instant    startedAt;
    private Instant    completedAt;
    private RunFailure failure;
    private String     failureReason;

    private final Map<AgentKind, AgentTask>   tasks     = new EnumMap<>(AgentKind.class);
    private final Map<ArtifactKind, Artifact> artifacts = new EnumMap<>(ArtifactKind.class);
    private ProposalDocument document;

    public PipelineRun(UUID id, PipelineRequest request, Map<AgentKind, Set<ArtifactKind>> dependencies, Instant now) {
        this.id        = id;
        this.request   = request;
        this.createdAt = now;
        for (AgentKind agent : AgentKind.values()) {
            tasks.put(agent, new AgentTask(agent, dependencies.getOrDefault(agent, Set.of())));
        }
    }

    public UUID            getId()        { return id; }
    public PipelineRequest getRequest()   { return request; }
    public Instant         getCreatedAt() { return createdAt; }

    public synchronized RunStatus getStatus()      { return status; }
    public synchronized Instant   getStartedAt()   { return startedAt; }
    public synchronized Instant   getCompletedAt() { return completedAt; }

    public synchronized TaskStatus taskStatus(AgentKind agent) {
        return tasks.get(agent).getStatus();
    }

    /** Agents whose task is still WAITING, in declaration order. */
    public synchronized List<AgentKind> waitingAgents() {
        List<AgentKind> out = new ArrayList<>();
        tasks.forEach((agent, task) -> {
            if (task.getStatus() == TaskStatus.WAITING) out.add(agent);
        });
        return out;
    }

    /** Copy of the artifacts produced so far. */
    public synchronized Map<ArtifactKind, Artifact> artifacts() {
        return artifacts.isEmpty() ? Map.of() : Map.copyOf(artifacts);
    }

    // ------------------------------------------------------------------
    // Transitions (driver thread only)
    // ------------------------------------------------------------------

    public synchronized void start(Instant now) {
        if (status != RunStatus.PENDING) return;
        status    = RunStatus.RUNNING;
        startedAt = now;
    }

    public synchronized void markReady(AgentKind agent, Set<ArtifactKind> degradedInputs) {
        if (status.isTerminal()) return;
        AgentTask task = tasks.get(agent);
        task.setStatus(TaskStatus.READY);
        task.setDegradedInputs(degradedInputs);
    }

    public synchronized void markRunning(AgentKind agent, Instant now) {
        if (status.isTerminal()) return;
        AgentTask task = tasks.get(agent);
        task.setStatus(TaskStatus.RUNNING);
        task.setStartedAt(now);
    }

    public synchronized void markSucceeded(AgentKind agent, Artifact artifact, int retries, String lastError, Instant now) {
        if (status.isTerminal()) return;
        AgentTask task = tasks.get(agent);
        task.setStatus(TaskStatus.SUCCEEDED);
        task.setRetries(retries);
        task.setLastError(lastError);
        task.setFinishedAt(now);
        artifacts.put(artifact.kind(), artifact);
    }

    public synchronized void markFailed(AgentKind agent, int retries, String error, Instant now) {
        if (status.isTerminal()) return;
        AgentTask task = tasks.get(agent);
        task.setStatus(TaskStatus.FAILED);
        task.setRetries(retries);
        task.setLastError(error);
        task.setFinishedAt(now);
    }

    public synchronized void markSkipped(AgentKind agent, String reason, Instant now) {
        if (status.isTerminal()) return;
        skip(tasks.get(agent), reason, now);
    }

    /**
     * COMPLETED or PARTIALLY_FAILED, depending on whether the document flags gaps.
     * Tasks still running (their output was given up on) are skipped.
     */
    public synchronized void complete(ProposalDocument document, Instant now) {
        if (status.isTerminal()) return;
        this.document    = document;
        this.status      = document.complete() ? RunStatus.COMPLETED : RunStatus.PARTIALLY_FAILED;
        this.completedAt = now;
        skipUnfinished("Proposal finalised without this output", now);
    }

    public synchronized void fail(RunFailure failure, String reason, Instant now) {
        if (status.isTerminal()) return;
        this.status        = RunStatus.FAILED;
        this.failure       = failure;
        this.failureReason = reason;
        this.completedAt   = now;
        skipUnfinished("Run failed: " + failure, now);
    }

    /** Cancel: discard artifacts, skip unfinished tasks. Returns false if already terminal. */
    public synchronized boolean cancel(String reason, Instant now) {
        if (status.isTerminal()) return false;
        this.status        = RunStatus.CANCELLED;
        this.failureReason = reason;
        this.completedAt   = now;
        artifacts.clear();
        skipUnfinished(reason, now);
        return true;
    }

    private void skipUnfinished(String reason, Instant now) {
        for (AgentTask task : tasks.values()) {
            if (!task.getStatus().isTerminal()) {
                skip(task, reason, now);
            }
        }
    }

    private static void skip(AgentTask task, String reason, Instant now) {
        task.setStatus(TaskStatus.SKIPPED);
        task.setLastError(reason);
        task.setFinishedAt(now);
    }

    public synchronized RunSnapshot snapshot() {
        List<TaskSnapshot> taskViews = tasks.values().stream().map(AgentTask::snapshot).toList();
        List<String> missing = document == null ? List.of() : document.missingSections();
        return new RunSnapshot(id, request, status, createdAt, startedAt, completedAt,
                taskViews, missing, failure, failureReason, document);
    }
}
