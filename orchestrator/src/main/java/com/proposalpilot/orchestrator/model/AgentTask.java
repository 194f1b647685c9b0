package com.proposalpilot.orchestrator.model;

import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;

/**
 * One agent's execution within a PipelineRun.
 *
 * Not thread-safe on its own: every mutation goes through the owning
 * {@link PipelineRun}, which holds the lock.
 */
public class AgentTask {

    private final AgentKind         agent;
    private final Set<ArtifactKind> dependencies;

    private TaskStatus status = TaskStatus.WAITING;

    // Tool-call retries spent, summed over all of the agent's calls.
    private int retries;

    private String  lastError;
    private Instant startedAt;
    private Instant finishedAt;

    // Dependencies the task was dispatched without.
    private Set<ArtifactKind> degradedInputs = EnumSet.noneOf(ArtifactKind.class);

    AgentTask(AgentKind agent, Set<ArtifactKind> dependencies) {
        this.agent        = agent;
        this.dependencies = dependencies.isEmpty() ? Set.of() : Set.copyOf(dependencies);
    }

    public AgentKind         getAgent()          { return agent; }
    public Set<ArtifactKind> getDependencies()   { return dependencies; }
    public TaskStatus        getStatus()         { return status; }
    public int               getRetries()        { return retries; }
    public String            getLastError()      { return lastError; }
    public Instant           getStartedAt()      { return startedAt; }
    public Instant           getFinishedAt()     { return finishedAt; }
    public Set<ArtifactKind> getDegradedInputs() { return Set.copyOf(degradedInputs); }

    void setStatus(TaskStatus status)          { this.status = status; }
    void setRetries(int retries)               { this.retries = retries; }
    void setLastError(String lastError)        { this.lastError = lastError; }
    void setStartedAt(Instant t)               { this.startedAt = t; }
    void setFinishedAt(Instant t)              { this.finishedAt = t; }
    void setDegradedInputs(Set<ArtifactKind> d) {
        this.degradedInputs = d.isEmpty() ? EnumSet.noneOf(ArtifactKind.class) : EnumSet.copyOf(d);
    }

    TaskSnapshot snapshot() {
        return new TaskSnapshot(agent, status, dependencies, getDegradedInputs(),
                retries, lastError, startedAt, finishedAt);
    }
}
