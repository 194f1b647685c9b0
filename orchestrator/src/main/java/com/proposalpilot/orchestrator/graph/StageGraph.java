package com.proposalpilot.orchestrator.graph;

import com.proposalpilot.orchestrator.config.PipelineProperties;
import com.proposalpilot.orchestrator.model.AgentKind;
import com.proposalpilot.orchestrator.model.ArtifactKind;
import com.proposalpilot.orchestrator.model.TaskStatus;

import java.time.Duration;
import java.util.Collection;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Declares which artifacts each agent consumes and decides when a waiting
 * agent may run.
 *
 * {@link #evaluate} is a pure function of the run's current state and the
 * elapsed time; the coordinator calls it on every loop iteration and acts on
 * the result. A dependency becomes unavailable when its producer FAILED or was
 * SKIPPED, or when its wait budget (measured from run start) ran out while it
 * was still pending. An agent with an unavailable Required dependency is
 * skipped; with only Optional ones it runs degraded.
 */
public final class StageGraph {

    public enum DependencyMode { REQUIRED, OPTIONAL }

    public enum ArtifactState { PENDING, AVAILABLE, UNAVAILABLE }

    /**
     * Outcome of one evaluation.
     *
     * @param ready        agents to dispatch now, each with the inputs it will run without
     * @param skipped      agents that can never run, with the reason
     * @param nextDeadline time until the earliest wait budget still running expires
     */
    public record Evaluation(
            Map<AgentKind, Set<ArtifactKind>> ready,
            Map<AgentKind, String>            skipped,
            Optional<Duration>                nextDeadline) {

        public boolean hasChanges() {
            return !ready.isEmpty() || !skipped.isEmpty();
        }
    }

    private final Map<AgentKind, Map<ArtifactKind, DependencyMode>> stages;

    public StageGraph(Map<AgentKind, Map<ArtifactKind, DependencyMode>> stages) {
        Map<AgentKind, Map<ArtifactKind, DependencyMode>> copy = new EnumMap<>(AgentKind.class);
        for (AgentKind agent : AgentKind.values()) {
            Map<ArtifactKind, DependencyMode> deps = stages.getOrDefault(agent, Map.of());
            if (deps.containsKey(agent.produces())) {
                throw new IllegalArgumentException(agent + " cannot depend on its own artifact");
            }
            copy.put(agent, deps.isEmpty() ? Map.of() : Map.copyOf(new EnumMap<>(deps)));
        }
        this.stages = copy;
        checkAcyclic();
    }

    /**
     * Research and market analysis start immediately; resource search would
     * like the research profile; the final proposal takes whatever arrived.
     */
    public static StageGraph defaultGraph() {
        Map<AgentKind, Map<ArtifactKind, DependencyMode>> stages = new EnumMap<>(AgentKind.class);
        stages.put(AgentKind.RESEARCH,         Map.of());
        stages.put(AgentKind.MARKET_STANDARDS, Map.of());
        stages.put(AgentKind.RESOURCE_ASSET,   Map.of(ArtifactKind.RESEARCH_PROFILE, DependencyMode.OPTIONAL));
        stages.put(AgentKind.FINAL_PROPOSAL,   Map.of(
                ArtifactKind.RESEARCH_PROFILE,     DependencyMode.OPTIONAL,
                ArtifactKind.MARKET_TRENDS_REPORT, DependencyMode.OPTIONAL,
                ArtifactKind.RESOURCE_BUNDLE,      DependencyMode.OPTIONAL));
        return new StageGraph(stages);
    }

    public Map<ArtifactKind, DependencyMode> dependenciesOf(AgentKind agent) {
        return stages.get(agent);
    }

    /** Dependency sets per agent, as recorded on each AgentTask. */
    public Map<AgentKind, Set<ArtifactKind>> dependencySets() {
        Map<AgentKind, Set<ArtifactKind>> out = new EnumMap<>(AgentKind.class);
        stages.forEach((agent, deps) -> out.put(agent, deps.keySet()));
        return out;
    }

    /** Derive artifact availability from the producers' task states. */
    public static Map<ArtifactKind, ArtifactState> artifactStates(Map<AgentKind, TaskStatus> taskStates) {
        Map<ArtifactKind, ArtifactState> out = new EnumMap<>(ArtifactKind.class);
        taskStates.forEach((agent, status) -> out.put(agent.produces(), switch (status) {
            case SUCCEEDED       -> ArtifactState.AVAILABLE;
            case FAILED, SKIPPED -> ArtifactState.UNAVAILABLE;
            default              -> ArtifactState.PENDING;
        }));
        return out;
    }

    /**
     * Decide what to do with each waiting agent.
     *
     * @param waiting  agents whose task is still WAITING
     * @param states   current availability of every artifact kind
     * @param elapsed  time since the run started
     */
    public Evaluation evaluate(Collection<AgentKind> waiting,
                               Map<ArtifactKind, ArtifactState> states,
                               Duration elapsed,
                               PipelineProperties props) {
        Map<AgentKind, Set<ArtifactKind>> ready   = new LinkedHashMap<>();
        Map<AgentKind, String>            skipped = new LinkedHashMap<>();
        Duration next = null;

        for (AgentKind agent : waiting) {
            Set<ArtifactKind> degraded = EnumSet.noneOf(ArtifactKind.class);
            String skipReason = null;
            boolean mustWait  = false;

            for (Map.Entry<ArtifactKind, DependencyMode> dep : stages.get(agent).entrySet()) {
                ArtifactKind kind = dep.getKey();
                ArtifactState state = states.getOrDefault(kind, ArtifactState.PENDING);
                if (state == ArtifactState.AVAILABLE) continue;

                boolean unavailable = state == ArtifactState.UNAVAILABLE;
                String why = kind + " unavailable (producer failed or skipped)";
                if (!unavailable) {
                    Duration budget = props.dependencyTimeoutFor(kind);
                    Duration left = budget.minus(elapsed);
                    if (left.isNegative() || left.isZero()) {
                        unavailable = true;
                        why = kind + " not produced within " + budget.toMillis() + " ms";
                    } else {
                        mustWait = true;
                        if (next == null || left.compareTo(next) < 0) next = left;
                    }
                }
                if (unavailable) {
                    if (dep.getValue() == DependencyMode.REQUIRED) {
                        skipReason = "Required input " + why;
                    } else {
                        degraded.add(kind);
                    }
                }
            }

            if (skipReason != null) {
                skipped.put(agent, skipReason);
            } else if (!mustWait) {
                ready.put(agent, degraded.isEmpty() ? Set.of() : Set.copyOf(degraded));
            }
        }
        return new Evaluation(ready, skipped, Optional.ofNullable(next));
    }

    private void checkAcyclic() {
        Set<AgentKind> done = EnumSet.noneOf(AgentKind.class);
        for (AgentKind agent : AgentKind.values()) {
            visit(agent, EnumSet.noneOf(AgentKind.class), done);
        }
    }

    private void visit(AgentKind agent, Set<AgentKind> path, Set<AgentKind> done) {
        if (done.contains(agent)) return;
        if (!path.add(agent)) {
            throw new IllegalArgumentException("Dependency cycle through " + agent);
        }
        for (ArtifactKind dep : stages.get(agent).keySet()) {
            visit(AgentKind.producerOf(dep), path, done);
        }
        path.remove(agent);
        done.add(agent);
    }
}
