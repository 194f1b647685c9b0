package com.proposalpilot.orchestrator.model;

/**
 * The four agents of the proposal pipeline.
 *
 * Each agent maps to one AgentTask per run and produces exactly one
 * kind of Artifact. Dependencies between agents are declared by the
 * StageGraph, not by the order of these constants.
 */
public enum AgentKind {
    RESEARCH(ArtifactKind.RESEARCH_PROFILE),             // Company and industry profile
    MARKET_STANDARDS(ArtifactKind.MARKET_TRENDS_REPORT), // AI/ML trends and use cases
    RESOURCE_ASSET(ArtifactKind.RESOURCE_BUNDLE),        // Datasets and code repositories
    FINAL_PROPOSAL(ArtifactKind.PROPOSAL_DOCUMENT);      // Merges everything into the proposal

    private final ArtifactKind produces;

    AgentKind(ArtifactKind produces) {
        this.produces = produces;
    }

    public ArtifactKind produces() {
        return produces;
    }

    /** The agent that produces the given artifact kind. */
    public static AgentKind producerOf(ArtifactKind kind) {
        for (AgentKind agent : values()) {
            if (agent.produces == kind) {
                return agent;
            }
        }
        throw new IllegalArgumentException("No agent produces " + kind);
    }
}
