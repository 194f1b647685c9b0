package com.proposalpilot.orchestrator.artifact;

/**
 * Headline numbers shown next to the proposal.
 */
public record ProposalMetrics(int trendsIdentified, int useCasesGenerated, int datasetsFound, int repositoriesFound) {

    public int resourcesFound() {
        return datasetsFound + repositoriesFound;
    }
}
