package com.proposalpilot.orchestrator.artifact;

import com.proposalpilot.orchestrator.model.ArtifactKind;

import java.util.List;

/**
 * Datasets and code repositories gathered by the resource agent.
 *
 * @param queryTerms          the search terms actually sent to the providers
 * @param refinedFromResearch true when the terms were refined with the research
 *                            profile, false when only the raw industry keyword was used
 */
public record ResourceBundle(
        List<ResourceLink> datasets,
        List<ResourceLink> repositories,
        String             queryTerms,
        boolean            refinedFromResearch,
        List<String>       missingParts
) implements Artifact {

    public static final String DATASETS     = "datasets";
    public static final String REPOSITORIES = "repositories";

    public ResourceBundle {
        datasets     = List.copyOf(datasets);
        repositories = List.copyOf(repositories);
        missingParts = missingParts.stream().distinct().sorted().toList();
    }

    public int linkCount() {
        return datasets.size() + repositories.size();
    }

    @Override
    public ArtifactKind kind() {
        return ArtifactKind.RESOURCE_BUNDLE;
    }
}
