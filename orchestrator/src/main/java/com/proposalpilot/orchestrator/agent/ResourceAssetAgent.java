package com.proposalpilot.orchestrator.agent;

import com.proposalpilot.orchestrator.artifact.Artifact;
import com.proposalpilot.orchestrator.artifact.ResearchProfile;
import com.proposalpilot.orchestrator.artifact.ResourceBundle;
import com.proposalpilot.orchestrator.artifact.ResourceLink;
import com.proposalpilot.orchestrator.artifact.ResourceType;
import com.proposalpilot.orchestrator.config.PipelineProperties;
import com.proposalpilot.orchestrator.model.AgentKind;
import com.proposalpilot.orchestrator.model.ArtifactKind;
import com.proposalpilot.orchestrator.tool.ProviderIds;
import com.proposalpilot.orchestrator.tool.SearchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Collects datasets and code repositories relevant to the industry.
 *
 * When a research profile is available the search terms are refined with
 * its top key terms; otherwise the agent falls back to the bare industry
 * keyword. Kaggle is consulted only when that provider is registered.
 */
@Component
public class ResourceAssetAgent extends AbstractToolAgent {

    private static final Logger log = LoggerFactory.getLogger(ResourceAssetAgent.class);

    static final String KAGGLE_DATASETS  = "kaggle_datasets";
    static final int    REFINEMENT_TERMS = 3;

    public ResourceAssetAgent(RetryingToolCaller caller, PipelineProperties properties) {
        super(caller, properties.maxResults());
    }

    @Override
    public AgentKind kind() {
        return AgentKind.RESOURCE_ASSET;
    }

    @Override
    public Artifact run(AgentContext ctx) {
        Optional<ResearchProfile> research = ctx.input(ArtifactKind.RESEARCH_PROFILE, ResearchProfile.class);
        String industry = ctx.request().industry();

        boolean refined = research.isPresent() && !research.get().keyTerms().isEmpty();
        String terms = refined ? refine(industry, research.get().keyTerms()) : industry;
        if (!refined) {
            log.info("No research key terms for run {}, searching resources with '{}' only", ctx.runId(), industry);
        }

        List<PlannedCall> plan = new ArrayList<>(List.of(
                new PlannedCall(ResourceBundle.DATASETS, ProviderIds.DATASET_SEARCH, query(terms), true),
                new PlannedCall(ResourceBundle.REPOSITORIES, ProviderIds.CODE_SEARCH, query(terms), true)));
        if (caller.isAvailable(ProviderIds.KAGGLE_DATASETS)) {
            plan.add(new PlannedCall(KAGGLE_DATASETS, ProviderIds.KAGGLE_DATASETS, query(terms), false));
        }

        CallResults results = execute(plan, ctx);

        List<ResourceLink> datasets = dedupe(ResourceType.DATASET,
                results.hits(ResourceBundle.DATASETS), results.hits(KAGGLE_DATASETS));
        List<ResourceLink> repositories = dedupe(ResourceType.CODE_REPOSITORY,
                results.hits(ResourceBundle.REPOSITORIES));
        log.info("Resource search '{}' found {} dataset(s) and {} repositor(ies)",
                terms, datasets.size(), repositories.size());

        return new ResourceBundle(datasets, repositories, terms, refined, results.failedParts());
    }

    static String refine(String industry, List<String> keyTerms) {
        StringBuilder sb = new StringBuilder(industry);
        keyTerms.stream().limit(REFINEMENT_TERMS).forEach(t -> sb.append(' ').append(t));
        return sb.toString();
    }

    @SafeVarargs
    private static List<ResourceLink> dedupe(ResourceType type, List<SearchResult>... sources) {
        Map<String, ResourceLink> byUrl = new LinkedHashMap<>();
        for (List<SearchResult> source : sources) {
            for (SearchResult hit : source) {
                byUrl.putIfAbsent(hit.url(), ResourceLink.from(hit, type));
            }
        }
        return List.copyOf(byUrl.values());
    }
}
