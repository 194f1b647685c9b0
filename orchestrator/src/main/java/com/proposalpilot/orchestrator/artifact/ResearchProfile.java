package com.proposalpilot.orchestrator.artifact;

import com.proposalpilot.orchestrator.model.ArtifactKind;
import com.proposalpilot.orchestrator.tool.SearchResult;

import java.util.List;

/**
 * Company and industry profile produced by the research agent.
 *
 * {@code keyTerms} are the most frequent descriptive terms found in the
 * findings; the resource agent uses them to refine its searches.
 */
public record ResearchProfile(
        String             companyName,
        String             industry,
        List<SearchResult> companyOverview,
        List<SearchResult> industryLandscape,
        List<SearchResult> strategicFocus,
        List<String>       keyTerms,
        List<String>       missingParts
) implements Artifact {

    public static final String COMPANY_OVERVIEW   = "company_overview";
    public static final String INDUSTRY_LANDSCAPE = "industry_landscape";
    public static final String STRATEGIC_FOCUS    = "strategic_focus";

    public ResearchProfile {
        companyOverview   = List.copyOf(companyOverview);
        industryLandscape = List.copyOf(industryLandscape);
        strategicFocus    = List.copyOf(strategicFocus);
        keyTerms          = List.copyOf(keyTerms);
        missingParts      = missingParts.stream().distinct().sorted().toList();
    }

    @Override
    public ArtifactKind kind() {
        return ArtifactKind.RESEARCH_PROFILE;
    }
}
