package com.proposalpilot.orchestrator.artifact;

import com.proposalpilot.orchestrator.model.ArtifactKind;
import com.proposalpilot.orchestrator.tool.SearchResult;

import java.util.List;

/**
 * AI/ML market trends, candidate use cases and competitor activity for an industry.
 */
public record MarketTrendsReport(
        List<SearchResult> trends,
        List<SearchResult> useCases,
        List<SearchResult> competitiveLandscape,
        List<String>       missingParts
) implements Artifact {

    public static final String TRENDS                = "trends";
    public static final String USE_CASES             = "use_cases";
    public static final String COMPETITIVE_LANDSCAPE = "competitive_landscape";

    public MarketTrendsReport {
        trends               = List.copyOf(trends);
        useCases             = List.copyOf(useCases);
        competitiveLandscape = List.copyOf(competitiveLandscape);
        missingParts         = missingParts.stream().distinct().sorted().toList();
    }

    @Override
    public ArtifactKind kind() {
        return ArtifactKind.MARKET_TRENDS_REPORT;
    }
}
