package com.proposalpilot.orchestrator.proposal;

import com.proposalpilot.orchestrator.artifact.Artifact;
import com.proposalpilot.orchestrator.artifact.MarketTrendsReport;
import com.proposalpilot.orchestrator.artifact.ProposalDocument;
import com.proposalpilot.orchestrator.artifact.ProposalMetrics;
import com.proposalpilot.orchestrator.artifact.ProposalSection;
import com.proposalpilot.orchestrator.artifact.ResearchProfile;
import com.proposalpilot.orchestrator.artifact.ResourceBundle;
import com.proposalpilot.orchestrator.artifact.ResourceLink;
import com.proposalpilot.orchestrator.artifact.SectionKind;
import com.proposalpilot.orchestrator.model.ArtifactKind;
import com.proposalpilot.orchestrator.model.PipelineRequest;
import com.proposalpilot.orchestrator.text.KeywordExtractor;
import com.proposalpilot.orchestrator.tool.SearchResult;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Merges the upstream artifacts into the final {@link ProposalDocument}.
 *
 * A pure function of its inputs: no I/O, no clock, no randomness. Sections
 * always come out in {@link SectionKind} order, whatever order the inputs
 * arrived in, and a missing input yields a placeholder section instead of
 * dropping the section, so consumers can rely on the document shape.
 */
@Component
public class ProposalAssembler {

    private static final int SNIPPET_LIMIT = 280;

    /**
     * Assemble from whatever artifacts arrived, in any order.
     *
     * @throws IllegalArgumentException if two artifacts of the same kind are given
     */
    public ProposalDocument assemble(PipelineRequest request, Collection<? extends Artifact> artifacts) {
        Map<ArtifactKind, Artifact> byKind = new EnumMap<>(ArtifactKind.class);
        for (Artifact a : artifacts) {
            if (byKind.put(a.kind(), a) != null) {
                throw new IllegalArgumentException("Duplicate artifact of kind " + a.kind());
            }
        }
        return assemble(request,
                (ResearchProfile)    byKind.get(ArtifactKind.RESEARCH_PROFILE),
                (MarketTrendsReport) byKind.get(ArtifactKind.MARKET_TRENDS_REPORT),
                (ResourceBundle)     byKind.get(ArtifactKind.RESOURCE_BUNDLE));
    }

    /**
     * Assemble the proposal. Any of the three inputs may be null (missing).
     */
    public ProposalDocument assemble(PipelineRequest request,
                                     ResearchProfile research,
                                     MarketTrendsReport market,
                                     ResourceBundle resources) {
        List<String> missing = new ArrayList<>();
        List<ProposalSection> sections = List.of(
                summary(request, research, missing),
                trends(market, missing),
                useCases(market, missing),
                feasibility(market, resources, missing),
                resources(resources, missing));

        ProposalMetrics metrics = new ProposalMetrics(
                market    == null ? 0 : market.trends().size(),
                market    == null ? 0 : market.useCases().size(),
                resources == null ? 0 : resources.datasets().size(),
                resources == null ? 0 : resources.repositories().size());

        return new ProposalDocument(
                "AI/ML Adoption Proposal: " + request.companyName(),
                request.companyName(),
                request.industry(),
                sections,
                missing.isEmpty(),
                missing,
                metrics);
    }

    // ------------------------------------------------------------------
    // Sections
    // ------------------------------------------------------------------

    private ProposalSection summary(PipelineRequest request, ResearchProfile research, List<String> missing) {
        if (research == null) {
            return unavailable(SectionKind.SUMMARY, "the company and industry research could not be gathered", missing);
        }
        List<String> gaps = new ArrayList<>();
        StringBuilder sb = new StringBuilder();
        sb.append("**").append(request.companyName()).append("** operates in the **")
          .append(request.industry()).append("** industry.\n\n");
        findings(sb, "Company overview", research.companyOverview(),
                research.missingParts().contains(ResearchProfile.COMPANY_OVERVIEW), SectionKind.SUMMARY,
                ResearchProfile.COMPANY_OVERVIEW, gaps);
        findings(sb, "Industry landscape", research.industryLandscape(),
                research.missingParts().contains(ResearchProfile.INDUSTRY_LANDSCAPE), SectionKind.SUMMARY,
                ResearchProfile.INDUSTRY_LANDSCAPE, gaps);
        findings(sb, "Strategic focus", research.strategicFocus(),
                research.missingParts().contains(ResearchProfile.STRATEGIC_FOCUS), SectionKind.SUMMARY,
                ResearchProfile.STRATEGIC_FOCUS, gaps);
        if (!research.keyTerms().isEmpty()) {
            sb.append("Key themes: ").append(String.join(", ", research.keyTerms())).append("\n");
        }
        return available(SectionKind.SUMMARY, sb, gaps, missing);
    }

    private ProposalSection trends(MarketTrendsReport market, List<String> missing) {
        if (market == null) {
            return unavailable(SectionKind.TRENDS, "the market analysis could not be gathered", missing);
        }
        if (market.missingParts().contains(MarketTrendsReport.TRENDS)) {
            return unavailable(SectionKind.TRENDS, "the market trend lookup failed", missing);
        }
        List<String> gaps = new ArrayList<>();
        StringBuilder sb = new StringBuilder();
        findings(sb, "Current trends", market.trends(), false, SectionKind.TRENDS,
                MarketTrendsReport.TRENDS, gaps);
        findings(sb, "Competitor AI adoption", market.competitiveLandscape(),
                market.missingParts().contains(MarketTrendsReport.COMPETITIVE_LANDSCAPE), SectionKind.TRENDS,
                MarketTrendsReport.COMPETITIVE_LANDSCAPE, gaps);
        return available(SectionKind.TRENDS, sb, gaps, missing);
    }

    private ProposalSection useCases(MarketTrendsReport market, List<String> missing) {
        if (market == null) {
            return unavailable(SectionKind.USE_CASES, "the market analysis could not be gathered", missing);
        }
        if (market.missingParts().contains(MarketTrendsReport.USE_CASES)) {
            return unavailable(SectionKind.USE_CASES, "the use case lookup failed", missing);
        }
        StringBuilder sb = new StringBuilder();
        if (market.useCases().isEmpty()) {
            sb.append("No documented use cases were found for this industry.\n");
        }
        int n = 1;
        for (SearchResult useCase : market.useCases()) {
            sb.append(n++).append(". **").append(useCase.title()).append("**");
            if (!useCase.snippet().isEmpty()) {
                sb.append(": ").append(abbreviate(useCase.snippet()));
            }
            if (!useCase.url().isEmpty()) {
                sb.append(" ([source](").append(useCase.url()).append("))");
            }
            sb.append("\n");
        }
        return available(SectionKind.USE_CASES, sb, List.of(), missing);
    }

    /**
     * One note per use case, rating readiness by how many datasets and
     * repositories share a term with the use case title.
     */
    private ProposalSection feasibility(MarketTrendsReport market, ResourceBundle resources, List<String> missing) {
        if (market == null || market.missingParts().contains(MarketTrendsReport.USE_CASES)) {
            return unavailable(SectionKind.FEASIBILITY, "no use cases were available to assess", missing);
        }
        StringBuilder sb = new StringBuilder();
        if (market.useCases().isEmpty()) {
            sb.append("No use cases to assess.\n");
        }
        for (SearchResult useCase : market.useCases()) {
            sb.append("- **").append(useCase.title()).append("**: ");
            if (resources == null) {
                sb.append("supporting resources were not assessed; readiness to be confirmed.\n");
                continue;
            }
            List<String> terms = KeywordExtractor.tokens(useCase.title());
            long datasets = resources.datasets().stream()
                    .filter(r -> KeywordExtractor.mentionsAny(r.title() + " " + r.description(), terms))
                    .count();
            long repos = resources.repositories().stream()
                    .filter(r -> KeywordExtractor.mentionsAny(r.title() + " " + r.description(), terms))
                    .count();
            String readiness = datasets > 0 && repos > 0 ? "High"
                    : datasets > 0 || repos > 0 ? "Medium" : "Low";
            sb.append(datasets).append(" supporting dataset(s), ")
              .append(repos).append(" reference implementation(s). Readiness: ")
              .append(readiness).append(".\n");
        }
        return available(SectionKind.FEASIBILITY, sb, List.of(), missing);
    }

    private ProposalSection resources(ResourceBundle resources, List<String> missing) {
        if (resources == null) {
            return unavailable(SectionKind.RESOURCES, "the dataset and repository lookups failed", missing);
        }
        List<String> gaps = new ArrayList<>();
        StringBuilder sb = new StringBuilder();
        sb.append("Search terms: `").append(resources.queryTerms()).append("`\n\n");
        links(sb, "Datasets", resources.datasets());
        links(sb, "Code repositories", resources.repositories());
        for (String part : resources.missingParts()) {
            sb.append(ProposalSection.placeholder(part.replace('_', ' ') + " lookup failed")).append("\n");
            gaps.add(SectionKind.RESOURCES.id() + "/" + part);
        }
        return available(SectionKind.RESOURCES, sb, gaps, missing);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static void findings(StringBuilder sb, String heading, List<SearchResult> hits, boolean failed,
                                 SectionKind section, String part, List<String> gaps) {
        sb.append("### ").append(heading).append("\n");
        if (failed) {
            sb.append(ProposalSection.placeholder(heading.toLowerCase(Locale.ROOT) + " lookup failed")).append("\n\n");
            gaps.add(section.id() + "/" + part);
            return;
        }
        if (hits.isEmpty()) {
            sb.append("No findings returned.\n\n");
            return;
        }
        for (SearchResult hit : hits) {
            sb.append("- ");
            if (hit.url().isEmpty()) {
                sb.append(hit.title());
            } else {
                sb.append("[").append(hit.title()).append("](").append(hit.url()).append(")");
            }
            if (!hit.snippet().isEmpty()) {
                sb.append(": ").append(abbreviate(hit.snippet()));
            }
            sb.append("\n");
        }
        sb.append("\n");
    }

    private static void links(StringBuilder sb, String heading, List<ResourceLink> links) {
        sb.append("### ").append(heading).append("\n");
        if (links.isEmpty()) {
            sb.append("None found.\n\n");
            return;
        }
        for (ResourceLink link : links) {
            sb.append("- [").append(link.title()).append("](").append(link.url()).append(")");
            if (!link.description().isEmpty()) {
                sb.append(": ").append(abbreviate(link.description()));
            }
            sb.append(" _(").append(link.provider()).append(")_\n");
        }
        sb.append("\n");
    }

    private static ProposalSection unavailable(SectionKind kind, String reason, List<String> missing) {
        missing.add(kind.id());
        return new ProposalSection(kind, kind.title(), ProposalSection.placeholder(reason), false, List.of());
    }

    private static ProposalSection available(SectionKind kind, StringBuilder body, List<String> gaps,
                                             List<String> missing) {
        missing.addAll(gaps);
        return new ProposalSection(kind, kind.title(), body.toString().strip(), true, gaps);
    }

    private static String abbreviate(String text) {
        String flat = text.replaceAll("\\s+", " ").strip();
        return flat.length() <= SNIPPET_LIMIT ? flat : flat.substring(0, SNIPPET_LIMIT).stripTrailing() + "...";
    }
}
