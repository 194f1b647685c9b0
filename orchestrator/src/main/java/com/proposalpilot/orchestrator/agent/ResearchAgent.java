package com.proposalpilot.orchestrator.agent;

import com.proposalpilot.orchestrator.artifact.Artifact;
import com.proposalpilot.orchestrator.artifact.ResearchProfile;
import com.proposalpilot.orchestrator.config.PipelineProperties;
import com.proposalpilot.orchestrator.model.AgentKind;
import com.proposalpilot.orchestrator.model.PipelineRequest;
import com.proposalpilot.orchestrator.text.KeywordExtractor;
import com.proposalpilot.orchestrator.tool.ProviderIds;
import com.proposalpilot.orchestrator.tool.SearchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Researches the company and its industry.
 *
 * All three lookups are required, so the agent fails only when none of them
 * answers; any one success yields a profile with the others flagged missing.
 */
@Component
public class ResearchAgent extends AbstractToolAgent {

    private static final Logger log = LoggerFactory.getLogger(ResearchAgent.class);

    static final int KEY_TERM_LIMIT = 8;

    public ResearchAgent(RetryingToolCaller caller, PipelineProperties properties) {
        super(caller, properties.maxResults());
    }

    @Override
    public AgentKind kind() {
        return AgentKind.RESEARCH;
    }

    @Override
    public Artifact run(AgentContext ctx) {
        PipelineRequest req = ctx.request();
        List<PlannedCall> plan = List.of(
                new PlannedCall(ResearchProfile.COMPANY_OVERVIEW, ProviderIds.WEB_SEARCH,
                        query(req.companyName() + " company overview products services " + req.industry()), true),
                new PlannedCall(ResearchProfile.INDUSTRY_LANDSCAPE, ProviderIds.WEB_SEARCH,
                        query(req.industry() + " industry landscape key players challenges"), true),
                new PlannedCall(ResearchProfile.STRATEGIC_FOCUS, ProviderIds.BUSINESS_ANALYSIS,
                        query(req.companyName() + " strategic focus digital transformation priorities"), true));

        CallResults results = execute(plan, ctx);

        List<SearchResult> overview  = results.hits(ResearchProfile.COMPANY_OVERVIEW);
        List<SearchResult> landscape = results.hits(ResearchProfile.INDUSTRY_LANDSCAPE);
        List<SearchResult> strategic = results.hits(ResearchProfile.STRATEGIC_FOCUS);

        List<String> keyTerms = keyTerms(req, Stream.of(overview, landscape, strategic)
                .flatMap(List::stream).toList());
        log.info("Research for '{}' gathered {} finding(s), key terms {}",
                req.companyName(), results.totalHits(), keyTerms);

        return new ResearchProfile(req.companyName(), req.industry(),
                overview, landscape, strategic, keyTerms, results.failedParts());
    }

    /** Top terms of the findings, excluding words of the company name and industry. */
    static List<String> keyTerms(PipelineRequest req, List<SearchResult> findings) {
        Set<String> exclude = new HashSet<>(KeywordExtractor.tokens(req.companyName()));
        exclude.addAll(KeywordExtractor.tokens(req.industry()));
        List<String> texts = new ArrayList<>();
        for (SearchResult hit : findings) {
            texts.add(hit.title() + " " + hit.snippet());
        }
        return KeywordExtractor.topTerms(texts, exclude, KEY_TERM_LIMIT);
    }
}
