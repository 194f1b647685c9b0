package com.proposalpilot.orchestrator.agent;

import com.proposalpilot.orchestrator.artifact.Artifact;
import com.proposalpilot.orchestrator.artifact.MarketTrendsReport;
import com.proposalpilot.orchestrator.config.PipelineProperties;
import com.proposalpilot.orchestrator.model.AgentKind;
import com.proposalpilot.orchestrator.model.PipelineRequest;
import com.proposalpilot.orchestrator.tool.ProviderIds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Surveys AI/ML trends, use cases and competitor activity in the industry.
 * Runs independently of the research agent.
 */
@Component
public class MarketStandardsAgent extends AbstractToolAgent {

    private static final Logger log = LoggerFactory.getLogger(MarketStandardsAgent.class);

    public MarketStandardsAgent(RetryingToolCaller caller, PipelineProperties properties) {
        super(caller, properties.maxResults());
    }

    @Override
    public AgentKind kind() {
        return AgentKind.MARKET_STANDARDS;
    }

    @Override
    public Artifact run(AgentContext ctx) {
        PipelineRequest req = ctx.request();
        String industry = req.industry();
        List<PlannedCall> plan = List.of(
                new PlannedCall(MarketTrendsReport.TRENDS, ProviderIds.MARKET_TRENDS,
                        query("AI machine learning trends in " + industry), true),
                new PlannedCall(MarketTrendsReport.USE_CASES, ProviderIds.USE_CASES,
                        query("AI ML GenAI use cases " + industry + " industry"), true),
                new PlannedCall(MarketTrendsReport.COMPETITIVE_LANDSCAPE, ProviderIds.WEB_SEARCH,
                        query(industry + " competitors AI adoption " + req.companyName()), false));

        CallResults results = execute(plan, ctx);
        log.info("Market survey for '{}' gathered {} finding(s), missing {}",
                industry, results.totalHits(), results.failedParts());

        return new MarketTrendsReport(
                results.hits(MarketTrendsReport.TRENDS),
                results.hits(MarketTrendsReport.USE_CASES),
                results.hits(MarketTrendsReport.COMPETITIVE_LANDSCAPE),
                results.failedParts());
    }
}
