package com.proposalpilot.orchestrator.agent;

import com.proposalpilot.orchestrator.artifact.Artifact;
import com.proposalpilot.orchestrator.model.AgentKind;

/**
 * A unit of orchestrated work: consumes its upstream artifacts, calls
 * external tools, produces exactly one artifact.
 *
 * Agents are stateless singletons. Everything run-specific arrives in the
 * {@link AgentContext}; the only thing an agent writes while running is
 * the context's own {@link ToolCallLedger}.
 */
public interface Agent {

    AgentKind kind();

    /**
     * Run the agent for one pipeline run.
     *
     * @throws AgentFailureException when the agent cannot produce its artifact
     * @throws java.util.concurrent.CancellationException when the run was cancelled mid-flight
     */
    Artifact run(AgentContext context);
}
