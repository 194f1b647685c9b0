package com.proposalpilot.orchestrator.tool;

import com.proposalpilot.orchestrator.model.AgentKind;

import java.util.UUID;

/**
 * Runtime context passed with every gateway invocation.
 *
 * The gateway uses the run id to find and abort in-flight calls when a run
 * is cancelled; the agent tags logs and metrics.
 */
public record ToolCallContext(UUID runId, AgentKind agent) {}
