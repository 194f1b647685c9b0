package com.proposalpilot.orchestrator.agent;

import com.proposalpilot.orchestrator.model.AgentKind;

/**
 * Thrown when an agent cannot produce its artifact.
 *
 * Unchecked: the coordinator is the only caller with a recovery strategy
 * (mark the artifact missing and carry on degraded).
 */
public class AgentFailureException extends RuntimeException {

    public enum Kind { ALL_REQUIRED_CALLS_EXHAUSTED, INTERNAL_ASSEMBLY_ERROR }

    private final Kind      kind;
    private final AgentKind agent;

    public AgentFailureException(Kind kind, AgentKind agent, String message) {
        super("[" + kind + "] " + message);
        this.kind  = kind;
        this.agent = agent;
    }

    public AgentFailureException(Kind kind, AgentKind agent, String message, Throwable cause) {
        super("[" + kind + "] " + message, cause);
        this.kind  = kind;
        this.agent = agent;
    }

    public static AgentFailureException exhausted(AgentKind agent, String detail) {
        return new AgentFailureException(Kind.ALL_REQUIRED_CALLS_EXHAUSTED, agent,
                "All required provider calls failed: " + detail);
    }

    public static AgentFailureException internal(AgentKind agent, Throwable cause) {
        return new AgentFailureException(Kind.INTERNAL_ASSEMBLY_ERROR, agent,
                agent + " failed internally: " + cause, cause);
    }

    public Kind      getKind()  { return kind; }
    public AgentKind getAgent() { return agent; }
}
