package com.proposalpilot.orchestrator.agent;

import com.proposalpilot.orchestrator.model.AgentKind;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/** Looks agents up by kind. Exactly one agent per {@link AgentKind}. */
@Component
public class AgentRegistry {

    private final Map<AgentKind, Agent> agents = new EnumMap<>(AgentKind.class);

    public AgentRegistry(List<Agent> all) {
        for (Agent agent : all) {
            if (agents.put(agent.kind(), agent) != null) {
                throw new IllegalStateException("Duplicate agent for " + agent.kind());
            }
        }
        for (AgentKind kind : AgentKind.values()) {
            if (!agents.containsKey(kind)) {
                throw new IllegalStateException("No agent registered for " + kind);
            }
        }
    }

    public Agent get(AgentKind kind) {
        return agents.get(kind);
    }
}
