package com.eainde.lending.agents;

import com.eainde.lending.model.AgentRole;

import java.util.EnumMap;
import java.util.Map;

/**
 * One agent per debate role.
 */
public class AgentRoster {

    private final Map<AgentRole, AnalysisAgent> agents;

    public AgentRoster(Map<AgentRole, AnalysisAgent> agents) {
        for (AgentRole role : AgentRole.values()) {
            if (!agents.containsKey(role)) {
                throw new IllegalArgumentException("No agent registered for role " + role.displayName());
            }
        }
        this.agents = new EnumMap<>(agents);
    }

    public AnalysisAgent get(AgentRole role) {
        return agents.get(role);
    }
}
