package com.eainde.lending.agents;

import com.eainde.lending.model.AgentRole;

public class AgentUnavailableException extends AgentInvocationException {

    public AgentUnavailableException(AgentRole role, String message) {
        super(role, message, null);
    }

    public AgentUnavailableException(AgentRole role, String message, Throwable cause) {
        super(role, message, cause);
    }

    @Override
    public String kind() {
        return "AGENT_UNAVAILABLE";
    }
}
