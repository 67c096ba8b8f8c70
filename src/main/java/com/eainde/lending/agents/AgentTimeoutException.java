package com.eainde.lending.agents;

import com.eainde.lending.model.AgentRole;

public class AgentTimeoutException extends AgentInvocationException {

    public AgentTimeoutException(AgentRole role, String message) {
        super(role, message, null);
    }

    @Override
    public String kind() {
        return "AGENT_TIMEOUT";
    }
}
