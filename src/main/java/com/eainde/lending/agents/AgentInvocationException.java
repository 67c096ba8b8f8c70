package com.eainde.lending.agents;

import com.eainde.lending.model.AgentRole;
import lombok.Getter;

/**
 * Base class for agent call failures that survive the retry.
 */
@Getter
public abstract class AgentInvocationException extends RuntimeException {

    private final AgentRole role;

    protected AgentInvocationException(AgentRole role, String message, Throwable cause) {
        super(message, cause);
        this.role = role;
    }

    /** Short machine-readable kind recorded on the loan's error list. */
    public abstract String kind();
}
