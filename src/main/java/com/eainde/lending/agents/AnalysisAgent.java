package com.eainde.lending.agents;

import com.eainde.lending.model.AgentRole;

import java.time.Duration;

/**
 * One debate participant. Implementations may block; callers bound them with
 * {@link AgentInvoker}.
 */
public interface AnalysisAgent {

    AgentRole role();

    /**
     * @throws AgentUnavailableException if the backend fails or its output cannot be used
     */
    AgentOpinion produceMemo(LoanContext context);

    /** Per-agent timeout override, null to use the configured default. */
    default Duration timeout() {
        return null;
    }
}
