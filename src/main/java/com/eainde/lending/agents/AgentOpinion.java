package com.eainde.lending.agents;

import java.util.List;

/**
 * What a single agent call returns.
 *
 * @param riskScore 0-100, null when the agent abstained
 */
public record AgentOpinion(Double riskScore, String narrative, List<String> flags) {

    public AgentOpinion {
        narrative = narrative == null ? "" : narrative;
        flags = flags == null ? List.of() : List.copyOf(flags);
    }
}
