package com.eainde.lending.model;

import java.time.Instant;
import java.util.List;

/**
 * A memo produced by one agent during the debate.
 *
 * @param sequence  per-loan append position, reflects completion order
 * @param round     explicit debate round (0 = independent round); null only for legacy memos
 * @param riskScore 0-100, null when the agent abstained
 */
public record AgentMemo(
        long sequence,
        AgentRole agentType,
        Integer round,
        Double riskScore,
        String narrative,
        List<String> flags,
        Instant createdAt
) {

    public AgentMemo {
        flags = flags == null ? List.of() : List.copyOf(flags);
    }

    public boolean hasScore() {
        return riskScore != null;
    }
}
