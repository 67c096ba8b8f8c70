package com.eainde.lending.debate;

import com.eainde.lending.agents.AgentInvocationException;
import com.eainde.lending.agents.AgentOpinion;
import com.eainde.lending.model.AgentMemo;
import com.eainde.lending.model.AgentRole;

/**
 * Receives debate results as they complete. Appends must be serialized so the stored
 * order is the completion order.
 */
public interface MemoSink {

    /**
     * @return the stored memo, or null if the sink no longer accepts memos (run cancelled)
     */
    AgentMemo append(AgentRole role, int round, AgentOpinion opinion);

    void failed(AgentInvocationException failure, int round);
}
