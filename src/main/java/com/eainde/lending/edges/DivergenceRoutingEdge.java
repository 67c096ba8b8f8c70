package com.eainde.lending.edges;

import com.eainde.lending.state.LoanDecisionState;
import org.bsc.langgraph4j.action.AsyncEdgeAction;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * After round 0: a wide Sales/Risk gap is a designed path into the Moderator round, not a fault.
 */
@Component
public class DivergenceRoutingEdge implements AsyncEdgeAction<LoanDecisionState> {

    public static final String MODERATE = "moderate";
    public static final String SETTLED = "settled";

    @Override
    public CompletableFuture<String> apply(LoanDecisionState state) {
        return CompletableFuture.completedFuture(state.isModeratorRequired() ? MODERATE : SETTLED);
    }
}
