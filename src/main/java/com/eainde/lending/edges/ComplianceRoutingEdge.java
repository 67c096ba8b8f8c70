package com.eainde.lending.edges;

import com.eainde.lending.state.LoanDecisionState;
import org.bsc.langgraph4j.action.AsyncEdgeAction;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

@Component
public class ComplianceRoutingEdge implements AsyncEdgeAction<LoanDecisionState> {

    public static final String VETOED = "vetoed";
    public static final String HOLD = "hold";
    public static final String CLEAR = "clear";

    @Override
    public CompletableFuture<String> apply(LoanDecisionState state) {
        String next;
        if (state.isVetoed()) {
            next = VETOED;
        } else if (state.isHeld()) {
            next = HOLD;
        } else {
            next = CLEAR;
        }
        return CompletableFuture.completedFuture(next);
    }
}
