package com.eainde.lending.state;

import org.bsc.langgraph4j.state.AgentState;

import java.util.Map;

/**
 * Graph state of one decision run. Holds only routing facts; the loan record itself
 * lives in the repository and is the source of truth.
 */
public class LoanDecisionState extends AgentState {

    public static final String LOAN_ID = "loanId";
    public static final String SALES_SCORE = "salesScore";
    public static final String RISK_SCORE = "riskScore";
    public static final String DIVERGENCE = "divergence";
    public static final String MODERATOR_REQUIRED = "moderatorRequired";
    public static final String VETOED = "vetoed";
    public static final String HELD = "held";

    public LoanDecisionState(Map<String, Object> initData) {
        super(initData);
    }

    public String getLoanId() { return (String) this.data().get(LOAN_ID); }
    public Double getSalesScore() { return (Double) this.data().get(SALES_SCORE); }
    public Double getRiskScore() { return (Double) this.data().get(RISK_SCORE); }
    public Double getDivergence() { return (Double) this.data().get(DIVERGENCE); }
    public boolean isModeratorRequired() { return flag(MODERATOR_REQUIRED); }
    public boolean isVetoed() { return flag(VETOED); }
    public boolean isHeld() { return flag(HELD); }

    public static Map<String, Object> initial(String loanId) {
        return Map.of(LOAN_ID, loanId);
    }

    private boolean flag(String key) {
        return Boolean.TRUE.equals(this.data().get(key));
    }
}
