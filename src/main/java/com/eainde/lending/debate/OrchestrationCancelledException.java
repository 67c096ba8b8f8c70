package com.eainde.lending.debate;

public class OrchestrationCancelledException extends RuntimeException {

    private final String loanId;

    public OrchestrationCancelledException(String loanId) {
        super("Decision run for loan " + loanId + " was cancelled");
        this.loanId = loanId;
    }

    public String getLoanId() {
        return loanId;
    }
}
