package com.eainde.lending.debate;

/**
 * No usable round-0 memo was produced. The loan is left unfinalized and the run can be retried.
 */
public class OrchestrationFailedException extends RuntimeException {

    private final String loanId;

    public OrchestrationFailedException(String loanId, String message) {
        super(message);
        this.loanId = loanId;
    }

    public String getLoanId() {
        return loanId;
    }
}
