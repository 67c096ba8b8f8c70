package com.eainde.lending.service;

/**
 * A decision run for this loan is already in flight. Runs for one loan are never interleaved.
 */
public class OrchestrationInProgressException extends RuntimeException {

    public OrchestrationInProgressException(String loanId) {
        super("A decision run for loan " + loanId + " is already in progress");
    }
}
