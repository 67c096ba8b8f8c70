package com.eainde.lending.service;

/**
 * The loan is not in a workflow state that allows the requested operation,
 * e.g. re-deciding a finalized loan or rendering a memo for an undecided one.
 */
public class LoanStateConflictException extends RuntimeException {

    public LoanStateConflictException(String message) {
        super(message);
    }
}
