package com.eainde.lending.service;

public class LoanNotFoundException extends RuntimeException {

    public LoanNotFoundException(String loanId) {
        super("No loan application with id " + loanId);
    }
}
