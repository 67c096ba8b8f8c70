package com.eainde.lending.decision;

import com.eainde.lending.model.LoanStatus;

/**
 * What the finalizer wrote onto the loan.
 */
public record Decision(LoanStatus status, double finalScore, Double confidence, boolean vetoed) {
}
