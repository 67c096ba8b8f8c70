package com.eainde.lending.controller.dto;

import com.eainde.lending.model.LoanSnapshot;

import java.time.Instant;

/**
 * Returned when a decision run could not finalize the loan. The partial loan is always
 * included so missing memos are visible as missing, not as empty.
 */
public record DecisionErrorResponse(
        Instant timestamp,
        int status,
        String error,
        String message,
        boolean retryable,
        LoanSnapshot loan
) {
}
