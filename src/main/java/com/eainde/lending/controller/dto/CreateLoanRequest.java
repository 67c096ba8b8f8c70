package com.eainde.lending.controller.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

import java.util.Map;

/**
 * New loan application. {@code extractedFinancials} is the extraction stage's raw output
 * and may be absent when ingestion failed.
 */
public record CreateLoanRequest(
        @NotBlank String companyName,
        String industry,
        @Positive double requestedAmount,
        Map<String, Object> extractedFinancials
) {
}
