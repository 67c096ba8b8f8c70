package com.eainde.lending.controller.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;

public record ConfidenceRequest(
        @NotNull @DecimalMin("0") @DecimalMax("100") Double salesScore,
        @NotNull @DecimalMin("0") @DecimalMax("100") Double riskScore
) {
}
