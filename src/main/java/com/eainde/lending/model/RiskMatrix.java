package com.eainde.lending.model;

import java.util.Objects;

/**
 * Categorical risk view of an applicant. All four categories are always present.
 * Growth strength is higher-is-better; the other three are higher-is-worse.
 */
public record RiskMatrix(
        CategoryScore financialRisk,
        CategoryScore growthStrength,
        CategoryScore regulatoryRisk,
        CategoryScore reputationRisk
) {

    public RiskMatrix {
        Objects.requireNonNull(financialRisk, "financialRisk");
        Objects.requireNonNull(growthStrength, "growthStrength");
        Objects.requireNonNull(regulatoryRisk, "regulatoryRisk");
        Objects.requireNonNull(reputationRisk, "reputationRisk");
    }
}
