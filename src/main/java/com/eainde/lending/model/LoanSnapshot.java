package com.eainde.lending.model;

import java.time.Instant;
import java.util.List;

/**
 * Immutable copy of a {@link LoanApplication} at one point in time. This is what the API
 * returns and what read-only consumers (memo rendering, assistant context) work from.
 */
public record LoanSnapshot(
        String id,
        String companyName,
        String industry,
        double requestedAmount,
        ExtractionResult extractedFinancials,
        LoanStatus status,
        WorkflowState workflowState,
        Double finalScore,
        boolean complianceFlag,
        Double confidenceScore,
        boolean lowConfidence,
        RiskMatrix riskMatrix,
        List<AgentMemo> agentMemos,
        List<AgentStepError> errors,
        Instant createdAt
) {

    public boolean isFinalized() {
        return workflowState == WorkflowState.FINALIZED;
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
