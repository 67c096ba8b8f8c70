package com.eainde.lending.service;

import com.eainde.lending.model.AgentMemo;
import com.eainde.lending.model.LoanStatus;
import com.eainde.lending.model.RiskMatrix;

import java.util.List;

/**
 * Read-only grounding handed to the Q&A assistant. Carries copies only; nothing here
 * can reach back into the loan record.
 *
 * @param groundingText the same facts rendered as prompt-ready text
 */
public record DecisionContext(
        String loanId,
        String companyName,
        LoanStatus status,
        Double finalScore,
        Double confidenceScore,
        boolean complianceFlag,
        RiskMatrix riskMatrix,
        List<AgentMemo> agentMemos,
        String groundingText
) {
}
