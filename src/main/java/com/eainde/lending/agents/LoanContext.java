package com.eainde.lending.agents;

import com.eainde.lending.model.AgentMemo;
import com.eainde.lending.model.ExtractionResult;
import com.eainde.lending.model.LoanApplication;
import com.eainde.lending.model.RiskMatrix;

import java.util.List;

/**
 * Read-only input handed to an agent. Round-0 contexts carry no memos from other agents.
 *
 * @param divergence |sales - risk| of round 0, only set for the moderator round
 */
public record LoanContext(
        String loanId,
        String companyName,
        String industry,
        double requestedAmount,
        ExtractionResult financials,
        RiskMatrix riskMatrix,
        List<AgentMemo> priorMemos,
        Double divergence
) {

    public LoanContext {
        priorMemos = priorMemos == null ? List.of() : List.copyOf(priorMemos);
    }

    public static LoanContext roundZero(LoanApplication loan) {
        return new LoanContext(loan.getId(), loan.getCompanyName(), loan.getIndustry(),
                loan.getRequestedAmount(), loan.getExtractedFinancials(), loan.getRiskMatrix(),
                List.of(), null);
    }

    public LoanContext withDebate(List<AgentMemo> memos, double divergence) {
        return new LoanContext(loanId, companyName, industry, requestedAmount, financials,
                riskMatrix, memos, divergence);
    }

    public boolean isRoundZero() {
        return priorMemos.isEmpty() && divergence == null;
    }
}
