package com.eainde.lending.service;

import com.eainde.lending.model.AgentMemo;
import com.eainde.lending.model.LoanSnapshot;
import com.eainde.lending.model.RiskMatrix;
import com.eainde.lending.repository.LoanApplicationRepository;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Grounding context for the assistant that answers questions about a decision.
 * Only finalized loans are exposed.
 */
@Component
public class DecisionContextProvider {

    static final String DECISION_RULES = """
            Decision rules:
            - final score = 0.4 * sales - 0.4 * risk, using round-0 scores
            - approved when the final score is at least 20
            - confidence falls as |sales - risk| grows
            - a compliance veto forces Rejected, score 0.0, confidence 1.00""";

    private final LoanApplicationRepository loans;

    public DecisionContextProvider(LoanApplicationRepository loans) {
        this.loans = loans;
    }

    public DecisionContext contextFor(String loanId) {
        LoanSnapshot loan = loans.require(loanId).snapshot();
        if (!loan.isFinalized()) {
            throw new LoanStateConflictException("Loan " + loanId + " has no final decision yet");
        }
        return new DecisionContext(loan.id(), loan.companyName(), loan.status(), loan.finalScore(),
                loan.confidenceScore(), loan.complianceFlag(), loan.riskMatrix(), loan.agentMemos(),
                groundingText(loan));
    }

    String groundingText(LoanSnapshot loan) {
        StringBuilder sb = new StringBuilder();
        sb.append("Company: ").append(loan.companyName()).append('\n');
        if (loan.industry() != null) {
            sb.append("Industry: ").append(loan.industry()).append('\n');
        }
        sb.append(String.format(Locale.ROOT, "Requested Amount: $%,.0f%n", loan.requestedAmount()));
        sb.append("Status: ").append(loan.status().displayName()).append('\n');
        sb.append("Final Score: ").append(loan.finalScore()).append('\n');
        sb.append("Confidence: ").append(loan.confidenceScore()).append('\n');
        sb.append("Compliance Flag: ").append(loan.complianceFlag()).append('\n');

        RiskMatrix matrix = loan.riskMatrix();
        if (matrix != null) {
            sb.append("\nRisk Matrix:\n");
            sb.append("- financial_risk ").append(matrix.financialRisk().score()).append(": ")
                    .append(String.join("; ", matrix.financialRisk().evidence())).append('\n');
            sb.append("- growth_strength ").append(matrix.growthStrength().score()).append(": ")
                    .append(String.join("; ", matrix.growthStrength().evidence())).append('\n');
            sb.append("- regulatory_risk ").append(matrix.regulatoryRisk().score()).append(": ")
                    .append(String.join("; ", matrix.regulatoryRisk().evidence())).append('\n');
            sb.append("- reputation_risk ").append(matrix.reputationRisk().score()).append(": ")
                    .append(String.join("; ", matrix.reputationRisk().evidence())).append('\n');
        }

        sb.append("\nAgent Memos:\n");
        for (AgentMemo memo : loan.agentMemos()) {
            sb.append('[').append(memo.agentType().displayName()).append(", round ").append(memo.round())
                    .append("] (score: ").append(memo.riskScore()).append("): ")
                    .append(memo.narrative()).append('\n');
        }
        sb.append('\n').append(DECISION_RULES);
        return sb.toString();
    }
}
