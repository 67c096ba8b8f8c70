package com.eainde.lending.nodes;

import com.eainde.lending.execution.AuditEventType;
import com.eainde.lending.execution.AuditTrail;
import com.eainde.lending.model.ExtractionResult;
import com.eainde.lending.model.LoanApplication;
import com.eainde.lending.model.RiskMatrix;
import com.eainde.lending.repository.LoanApplicationRepository;
import com.eainde.lending.scoring.RiskMatrixScorer;
import com.eainde.lending.state.LoanDecisionState;
import lombok.extern.log4j.Log4j2;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Scores the risk matrix. Missing financials never block the run: the loan gets the
 * neutral matrix and is marked low-confidence.
 */
@Log4j2
@Component
public class InitialReviewNode implements AsyncNodeAction<LoanDecisionState> {

    private final LoanApplicationRepository loans;
    private final RiskMatrixScorer scorer;
    private final AuditTrail auditTrail;

    public InitialReviewNode(LoanApplicationRepository loans, RiskMatrixScorer scorer, AuditTrail auditTrail) {
        this.loans = loans;
        this.scorer = scorer;
        this.auditTrail = auditTrail;
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(LoanDecisionState state) {
        try {
            LoanApplication loan = loans.require(state.getLoanId());
            if (loan.getRiskMatrix() != null) {
                log.debug("Risk matrix already attached to loan {}", loan.getId());
                return CompletableFuture.completedFuture(Map.of());
            }

            ExtractionResult financials = loan.getExtractedFinancials();
            RiskMatrix matrix = scorer.score(financials);
            boolean lowConfidence = financials == null;
            loan.attachRiskMatrix(matrix, lowConfidence);
            if (lowConfidence) {
                log.warn("Loan {} has no extracted financials, continuing with neutral risk matrix", loan.getId());
            }

            auditTrail.record(loan.getId(), AuditEventType.RISK_MATRIX,
                    "financial_risk", matrix.financialRisk().score(),
                    "growth_strength", matrix.growthStrength().score(),
                    "regulatory_risk", matrix.regulatoryRisk().score(),
                    "reputation_risk", matrix.reputationRisk().score(),
                    "low_confidence", lowConfidence);
            return CompletableFuture.completedFuture(Map.of());
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }
}
