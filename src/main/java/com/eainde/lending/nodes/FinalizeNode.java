package com.eainde.lending.nodes;

import com.eainde.lending.decision.Decision;
import com.eainde.lending.decision.DecisionFinalizer;
import com.eainde.lending.execution.AuditEventType;
import com.eainde.lending.execution.AuditTrail;
import com.eainde.lending.model.LoanApplication;
import com.eainde.lending.model.WorkflowState;
import com.eainde.lending.repository.LoanApplicationRepository;
import com.eainde.lending.state.LoanDecisionState;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

@Component
public class FinalizeNode implements AsyncNodeAction<LoanDecisionState> {

    private final LoanApplicationRepository loans;
    private final DecisionFinalizer finalizer;
    private final AuditTrail auditTrail;

    public FinalizeNode(LoanApplicationRepository loans, DecisionFinalizer finalizer, AuditTrail auditTrail) {
        this.loans = loans;
        this.finalizer = finalizer;
        this.auditTrail = auditTrail;
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(LoanDecisionState state) {
        try {
            LoanApplication loan = loans.require(state.getLoanId());
            double sales = state.getSalesScore();
            double risk = state.getRiskScore();

            Decision decision = finalizer.finalizeDecision(loan, sales, risk);
            String loanId = loan.getId();
            auditTrail.record(loanId, AuditEventType.FINAL_SCORE_CALC,
                    "formula", "0.4*sales - 0.4*risk",
                    "sales", sales,
                    "risk", risk,
                    "final_score", decision.finalScore());
            auditTrail.record(loanId, AuditEventType.DECISION,
                    "threshold", DecisionFinalizer.APPROVAL_THRESHOLD,
                    "status", decision.status().displayName());
            auditTrail.record(loanId, AuditEventType.CONFIDENCE_CALC,
                    "variance", Math.abs(sales - risk),
                    "confidence", decision.confidence());
            auditTrail.record(loanId, AuditEventType.STATE_TRANSITION,
                    "from", WorkflowState.COMPLIANCE_CHECK.name(), "to", WorkflowState.FINALIZED.name());
            auditTrail.record(loanId, AuditEventType.WORKFLOW_COMPLETE,
                    "status", decision.status().displayName(), "final_score", decision.finalScore());

            return CompletableFuture.completedFuture(Map.of());
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }
}
