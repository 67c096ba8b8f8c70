package com.eainde.lending.nodes;

import com.eainde.lending.debate.RoundGrouping;
import com.eainde.lending.decision.Decision;
import com.eainde.lending.decision.DecisionFinalizer;
import com.eainde.lending.decision.ComplianceVetoGate;
import com.eainde.lending.decision.VetoResult;
import com.eainde.lending.execution.AuditEventType;
import com.eainde.lending.execution.AuditTrail;
import com.eainde.lending.model.AgentMemo;
import com.eainde.lending.model.AgentRole;
import com.eainde.lending.model.AgentStepError;
import com.eainde.lending.model.LoanApplication;
import com.eainde.lending.model.WorkflowState;
import com.eainde.lending.repository.LoanApplicationRepository;
import com.eainde.lending.state.LoanDecisionState;
import lombok.extern.log4j.Log4j2;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * COMPLIANCE_CHECK. A veto finalizes the loan on the spot and wins over every other signal.
 * Without a veto, the loan is only handed to the finalizer when the Sales, Risk and
 * Compliance memos all exist with scores; otherwise it is held unfinalized with an
 * explicit DECISION_INCOMPLETE error so the run can be retried.
 */
@Log4j2
@Component
public class ComplianceCheckNode implements AsyncNodeAction<LoanDecisionState> {

    public static final String DECISION_INCOMPLETE = "DECISION_INCOMPLETE";

    private final LoanApplicationRepository loans;
    private final ComplianceVetoGate vetoGate;
    private final DecisionFinalizer finalizer;
    private final AuditTrail auditTrail;

    public ComplianceCheckNode(LoanApplicationRepository loans, ComplianceVetoGate vetoGate,
                               DecisionFinalizer finalizer, AuditTrail auditTrail) {
        this.loans = loans;
        this.vetoGate = vetoGate;
        this.finalizer = finalizer;
        this.auditTrail = auditTrail;
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(LoanDecisionState state) {
        try {
            LoanApplication loan = loans.require(state.getLoanId());
            Transitions.advance(loan, WorkflowState.COMPLIANCE_CHECK, auditTrail);

            Map<AgentRole, AgentMemo> roundZero = RoundGrouping.byRole(loan.getAgentMemos(), 0);
            VetoResult veto = vetoGate.apply(loan, roundZero.get(AgentRole.COMPLIANCE));
            if (veto.vetoed()) {
                auditTrail.record(loan.getId(), AuditEventType.AUTO_REJECT, "reasons", veto.reasons());
                Decision decision = finalizer.finalizeVetoed(loan);
                auditTrail.record(loan.getId(), AuditEventType.STATE_TRANSITION,
                        "from", WorkflowState.COMPLIANCE_CHECK.name(), "to", WorkflowState.FINALIZED.name());
                auditTrail.record(loan.getId(), AuditEventType.WORKFLOW_COMPLETE,
                        "status", decision.status().displayName(), "final_score", decision.finalScore());
                return CompletableFuture.completedFuture(Map.of(LoanDecisionState.VETOED, true));
            }

            List<String> missing = new ArrayList<>();
            for (AgentRole role : AgentRole.ROUND_ZERO) {
                AgentMemo memo = roundZero.get(role);
                if (memo == null || !memo.hasScore()) {
                    missing.add(role.displayName());
                }
            }
            if (!missing.isEmpty()) {
                String message = "Decision held, no round-0 score from " + String.join(", ", missing);
                log.warn("Loan {}: {}", loan.getId(), message);
                loan.recordError(new AgentStepError(null, 0, DECISION_INCOMPLETE, message, Instant.now()));
                auditTrail.record(loan.getId(), AuditEventType.DECISION_HELD, "missing", missing);
                return CompletableFuture.completedFuture(Map.of(LoanDecisionState.HELD, true));
            }

            return CompletableFuture.completedFuture(Map.of(
                    LoanDecisionState.SALES_SCORE, roundZero.get(AgentRole.SALES).riskScore(),
                    LoanDecisionState.RISK_SCORE, roundZero.get(AgentRole.RISK).riskScore()));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }
}
