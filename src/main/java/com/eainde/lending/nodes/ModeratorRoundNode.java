package com.eainde.lending.nodes;

import com.eainde.lending.agents.LoanContext;
import com.eainde.lending.debate.DebateOrchestrator;
import com.eainde.lending.debate.DebateSession;
import com.eainde.lending.debate.LoanMemoSink;
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

/**
 * DEBATE_ROUND_2: Moderator synthesis, only reached when Sales and Risk diverge.
 * A failed Moderator is recorded on the loan but does not stop the run.
 */
@Component
public class ModeratorRoundNode implements AsyncNodeAction<LoanDecisionState> {

    private final LoanApplicationRepository loans;
    private final DebateOrchestrator orchestrator;
    private final AuditTrail auditTrail;

    public ModeratorRoundNode(LoanApplicationRepository loans, DebateOrchestrator orchestrator, AuditTrail auditTrail) {
        this.loans = loans;
        this.orchestrator = orchestrator;
        this.auditTrail = auditTrail;
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(LoanDecisionState state) {
        try {
            LoanApplication loan = loans.require(state.getLoanId());
            Transitions.advance(loan, WorkflowState.DEBATE_ROUND_2, auditTrail,
                    "reason", "sales_risk_divergence",
                    "divergence", state.getDivergence());

            DebateSession session = DebateSession.resume(LoanContext.roundZero(loan), loan.getAgentMemos());
            if (session.moderatorMemo() == null) {
                auditTrail.record(loan.getId(), AuditEventType.MODERATOR_TRIGGERED,
                        "divergence", session.divergence(),
                        "threshold", DebateOrchestrator.DIVERGENCE_THRESHOLD);
            }
            orchestrator.runModerator(session, new LoanMemoSink(loan, auditTrail));
            return CompletableFuture.completedFuture(Map.of());
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }
}
