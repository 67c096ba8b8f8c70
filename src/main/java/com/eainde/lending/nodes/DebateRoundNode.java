package com.eainde.lending.nodes;

import com.eainde.lending.agents.LoanContext;
import com.eainde.lending.debate.DebateOrchestrator;
import com.eainde.lending.debate.DebateSession;
import com.eainde.lending.debate.LoanMemoSink;
import com.eainde.lending.execution.AuditTrail;
import com.eainde.lending.model.LoanApplication;
import com.eainde.lending.model.WorkflowState;
import com.eainde.lending.repository.LoanApplicationRepository;
import com.eainde.lending.state.LoanDecisionState;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * DEBATE_ROUND_1: the independent round. Roles that already have a memo on the loan
 * (from an interrupted run) are not dispatched again.
 */
@Component
public class DebateRoundNode implements AsyncNodeAction<LoanDecisionState> {

    private final LoanApplicationRepository loans;
    private final DebateOrchestrator orchestrator;
    private final AuditTrail auditTrail;

    public DebateRoundNode(LoanApplicationRepository loans, DebateOrchestrator orchestrator, AuditTrail auditTrail) {
        this.loans = loans;
        this.orchestrator = orchestrator;
        this.auditTrail = auditTrail;
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(LoanDecisionState state) {
        try {
            LoanApplication loan = loans.require(state.getLoanId());
            Transitions.advance(loan, WorkflowState.DEBATE_ROUND_1, auditTrail);

            DebateSession session = DebateSession.resume(LoanContext.roundZero(loan), loan.getAgentMemos());
            orchestrator.runRoundZero(session, new LoanMemoSink(loan, auditTrail));

            Map<String, Object> update = new HashMap<>();
            putIfPresent(update, LoanDecisionState.SALES_SCORE, session.salesScore());
            putIfPresent(update, LoanDecisionState.RISK_SCORE, session.riskScore());
            putIfPresent(update, LoanDecisionState.DIVERGENCE, session.divergence());
            update.put(LoanDecisionState.MODERATOR_REQUIRED, session.moderatorRequired());
            return CompletableFuture.completedFuture(update);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private static void putIfPresent(Map<String, Object> update, String key, Object value) {
        if (value != null) {
            update.put(key, value);
        }
    }
}
