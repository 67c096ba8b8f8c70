package com.eainde.lending.debate;

import com.eainde.lending.agents.AgentInvocationException;
import com.eainde.lending.agents.AgentOpinion;
import com.eainde.lending.execution.AuditEventType;
import com.eainde.lending.execution.AuditTrail;
import com.eainde.lending.model.AgentMemo;
import com.eainde.lending.model.AgentRole;
import com.eainde.lending.model.AgentStepError;
import com.eainde.lending.model.LoanApplication;
import lombok.extern.log4j.Log4j2;

import java.time.Instant;

/**
 * Writes debate results straight onto the loan record as they arrive, with an audit entry
 * for each. Nothing is buffered, so a cancelled run keeps every memo that completed.
 */
@Log4j2
public class LoanMemoSink implements MemoSink {

    private final LoanApplication loan;
    private final AuditTrail auditTrail;

    public LoanMemoSink(LoanApplication loan, AuditTrail auditTrail) {
        this.loan = loan;
        this.auditTrail = auditTrail;
    }

    @Override
    public AgentMemo append(AgentRole role, int round, AgentOpinion opinion) {
        if (Thread.currentThread().isInterrupted()) {
            log.warn("Dropping late {} memo for loan {}, run was cancelled", role.displayName(), loan.getId());
            return null;
        }
        AgentMemo memo = loan.appendMemo(role, round, opinion.riskScore(), opinion.narrative(), opinion.flags());
        auditTrail.record(loan.getId(), AuditEventType.AGENT_MEMO,
                "agent", role.displayName(),
                "round", round,
                "sequence", memo.sequence(),
                "score", memo.riskScore(),
                "flags", memo.flags());
        log.info("{} memo #{} stored for loan {} (round {}, score {})",
                role.displayName(), memo.sequence(), loan.getId(), round, memo.riskScore());
        return memo;
    }

    @Override
    public void failed(AgentInvocationException failure, int round) {
        loan.recordError(new AgentStepError(failure.getRole(), round, failure.kind(),
                failure.getMessage(), Instant.now()));
        auditTrail.record(loan.getId(), AuditEventType.AGENT_FAILED,
                "agent", failure.getRole().displayName(),
                "round", round,
                "kind", failure.kind(),
                "message", failure.getMessage());
    }
}
