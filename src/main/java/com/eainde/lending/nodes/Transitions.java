package com.eainde.lending.nodes;

import com.eainde.lending.execution.AuditEventType;
import com.eainde.lending.execution.AuditTrail;
import com.eainde.lending.model.LoanApplication;
import com.eainde.lending.model.WorkflowState;
import lombok.extern.log4j.Log4j2;

@Log4j2
final class Transitions {

    private Transitions() {
    }

    static void advance(LoanApplication loan, WorkflowState target, AuditTrail auditTrail, Object... details) {
        WorkflowState from = loan.getWorkflowState();
        if (!loan.advanceTo(target)) {
            return;
        }
        log.info("Loan {} {} -> {}", loan.getId(), from, target);
        Object[] keyValues = new Object[details.length + 4];
        keyValues[0] = "from";
        keyValues[1] = from.name();
        keyValues[2] = "to";
        keyValues[3] = target.name();
        System.arraycopy(details, 0, keyValues, 4, details.length);
        auditTrail.record(loan.getId(), AuditEventType.STATE_TRANSITION, keyValues);
    }
}
