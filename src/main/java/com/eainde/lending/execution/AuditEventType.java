package com.eainde.lending.execution;

public enum AuditEventType {
    WORKFLOW_START,
    RISK_MATRIX,
    STATE_TRANSITION,
    AGENT_MEMO,
    AGENT_FAILED,
    MODERATOR_TRIGGERED,
    AUTO_REJECT,
    DECISION_HELD,
    FINAL_SCORE_CALC,
    DECISION,
    CONFIDENCE_CALC,
    WORKFLOW_COMPLETE,
    WORKFLOW_FAILED,
    WORKFLOW_CANCELLED
}
