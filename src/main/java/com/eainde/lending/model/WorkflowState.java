package com.eainde.lending.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Decision workflow states. FINALIZED is terminal.
 */
public enum WorkflowState {
    INITIAL_REVIEW,
    DEBATE_ROUND_1,
    DEBATE_ROUND_2,
    COMPLIANCE_CHECK,
    FINALIZED;

    public Set<WorkflowState> successors() {
        return switch (this) {
            case INITIAL_REVIEW -> EnumSet.of(DEBATE_ROUND_1);
            case DEBATE_ROUND_1 -> EnumSet.of(DEBATE_ROUND_2, COMPLIANCE_CHECK);
            case DEBATE_ROUND_2 -> EnumSet.of(COMPLIANCE_CHECK);
            case COMPLIANCE_CHECK -> EnumSet.of(FINALIZED);
            case FINALIZED -> EnumSet.noneOf(WorkflowState.class);
        };
    }

    public boolean canTransitionTo(WorkflowState target) {
        return successors().contains(target);
    }

    public boolean isTerminal() {
        return this == FINALIZED;
    }
}
