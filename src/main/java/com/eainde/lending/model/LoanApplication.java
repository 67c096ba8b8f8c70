package com.eainde.lending.model;

import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * The single mutable record a decision run works on.
 * <p>
 * Created as {@code Pending / INITIAL_REVIEW}. Memos and errors are append-only.
 * Once {@link WorkflowState#FINALIZED} every mutator throws {@link IllegalStateException}.
 * All mutators are synchronized: round-0 agents append from worker threads.
 */
@Getter
public class LoanApplication {

    private final String id;
    private final String companyName;
    private final String industry;
    private final double requestedAmount;
    private final ExtractionResult extractedFinancials;
    private final Instant createdAt;

    private LoanStatus status = LoanStatus.PENDING;
    private WorkflowState workflowState = WorkflowState.INITIAL_REVIEW;
    private Double finalScore;
    private boolean complianceFlag;
    private Double confidenceScore;
    private boolean lowConfidence;
    private RiskMatrix riskMatrix;

    private final List<AgentMemo> agentMemos = new ArrayList<>();
    private final List<AgentStepError> errors = new ArrayList<>();

    public LoanApplication(String id, String companyName, String industry,
                           double requestedAmount, ExtractionResult extractedFinancials) {
        this.id = id;
        this.companyName = companyName;
        this.industry = industry;
        this.requestedAmount = requestedAmount;
        this.extractedFinancials = extractedFinancials;
        this.createdAt = Instant.now();
    }

    public synchronized LoanStatus getStatus() { return status; }
    public synchronized WorkflowState getWorkflowState() { return workflowState; }
    public synchronized Double getFinalScore() { return finalScore; }
    public synchronized boolean isComplianceFlag() { return complianceFlag; }
    public synchronized Double getConfidenceScore() { return confidenceScore; }
    public synchronized boolean isLowConfidence() { return lowConfidence; }
    public synchronized RiskMatrix getRiskMatrix() { return riskMatrix; }

    public synchronized List<AgentMemo> getAgentMemos() {
        return List.copyOf(agentMemos);
    }

    public synchronized List<AgentStepError> getErrors() {
        return List.copyOf(errors);
    }

    public synchronized boolean isFinalized() {
        return workflowState == WorkflowState.FINALIZED;
    }

    /**
     * Moves the workflow forward. Re-entering the current state, or asking for a state the
     * loan has already passed (a resumed run), is a no-op.
     *
     * @return true if the state changed
     */
    public synchronized boolean advanceTo(WorkflowState target) {
        ensureMutable();
        if (workflowState == target || workflowState.ordinal() > target.ordinal()) {
            return false;
        }
        if (!workflowState.canTransitionTo(target)) {
            throw new IllegalStateException(
                    "Illegal workflow transition " + workflowState + " -> " + target + " for loan " + id);
        }
        workflowState = target;
        return true;
    }

    public synchronized AgentMemo appendMemo(AgentRole role, int round, Double riskScore,
                                             String narrative, List<String> flags) {
        ensureMutable();
        AgentMemo memo = new AgentMemo(agentMemos.size() + 1L, role, round, riskScore,
                narrative, flags, Instant.now());
        agentMemos.add(memo);
        return memo;
    }

    public synchronized void recordError(AgentStepError error) {
        ensureMutable();
        errors.add(error);
    }

    public synchronized void attachRiskMatrix(RiskMatrix matrix, boolean lowConfidence) {
        ensureMutable();
        this.riskMatrix = matrix;
        this.lowConfidence = lowConfidence;
    }

    /**
     * Writes the decision and freezes the record.
     */
    public synchronized void finalizeDecision(LoanStatus status, double finalScore,
                                              Double confidenceScore, boolean complianceFlag) {
        ensureMutable();
        if (!workflowState.canTransitionTo(WorkflowState.FINALIZED)) {
            throw new IllegalStateException(
                    "Loan " + id + " cannot be finalized from " + workflowState);
        }
        this.status = status;
        this.finalScore = finalScore;
        this.confidenceScore = confidenceScore;
        this.complianceFlag = complianceFlag;
        this.workflowState = WorkflowState.FINALIZED;
    }

    public synchronized LoanSnapshot snapshot() {
        return new LoanSnapshot(id, companyName, industry, requestedAmount, extractedFinancials,
                status, workflowState, finalScore, complianceFlag, confidenceScore, lowConfidence,
                riskMatrix, List.copyOf(agentMemos), List.copyOf(errors), createdAt);
    }

    private void ensureMutable() {
        if (workflowState == WorkflowState.FINALIZED) {
            throw new IllegalStateException("Loan " + id + " is finalized and can no longer change");
        }
    }
}
