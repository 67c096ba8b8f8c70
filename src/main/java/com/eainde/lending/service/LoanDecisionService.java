package com.eainde.lending.service;

import com.eainde.lending.debate.OrchestrationCancelledException;
import com.eainde.lending.debate.OrchestrationFailedException;
import com.eainde.lending.execution.AuditEvent;
import com.eainde.lending.execution.AuditEventType;
import com.eainde.lending.execution.AuditTrail;
import com.eainde.lending.model.ExtractionResult;
import com.eainde.lending.model.LoanApplication;
import com.eainde.lending.model.LoanSnapshot;
import com.eainde.lending.repository.LoanApplicationRepository;
import com.eainde.lending.state.LoanDecisionState;
import com.eainde.lending.thread.MdcAwareExecutor;
import com.eainde.lending.workflow.LoanDecisionWorkflowGraph;
import com.eainde.lending.workflow.WorkflowEngine;
import lombok.extern.log4j.Log4j2;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.FutureTask;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Loan lifecycle and decision runs.
 * <p>
 * At most one decision run per loan is in flight; a second trigger fails fast with
 * {@link OrchestrationInProgressException}. A run executes on a worker thread so it can be
 * cancelled by interruption. Every stage writes to the loan as it completes, so a cancelled
 * or failed run leaves the loan at its last completed state and can simply be triggered again.
 */
@Log4j2
@Service
public class LoanDecisionService {

    public static final String LOAN_ID = "loanId";

    private final LoanApplicationRepository loans;
    private final WorkflowEngine engine;
    private final AuditTrail auditTrail;
    private final MdcAwareExecutor executor;

    private final ConcurrentMap<String, FutureTask<LoanSnapshot>> inFlight = new ConcurrentHashMap<>();

    public LoanDecisionService(LoanApplicationRepository loans, WorkflowEngine engine,
                               AuditTrail auditTrail, MdcAwareExecutor executor) {
        this.loans = loans;
        this.engine = engine;
        this.auditTrail = auditTrail;
        this.executor = executor;
    }

    // =========================================================================
    //  Loans
    // =========================================================================

    public LoanSnapshot createLoan(String companyName, String industry, double requestedAmount,
                                   ExtractionResult financials) {
        LoanApplication loan = new LoanApplication(UUID.randomUUID().toString(), companyName, industry,
                requestedAmount, financials);
        loans.save(loan);
        log.info("Created loan {} for {} (financials {})", loan.getId(), companyName,
                financials == null ? "missing" : "attached");
        return loan.snapshot();
    }

    public LoanSnapshot getLoan(String loanId) {
        return loans.require(loanId).snapshot();
    }

    public List<LoanSnapshot> listLoans() {
        return loans.findAll().stream().map(LoanApplication::snapshot).toList();
    }

    public List<AuditEvent> auditTrail(String loanId) {
        loans.require(loanId);
        return auditTrail.eventsFor(loanId);
    }

    // =========================================================================
    //  Decision runs
    // =========================================================================

    /**
     * Runs (or resumes) the decision workflow and waits for it.
     *
     * @return the loan after the run: finalized, or held with an error indicator
     * @throws OrchestrationInProgressException if a run for this loan is already active
     * @throws OrchestrationFailedException     if every round-0 agent failed
     * @throws OrchestrationCancelledException  if the run was cancelled
     */
    public LoanSnapshot decide(String loanId) {
        LoanApplication loan = loans.require(loanId);
        if (loan.isFinalized()) {
            throw new LoanStateConflictException("Loan " + loanId + " is already finalized");
        }

        // deregistered by the worker itself once it has unwound
        AtomicBoolean started = new AtomicBoolean();
        FutureTask<LoanSnapshot> run = new FutureTask<>(() -> {
            started.set(true);
            try {
                return runWorkflow(loan);
            } finally {
                inFlight.remove(loanId);
            }
        });
        if (inFlight.putIfAbsent(loanId, run) != null) {
            throw new OrchestrationInProgressException(loanId);
        }

        MDC.put(LOAN_ID, loanId);
        try {
            executor.execute(run);
            return run.get();
        } catch (CancellationException e) {
            throw cancelled(loan);
        } catch (InterruptedException e) {
            run.cancel(true);
            Thread.currentThread().interrupt();
            throw cancelled(loan);
        } catch (ExecutionException e) {
            throw unwrap(loan, e.getCause());
        } finally {
            if (!started.get()) {
                inFlight.remove(loanId, run);
            }
            MDC.remove(LOAN_ID);
        }
    }

    /**
     * Interrupts the in-flight run for this loan.
     *
     * @return false if nothing was running
     */
    public boolean cancel(String loanId) {
        loans.require(loanId);
        FutureTask<LoanSnapshot> run = inFlight.get(loanId);
        if (run == null) {
            return false;
        }
        log.warn("Cancelling decision run for loan {}", loanId);
        return run.cancel(true);
    }

    public boolean isRunning(String loanId) {
        return inFlight.containsKey(loanId);
    }

    private LoanSnapshot runWorkflow(LoanApplication loan) {
        auditTrail.record(loan.getId(), AuditEventType.WORKFLOW_START,
                "state", loan.getWorkflowState().name());
        engine.start(LoanDecisionWorkflowGraph.WORKFLOW_NAME, LoanDecisionState.initial(loan.getId()));
        return loan.snapshot();
    }

    private RuntimeException cancelled(LoanApplication loan) {
        auditTrail.record(loan.getId(), AuditEventType.WORKFLOW_CANCELLED,
                "state", loan.getWorkflowState().name());
        return new OrchestrationCancelledException(loan.getId());
    }

    /**
     * Graph failures arrive wrapped (CompletionException, ExecutionException, ...);
     * surface the domain exception underneath.
     */
    private RuntimeException unwrap(LoanApplication loan, Throwable failure) {
        Throwable current = failure;
        while (current != null) {
            if (current instanceof OrchestrationCancelledException || current instanceof InterruptedException) {
                return cancelled(loan);
            }
            if (current instanceof OrchestrationFailedException orchestrationFailed) {
                auditTrail.record(loan.getId(), AuditEventType.WORKFLOW_FAILED,
                        "reason", orchestrationFailed.getMessage());
                return orchestrationFailed;
            }
            if (current instanceof LoanNotFoundException || current instanceof LoanStateConflictException) {
                return (RuntimeException) current;
            }
            current = current.getCause();
        }
        auditTrail.record(loan.getId(), AuditEventType.WORKFLOW_FAILED,
                "reason", String.valueOf(failure));
        return new IllegalStateException("Decision run for loan " + loan.getId() + " failed", failure);
    }
}
