package com.eainde.lending.controller;

import com.eainde.lending.controller.dto.CancelResponse;
import com.eainde.lending.controller.dto.CreateLoanRequest;
import com.eainde.lending.controller.dto.DecisionErrorResponse;
import com.eainde.lending.execution.AuditEvent;
import com.eainde.lending.model.ExtractionResult;
import com.eainde.lending.model.LoanSnapshot;
import com.eainde.lending.service.DecisionContext;
import com.eainde.lending.service.DecisionContextProvider;
import com.eainde.lending.service.DecisionMemoRenderer;
import com.eainde.lending.service.LoanDecisionService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;

@RestController
@RequestMapping("/loans")
public class LoanController {

    static final String MARKDOWN = "text/markdown";

    private final LoanDecisionService decisionService;
    private final DecisionMemoRenderer memoRenderer;
    private final DecisionContextProvider contextProvider;

    public LoanController(LoanDecisionService decisionService, DecisionMemoRenderer memoRenderer,
                          DecisionContextProvider contextProvider) {
        this.decisionService = decisionService;
        this.memoRenderer = memoRenderer;
        this.contextProvider = contextProvider;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public LoanSnapshot create(@Valid @RequestBody CreateLoanRequest request) {
        return decisionService.createLoan(request.companyName(), request.industry(), request.requestedAmount(),
                ExtractionResult.fromMap(request.extractedFinancials()));
    }

    @GetMapping
    public List<LoanSnapshot> list() {
        return decisionService.listLoans();
    }

    @GetMapping("/{loanId}")
    public LoanSnapshot get(@PathVariable String loanId) {
        return decisionService.getLoan(loanId);
    }

    /**
     * Runs the decision. A loan that could not be finalized comes back with 502 and its
     * error indicators.
     */
    @PostMapping("/{loanId}/decision")
    public ResponseEntity<?> decide(@PathVariable String loanId) {
        LoanSnapshot loan = decisionService.decide(loanId);
        if (loan.isFinalized()) {
            return ResponseEntity.ok(loan);
        }
        String message = loan.hasErrors()
                ? loan.errors().get(loan.errors().size() - 1).message()
                : "Loan " + loanId + " was not finalized";
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(new DecisionErrorResponse(
                Instant.now(), HttpStatus.BAD_GATEWAY.value(), "Decision Incomplete", message, true, loan));
    }

    @DeleteMapping("/{loanId}/decision")
    public CancelResponse cancel(@PathVariable String loanId) {
        return new CancelResponse(loanId, decisionService.cancel(loanId));
    }

    @GetMapping(value = "/{loanId}/memo", produces = MARKDOWN)
    public String memo(@PathVariable String loanId) {
        return memoRenderer.render(decisionService.getLoan(loanId));
    }

    @GetMapping("/{loanId}/context")
    public DecisionContext context(@PathVariable String loanId) {
        return contextProvider.contextFor(loanId);
    }

    @GetMapping("/{loanId}/audit")
    public List<AuditEvent> audit(@PathVariable String loanId) {
        return decisionService.auditTrail(loanId);
    }
}
