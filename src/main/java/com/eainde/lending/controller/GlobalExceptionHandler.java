package com.eainde.lending.controller;

import com.eainde.lending.controller.dto.DecisionErrorResponse;
import com.eainde.lending.debate.OrchestrationCancelledException;
import com.eainde.lending.debate.OrchestrationFailedException;
import com.eainde.lending.model.LoanApplication;
import com.eainde.lending.model.LoanSnapshot;
import com.eainde.lending.repository.LoanApplicationRepository;
import com.eainde.lending.service.LoanNotFoundException;
import com.eainde.lending.service.LoanStateConflictException;
import com.eainde.lending.service.OrchestrationInProgressException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.log4j.Log4j2;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

@Log4j2
@RestControllerAdvice
public class GlobalExceptionHandler {

    private final LoanApplicationRepository loans;

    public GlobalExceptionHandler(LoanApplicationRepository loans) {
        this.loans = loans;
    }

    @ExceptionHandler(LoanNotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Map<String, Object> handleNotFound(LoanNotFoundException ex, HttpServletRequest req) {
        return body(HttpStatus.NOT_FOUND, "Not Found", ex.getMessage(), req);
    }

    @ExceptionHandler({OrchestrationInProgressException.class, LoanStateConflictException.class})
    @ResponseStatus(HttpStatus.CONFLICT)
    public Map<String, Object> handleConflict(RuntimeException ex, HttpServletRequest req) {
        log.warn("Conflict on {}: {}", req.getRequestURI(), ex.getMessage());
        return body(HttpStatus.CONFLICT, "Conflict", ex.getMessage(), req);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleValidation(MethodArgumentNotValidException ex, HttpServletRequest req) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(e -> e.getField() + " " + e.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return body(HttpStatus.BAD_REQUEST, "Bad Request", message, req);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleUnreadable(HttpMessageNotReadableException ex, HttpServletRequest req) {
        return body(HttpStatus.BAD_REQUEST, "Bad Request", "Malformed request body", req);
    }

    @ExceptionHandler(OrchestrationFailedException.class)
    public ResponseEntity<DecisionErrorResponse> handleOrchestrationFailed(OrchestrationFailedException ex) {
        log.error("Decision run failed: {}", ex.getMessage());
        return decisionError(HttpStatus.BAD_GATEWAY, "Orchestration Failed", ex.getMessage(), true, ex.getLoanId());
    }

    @ExceptionHandler(OrchestrationCancelledException.class)
    public ResponseEntity<DecisionErrorResponse> handleCancelled(OrchestrationCancelledException ex) {
        return decisionError(HttpStatus.CONFLICT, "Cancelled", ex.getMessage(), true, ex.getLoanId());
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleAny(Exception ex, HttpServletRequest req) {
        log.error("Unhandled error on {}", req.getRequestURI(), ex);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", ex.getMessage(), req);
    }

    private ResponseEntity<DecisionErrorResponse> decisionError(HttpStatus status, String error, String message,
                                                                boolean retryable, String loanId) {
        LoanSnapshot loan = loanId == null ? null
                : loans.findById(loanId).map(LoanApplication::snapshot).orElse(null);
        return ResponseEntity.status(status).body(new DecisionErrorResponse(
                Instant.now(), status.value(), error, message, retryable, loan));
    }

    private static Map<String, Object> body(HttpStatus status, String error, String message, HttpServletRequest req) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", Instant.now());
        body.put("status", status.value());
        body.put("error", error);
        body.put("message", message);
        body.put("path", req.getRequestURI());
        return body;
    }
}
