package com.eainde.lending.execution;

import java.time.Instant;
import java.util.Map;

/**
 * One step of a loan's decision run, kept for audit and debugging.
 */
public record AuditEvent(
        long sequence,
        String loanId,
        String runId,
        AuditEventType eventType,
        Map<String, Object> details,
        Instant occurredAt
) {

    public AuditEvent {
        details = details == null ? Map.of() : Map.copyOf(details);
    }
}
