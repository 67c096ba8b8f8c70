package com.eainde.lending.execution;

import com.eainde.lending.workflow.WorkflowEngine;
import lombok.extern.log4j.Log4j2;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory, append-only audit log per loan.
 * <p>
 * Events are written as each step completes, so a run that crashes or is cancelled midway
 * still shows how far it got. Null detail values are dropped.
 */
@Log4j2
@Component
public class AuditTrail {

    private final Map<String, List<AuditEvent>> events = new ConcurrentHashMap<>();

    public AuditEvent record(String loanId, AuditEventType type, Object... keyValues) {
        Map<String, Object> details = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            if (keyValues[i + 1] != null) {
                details.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
            }
        }

        List<AuditEvent> timeline = events.computeIfAbsent(loanId, id -> new ArrayList<>());
        synchronized (timeline) {
            AuditEvent event = new AuditEvent(timeline.size() + 1L, loanId, MDC.get(WorkflowEngine.RUN_ID), type,
                    details, Instant.now());
            timeline.add(event);
            log.debug("Audit {} #{} {} {}", loanId, event.sequence(), type, details);
            return event;
        }
    }

    public List<AuditEvent> eventsFor(String loanId) {
        List<AuditEvent> timeline = events.get(loanId);
        if (timeline == null) {
            return List.of();
        }
        synchronized (timeline) {
            return List.copyOf(timeline);
        }
    }
}
