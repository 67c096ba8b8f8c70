package com.eainde.lending.model;

import java.time.Instant;

/**
 * Explicit error indicator for a failed orchestration step. Kept on the loan so the
 * API never presents a missing memo as an empty one.
 *
 * @param role null for steps not tied to one agent
 * @param kind e.g. AGENT_TIMEOUT, AGENT_UNAVAILABLE, DECISION_INCOMPLETE
 */
public record AgentStepError(AgentRole role, int round, String kind, String message, Instant occurredAt) {
}
