package com.eainde.lending.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;

/**
 * Closed set of debate participants.
 */
public enum AgentRole {
    SALES("Sales"),
    RISK("Risk"),
    COMPLIANCE("Compliance"),
    MODERATOR("Moderator");

    /** Roles dispatched independently in round 0. */
    public static final List<AgentRole> ROUND_ZERO = List.of(SALES, RISK, COMPLIANCE);

    private final String displayName;

    AgentRole(String displayName) {
        this.displayName = displayName;
    }

    @JsonValue
    public String displayName() {
        return displayName;
    }

    @JsonCreator
    public static AgentRole fromDisplayName(String value) {
        return Arrays.stream(values())
                .filter(r -> r.displayName.equalsIgnoreCase(value) || r.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown agent role: " + value));
    }
}
