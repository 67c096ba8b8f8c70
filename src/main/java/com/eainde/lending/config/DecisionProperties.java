package com.eainde.lending.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Orchestration tuning, bound from {@code lending.decision.*}.
 */
@Data
@ConfigurationProperties(prefix = "lending.decision")
public class DecisionProperties {

    /** Upper bound for a single agent call. */
    private Duration agentTimeout = Duration.ofSeconds(30);

    /** Pause before the single retry of a failed agent call. */
    private Duration retryBackoff = Duration.ofMillis(500);

    /** Thread name prefix for orchestration workers. */
    private String workerThreadPrefix = "loan-decision";
}
