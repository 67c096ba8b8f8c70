package com.eainde.lending.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Chat model settings, bound from {@code lending.llm.*}. Without an API key no model is built.
 */
@Data
@ConfigurationProperties(prefix = "lending.llm")
public class LlmProperties {

    private String apiKey;
    private String modelName = "gpt-4o-mini";
    private double temperature = 0.0;
    private int maxTokens = 800;
    private Duration timeout = Duration.ofSeconds(60);
    private boolean logRequests = false;
}
