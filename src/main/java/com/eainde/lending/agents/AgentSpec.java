package com.eainde.lending.agents;

import com.eainde.lending.model.AgentRole;
import dev.langchain4j.model.chat.ChatModel;

import java.time.Duration;

/**
 * Declarative specification for a debate agent.
 *
 * The system prompt is resolved by {@link AgentFactory} from the role unless one is set here.
 * All other settings are optional; only set what each agent actually needs.
 *
 * <pre>
 * // Minimal: role prompt, shared ChatModel, default timeout
 * AgentSpec.of(AgentRole.SALES, "Growth-oriented reviewer").build();
 *
 * // Dedicated model and a tighter timeout
 * AgentSpec.of(AgentRole.COMPLIANCE, "Sanctions and AML screening")
 *          .chatModel(complianceModel)
 *          .timeout(Duration.ofSeconds(10))
 *          .build();
 * </pre>
 */
public class AgentSpec {

    // === Core identity ===
    private final AgentRole role;
    private final String description;
    private final String systemPrompt;

    // === Model override (optional, defaults to shared ChatModel bean) ===
    private final ChatModel chatModel;

    // === Execution ===
    private final Duration timeout;
    private final Integer maxTokens;

    private AgentSpec(Builder builder) {
        this.role = builder.role;
        this.description = builder.description;
        this.systemPrompt = builder.systemPrompt;
        this.chatModel = builder.chatModel;
        this.timeout = builder.timeout;
        this.maxTokens = builder.maxTokens;
    }

    // === Factory ===

    public static Builder of(AgentRole role, String description) {
        return new Builder(role, description);
    }

    // === Getters ===

    public AgentRole getRole() { return role; }
    public String getAgentName() { return role.displayName(); }
    public String getDescription() { return description; }

    public String getSystemPrompt() { return systemPrompt; }
    public boolean hasSystemPrompt() { return systemPrompt != null; }

    public ChatModel getChatModel() { return chatModel; }
    public boolean hasModelOverride() { return chatModel != null; }

    public Duration getTimeout() { return timeout; }
    public boolean hasTimeout() { return timeout != null; }

    public Integer getMaxTokens() { return maxTokens; }
    public boolean hasMaxTokens() { return maxTokens != null; }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(getAgentName());
        if (hasModelOverride()) sb.append(" +model");
        if (hasSystemPrompt()) sb.append(" +prompt");
        if (hasTimeout()) sb.append(" timeout=").append(timeout);
        if (hasMaxTokens()) sb.append(" maxTokens=").append(maxTokens);
        return sb.toString();
    }

    // ==========================================================================
    //  Builder
    // ==========================================================================

    public static class Builder {
        private final AgentRole role;
        private final String description;
        private String systemPrompt;
        private ChatModel chatModel;
        private Duration timeout;
        private Integer maxTokens;

        private Builder(AgentRole role, String description) {
            this.role = role;
            this.description = description;
        }

        /** Replace the built-in role prompt. */
        public Builder systemPrompt(String systemPrompt) {
            this.systemPrompt = systemPrompt;
            return this;
        }

        /** Override the default ChatModel for this specific agent. */
        public Builder chatModel(ChatModel chatModel) {
            this.chatModel = chatModel;
            return this;
        }

        /** Per-call timeout; falls back to {@code lending.decision.agent-timeout}. */
        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder maxTokens(int maxTokens) {
            this.maxTokens = maxTokens;
            return this;
        }

        // --- Build ---

        public AgentSpec build() {
            if (role == null) {
                throw new IllegalArgumentException("role is required for agent: " + description);
            }
            if (systemPrompt != null && systemPrompt.isBlank()) {
                throw new IllegalArgumentException("systemPrompt must not be blank for agent: " + role.displayName());
            }
            if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
                throw new IllegalArgumentException("timeout must be positive for agent: " + role.displayName());
            }
            if (maxTokens != null && maxTokens <= 0) {
                throw new IllegalArgumentException("maxTokens must be positive for agent: " + role.displayName());
            }
            return new AgentSpec(this);
        }
    }
}
