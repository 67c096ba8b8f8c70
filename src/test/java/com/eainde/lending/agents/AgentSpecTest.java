package com.eainde.lending.agents;

import com.eainde.lending.model.AgentRole;
import dev.langchain4j.model.chat.ChatModel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

class AgentSpecTest {

    // =========================================================================
    //  Minimal build
    // =========================================================================

    @Nested
    @DisplayName("Minimal spec (only required fields)")
    class MinimalSpec {

        @Test
        @DisplayName("should build with just role and description")
        void minimalBuild() {
            AgentSpec spec = AgentSpec.of(AgentRole.SALES, "Growth reviewer").build();

            assertThat(spec.getRole()).isEqualTo(AgentRole.SALES);
            assertThat(spec.getAgentName()).isEqualTo("Sales");
            assertThat(spec.getDescription()).isEqualTo("Growth reviewer");
        }

        @Test
        @DisplayName("optional fields should be absent")
        void optionalFieldsAbsent() {
            AgentSpec spec = AgentSpec.of(AgentRole.RISK, "Credit").build();

            assertThat(spec.hasSystemPrompt()).isFalse();
            assertThat(spec.hasModelOverride()).isFalse();
            assertThat(spec.hasTimeout()).isFalse();
            assertThat(spec.hasMaxTokens()).isFalse();
            assertThat(spec.getTimeout()).isNull();
        }
    }

    // =========================================================================
    //  Overrides
    // =========================================================================

    @Nested
    @DisplayName("Overrides")
    class Overrides {

        @Test
        @DisplayName("should carry model, prompt, timeout and token overrides")
        void fullSpec() {
            ChatModel model = mock(ChatModel.class);

            AgentSpec spec = AgentSpec.of(AgentRole.COMPLIANCE, "Screening")
                    .chatModel(model)
                    .systemPrompt("custom prompt")
                    .timeout(Duration.ofSeconds(10))
                    .maxTokens(300)
                    .build();

            assertThat(spec.getChatModel()).isSameAs(model);
            assertThat(spec.getSystemPrompt()).isEqualTo("custom prompt");
            assertThat(spec.getTimeout()).isEqualTo(Duration.ofSeconds(10));
            assertThat(spec.getMaxTokens()).isEqualTo(300);
            assertThat(spec.toString())
                    .isEqualTo("Compliance +model +prompt timeout=PT10S maxTokens=300");
        }
    }

    // =========================================================================
    //  Validation
    // =========================================================================

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        @DisplayName("should reject a missing role")
        void nullRole() {
            assertThatThrownBy(() -> AgentSpec.of(null, "nobody").build())
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("role is required");
        }

        @Test
        @DisplayName("should reject a blank system prompt")
        void blankPrompt() {
            assertThatThrownBy(() -> AgentSpec.of(AgentRole.SALES, "x").systemPrompt("  ").build())
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("systemPrompt");
        }

        @Test
        @DisplayName("should reject zero or negative timeouts")
        void badTimeout() {
            assertThatThrownBy(() -> AgentSpec.of(AgentRole.RISK, "x").timeout(Duration.ZERO).build())
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> AgentSpec.of(AgentRole.RISK, "x").timeout(Duration.ofSeconds(-1)).build())
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("should reject non-positive maxTokens")
        void badMaxTokens() {
            assertThatThrownBy(() -> AgentSpec.of(AgentRole.MODERATOR, "x").maxTokens(0).build())
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("maxTokens");
        }
    }
}
