package com.eainde.lending.agents;

import com.eainde.lending.model.AgentMemo;
import com.eainde.lending.model.AgentRole;
import com.eainde.lending.model.ExtractionResult;
import com.eainde.lending.scoring.RiskMatrixScorer;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LlmAnalysisAgentTest {

    @Mock private ChatModel chatModel;

    private final ObjectMapper objectMapper = new ObjectMapper();

    private LlmAnalysisAgent agent(AgentSpec spec) {
        return new LlmAnalysisAgent(spec, chatModel, "system", objectMapper);
    }

    private LlmAnalysisAgent riskAgent() {
        return agent(AgentSpec.of(AgentRole.RISK, "Credit").build());
    }

    private static LoanContext context() {
        ExtractionResult financials = new ExtractionResult(25_000_000.0, 8_000_000.0, 1.1, false, List.of("offshore"));
        return new LoanContext("loan-1", "Acme Freight", "Logistics", 2_000_000, financials,
                new RiskMatrixScorer().score(financials), null, null);
    }

    // =========================================================================
    //  parse()
    // =========================================================================

    @Nested
    @DisplayName("parse()")
    class Parse {

        @Test
        @DisplayName("reads memo, score and flags")
        void wellFormed() {
            AgentOpinion opinion = riskAgent().parse(
                    "{\"memo\":\"Thin coverage\",\"score\":45,\"flags\":[\"DSCR below covenant\", \" \"]}");

            assertThat(opinion.riskScore()).isEqualTo(45.0);
            assertThat(opinion.narrative()).isEqualTo("Thin coverage");
            assertThat(opinion.flags()).containsExactly("DSCR below covenant");
        }

        @Test
        @DisplayName("strips a markdown code fence")
        void fenced() {
            AgentOpinion opinion = riskAgent().parse("```json\n{\"memo\":\"ok\",\"score\":\"62.5\"}\n```");

            assertThat(opinion.riskScore()).isEqualTo(62.5);
        }

        @Test
        @DisplayName("clamps out-of-range scores into [0, 100]")
        void clamps() {
            assertThat(riskAgent().parse("{\"score\":140}").riskScore()).isEqualTo(100.0);
            assertThat(riskAgent().parse("{\"score\":-3}").riskScore()).isEqualTo(0.0);
        }

        @Test
        @DisplayName("a missing or null score is an abstention")
        void abstains() {
            assertThat(riskAgent().parse("{\"memo\":\"not enough data\"}").riskScore()).isNull();
            assertThat(riskAgent().parse("{\"memo\":\"x\",\"score\":null}").riskScore()).isNull();
        }

        @Test
        @DisplayName("unusable output is reported as unavailable")
        void malformed() {
            assertThatThrownBy(() -> riskAgent().parse("I think this loan is fine"))
                    .isInstanceOf(AgentUnavailableException.class)
                    .hasMessageContaining("malformed JSON");
            assertThatThrownBy(() -> riskAgent().parse("{\"score\":\"high\"}"))
                    .isInstanceOf(AgentUnavailableException.class)
                    .hasMessageContaining("non-numeric score");
            assertThatThrownBy(() -> riskAgent().parse("[1,2]"))
                    .isInstanceOf(AgentUnavailableException.class);
            assertThatThrownBy(() -> riskAgent().parse("  "))
                    .isInstanceOf(AgentUnavailableException.class);
        }
    }

    // =========================================================================
    //  produceMemo()
    // =========================================================================

    @Nested
    @DisplayName("produceMemo()")
    class Produce {

        @Test
        @DisplayName("sends the rendered loan and honours maxTokens")
        void request() {
            when(chatModel.chat(any(ChatRequest.class))).thenReturn(ChatResponse.builder()
                    .aiMessage(AiMessage.from("{\"memo\":\"Fine\",\"score\":30}"))
                    .build());

            AgentOpinion opinion = agent(AgentSpec.of(AgentRole.RISK, "Credit").maxTokens(256).build())
                    .produceMemo(context());

            ArgumentCaptor<ChatRequest> captor = ArgumentCaptor.forClass(ChatRequest.class);
            verify(chatModel).chat(captor.capture());
            assertThat(captor.getValue().maxOutputTokens()).isEqualTo(256);
            assertThat(opinion.riskScore()).isEqualTo(30.0);
        }

        @Test
        @DisplayName("wraps backend failures")
        void backendFailure() {
            when(chatModel.chat(any(ChatRequest.class))).thenThrow(new RuntimeException("429 Too Many Requests"));

            AgentUnavailableException failure = catchThrowableOfType(
                    () -> riskAgent().produceMemo(context()), AgentUnavailableException.class);

            assertThat(failure).hasMessageContaining("429");
            assertThat(failure.getRole()).isEqualTo(AgentRole.RISK);
            assertThat(failure.kind()).isEqualTo("AGENT_UNAVAILABLE");
        }
    }

    // =========================================================================
    //  renderContext()
    // =========================================================================

    @Nested
    @DisplayName("renderContext()")
    class Render {

        @Test
        @DisplayName("round-0 prompt carries financials and matrix but no other memos")
        void roundZero() {
            String prompt = riskAgent().renderContext(context());

            assertThat(prompt).contains("Applicant: Acme Freight (Logistics)", "\"dscr\" : 1.1",
                    "- financial_risk: 6", "Keyword detected: offshore");
            assertThat(prompt).doesNotContain("Prior agent memos", "divergence");
        }

        @Test
        @DisplayName("moderator prompt carries prior memos and divergence")
        void moderator() {
            AgentMemo sales = new AgentMemo(1, AgentRole.SALES, 0, 85.0, "Strong growth", List.of(), Instant.now());
            AgentMemo risk = new AgentMemo(2, AgentRole.RISK, 0, 45.0, "Thin coverage", List.of(), Instant.now());

            String prompt = riskAgent().renderContext(context().withDebate(List.of(sales, risk), 40.0));

            assertThat(prompt).contains("[Sales] (score 85): Strong growth", "[Risk] (score 45): Thin coverage",
                    "Sales/Risk divergence: 40 points");
        }

        @Test
        @DisplayName("missing extraction is rendered explicitly")
        void noFinancials() {
            LoanContext bare = new LoanContext("loan-2", "Acme", null, 10_000, null, null, null, null);

            assertThat(riskAgent().renderContext(bare)).contains("{} (extraction unavailable)");
        }
    }
}
