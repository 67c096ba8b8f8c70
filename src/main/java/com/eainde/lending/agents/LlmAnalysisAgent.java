package com.eainde.lending.agents;

import com.eainde.lending.model.AgentMemo;
import com.eainde.lending.model.AgentRole;
import com.eainde.lending.model.CategoryScore;
import com.eainde.lending.model.ExtractionResult;
import com.eainde.lending.model.RiskMatrix;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import lombok.extern.log4j.Log4j2;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * {@link AnalysisAgent} backed by a LangChain4j {@link ChatModel}.
 * <p>
 * The model answers with {@code {"memo", "score", "flags"}}. Scores are clamped to [0, 100];
 * a missing score is an abstention. Anything that cannot be parsed is reported as
 * {@link AgentUnavailableException} so the invoker can retry.
 */
@Log4j2
public class LlmAnalysisAgent implements AnalysisAgent {

    private final AgentSpec spec;
    private final ChatModel chatModel;
    private final String systemPrompt;
    private final ObjectMapper objectMapper;

    LlmAnalysisAgent(AgentSpec spec, ChatModel chatModel, String systemPrompt, ObjectMapper objectMapper) {
        this.spec = spec;
        this.chatModel = chatModel;
        this.systemPrompt = systemPrompt;
        this.objectMapper = objectMapper;
    }

    @Override
    public AgentRole role() {
        return spec.getRole();
    }

    @Override
    public Duration timeout() {
        return spec.getTimeout();
    }

    @Override
    public AgentOpinion produceMemo(LoanContext context) {
        if (chatModel == null) {
            throw new AgentUnavailableException(role(), "No chat model configured for " + spec.getAgentName());
        }

        ChatRequest.Builder request = ChatRequest.builder()
                .messages(SystemMessage.from(systemPrompt), UserMessage.from(renderContext(context)));
        if (spec.hasMaxTokens()) {
            request.maxOutputTokens(spec.getMaxTokens());
        }

        ChatResponse response;
        try {
            response = chatModel.chat(request.build());
        } catch (RuntimeException e) {
            throw new AgentUnavailableException(role(), spec.getAgentName() + " model call failed: " + e.getMessage(), e);
        }

        String text = response == null || response.aiMessage() == null ? null : response.aiMessage().text();
        return parse(text);
    }

    AgentOpinion parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new AgentUnavailableException(role(), spec.getAgentName() + " returned an empty response");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(stripCodeFence(raw));
        } catch (JsonProcessingException e) {
            throw new AgentUnavailableException(role(), spec.getAgentName() + " returned malformed JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new AgentUnavailableException(role(), spec.getAgentName() + " did not return a JSON object");
        }

        String memo = root.path("memo").asText("");
        Double score = readScore(root.get("score"));
        List<String> flags = new ArrayList<>();
        JsonNode flagsNode = root.path("flags");
        if (flagsNode.isArray()) {
            flagsNode.forEach(f -> {
                if (!f.isNull() && !f.asText().isBlank()) {
                    flags.add(f.asText().trim());
                }
            });
        }

        log.debug("{} opinion parsed: score={}, flags={}", spec.getAgentName(), score, flags);
        return new AgentOpinion(score, memo, flags);
    }

    private Double readScore(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        double value;
        if (node.isNumber()) {
            value = node.asDouble();
        } else {
            try {
                value = Double.parseDouble(node.asText().trim());
            } catch (NumberFormatException e) {
                throw new AgentUnavailableException(role(),
                        spec.getAgentName() + " returned a non-numeric score: " + node.asText(), e);
            }
        }
        if (Double.isNaN(value)) {
            throw new AgentUnavailableException(role(), spec.getAgentName() + " returned a NaN score");
        }
        return Math.max(0.0, Math.min(100.0, value));
    }

    static String stripCodeFence(String raw) {
        String text = raw.trim();
        if (text.startsWith("```")) {
            int firstNewline = text.indexOf('\n');
            text = firstNewline < 0 ? "" : text.substring(firstNewline + 1);
            if (text.endsWith("```")) {
                text = text.substring(0, text.length() - 3);
            }
        }
        return text.trim();
    }

    // =========================================================================
    //  Prompt rendering
    // =========================================================================

    String renderContext(LoanContext context) {
        StringBuilder sb = new StringBuilder();
        sb.append("Applicant: ").append(context.companyName());
        if (context.industry() != null) {
            sb.append(" (").append(context.industry()).append(')');
        }
        sb.append('\n');
        sb.append(String.format(Locale.ROOT, "Requested amount: %.2f%n", context.requestedAmount()));

        sb.append("\nFinancial data:\n").append(financialsJson(context.financials())).append('\n');

        RiskMatrix matrix = context.riskMatrix();
        if (matrix != null) {
            sb.append("\nRisk matrix (0-10):\n");
            appendCategory(sb, "financial_risk", matrix.financialRisk());
            appendCategory(sb, "growth_strength", matrix.growthStrength());
            appendCategory(sb, "regulatory_risk", matrix.regulatoryRisk());
            appendCategory(sb, "reputation_risk", matrix.reputationRisk());
        }

        if (!context.priorMemos().isEmpty()) {
            sb.append("\nPrior agent memos:\n");
            for (AgentMemo memo : context.priorMemos()) {
                sb.append('[').append(memo.agentType().displayName()).append("] (score ")
                        .append(memo.hasScore() ? String.format(Locale.ROOT, "%.0f", memo.riskScore()) : "n/a")
                        .append("): ").append(memo.narrative()).append('\n');
            }
        }
        if (context.divergence() != null) {
            sb.append(String.format(Locale.ROOT, "%nSales/Risk divergence: %.0f points%n", context.divergence()));
        }
        sb.append("\nReturn JSON only.");
        return sb.toString();
    }

    private String financialsJson(ExtractionResult financials) {
        if (financials == null) {
            return "{} (extraction unavailable)";
        }
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(ExtractionResult.REVENUE, financials.revenue());
        map.put(ExtractionResult.DEBT, financials.debt());
        map.put(ExtractionResult.DSCR, financials.dscr());
        map.put(ExtractionResult.COLLATERAL_PRESENT, financials.collateralPresent());
        map.put(ExtractionResult.COMPLIANCE_KEYWORDS, financials.complianceKeywords());
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(map);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not render financials for " + spec.getAgentName(), e);
        }
    }

    private static void appendCategory(StringBuilder sb, String name, CategoryScore category) {
        sb.append("- ").append(name).append(": ").append(category.score())
                .append(" (").append(String.join("; ", category.evidence())).append(")\n");
    }
}
