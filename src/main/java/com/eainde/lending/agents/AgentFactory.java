package com.eainde.lending.agents;

import com.eainde.lending.model.AgentRole;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.chat.ChatModel;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Factory that builds debate agents from {@link AgentSpec} definitions.
 *
 * Centralizes all agent construction logic in one place:
 *   - Resolves the system prompt for the role unless the spec overrides it
 *   - Picks the spec's own ChatModel or the shared one
 *   - Assembles the per-role roster the orchestrator dispatches
 *
 * Usage in config:
 *   AnalysisAgent sales  = agentFactory.create(salesSpec);
 *   AgentRoster roster   = agentFactory.roster(salesSpec, riskSpec, complianceSpec, moderatorSpec);
 *
 * When no ChatModel is configured the agents still build, but every call fails with
 * {@link AgentUnavailableException}.
 */
@Log4j2
@Component
public class AgentFactory {

    private final ChatModel chatModel;
    private final ObjectMapper objectMapper;

    public AgentFactory(Optional<ChatModel> chatModel, ObjectMapper objectMapper) {
        this.chatModel = chatModel.orElse(null);
        this.objectMapper = objectMapper;
        if (this.chatModel == null) {
            log.warn("No ChatModel configured, debate agents will report as unavailable");
        }
    }

    // =========================================================================
    //  Core: Build a single agent from a spec
    // =========================================================================

    public AnalysisAgent create(AgentSpec spec) {
        log.debug("Building agent: {}", spec);
        ChatModel model = spec.hasModelOverride() ? spec.getChatModel() : chatModel;
        String prompt = spec.hasSystemPrompt() ? spec.getSystemPrompt() : AgentPrompts.forRole(spec.getRole());
        return new LlmAnalysisAgent(spec, model, prompt, objectMapper);
    }

    // =========================================================================
    //  Composition: Roster
    // =========================================================================

    /**
     * Builds one agent per spec. Every role must be covered exactly once.
     */
    public AgentRoster roster(AgentSpec... specs) {
        Map<AgentRole, AnalysisAgent> agents = new EnumMap<>(AgentRole.class);
        for (AgentSpec spec : specs) {
            if (agents.put(spec.getRole(), create(spec)) != null) {
                throw new IllegalArgumentException("Duplicate agent spec for role " + spec.getAgentName());
            }
        }
        return new AgentRoster(agents);
    }
}
