package com.eainde.lending.config;

import com.eainde.lending.agents.AgentFactory;
import com.eainde.lending.agents.AgentRoster;
import com.eainde.lending.agents.AgentSpec;
import com.eainde.lending.model.AgentRole;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * The four debate participants. Prompts come from the role; only the Moderator, which reads
 * the whole round-0 transcript, gets a larger output budget.
 */
@Configuration
public class DebateAgentsConfig {

    @Bean
    public AgentRoster agentRoster(AgentFactory agentFactory, LlmProperties llm) {
        return agentFactory.roster(
                AgentSpec.of(AgentRole.SALES, "Growth and relationship upside")
                        .build(),
                AgentSpec.of(AgentRole.RISK, "Credit risk, covenants and repayment capacity")
                        .build(),
                AgentSpec.of(AgentRole.COMPLIANCE, "AML, sanctions and jurisdiction screening")
                        .build(),
                AgentSpec.of(AgentRole.MODERATOR, "Synthesis of diverging Sales and Risk positions")
                        .maxTokens(llm.getMaxTokens() * 2)
                        .build()
        );
    }
}
