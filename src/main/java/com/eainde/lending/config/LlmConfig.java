package com.eainde.lending.config;

import com.eainde.lending.agents.LlmCallListener;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.extern.log4j.Log4j2;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Shared chat model for the debate agents. Only built when {@code lending.llm.api-key} is set;
 * otherwise the agents run without a model and report themselves unavailable.
 */
@Log4j2
@Configuration
public class LlmConfig {

    @Bean
    @ConditionalOnExpression("!'${lending.llm.api-key:}'.isBlank()")
    public ChatModel debateChatModel(LlmProperties properties) {
        log.info("Building chat model {} (temperature {}, maxTokens {})",
                properties.getModelName(), properties.getTemperature(), properties.getMaxTokens());
        return OpenAiChatModel.builder()
                .apiKey(properties.getApiKey())
                .modelName(properties.getModelName())
                .temperature(properties.getTemperature())
                .maxTokens(properties.getMaxTokens())
                .timeout(properties.getTimeout())
                .logRequests(properties.isLogRequests())
                .logResponses(properties.isLogRequests())
                .listeners(List.of(new LlmCallListener()))
                .build();
    }
}
