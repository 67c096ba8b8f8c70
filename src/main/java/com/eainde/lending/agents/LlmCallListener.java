package com.eainde.lending.agents;

import dev.langchain4j.model.chat.listener.ChatModelErrorContext;
import dev.langchain4j.model.chat.listener.ChatModelListener;
import dev.langchain4j.model.chat.listener.ChatModelRequestContext;
import dev.langchain4j.model.chat.listener.ChatModelResponseContext;
import dev.langchain4j.model.output.TokenUsage;
import lombok.extern.log4j.Log4j2;

/**
 * Logs latency and token usage of every agent model call. The MDC already carries
 * {@code loanId} and {@code agent}, so each line is attributable.
 */
@Log4j2
public class LlmCallListener implements ChatModelListener {

    static final String START_TIME = "startTime";

    @Override
    public void onRequest(ChatModelRequestContext requestContext) {
        log.debug("Sending {} messages to model", requestContext.chatRequest().messages().size());
        requestContext.attributes().put(START_TIME, System.currentTimeMillis());
    }

    @Override
    public void onResponse(ChatModelResponseContext responseContext) {
        Object startTime = responseContext.attributes().get(START_TIME);
        long duration = startTime instanceof Long start ? System.currentTimeMillis() - start : -1;

        TokenUsage usage = responseContext.chatResponse().tokenUsage();
        if (usage == null) {
            log.info("Model responded in {}ms", duration);
            return;
        }
        log.info("Model responded in {}ms, tokens input={} output={} total={}",
                duration, usage.inputTokenCount(), usage.outputTokenCount(), usage.totalTokenCount());
    }

    @Override
    public void onError(ChatModelErrorContext errorContext) {
        log.error("LLM interaction failed", errorContext.error());
    }
}
