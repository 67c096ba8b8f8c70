package com.eainde.lending.agents;

import com.eainde.lending.config.DecisionProperties;
import com.eainde.lending.thread.MdcAwareExecutor;
import lombok.extern.log4j.Log4j2;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Calls an agent with a bounded timeout and retries once after a backoff.
 * The second failure is reported as {@link AgentTimeoutException} or
 * {@link AgentUnavailableException}, whichever happened last.
 */
@Log4j2
@Component
public class AgentInvoker {

    static final int MAX_ATTEMPTS = 2;

    private final MdcAwareExecutor executor;
    private final DecisionProperties properties;

    public AgentInvoker(MdcAwareExecutor executor, DecisionProperties properties) {
        this.executor = executor;
        this.properties = properties;
    }

    /**
     * @throws InterruptedException if the calling debate was cancelled
     */
    public AgentOpinion invoke(AnalysisAgent agent, LoanContext context) throws InterruptedException {
        Duration timeout = agent.timeout() != null ? agent.timeout() : properties.getAgentTimeout();
        String roleName = agent.role().displayName();
        MDC.put("agent", roleName);
        try {
            AgentInvocationException last = null;
            for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
                if (attempt > 1) {
                    log.warn("{} attempt {} failed ({}), retrying in {}ms", roleName, attempt - 1,
                            last.getMessage(), properties.getRetryBackoff().toMillis());
                    Thread.sleep(properties.getRetryBackoff().toMillis());
                }
                try {
                    return callOnce(agent, context, timeout);
                } catch (AgentInvocationException e) {
                    last = e;
                }
            }
            log.error("{} failed after {} attempts: {}", roleName, MAX_ATTEMPTS, last.getMessage());
            throw last;
        } finally {
            MDC.remove("agent");
        }
    }

    private AgentOpinion callOnce(AnalysisAgent agent, LoanContext context, Duration timeout)
            throws InterruptedException {
        Future<AgentOpinion> future = executor.submit(() -> agent.produceMemo(context));
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new AgentTimeoutException(agent.role(),
                    agent.role().displayName() + " did not answer within " + timeout.toMillis() + "ms");
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof AgentInvocationException invocation) {
                throw invocation;
            }
            throw new AgentUnavailableException(agent.role(),
                    agent.role().displayName() + " failed: " + cause, cause);
        }
    }
}
