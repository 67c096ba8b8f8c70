package com.eainde.lending.workflow;

import lombok.extern.log4j.Log4j2;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.RunnableConfig;
import org.bsc.langgraph4j.state.AgentState;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs a named {@link CompiledGraph} bean synchronously under a fresh run id.
 * <p>
 * The run id doubles as the graph thread id and sits on the MDC under {@link #RUN_ID}
 * for the duration of the run, which is how audit events and log lines are tied to it.
 */
@Log4j2
@Service
public class WorkflowEngine {

    public static final String RUN_ID = "runId";

    private final Map<String, CompiledGraph<? extends AgentState>> registry = new ConcurrentHashMap<>();

    public WorkflowEngine(Map<String, CompiledGraph<? extends AgentState>> allGraphs) {
        this.registry.putAll(allGraphs);
        log.info("Registered workflows: {}", registry.keySet());
    }

    /**
     * Runs a workflow to completion on the calling thread.
     *
     * @param beanName the graph bean to execute, e.g. {@code "loanDecisionWorkflow"}
     * @param inputs   initial state for the graph's first node
     * @param <S>      the state type of that graph
     * @return the final state, empty if the graph produced none
     * @throws IllegalArgumentException if no workflow with the given {@code beanName} is registered
     */
    @SuppressWarnings("unchecked")
    public <S extends AgentState> Optional<S> start(String beanName, Map<String, Object> inputs) {

        CompiledGraph<S> graph = (CompiledGraph<S>) registry.get(beanName);
        if (graph == null) {
            throw new IllegalArgumentException("No workflow found with name: " + beanName);
        }

        String runId = UUID.randomUUID().toString();
        MDC.put(RUN_ID, runId);
        try {
            log.info("Starting workflow {} run {}", beanName, runId);
            RunnableConfig config = RunnableConfig.builder()
                    .threadId(runId)
                    .build();
            Optional<S> result = graph.invoke(inputs, config);
            log.info("Workflow {} run {} finished", beanName, runId);
            return result;
        } finally {
            MDC.remove(RUN_ID);
        }
    }
}
