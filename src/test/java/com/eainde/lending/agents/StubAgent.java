package com.eainde.lending.agents;

import com.eainde.lending.model.AgentRole;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Scripted {@link AnalysisAgent} for orchestration tests. Records every context it receives.
 */
public class StubAgent implements AnalysisAgent {

    private final AgentRole role;
    private final Function<LoanContext, AgentOpinion> behaviour;
    private final Duration delay;
    private final List<LoanContext> received = new CopyOnWriteArrayList<>();
    private final AtomicInteger calls = new AtomicInteger();

    private StubAgent(AgentRole role, Duration delay, Function<LoanContext, AgentOpinion> behaviour) {
        this.role = role;
        this.delay = delay;
        this.behaviour = behaviour;
    }

    public static StubAgent scoring(AgentRole role, Double score, String... flags) {
        return new StubAgent(role, Duration.ZERO,
                ctx -> new AgentOpinion(score, role.displayName() + " view", List.of(flags)));
    }

    public static StubAgent slow(AgentRole role, Duration delay, Double score) {
        return new StubAgent(role, delay, ctx -> new AgentOpinion(score, role.displayName() + " view", List.of()));
    }

    public static StubAgent failing(AgentRole role) {
        return new StubAgent(role, Duration.ZERO, ctx -> {
            throw new AgentUnavailableException(role, role.displayName() + " backend down");
        });
    }

    public static StubAgent answering(AgentRole role, Function<LoanContext, AgentOpinion> behaviour) {
        return new StubAgent(role, Duration.ZERO, behaviour);
    }

    @Override
    public AgentRole role() {
        return role;
    }

    @Override
    public AgentOpinion produceMemo(LoanContext context) {
        calls.incrementAndGet();
        received.add(context);
        if (!delay.isZero()) {
            try {
                Thread.sleep(delay.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new AgentUnavailableException(role, role.displayName() + " interrupted", e);
            }
        }
        return behaviour.apply(context);
    }

    public int calls() {
        return calls.get();
    }

    public List<LoanContext> received() {
        return List.copyOf(received);
    }
}
