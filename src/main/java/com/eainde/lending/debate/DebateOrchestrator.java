package com.eainde.lending.debate;

import com.eainde.lending.agents.AgentInvocationException;
import com.eainde.lending.agents.AgentInvoker;
import com.eainde.lending.agents.AgentOpinion;
import com.eainde.lending.agents.AgentRoster;
import com.eainde.lending.agents.AnalysisAgent;
import com.eainde.lending.agents.LoanContext;
import com.eainde.lending.model.AgentMemo;
import com.eainde.lending.model.AgentRole;
import com.eainde.lending.thread.MdcAwareExecutor;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

/**
 * Runs the debate protocol over one loan.
 * <p>
 * Round 0 dispatches Sales, Risk and Compliance in parallel, each seeing only the loan itself.
 * Memos reach the {@link MemoSink} in completion order. When Sales and Risk end up more than
 * {@link #DIVERGENCE_THRESHOLD} points apart, a Moderator round runs strictly after both.
 * A failed agent leaves its memo absent; only a round where every agent failed is fatal.
 */
@Log4j2
@Component
public class DebateOrchestrator {

    public static final double DIVERGENCE_THRESHOLD = 20.0;

    static final int ROUND_ZERO = 0;
    static final int MODERATOR_ROUND = 1;

    private final AgentRoster roster;
    private final AgentInvoker invoker;
    private final MdcAwareExecutor executor;

    public DebateOrchestrator(AgentRoster roster, AgentInvoker invoker, MdcAwareExecutor executor) {
        this.roster = roster;
        this.invoker = invoker;
        this.executor = executor;
    }

    /**
     * Round 0 followed by the Moderator round when the scores diverge.
     */
    public DebateSession debate(DebateSession session, MemoSink sink) {
        runRoundZero(session, sink);
        if (session.moderatorRequired()) {
            runModerator(session, sink);
        }
        session.moveTo(DebatePhase.DEBATE_DONE);
        return session;
    }

    /**
     * Dispatches every round-0 role still missing from the session and waits for all of them.
     *
     * @throws OrchestrationFailedException     if no round-0 memo exists afterwards
     * @throws OrchestrationCancelledException  if the calling thread is interrupted
     */
    public void runRoundZero(DebateSession session, MemoSink sink) {
        LoanContext context = session.context();
        List<AgentRole> roles = session.missingRoundZeroRoles();
        if (roles.isEmpty()) {
            log.info("Round 0 already complete for loan {}", context.loanId());
            session.moveTo(DebatePhase.ROUND_0_COMPLETE);
            return;
        }

        log.info("Dispatching round 0 for loan {}: {}", context.loanId(), roles);
        List<Future<AgentMemo>> inFlight = new ArrayList<>();
        for (AgentRole role : roles) {
            AnalysisAgent agent = roster.get(role);
            inFlight.add(executor.submit(() -> runAgent(session, agent, context, ROUND_ZERO, sink)));
        }

        try {
            for (Future<AgentMemo> future : inFlight) {
                future.get();
            }
        } catch (InterruptedException e) {
            session.cancel();
            inFlight.forEach(f -> f.cancel(true));
            Thread.currentThread().interrupt();
            throw new OrchestrationCancelledException(context.loanId());
        } catch (ExecutionException e) {
            session.cancel();
            inFlight.forEach(f -> f.cancel(true));
            Throwable cause = e.getCause();
            if (cause instanceof InterruptedException) {
                throw new OrchestrationCancelledException(context.loanId());
            }
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Round 0 failed for loan " + context.loanId(), cause);
        }

        if (session.roundZeroMemos().isEmpty()) {
            throw new OrchestrationFailedException(context.loanId(),
                    "All round-0 agents failed for loan " + context.loanId() + ": " + describe(session.failures()));
        }
        session.moveTo(DebatePhase.ROUND_0_COMPLETE);

        Double divergence = session.divergence();
        log.info("Round 0 complete for loan {}: sales={}, risk={}, divergence={}",
                context.loanId(), session.salesScore(), session.riskScore(), divergence);
    }

    /**
     * Synthesis round. Its input carries both round-0 positions and the divergence, and its
     * narrative always states the divergence.
     */
    public AgentMemo runModerator(DebateSession session, MemoSink sink) {
        Double divergence = session.divergence();
        if (divergence == null) {
            throw new IllegalStateException("Moderator needs both Sales and Risk scores for loan "
                    + session.context().loanId());
        }
        if (session.moderatorMemo() != null) {
            session.moveTo(DebatePhase.MODERATOR_COMPLETE);
            return session.moderatorMemo();
        }

        session.moveTo(DebatePhase.MODERATOR_PENDING);
        log.info("Sales/Risk divergence {} exceeds {} for loan {}, running moderator",
                divergence, DIVERGENCE_THRESHOLD, session.context().loanId());

        LoanContext moderatorContext = session.context().withDebate(session.roundZeroMemos(), divergence);
        AgentMemo memo;
        try {
            memo = invokeModerator(session, moderatorContext, divergence, sink);
        } catch (InterruptedException e) {
            session.cancel();
            Thread.currentThread().interrupt();
            throw new OrchestrationCancelledException(session.context().loanId());
        }
        session.moveTo(DebatePhase.MODERATOR_COMPLETE);
        return memo;
    }

    private AgentMemo invokeModerator(DebateSession session, LoanContext context, double divergence,
                                      MemoSink sink) throws InterruptedException {
        AnalysisAgent moderator = roster.get(AgentRole.MODERATOR);
        try {
            AgentOpinion opinion = invoker.invoke(moderator, context);
            AgentOpinion framed = new AgentOpinion(opinion.riskScore(),
                    withDivergence(opinion.narrative(), divergence), opinion.flags());
            AgentMemo memo = sink.append(AgentRole.MODERATOR, MODERATOR_ROUND, framed);
            if (memo != null) {
                session.recordModerator(memo);
            }
            return memo;
        } catch (AgentInvocationException e) {
            session.recordFailure(e);
            sink.failed(e, MODERATOR_ROUND);
            return null;
        }
    }

    private AgentMemo runAgent(DebateSession session, AnalysisAgent agent, LoanContext context,
                               int round, MemoSink sink) throws InterruptedException {
        try {
            AgentOpinion opinion = invoker.invoke(agent, context);
            if (session.isCancelled()) {
                return null;
            }
            AgentMemo memo = sink.append(agent.role(), round, opinion);
            if (memo != null) {
                session.recordRoundZero(memo);
            }
            return memo;
        } catch (AgentInvocationException e) {
            session.recordFailure(e);
            if (!session.isCancelled()) {
                sink.failed(e, round);
            }
            return null;
        }
    }

    static String withDivergence(String narrative, double divergence) {
        String magnitude = String.format(Locale.ROOT, "%.0f", divergence);
        String text = narrative == null ? "" : narrative;
        if (text.contains(magnitude)) {
            return text;
        }
        String prefix = "Sales/Risk divergence of " + magnitude + " points.";
        return text.isBlank() ? prefix : prefix + " " + text;
    }

    private static String describe(List<AgentInvocationException> failures) {
        List<String> parts = new ArrayList<>();
        for (AgentInvocationException failure : failures) {
            parts.add(failure.getRole().displayName() + " " + failure.kind());
        }
        return String.join(", ", parts);
    }
}
