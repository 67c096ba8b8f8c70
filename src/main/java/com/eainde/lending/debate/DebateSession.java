package com.eainde.lending.debate;

import com.eainde.lending.agents.AgentInvocationException;
import com.eainde.lending.agents.LoanContext;
import com.eainde.lending.model.AgentMemo;
import com.eainde.lending.model.AgentRole;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Working state of one debate over one loan. Round-0 memos arrive from worker threads.
 */
public class DebateSession {

    private final LoanContext context;
    private final Map<AgentRole, AgentMemo> roundZero = Collections.synchronizedMap(new EnumMap<>(AgentRole.class));
    private final List<AgentInvocationException> failures = Collections.synchronizedList(new ArrayList<>());
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private volatile AgentMemo moderatorMemo;
    private volatile DebatePhase phase = DebatePhase.ROUND_0_PENDING;

    private DebateSession(LoanContext context) {
        this.context = context;
    }

    public static DebateSession start(LoanContext context) {
        return new DebateSession(context);
    }

    /**
     * Rebuilds a session from memos already stored on the loan, so an interrupted run
     * only re-dispatches what is missing.
     */
    public static DebateSession resume(LoanContext context, List<AgentMemo> storedMemos) {
        DebateSession session = new DebateSession(context);
        RoundGrouping.byRole(storedMemos, 0).forEach((role, memo) -> {
            if (AgentRole.ROUND_ZERO.contains(role)) {
                session.roundZero.put(role, memo);
            }
        });
        session.moderatorMemo = RoundGrouping.byRole(storedMemos, 1).get(AgentRole.MODERATOR);
        if (session.missingRoundZeroRoles().isEmpty()) {
            session.phase = session.moderatorMemo != null ? DebatePhase.MODERATOR_COMPLETE : DebatePhase.ROUND_0_COMPLETE;
        }
        return session;
    }

    public LoanContext context() {
        return context;
    }

    public DebatePhase phase() {
        return phase;
    }

    void moveTo(DebatePhase next) {
        this.phase = next;
    }

    void recordRoundZero(AgentMemo memo) {
        roundZero.put(memo.agentType(), memo);
    }

    void recordModerator(AgentMemo memo) {
        this.moderatorMemo = memo;
    }

    void recordFailure(AgentInvocationException failure) {
        failures.add(failure);
    }

    public List<AgentRole> missingRoundZeroRoles() {
        List<AgentRole> missing = new ArrayList<>();
        for (AgentRole role : AgentRole.ROUND_ZERO) {
            if (!roundZero.containsKey(role)) {
                missing.add(role);
            }
        }
        return missing;
    }

    public AgentMemo roundZeroMemo(AgentRole role) {
        return roundZero.get(role);
    }

    public List<AgentMemo> roundZeroMemos() {
        synchronized (roundZero) {
            List<AgentMemo> memos = new ArrayList<>(roundZero.values());
            memos.sort((a, b) -> Long.compare(a.sequence(), b.sequence()));
            return memos;
        }
    }

    public AgentMemo moderatorMemo() {
        return moderatorMemo;
    }

    public List<AgentInvocationException> failures() {
        synchronized (failures) {
            return List.copyOf(failures);
        }
    }

    public Double salesScore() {
        return scoreOf(AgentRole.SALES);
    }

    public Double riskScore() {
        return scoreOf(AgentRole.RISK);
    }

    /**
     * |sales - risk| of round 0, null while either score is unavailable.
     */
    public Double divergence() {
        Double sales = salesScore();
        Double risk = riskScore();
        return sales == null || risk == null ? null : Math.abs(sales - risk);
    }

    public boolean moderatorRequired() {
        Double divergence = divergence();
        return divergence != null && divergence > DebateOrchestrator.DIVERGENCE_THRESHOLD;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    void cancel() {
        cancelled.set(true);
    }

    private Double scoreOf(AgentRole role) {
        AgentMemo memo = roundZero.get(role);
        return memo == null ? null : memo.riskScore();
    }
}
