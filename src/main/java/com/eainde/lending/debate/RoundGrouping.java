package com.eainde.lending.debate;

import com.eainde.lending.model.AgentMemo;
import com.eainde.lending.model.AgentRole;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Groups a loan's memos into debate rounds.
 * <p>
 * The explicit {@link AgentMemo#round()} tag wins. Memos stored without one are placed by
 * position: the n-th memo of a role (counting from 0, in stored order) belongs to round n.
 * The result depends only on the input order, never on timestamps.
 */
public final class RoundGrouping {

    private RoundGrouping() {
    }

    public static SortedMap<Integer, List<AgentMemo>> group(List<AgentMemo> memos) {
        SortedMap<Integer, List<AgentMemo>> rounds = new TreeMap<>();
        Map<AgentRole, Integer> occurrences = new EnumMap<>(AgentRole.class);
        for (AgentMemo memo : memos) {
            int seen = occurrences.merge(memo.agentType(), 1, Integer::sum) - 1;
            int round = memo.round() != null ? memo.round() : seen;
            rounds.computeIfAbsent(round, r -> new ArrayList<>()).add(memo);
        }
        rounds.replaceAll((round, list) -> Collections.unmodifiableList(list));
        return Collections.unmodifiableSortedMap(rounds);
    }

    /**
     * Latest memo per role within one round.
     */
    public static Map<AgentRole, AgentMemo> byRole(List<AgentMemo> memos, int round) {
        Map<AgentRole, AgentMemo> result = new EnumMap<>(AgentRole.class);
        for (AgentMemo memo : group(memos).getOrDefault(round, List.of())) {
            result.put(memo.agentType(), memo);
        }
        return result;
    }
}
