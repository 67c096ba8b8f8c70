package com.eainde.lending.debate;

import com.eainde.lending.model.AgentMemo;
import com.eainde.lending.model.AgentRole;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;

import static org.assertj.core.api.Assertions.assertThat;

class RoundGroupingTest {

    private static AgentMemo memo(long sequence, AgentRole role, Integer round, double score) {
        return new AgentMemo(sequence, role, round, score, role.displayName() + " #" + sequence, List.of(),
                Instant.parse("2026-01-01T00:00:00Z").plusSeconds(100 - sequence));
    }

    @Test
    @DisplayName("explicit round tags decide the grouping")
    void explicitRounds() {
        List<AgentMemo> memos = List.of(
                memo(1, AgentRole.RISK, 0, 45),
                memo(2, AgentRole.SALES, 0, 85),
                memo(3, AgentRole.COMPLIANCE, 0, 70),
                memo(4, AgentRole.MODERATOR, 1, 60));

        SortedMap<Integer, List<AgentMemo>> rounds = RoundGrouping.group(memos);

        assertThat(rounds.keySet()).containsExactly(0, 1);
        assertThat(rounds.get(0)).extracting(AgentMemo::agentType)
                .containsExactly(AgentRole.RISK, AgentRole.SALES, AgentRole.COMPLIANCE);
        assertThat(rounds.get(1)).extracting(AgentMemo::sequence).containsExactly(4L);
    }

    @Test
    @DisplayName("untagged memos are placed by per-role occurrence, not by timestamp")
    void positional() {
        List<AgentMemo> memos = List.of(
                memo(1, AgentRole.SALES, null, 80),
                memo(2, AgentRole.RISK, null, 40),
                memo(3, AgentRole.SALES, null, 75));

        SortedMap<Integer, List<AgentMemo>> rounds = RoundGrouping.group(memos);

        assertThat(rounds.get(0)).extracting(AgentMemo::sequence).containsExactly(1L, 2L);
        assertThat(rounds.get(1)).extracting(AgentMemo::sequence).containsExactly(3L);
    }

    @Test
    @DisplayName("byRole keeps the latest memo of each role in the round")
    void byRole() {
        List<AgentMemo> memos = List.of(
                memo(1, AgentRole.SALES, 0, 80),
                memo(2, AgentRole.SALES, 0, 82),
                memo(3, AgentRole.MODERATOR, 1, 60));

        Map<AgentRole, AgentMemo> roundZero = RoundGrouping.byRole(memos, 0);

        assertThat(roundZero).containsOnlyKeys(AgentRole.SALES);
        assertThat(roundZero.get(AgentRole.SALES).riskScore()).isEqualTo(82.0);
        assertThat(RoundGrouping.byRole(memos, 5)).isEmpty();
    }

    @Test
    @DisplayName("empty input yields no rounds")
    void empty() {
        assertThat(RoundGrouping.group(List.of())).isEmpty();
    }
}
