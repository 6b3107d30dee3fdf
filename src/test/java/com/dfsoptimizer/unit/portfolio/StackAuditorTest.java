package com.dfsoptimizer.unit.portfolio;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.dfsoptimizer.domain.model.Lineup;
import com.dfsoptimizer.pool.PlayerPool;
import com.dfsoptimizer.portfolio.StackAuditor;
import com.dfsoptimizer.portfolio.StackAuditor.StackAuditEntry;
import com.dfsoptimizer.unit.SlateFixtures;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class StackAuditorTest {

    private final StackAuditor stackAuditor = new StackAuditor();
    private final PlayerPool pool = SlateFixtures.dkNflPool();

    @Test
    @DisplayName("QB with same-team pass catchers is labelled with the skill count and team")
    void qbStack() {
        Lineup lineup = lineup("kc-qb", "kc-wr1", "kc-te", "buf-wr2", "dal-rb", "phi-rb2");

        assertThat(stackAuditor.classify(lineup)).isEqualTo("QB+2 Stack (KC)");
    }

    @Test
    @DisplayName("two doubled-up teams without a QB stack form a game stack")
    void gameStack() {
        Lineup lineup = lineup("kc-rb", "kc-wr1", "buf-rb", "buf-wr1", "dal-te", "phi-rb1");

        assertThat(stackAuditor.classify(lineup)).isEqualTo("Game Stack (BUF/KC)");
    }

    @Test
    @DisplayName("a QB paired only with his defense is not a stack")
    void qbWithDefenseOnly() {
        Lineup lineup = lineup("kc-qb", "kc-dst", "buf-rb", "dal-wr", "phi-rb1");

        assertThat(stackAuditor.classify(lineup)).isEqualTo("No Stack");
    }

    @Test
    @DisplayName("audit counts labels across the batch, most frequent first")
    void audit() {
        List<Lineup> lineups = List.of(
                lineup("kc-qb", "kc-wr1", "kc-te", "dal-rb"),
                lineup("kc-qb", "kc-wr2", "kc-rb", "dal-rb"),
                lineup("buf-qb", "buf-wr1", "buf-wr2", "dal-rb"));

        List<StackAuditEntry> entries = stackAuditor.audit(lineups);

        assertThat(entries).extracting(StackAuditEntry::getStackType)
                .containsExactly("QB+2 Stack (KC)", "QB+2 Stack (BUF)");
        assertThat(entries.get(0).getCount()).isEqualTo(2);
        assertThat(entries.get(0).getPercentage()).isCloseTo(66.667, within(0.01));
        assertThat(stackAuditor.audit(List.of())).isEmpty();
    }

    private Lineup lineup(String... ids) {
        return SlateFixtures.lineup(String.join("-", ids), 0, 0.0, SlateFixtures.byIds(pool, ids));
    }
}
