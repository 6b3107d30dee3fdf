package com.dfsoptimizer.unit.pool;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.offset;

import com.dfsoptimizer.domain.model.Player;
import com.dfsoptimizer.domain.model.RosterSlot;
import com.dfsoptimizer.exception.ValidationException;
import com.dfsoptimizer.pool.PlayerPool;
import com.dfsoptimizer.unit.SlateFixtures;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class PlayerPoolTest {

    @Nested
    @DisplayName("Loading")
    class Loading {

        @Test
        @DisplayName("valid slate loads in input order with stable indexes")
        void validSlateLoads() {
            PlayerPool pool = SlateFixtures.dkNflPool();

            assertThat(pool.size()).isEqualTo(20);
            assertThat(pool.get(0).getId()).isEqualTo("kc-qb");
            assertThat(pool.indexOf("phi-wr2")).isEqualTo(19);
            assertThat(pool.indexOf("nobody")).isEqualTo(-1);
            assertThat(pool.getTeams()).containsExactly("KC", "BUF", "DAL", "PHI");
            assertThat(pool.getGames()).containsExactlyInAnyOrder("BUF@KC", "DAL@PHI");
        }

        @Test
        @DisplayName("empty pool is rejected")
        void emptyPoolRejected() {
            assertThatThrownBy(() -> PlayerPool.load(List.of()))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("must not be empty");
        }

        @Test
        @DisplayName("every bad record is reported at once, keyed by player id")
        @SuppressWarnings("unchecked")
        void reportsEveryBadRecord() {
            List<Player> players = new ArrayList<>(SlateFixtures.dkNflPlayers());
            players.add(SlateFixtures.player("bad-salary", "WR", "KC", "BUF", 0, 5.0, 0.1));
            players.add(SlateFixtures.player("bad-own", "WR", "KC", "BUF", 3000, 5.0, 1.5));
            players.add(SlateFixtures.player("kc-qb", "QB", "KC", "BUF", 3000, 5.0, 0.1));
            players.add(SlateFixtures.player("bad-range", "RB", "KC", "BUF", 3000, 5.0, 0.1).toBuilder()
                    .floor(9.0)
                    .build());

            assertThatThrownBy(() -> PlayerPool.load(players))
                    .isInstanceOf(ValidationException.class)
                    .satisfies(e -> {
                        Map<String, Object> details = ((ValidationException) e).getDetails();
                        assertThat(details).containsOnlyKeys("bad-salary", "bad-own", "kc-qb", "bad-range");
                        assertThat((String) details.get("kc-qb")).isEqualTo("duplicate id");
                    });
        }
    }

    @Nested
    @DisplayName("Slot eligibility")
    class SlotEligibility {

        @Test
        @DisplayName("FLEX takes running backs, receivers and tight ends but no QB or DST")
        void flexSlot() {
            PlayerPool pool = SlateFixtures.dkNflPool();

            List<Player> eligible = pool.eligibleForSlot(RosterSlot.flex("FLEX", "RB", "WR", "TE"));

            assertThat(eligible).hasSize(15);
            assertThat(eligible).extracting(Player::getId).contains("kc-rb", "buf-wr2", "dal-te")
                    .doesNotContain("kc-qb", "buf-dst");
        }

        @Test
        @DisplayName("UTIL takes every position, including dual-eligible players, and skips banned ones")
        void utilSlot() {
            PlayerPool pool = PlayerPool.load(List.of(
                    nba("pg", Set.of("PG")),
                    nba("swing", Set.of("SG", "SF")),
                    nba("c", Set.of("C")),
                    nba("benched", Set.of("PF")).toBuilder().banned(true).build()));

            List<Player> eligible = pool.eligibleForSlot(RosterSlot.flex("UTIL", "PG", "SG", "SF", "PF", "C"));

            assertThat(eligible).extracting(Player::getId).containsExactly("pg", "swing", "c");
        }

        @Test
        @DisplayName("a slot no player can fill yields an empty list")
        void ineligiblePosition() {
            PlayerPool pool = SlateFixtures.dkNflPool();

            assertThat(pool.eligibleForSlot(RosterSlot.of("K"))).isEmpty();
            assertThat(pool.eligibleForSlot(RosterSlot.of("QB"))).extracting(Player::getId)
                    .containsExactly("kc-qb", "buf-qb");
        }

        private Player nba(String id, Set<String> positions) {
            return SlateFixtures.player(id, "PG", "LAL", "BOS", 6000, 30.0, 0.1).toBuilder()
                    .positions(positions)
                    .build();
        }
    }

    @Nested
    @DisplayName("Effective values")
    class EffectiveValues {

        @Test
        @DisplayName("custom projection and boost replace the base projection")
        void customProjectionAndBoost() {
            Player player = SlateFixtures.player("p", "WR", "KC", "BUF", 5000, 10.0, 0.1).toBuilder()
                    .customProjection(12.0)
                    .projectionBoost(10.0)
                    .ownershipOverride(0.3)
                    .build();

            assertThat(player.getEffectiveProjection()).isCloseTo(13.2, offset(1e-9));
            assertThat(player.getEffectiveOwnership()).isEqualTo(0.3);
        }

        @Test
        @DisplayName("std-dev falls back to the floor/ceiling band, then to default volatility")
        void stdDevFallbacks() {
            Player banded = SlateFixtures.player("p", "WR", "KC", "BUF", 5000, 10.0, 0.1).toBuilder()
                    .floor(5.0)
                    .ceiling(21.45)
                    .build();
            Player bare = SlateFixtures.player("q", "WR", "KC", "BUF", 5000, 10.0, 0.1);

            assertThat(banded.getEffectiveStdDev()).isCloseTo(5.0, offset(1e-9));
            assertThat(bare.getEffectiveStdDev()).isCloseTo(10.0 * Player.DEFAULT_VOLATILITY,
                    offset(1e-9));
        }

        @Test
        @DisplayName("positions and score history are copied, so later edits to the inputs do not leak in")
        void collectionsAreCopied() {
            Set<String> positions = new HashSet<>(Set.of("RB"));
            List<Double> history = new ArrayList<>(List.of(12.0, 18.5));
            Player player = SlateFixtures.player("p", "RB", "KC", "BUF", 5000, 10.0, 0.1).toBuilder()
                    .positions(positions)
                    .historicalScores(history)
                    .build();

            positions.add("WR");
            history.clear();

            assertThat(player.getPositions()).containsExactly("RB");
            assertThat(player.getHistoricalScores()).containsExactly(12.0, 18.5);
            assertThatThrownBy(() -> player.getPositions().add("TE"))
                    .isInstanceOf(UnsupportedOperationException.class);
        }

        @Test
        @DisplayName("game id is the same for both sides of a matchup")
        void gameIdIsSymmetric() {
            PlayerPool pool = SlateFixtures.dkNflPool();

            assertThat(pool.getById("kc-qb").getResolvedGameId())
                    .isEqualTo(pool.getById("buf-qb").getResolvedGameId());
        }
    }
}
