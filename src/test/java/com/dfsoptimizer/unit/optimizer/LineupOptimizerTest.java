package com.dfsoptimizer.unit.optimizer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doCallRealMethod;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;

import com.dfsoptimizer.constraint.ConstraintSet;
import com.dfsoptimizer.constraint.LineupCandidate;
import com.dfsoptimizer.constraint.StackRule;
import com.dfsoptimizer.core.CancellationToken;
import com.dfsoptimizer.domain.enums.BatchStatus;
import com.dfsoptimizer.domain.enums.BatchStopReason;
import com.dfsoptimizer.domain.enums.InfeasibilityCause;
import com.dfsoptimizer.domain.enums.ObjectiveType;
import com.dfsoptimizer.domain.model.Lineup;
import com.dfsoptimizer.domain.model.Player;
import com.dfsoptimizer.event.EventPublisherHelper;
import com.dfsoptimizer.exception.InfeasibleException;
import com.dfsoptimizer.exception.SolverTimeoutException;
import com.dfsoptimizer.optimizer.MipSolver;
import com.dfsoptimizer.optimizer.LineupOptimizer;
import com.dfsoptimizer.optimizer.OptimizationResult;
import com.dfsoptimizer.optimizer.OptimizerSettings;
import com.dfsoptimizer.pool.PlayerPool;
import com.dfsoptimizer.unit.SlateFixtures;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class LineupOptimizerTest {

    @Mock
    private EventPublisherHelper eventPublisherHelper;

    private MipSolver solver;
    private LineupOptimizer optimizer;
    private PlayerPool pool;

    @BeforeEach
    void setUp() {
        solver = spy(new MipSolver());
        optimizer = new LineupOptimizer(solver, eventPublisherHelper);
        pool = SlateFixtures.dkNflPool();
    }

    @Nested
    @DisplayName("Full batches")
    class FullBatches {

        @Test
        @DisplayName("5 lineups with min-unique 2: legal, distinct, at most 7 shared players")
        void fiveDistinctLineups() {
            ConstraintSet constraints =
                    SlateFixtures.dkNflConstraints(pool, SlateFixtures.defaultRules().minUniquePlayers(2));

            OptimizationResult result = optimizer.optimize(constraints, settings(5));

            assertThat(result.getStatus()).isEqualTo(BatchStatus.COMPLETE);
            assertThat(result.getDelivered()).isEqualTo(5);
            assertThat(result.isPartial()).isFalse();
            List<Lineup> lineups = result.getLineups();
            for (int i = 0; i < lineups.size(); i++) {
                Lineup lineup = lineups.get(i);
                assertThat(lineup.getAssignments()).hasSize(9);
                assertThat(lineup.getPlayerIds()).hasSize(9);
                assertThat(lineup.getTotalSalary()).isLessThanOrEqualTo(50_000);
                assertThat(count(lineup, "QB")).isEqualTo(1);
                assertThat(count(lineup, "DST")).isEqualTo(1);
                assertThat(constraints.isFeasible(LineupCandidate.from(constraints.getSlotSpec(), lineup))).isTrue();
                for (int j = 0; j < i; j++) {
                    assertThat(lineup.sharedPlayerCount(lineups.get(j))).isLessThanOrEqualTo(7);
                }
            }
            verify(eventPublisherHelper).publishBatchCompleted(any(), eq(result));
        }

        @Test
        @DisplayName("without jitter each lineup scores no higher than the one before")
        void objectiveNonIncreasing() {
            ConstraintSet constraints = SlateFixtures.dkNflConstraints(pool, SlateFixtures.defaultRules());

            List<Lineup> lineups = optimizer.optimize(constraints, settings(4)).getLineups();

            for (int i = 1; i < lineups.size(); i++) {
                assertThat(lineups.get(i).getObjectiveValue())
                        .isLessThanOrEqualTo(lineups.get(i - 1).getObjectiveValue() + 1e-6);
            }
            assertThat(lineups.get(0).getLineupId()).isEqualTo("lineup-001");
        }

        @Test
        @DisplayName("locked players appear in every lineup and banned players in none")
        void locksAndBans() {
            ConstraintSet constraints = SlateFixtures.dkNflConstraints(pool, SlateFixtures.defaultRules()
                    .lockedPlayerIds(Set.of("dal-wr"))
                    .bannedPlayerIds(Set.of("buf-qb")));

            List<Lineup> lineups = optimizer.optimize(constraints, settings(3)).getLineups();

            assertThat(lineups).hasSize(3).allSatisfy(lineup -> {
                assertThat(lineup.contains("dal-wr")).isTrue();
                assertThat(lineup.contains("buf-qb")).isFalse();
            });
        }

        @Test
        @DisplayName("team limit, minimum games and a QB stack with bring-back hold together")
        void teamGamesAndStack() {
            StackRule stack = StackRule.builder()
                    .name("KC stack")
                    .team("KC")
                    .positions(Set.of("QB", "WR", "TE"))
                    .minCount(2)
                    .maxCount(3)
                    .bringBackPositions(Set.of("WR", "TE"))
                    .bringBackMin(1)
                    .build();
            ConstraintSet constraints = SlateFixtures.dkNflConstraints(pool, SlateFixtures.defaultRules()
                    .maxPlayersPerTeam(4)
                    .minGames(2)
                    .stackRules(List.of(stack)));

            List<Lineup> lineups = optimizer.optimize(constraints, settings(3)).getLineups();

            assertThat(lineups).hasSize(3).allSatisfy(lineup -> {
                Set<String> games = lineup.getPlayers().stream()
                        .map(Player::getResolvedGameId)
                        .collect(Collectors.toSet());
                assertThat(games).hasSizeGreaterThanOrEqualTo(2);
                long kc = lineup.getPlayers().stream().filter(p -> p.getTeam().equals("KC")).count();
                assertThat(kc).isLessThanOrEqualTo(4);
                long bringBack = lineup.getPlayers().stream()
                        .filter(p -> p.getTeam().equals("BUF") && (p.hasPosition("WR") || p.hasPosition("TE")))
                        .count();
                assertThat(bringBack).isGreaterThanOrEqualTo(1);
            });
        }

        @Test
        @DisplayName("same seed and jitter reproduce the same batch")
        void jitterIsSeeded() {
            ConstraintSet constraints = SlateFixtures.dkNflConstraints(pool, SlateFixtures.defaultRules());
            OptimizerSettings jittered = OptimizerSettings.builder()
                    .lineupCount(3)
                    .objective(ObjectiveType.EV)
                    .jitterPercent(15.0)
                    .seed(7L)
                    .build();

            List<Set<String>> first = ids(optimizer.optimize(constraints, jittered).getLineups());
            List<Set<String>> second = ids(optimizer.optimize(constraints, jittered).getLineups());

            assertThat(second).isEqualTo(first);
        }
    }

    @Nested
    @DisplayName("Full-size slates")
    class FullSizeSlates {

        @Test
        @DisplayName("320-player, 10-game slate yields 5 distinct lineups at default settings")
        void largeSlateWithinDefaultBudget() {
            PlayerPool large = PlayerPool.load(largeSlate(20, 11L));
            ConstraintSet constraints = SlateFixtures.dkNflConstraints(large, SlateFixtures.defaultRules()
                    .minUniquePlayers(2)
                    .maxPlayersPerTeam(4));
            OptimizerSettings settings = settings(5);

            OptimizationResult result = optimizer.optimize(constraints, settings);

            assertThat(large.size()).isEqualTo(320);
            assertThat(result.getStatus()).isEqualTo(BatchStatus.COMPLETE);
            assertThat(result.isPartial()).isFalse();
            assertThat(result.getDelivered()).isEqualTo(5);
            assertThat(result.getElapsedMs()).isLessThan(5 * settings.getPerLineupTimeoutMs());
            List<Lineup> lineups = result.getLineups();
            assertThat(lineups).allSatisfy(lineup ->
                    assertThat(constraints.isFeasible(LineupCandidate.from(constraints.getSlotSpec(), lineup))).isTrue());
            for (int i = 1; i < lineups.size(); i++) {
                for (int j = 0; j < i; j++) {
                    assertThat(lineups.get(i).sharedPlayerCount(lineups.get(j))).isLessThanOrEqualTo(7);
                }
            }
        }

        @Test
        @DisplayName("a slate rich in running backs still fills WR and TE slots, at most one RB in FLEX")
        void positionBucketsKeepSelectionSeatable() {
            List<Player> players = new ArrayList<>(SlateFixtures.dkNflPlayers());
            for (int i = 0; i < 6; i++) {
                players.add(SlateFixtures.player("cheap-rb" + i, "RB", "DAL", "PHI", 3000, 30.0 - i, 0.05));
            }
            ConstraintSet constraints = SlateFixtures.dkNflConstraints(PlayerPool.load(players), SlateFixtures.defaultRules());

            Lineup lineup = optimizer.optimize(constraints, settings(1)).getLineups().get(0);

            assertThat(count(lineup, "RB")).isEqualTo(3);
            assertThat(count(lineup, "WR")).isEqualTo(3);
            assertThat(count(lineup, "TE")).isEqualTo(1);
            assertThat(lineup.getAssignments())
                    .filteredOn(a -> a.getSlotName().equals("FLEX"))
                    .singleElement()
                    .satisfies(a -> assertThat(a.getPlayer().hasPosition("RB")).isTrue());
        }
    }

    @Nested
    @DisplayName("Infeasible input")
    class InfeasibleInput {

        @Test
        @DisplayName("locked salary above the cap fails with SALARY_CAP before solving")
        void lockedSalaryOverCap() {
            ConstraintSet constraints = SlateFixtures.dkNflConstraints(pool, SlateFixtures.defaultRules()
                    .lockedPlayerIds(Set.of("kc-qb", "buf-wr1", "kc-wr1", "kc-rb", "phi-rb1", "kc-te", "buf-rb")));

            assertThatThrownBy(() -> optimizer.optimize(constraints, settings(1)))
                    .isInstanceOf(InfeasibleException.class)
                    .satisfies(e -> assertThat(((InfeasibleException) e).getInfeasibilityCause())
                            .isEqualTo(InfeasibilityCause.SALARY_CAP));
        }

        @Test
        @DisplayName("more games required than the slate has fails with GAME_DIVERSITY")
        void tooManyGames() {
            ConstraintSet constraints =
                    SlateFixtures.dkNflConstraints(pool, SlateFixtures.defaultRules().minGames(3));

            assertThatThrownBy(() -> optimizer.optimize(constraints, settings(1)))
                    .isInstanceOf(InfeasibleException.class)
                    .satisfies(e -> assertThat(((InfeasibleException) e).getInfeasibilityCause())
                            .isEqualTo(InfeasibilityCause.GAME_DIVERSITY));
        }

        @Test
        @DisplayName("a team limit too tight to fill the roster fails with TEAM_LIMIT")
        void teamLimitTooTight() {
            ConstraintSet constraints =
                    SlateFixtures.dkNflConstraints(pool, SlateFixtures.defaultRules().maxPlayersPerTeam(2));

            assertThatThrownBy(() -> optimizer.optimize(constraints, settings(1)))
                    .isInstanceOf(InfeasibleException.class)
                    .satisfies(e -> assertThat(((InfeasibleException) e).getInfeasibilityCause())
                            .isEqualTo(InfeasibilityCause.TEAM_LIMIT));
        }
    }

    @Nested
    @DisplayName("Partial batches")
    class PartialBatches {

        @Test
        @DisplayName("exhausted diversity returns the lineups found with an INFEASIBLE stop")
        void diversityExhausted() {
            PlayerPool tiny = PlayerPool.load(List.of(
                    SlateFixtures.player("qb", "QB", "KC", "BUF", 6000, 20.0, 0.1),
                    SlateFixtures.player("rb1", "RB", "KC", "BUF", 5000, 15.0, 0.1),
                    SlateFixtures.player("rb2", "RB", "BUF", "KC", 5000, 14.0, 0.1),
                    SlateFixtures.player("wr1", "WR", "KC", "BUF", 5000, 14.0, 0.1),
                    SlateFixtures.player("wr2", "WR", "BUF", "KC", 5000, 13.0, 0.1),
                    SlateFixtures.player("wr3", "WR", "KC", "BUF", 4000, 12.0, 0.1),
                    SlateFixtures.player("wr4", "WR", "BUF", "KC", 4000, 11.0, 0.1),
                    SlateFixtures.player("te", "TE", "KC", "BUF", 4000, 10.0, 0.1),
                    SlateFixtures.player("dst", "DST", "BUF", "KC", 3000, 8.0, 0.1)));
            ConstraintSet constraints = SlateFixtures.dkNflConstraints(tiny, SlateFixtures.defaultRules());

            OptimizationResult result = optimizer.optimize(constraints, settings(3));

            assertThat(result.getDelivered()).isEqualTo(1);
            assertThat(result.getRequested()).isEqualTo(3);
            assertThat(result.isPartial()).isTrue();
            assertThat(result.getStatus()).isEqualTo(BatchStatus.COMPLETE);
            assertThat(result.getStopReason()).isEqualTo(BatchStopReason.INFEASIBLE);
            assertThat(result.getStopCause()).isEqualTo(InfeasibilityCause.UNIQUENESS);
        }

        @Test
        @DisplayName("a solver timeout mid-batch keeps the lineups already emitted")
        void timeoutKeepsEmitted() {
            doCallRealMethod()
                    .doThrow(new SolverTimeoutException("Lineup solve exceeded time budget", 10_000))
                    .when(solver)
                    .solve(any(), anyString(), anyLong());
            ConstraintSet constraints = SlateFixtures.dkNflConstraints(pool, SlateFixtures.defaultRules());

            OptimizationResult result = optimizer.optimize(constraints, settings(3));

            assertThat(result.getDelivered()).isEqualTo(1);
            assertThat(result.getStopReason()).isEqualTo(BatchStopReason.TIMEOUT);
            assertThat(result.getMessage()).contains("time budget");
        }

        @Test
        @DisplayName("a cancelled token stops the batch before the next solve")
        void cancelled() {
            CancellationToken token = CancellationToken.create();
            token.cancel();
            ConstraintSet constraints = SlateFixtures.dkNflConstraints(pool, SlateFixtures.defaultRules());

            OptimizationResult result = optimizer.optimize(constraints, settings(3), token);

            assertThat(result.getStatus()).isEqualTo(BatchStatus.CANCELLED);
            assertThat(result.isCancelled()).isTrue();
            assertThat(result.getDelivered()).isZero();
        }
    }

    private static OptimizerSettings settings(int lineupCount) {
        return OptimizerSettings.builder().lineupCount(lineupCount).build();
    }

    /** Deterministic slate: per team 2 QB, 4 RB, 6 WR, 3 TE and 1 DST, paired into games. */
    private static List<Player> largeSlate(int teams, long seed) {
        Random random = new Random(seed);
        String[] positions = {"QB", "QB", "RB", "RB", "RB", "RB", "WR", "WR", "WR", "WR", "WR", "WR", "TE", "TE", "TE", "DST"};
        List<Player> players = new ArrayList<>();
        for (int t = 0; t < teams; t++) {
            String team = "T" + t;
            String opponent = "T" + (t % 2 == 0 ? t + 1 : t - 1);
            for (int i = 0; i < positions.length; i++) {
                int salary = 3000 + 100 * random.nextInt(60);
                double projection = salary / 1000.0 * (2.0 + random.nextDouble());
                players.add(SlateFixtures.player(
                        team.toLowerCase() + "-" + positions[i].toLowerCase() + i, positions[i], team, opponent,
                        salary, projection, 0.02 + 0.2 * random.nextDouble()));
            }
        }
        return players;
    }

    private static long count(Lineup lineup, String position) {
        return lineup.getPlayers().stream().filter(p -> p.hasPosition(position)).count();
    }

    private static List<Set<String>> ids(List<Lineup> lineups) {
        return lineups.stream().map(Lineup::getPlayerIds).toList();
    }
}
