package com.dfsoptimizer.unit.simulation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;

import com.dfsoptimizer.core.CancellationToken;
import com.dfsoptimizer.correlation.CorrelationMatrix;
import com.dfsoptimizer.correlation.CorrelationMatrixBuilder;
import com.dfsoptimizer.correlation.CorrelationRuleGenerator;
import com.dfsoptimizer.domain.enums.ContestType;
import com.dfsoptimizer.domain.enums.DistributionMode;
import com.dfsoptimizer.domain.model.Lineup;
import com.dfsoptimizer.domain.model.Player;
import com.dfsoptimizer.event.EventPublisherHelper;
import com.dfsoptimizer.exception.ResourceBudgetExceededException;
import com.dfsoptimizer.exception.ValidationException;
import com.dfsoptimizer.pool.PlayerPool;
import com.dfsoptimizer.simulation.PlayerOutcomeSummary;
import com.dfsoptimizer.simulation.SimulationEngine;
import com.dfsoptimizer.simulation.SimulationReport;
import com.dfsoptimizer.simulation.SimulationResult;
import com.dfsoptimizer.simulation.SimulationSettings;
import com.dfsoptimizer.unit.SlateFixtures;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@ExtendWith(MockitoExtension.class)
class SimulationEngineTest {

    @Mock
    private EventPublisherHelper eventPublisherHelper;

    private final List<ThreadPoolTaskExecutor> executors = new ArrayList<>();

    private PlayerPool pool;
    private CorrelationMatrix matrix;
    private List<Lineup> lineups;

    @BeforeEach
    void setUp() {
        pool = SlateFixtures.dkNflPool();
        CorrelationRuleGenerator generator = new CorrelationRuleGenerator();
        matrix = new CorrelationMatrixBuilder().build(pool, generator.generate(pool, 1.0));
        lineups = List.of(
                SlateFixtures.lineup("stack", 0, 150.0, SlateFixtures.byIds(pool,
                        "kc-qb", "kc-rb", "dal-rb", "kc-wr1", "buf-wr2", "phi-wr2", "buf-te", "phi-rb2", "dal-dst")),
                SlateFixtures.lineup("contrarian", 1, 140.0, SlateFixtures.byIds(pool,
                        "buf-qb", "phi-rb2", "dal-rb", "dal-wr", "phi-wr2", "buf-wr2", "dal-te", "buf-rb", "kc-dst")));
    }

    @AfterEach
    void tearDown() {
        executors.forEach(ThreadPoolTaskExecutor::shutdown);
    }

    @Nested
    @DisplayName("Determinism")
    class Determinism {

        @Test
        @DisplayName("same seed gives identical results regardless of worker count")
        void identicalAcrossPoolSizes() {
            SimulationSettings settings = settings(6_000, 1_000);

            SimulationReport single = engine(1).simulate(lineups, pool, matrix, settings);
            SimulationReport parallel = engine(4).simulate(lineups, pool, matrix, settings);

            for (int i = 0; i < lineups.size(); i++) {
                SimulationResult a = single.getResults().get(i);
                SimulationResult b = parallel.getResults().get(i);
                assertThat(b.getMeanScore()).isEqualTo(a.getMeanScore());
                assertThat(b.getStdDev()).isEqualTo(a.getStdDev());
                assertThat(b.getP95()).isEqualTo(a.getP95());
                assertThat(b.getRoi()).isEqualTo(a.getRoi());
            }
        }

        @Test
        @DisplayName("a different seed changes the sample")
        void differentSeed() {
            SimulationEngine engine = engine(2);

            SimulationReport first = engine.simulate(lineups, pool, matrix, settings(2_000, 500));
            SimulationReport second = engine.simulate(lineups, pool, matrix,
                    SimulationSettings.builder().trials(2_000).chunkSize(500).seed(43L).build());

            assertThat(second.getResults().get(0).getMeanScore())
                    .isNotEqualTo(first.getResults().get(0).getMeanScore());
        }
    }

    @Nested
    @DisplayName("Statistics")
    class Statistics {

        @Test
        @DisplayName("lineup mean converges to the summed projection and percentiles are ordered")
        void convergesToProjection() {
            SimulationReport report = engine(4).simulate(lineups, pool, matrix, settings(20_000, 5_000));

            assertThat(report.getTrialsRun()).isEqualTo(20_000);
            assertThat(report.isCancelled()).isFalse();
            for (int i = 0; i < lineups.size(); i++) {
                SimulationResult result = report.getResults().get(i);
                double projection = lineups.get(i).getTotalProjection();
                assertThat(result.getLineupId()).isEqualTo(lineups.get(i).getLineupId());
                assertThat(result.getMeanScore()).isCloseTo(projection, within(projection * 0.02));
                assertThat(result.getP5()).isLessThanOrEqualTo(result.getP25());
                assertThat(result.getP25()).isLessThanOrEqualTo(result.getP50());
                assertThat(result.getP50()).isLessThanOrEqualTo(result.getP75());
                assertThat(result.getP75()).isLessThanOrEqualTo(result.getP95());
                assertThat(result.getProbabilityAboveTarget()).isBetween(0.0, 1.0);
                assertThat(result.getWinProbability()).isBetween(0.0, 1.0);
                assertThat(result.getExpectedRank()).isBetween(1.0, 10_000.0);
                assertThat(result.getRoi()).isGreaterThanOrEqualTo(-1.0);
            }
            verify(eventPublisherHelper).publishSimulationCompleted(any(), any(SimulationReport.class));
        }

        @Test
        @DisplayName("a positively correlated stack has a wider spread than its independent sum")
        void correlationWidensStack() {
            CorrelationMatrix independent = new CorrelationMatrixBuilder().build(pool, List.of());
            SimulationEngine engine = engine(2);

            double correlated = engine.simulate(lineups, pool, matrix, settings(20_000, 5_000))
                    .getResults().get(0).getStdDev();
            double uncorrelated = engine.simulate(lineups, pool, independent, settings(20_000, 5_000))
                    .getResults().get(0).getStdDev();

            assertThat(correlated).isGreaterThan(uncorrelated);
        }

        @Test
        @DisplayName("lineup std-dev converges to the analytic value from the correlation matrix")
        void stdDevMatchesCovariance() {
            List<Player> players = new ArrayList<>();
            for (Player player : SlateFixtures.dkNflPlayers()) {
                players.add(player.toBuilder().stdDev(player.getProjection() * 0.25).build());
            }
            PlayerPool tight = PlayerPool.load(players);
            CorrelationMatrix stacked = new CorrelationMatrixBuilder()
                    .build(tight, new CorrelationRuleGenerator().generate(tight, 1.0));
            List<Player> roster = SlateFixtures.byIds(tight,
                    "kc-qb", "kc-rb", "dal-rb", "kc-wr1", "buf-wr2", "phi-wr2", "kc-te", "phi-rb2", "buf-dst");
            double variance = 0.0;
            for (Player a : roster) {
                for (Player b : roster) {
                    variance += stacked.get(a.getId(), b.getId()) * a.getEffectiveStdDev() * b.getEffectiveStdDev();
                }
            }
            double analytic = Math.sqrt(variance);

            SimulationReport report = engine(4).simulate(
                    List.of(SlateFixtures.lineup("kc-stack", 0, 1.0, roster)), tight, stacked, settings(40_000, 5_000));

            assertThat(report.getResults().get(0).getStdDev()).isCloseTo(analytic, within(analytic * 0.02));
        }

        @Test
        @DisplayName("player outcomes cover every lineup player with boom and bust rates in [0, 1]")
        void playerOutcomes() {
            SimulationReport report = engine(2).simulate(lineups, pool, matrix, settings(4_000, 1_000));

            assertThat(report.getPlayerOutcomes())
                    .extracting(PlayerOutcomeSummary::getPlayerId)
                    .contains("kc-qb", "buf-qb", "kc-dst");
            assertThat(report.getPlayerOutcomes()).allSatisfy(outcome -> {
                assertThat(outcome.getBoomRate()).isBetween(0.0, 1.0);
                assertThat(outcome.getBustRate()).isBetween(0.0, 1.0);
            });
            assertThat(report.getRoiDistribution().getLineups()).isEqualTo(2);
            assertThat(report.getSimulatedPlayers()).isEqualTo(pool.size());
        }

        @Test
        @DisplayName("cash contests pay the top 45% at 1.8x, so ROI lies in [-1, 0.8]")
        void cashRoiBounds() {
            SimulationSettings cash = SimulationSettings.builder()
                    .trials(4_000)
                    .chunkSize(1_000)
                    .contestType(ContestType.CASH)
                    .fieldSize(100)
                    .build();

            SimulationReport report = engine(2).simulate(lineups, pool, matrix, cash);

            assertThat(report.getResults()).allSatisfy(r -> assertThat(r.getRoi()).isBetween(-1.0, 0.8));
        }

        @Test
        @DisplayName("entry fee turns ROI into expected payout and profit per lineup and in total")
        void entryFeeScalesProfit() {
            SimulationSettings cash = SimulationSettings.builder()
                    .trials(4_000)
                    .chunkSize(1_000)
                    .contestType(ContestType.CASH)
                    .fieldSize(100)
                    .entryFee(50.0)
                    .build();

            SimulationReport report = engine(2).simulate(lineups, pool, matrix, cash);

            assertThat(report.getEntryFee()).isEqualTo(50.0);
            assertThat(report.getTotalEntryFees()).isEqualTo(100.0);
            assertThat(report.getResults()).allSatisfy(r -> {
                assertThat(r.getEntryFee()).isEqualTo(50.0);
                assertThat(r.getExpectedProfit()).isCloseTo(r.getRoi() * 50.0, within(1e-9));
                assertThat(r.getExpectedPayout()).isCloseTo((1.0 + r.getRoi()) * 50.0, within(1e-9));
                assertThat(r.getExpectedProfit()).isBetween(-50.0, 40.0);
            });
            double summed = report.getResults().stream().mapToDouble(SimulationResult::getExpectedProfit).sum();
            assertThat(report.getTotalExpectedProfit()).isCloseTo(summed, within(1e-9));
        }

        @Test
        @DisplayName("lognormal and empirical modes run and stay non-negative")
        void otherDistributionModes() {
            List<Player> players = SlateFixtures.dkNflPlayers();
            players.set(0, players.get(0).toBuilder().historicalScores(List.of(12.0, 18.0, 25.0, 31.0)).build());
            PlayerPool withHistory = PlayerPool.load(players);
            CorrelationMatrix flat = new CorrelationMatrixBuilder().build(withHistory, List.of());
            List<Lineup> seeded = List.of(SlateFixtures.lineup("h", 0, 1.0, SlateFixtures.byIds(withHistory,
                    "kc-qb", "kc-rb", "dal-rb", "kc-wr1", "buf-wr2", "phi-wr2", "buf-te", "phi-rb2", "dal-dst")));

            for (DistributionMode mode : List.of(DistributionMode.LOGNORMAL, DistributionMode.EMPIRICAL)) {
                SimulationReport report = engine(2).simulate(seeded, withHistory, flat,
                        SimulationSettings.builder().trials(2_000).chunkSize(500).distributionMode(mode).build());
                assertThat(report.getResults().get(0).getP5()).isGreaterThanOrEqualTo(0.0);
                assertThat(report.getDistributionMode()).isEqualTo(mode);
            }
        }
    }

    @Nested
    @DisplayName("Budgets and input errors")
    class Budgets {

        @Test
        @DisplayName("trial count above the budget is refused before sampling")
        void trialBudget() {
            SimulationSettings settings = SimulationSettings.builder().trials(5_000).maxTrials(1_000).build();

            assertThatThrownBy(() -> engine(1).simulate(lineups, pool, matrix, settings))
                    .isInstanceOf(ResourceBudgetExceededException.class);
        }

        @Test
        @DisplayName("histogram memory estimate above the budget is refused")
        void memoryBudget() {
            SimulationSettings settings = SimulationSettings.builder()
                    .trials(1_000)
                    .histogramBinWidth(0.001)
                    .maxHistogramBytes(1_024L)
                    .build();

            assertThatThrownBy(() -> engine(1).simulate(lineups, pool, matrix, settings))
                    .isInstanceOf(ResourceBudgetExceededException.class)
                    .hasMessageContaining("Histogram memory");
        }

        @Test
        @DisplayName("a cancelled token stops before the first wave")
        void cancelled() {
            CancellationToken token = CancellationToken.create();
            token.cancel();

            SimulationReport report = engine(1).simulate(lineups, pool, matrix, settings(2_000, 500), token);

            assertThat(report.isCancelled()).isTrue();
            assertThat(report.getTrialsRun()).isZero();
        }

        @Test
        @DisplayName("an empty lineup list is rejected")
        void emptyLineups() {
            assertThatThrownBy(() -> engine(1).simulate(List.of(), pool, matrix, settings(100, 100)))
                    .isInstanceOf(ValidationException.class);
        }
    }

    private SimulationEngine engine(int threads) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(64);
        executor.setThreadNamePrefix("sim-test-");
        executor.initialize();
        executors.add(executor);
        return new SimulationEngine(executor, eventPublisherHelper);
    }

    private static SimulationSettings settings(int trials, int chunkSize) {
        return SimulationSettings.builder().trials(trials).chunkSize(chunkSize).build();
    }
}
