package com.dfsoptimizer.unit.portfolio;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;

import com.dfsoptimizer.domain.enums.ExclusionReason;
import com.dfsoptimizer.domain.enums.ExposureStatus;
import com.dfsoptimizer.domain.model.Lineup;
import com.dfsoptimizer.event.EventPublisherHelper;
import com.dfsoptimizer.exception.ValidationException;
import com.dfsoptimizer.pool.PlayerPool;
import com.dfsoptimizer.portfolio.ExcludedLineup;
import com.dfsoptimizer.portfolio.ExposureReportEntry;
import com.dfsoptimizer.portfolio.ExposureTarget;
import com.dfsoptimizer.portfolio.PortfolioFilter;
import com.dfsoptimizer.portfolio.PortfolioFilterResult;
import com.dfsoptimizer.portfolio.PortfolioThresholds;
import com.dfsoptimizer.simulation.SimulationResult;
import com.dfsoptimizer.unit.SlateFixtures;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class PortfolioFilterTest {

    @Mock
    private EventPublisherHelper eventPublisherHelper;

    private PortfolioFilter portfolioFilter;
    private Lineup a;
    private Lineup b;
    private Lineup c;
    private Lineup d;

    @BeforeEach
    void setUp() {
        portfolioFilter = new PortfolioFilter(eventPublisherHelper);
        PlayerPool pool = SlateFixtures.dkNflPool();
        a = SlateFixtures.lineup("a", 0, 100.0, SlateFixtures.byIds(pool,
                "kc-qb", "kc-wr1", "kc-te", "buf-wr2", "dal-rb", "phi-rb2", "buf-rb", "dal-wr", "dal-dst"));
        b = SlateFixtures.lineup("b", 1, 90.0, SlateFixtures.byIds(pool,
                "kc-qb", "kc-wr2", "kc-rb", "buf-te", "dal-rb", "phi-rb2", "phi-wr1", "dal-wr", "buf-dst"));
        c = SlateFixtures.lineup("c", 2, 80.0, SlateFixtures.byIds(pool,
                "kc-qb", "kc-wr1", "buf-wr1", "buf-te", "dal-te", "phi-rb1", "phi-wr2", "dal-wr", "kc-dst"));
        d = SlateFixtures.lineup("d", 3, 70.0, SlateFixtures.byIds(pool,
                "buf-qb", "buf-wr1", "buf-wr2", "kc-te", "dal-rb", "phi-rb1", "phi-wr1", "dal-te", "dal-dst"));
    }

    @Nested
    @DisplayName("Threshold pass")
    class Thresholds {

        @Test
        @DisplayName("no thresholds and no targets keeps every lineup")
        void keepsEverything() {
            PortfolioFilterResult result = portfolioFilter.filter(
                    List.of(a, b, c, d), null, List.of(), PortfolioThresholds.none(), 10_000);

            assertThat(result.getKept()).containsExactly(a, b, c, d);
            assertThat(result.getExcluded()).isEmpty();
            assertThat(result.isExposureCompliant()).isTrue();
            verify(eventPublisherHelper).publishPortfolioFiltered(any(), any(PortfolioFilterResult.class));
        }

        @Test
        @DisplayName("total ownership above the cap excludes the lineup with a detail")
        void maxTotalOwnership() {
            double cap = (a.getTotalOwnership() + c.getTotalOwnership()) / 2.0;
            PortfolioThresholds thresholds = PortfolioThresholds.builder().maxTotalOwnership(cap).build();

            PortfolioFilterResult result = portfolioFilter.filter(List.of(a, c), null, List.of(), thresholds, 10_000);

            Lineup heavier = a.getTotalOwnership() > c.getTotalOwnership() ? a : c;
            assertThat(result.getExcluded())
                    .singleElement()
                    .satisfies(e -> {
                        assertThat(e.getLineupId()).isEqualTo(heavier.getLineupId());
                        assertThat(e.getReason()).isEqualTo(ExclusionReason.MAX_TOTAL_OWNERSHIP);
                        assertThat(e.getDetail()).contains("vs threshold");
                    });
        }

        @Test
        @DisplayName("the first failed threshold in fixed order is the one reported")
        void firstFailureWins() {
            Map<String, SimulationResult> results = Map.of(
                    "a", result("a", 0.5, -0.5, 0.0),
                    "b", result("b", 0.01, -0.5, 0.0),
                    "c", result("c", 0.01, 0.3, 0.002));
            PortfolioThresholds thresholds = PortfolioThresholds.builder()
                    .maxDuplicateRisk(0.1)
                    .minRoi(0.0)
                    .minWinProbability(0.001)
                    .build();

            PortfolioFilterResult result = portfolioFilter.filter(List.of(a, b, c), results, null, thresholds, 10_000);

            assertThat(result.getKept()).containsExactly(c);
            assertThat(result.getExcluded())
                    .extracting(ExcludedLineup::getLineupId, ExcludedLineup::getReason)
                    .containsExactly(
                            tuple("a", ExclusionReason.MAX_DUPLICATE_RISK),
                            tuple("b", ExclusionReason.MIN_ROI));
        }

        @Test
        @DisplayName("simulation thresholds without simulation results are rejected")
        void missingSimulation() {
            PortfolioThresholds thresholds = PortfolioThresholds.builder().minRoi(0.0).build();

            assertThatThrownBy(() -> portfolioFilter.filter(List.of(a), Map.of(), List.of(), thresholds, 100))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("lineup a");
        }

        @Test
        @DisplayName("out-of-range thresholds are rejected at construction")
        void invalidThreshold() {
            assertThatThrownBy(() -> PortfolioThresholds.builder().maxDuplicateRisk(1.5).build())
                    .isInstanceOf(ValidationException.class);
        }
    }

    @Nested
    @DisplayName("Exposure pass")
    class Exposure {

        @Test
        @DisplayName("over-exposed player drops its lowest-objective lineup")
        void dropsLowestObjective() {
            PortfolioFilterResult result = portfolioFilter.filter(
                    List.of(a, b, c, d), null, List.of(ExposureTarget.of("kc-qb", null, 0.5)),
                    PortfolioThresholds.none(), 10_000);

            assertThat(result.getKept()).containsExactly(a, b, d);
            assertThat(result.getExcluded())
                    .singleElement()
                    .satisfies(e -> {
                        assertThat(e.getLineupId()).isEqualTo("c");
                        assertThat(e.getReason()).isEqualTo(ExclusionReason.EXPOSURE);
                    });
            assertThat(result.isExposureCompliant()).isTrue();
            assertThat(result.getExposureByPlayer().get("kc-qb")).isCloseTo(2.0 / 3.0, within(1e-9));
        }

        @Test
        @DisplayName("a minimum target for a player in no lineup cannot be met and is flagged")
        void unreachableMinimum() {
            PortfolioFilterResult result = portfolioFilter.filter(
                    List.of(a, b), null, List.of(ExposureTarget.of("kc-dst", 0.5, null)),
                    PortfolioThresholds.none(), 10_000);

            assertThat(result.getKept()).containsExactly(a, b);
            assertThat(result.isExposureCompliant()).isFalse();
            assertThat(result.getExposureReport())
                    .filteredOn(e -> e.getPlayerId().equals("kc-dst"))
                    .singleElement()
                    .satisfies(e -> {
                        assertThat(e.getCount()).isZero();
                        assertThat(e.getStatus()).isEqualTo(ExposureStatus.UNDER);
                        assertThat(e.getTargetMin()).isEqualTo(0.5);
                    });
        }

        @Test
        @DisplayName("the exposure report lists players by count, most used first")
        void reportOrdering() {
            PortfolioFilterResult result = portfolioFilter.filter(
                    List.of(a, b, c, d), null, List.of(), PortfolioThresholds.none(), 10_000);

            ExposureReportEntry top = result.getExposureReport().get(0);
            assertThat(top.getPlayerId()).isEqualTo("dal-rb");
            assertThat(top.getCount()).isEqualTo(3);
            assertThat(top.getExposure()).isCloseTo(0.75, within(1e-9));
            assertThat(result.getExposureReport())
                    .extracting(ExposureReportEntry::getStatus)
                    .containsOnly(ExposureStatus.WITHIN);
        }

        @Test
        @DisplayName("min exposure above max exposure is rejected")
        void invalidTarget() {
            List<ExposureTarget> targets = List.of(ExposureTarget.of("kc-qb", 0.8, 0.2));

            assertThatThrownBy(() -> portfolioFilter.filter(
                    List.of(a), null, targets, PortfolioThresholds.none(), 100))
                    .isInstanceOf(ValidationException.class);
        }
    }

    private static SimulationResult result(String lineupId, double duplicateRisk, double roi, double winProbability) {
        return SimulationResult.builder()
                .lineupId(lineupId)
                .duplicateRisk(duplicateRisk)
                .roi(roi)
                .winProbability(winProbability)
                .build();
    }
}
