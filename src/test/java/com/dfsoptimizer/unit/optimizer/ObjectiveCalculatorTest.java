package com.dfsoptimizer.unit.optimizer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.offset;

import com.dfsoptimizer.domain.enums.ObjectiveType;
import com.dfsoptimizer.domain.model.Player;
import com.dfsoptimizer.optimizer.ObjectiveCalculator;
import com.dfsoptimizer.unit.SlateFixtures;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ObjectiveCalculatorTest {

    private final Player player = SlateFixtures.player("p", "WR", "KC", "BUF", 6000, 20.0, 0.4).toBuilder()
            .ceiling(30.0)
            .build();

    @Test
    @DisplayName("PROJECTION and CEILING use the effective values")
    void projectionAndCeiling() {
        assertThat(new ObjectiveCalculator(ObjectiveType.PROJECTION, 0.5).valueOf(player)).isEqualTo(20.0);
        assertThat(new ObjectiveCalculator(ObjectiveType.CEILING, 0.5).valueOf(player)).isEqualTo(30.0);
    }

    @Test
    @DisplayName("EV discounts owned projection and adds unowned upside")
    void evBlend() {
        double ev = new ObjectiveCalculator(ObjectiveType.EV, 0.5).valueOf(player);

        // 20 * (1 - 0.5 * 0.4) + 0.5 * 10 * 0.6
        assertThat(ev).isCloseTo(19.0, offset(1e-9));
    }

    @Test
    @DisplayName("jitter is reproducible per lineup index and never negative")
    void jitterReproducible() {
        ObjectiveCalculator calculator = new ObjectiveCalculator(ObjectiveType.PROJECTION, 0.5);
        List<Player> players = SlateFixtures.dkNflPlayers();

        double[] first = calculator.perturbedValues(players, 50.0, 11L, 3);
        double[] again = calculator.perturbedValues(players, 50.0, 11L, 3);
        double[] other = calculator.perturbedValues(players, 50.0, 11L, 4);
        double[] plain = calculator.perturbedValues(players, 0.0, 11L, 3);

        assertThat(again).containsExactly(first);
        assertThat(other).isNotEqualTo(first);
        for (double value : first) {
            assertThat(value).isGreaterThanOrEqualTo(0.0);
        }
        assertThat(plain[0]).isEqualTo(players.get(0).getEffectiveProjection());
    }
}
