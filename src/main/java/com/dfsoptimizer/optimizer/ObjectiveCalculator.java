package com.dfsoptimizer.optimizer;

import com.dfsoptimizer.domain.enums.ObjectiveType;
import com.dfsoptimizer.domain.model.Player;
import java.util.List;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;

/**
 * Per-player objective coefficients.
 *
 * <ul>
 *   <li>PROJECTION: effective projection</li>
 *   <li>CEILING: effective ceiling</li>
 *   <li>EV: projection discounted by ownership, plus the ownership-discounted upside above it,
 *       {@code proj * (1 - w * own) + w * (ceiling - proj) * (1 - own)}</li>
 * </ul>
 */
public final class ObjectiveCalculator {

    private final ObjectiveType objective;
    private final double evOwnershipWeight;

    public ObjectiveCalculator(ObjectiveType objective, double evOwnershipWeight) {
        this.objective = objective;
        this.evOwnershipWeight = evOwnershipWeight;
    }

    public static ObjectiveCalculator from(OptimizerSettings settings) {
        return new ObjectiveCalculator(settings.getObjective(), settings.getEvOwnershipWeight());
    }

    public double valueOf(Player player) {
        double projection = player.getEffectiveProjection();
        return switch (objective) {
            case PROJECTION -> projection;
            case CEILING -> player.getEffectiveCeiling();
            case EV -> {
                double ownership = player.getEffectiveOwnership();
                double upside = Math.max(player.getEffectiveCeiling() - projection, 0.0);
                yield projection * (1.0 - evOwnershipWeight * ownership)
                        + evOwnershipWeight * upside * (1.0 - ownership);
            }
        };
    }

    public double totalOf(List<Player> players) {
        return players.stream().mapToDouble(this::valueOf).sum();
    }

    /**
     * Objective values for a pool, optionally perturbed by multiplicative Gaussian noise.
     * The noise stream is seeded by (seed, lineupIndex) so a batch is reproducible.
     */
    public double[] perturbedValues(List<Player> players, double jitterPercent, long seed, int lineupIndex) {
        double[] values = new double[players.size()];
        RandomGenerator random = jitterPercent > 0 ? new Well19937c(new int[] {(int) seed, (int) (seed >>> 32), lineupIndex}) : null;
        for (int i = 0; i < players.size(); i++) {
            double value = valueOf(players.get(i));
            if (random != null) {
                value *= Math.max(0.0, 1.0 + random.nextGaussian() * jitterPercent / 100.0);
            }
            values[i] = value;
        }
        return values;
    }
}
