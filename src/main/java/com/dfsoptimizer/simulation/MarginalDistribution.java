package com.dfsoptimizer.simulation;

import com.dfsoptimizer.domain.enums.DistributionMode;
import com.dfsoptimizer.domain.model.Player;
import java.util.Arrays;
import java.util.List;
import org.apache.commons.math3.distribution.NormalDistribution;

/**
 * Maps a standard normal draw to one player's fantasy score. The copula supplies correlated
 * z values; the marginal decides the shape of each player's outcome.
 *
 * <ul>
 *   <li>NORMAL: {@code mean + sd * z}, clamped at 0</li>
 *   <li>LOGNORMAL: {@code exp(mu + sigma * z)} with mu/sigma matched to the player's mean and sd</li>
 *   <li>EMPIRICAL: {@code Phi(z)} mapped through the player's historical score quantiles</li>
 * </ul>
 *
 * <p>Players without a history fall back to NORMAL in EMPIRICAL mode. All implementations are
 * immutable and shared across chunk workers.
 */
public interface MarginalDistribution {

    double fromStandardNormal(double z);

    double mean();

    static MarginalDistribution of(Player player, DistributionMode mode) {
        double mean = player.getEffectiveProjection();
        double sd = player.getEffectiveStdDev();
        return switch (mode) {
            case NORMAL -> new Normal(mean, sd);
            case LOGNORMAL -> Lognormal.matching(mean, sd);
            case EMPIRICAL -> player.hasHistory()
                    ? Empirical.from(player.getHistoricalScores())
                    : new Normal(mean, sd);
        };
    }

    record Normal(double mean, double sd) implements MarginalDistribution {

        @Override
        public double fromStandardNormal(double z) {
            return Math.max(0.0, mean + sd * z);
        }
    }

    record Lognormal(double mu, double sigma, double mean) implements MarginalDistribution {

        static Lognormal matching(double mean, double sd) {
            if (mean <= 0) {
                return new Lognormal(Double.NEGATIVE_INFINITY, 0.0, 0.0);
            }
            double variance = Math.log(1.0 + (sd * sd) / (mean * mean));
            return new Lognormal(Math.log(mean) - variance / 2.0, Math.sqrt(variance), mean);
        }

        @Override
        public double fromStandardNormal(double z) {
            return Math.exp(mu + sigma * z);
        }
    }

    record Empirical(double[] sortedScores, double mean) implements MarginalDistribution {

        private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution();

        static Empirical from(List<Double> history) {
            double[] sorted = history.stream().mapToDouble(Double::doubleValue).sorted().toArray();
            return new Empirical(sorted, Arrays.stream(sorted).average().orElse(0.0));
        }

        @Override
        public double fromStandardNormal(double z) {
            if (sortedScores.length == 1) {
                return sortedScores[0];
            }
            double position = STANDARD_NORMAL.cumulativeProbability(z) * (sortedScores.length - 1);
            int lower = (int) Math.floor(position);
            if (lower >= sortedScores.length - 1) {
                return sortedScores[sortedScores.length - 1];
            }
            double fraction = position - lower;
            return sortedScores[lower] + fraction * (sortedScores[lower + 1] - sortedScores[lower]);
        }
    }
}
