package com.dfsoptimizer.simulation;

import org.apache.commons.math3.distribution.NormalDistribution;

/**
 * Approximates the contest field from projected ownership so a single trial can be turned into
 * a finishing position without simulating every opponent lineup.
 *
 * <p>Ownership is rescaled into selection weights w summing to the roster size (each capped at
 * 1). A random field lineup then scores, per trial, with mean {@code sum w*s} and dispersion
 * {@code sqrt(sum w(1-w) s^2)}. With {@code p = Phi((lineupScore - mean) / dispersion)} the
 * lineup beats each opponent with probability p, so
 * <ul>
 *   <li>win probability = p^(F-1)</li>
 *   <li>expected rank = 1 + (F-1)(1-p)</li>
 * </ul>
 */
public final class FieldModel {

    private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution();

    private final double[] weights;
    private final int fieldSize;
    private final PayoutStructure payouts;

    /** Per-trial state, set by {@link #prepare(double[])}. Each chunk worker owns its own copy. */
    private double fieldMean;
    private double fieldDispersion;

    private FieldModel(double[] weights, int fieldSize, PayoutStructure payouts) {
        this.weights = weights;
        this.fieldSize = fieldSize;
        this.payouts = payouts;
    }

    /**
     * @param ownership  projected ownership per simulated player, sample order
     * @param rosterSize players per lineup
     */
    public static FieldModel create(double[] ownership, int rosterSize, int fieldSize, PayoutStructure payouts) {
        double total = 0.0;
        for (double own : ownership) {
            total += Math.max(own, 0.0);
        }
        double[] weights = new double[ownership.length];
        for (int i = 0; i < ownership.length; i++) {
            double share = total > 0 ? Math.max(ownership[i], 0.0) / total : 1.0 / ownership.length;
            weights[i] = Math.min(1.0, share * rosterSize);
        }
        return new FieldModel(weights, fieldSize, payouts);
    }

    /** Independent copy for another worker thread. */
    public FieldModel copy() {
        return new FieldModel(weights, fieldSize, payouts);
    }

    public void prepare(double[] scores) {
        double mean = 0.0;
        double variance = 0.0;
        for (int i = 0; i < weights.length; i++) {
            double w = weights[i];
            double s = scores[i];
            mean += w * s;
            variance += w * (1.0 - w) * s * s;
        }
        fieldMean = mean;
        fieldDispersion = Math.sqrt(variance);
    }

    /** Probability that the lineup outscores one random field lineup in the prepared trial. */
    public double beatProbability(double lineupScore) {
        if (fieldDispersion <= 0) {
            return lineupScore > fieldMean ? 1.0 : lineupScore == fieldMean ? 0.5 : 0.0;
        }
        return STANDARD_NORMAL.cumulativeProbability((lineupScore - fieldMean) / fieldDispersion);
    }

    public double winProbability(double beatProbability) {
        return Math.pow(beatProbability, fieldSize - 1);
    }

    public double expectedRank(double beatProbability) {
        return 1.0 + (fieldSize - 1) * (1.0 - beatProbability);
    }

    /** Return on one entry fee: payout multiple minus the fee itself. */
    public double roi(double beatProbability) {
        return payouts.multipleAt(expectedRank(beatProbability)) - 1.0;
    }

    public int getFieldSize() {
        return fieldSize;
    }
}
