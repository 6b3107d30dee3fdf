package com.dfsoptimizer.simulation;

import lombok.Builder;
import lombok.Getter;

/**
 * Simulated outcome statistics for one lineup. Derived data: recomputed whenever the lineup
 * set changes, never stored on the lineup itself.
 */
@Getter
@Builder
public class SimulationResult {

    private final String lineupId;
    private final long trials;

    private final double meanScore;
    private final double stdDev;
    private final double p5;
    private final double p25;
    private final double p50;
    private final double p75;
    private final double p95;

    private final double targetScore;
    private final double probabilityAboveTarget;

    /** Mean over trials of the probability of finishing first in the field. */
    private final double winProbability;

    private final double expectedRank;

    /** Mean return per entry fee (0.5 = +50%). */
    private final double roi;

    private final double entryFee;

    /** Mean payout in currency: (1 + roi) x entry fee. */
    private final double expectedPayout;

    /** Mean payout minus the entry fee. */
    private final double expectedProfit;

    /** Chance that at least one other entry in the field is an exact duplicate, in [0, 1]. */
    private final double duplicateRisk;

    /** Mean over players of (ceiling / projection) x (1 - ownership). */
    private final double leverage;

    private final double totalOwnership;
}
