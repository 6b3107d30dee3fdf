package com.dfsoptimizer.simulation;

import lombok.Builder;
import lombok.Getter;

/**
 * Simulated distribution of one player's score. A boom is a trial at or above 1.5x the
 * projection, a bust one at or below 0.5x.
 */
@Getter
@Builder
public class PlayerOutcomeSummary {

    public static final double BOOM_MULTIPLE = 1.5;
    public static final double BUST_MULTIPLE = 0.5;

    private final String playerId;
    private final String name;
    private final double projection;
    private final double mean;
    private final double stdDev;
    private final double p5;
    private final double p25;
    private final double p50;
    private final double p75;
    private final double p95;
    private final double boomRate;
    private final double bustRate;
}
