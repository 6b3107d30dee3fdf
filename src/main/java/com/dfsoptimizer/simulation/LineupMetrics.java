package com.dfsoptimizer.simulation;

import com.dfsoptimizer.domain.model.Lineup;
import com.dfsoptimizer.domain.model.Player;

/** Closed-form ownership metrics for a lineup; no sampling involved. */
public final class LineupMetrics {

    private LineupMetrics() {}

    /**
     * Probability that at least one of the other entries is an exact copy, treating each entry as
     * rostering every player independently with its ownership: {@code 1 - exp(-F * prod(own))}.
     */
    public static double duplicateRisk(Lineup lineup, int fieldSize) {
        double product = 1.0;
        for (Player player : lineup.getPlayers()) {
            product *= Math.max(0.0, Math.min(1.0, player.getEffectiveOwnership()));
        }
        return 1.0 - Math.exp(-fieldSize * product);
    }

    /** Mean over players of (ceiling / projection) x (1 - ownership). Zero-projection players count their ratio as 1. */
    public static double leverage(Lineup lineup) {
        double total = 0.0;
        int count = 0;
        for (Player player : lineup.getPlayers()) {
            double projection = player.getEffectiveProjection();
            double ratio = projection > 0 ? player.getEffectiveCeiling() / projection : 1.0;
            total += ratio * (1.0 - player.getEffectiveOwnership());
            count++;
        }
        return count > 0 ? total / count : 0.0;
    }
}
