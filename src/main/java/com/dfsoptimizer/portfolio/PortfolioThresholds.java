package com.dfsoptimizer.portfolio;

import com.dfsoptimizer.exception.ValidationException;
import lombok.Builder;
import lombok.Getter;

/**
 * Per-lineup portfolio cutoffs. Every threshold is optional; a null threshold is not applied.
 */
@Getter
public final class PortfolioThresholds {

    private final Double maxDuplicateRisk;
    private final Double minLeverage;
    private final Double minRoi;
    private final Double maxTotalOwnership;
    private final Double minWinProbability;

    @Builder
    private PortfolioThresholds(
            Double maxDuplicateRisk,
            Double minLeverage,
            Double minRoi,
            Double maxTotalOwnership,
            Double minWinProbability) {
        requireRange("maxDuplicateRisk", maxDuplicateRisk, 0.0, 1.0);
        requireRange("minLeverage", minLeverage, 0.0, Double.MAX_VALUE);
        requireRange("minRoi", minRoi, -1.0, Double.MAX_VALUE);
        requireRange("maxTotalOwnership", maxTotalOwnership, 0.0, Double.MAX_VALUE);
        requireRange("minWinProbability", minWinProbability, 0.0, 1.0);
        this.maxDuplicateRisk = maxDuplicateRisk;
        this.minLeverage = minLeverage;
        this.minRoi = minRoi;
        this.maxTotalOwnership = maxTotalOwnership;
        this.minWinProbability = minWinProbability;
    }

    public static PortfolioThresholds none() {
        return PortfolioThresholds.builder().build();
    }

    public boolean needsSimulation() {
        return minRoi != null || minWinProbability != null;
    }

    private static void requireRange(String name, Double value, double min, double max) {
        if (value != null && (!Double.isFinite(value) || value < min || value > max)) {
            throw new ValidationException(name + " must lie in [" + min + ", " + max + "], was " + value);
        }
    }
}
