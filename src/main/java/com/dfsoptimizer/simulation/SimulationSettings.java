package com.dfsoptimizer.simulation;

import com.dfsoptimizer.domain.enums.ContestType;
import com.dfsoptimizer.domain.enums.DistributionMode;
import com.dfsoptimizer.exception.ValidationException;
import lombok.Builder;
import lombok.Getter;

/**
 * Explicit per-run simulation configuration: trial count, seed, marginal distribution, contest
 * assumptions and resource budgets. Validated when built; out-of-range values are rejected.
 */
@Getter
public final class SimulationSettings {

    private final int trials;
    private final long seed;
    private final DistributionMode distributionMode;

    /** Score the "probability above target" statistic is measured against. Null = each lineup's projection. */
    private final Double targetScore;

    private final int fieldSize;
    private final double entryFee;
    private final ContestType contestType;

    /** Most-owned non-lineup players added to the simulation so the field model sees them. */
    private final int fieldPlayerLimit;

    private final int chunkSize;
    private final int maxTrials;
    private final long chunkTimeoutMs;
    private final double histogramBinWidth;
    private final long maxHistogramBytes;

    @Builder
    private SimulationSettings(
            Integer trials,
            Long seed,
            DistributionMode distributionMode,
            Double targetScore,
            Integer fieldSize,
            Double entryFee,
            ContestType contestType,
            Integer fieldPlayerLimit,
            Integer chunkSize,
            Integer maxTrials,
            Long chunkTimeoutMs,
            Double histogramBinWidth,
            Long maxHistogramBytes) {
        this.trials = trials != null ? trials : 10_000;
        this.seed = seed != null ? seed : 42L;
        this.distributionMode = distributionMode != null ? distributionMode : DistributionMode.NORMAL;
        this.targetScore = targetScore;
        this.fieldSize = fieldSize != null ? fieldSize : 10_000;
        this.entryFee = entryFee != null ? entryFee : 20.0;
        this.contestType = contestType != null ? contestType : ContestType.GPP;
        this.fieldPlayerLimit = fieldPlayerLimit != null ? fieldPlayerLimit : 60;
        this.chunkSize = chunkSize != null ? chunkSize : 5_000;
        this.maxTrials = maxTrials != null ? maxTrials : 1_000_000;
        this.chunkTimeoutMs = chunkTimeoutMs != null ? chunkTimeoutMs : 30_000L;
        this.histogramBinWidth = histogramBinWidth != null ? histogramBinWidth : 0.1;
        this.maxHistogramBytes = maxHistogramBytes != null ? maxHistogramBytes : 256L * 1024 * 1024;

        if (this.trials < 1) {
            throw new ValidationException("Trial count must be at least 1, was " + this.trials);
        }
        if (targetScore != null && !Double.isFinite(targetScore)) {
            throw new ValidationException("Target score must be finite");
        }
        if (this.fieldSize < 1) {
            throw new ValidationException("Field size must be at least 1, was " + this.fieldSize);
        }
        if (!Double.isFinite(this.entryFee) || this.entryFee <= 0) {
            throw new ValidationException("Entry fee must be positive, was " + this.entryFee);
        }
        if (this.fieldPlayerLimit < 0) {
            throw new ValidationException("Field player limit must not be negative");
        }
        if (this.chunkSize < 1) {
            throw new ValidationException("Chunk size must be at least 1, was " + this.chunkSize);
        }
        if (this.maxTrials < 1) {
            throw new ValidationException("Max trials must be at least 1, was " + this.maxTrials);
        }
        if (this.chunkTimeoutMs <= 0) {
            throw new ValidationException("Chunk timeout must be positive, was " + this.chunkTimeoutMs);
        }
        if (!Double.isFinite(this.histogramBinWidth) || this.histogramBinWidth <= 0) {
            throw new ValidationException("Histogram bin width must be positive, was " + this.histogramBinWidth);
        }
        if (this.maxHistogramBytes <= 0) {
            throw new ValidationException("Histogram memory budget must be positive");
        }
    }

    public int getChunkCount() {
        return (trials + chunkSize - 1) / chunkSize;
    }
}
