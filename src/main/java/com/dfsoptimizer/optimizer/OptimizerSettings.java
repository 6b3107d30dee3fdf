package com.dfsoptimizer.optimizer;

import com.dfsoptimizer.domain.enums.ObjectiveType;
import com.dfsoptimizer.exception.ValidationException;
import lombok.Builder;
import lombok.Getter;

/**
 * Explicit per-run optimizer configuration. Every field is validated when built; an
 * out-of-range value is rejected rather than replaced by a default.
 */
@Getter
public final class OptimizerSettings {

    private final int lineupCount;
    private final ObjectiveType objective;

    /** Ownership penalty weight for the EV objective, in [0, 1]. */
    private final double evOwnershipWeight;

    /** Standard deviation of per-player objective noise, as a percent of the player's value. */
    private final double jitterPercent;

    private final long seed;
    private final long perLineupTimeoutMs;

    /** OR-Tools mixed-integer backend id. */
    private final String solverBackend;

    @Builder
    private OptimizerSettings(
            Integer lineupCount,
            ObjectiveType objective,
            Double evOwnershipWeight,
            Double jitterPercent,
            Long seed,
            Long perLineupTimeoutMs,
            String solverBackend) {
        this.lineupCount = lineupCount != null ? lineupCount : 1;
        this.objective = objective != null ? objective : ObjectiveType.PROJECTION;
        this.evOwnershipWeight = evOwnershipWeight != null ? evOwnershipWeight : 0.5;
        this.jitterPercent = jitterPercent != null ? jitterPercent : 0.0;
        this.seed = seed != null ? seed : 42L;
        this.perLineupTimeoutMs = perLineupTimeoutMs != null ? perLineupTimeoutMs : 10_000L;
        this.solverBackend = solverBackend != null ? solverBackend : MipSolver.DEFAULT_BACKEND;

        if (this.lineupCount < 1) {
            throw new ValidationException("Lineup count must be at least 1, was " + this.lineupCount);
        }
        if (!Double.isFinite(this.evOwnershipWeight) || this.evOwnershipWeight < 0 || this.evOwnershipWeight > 1) {
            throw new ValidationException("EV ownership weight must lie in [0, 1], was " + this.evOwnershipWeight);
        }
        if (!Double.isFinite(this.jitterPercent) || this.jitterPercent < 0 || this.jitterPercent > 100) {
            throw new ValidationException("Jitter percent must lie in [0, 100], was " + this.jitterPercent);
        }
        if (this.perLineupTimeoutMs <= 0) {
            throw new ValidationException("Per-lineup timeout must be positive, was " + this.perLineupTimeoutMs);
        }
        if (this.solverBackend.isBlank()) {
            throw new ValidationException("Solver backend must not be blank");
        }
    }
}
