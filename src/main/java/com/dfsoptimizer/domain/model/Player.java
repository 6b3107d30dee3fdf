package com.dfsoptimizer.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import lombok.Builder;
import lombok.Getter;

/**
 * One eligible player on a slate: salary, roster positions, team/game affiliation and the
 * projection statistics the optimizer and simulator consume.
 *
 * <p>Immutable once built. Validation (positive salary, non-empty positions, floor <= projection
 * <= ceiling) happens when the pool is loaded, not here, so a pool load can report every bad
 * record at once.
 *
 * <p>The "effective" accessors apply the player controls carried over from the dashboard:
 * a custom projection replaces the base projection, the boost (percent) scales it, and an
 * ownership override replaces the projected ownership.
 *
 * <p>The builder copies the position set and score history, so a pooled player never changes
 * under its caller.
 */
@Getter
@Builder(toBuilder = true)
public class Player {

    /** Assumed coefficient of variation when neither a std-dev nor a floor/ceiling band is given. */
    public static final double DEFAULT_VOLATILITY = 0.4;

    /** Width of a 5th-95th percentile band of a normal distribution, in standard deviations. */
    private static final double P5_P95_SPAN = 3.29;

    /** One-sided 95th percentile z-score. */
    private static final double Z_95 = 1.645;

    private final String id;
    private final String name;

    /** Roster positions this player may fill (e.g. {"RB"}; multi-eligible players list several). */
    private final Set<String> positions;

    private final String team;
    private final String opponent;

    /** Optional explicit game key. When null the game is derived from team and opponent. */
    private final String gameId;

    private final int salary;

    /** Mean projected fantasy points. */
    private final double projection;

    private final Double floor;
    private final Double ceiling;
    private final Double stdDev;

    /** Projected ownership as a fraction in [0, 1]. */
    private final double ownership;

    private final boolean locked;
    private final boolean banned;

    /** Projection boost in percent (e.g. 10 = +10%). */
    private final double projectionBoost;

    private final Double customProjection;
    private final Double ownershipOverride;

    /** Minimum exposure target as a fraction of the final lineup set. Null = no target. */
    private final Double minExposure;

    /** Maximum exposure target as a fraction of the final lineup set. Null = no target. */
    private final Double maxExposure;

    /** Past fantasy scores, used by the EMPIRICAL distribution mode. */
    private final List<Double> historicalScores;

    public double getEffectiveProjection() {
        double base = customProjection != null ? customProjection : projection;
        return base * (1.0 + projectionBoost / 100.0);
    }

    public double getEffectiveOwnership() {
        return ownershipOverride != null ? ownershipOverride : ownership;
    }

    /**
     * Standard deviation of the outcome: provided value, else derived from the floor/ceiling band,
     * else {@link #DEFAULT_VOLATILITY} times the effective projection.
     */
    public double getEffectiveStdDev() {
        if (stdDev != null && stdDev > 0) {
            return stdDev;
        }
        if (floor != null && ceiling != null && ceiling > floor) {
            return (ceiling - floor) / P5_P95_SPAN;
        }
        return Math.max(getEffectiveProjection() * DEFAULT_VOLATILITY, 0.0);
    }

    public double getEffectiveCeiling() {
        if (ceiling != null) {
            return ceiling * (1.0 + projectionBoost / 100.0);
        }
        return getEffectiveProjection() + Z_95 * getEffectiveStdDev();
    }

    /** Game key shared by both teams of a matchup, independent of which side is asking. */
    public String getResolvedGameId() {
        if (gameId != null && !gameId.isBlank()) {
            return gameId;
        }
        if (opponent == null || opponent.isBlank()) {
            return team;
        }
        return team.compareTo(opponent) <= 0 ? team + "@" + opponent : opponent + "@" + team;
    }

    public boolean isEligibleFor(Set<String> eligiblePositions) {
        for (String position : positions) {
            if (eligiblePositions.contains(position)) {
                return true;
            }
        }
        return false;
    }

    public boolean hasPosition(String position) {
        return positions.contains(position);
    }

    public boolean hasHistory() {
        return historicalScores != null && !historicalScores.isEmpty();
    }

    /** Builder hooks that take read-only copies of the collection fields. */
    public static class PlayerBuilder {

        public PlayerBuilder positions(Set<String> positions) {
            this.positions = positions == null ? null : Collections.unmodifiableSet(new LinkedHashSet<>(positions));
            return this;
        }

        public PlayerBuilder historicalScores(List<Double> historicalScores) {
            this.historicalScores =
                    historicalScores == null ? null : Collections.unmodifiableList(new ArrayList<>(historicalScores));
            return this;
        }
    }

    @Override
    public String toString() {
        return name + " (" + String.join("/", positions) + ", " + team + ", $" + salary + ")";
    }
}
