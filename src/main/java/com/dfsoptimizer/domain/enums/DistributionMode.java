package com.dfsoptimizer.domain.enums;

/**
 * Marginal distribution of a player's simulated score.
 * NORMAL draws are clamped at zero; LOGNORMAL has no negative support; EMPIRICAL maps the
 * copula uniform through the player's historical score quantiles.
 */
public enum DistributionMode {
    NORMAL,
    LOGNORMAL,
    EMPIRICAL
}
