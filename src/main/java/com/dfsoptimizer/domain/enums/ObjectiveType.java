package com.dfsoptimizer.domain.enums;

/**
 * Per-player value the optimizer maximizes.
 * PROJECTION uses mean points, EV blends projection with ownership leverage,
 * CEILING uses the upside outcome.
 */
public enum ObjectiveType {
    PROJECTION,
    EV,
    CEILING
}
