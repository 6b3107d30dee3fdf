package com.dfsoptimizer.domain.enums;

/**
 * Tag attached to a lineup removed by the portfolio filter. Threshold reasons are evaluated in
 * declaration order and the first failing one is reported.
 */
public enum ExclusionReason {
    MAX_DUPLICATE_RISK,
    MIN_LEVERAGE,
    MIN_ROI,
    MAX_TOTAL_OWNERSHIP,
    MIN_WIN_PROBABILITY,
    EXPOSURE
}
