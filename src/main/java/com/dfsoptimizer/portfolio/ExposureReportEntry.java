package com.dfsoptimizer.portfolio;

import com.dfsoptimizer.domain.enums.ExposureStatus;
import lombok.Builder;
import lombok.Getter;

/** Actual appearance rate of one player across the kept lineups, against its target if any. */
@Getter
@Builder
public class ExposureReportEntry {

    private final String playerId;
    private final String name;
    private final int count;

    /** Fraction of kept lineups containing the player, in [0, 1]. */
    private final double exposure;

    private final Double targetMin;
    private final Double targetMax;
    private final ExposureStatus status;
}
