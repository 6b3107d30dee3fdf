package com.dfsoptimizer.portfolio;

import com.dfsoptimizer.domain.enums.ExclusionReason;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class ExcludedLineup {

    private final String lineupId;
    private final ExclusionReason reason;

    /** Human-readable value-versus-threshold detail. */
    private final String detail;
}
