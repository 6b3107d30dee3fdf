package com.dfsoptimizer.portfolio;

import com.dfsoptimizer.domain.model.Lineup;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;

/** Partition of a lineup batch into kept and excluded lineups, with the resulting exposures. */
@Getter
@Builder
public class PortfolioFilterResult {

    private final List<Lineup> kept;
    private final List<ExcludedLineup> excluded;
    private final List<ExposureReportEntry> exposureReport;

    /** False when some exposure target could not be met even after dropping lineups. */
    private final boolean exposureCompliant;

    public Map<String, Double> getExposureByPlayer() {
        Map<String, Double> exposures = new LinkedHashMap<>();
        exposureReport.forEach(e -> exposures.put(e.getPlayerId(), e.getExposure()));
        return exposures;
    }
}
