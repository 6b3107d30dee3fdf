package com.dfsoptimizer.api.dto.response;

import com.dfsoptimizer.portfolio.ExcludedLineup;
import com.dfsoptimizer.portfolio.ExposureReportEntry;
import com.dfsoptimizer.simulation.SimulationReport;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * End-to-end result. {@code optimization} holds every generated lineup; {@code kept} the subset
 * that survived the portfolio filter. Simulation and portfolio fields are null when no lineup
 * was generated.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PipelineResponse {

    private OptimizeResponse optimization;
    private SimulationReport simulation;
    private List<LineupResponse> kept;
    private List<ExcludedLineup> excluded;
    private List<ExposureReportEntry> exposureReport;
    private Boolean exposureCompliant;
    private boolean correlationCorrected;
    private double correlationMaxAdjustment;
    private long elapsedMs;
}
