package com.dfsoptimizer.pipeline;

import com.dfsoptimizer.optimizer.OptimizationResult;
import com.dfsoptimizer.portfolio.PortfolioFilterResult;
import com.dfsoptimizer.portfolio.StackAuditor.StackAuditEntry;
import com.dfsoptimizer.simulation.SimulationReport;
import java.util.List;
import lombok.Builder;
import lombok.Getter;

/**
 * Result of an end-to-end run. Simulation and portfolio are null when the optimizer delivered
 * no lineups.
 */
@Getter
@Builder
public class PipelineReport {

    private final OptimizationResult optimization;
    private final SimulationReport simulation;
    private final PortfolioFilterResult portfolio;
    private final List<StackAuditEntry> stackAudit;
    private final boolean correlationCorrected;
    private final double correlationMaxAdjustment;
    private final long elapsedMs;
}
