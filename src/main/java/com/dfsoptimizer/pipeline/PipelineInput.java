package com.dfsoptimizer.pipeline;

import com.dfsoptimizer.constraint.ConstraintSet;
import com.dfsoptimizer.domain.model.CorrelationEntry;
import com.dfsoptimizer.optimizer.OptimizerSettings;
import com.dfsoptimizer.portfolio.ExposureTarget;
import com.dfsoptimizer.portfolio.PortfolioThresholds;
import com.dfsoptimizer.simulation.SimulationSettings;
import java.util.List;
import lombok.Builder;
import lombok.Getter;

/** Everything one end-to-end run needs. The pool comes from the constraint set. */
@Getter
@Builder
public class PipelineInput {

    private final ConstraintSet constraints;
    private final List<CorrelationEntry> correlations;

    /** Strength of the rule-based correlations in [0, 1]; null or 0 uses only the explicit entries. */
    private final Double correlationStrength;

    private final OptimizerSettings optimizerSettings;
    private final SimulationSettings simulationSettings;
    private final List<ExposureTarget> exposureTargets;
    private final PortfolioThresholds thresholds;
}
