package com.dfsoptimizer.pipeline;

import com.dfsoptimizer.core.CancellationToken;
import com.dfsoptimizer.correlation.CorrelationMatrix;
import com.dfsoptimizer.correlation.CorrelationMatrixBuilder;
import com.dfsoptimizer.correlation.CorrelationRuleGenerator;
import com.dfsoptimizer.domain.model.CorrelationEntry;
import com.dfsoptimizer.domain.model.Lineup;
import com.dfsoptimizer.optimizer.LineupOptimizer;
import com.dfsoptimizer.optimizer.OptimizationResult;
import com.dfsoptimizer.pool.PlayerPool;
import com.dfsoptimizer.portfolio.PortfolioFilter;
import com.dfsoptimizer.portfolio.PortfolioFilterResult;
import com.dfsoptimizer.portfolio.StackAuditor;
import com.dfsoptimizer.simulation.SimulationEngine;
import com.dfsoptimizer.simulation.SimulationReport;
import com.dfsoptimizer.simulation.SimulationResult;
import com.dfsoptimizer.simulation.SimulationSettings;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * End-to-end run: correlation matrix, optimizer batch, simulation, portfolio filter and stack
 * audit, in that order.
 *
 * <p>The correlation matrix is built first so a bad correlation input fails before any solve.
 * An optimizer batch that delivers nothing (timeout or cancellation on the first lineup) ends
 * the run with only the optimization part filled in.
 */
@Service
public class LineupPipelineService {

    private static final Logger log = LoggerFactory.getLogger(LineupPipelineService.class);

    private final CorrelationRuleGenerator correlationRuleGenerator;
    private final CorrelationMatrixBuilder correlationMatrixBuilder;
    private final LineupOptimizer lineupOptimizer;
    private final SimulationEngine simulationEngine;
    private final PortfolioFilter portfolioFilter;
    private final StackAuditor stackAuditor;

    public LineupPipelineService(
            CorrelationRuleGenerator correlationRuleGenerator,
            CorrelationMatrixBuilder correlationMatrixBuilder,
            LineupOptimizer lineupOptimizer,
            SimulationEngine simulationEngine,
            PortfolioFilter portfolioFilter,
            StackAuditor stackAuditor) {
        this.correlationRuleGenerator = correlationRuleGenerator;
        this.correlationMatrixBuilder = correlationMatrixBuilder;
        this.lineupOptimizer = lineupOptimizer;
        this.simulationEngine = simulationEngine;
        this.portfolioFilter = portfolioFilter;
        this.stackAuditor = stackAuditor;
    }

    public PipelineReport run(PipelineInput input) {
        return run(input, CancellationToken.none());
    }

    public PipelineReport run(PipelineInput input, CancellationToken cancellationToken) {
        long startNanos = System.nanoTime();
        PlayerPool pool = input.getConstraints().getPool();
        CorrelationMatrix matrix = buildMatrix(pool, input.getCorrelations(), input.getCorrelationStrength());

        OptimizationResult optimization =
                lineupOptimizer.optimize(input.getConstraints(), input.getOptimizerSettings(), cancellationToken);
        List<Lineup> lineups = optimization.getLineups();
        PipelineReport.PipelineReportBuilder report = PipelineReport.builder()
                .optimization(optimization)
                .correlationCorrected(matrix.isCorrected())
                .correlationMaxAdjustment(matrix.getMaxAdjustment())
                .stackAudit(stackAuditor.audit(lineups));

        if (lineups.isEmpty() || cancellationToken.isCancelled()) {
            log.warn("Pipeline ended after optimization: {} lineup(s), stop reason {}",
                    lineups.size(), optimization.getStopReason());
            return report.elapsedMs(elapsedMs(startNanos)).build();
        }

        SimulationReport simulation =
                simulationEngine.simulate(lineups, pool, matrix, input.getSimulationSettings(), cancellationToken);
        Map<String, SimulationResult> byLineup = new LinkedHashMap<>();
        simulation.getResults().forEach(r -> byLineup.put(r.getLineupId(), r));

        PortfolioFilterResult portfolio = portfolioFilter.filter(
                lineups,
                byLineup,
                input.getExposureTargets(),
                input.getThresholds(),
                input.getSimulationSettings().getFieldSize());

        long elapsed = elapsedMs(startNanos);
        log.info("Pipeline finished in {}ms: {} generated, {} kept", elapsed, lineups.size(), portfolio.getKept().size());
        return report.simulation(simulation).portfolio(portfolio).elapsedMs(elapsed).build();
    }

    /** Simulates caller-built lineups without running the optimizer. */
    public SimulationReport simulate(
            List<Lineup> lineups,
            PlayerPool pool,
            List<CorrelationEntry> correlations,
            Double correlationStrength,
            SimulationSettings settings) {
        CorrelationMatrix matrix = buildMatrix(pool, correlations, correlationStrength);
        return simulationEngine.simulate(lineups, pool, matrix, settings);
    }

    private CorrelationMatrix buildMatrix(PlayerPool pool, List<CorrelationEntry> correlations, Double strength) {
        List<CorrelationEntry> explicit = correlations != null ? correlations : List.of();
        List<CorrelationEntry> entries = strength != null && strength > 0
                ? correlationRuleGenerator.merge(correlationRuleGenerator.generate(pool, strength), explicit)
                : explicit;
        return correlationMatrixBuilder.build(pool, entries);
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
