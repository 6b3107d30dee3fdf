package com.dfsoptimizer.observability;

import com.dfsoptimizer.event.LineupBatchCompletedEvent;
import com.dfsoptimizer.event.PortfolioFilteredEvent;
import com.dfsoptimizer.event.SimulationCompletedEvent;
import com.dfsoptimizer.optimizer.OptimizationResult;
import com.dfsoptimizer.portfolio.ExcludedLineup;
import com.dfsoptimizer.simulation.SimulationReport;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Micrometer meters for the lineup engine:
 * <ul>
 *   <li><b>lineups.generated.count</b> (counter): lineups emitted by optimizer batches</li>
 *   <li><b>lineups.failed.count</b> (counter, tag reason): batches that stopped short</li>
 *   <li><b>optimizer.batch.duration</b> (timer): wall time per batch</li>
 *   <li><b>simulation.trials.count</b> (counter): trials simulated</li>
 *   <li><b>simulation.run.duration</b> (timer): wall time per simulation run</li>
 *   <li><b>portfolio.excluded.count</b> (counter, tag reason): lineups excluded by the portfolio filter</li>
 * </ul>
 *
 * <p>Fed by application events so the engines carry no metrics code.
 */
@Service
public class EngineMetricsService {

    private static final Logger log = LoggerFactory.getLogger(EngineMetricsService.class);

    private final MeterRegistry meterRegistry;
    private final Counter lineupsGeneratedCounter;
    private final Counter simulationTrialsCounter;
    private final Timer batchDurationTimer;
    private final Timer simulationDurationTimer;

    public EngineMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.lineupsGeneratedCounter = Counter.builder("lineups.generated.count")
                .description("Total lineups emitted by the optimizer")
                .register(meterRegistry);

        this.simulationTrialsCounter = Counter.builder("simulation.trials.count")
                .description("Total Monte Carlo trials simulated")
                .register(meterRegistry);

        this.batchDurationTimer = Timer.builder("optimizer.batch.duration")
                .description("Wall time of one optimizer batch")
                .publishPercentiles(0.5, 0.95)
                .register(meterRegistry);

        this.simulationDurationTimer = Timer.builder("simulation.run.duration")
                .description("Wall time of one simulation run")
                .publishPercentiles(0.5, 0.95)
                .register(meterRegistry);
    }

    @EventListener
    @Order(20)
    public void onBatchCompleted(LineupBatchCompletedEvent event) {
        OptimizationResult result = event.getResult();
        lineupsGeneratedCounter.increment(result.getDelivered());
        batchDurationTimer.record(result.getElapsedMs(), TimeUnit.MILLISECONDS);
        if (result.isPartial()) {
            failedCounter(result.getStopReason().name()).increment();
            log.debug("Batch {} short by {} lineup(s)", result.getBatchId(), result.getRequested() - result.getDelivered());
        }
    }

    @EventListener
    @Order(20)
    public void onSimulationCompleted(SimulationCompletedEvent event) {
        SimulationReport report = event.getReport();
        simulationTrialsCounter.increment(report.getTrialsRun());
        simulationDurationTimer.record(report.getElapsedMs(), TimeUnit.MILLISECONDS);
    }

    @EventListener
    @Order(20)
    public void onPortfolioFiltered(PortfolioFilteredEvent event) {
        for (ExcludedLineup excluded : event.getResult().getExcluded()) {
            Counter.builder("portfolio.excluded.count")
                    .description("Lineups excluded by the portfolio filter")
                    .tag("reason", excluded.getReason().name())
                    .register(meterRegistry)
                    .increment();
        }
    }

    private Counter failedCounter(String reason) {
        return Counter.builder("lineups.failed.count")
                .description("Optimizer batches that delivered fewer lineups than requested")
                .tag("reason", reason)
                .register(meterRegistry);
    }
}
