package com.dfsoptimizer.event;

import com.dfsoptimizer.optimizer.OptimizationResult;
import com.dfsoptimizer.portfolio.PortfolioFilterResult;
import com.dfsoptimizer.simulation.SimulationReport;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Typed factory methods over Spring's {@link ApplicationEventPublisher} for engine events.
 *
 * <p>Delivery is synchronous unless a listener is marked {@code @Async}.
 */
@Component
public class EventPublisherHelper {

    private final ApplicationEventPublisher applicationEventPublisher;

    public EventPublisherHelper(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    public void publishBatchCompleted(Object source, OptimizationResult result) {
        applicationEventPublisher.publishEvent(new LineupBatchCompletedEvent(source, result));
    }

    public void publishSimulationCompleted(Object source, SimulationReport report) {
        applicationEventPublisher.publishEvent(new SimulationCompletedEvent(source, report));
    }

    public void publishPortfolioFiltered(Object source, PortfolioFilterResult result) {
        applicationEventPublisher.publishEvent(new PortfolioFilteredEvent(source, result));
    }
}
