package com.dfsoptimizer.event;

import com.dfsoptimizer.simulation.SimulationReport;
import org.springframework.context.ApplicationEvent;

/**
 * Published after a simulation run finishes, including runs cut short by cancellation.
 */
public class SimulationCompletedEvent extends ApplicationEvent {

    private final SimulationReport report;

    public SimulationCompletedEvent(Object source, SimulationReport report) {
        super(source);
        this.report = report;
    }

    public SimulationReport getReport() {
        return report;
    }
}
