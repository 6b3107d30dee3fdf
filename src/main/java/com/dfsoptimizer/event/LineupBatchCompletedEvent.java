package com.dfsoptimizer.event;

import com.dfsoptimizer.optimizer.OptimizationResult;
import org.springframework.context.ApplicationEvent;

/**
 * Published when an optimizer batch reaches a terminal state, complete or partial.
 */
public class LineupBatchCompletedEvent extends ApplicationEvent {

    private final OptimizationResult result;

    public LineupBatchCompletedEvent(Object source, OptimizationResult result) {
        super(source);
        this.result = result;
    }

    public OptimizationResult getResult() {
        return result;
    }
}
