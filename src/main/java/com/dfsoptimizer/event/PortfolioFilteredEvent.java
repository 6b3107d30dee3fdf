package com.dfsoptimizer.event;

import com.dfsoptimizer.portfolio.PortfolioFilterResult;
import org.springframework.context.ApplicationEvent;

public class PortfolioFilteredEvent extends ApplicationEvent {

    private final PortfolioFilterResult result;

    public PortfolioFilteredEvent(Object source, PortfolioFilterResult result) {
        super(source);
        this.result = result;
    }

    public PortfolioFilterResult getResult() {
        return result;
    }
}
