package com.dfsoptimizer.config;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import org.springframework.context.annotation.Configuration;

/**
 * Common tags for every meter. The engine's own meters are defined in
 * {@link com.dfsoptimizer.observability.EngineMetricsService}.
 */
@Configuration
public class MetricsConfig {

    private final MeterRegistry meterRegistry;

    public MetricsConfig(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    void configureCommonTags() {
        meterRegistry.config().commonTags("application", "dfs-lineup-engine");
    }
}
