package com.dfsoptimizer.config;

import com.dfsoptimizer.domain.enums.ContestType;
import com.dfsoptimizer.domain.enums.DistributionMode;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Request defaults and resource budgets for the simulation engine.
 *
 * <p>Properties prefix: {@code dfs.simulation.*}
 */
@Configuration
@ConfigurationProperties(prefix = "dfs.simulation")
@Getter
@Setter
public class SimulationConfig {

    private int defaultTrials = 10_000;

    /** Hard trial budget; larger requests fail before any draw. */
    private int maxTrials = 1_000_000;

    /** Trials per chunk. Each chunk is one unit of parallel work and one cancellation point. */
    private int chunkSize = 5_000;

    /** Time budget per chunk in milliseconds. */
    private long chunkTimeoutMs = 30_000;

    /** Histogram resolution in fantasy points; percentiles are accurate to this width. */
    private double histogramBinWidth = 0.1;

    /** Budget for all histograms held at once, in bytes. */
    private long maxHistogramBytes = 256L * 1024 * 1024;

    /** Most-owned non-lineup players included in the field model. */
    private int fieldPlayerLimit = 60;

    private int defaultFieldSize = 10_000;

    private double defaultEntryFee = 20.0;

    private ContestType defaultContestType = ContestType.GPP;

    private DistributionMode defaultDistributionMode = DistributionMode.NORMAL;

    private long defaultSeed = 42L;
}
