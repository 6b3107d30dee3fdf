package com.dfsoptimizer.config;

import com.dfsoptimizer.domain.enums.ObjectiveType;
import com.dfsoptimizer.optimizer.MipSolver;
import com.dfsoptimizer.optimizer.OptimizerSettings;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Request defaults and limits for the lineup optimizer.
 *
 * <p>Only the API layer reads these, to fill fields a request leaves out. The optimizer itself
 * receives an explicit {@link OptimizerSettings} per run.
 *
 * <p>Properties prefix: {@code dfs.optimizer.*}
 */
@Configuration
@ConfigurationProperties(prefix = "dfs.optimizer")
@Getter
@Setter
public class OptimizerConfig {

    /** Lineups generated when a request does not say. */
    private int defaultLineupCount = 20;

    /** Upper bound on lineups per request. */
    private int maxLineupsPerRequest = 150;

    /** Solve time budget per lineup in milliseconds. */
    private long perLineupTimeoutMs = 10_000;

    private int defaultMinUniquePlayers = 1;

    /** Default objective jitter, percent of each player's value. */
    private double defaultJitterPercent = 0.0;

    private ObjectiveType defaultObjective = ObjectiveType.PROJECTION;

    /** Ownership weight of the EV objective. */
    private double evOwnershipWeight = 0.5;

    /** OR-Tools mixed-integer backend: SCIP or CBC. */
    private String solverBackend = MipSolver.DEFAULT_BACKEND;

    private long defaultSeed = 42L;
}
