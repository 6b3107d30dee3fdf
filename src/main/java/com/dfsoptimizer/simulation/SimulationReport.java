package com.dfsoptimizer.simulation;

import com.dfsoptimizer.domain.enums.DistributionMode;
import java.util.List;
import java.util.Optional;
import lombok.Builder;
import lombok.Getter;

/**
 * Output of one simulation run: per-lineup results plus the run summary. A cancelled run carries
 * {@code cancelled = true} and statistics over the trials completed before cancellation.
 */
@Getter
@Builder
public class SimulationReport {

    private final List<SimulationResult> results;
    private final List<PlayerOutcomeSummary> playerOutcomes;
    private final RoiDistribution roiDistribution;

    private final int trialsRequested;
    private final long trialsRun;
    private final long seed;
    private final DistributionMode distributionMode;
    private final int simulatedPlayers;
    private final int fieldSize;
    private final double entryFee;

    /** Cost of entering every simulated lineup once. */
    private final double totalEntryFees;

    /** Sum of the lineups' expected profit, in currency. */
    private final double totalExpectedProfit;

    private final boolean correlationCorrected;
    private final boolean cancelled;
    private final long elapsedMs;

    public Optional<SimulationResult> resultFor(String lineupId) {
        return results.stream().filter(r -> r.getLineupId().equals(lineupId)).findFirst();
    }
}
