package com.dfsoptimizer.optimizer;

import com.dfsoptimizer.domain.enums.BatchStatus;
import com.dfsoptimizer.domain.enums.BatchStopReason;
import com.dfsoptimizer.domain.enums.InfeasibilityCause;
import com.dfsoptimizer.domain.model.Lineup;
import java.util.List;
import lombok.Builder;
import lombok.Getter;

/**
 * Outcome of one optimizer batch. When fewer lineups than requested were produced,
 * {@link #getStopReason()} and {@link #getMessage()} say why.
 */
@Getter
@Builder
public class OptimizationResult {

    private final String batchId;
    private final List<Lineup> lineups;
    private final int requested;
    private final int delivered;
    private final BatchStatus status;
    private final BatchStopReason stopReason;

    /** Constraint class behind an INFEASIBLE stop, null otherwise. */
    private final InfeasibilityCause stopCause;

    private final String message;
    private final long elapsedMs;

    public boolean isPartial() {
        return delivered < requested;
    }

    public boolean isCancelled() {
        return stopReason == BatchStopReason.CANCELLED;
    }

    static OptimizationResult from(LineupBatch batch, long elapsedMs) {
        return OptimizationResult.builder()
                .batchId(batch.getBatchId())
                .lineups(List.copyOf(batch.getEmitted()))
                .requested(batch.getRequested())
                .delivered(batch.getDelivered())
                .status(batch.getStatus())
                .stopReason(batch.getStopReason())
                .stopCause(batch.getStopCause())
                .message(batch.getStopMessage())
                .elapsedMs(elapsedMs)
                .build();
    }
}
