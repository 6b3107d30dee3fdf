package com.dfsoptimizer.optimizer;

import com.dfsoptimizer.domain.enums.BatchStatus;
import com.dfsoptimizer.domain.enums.BatchStopReason;
import com.dfsoptimizer.domain.enums.InfeasibilityCause;
import com.dfsoptimizer.domain.model.Lineup;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single-threaded coordinator state for one optimizer batch: lifecycle status plus the
 * accumulating list of emitted lineups that the uniqueness cuts are built from.
 *
 * <p>Transitions: INITIALIZING -> SOLVING -> EMITTED -> SOLVING ... -> COMPLETE, or FAILED /
 * CANCELLED from any non-terminal state. An illegal transition is a programming error and
 * throws {@link IllegalStateException}.
 *
 * <p>Owned by one batch run and never shared; independent batches can run in parallel.
 */
public final class LineupBatch {

    private static final Logger log = LoggerFactory.getLogger(LineupBatch.class);

    private final String batchId = UUID.randomUUID().toString();
    private final int requested;
    private final List<Lineup> emitted = new ArrayList<>();

    private BatchStatus status = BatchStatus.INITIALIZING;
    private BatchStopReason stopReason = BatchStopReason.NONE;
    private InfeasibilityCause stopCause;
    private String stopMessage;

    public LineupBatch(int requested) {
        this.requested = requested;
    }

    /** Enters SOLVING for the next lineup index. */
    public int beginSolve() {
        requireStatus(BatchStatus.INITIALIZING, BatchStatus.EMITTED);
        status = BatchStatus.SOLVING;
        return emitted.size();
    }

    public void emit(Lineup lineup) {
        requireStatus(BatchStatus.SOLVING);
        emitted.add(lineup);
        status = BatchStatus.EMITTED;
        log.debug("Batch {} emitted {} ({}/{})", batchId, lineup, emitted.size(), requested);
    }

    public void complete() {
        requireStatus(BatchStatus.EMITTED);
        status = BatchStatus.COMPLETE;
    }

    /**
     * Ends the batch early. With at least one lineup emitted the batch is still COMPLETE, only
     * short; with none it is FAILED.
     */
    public void stop(BatchStopReason reason, InfeasibilityCause cause, String message) {
        requireNotTerminal();
        stopReason = reason;
        stopCause = cause;
        stopMessage = message;
        status = emitted.isEmpty() ? BatchStatus.FAILED : BatchStatus.COMPLETE;
    }

    public void cancel() {
        requireNotTerminal();
        stopReason = BatchStopReason.CANCELLED;
        stopMessage = "Cancelled after " + emitted.size() + " of " + requested + " lineup(s)";
        status = BatchStatus.CANCELLED;
    }

    public boolean isFull() {
        return emitted.size() >= requested;
    }

    public List<Lineup> getEmitted() {
        return Collections.unmodifiableList(emitted);
    }

    public String getBatchId() {
        return batchId;
    }

    public int getRequested() {
        return requested;
    }

    public int getDelivered() {
        return emitted.size();
    }

    public BatchStatus getStatus() {
        return status;
    }

    public BatchStopReason getStopReason() {
        return stopReason;
    }

    public InfeasibilityCause getStopCause() {
        return stopCause;
    }

    public String getStopMessage() {
        return stopMessage;
    }

    private void requireStatus(BatchStatus... allowed) {
        for (BatchStatus candidate : allowed) {
            if (status == candidate) {
                return;
            }
        }
        throw new IllegalStateException("Batch " + batchId + " cannot transition from " + status);
    }

    private void requireNotTerminal() {
        if (status.isTerminal()) {
            throw new IllegalStateException("Batch " + batchId + " is already " + status);
        }
    }
}
