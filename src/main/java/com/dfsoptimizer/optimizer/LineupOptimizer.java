package com.dfsoptimizer.optimizer;

import com.dfsoptimizer.constraint.ConstraintSet;
import com.dfsoptimizer.constraint.FeasibilityResult;
import com.dfsoptimizer.constraint.LineupCandidate;
import com.dfsoptimizer.core.CancellationToken;
import com.dfsoptimizer.domain.enums.BatchStopReason;
import com.dfsoptimizer.domain.enums.InfeasibilityCause;
import com.dfsoptimizer.domain.model.Lineup;
import com.dfsoptimizer.domain.model.Player;
import com.dfsoptimizer.domain.model.SlotAssignment;
import com.dfsoptimizer.event.EventPublisherHelper;
import com.dfsoptimizer.exception.InfeasibleException;
import com.dfsoptimizer.exception.SolverTimeoutException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Generates a batch of distinct optimal lineups.
 *
 * <p>Lineups are solved strictly in sequence. After lineup k is emitted, a uniqueness cut
 * against it is added to every later program, so no two lineups share more than
 * {@code rosterSize - minUniquePlayers} players. Optional objective jitter adds further spread.
 *
 * <p>Failure handling:
 * <ul>
 *   <li>structurally impossible rules (lock salary over cap, no eligible player for a slot...)
 *       are caught before solving and thrown as {@link InfeasibleException}</li>
 *   <li>an infeasible first lineup is thrown with the diagnosed constraint class</li>
 *   <li>an infeasible later lineup (diversity exhausted) or a timeout ends the batch early and
 *       returns what was already emitted, with requested vs delivered counts</li>
 *   <li>a cancelled token is honored between solves</li>
 * </ul>
 *
 * <p>Every lineup is re-checked against the {@link ConstraintSet} before emission; a lineup that
 * fails the check is never returned.
 */
@Service
public class LineupOptimizer {

    private static final Logger log = LoggerFactory.getLogger(LineupOptimizer.class);

    private final MipSolver solver;
    private final EventPublisherHelper eventPublisherHelper;

    public LineupOptimizer(MipSolver solver, EventPublisherHelper eventPublisherHelper) {
        this.solver = solver;
        this.eventPublisherHelper = eventPublisherHelper;
    }

    public OptimizationResult optimize(ConstraintSet constraints, OptimizerSettings settings) {
        return optimize(constraints, settings, CancellationToken.none());
    }

    public OptimizationResult optimize(
            ConstraintSet constraints, OptimizerSettings settings, CancellationToken cancellationToken) {
        long startNanos = System.nanoTime();
        log.info(
                "Optimizing {} lineup(s): objective={}, minUnique={}, jitter={}%, pool={}",
                settings.getLineupCount(),
                settings.getObjective(),
                constraints.getMinUniquePlayers(),
                settings.getJitterPercent(),
                constraints.getPool().size());

        FeasibilityPrecheck.check(constraints);

        LineupBatch batch = new LineupBatch(settings.getLineupCount());
        ObjectiveCalculator objective = ObjectiveCalculator.from(settings);
        List<Player> players = constraints.getPool().getPlayers();

        while (!batch.isFull()) {
            if (cancellationToken.isCancelled()) {
                batch.cancel();
                log.warn("Batch {} cancelled: {}", batch.getBatchId(), batch.getStopMessage());
                break;
            }
            int index = batch.beginSolve();
            double[] values = objective.perturbedValues(players, settings.getJitterPercent(), settings.getSeed(), index);
            LineupProgram program = LineupProgramBuilder.build(constraints, values, batch.getEmitted());

            IntegerSolution solution;
            try {
                solution = solver.solve(program.getProgram(), settings.getSolverBackend(), settings.getPerLineupTimeoutMs());
            } catch (InfeasibleException e) {
                InfeasibilityCause cause = FeasibilityPrecheck.diagnose(
                        program, solver, settings.getSolverBackend(), settings.getPerLineupTimeoutMs());
                String message = "Lineup " + (index + 1) + " is infeasible (" + cause + ")";
                batch.stop(BatchStopReason.INFEASIBLE, cause, message);
                if (index == 0) {
                    publish(batch, startNanos);
                    throw new InfeasibleException(cause, message, Map.of("lineupIndex", index));
                }
                log.warn("Batch {} stopped at {}/{}: {}", batch.getBatchId(), index, batch.getRequested(), message);
                break;
            } catch (SolverTimeoutException e) {
                batch.stop(BatchStopReason.TIMEOUT, null, e.getMessage());
                log.warn("Batch {} timed out at lineup {}: {}", batch.getBatchId(), index + 1, e.getMessage());
                break;
            }

            Player[] seated = program.decode(solution);
            Lineup lineup = seated != null ? toLineup(seated, index, constraints, objective) : null;
            if (lineup == null) {
                batch.stop(BatchStopReason.INFEASIBLE, InfeasibilityCause.UNKNOWN,
                        "Solver returned a player set that cannot be seated");
                log.error("Batch {} produced an unseatable solution at lineup {}", batch.getBatchId(), index + 1);
                break;
            }
            FeasibilityResult check = constraints.evaluate(LineupCandidate.from(constraints.getSlotSpec(), lineup), batch.getEmitted());
            if (!check.isFeasible()) {
                batch.stop(BatchStopReason.INFEASIBLE, InfeasibilityCause.UNKNOWN,
                        "Solved lineup failed verification: " + check.getViolations());
                log.error("Batch {} lineup {} failed verification: {}", batch.getBatchId(), index + 1, check.getViolations());
                break;
            }
            batch.emit(lineup);
        }
        if (batch.isFull() && !batch.getStatus().isTerminal()) {
            batch.complete();
        }

        OptimizationResult result = publish(batch, startNanos);
        log.info(
                "Batch {} {}: delivered {}/{} in {}ms{}",
                result.getBatchId(),
                result.getStatus(),
                result.getDelivered(),
                result.getRequested(),
                result.getElapsedMs(),
                result.isPartial() ? " (" + result.getStopReason() + ")" : "");
        return result;
    }

    private OptimizationResult publish(LineupBatch batch, long startNanos) {
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
        OptimizationResult result = OptimizationResult.from(batch, elapsedMs);
        eventPublisherHelper.publishBatchCompleted(this, result);
        return result;
    }

    private static Lineup toLineup(Player[] seated, int index, ConstraintSet constraints, ObjectiveCalculator objective) {
        if (Arrays.stream(seated).anyMatch(p -> p == null)) {
            return null;
        }
        List<SlotAssignment> assignments = new ArrayList<>(seated.length);
        for (int s = 0; s < seated.length; s++) {
            assignments.add(SlotAssignment.builder()
                    .slotIndex(s)
                    .slotName(constraints.getSlotSpec().getSlot(s).getName())
                    .player(seated[s])
                    .build());
        }
        List<Player> players = Arrays.asList(seated);
        return Lineup.builder()
                .lineupId(String.format("lineup-%03d", index + 1))
                .generationIndex(index)
                .assignments(List.copyOf(assignments))
                .totalSalary(players.stream().mapToInt(Player::getSalary).sum())
                .totalProjection(players.stream().mapToDouble(Player::getEffectiveProjection).sum())
                .objectiveValue(objective.totalOf(players))
                .build();
    }
}
