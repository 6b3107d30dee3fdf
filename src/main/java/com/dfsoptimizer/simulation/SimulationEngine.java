package com.dfsoptimizer.simulation;

import com.dfsoptimizer.core.CancellationToken;
import com.dfsoptimizer.correlation.CorrelationMatrix;
import com.dfsoptimizer.domain.enums.DistributionMode;
import com.dfsoptimizer.domain.model.Lineup;
import com.dfsoptimizer.domain.model.Player;
import com.dfsoptimizer.event.EventPublisherHelper;
import com.dfsoptimizer.exception.BaseException;
import com.dfsoptimizer.exception.ResourceBudgetExceededException;
import com.dfsoptimizer.exception.ValidationException;
import com.dfsoptimizer.pool.PlayerPool;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

/**
 * Correlated Monte Carlo evaluation of a lineup batch.
 *
 * <p>The simulated player set is every lineup player plus the most-owned remaining players (up
 * to the field player limit), so the field model sees the chalk even when no lineup rosters it.
 * Trials are split into fixed-size chunks. Each chunk draws from its own {@link Well19937c}
 * seeded by (run seed, chunk index) and fills its own {@link ChunkAccumulator}; chunks run on
 * the {@code simulationExecutor} in waves of the pool size and are merged strictly in chunk
 * order. Raw draws are never retained, and the results are identical for a given seed whatever
 * the thread count.
 *
 * <p>Budgets:
 * <ul>
 *   <li>trials above {@code maxTrials}, or histogram memory above {@code maxHistogramBytes},
 *       fail with {@link ResourceBudgetExceededException} before any draw</li>
 *   <li>a chunk running past {@code chunkTimeoutMs} aborts the run with the same exception</li>
 * </ul>
 * Cancellation is checked between waves; a cancelled run reports the trials already merged.
 */
@Service
public class SimulationEngine {

    private static final Logger log = LoggerFactory.getLogger(SimulationEngine.class);

    private static final int TIME_CHECK_INTERVAL = 1024;
    private static final double LOWER_SPAN_SD = 8.0;
    private static final double UPPER_SPAN_SD = 12.0;

    private final ThreadPoolTaskExecutor simulationExecutor;
    private final EventPublisherHelper eventPublisherHelper;

    public SimulationEngine(
            @Qualifier("simulationExecutor") ThreadPoolTaskExecutor simulationExecutor,
            EventPublisherHelper eventPublisherHelper) {
        this.simulationExecutor = simulationExecutor;
        this.eventPublisherHelper = eventPublisherHelper;
    }

    public SimulationReport simulate(
            List<Lineup> lineups, PlayerPool pool, CorrelationMatrix matrix, SimulationSettings settings) {
        return simulate(lineups, pool, matrix, settings, CancellationToken.none());
    }

    public SimulationReport simulate(
            List<Lineup> lineups,
            PlayerPool pool,
            CorrelationMatrix matrix,
            SimulationSettings settings,
            CancellationToken cancellationToken) {
        if (lineups == null || lineups.isEmpty()) {
            throw new ValidationException("At least one lineup is required for simulation");
        }
        if (matrix.size() != pool.size()) {
            throw new ValidationException("Correlation matrix covers " + matrix.size() + " players, pool has " + pool.size());
        }
        if (settings.getTrials() > settings.getMaxTrials()) {
            throw new ResourceBudgetExceededException(
                    "Requested " + settings.getTrials() + " trials exceeds budget of " + settings.getMaxTrials(),
                    Map.of("trials", settings.getTrials(), "maxTrials", settings.getMaxTrials()));
        }

        long startNanos = System.nanoTime();
        int[] simulated = selectSimulatedPlayers(lineups, pool, settings.getFieldPlayerLimit());
        Map<Integer, Integer> sampleIndexOf = new HashMap<>();
        for (int i = 0; i < simulated.length; i++) {
            sampleIndexOf.put(simulated[i], i);
        }

        List<MarginalDistribution> marginals = new ArrayList<>(simulated.length);
        double[] ownership = new double[simulated.length];
        for (int i = 0; i < simulated.length; i++) {
            Player player = pool.get(simulated[i]);
            marginals.add(MarginalDistribution.of(player, settings.getDistributionMode()));
            ownership[i] = player.getEffectiveOwnership();
        }
        CorrelatedSampler sampler = CorrelatedSampler.create(matrix, simulated, marginals);

        int rosterSize = lineups.get(0).getAssignments().size();
        FieldModel fieldModel = FieldModel.create(
                ownership, rosterSize, settings.getFieldSize(),
                PayoutStructure.of(settings.getContestType(), settings.getFieldSize()));

        int[][] lineupSamples = new int[lineups.size()][];
        double[] targets = new double[lineups.size()];
        ScoreHistogram[] lineupLayouts = new ScoreHistogram[lineups.size()];
        for (int l = 0; l < lineups.size(); l++) {
            Lineup lineup = lineups.get(l);
            lineupSamples[l] = lineup.getPlayers().stream()
                    .mapToInt(p -> sampleIndexOf.get(pool.indexOf(p.getId())))
                    .toArray();
            targets[l] = settings.getTargetScore() != null ? settings.getTargetScore() : lineup.getTotalProjection();
            lineupLayouts[l] = lineupLayout(lineup, pool, matrix, settings);
        }

        int[] reportedPlayers = lineupPlayerSamples(lineupSamples);
        ScoreHistogram[] playerLayouts = new ScoreHistogram[reportedPlayers.length];
        double[] projections = new double[reportedPlayers.length];
        for (int r = 0; r < reportedPlayers.length; r++) {
            Player player = pool.get(simulated[reportedPlayers[r]]);
            projections[r] = player.getEffectiveProjection();
            playerLayouts[r] = playerLayout(player, settings);
        }

        enforceMemoryBudget(lineupLayouts, playerLayouts, settings);

        log.info(
                "Simulating {} lineup(s) over {} trial(s): seed={}, mode={}, players={}, chunks={}",
                lineups.size(),
                settings.getTrials(),
                settings.getSeed(),
                settings.getDistributionMode(),
                simulated.length,
                settings.getChunkCount());

        ChunkJob job = new ChunkJob(
                sampler, fieldModel, lineupSamples, targets, reportedPlayers, projections,
                lineupLayouts, playerLayouts, settings);

        ChunkAccumulator total = new ChunkAccumulator(lineupLayouts, playerLayouts);
        boolean cancelled = false;
        int chunkCount = settings.getChunkCount();
        int wave = Math.max(1, simulationExecutor.getMaxPoolSize());
        for (int first = 0; first < chunkCount; first += wave) {
            if (cancellationToken.isCancelled()) {
                cancelled = true;
                log.warn("Simulation cancelled after {} of {} trial(s)", total.trials, settings.getTrials());
                break;
            }
            List<CompletableFuture<ChunkAccumulator>> futures = new ArrayList<>();
            for (int chunk = first; chunk < Math.min(first + wave, chunkCount); chunk++) {
                int chunkIndex = chunk;
                futures.add(CompletableFuture.supplyAsync(() -> job.run(chunkIndex), simulationExecutor));
            }
            for (CompletableFuture<ChunkAccumulator> future : futures) {
                total.merge(await(future));
            }
        }

        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
        SimulationReport report = buildReport(
                lineups, pool, simulated, reportedPlayers, targets, total, settings, matrix, cancelled, elapsedMs);
        log.info("Simulation finished: {} trial(s) in {}ms{}", report.getTrialsRun(), elapsedMs,
                cancelled ? " (cancelled)" : "");
        eventPublisherHelper.publishSimulationCompleted(this, report);
        return report;
    }

    private static ChunkAccumulator await(CompletableFuture<ChunkAccumulator> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof BaseException baseException) {
                throw baseException;
            }
            throw new IllegalStateException("Simulation chunk failed", e.getCause());
        }
    }

    /** Lineup players first in pool order, then the most-owned others up to the limit. */
    private static int[] selectSimulatedPlayers(List<Lineup> lineups, PlayerPool pool, int fieldPlayerLimit) {
        TreeSet<Integer> selected = new TreeSet<>();
        for (Lineup lineup : lineups) {
            for (Player player : lineup.getPlayers()) {
                int index = pool.indexOf(player.getId());
                if (index < 0) {
                    throw new ValidationException("Lineup " + lineup.getLineupId() + " references unknown player " + player.getId());
                }
                selected.add(index);
            }
        }
        List<Integer> others = new ArrayList<>();
        for (int i = 0; i < pool.size(); i++) {
            if (!selected.contains(i) && !pool.get(i).isBanned()) {
                others.add(i);
            }
        }
        others.sort(Comparator.comparingDouble((Integer i) -> -pool.get(i).getEffectiveOwnership())
                .thenComparingInt(i -> i));
        selected.addAll(others.subList(0, Math.min(fieldPlayerLimit, others.size())));
        return selected.stream().mapToInt(Integer::intValue).toArray();
    }

    private static int[] lineupPlayerSamples(int[][] lineupSamples) {
        TreeSet<Integer> samples = new TreeSet<>();
        for (int[] lineup : lineupSamples) {
            for (int sample : lineup) {
                samples.add(sample);
            }
        }
        return samples.stream().mapToInt(Integer::intValue).toArray();
    }

    private static ScoreHistogram lineupLayout(
            Lineup lineup, PlayerPool pool, CorrelationMatrix matrix, SimulationSettings settings) {
        List<Player> players = lineup.getPlayers();
        double mean = 0.0;
        double variance = 0.0;
        double historyLow = 0.0;
        double historyHigh = 0.0;
        for (Player a : players) {
            mean += a.getEffectiveProjection();
            for (Player b : players) {
                double rho = matrix.get(pool.indexOf(a.getId()), pool.indexOf(b.getId()));
                variance += rho * a.getEffectiveStdDev() * b.getEffectiveStdDev();
            }
            if (settings.getDistributionMode() == DistributionMode.EMPIRICAL && a.hasHistory()) {
                historyLow += a.getHistoricalScores().stream().mapToDouble(Double::doubleValue).min().orElse(0.0);
                historyHigh += a.getHistoricalScores().stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
            }
        }
        double sd = Math.sqrt(Math.max(variance, 0.0));
        double lower = Math.min(Math.min(0.0, historyLow), mean - LOWER_SPAN_SD * sd);
        double upper = Math.max(historyHigh, mean + UPPER_SPAN_SD * sd) + settings.getHistogramBinWidth();
        return ScoreHistogram.covering(lower, upper, settings.getHistogramBinWidth());
    }

    private static ScoreHistogram playerLayout(Player player, SimulationSettings settings) {
        double mean = player.getEffectiveProjection();
        double sd = player.getEffectiveStdDev();
        double lower = Math.min(0.0, mean - LOWER_SPAN_SD * sd);
        double upper = mean + UPPER_SPAN_SD * sd + settings.getHistogramBinWidth();
        if (settings.getDistributionMode() == DistributionMode.EMPIRICAL && player.hasHistory()) {
            lower = Math.min(lower, player.getHistoricalScores().stream().mapToDouble(Double::doubleValue).min().orElse(0.0));
            upper = Math.max(upper, player.getHistoricalScores().stream().mapToDouble(Double::doubleValue).max().orElse(0.0));
        }
        return ScoreHistogram.covering(lower, upper, settings.getHistogramBinWidth());
    }

    private void enforceMemoryBudget(
            ScoreHistogram[] lineupLayouts, ScoreHistogram[] playerLayouts, SimulationSettings settings) {
        long perAccumulator = 0;
        for (ScoreHistogram layout : lineupLayouts) {
            perAccumulator += ScoreHistogram.estimateBytes(layout.getBinCount());
        }
        for (ScoreHistogram layout : playerLayouts) {
            perAccumulator += ScoreHistogram.estimateBytes(layout.getBinCount());
        }
        // one accumulator per in-flight chunk plus the running total
        int inFlight = Math.min(settings.getChunkCount(), Math.max(1, simulationExecutor.getMaxPoolSize())) + 1;
        long estimate = perAccumulator * inFlight;
        if (estimate > settings.getMaxHistogramBytes()) {
            throw new ResourceBudgetExceededException(
                    "Histogram memory estimate " + estimate + " bytes exceeds budget of " + settings.getMaxHistogramBytes(),
                    Map.of("estimatedBytes", estimate, "maxHistogramBytes", settings.getMaxHistogramBytes()));
        }
    }

    private static SimulationReport buildReport(
            List<Lineup> lineups,
            PlayerPool pool,
            int[] simulated,
            int[] reportedPlayers,
            double[] targets,
            ChunkAccumulator total,
            SimulationSettings settings,
            CorrelationMatrix matrix,
            boolean cancelled,
            long elapsedMs) {
        long n = total.trials;
        List<SimulationResult> results = new ArrayList<>(lineups.size());
        List<Double> rois = new ArrayList<>(lineups.size());
        for (int l = 0; l < lineups.size(); l++) {
            Lineup lineup = lineups.get(l);
            ScoreHistogram histogram = total.lineupHistograms[l];
            double roi = ChunkAccumulator.mean(total.roiSum[l], n);
            rois.add(roi);
            results.add(SimulationResult.builder()
                    .lineupId(lineup.getLineupId())
                    .trials(n)
                    .meanScore(ChunkAccumulator.mean(total.lineupSum[l], n))
                    .stdDev(ChunkAccumulator.stdDev(total.lineupSum[l], total.lineupSumSquares[l], n))
                    .p5(histogram.percentile(0.05))
                    .p25(histogram.percentile(0.25))
                    .p50(histogram.percentile(0.50))
                    .p75(histogram.percentile(0.75))
                    .p95(histogram.percentile(0.95))
                    .targetScore(targets[l])
                    .probabilityAboveTarget(n > 0 ? (double) total.aboveTarget[l] / n : 0.0)
                    .winProbability(ChunkAccumulator.mean(total.winProbabilitySum[l], n))
                    .expectedRank(ChunkAccumulator.mean(total.rankSum[l], n))
                    .roi(roi)
                    .entryFee(settings.getEntryFee())
                    .expectedPayout((1.0 + roi) * settings.getEntryFee())
                    .expectedProfit(roi * settings.getEntryFee())
                    .duplicateRisk(LineupMetrics.duplicateRisk(lineup, settings.getFieldSize()))
                    .leverage(LineupMetrics.leverage(lineup))
                    .totalOwnership(lineup.getTotalOwnership())
                    .build());
        }

        List<PlayerOutcomeSummary> outcomes = new ArrayList<>(reportedPlayers.length);
        for (int r = 0; r < reportedPlayers.length; r++) {
            Player player = pool.get(simulated[reportedPlayers[r]]);
            ScoreHistogram histogram = total.playerHistograms[r];
            outcomes.add(PlayerOutcomeSummary.builder()
                    .playerId(player.getId())
                    .name(player.getName())
                    .projection(player.getEffectiveProjection())
                    .mean(ChunkAccumulator.mean(total.playerSum[r], n))
                    .stdDev(ChunkAccumulator.stdDev(total.playerSum[r], total.playerSumSquares[r], n))
                    .p5(histogram.percentile(0.05))
                    .p25(histogram.percentile(0.25))
                    .p50(histogram.percentile(0.50))
                    .p75(histogram.percentile(0.75))
                    .p95(histogram.percentile(0.95))
                    .boomRate(n > 0 ? (double) total.boomCount[r] / n : 0.0)
                    .bustRate(n > 0 ? (double) total.bustCount[r] / n : 0.0)
                    .build());
        }

        return SimulationReport.builder()
                .results(List.copyOf(results))
                .playerOutcomes(List.copyOf(outcomes))
                .roiDistribution(RoiDistribution.of(rois))
                .trialsRequested(settings.getTrials())
                .trialsRun(n)
                .seed(settings.getSeed())
                .distributionMode(settings.getDistributionMode())
                .simulatedPlayers(simulated.length)
                .fieldSize(settings.getFieldSize())
                .entryFee(settings.getEntryFee())
                .totalEntryFees(settings.getEntryFee() * lineups.size())
                .totalExpectedProfit(results.stream().mapToDouble(SimulationResult::getExpectedProfit).sum())
                .correlationCorrected(matrix.isCorrected())
                .cancelled(cancelled)
                .elapsedMs(elapsedMs)
                .build();
    }

    /** Immutable description of the work shared by every chunk of one run. */
    private record ChunkJob(
            CorrelatedSampler sampler,
            FieldModel fieldModel,
            int[][] lineupSamples,
            double[] targets,
            int[] reportedPlayers,
            double[] projections,
            ScoreHistogram[] lineupLayouts,
            ScoreHistogram[] playerLayouts,
            SimulationSettings settings) {

        ChunkAccumulator run(int chunkIndex) {
            long startNanos = System.nanoTime();
            long budgetNanos = TimeUnit.MILLISECONDS.toNanos(settings.getChunkTimeoutMs());
            int firstTrial = chunkIndex * settings.getChunkSize();
            int trials = Math.min(settings.getChunkSize(), settings.getTrials() - firstTrial);

            long seed = settings.getSeed();
            RandomGenerator random = new Well19937c(new int[] {(int) seed, (int) (seed >>> 32), chunkIndex});
            FieldModel field = fieldModel.copy();
            ChunkAccumulator acc = new ChunkAccumulator(lineupLayouts, playerLayouts);
            double[] independent = new double[sampler.size()];
            double[] scores = new double[sampler.size()];

            for (int t = 0; t < trials; t++) {
                if (t % TIME_CHECK_INTERVAL == 0 && System.nanoTime() - startNanos > budgetNanos) {
                    throw new ResourceBudgetExceededException(
                            "Simulation chunk " + chunkIndex + " exceeded time budget of " + settings.getChunkTimeoutMs() + "ms",
                            Map.of("chunk", chunkIndex, "chunkTimeoutMs", settings.getChunkTimeoutMs(), "trialsDone", t));
                }
                sampler.draw(random, independent, scores);
                field.prepare(scores);

                for (int l = 0; l < lineupSamples.length; l++) {
                    double score = 0.0;
                    for (int sample : lineupSamples[l]) {
                        score += scores[sample];
                    }
                    acc.lineupSum[l] += score;
                    acc.lineupSumSquares[l] += score * score;
                    acc.lineupHistograms[l].add(score);
                    if (score > targets[l]) {
                        acc.aboveTarget[l]++;
                    }
                    double beat = field.beatProbability(score);
                    acc.winProbabilitySum[l] += field.winProbability(beat);
                    acc.rankSum[l] += field.expectedRank(beat);
                    acc.roiSum[l] += field.roi(beat);
                }

                for (int r = 0; r < reportedPlayers.length; r++) {
                    double score = scores[reportedPlayers[r]];
                    acc.playerSum[r] += score;
                    acc.playerSumSquares[r] += score * score;
                    acc.playerHistograms[r].add(score);
                    if (score >= projections[r] * PlayerOutcomeSummary.BOOM_MULTIPLE) {
                        acc.boomCount[r]++;
                    }
                    if (score <= projections[r] * PlayerOutcomeSummary.BUST_MULTIPLE) {
                        acc.bustCount[r]++;
                    }
                }
            }
            acc.trials = trials;
            log.debug("Chunk {} finished {} trial(s)", chunkIndex, trials);
            return acc;
        }
    }
}
