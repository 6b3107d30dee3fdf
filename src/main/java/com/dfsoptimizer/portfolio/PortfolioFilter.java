package com.dfsoptimizer.portfolio;

import com.dfsoptimizer.domain.enums.ExclusionReason;
import com.dfsoptimizer.domain.enums.ExposureStatus;
import com.dfsoptimizer.domain.model.Lineup;
import com.dfsoptimizer.domain.model.Player;
import com.dfsoptimizer.event.EventPublisherHelper;
import com.dfsoptimizer.exception.ValidationException;
import com.dfsoptimizer.simulation.LineupMetrics;
import com.dfsoptimizer.simulation.SimulationResult;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Partitions a lineup batch into kept and excluded lineups. Lineups are never modified.
 *
 * <p>Pass 1, thresholds: each lineup is checked against the portfolio thresholds in a fixed order
 * (duplicate risk, leverage, ROI, total ownership, win probability) and excluded with the first
 * one it fails.
 *
 * <p>Pass 2, exposure: while some player's count lies outside its target range (one lineup of
 * rounding slack), the lowest-objective lineup that makes the worst violation worse is dropped:
 * one containing an over-exposed player, or one lacking an under-exposed player. A drop that
 * does not reduce the total violation is reverted and the pass stops, leaving the batch
 * flagged as non-compliant.
 */
@Slf4j
@Service
public class PortfolioFilter {

    private final EventPublisherHelper eventPublisherHelper;

    public PortfolioFilter(EventPublisherHelper eventPublisherHelper) {
        this.eventPublisherHelper = eventPublisherHelper;
    }

    /**
     * @param simulationResults results keyed by lineup id; required only for ROI and win-probability thresholds
     * @param exposureTargets   explicit targets; player-level min/max exposure fields are merged in
     */
    public PortfolioFilterResult filter(
            List<Lineup> lineups,
            Map<String, SimulationResult> simulationResults,
            List<ExposureTarget> exposureTargets,
            PortfolioThresholds thresholds,
            int fieldSize) {
        PortfolioThresholds limits = thresholds != null ? thresholds : PortfolioThresholds.none();
        Map<String, SimulationResult> results = simulationResults != null ? simulationResults : Map.of();

        List<Player> players = distinctPlayers(lineups);
        List<ExposureTarget> targets = ExposureTarget.merge(players, exposureTargets);
        targets.forEach(ExposureTarget::validate);

        List<ExcludedLineup> excluded = new ArrayList<>();
        List<Lineup> kept = new ArrayList<>();
        for (Lineup lineup : lineups) {
            ExcludedLineup exclusion = checkThresholds(lineup, results.get(lineup.getLineupId()), limits, fieldSize);
            if (exclusion != null) {
                excluded.add(exclusion);
            } else {
                kept.add(lineup);
            }
        }

        boolean compliant = enforceExposure(kept, targets, excluded);

        kept.sort(Comparator.comparingInt(Lineup::getGenerationIndex));
        PortfolioFilterResult result = PortfolioFilterResult.builder()
                .kept(List.copyOf(kept))
                .excluded(List.copyOf(excluded))
                .exposureReport(exposureReport(players, targets, kept))
                .exposureCompliant(compliant)
                .build();
        log.info("Portfolio filter kept {}/{} lineup(s), excluded {}{}", kept.size(), lineups.size(), excluded.size(),
                compliant ? "" : " (exposure targets not fully met)");
        eventPublisherHelper.publishPortfolioFiltered(this, result);
        return result;
    }

    private ExcludedLineup checkThresholds(
            Lineup lineup, SimulationResult result, PortfolioThresholds limits, int fieldSize) {
        if (limits.needsSimulation() && result == null) {
            throw new ValidationException("No simulation result for lineup " + lineup.getLineupId());
        }
        if (limits.getMaxDuplicateRisk() != null) {
            double risk = result != null ? result.getDuplicateRisk() : LineupMetrics.duplicateRisk(lineup, fieldSize);
            if (risk > limits.getMaxDuplicateRisk()) {
                return exclusion(lineup, ExclusionReason.MAX_DUPLICATE_RISK, risk, limits.getMaxDuplicateRisk());
            }
        }
        if (limits.getMinLeverage() != null) {
            double leverage = result != null ? result.getLeverage() : LineupMetrics.leverage(lineup);
            if (leverage < limits.getMinLeverage()) {
                return exclusion(lineup, ExclusionReason.MIN_LEVERAGE, leverage, limits.getMinLeverage());
            }
        }
        if (limits.getMinRoi() != null && result.getRoi() < limits.getMinRoi()) {
            return exclusion(lineup, ExclusionReason.MIN_ROI, result.getRoi(), limits.getMinRoi());
        }
        if (limits.getMaxTotalOwnership() != null && lineup.getTotalOwnership() > limits.getMaxTotalOwnership()) {
            return exclusion(lineup, ExclusionReason.MAX_TOTAL_OWNERSHIP, lineup.getTotalOwnership(),
                    limits.getMaxTotalOwnership());
        }
        if (limits.getMinWinProbability() != null && result.getWinProbability() < limits.getMinWinProbability()) {
            return exclusion(lineup, ExclusionReason.MIN_WIN_PROBABILITY, result.getWinProbability(),
                    limits.getMinWinProbability());
        }
        return null;
    }

    private static ExcludedLineup exclusion(Lineup lineup, ExclusionReason reason, double value, double threshold) {
        return ExcludedLineup.builder()
                .lineupId(lineup.getLineupId())
                .reason(reason)
                .detail(String.format("%.4f vs threshold %.4f", value, threshold))
                .build();
    }

    /** @return true when every target holds after the pass */
    private boolean enforceExposure(List<Lineup> kept, List<ExposureTarget> targets, List<ExcludedLineup> excluded) {
        if (targets.isEmpty()) {
            return true;
        }
        int guard = kept.size();
        int violation = totalViolation(kept, targets);
        while (violation > 0 && guard-- > 0 && kept.size() > 1) {
            Lineup drop = pickDrop(kept, targets);
            if (drop == null) {
                break;
            }
            kept.remove(drop);
            int after = totalViolation(kept, targets);
            if (after >= violation) {
                kept.add(drop);
                break;
            }
            violation = after;
            excluded.add(ExcludedLineup.builder()
                    .lineupId(drop.getLineupId())
                    .reason(ExclusionReason.EXPOSURE)
                    .detail("Dropped to bring player exposure within target")
                    .build());
        }
        if (violation > 0) {
            log.warn("Exposure targets still violated by {} lineup(s) across {} kept lineup(s)", violation, kept.size());
        }
        return violation == 0;
    }

    private static Lineup pickDrop(List<Lineup> kept, List<ExposureTarget> targets) {
        int n = kept.size();
        ExposureTarget worst = null;
        int worstExcess = 0;
        boolean worstIsOver = false;
        for (ExposureTarget target : targets) {
            int count = count(kept, target.getPlayerId());
            int over = count - target.maxCount(n);
            int under = target.minCount(n) - count;
            if (over > worstExcess) {
                worst = target;
                worstExcess = over;
                worstIsOver = true;
            }
            // a player in no kept lineup cannot be raised by dropping lineups
            if (count > 0 && under > worstExcess) {
                worst = target;
                worstExcess = under;
                worstIsOver = false;
            }
        }
        if (worst == null) {
            return null;
        }
        String playerId = worst.getPlayerId();
        boolean mustContain = worstIsOver;
        return kept.stream()
                .filter(l -> l.contains(playerId) == mustContain)
                .min(Comparator.comparingDouble(Lineup::getObjectiveValue)
                        .thenComparing(Comparator.comparingInt(Lineup::getGenerationIndex).reversed()))
                .orElse(null);
    }

    private static int totalViolation(List<Lineup> kept, List<ExposureTarget> targets) {
        int n = kept.size();
        int total = 0;
        for (ExposureTarget target : targets) {
            int count = count(kept, target.getPlayerId());
            total += Math.max(0, count - target.maxCount(n)) + Math.max(0, target.minCount(n) - count);
        }
        return total;
    }

    private static int count(List<Lineup> lineups, String playerId) {
        int count = 0;
        for (Lineup lineup : lineups) {
            if (lineup.contains(playerId)) {
                count++;
            }
        }
        return count;
    }

    private static List<Player> distinctPlayers(List<Lineup> lineups) {
        Map<String, Player> players = new LinkedHashMap<>();
        lineups.forEach(l -> l.getPlayers().forEach(p -> players.putIfAbsent(p.getId(), p)));
        return new ArrayList<>(players.values());
    }

    private static List<ExposureReportEntry> exposureReport(
            List<Player> players, List<ExposureTarget> targets, List<Lineup> kept) {
        Map<String, ExposureTarget> targetById = new LinkedHashMap<>();
        targets.forEach(t -> targetById.put(t.getPlayerId(), t));
        Map<String, String> names = new LinkedHashMap<>();
        players.forEach(p -> names.put(p.getId(), p.getName()));
        targets.forEach(t -> names.putIfAbsent(t.getPlayerId(), t.getPlayerId()));

        int n = kept.size();
        List<ExposureReportEntry> report = new ArrayList<>();
        names.forEach((id, name) -> {
            int count = count(kept, id);
            ExposureTarget target = targetById.get(id);
            ExposureStatus status = ExposureStatus.WITHIN;
            if (target != null && count > target.maxCount(n)) {
                status = ExposureStatus.OVER;
            } else if (target != null && count < target.minCount(n)) {
                status = ExposureStatus.UNDER;
            }
            report.add(ExposureReportEntry.builder()
                    .playerId(id)
                    .name(name)
                    .count(count)
                    .exposure(n > 0 ? (double) count / n : 0.0)
                    .targetMin(target != null ? target.getMinExposure() : null)
                    .targetMax(target != null ? target.getMaxExposure() : null)
                    .status(status)
                    .build());
        });
        report.sort(Comparator.comparingInt(ExposureReportEntry::getCount).reversed()
                .thenComparing(ExposureReportEntry::getPlayerId));
        return List.copyOf(report);
    }
}
