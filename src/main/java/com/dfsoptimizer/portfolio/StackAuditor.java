package com.dfsoptimizer.portfolio;

import com.dfsoptimizer.domain.model.Lineup;
import com.dfsoptimizer.domain.model.Player;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import lombok.Builder;
import lombok.Getter;
import org.springframework.stereotype.Component;

/**
 * Labels each lineup with the stack it contains and tallies the labels across a batch.
 *
 * <ul>
 *   <li>{@code QB+n Stack (TEAM)}: a QB with n same-team RB/WR/TE</li>
 *   <li>{@code Game Stack (A/B)}: no QB stack, but two teams with at least two players each</li>
 *   <li>{@code No Stack}</li>
 * </ul>
 */
@Component
public class StackAuditor {

    static final String NO_STACK = "No Stack";

    private static final Set<String> SKILL_POSITIONS = Set.of("RB", "WR", "TE");

    @Getter
    @Builder
    public static class StackAuditEntry {
        private final String stackType;
        private final int count;
        private final double percentage;
    }

    public String classify(Lineup lineup) {
        Map<String, List<Player>> byTeam = new TreeMap<>();
        for (Player player : lineup.getPlayers()) {
            byTeam.computeIfAbsent(player.getTeam(), t -> new ArrayList<>()).add(player);
        }
        for (Map.Entry<String, List<Player>> team : byTeam.entrySet()) {
            boolean hasQb = team.getValue().stream().anyMatch(p -> p.hasPosition("QB"));
            if (!hasQb) {
                continue;
            }
            long skill = team.getValue().stream()
                    .filter(p -> !p.hasPosition("QB") && p.isEligibleFor(SKILL_POSITIONS))
                    .count();
            if (skill > 0) {
                return "QB+" + skill + " Stack (" + team.getKey() + ")";
            }
        }
        List<String> stackedTeams = byTeam.entrySet().stream()
                .filter(e -> e.getValue().size() >= 2)
                .map(Map.Entry::getKey)
                .limit(2)
                .toList();
        if (stackedTeams.size() == 2) {
            return "Game Stack (" + String.join("/", stackedTeams) + ")";
        }
        return NO_STACK;
    }

    /** Stack labels with counts and percentages of the batch, most frequent first. */
    public List<StackAuditEntry> audit(List<Lineup> lineups) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        lineups.forEach(l -> counts.merge(classify(l), 1, Integer::sum));
        List<StackAuditEntry> entries = new ArrayList<>();
        counts.forEach((type, count) -> entries.add(StackAuditEntry.builder()
                .stackType(type)
                .count(count)
                .percentage(lineups.isEmpty() ? 0.0 : count * 100.0 / lineups.size())
                .build()));
        entries.sort(Comparator.comparingInt(StackAuditEntry::getCount).reversed()
                .thenComparing(StackAuditEntry::getStackType));
        return entries;
    }
}
