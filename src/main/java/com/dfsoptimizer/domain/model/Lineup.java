package com.dfsoptimizer.domain.model;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import lombok.Builder;
import lombok.Getter;

/**
 * An emitted lineup: exactly one player per roster slot. Immutable; the simulator and the
 * portfolio filter only read it.
 */
@Getter
@Builder
public class Lineup {

    private final String lineupId;

    /** Zero-based position of this lineup in the batch that produced it. */
    private final int generationIndex;

    private final List<SlotAssignment> assignments;
    private final int totalSalary;
    private final double totalProjection;

    /** Objective value the optimizer maximized for this lineup (before jitter). */
    private final double objectiveValue;

    public Set<String> getPlayerIds() {
        Set<String> ids = new LinkedHashSet<>();
        assignments.forEach(a -> ids.add(a.getPlayer().getId()));
        return ids;
    }

    public List<Player> getPlayers() {
        return assignments.stream().map(SlotAssignment::getPlayer).toList();
    }

    public boolean contains(String playerId) {
        for (SlotAssignment assignment : assignments) {
            if (assignment.getPlayer().getId().equals(playerId)) {
                return true;
            }
        }
        return false;
    }

    public int sharedPlayerCount(Lineup other) {
        Set<String> mine = getPlayerIds();
        int shared = 0;
        for (String id : other.getPlayerIds()) {
            if (mine.contains(id)) {
                shared++;
            }
        }
        return shared;
    }

    public double getTotalOwnership() {
        return assignments.stream()
                .mapToDouble(a -> a.getPlayer().getEffectiveOwnership())
                .sum();
    }

    @Override
    public String toString() {
        return lineupId + " $" + totalSalary + " " + String.format("%.2f", totalProjection) + "pts";
    }
}
