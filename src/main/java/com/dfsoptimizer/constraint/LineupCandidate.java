package com.dfsoptimizer.constraint;

import com.dfsoptimizer.domain.model.Lineup;
import com.dfsoptimizer.domain.model.Player;
import com.dfsoptimizer.domain.model.RosterSlotSpec;
import com.dfsoptimizer.domain.model.SlotAssignment;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * A partial or complete slot assignment under construction. Slot positions follow the
 * {@link RosterSlotSpec}; an empty slot holds null.
 */
public final class LineupCandidate {

    private final RosterSlotSpec slotSpec;
    private final Player[] slots;

    private LineupCandidate(RosterSlotSpec slotSpec, Player[] slots) {
        this.slotSpec = slotSpec;
        this.slots = slots;
    }

    public static LineupCandidate empty(RosterSlotSpec slotSpec) {
        return new LineupCandidate(slotSpec, new Player[slotSpec.getRosterSize()]);
    }

    public static LineupCandidate of(RosterSlotSpec slotSpec, List<Player> playersInSlotOrder) {
        if (playersInSlotOrder.size() > slotSpec.getRosterSize()) {
            throw new IllegalArgumentException("More players than roster slots: " + playersInSlotOrder.size());
        }
        Player[] slots = new Player[slotSpec.getRosterSize()];
        for (int i = 0; i < playersInSlotOrder.size(); i++) {
            slots[i] = playersInSlotOrder.get(i);
        }
        return new LineupCandidate(slotSpec, slots);
    }

    public static LineupCandidate from(RosterSlotSpec slotSpec, Lineup lineup) {
        Player[] slots = new Player[slotSpec.getRosterSize()];
        for (SlotAssignment assignment : lineup.getAssignments()) {
            slots[assignment.getSlotIndex()] = assignment.getPlayer();
        }
        return new LineupCandidate(slotSpec, slots);
    }

    /** Returns a copy with the given slot filled. */
    public LineupCandidate with(int slotIndex, Player player) {
        Player[] copy = Arrays.copyOf(slots, slots.length);
        copy[slotIndex] = player;
        return new LineupCandidate(slotSpec, copy);
    }

    public RosterSlotSpec getSlotSpec() {
        return slotSpec;
    }

    public Player get(int slotIndex) {
        return slots[slotIndex];
    }

    public int size() {
        return slots.length;
    }

    public boolean isComplete() {
        return Arrays.stream(slots).allMatch(Objects::nonNull);
    }

    public int filledCount() {
        return (int) Arrays.stream(slots).filter(Objects::nonNull).count();
    }

    public List<Player> getPlayers() {
        List<Player> players = new ArrayList<>();
        for (Player player : slots) {
            if (player != null) {
                players.add(player);
            }
        }
        return players;
    }

    public int getTotalSalary() {
        return getPlayers().stream().mapToInt(Player::getSalary).sum();
    }
}
