package com.dfsoptimizer.domain.model;

import com.dfsoptimizer.exception.ValidationException;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import lombok.Getter;

/**
 * Ordered slot layout for one site/sport combination. The slot count is the roster size.
 */
@Getter
public class RosterSlotSpec {

    private final List<RosterSlot> slots;

    private RosterSlotSpec(List<RosterSlot> slots) {
        this.slots = slots;
    }

    public static RosterSlotSpec of(List<RosterSlot> slots) {
        if (slots == null || slots.isEmpty()) {
            throw new ValidationException("Roster slot spec must contain at least one slot");
        }
        for (RosterSlot slot : slots) {
            if (slot.getName() == null || slot.getName().isBlank()) {
                throw new ValidationException("Roster slot name must not be blank");
            }
            if (slot.getEligiblePositions() == null || slot.getEligiblePositions().isEmpty()) {
                throw new ValidationException("Roster slot " + slot.getName() + " has no eligible positions");
            }
        }
        return new RosterSlotSpec(List.copyOf(slots));
    }

    public static RosterSlotSpec of(RosterSlot... slots) {
        return of(List.of(slots));
    }

    public int getRosterSize() {
        return slots.size();
    }

    public RosterSlot getSlot(int index) {
        return slots.get(index);
    }

    /** Union of every position that can fill at least one slot. */
    public Set<String> getAllPositions() {
        Set<String> positions = new LinkedHashSet<>();
        slots.forEach(slot -> positions.addAll(slot.getEligiblePositions()));
        return positions;
    }

    @Override
    public String toString() {
        return slots.toString();
    }
}
