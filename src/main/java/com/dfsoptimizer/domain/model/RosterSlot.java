package com.dfsoptimizer.domain.model;

import java.util.Set;
import lombok.Builder;
import lombok.Getter;

/**
 * A single roster slot: display name plus the positions allowed to fill it. A flex slot
 * (FLEX, UTIL, G, F) accepts several positions.
 */
@Getter
@Builder
public class RosterSlot {

    private final String name;
    private final Set<String> eligiblePositions;
    private final boolean flex;

    public static RosterSlot of(String position) {
        return RosterSlot.builder()
                .name(position)
                .eligiblePositions(Set.of(position))
                .flex(false)
                .build();
    }

    public static RosterSlot flex(String name, String... positions) {
        return RosterSlot.builder()
                .name(name)
                .eligiblePositions(Set.of(positions))
                .flex(true)
                .build();
    }

    public boolean accepts(Player player) {
        return player.isEligibleFor(eligiblePositions);
    }

    @Override
    public String toString() {
        return name;
    }
}
