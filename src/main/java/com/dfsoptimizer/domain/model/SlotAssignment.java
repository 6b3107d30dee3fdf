package com.dfsoptimizer.domain.model;

import lombok.Builder;
import lombok.Getter;

/** One filled roster slot. Carries the slot name so exporters never re-derive the assignment. */
@Getter
@Builder
public class SlotAssignment {

    private final int slotIndex;
    private final String slotName;
    private final Player player;
}
