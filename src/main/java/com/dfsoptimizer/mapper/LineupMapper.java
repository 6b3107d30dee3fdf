package com.dfsoptimizer.mapper;

import com.dfsoptimizer.api.dto.response.LineupResponse;
import com.dfsoptimizer.api.dto.response.SlotResponse;
import com.dfsoptimizer.domain.model.Lineup;
import com.dfsoptimizer.domain.model.SlotAssignment;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/**
 * MapStruct mapper from emitted lineups to the flat API shape. Slot projection and ownership
 * are the effective values (after boost and override), the same ones the optimizer used.
 */
@Mapper
public interface LineupMapper {

    @Mapping(source = "assignments", target = "slots")
    @Mapping(target = "stackType", ignore = true)
    LineupResponse toResponse(Lineup lineup);

    List<LineupResponse> toResponseList(List<Lineup> lineups);

    @Mapping(source = "slotName", target = "slot")
    @Mapping(source = "player.id", target = "playerId")
    @Mapping(source = "player.name", target = "name")
    @Mapping(source = "player.team", target = "team")
    @Mapping(source = "player.salary", target = "salary")
    @Mapping(source = "player.effectiveProjection", target = "projection")
    @Mapping(source = "player.effectiveOwnership", target = "ownership")
    SlotResponse toSlot(SlotAssignment assignment);
}
