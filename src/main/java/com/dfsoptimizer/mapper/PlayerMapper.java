package com.dfsoptimizer.mapper;

import com.dfsoptimizer.api.dto.request.PlayerRequest;
import com.dfsoptimizer.domain.model.Player;
import java.util.List;
import org.mapstruct.Mapper;

/**
 * MapStruct mapper from the projection-feed record to the Player domain model. Positions arrive
 * as a list and become a set; range validation happens in PlayerPool.load.
 */
@Mapper
public interface PlayerMapper {

    Player toDomain(PlayerRequest request);

    List<Player> toDomainList(List<PlayerRequest> requests);
}
