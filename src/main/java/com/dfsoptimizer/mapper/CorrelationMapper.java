package com.dfsoptimizer.mapper;

import com.dfsoptimizer.api.dto.request.CorrelationRequest;
import com.dfsoptimizer.domain.model.CorrelationEntry;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/** Caller-supplied correlations are always tagged MANUAL so they win over generated rules. */
@Mapper
public interface CorrelationMapper {

    @Mapping(target = "reason", constant = "MANUAL")
    CorrelationEntry toDomain(CorrelationRequest request);

    List<CorrelationEntry> toDomainList(List<CorrelationRequest> requests);
}
