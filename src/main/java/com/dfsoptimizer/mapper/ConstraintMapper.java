package com.dfsoptimizer.mapper;

import com.dfsoptimizer.api.dto.request.ExposureTargetRequest;
import com.dfsoptimizer.api.dto.request.StackRuleRequest;
import com.dfsoptimizer.constraint.StackRule;
import com.dfsoptimizer.portfolio.ExposureTarget;
import java.util.List;
import org.mapstruct.Mapper;

@Mapper
public interface ConstraintMapper {

    StackRule toDomain(StackRuleRequest request);

    List<StackRule> toStackRules(List<StackRuleRequest> requests);

    ExposureTarget toDomain(ExposureTargetRequest request);

    List<ExposureTarget> toExposureTargets(List<ExposureTargetRequest> requests);
}
