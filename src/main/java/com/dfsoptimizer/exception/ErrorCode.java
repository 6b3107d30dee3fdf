package com.dfsoptimizer.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400),
    BAD_REQUEST("BAD_REQUEST", 400),
    CONSTRAINT_CONFIG_ERROR("CONSTRAINT_CONFIG_ERROR", 400),
    INVALID_CORRELATION("INVALID_CORRELATION", 400),
    RESOURCE_BUDGET_EXCEEDED("RESOURCE_BUDGET_EXCEEDED", 413),
    INFEASIBLE("INFEASIBLE", 422),
    INTERNAL_ERROR("INTERNAL_ERROR", 500),
    SOLVER_TIMEOUT("SOLVER_TIMEOUT", 504);

    private final String code;
    private final int httpStatus;
}
