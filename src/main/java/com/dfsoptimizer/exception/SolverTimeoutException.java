package com.dfsoptimizer.exception;

import java.util.Map;

public class SolverTimeoutException extends BaseException {

    public SolverTimeoutException(String message, long budgetMs) {
        super(ErrorCode.SOLVER_TIMEOUT, message, Map.of("budgetMs", budgetMs));
    }
}
