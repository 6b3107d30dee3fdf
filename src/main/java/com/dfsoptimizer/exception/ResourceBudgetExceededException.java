package com.dfsoptimizer.exception;

import java.util.Map;

/**
 * A simulation run would exceed its configured trial, memory or per-chunk time budget.
 * The caller must lower the trial count or raise the budget.
 */
public class ResourceBudgetExceededException extends BaseException {

    public ResourceBudgetExceededException(String message, Map<String, Object> details) {
        super(ErrorCode.RESOURCE_BUDGET_EXCEEDED, message, details);
    }
}
