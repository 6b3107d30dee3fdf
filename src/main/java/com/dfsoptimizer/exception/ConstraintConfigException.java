package com.dfsoptimizer.exception;

import java.util.Map;

/**
 * Internally inconsistent roster-construction rules (e.g. a stack rule with min above max).
 * Raised while a constraint set is being built, before any solve is attempted.
 */
public class ConstraintConfigException extends BaseException {

    public ConstraintConfigException(String message) {
        super(ErrorCode.CONSTRAINT_CONFIG_ERROR, message);
    }

    public ConstraintConfigException(String message, Map<String, Object> details) {
        super(ErrorCode.CONSTRAINT_CONFIG_ERROR, message, details);
    }
}
