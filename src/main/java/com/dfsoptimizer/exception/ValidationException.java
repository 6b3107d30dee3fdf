package com.dfsoptimizer.exception;

import java.util.Map;

/**
 * Malformed input data: player pool records, settings objects or correlation entries.
 * Always a caller bug, never retried.
 */
public class ValidationException extends BaseException {

    public ValidationException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
    }

    public ValidationException(String message, Map<String, Object> details) {
        super(ErrorCode.VALIDATION_ERROR, message, details);
    }
}
