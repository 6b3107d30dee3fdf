package com.dfsoptimizer.exception;

import java.util.Map;

public class InvalidCorrelationException extends BaseException {

    public InvalidCorrelationException(String message) {
        super(ErrorCode.INVALID_CORRELATION, message);
    }

    public InvalidCorrelationException(String message, Map<String, Object> details) {
        super(ErrorCode.INVALID_CORRELATION, message, details);
    }

    public InvalidCorrelationException(String message, Throwable cause) {
        super(ErrorCode.INVALID_CORRELATION, message, cause);
    }
}
