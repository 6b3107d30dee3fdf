package com.dfsoptimizer.exception;

import com.dfsoptimizer.api.dto.response.ApiErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps engine exceptions onto HTTP statuses through their {@link ErrorCode}. Infeasible,
 * timeout and budget errors keep their structured details (cause, budget) in the body.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiErrorResponse> handleValidation(
            MethodArgumentNotValidException ex, HttpServletRequest request) {
        Map<String, Object> details = new LinkedHashMap<>();
        ex.getBindingResult()
                .getFieldErrors()
                .forEach(error -> details.put(error.getField(), error.getDefaultMessage()));
        return buildResponse(ErrorCode.VALIDATION_ERROR, "Validation failed", details, request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiErrorResponse> handleUnreadable(
            HttpMessageNotReadableException ex, HttpServletRequest request) {
        return buildResponse(ErrorCode.BAD_REQUEST, "Malformed request body", null, request);
    }

    @ExceptionHandler(InfeasibleException.class)
    public ResponseEntity<ApiErrorResponse> handleInfeasible(InfeasibleException ex, HttpServletRequest request) {
        log.warn("Infeasible request ({}): {}", ex.getInfeasibilityCause(), ex.getMessage());
        return buildResponse(ex.getErrorCode(), ex.getMessage(), ex.getDetails(), request);
    }

    @ExceptionHandler(BaseException.class)
    public ResponseEntity<ApiErrorResponse> handleBase(BaseException ex, HttpServletRequest request) {
        ErrorCode errorCode = ex.getErrorCode();
        if (errorCode.getHttpStatus() >= 500) {
            log.error("Server error: {}", ex.getMessage(), ex);
        } else {
            log.warn("Client error: {}", ex.getMessage());
        }
        return buildResponse(errorCode, ex.getMessage(), ex.getDetails(), request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiErrorResponse> handleGeneric(Exception ex, HttpServletRequest request) {
        log.error("Unexpected error", ex);
        return buildResponse(ErrorCode.INTERNAL_ERROR, "An unexpected error occurred", null, request);
    }

    private ResponseEntity<ApiErrorResponse> buildResponse(
            ErrorCode errorCode, String message, Map<String, Object> details, HttpServletRequest request) {
        ApiErrorResponse response = ApiErrorResponse.of(errorCode, message, details, request.getRequestURI());
        return ResponseEntity.status(errorCode.getHttpStatus()).body(response);
    }
}
