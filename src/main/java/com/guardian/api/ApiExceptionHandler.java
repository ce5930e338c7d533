package com.guardian.api;

import com.guardian.contract.ValidationException;
import com.guardian.generation.GenerationFailedException;
import com.guardian.ledger.IntegrityException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps gate failures to the machine-readable error body:
 * <pre>
 * {
 *   "error_code": "VALIDATION_FAILED",
 *   "message": "...",
 *   "timestamp": "2026-..."
 * }
 * </pre>
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ValidationException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleValidation(ValidationException ex) {
        log.warn("Validation failed: {}", ex.getMessage());
        return errorResponse("VALIDATION_FAILED", ex.getMessage());
    }

    @ExceptionHandler({
        MethodArgumentTypeMismatchException.class,
        MissingServletRequestParameterException.class,
        HttpMessageNotReadableException.class
    })
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleParseErrors(Exception ex) {
        log.warn("Malformed request: {}", ex.getMessage());
        return errorResponse("BAD_REQUEST", "request format is invalid: " + ex.getMessage());
    }

    @ExceptionHandler(IntegrityException.class)
    @ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
    public Map<String, Object> handleIntegrity(IntegrityException ex) {
        log.error("Ledger integrity failure, refusing to decide: {}", ex.getMessage());
        return errorResponse("INTEGRITY_HALT", ex.getMessage());
    }

    @ExceptionHandler(GenerationFailedException.class)
    @ResponseStatus(HttpStatus.BAD_GATEWAY)
    public Map<String, Object> handleGenerationFailure(GenerationFailedException ex) {
        log.error("Generation backend failed: {}", ex.getMessage());
        return errorResponse("GENERATION_FAILED", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleUnexpected(Exception ex) {
        log.error("Unexpected error", ex);
        return errorResponse("INTERNAL_ERROR", "an unexpected error occurred");
    }

    private Map<String, Object> errorResponse(String errorCode, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error_code", errorCode);
        body.put("message", message);
        body.put("timestamp", Instant.now().toString());
        return body;
    }
}
