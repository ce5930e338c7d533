package com.guardian.contract;

import java.util.Map;

/**
 * Structural checks applied to every request before any rule is evaluated.
 */
public class RequestValidator {

    private final int maxTextLength;

    public RequestValidator(int maxTextLength) {
        if (maxTextLength < 1) {
            throw new IllegalArgumentException("maxTextLength must be >= 1");
        }
        this.maxTextLength = maxTextLength;
    }

    public void validate(GuardRequest request, Phase phase) {
        if (request == null) {
            throw new ValidationException("request cannot be null");
        }
        if (phase == null) {
            throw new ValidationException("phase is required");
        }
        String field = phase == Phase.PRE ? "prompt" : "output";
        String text = request.text();
        if (text == null || text.isBlank()) {
            throw new ValidationException(field + " must be a non-empty string");
        }
        if (text.length() > maxTextLength) {
            throw new ValidationException(
                field + " exceeds maximum length of " + maxTextLength + " characters");
        }
        for (Map.Entry<String, Object> entry : request.context().entrySet()) {
            if (entry.getKey() == null || entry.getKey().isBlank()) {
                throw new ValidationException("context keys must be non-empty strings");
            }
        }
    }

    public int maxTextLength() {
        return maxTextLength;
    }
}
