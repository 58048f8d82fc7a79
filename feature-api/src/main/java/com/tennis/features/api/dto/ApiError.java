package com.tennis.features.api.dto;

import java.time.Instant;

/**
 * Standardized error response format.
 */
public record ApiError(
        String code,
        String message,
        String path,
        Instant timestamp
) {
    public ApiError(String code, String message, String path) {
        this(code, message, path, Instant.now());
    }
}
