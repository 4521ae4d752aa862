package com.fintech.history.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;
import java.util.List;

/**
 * Standardized error response for API errors.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Error response with details about the failure")
public record ErrorResponse(

    @Schema(description = "HTTP status code", example = "404")
    int status,

    @Schema(description = "Error type/category", example = "NOT_FOUND")
    String error,

    @Schema(description = "Human-readable error message", example = "No shards for indices XYZ")
    String message,

    @Schema(description = "Request path that caused the error", example = "/api/v1/bars")
    String path,

    @Schema(description = "Timestamp of the error", example = "2024-03-15T10:30:00Z")
    Instant timestamp,

    @Schema(description = "Shards that could not be read (if applicable)")
    List<String> unavailableShards,

    @Schema(description = "Detailed validation errors (if applicable)")
    List<ValidationError> validationErrors
) {

    public ErrorResponse(int status, String error, String message, String path) {
        this(status, error, message, path, Instant.now(), null, null);
    }

    public ErrorResponse(int status, String error, String message, String path, List<ValidationError> validationErrors) {
        this(status, error, message, path, Instant.now(), null, validationErrors);
    }

    public static ErrorResponse withUnavailableShards(
            int status, String error, String message, String path, List<String> unavailableShards) {
        return new ErrorResponse(status, error, message, path, Instant.now(), unavailableShards, null);
    }

    /**
     * Individual field validation error.
     */
    @Schema(description = "Field-level validation error")
    public record ValidationError(
        @Schema(description = "Field name that failed validation", example = "granularity")
        String field,

        @Schema(description = "Rejected value", example = "7m")
        String rejectedValue,

        @Schema(description = "Validation error message", example = "Unknown granularity '7m'")
        String message
    ) {}
}
