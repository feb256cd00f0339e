package com.fintech.pricehistory.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;
import java.util.List;

/**
 * Error body for failed requests, shaped after RFC 7807 problem details.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Error response with details about the failure")
public record ErrorResponse(

    @Schema(description = "HTTP status code", example = "400")
    int status,

    @Schema(description = "Error category", example = "VALIDATION_ERROR")
    String error,

    @Schema(description = "Human-readable error message", example = "Request validation failed")
    String message,

    @Schema(description = "Request path that caused the error", example = "/api/v1/prices/US0378331005/daily")
    String path,

    Instant timestamp,

    @Schema(description = "Field-level problems, when the request itself was invalid")
    List<ValidationError> validationErrors
) {

    public ErrorResponse(int status, String error, String message, String path) {
        this(status, error, message, path, Instant.now(), null);
    }

    public ErrorResponse(int status, String error, String message, String path, List<ValidationError> validationErrors) {
        this(status, error, message, path, Instant.now(), validationErrors);
    }

    public record ValidationError(
        @Schema(example = "limit")
        String field,

        @Schema(example = "-1")
        String rejectedValue,

        @Schema(example = "must be greater than or equal to 0")
        String message
    ) {}
}
