package com.openrangelabs.copilot.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * Standard error response structure for API errors.
 *
 * <p>Returned for failures of the web layer itself, such as an unknown tool or
 * a malformed request. Connector failures are not errors at this level: they
 * come back as tool results with {@code status} set to {@code error} or
 * {@code not_found}.
 *
 * @author OpenRange Labs
 * @version 1.0
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Standard error response structure")
public class ErrorResponse {

    @Schema(description = "When the error occurred", example = "2025-11-17T10:30:00")
    LocalDateTime timestamp;

    @Schema(description = "HTTP status code", example = "404")
    int status;

    @Schema(description = "Error type", example = "Tool Not Found")
    String error;

    @Schema(description = "Detailed error message", example = "No tool registered with name: query_unknown")
    String message;

    @Schema(description = "Request path that caused the error", example = "/api/tools/query_unknown")
    String path;

    @Schema(description = "Unique trace ID for debugging", example = "a1b2c3d4")
    String traceId;
}
