package com.openrangelabs.copilot.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Global exception handler for the connector service.
 *
 * <p>Maps web-layer failures to structured error responses. Connector call
 * failures never reach this class; they are part of the tool result.
 *
 * @author OpenRange Labs
 * @version 1.0
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * Handles invocations of unregistered tools.
     */
    @ExceptionHandler(UnknownToolException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleUnknownTool(
            UnknownToolException ex, ServerWebExchange exchange) {

        log.warn("Unknown tool requested: {}", ex.getToolName());
        return Mono.just(buildResponse(HttpStatus.NOT_FOUND, "Tool Not Found", ex.getMessage(), exchange));
    }

    /**
     * Handles requests naming a connector that does not exist.
     */
    @ExceptionHandler(UnknownConnectorException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleUnknownConnector(
            UnknownConnectorException ex, ServerWebExchange exchange) {

        log.warn("Unknown connector requested: {}", ex.getConnectorType());
        return Mono.just(buildResponse(HttpStatus.NOT_FOUND, "Connector Not Found", ex.getMessage(), exchange));
    }

    /**
     * Handles validation exceptions.
     */
    @ExceptionHandler(WebExchangeBindException.class)
    public Mono<ResponseEntity<ValidationErrorResponse>> handleValidationException(
            WebExchangeBindException ex, ServerWebExchange exchange) {

        log.warn("Validation failed: {}", ex.getMessage());

        Map<String, String> fieldErrors = new HashMap<>();
        ex.getBindingResult().getAllErrors().forEach(error -> {
            String fieldName = error instanceof FieldError ? ((FieldError) error).getField() : error.getObjectName();
            fieldErrors.put(fieldName, error.getDefaultMessage());
        });

        ValidationErrorResponse error = ValidationErrorResponse.builder()
                .timestamp(LocalDateTime.now())
                .status(HttpStatus.BAD_REQUEST.value())
                .error("Validation Failed")
                .message("Request validation failed")
                .path(exchange.getRequest().getPath().toString())
                .traceId(generateTraceId())
                .fieldErrors(fieldErrors)
                .build();

        return Mono.just(ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error));
    }

    /**
     * Handles unreadable request bodies.
     */
    @ExceptionHandler(ServerWebInputException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleInputException(
            ServerWebInputException ex, ServerWebExchange exchange) {

        log.warn("Unreadable request: {}", ex.getReason());
        return Mono.just(buildResponse(HttpStatus.BAD_REQUEST, "Bad Request",
                ex.getReason() != null ? ex.getReason() : "Request body could not be read", exchange));
    }

    /**
     * Handles access denied exceptions.
     */
    @ExceptionHandler(AccessDeniedException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleAccessDenied(
            AccessDeniedException ex, ServerWebExchange exchange) {

        log.warn("Access denied: {}", ex.getMessage());
        return Mono.just(buildResponse(HttpStatus.FORBIDDEN, "Access Denied",
                "Insufficient privileges to access this resource", exchange));
    }

    /**
     * Handles all other exceptions.
     */
    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ErrorResponse>> handleGenericException(
            Exception ex, ServerWebExchange exchange) {

        log.error("Unexpected error: {}", ex.getMessage(), ex);
        return Mono.just(buildResponse(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                "An unexpected error occurred. Please try again.", exchange));
    }

    private ResponseEntity<ErrorResponse> buildResponse(HttpStatus status, String error, String message,
                                                        ServerWebExchange exchange) {
        ErrorResponse body = ErrorResponse.builder()
                .timestamp(LocalDateTime.now())
                .status(status.value())
                .error(error)
                .message(message)
                .path(exchange.getRequest().getPath().toString())
                .traceId(generateTraceId())
                .build();
        return ResponseEntity.status(status).body(body);
    }

    private String generateTraceId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
