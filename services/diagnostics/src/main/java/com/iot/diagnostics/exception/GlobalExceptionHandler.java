package com.iot.diagnostics.exception;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

/**
 * Maps pipeline failures to {@code {"error": "..."}} bodies.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /**
     * Payload parsed but is not an array of 1..max records.
     */
    @ExceptionHandler(InvalidBatchException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleInvalidBatch(
            InvalidBatchException ex, ServerWebExchange exchange) {

        log.warn("Invalid batch for {}: {}", path(exchange), ex.getMessage());
        return Mono.just(ResponseEntity.badRequest().body(ErrorResponse.of(ex.getMessage())));
    }

    /**
     * Payload is not valid JSON.
     */
    @ExceptionHandler(MalformedPayloadException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleMalformedPayload(
            MalformedPayloadException ex, ServerWebExchange exchange) {

        log.warn("JSON parsing failed for {}: {}", path(exchange), ex.getMessage());
        return Mono.just(ResponseEntity.badRequest().body(ErrorResponse.of(ex.getMessage())));
    }

    /**
     * Framework rejections such as a missing body or an unsupported media type keep their status.
     */
    @ExceptionHandler(ResponseStatusException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleResponseStatus(
            ResponseStatusException ex, ServerWebExchange exchange) {

        String message = ex.getReason() != null ? ex.getReason() : ex.getMessage();
        log.warn("Request rejected for {}: {}", path(exchange), message);
        return Mono.just(ResponseEntity.status(ex.getStatusCode()).body(ErrorResponse.of(message)));
    }

    /**
     * Handle all other exceptions.
     */
    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ErrorResponse>> handleGenericException(
            Exception ex, ServerWebExchange exchange) {

        log.error("Unexpected error for {}: {}", path(exchange), ex.getMessage(), ex);
        return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ErrorResponse.of(ex)));
    }

    private static String path(ServerWebExchange exchange) {
        return exchange.getRequest().getPath().value();
    }
}
