package com.chartsayer.position.controller;

import com.chartsayer.common.exception.InvalidPositionTransitionException;
import com.chartsayer.common.exception.PositionOwnershipException;
import com.chartsayer.common.exception.PositionStorageException;
import com.chartsayer.common.exception.PositionValidationException;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebExchange;

/**
 * Maps registry exceptions to HTTP statuses. Not found never reaches here; controllers
 * turn empty results into 404 themselves.
 */
@RestControllerAdvice
public class PositionExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(PositionExceptionHandler.class);

    public record ErrorResponse(
        @JsonProperty("status")  int status,
        @JsonProperty("error")   String error,
        @JsonProperty("message") String message,
        @JsonProperty("path")    String path
    ) {}

    @ExceptionHandler(PositionOwnershipException.class)
    public ResponseEntity<ErrorResponse> handleOwnership(PositionOwnershipException e, ServerWebExchange exchange) {
        log.warn("403 at {}: {}", path(exchange), e.getMessage());
        return build(HttpStatus.FORBIDDEN, e, exchange);
    }

    @ExceptionHandler(InvalidPositionTransitionException.class)
    public ResponseEntity<ErrorResponse> handleTransition(InvalidPositionTransitionException e, ServerWebExchange exchange) {
        log.info("409 at {}: {}", path(exchange), e.getMessage());
        return build(HttpStatus.CONFLICT, e, exchange);
    }

    @ExceptionHandler({PositionValidationException.class, IllegalArgumentException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(RuntimeException e, ServerWebExchange exchange) {
        log.warn("400 at {}: {}", path(exchange), e.getMessage());
        return build(HttpStatus.BAD_REQUEST, e, exchange);
    }

    @ExceptionHandler(PositionStorageException.class)
    public ResponseEntity<ErrorResponse> handleStorage(PositionStorageException e, ServerWebExchange exchange) {
        log.error("503 at {}: {}", path(exchange), e.getMessage(), e);
        return build(HttpStatus.SERVICE_UNAVAILABLE, e, exchange);
    }

    private ResponseEntity<ErrorResponse> build(HttpStatus status, Exception e, ServerWebExchange exchange) {
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        return ResponseEntity.status(status)
            .body(new ErrorResponse(status.value(), e.getClass().getSimpleName(), message, path(exchange)));
    }

    private static String path(ServerWebExchange exchange) {
        return exchange != null ? exchange.getRequest().getPath().value() : "/";
    }
}
