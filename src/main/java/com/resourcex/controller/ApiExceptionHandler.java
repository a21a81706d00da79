package com.resourcex.controller;

import com.resourcex.exception.InvalidInputException;
import com.resourcex.exception.ResourceNotFoundException;
import com.resourcex.exception.ShardInconsistencyException;
import com.resourcex.model.result.ApiResponse;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.io.UncheckedIOException;
import java.util.stream.Collectors;

/**
 * Maps resource failures onto the {@link ApiResponse} envelope
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ApiResponse<Void>> notFound(ResourceNotFoundException e) {
        log.debug("Not found: {}", e.getMessage());
        return respond(HttpStatus.NOT_FOUND, e.getMessage());
    }

    @ExceptionHandler({InvalidInputException.class, UnsupportedOperationException.class})
    public ResponseEntity<ApiResponse<Void>> badRequest(RuntimeException e) {
        log.debug("Rejected request: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Void>> invalidBody(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return respond(HttpStatus.BAD_REQUEST, message);
    }

    @ExceptionHandler(ShardInconsistencyException.class)
    public ResponseEntity<ApiResponse<Void>> conflict(ShardInconsistencyException e) {
        log.warn("Inconsistent shards: {}", e.getMessage());
        return respond(HttpStatus.CONFLICT, e.getMessage());
    }

    @ExceptionHandler(UncheckedIOException.class)
    public ResponseEntity<ApiResponse<Void>> ioFailure(UncheckedIOException e) {
        log.error("I/O failure: {}", e.getMessage(), e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
    }

    private static ResponseEntity<ApiResponse<Void>> respond(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(ApiResponse.error(message));
    }
}
