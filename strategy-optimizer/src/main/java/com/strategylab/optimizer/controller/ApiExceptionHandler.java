package com.strategylab.optimizer.controller;

import com.strategylab.optimizer.domain.EmptySeriesException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps rejected input to HTTP 400 with an {@code {error, message}} body.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> invalidParameter(IllegalArgumentException ex) {
        log.warn("400 invalid parameter: {}", ex.getMessage());
        return badRequest("invalid_parameter", ex.getMessage());
    }

    @ExceptionHandler(EmptySeriesException.class)
    public ResponseEntity<Map<String, String>> emptySeries(EmptySeriesException ex) {
        log.warn("400 empty series: {}", ex.getMessage());
        return badRequest("empty_series", ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, String>> validation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(fe -> fe.getField() + ": " + (fe.getDefaultMessage() == null ? "invalid" : fe.getDefaultMessage()))
                .sorted()
                .collect(Collectors.joining("; "));
        log.warn("400 validation error: {}", message);
        return badRequest("validation_error", message);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, String>> unreadable(HttpMessageNotReadableException ex) {
        log.warn("400 unreadable request: {}", ex.getMessage());
        return badRequest("bad_request", "Malformed request body");
    }

    private ResponseEntity<Map<String, String>> badRequest(String error, String message) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(Map.of(
                "error", error,
                "message", message == null ? "invalid_request" : message));
    }
}
