package com.crewflow.crewflow_backend.controller;

import com.crewflow.crewflow_backend.exception.ConfigException;
import com.crewflow.crewflow_backend.exception.EngineException;
import com.crewflow.crewflow_backend.exception.ResourceNotFoundException;
import com.crewflow.crewflow_backend.exception.StateTransitionException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps core exceptions to {@code {code, message}} bodies.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorBody> handleNotFound(ResourceNotFoundException ex, HttpServletRequest request) {
        return respond(HttpStatus.NOT_FOUND, "NOT_FOUND", ex.getMessage(), request);
    }

    @ExceptionHandler(StateTransitionException.class)
    public ResponseEntity<ErrorBody> handleConflict(StateTransitionException ex, HttpServletRequest request) {
        return respond(HttpStatus.CONFLICT, "ILLEGAL_STATE", ex.getMessage(), request);
    }

    @ExceptionHandler(ConfigException.class)
    public ResponseEntity<ErrorBody> handleConfig(ConfigException ex, HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, "INVALID_CONFIG", ex.getMessage(), request);
    }

    @ExceptionHandler({
            MethodArgumentNotValidException.class,
            MethodArgumentTypeMismatchException.class,
            HttpMessageNotReadableException.class
    })
    public ResponseEntity<ErrorBody> handleBadRequest(Exception ex, HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, "BAD_REQUEST", truncate(ex.getMessage(), 300), request);
    }

    @ExceptionHandler(EngineException.class)
    public ResponseEntity<ErrorBody> handleEngine(EngineException ex, HttpServletRequest request) {
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "ENGINE_UNAVAILABLE", ex.getMessage(), request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorBody> handleUnknown(Exception ex, HttpServletRequest request) {
        log.error("[HTTP] {} {} failed: {}", request.getMethod(), request.getRequestURI(), ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorBody("INTERNAL_ERROR", "Unexpected error"));
    }

    private ResponseEntity<ErrorBody> respond(HttpStatus status, String code, String message,
                                              HttpServletRequest request) {
        log.warn("[HTTP] {} {} -> {} {}: {}", request.getMethod(), request.getRequestURI(),
                status.value(), code, message);
        return ResponseEntity.status(status).body(new ErrorBody(code, message));
    }

    private static String truncate(String text, int max) {
        if (text == null || text.length() <= max) return text;
        return text.substring(0, max);
    }

    public record ErrorBody(String code, String message) {}
}
