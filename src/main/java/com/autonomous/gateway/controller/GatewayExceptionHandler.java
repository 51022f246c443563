package com.autonomous.gateway.controller;

import com.autonomous.gateway.exception.AgentNotRegisteredException;
import com.autonomous.gateway.exception.GatewayException;
import com.autonomous.gateway.exception.TaskNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Renders gateway failures as {@code {"status":"error","error":<kind>,"message":...}}.
 */
@Slf4j
@RestControllerAdvice
public class GatewayExceptionHandler {

    @ExceptionHandler({AgentNotRegisteredException.class, TaskNotFoundException.class})
    public ResponseEntity<Map<String, Object>> handleNotFound(GatewayException e) {
        return error(HttpStatus.NOT_FOUND, e.getKind(), e.getMessage());
    }

    @ExceptionHandler(GatewayException.class)
    public ResponseEntity<Map<String, Object>> handleUpstream(GatewayException e) {
        log.warn("Request failed: {}", e.getMessage());
        return error(HttpStatus.BAD_GATEWAY, e.getKind(), e.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleBadRequest(IllegalArgumentException e) {
        return error(HttpStatus.BAD_REQUEST, "invalid_argument", e.getMessage());
    }

    private ResponseEntity<Map<String, Object>> error(HttpStatus status, String kind, String message) {
        return ResponseEntity.status(status).body(Map.of(
            "status", "error",
            "error", kind,
            "message", message != null ? message : status.getReasonPhrase()
        ));
    }
}
