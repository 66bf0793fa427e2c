package com.autosem.digital.process.optimizer.infrastructure.inbound.controller;

import com.autosem.digital.process.optimizer.domain.exception.ABTestNotFoundException;
import com.autosem.digital.process.optimizer.domain.exception.InvalidABTestRequestException;
import com.autosem.digital.process.optimizer.domain.exception.InvalidSettingException;
import com.autosem.digital.process.optimizer.domain.exception.OptimizationPreconditionException;
import com.autosem.digital.process.optimizer.domain.exception.PlatformCallException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebInputException;

import java.util.HashMap;
import java.util.Map;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler({InvalidABTestRequestException.class, InvalidSettingException.class})
    public ResponseEntity<Map<String, Object>> handleBadRequest(RuntimeException ex) {
        return build(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", ex.getMessage());
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<Map<String, Object>> handleInput(ServerWebInputException ex) {
        return build(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", ex.getReason());
    }

    @ExceptionHandler(ABTestNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(ABTestNotFoundException ex) {
        return build(HttpStatus.NOT_FOUND, "AB_TEST_NOT_FOUND", ex.getMessage());
    }

    @ExceptionHandler(OptimisticLockingFailureException.class)
    public ResponseEntity<Map<String, Object>> handleConflict(OptimisticLockingFailureException ex) {
        log.warn("Conflicto de versión: {}", ex.getMessage());
        return build(HttpStatus.CONFLICT, "CONCURRENT_UPDATE", "The resource was modified concurrently, retry the request");
    }

    @ExceptionHandler(OptimizationPreconditionException.class)
    public ResponseEntity<Map<String, Object>> handlePrecondition(OptimizationPreconditionException ex) {
        log.error("Pasada de optimización abortada: {}", ex.getMessage());
        return build(HttpStatus.SERVICE_UNAVAILABLE, "OPTIMIZATION_UNAVAILABLE", ex.getMessage());
    }

    @ExceptionHandler(PlatformCallException.class)
    public ResponseEntity<Map<String, Object>> handlePlatform(PlatformCallException ex) {
        log.error("Fallo de plataforma {}: {}", ex.getPlatform(), ex.getMessage());
        return build(HttpStatus.SERVICE_UNAVAILABLE, "PLATFORM_CALL_FAILED", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGeneric(Exception ex) {
        log.error("Unhandled exception", ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "Internal server error");
    }

    private static ResponseEntity<Map<String, Object>> build(HttpStatus status, String code, String message) {
        Map<String, Object> body = new HashMap<>();
        body.put("status", status.value());
        body.put("code", code);
        body.put("message", message);
        return ResponseEntity.status(status).body(body);
    }
}
