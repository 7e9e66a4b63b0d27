package com.candlebacktest.backtester.controller;

import com.candlebacktest.backtester.domain.exception.MarketSimulationException;
import com.candlebacktest.backtester.domain.exception.OrderNotFoundException;
import com.candlebacktest.backtester.service.BacktestRunNotFoundException;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.validation.ObjectError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler({ BacktestRunNotFoundException.class, OrderNotFoundException.class })
    public ResponseEntity<Map<String, Object>> notFound(RuntimeException ex) {
        return error(HttpStatus.NOT_FOUND, "not_found", ex.getMessage());
    }

    @ExceptionHandler(MarketSimulationException.class)
    public ResponseEntity<Map<String, Object>> simulationFailed(MarketSimulationException ex) {
        log.warn("Simulation rejected: {}", ex.getMessage());
        return error(HttpStatus.UNPROCESSABLE_ENTITY, "simulation_error", ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> badRequest(IllegalArgumentException ex) {
        return error(HttpStatus.BAD_REQUEST, "bad_request", ex.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> unreadable(HttpMessageNotReadableException ex) {
        return error(HttpStatus.BAD_REQUEST, "bad_request", "malformed_request_body");
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> validation(MethodArgumentNotValidException ex) {
        Map<String, String> fields = new HashMap<>();
        for (FieldError fe : ex.getBindingResult().getFieldErrors()) {
            fields.put(fe.getField(), fe.getDefaultMessage() == null ? "invalid" : fe.getDefaultMessage());
        }
        for (ObjectError oe : ex.getBindingResult().getGlobalErrors()) {
            fields.put(oe.getObjectName(), oe.getDefaultMessage() == null ? "invalid" : oe.getDefaultMessage());
        }
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(Map.of(
                "status", "error",
                "reason", "validation_error",
                "message", "invalid_request",
                "fields", fields,
                "ts", Instant.now().toString()
        ));
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<Map<String, Object>> validation(ConstraintViolationException ex) {
        return error(HttpStatus.BAD_REQUEST, "validation_error", ex.getMessage());
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String reason, String message) {
        return ResponseEntity.status(status).body(Map.of(
                "status", "error",
                "reason", reason,
                "message", message == null ? reason : message,
                "ts", Instant.now().toString()
        ));
    }
}
