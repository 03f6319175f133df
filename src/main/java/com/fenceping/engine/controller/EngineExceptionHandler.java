package com.fenceping.engine.controller;

import com.fenceping.engine.exception.InvalidCoordinateException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.transaction.TransactionException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps engine exceptions to HTTP responses for the operational API.
 */
@RestControllerAdvice
@Slf4j
public class EngineExceptionHandler {

    @ExceptionHandler(InvalidCoordinateException.class)
    public ResponseEntity<Map<String, Object>> invalidCoordinate(InvalidCoordinateException e) {
        return ResponseEntity.badRequest().body(Map.of(
            "status", "INVALID_COORDINATE",
            "message", e.getMessage()
        ));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> invalidRequest(MethodArgumentNotValidException e) {
        Map<String, String> errors = e.getBindingResult().getFieldErrors().stream()
            .collect(Collectors.toMap(FieldError::getField,
                error -> String.valueOf(error.getDefaultMessage()),
                (first, second) -> first));
        return ResponseEntity.badRequest().body(Map.of(
            "status", "INVALID_REQUEST",
            "errors", errors
        ));
    }

    @ExceptionHandler({DataAccessException.class, TransactionException.class})
    public ResponseEntity<Map<String, Object>> storageUnavailable(RuntimeException e) {
        log.warn("Storage unavailable while serving request", e);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of(
            "status", "UNAVAILABLE",
            "message", "Storage unavailable"
        ));
    }
}
