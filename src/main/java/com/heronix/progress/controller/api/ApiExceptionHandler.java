package com.heronix.progress.controller.api;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import com.heronix.progress.exception.BatchRunNotFoundException;
import com.heronix.progress.exception.EvaluationFailedException;
import com.heronix.progress.model.result.DomainError;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;

/**
 * Maps engine failures to JSON error responses.
 *
 * Calculation failures map by category: VALIDATION and DATA_INCOMPLETE to 422,
 * INFRASTRUCTURE to 503.
 */
@RestControllerAdvice(annotations = RestController.class)
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(EvaluationFailedException.class)
    public ResponseEntity<Map<String, Object>> handleEvaluationFailed(EvaluationFailedException ex,
                                                                      HttpServletRequest request) {
        DomainError error = ex.getError();
        HttpStatus status = switch (error.category()) {
            case VALIDATION, DATA_INCOMPLETE -> HttpStatus.UNPROCESSABLE_ENTITY;
            case INFRASTRUCTURE -> HttpStatus.SERVICE_UNAVAILABLE;
        };
        Map<String, Object> body = body(status, error.code().name(), error.message(), request);
        body.put("category", error.category().name());
        body.put("details", error.details());
        return ResponseEntity.status(status).body(body);
    }

    @ExceptionHandler(BatchRunNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(BatchRunNotFoundException ex,
                                                              HttpServletRequest request) {
        HttpStatus status = HttpStatus.NOT_FOUND;
        return ResponseEntity.status(status).body(body(status, "not_found", ex.getMessage(), request));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidRequest(MethodArgumentNotValidException ex,
                                                                    HttpServletRequest request) {
        HttpStatus status = HttpStatus.BAD_REQUEST;
        List<String> details = ex.getBindingResult().getFieldErrors().stream()
                .map(fieldError -> fieldError.getField() + ": " + fieldError.getDefaultMessage())
                .toList();
        Map<String, Object> body = body(status, "invalid_request", "Request validation failed", request);
        body.put("details", details);
        return ResponseEntity.status(status).body(body);
    }

    private static Map<String, Object> body(HttpStatus status, String code, String message,
                                            HttpServletRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", Instant.now().toString());
        body.put("status", status.value());
        body.put("error", status.getReasonPhrase());
        body.put("code", code);
        body.put("message", message);
        body.put("path", request.getRequestURI());
        log.debug("API error {} on {}: {}", code, request.getRequestURI(), message);
        return body;
    }
}
