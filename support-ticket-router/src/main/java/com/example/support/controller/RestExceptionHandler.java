package com.example.support.controller;

import com.example.support.service.exception.ServiceException;
import jakarta.validation.ConstraintViolationException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Renders failures of the ticket API as {@code {timestamp, error, code}} bodies.
 */
@Slf4j
@RestControllerAdvice
public class RestExceptionHandler {

    static final String VALIDATION_ERROR = "validation_error";
    static final String INTERNAL_ERROR = "internal_error";

    @ExceptionHandler(ServiceException.class)
    public ResponseEntity<Map<String, Object>> handleServiceException(ServiceException ex) {
        if (ex.isServerError()) {
            log.error("Ticket API request failed with {}: {}", ex.getStatus(), ex.getMessage(), ex);
        } else {
            log.debug("Ticket API request rejected with {}: {}", ex.getStatus(), ex.getMessage());
        }
        return ResponseEntity.status(ex.getStatus()).body(body(ex.getMessage(), ex.getErrorCode()));
    }

    @ExceptionHandler({
        ConstraintViolationException.class,
        MissingServletRequestParameterException.class,
        MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<Map<String, Object>> handleValidation(Exception ex) {
        Map<String, Object> body = body(VALIDATION_ERROR, VALIDATION_ERROR);
        body.put("details", String.valueOf(ex.getMessage()));
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(Exception ex) {
        log.error("Unhandled ticket API failure", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(body(String.valueOf(ex.getMessage()), INTERNAL_ERROR));
    }

    private static Map<String, Object> body(String error, String code) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", Instant.now().toString());
        body.put("error", error);
        if (code != null) {
            body.put("code", code);
        }
        return body;
    }
}
