package com.jay.tradeledger.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler({OrderNotFoundException.class, PositionNotFoundException.class})
    public ResponseEntity<Map<String, Object>> handleNotFound(LedgerException ex) {
        return buildError(HttpStatus.NOT_FOUND, ex.getMessage(), ex);
    }

    @ExceptionHandler({IllegalArgumentException.class, InvalidOrderMetadataException.class,
        HttpMessageNotReadableException.class, MissingServletRequestParameterException.class,
        MethodArgumentTypeMismatchException.class})
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception ex) {
        return buildError(HttpStatus.BAD_REQUEST, ex.getMessage(), ex);
    }

    @ExceptionHandler(LedgerStorageException.class)
    public ResponseEntity<Map<String, Object>> handleStorage(LedgerStorageException ex) {
        ResponseEntity<Map<String, Object>> response =
            buildError(HttpStatus.SERVICE_UNAVAILABLE, "Storage unavailable, retry later", ex);
        response.getBody().put("retriable", ex.isRetriable());
        return response;
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(Exception ex) {
        return buildError(HttpStatus.INTERNAL_SERVER_ERROR, "Unexpected error", ex);
    }

    private ResponseEntity<Map<String, Object>> buildError(HttpStatus status, String message, Exception ex) {
        if (status.is5xxServerError()) {
            log.error("Request failed with {}: {}", status.value(), ex.getMessage(), ex);
        } else {
            log.warn("Request failed with {}: {}", status.value(), ex.getMessage());
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", Instant.now().toString());
        body.put("status", status.value());
        body.put("error", status.getReasonPhrase());
        body.put("message", message);
        return ResponseEntity.status(status).body(body);
    }
}
