package com.subtrack.subbackend.error;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Maps store error kinds onto HTTP statuses. Raw driver messages never reach the client.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(StoreException.class)
    public ResponseEntity<Map<String, String>> handleStore(StoreException e) {
        HttpStatus status = statusFor(e.kind());
        switch (e.kind()) {
            case NOT_FOUND -> log.debug("Not found: {}", e.getMessage());
            case VALIDATION -> log.info("Rejected request: {}", e.getMessage());
            default -> log.error("Request failed ({}): {}", e.kind(), e.getMessage());
        }
        String details = status.is5xxServerError() ? "internal error" : e.getMessage();
        return ResponseEntity.status(status).body(body(e.kind().name(), details));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, String>> handleUnreadable(HttpMessageNotReadableException e) {
        log.info("Rejected request: unreadable body ({})", e.getMostSpecificCause().getMessage());
        return ResponseEntity.badRequest().body(body(ErrorKind.VALIDATION.name(), "invalid json"));
    }

    static HttpStatus statusFor(ErrorKind kind) {
        return switch (kind) {
            case VALIDATION -> HttpStatus.BAD_REQUEST;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            default -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    private static Map<String, String> body(String error, String details) {
        return Map.of("error", error, "details", details);
    }
}
