package com.example.phoneaddress.http;

import com.example.phoneaddress.service.PhoneAddressException;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(PhoneAddressException.class)
    public ResponseEntity<Map<String, Object>> domainError(PhoneAddressException ex) {
        HttpStatus status = switch (ex.getCode()) {
            case PHONE_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case PHONE_ALREADY_EXISTS -> HttpStatus.CONFLICT;
            case INVALID_PHONE -> HttpStatus.UNPROCESSABLE_ENTITY;
        };
        return body(status, ex.getCode().name(), ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> invalidBody(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .sorted()
                .collect(Collectors.joining("; "));
        return body(HttpStatus.UNPROCESSABLE_ENTITY, "VALIDATION_FAILED", message);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> unreadableBody(HttpMessageNotReadableException ex) {
        return body(HttpStatus.UNPROCESSABLE_ENTITY, "MALFORMED_BODY", "Request body is missing or is not valid JSON.");
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> badArgument(IllegalArgumentException ex) {
        return body(HttpStatus.UNPROCESSABLE_ENTITY, "VALIDATION_FAILED", ex.getMessage());
    }

    @ExceptionHandler(DataAccessResourceFailureException.class)
    public ResponseEntity<Map<String, Object>> storeUnavailable(DataAccessResourceFailureException ex) {
        log.error("Key-value store unavailable", ex);
        return body(HttpStatus.SERVICE_UNAVAILABLE, "STORE_UNAVAILABLE", "Storage backend is unavailable.");
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<Map<String, Object>> storeFailure(DataAccessException ex) {
        log.error("Key-value store operation failed", ex);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "Storage operation failed.");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> boom(Exception ex) {
        // Framework 4xx errors such as an unknown route keep their own status.
        if (ex instanceof ErrorResponse errorResponse) {
            HttpStatus status = HttpStatus.resolve(errorResponse.getStatusCode().value());
            if (status != null && status.is4xxClientError()) {
                return body(status, status.name(), ex.getMessage());
            }
        }
        log.error("Unexpected error handling request", ex);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", ex.getMessage());
    }

    private static ResponseEntity<Map<String, Object>> body(HttpStatus status, String code, String message) {
        return ResponseEntity.status(status)
                .body(Map.of(
                        "code", code,
                        "message", Objects.requireNonNullElse(message, status.getReasonPhrase())
                ));
    }
}
