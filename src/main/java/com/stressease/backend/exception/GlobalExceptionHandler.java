package com.stressease.backend.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps the exception hierarchy to {success:false, error, message, field?, timestamp}.
 * Client errors are logged at WARN, server errors at ERROR with the stack trace.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(InputValidationException.class)
    public ResponseEntity<Map<String, Object>> handleInputValidation(InputValidationException ex) {
        log.warn("Invalid input [field={}]: {}", ex.getField(), ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Invalid input", ex.getMessage(), ex.getField());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException ex) {
        FieldError first = ex.getBindingResult().getFieldErrors().stream().findFirst().orElse(null);
        String message = first != null ? first.getDefaultMessage() : "Validation failed";
        String field = first != null ? snakeCase(first.getField()) : null;
        log.warn("Request validation failed [field={}]: {}", field, message);
        return respond(HttpStatus.BAD_REQUEST, "Invalid input", message, field);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Invalid request", "A valid JSON body is required", "body");
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<Map<String, Object>> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        log.warn("Bad parameter [{}]: {}", ex.getName(), ex.getValue());
        return respond(HttpStatus.BAD_REQUEST, "Invalid input",
                ex.getName() + " has an invalid value", ex.getName());
    }

    @ExceptionHandler(UnauthorizedException.class)
    public ResponseEntity<Map<String, Object>> handleUnauthorized(UnauthorizedException ex) {
        log.warn("Unauthorized: {}", ex.getMessage());
        return respond(HttpStatus.UNAUTHORIZED, "Unauthorized", ex.getMessage(), null);
    }

    @ExceptionHandler(SessionExpiredException.class)
    public ResponseEntity<Map<String, Object>> handleSessionExpired(SessionExpiredException ex) {
        log.warn("Session not found [sessionId={}]", ex.getSessionId());
        return respond(HttpStatus.NOT_FOUND, "Session expired", ex.getMessage(), null);
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(ResourceNotFoundException ex) {
        log.warn("Not found: {}", ex.getMessage());
        return respond(HttpStatus.NOT_FOUND, "Not found", ex.getMessage(), null);
    }

    @ExceptionHandler({SessionBusyException.class, DuplicateSubmissionException.class})
    public ResponseEntity<Map<String, Object>> handleConflict(StressEaseException ex) {
        log.warn("Conflict: {}", ex.getMessage());
        return respond(HttpStatus.CONFLICT, "Conflict", ex.getMessage(), null);
    }

    @ExceptionHandler(UpstreamGenerationException.class)
    public ResponseEntity<Map<String, Object>> handleUpstream(UpstreamGenerationException ex) {
        log.error("Generation unavailable: {}", ex.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "AI service unavailable", ex.getMessage(), null);
    }

    @ExceptionHandler(LlmClientException.class)
    public ResponseEntity<Map<String, Object>> handleLlmClient(LlmClientException ex) {
        log.error("LLM client misconfiguration: {}", ex.getMessage(), ex);
        return respond(HttpStatus.BAD_GATEWAY, "AI service error",
                "The AI service rejected the request", null);
    }

    @ExceptionHandler(StorageException.class)
    public ResponseEntity<Map<String, Object>> handleStorage(StorageException ex) {
        log.error("Storage error: {}", ex.getMessage(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Database error", ex.getMessage(), null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGeneral(Exception ex) {
        log.error("Unexpected error", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Server error", "An unexpected error occurred", null);
    }

    private ResponseEntity<Map<String, Object>> respond(HttpStatus status, String error,
                                                        String message, String field) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", false);
        body.put("error", error);
        body.put("message", message);
        if (field != null) {
            body.put("field", field);
        }
        body.put("timestamp", Instant.now().toString());
        return ResponseEntity.status(status).body(body);
    }

    private static String snakeCase(String javaName) {
        return javaName.replaceAll("([a-z0-9])([A-Z])", "$1_$2").toLowerCase();
    }
}
