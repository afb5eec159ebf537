package com.stressease.backend.exception;

/**
 * Root of the application's unchecked exception hierarchy.
 * Mapped to HTTP responses by {@link GlobalExceptionHandler}.
 */
public class StressEaseException extends RuntimeException {

    public StressEaseException(String message) {
        super(message);
    }

    public StressEaseException(String message, Throwable cause) {
        super(message, cause);
    }
}
