package com.stressease.backend.exception;

/**
 * Non-retryable generation failure: bad credentials, decommissioned model,
 * malformed request. Ignored by the circuit breaker.
 */
public class LlmClientException extends StressEaseException {

    public LlmClientException(String message) {
        super(message);
    }

    public LlmClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
