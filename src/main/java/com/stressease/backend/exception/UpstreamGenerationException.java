package com.stressease.backend.exception;

/**
 * Retryable generation failure: provider 5xx or rate limiting.
 */
public class UpstreamGenerationException extends StressEaseException {

    public UpstreamGenerationException(String message) {
        super(message);
    }
}
