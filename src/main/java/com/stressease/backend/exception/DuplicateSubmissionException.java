package com.stressease.backend.exception;

/**
 * A request carrying the same Idempotency-Key is still being processed.
 */
public class DuplicateSubmissionException extends StressEaseException {

    public DuplicateSubmissionException(String idempotencyKey) {
        super("A request with Idempotency-Key " + idempotencyKey + " is already in progress");
    }
}
