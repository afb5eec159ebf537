package com.stressease.backend.exception;

import lombok.Getter;

/**
 * Malformed, missing or out-of-range request field. Always reported to the
 * caller together with the offending field.
 */
@Getter
public class InputValidationException extends StressEaseException {

    private final String field;

    public InputValidationException(String field, String message) {
        super(message);
        this.field = field;
    }
}
