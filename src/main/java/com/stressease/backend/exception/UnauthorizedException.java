package com.stressease.backend.exception;

public class UnauthorizedException extends StressEaseException {

    public UnauthorizedException(String message) {
        super(message);
    }
}
