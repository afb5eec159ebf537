package com.stressease.backend.exception;

public class ResourceNotFoundException extends StressEaseException {

    public ResourceNotFoundException(String message) {
        super(message);
    }
}
