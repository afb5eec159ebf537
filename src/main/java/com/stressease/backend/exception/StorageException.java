package com.stressease.backend.exception;

/**
 * A required write or read against the datastore failed.
 */
public class StorageException extends StressEaseException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
