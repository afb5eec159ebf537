package com.stressease.backend.exception;

public class SessionBusyException extends StressEaseException {

    public SessionBusyException(String sessionId) {
        super("Session " + sessionId + " is busy processing another message. Please retry.");
    }
}
