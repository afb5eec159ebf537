package com.stressease.backend.exception;

import lombok.Getter;

/**
 * A session id was supplied but is not in the session table.
 * Distinct from "no session id", which opens a new session.
 */
@Getter
public class SessionExpiredException extends StressEaseException {

    private final String sessionId;

    public SessionExpiredException(String sessionId) {
        super("Chat session has expired or does not exist");
        this.sessionId = sessionId;
    }
}
