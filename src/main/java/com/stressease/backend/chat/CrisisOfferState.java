package com.stressease.backend.chat;

/**
 * Progress of the crisis-resource handshake within one session.
 * RESOLVED behaves like NOT_OFFERED for the next message; a session may
 * re-enter OFFERED_PENDING_CONFIRMATION whenever risk is detected again.
 */
public enum CrisisOfferState {
    NOT_OFFERED,
    OFFERED_PENDING_CONFIRMATION,
    RESOLVED;

    public boolean isPending() {
        return this == OFFERED_PENDING_CONFIRMATION;
    }
}
