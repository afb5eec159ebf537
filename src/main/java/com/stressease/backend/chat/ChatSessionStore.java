package com.stressease.backend.chat;

import java.util.Optional;

/**
 * Session table shared by all request handlers.
 *
 * Implementations must be safe for concurrent use across sessions. Callers
 * serialize access to a single session through {@link SessionLocks} within one
 * process; writes go through {@link #compareAndPut} so that instances sharing
 * a store cannot overwrite each other's turns.
 */
public interface ChatSessionStore {

    Optional<ChatSession> get(String sessionId);

    /**
     * Stores {@code session} only if the stored version still equals
     * {@code expectedVersion}. An absent entry matches an expected version of 0.
     *
     * @return false when another writer got there first
     */
    boolean compareAndPut(ChatSession session, long expectedVersion);

    /** @return true if an entry was removed */
    boolean delete(String sessionId);

    /**
     * Removes the entry only if its stored version still equals {@code expectedVersion}.
     *
     * @return true if an entry was removed
     */
    boolean compareAndDelete(String sessionId, long expectedVersion);
}
