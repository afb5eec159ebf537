package com.stressease.backend.chat;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Process-local session table. Entries live until ended or summarized.
 */
@Component
@ConditionalOnProperty(name = "stressease.session.store", havingValue = "memory", matchIfMissing = true)
@Slf4j
public class InMemoryChatSessionStore implements ChatSessionStore {

    private final ConcurrentMap<String, ChatSession> sessions = new ConcurrentHashMap<>();

    @Override
    public Optional<ChatSession> get(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    @Override
    public boolean compareAndPut(ChatSession session, long expectedVersion) {
        boolean[] stored = {false};
        sessions.compute(session.getSessionId(), (id, current) -> {
            long currentVersion = current == null ? 0 : current.getVersion();
            if (currentVersion != expectedVersion) {
                return current;
            }
            stored[0] = true;
            return session;
        });
        if (stored[0]) {
            log.debug("Stored session={} version={}", session.getSessionId(), session.getVersion());
        } else {
            log.warn("Rejected stale write for session={} (expected version {})",
                    session.getSessionId(), expectedVersion);
        }
        return stored[0];
    }

    @Override
    public boolean delete(String sessionId) {
        return sessions.remove(sessionId) != null;
    }

    @Override
    public boolean compareAndDelete(String sessionId, long expectedVersion) {
        boolean[] removed = {false};
        sessions.computeIfPresent(sessionId, (id, current) -> {
            if (current.getVersion() == expectedVersion) {
                removed[0] = true;
                return null;
            }
            return current;
        });
        return removed[0];
    }

    int size() {
        return sessions.size();
    }
}
