package com.stressease.backend.chat;

import com.stressease.backend.config.StressEaseProperties;
import com.stressease.backend.exception.SessionBusyException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Striped per-session mutual exclusion.
 *
 * A fixed array of locks indexed by the session id hash: two requests for the
 * same session always share a stripe, unrelated sessions usually do not.
 * Acquisition waits at most {@code stressease.session.lock-timeout-ms}.
 */
@Component
@Slf4j
public class SessionLocks {

    private final ReentrantLock[] stripes;
    private final long timeoutMs;

    public SessionLocks(StressEaseProperties properties) {
        this(properties.getSession().getLockStripes(), properties.getSession().getLockTimeoutMs());
    }

    SessionLocks(int stripeCount, long timeoutMs) {
        if (stripeCount < 1) {
            throw new IllegalArgumentException("stripeCount must be positive: " + stripeCount);
        }
        this.stripes = new ReentrantLock[stripeCount];
        for (int i = 0; i < stripeCount; i++) {
            stripes[i] = new ReentrantLock();
        }
        this.timeoutMs = timeoutMs;
    }

    public <T> T withLock(String sessionId, Supplier<T> action) {
        ReentrantLock lock = stripeFor(sessionId);
        try {
            if (!lock.tryLock(timeoutMs, TimeUnit.MILLISECONDS)) {
                log.warn("Timed out after {}ms waiting for session={}", timeoutMs, sessionId);
                throw new SessionBusyException(sessionId);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SessionBusyException(sessionId);
        }

        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    ReentrantLock stripeFor(String sessionId) {
        return stripes[Math.floorMod(sessionId.hashCode(), stripes.length)];
    }
}
