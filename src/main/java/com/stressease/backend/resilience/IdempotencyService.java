package com.stressease.backend.resilience;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;

/**
 * Redis-based idempotency for daily quiz submissions.
 *
 * A mobile client that times out and resubmits must not create a second
 * daily entry (which would also shift the weekly block boundary). The client
 * sends an Idempotency-Key; the first response is cached under it and replayed
 * for repeats.
 *
 * Key pattern: stressease:idempotency:{userId}:{idempotencyKey}
 * TTL: 24 hours
 *
 * Opt-in and best effort: without a key, or when Redis is unreachable, the
 * request simply runs.
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String KEY_PREFIX = "stressease:idempotency:";
    private static final Duration TTL = Duration.ofHours(24);
    // Stored while the first request is still running
    static final String IN_FLIGHT_SENTINEL = "__IN_FLIGHT__";

    private final StringRedisTemplate redisTemplate;

    public IdempotencyService(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    /**
     * @return the cached response body, empty when the key is unknown or still in flight
     */
    public Optional<String> getCachedResponse(String userId, String idempotencyKey) {
        try {
            String existing = redisTemplate.opsForValue().get(buildKey(userId, idempotencyKey));
            if (existing == null || IN_FLIGHT_SENTINEL.equals(existing)) {
                return Optional.empty();
            }
            log.info("Idempotency hit [userId={}, key={}]", userId, idempotencyKey);
            return Optional.of(existing);
        } catch (DataAccessException e) {
            log.warn("Idempotency lookup unavailable, processing request fresh: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Marks the key as in flight (SET NX).
     *
     * @return false only when another request already holds the key
     */
    public boolean claimKey(String userId, String idempotencyKey) {
        try {
            Boolean claimed = redisTemplate.opsForValue()
                    .setIfAbsent(buildKey(userId, idempotencyKey), IN_FLIGHT_SENTINEL, TTL);
            return !Boolean.FALSE.equals(claimed);
        } catch (DataAccessException e) {
            log.warn("Idempotency claim unavailable, processing request fresh: {}", e.getMessage());
            return true;
        }
    }

    public void storeResponse(String userId, String idempotencyKey, String responseJson) {
        try {
            redisTemplate.opsForValue().set(buildKey(userId, idempotencyKey), responseJson, TTL);
            log.debug("Stored idempotency response [userId={}, key={}]", userId, idempotencyKey);
        } catch (DataAccessException e) {
            log.warn("Failed to cache idempotency response for key={}: {}", idempotencyKey, e.getMessage());
        }
    }

    /** Frees the key after a failed request so the client can retry. */
    public void releaseKey(String userId, String idempotencyKey) {
        try {
            redisTemplate.delete(buildKey(userId, idempotencyKey));
        } catch (DataAccessException e) {
            log.warn("Failed to release idempotency key={}: {}", idempotencyKey, e.getMessage());
        }
    }

    private String buildKey(String userId, String idempotencyKey) {
        return KEY_PREFIX + userId + ":" + idempotencyKey;
    }
}
