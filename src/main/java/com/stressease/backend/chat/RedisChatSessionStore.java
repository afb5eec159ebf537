package com.stressease.backend.chat;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stressease.backend.config.StressEaseProperties;
import com.stressease.backend.exception.StorageException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Redis-backed session table for deployments running more than one instance.
 *
 * Key pattern: stressease:session:{sessionId}
 * Each session is a single JSON document; the TTL is reset on every write so
 * idle sessions expire on their own. An expired key reads exactly like an
 * ended session.
 *
 * {@link SessionLocks} only serializes requests within one process, so
 * compare-and-put and compare-and-delete run as Lua scripts that check the
 * stored version atomically.
 */
@Component
@ConditionalOnProperty(name = "stressease.session.store", havingValue = "redis")
@Slf4j
public class RedisChatSessionStore implements ChatSessionStore {

    static final String KEY_PREFIX = "stressease:session:";

    static final RedisScript<Long> COMPARE_AND_DELETE = new DefaultRedisScript<>(
            "local current = redis.call('GET', KEYS[1]) "
            + "if not current then return 0 end "
            + "if tostring(cjson.decode(current)['version']) == ARGV[1] then "
            + "  return redis.call('DEL', KEYS[1]) "
            + "end "
            + "return 0",
            Long.class);

    static final RedisScript<Long> COMPARE_AND_SET = new DefaultRedisScript<>(
            "local current = redis.call('GET', KEYS[1]) "
            + "if current then "
            + "  if tostring(cjson.decode(current)['version']) ~= ARGV[1] then return 0 end "
            + "elseif ARGV[1] ~= '0' then "
            + "  return 0 "
            + "end "
            + "redis.call('SET', KEYS[1], ARGV[2], 'PX', ARGV[3]) "
            + "return 1",
            Long.class);

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final Duration ttl;

    public RedisChatSessionStore(StringRedisTemplate redisTemplate,
                                 ObjectMapper objectMapper,
                                 StressEaseProperties properties) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.ttl = Duration.ofMinutes(properties.getSession().getTtlMinutes());
        log.info("Redis session store enabled (idle TTL: {})", ttl);
    }

    @Override
    public Optional<ChatSession> get(String sessionId) {
        String json = redisTemplate.opsForValue().get(buildKey(sessionId));
        if (json == null) {
            return Optional.empty();
        }

        try {
            return Optional.of(objectMapper.readValue(json, ChatSession.class));
        } catch (JsonProcessingException e) {
            // An unreadable entry can never be resumed; treat it as expired
            log.error("Corrupt session document for session={}, discarding", sessionId, e);
            redisTemplate.delete(buildKey(sessionId));
            return Optional.empty();
        }
    }

    @Override
    public boolean compareAndPut(ChatSession session, long expectedVersion) {
        Long stored = redisTemplate.execute(COMPARE_AND_SET,
                List.of(buildKey(session.getSessionId())),
                String.valueOf(expectedVersion), serialize(session), String.valueOf(ttl.toMillis()));
        boolean ok = stored != null && stored > 0;
        if (ok) {
            log.debug("Saved session={} version={} (TTL: {})", session.getSessionId(), session.getVersion(), ttl);
        } else {
            log.warn("Rejected stale write for session={} (expected version {})",
                    session.getSessionId(), expectedVersion);
        }
        return ok;
    }

    @Override
    public boolean delete(String sessionId) {
        return Boolean.TRUE.equals(redisTemplate.delete(buildKey(sessionId)));
    }

    @Override
    public boolean compareAndDelete(String sessionId, long expectedVersion) {
        Long removed = redisTemplate.execute(COMPARE_AND_DELETE,
                List.of(buildKey(sessionId)), String.valueOf(expectedVersion));
        return removed != null && removed > 0;
    }

    private String serialize(ChatSession session) {
        try {
            return objectMapper.writeValueAsString(session);
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to serialize session " + session.getSessionId(), e);
        }
    }

    private String buildKey(String sessionId) {
        return KEY_PREFIX + sessionId;
    }
}
