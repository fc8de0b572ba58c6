package com.ai.tarot.repository;

import com.ai.tarot.entity.Session;
import com.ai.tarot.exception.StorageUnavailableException;
import com.fasterxml.jackson.core.JsonProcessingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.Optional;

/**
 * Redis-backed store; expiry is delegated to Redis via {@code SET ... EX}.
 */
public class RedisSessionStore implements SessionStore {

    private static final Logger log = LoggerFactory.getLogger(RedisSessionStore.class);

    static final String KEY_PREFIX = "tarot:session:";

    private final StringRedisTemplate redis;
    private final SessionCodec codec;
    private final Duration ttl;

    public RedisSessionStore(StringRedisTemplate redis, SessionCodec codec, Duration ttl) {
        this.redis = redis;
        this.codec = codec;
        this.ttl = ttl;
    }

    @Override
    public Optional<Session> get(String userId) {
        String json;
        try {
            json = redis.opsForValue().get(key(userId));
        } catch (DataAccessException e) {
            throw new StorageUnavailableException("Redis read failed for user " + userId, e);
        }
        if (json == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(codec.decode(json));
        } catch (JsonProcessingException e) {
            log.warn("Dropping unreadable session for user {}: {}", userId, e.getOriginalMessage());
            delete(userId);
            return Optional.empty();
        }
    }

    @Override
    public void set(String userId, Session session) {
        try {
            redis.opsForValue().set(key(userId), codec.encode(session), ttl);
        } catch (DataAccessException e) {
            throw new StorageUnavailableException("Redis write failed for user " + userId, e);
        }
    }

    @Override
    public void delete(String userId) {
        try {
            redis.delete(key(userId));
        } catch (DataAccessException e) {
            throw new StorageUnavailableException("Redis delete failed for user " + userId, e);
        }
    }

    @Override
    public boolean exists(String userId) {
        try {
            return Boolean.TRUE.equals(redis.hasKey(key(userId)));
        } catch (DataAccessException e) {
            throw new StorageUnavailableException("Redis read failed for user " + userId, e);
        }
    }

    static String key(String userId) {
        return KEY_PREFIX + userId;
    }
}
