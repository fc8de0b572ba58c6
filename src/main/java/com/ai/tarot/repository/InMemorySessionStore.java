package com.ai.tarot.repository;

import com.ai.tarot.entity.Session;
import com.fasterxml.jackson.core.JsonProcessingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local store. Holds the serialized form so callers never share a mutable
 * {@link Session} instance across turns.
 */
public class InMemorySessionStore implements SessionStore {

    private static final Logger log = LoggerFactory.getLogger(InMemorySessionStore.class);

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final SessionCodec codec;
    private final Clock clock;
    private final Duration ttl;

    public InMemorySessionStore(SessionCodec codec, Clock clock, Duration ttl) {
        this.codec = codec;
        this.clock = clock;
        this.ttl = ttl;
    }

    @Override
    public Optional<Session> get(String userId) {
        Entry entry = entries.get(userId);
        if (entry == null) {
            return Optional.empty();
        }
        if (!clock.instant().isBefore(entry.expiresAt)) {
            entries.remove(userId, entry);
            log.debug("Session for user {} expired", userId);
            return Optional.empty();
        }
        try {
            return Optional.of(codec.decode(entry.json));
        } catch (JsonProcessingException e) {
            log.warn("Dropping unreadable session for user {}: {}", userId, e.getOriginalMessage());
            entries.remove(userId, entry);
            return Optional.empty();
        }
    }

    @Override
    public void set(String userId, Session session) {
        entries.put(userId, new Entry(codec.encode(session), clock.instant().plus(ttl)));
    }

    @Override
    public void delete(String userId) {
        entries.remove(userId);
    }

    @Override
    public boolean exists(String userId) {
        return get(userId).isPresent();
    }

    private static final class Entry {
        private final String json;
        private final Instant expiresAt;

        private Entry(String json, Instant expiresAt) {
            this.json = json;
            this.expiresAt = expiresAt;
        }
    }
}
