package com.ai.tarot.repository;

import com.ai.tarot.entity.Session;

import java.util.Optional;

/**
 * Keyed session storage with inactivity expiry. Every {@link #set} restarts the TTL;
 * an expired entry reads as absent.
 */
public interface SessionStore {

    Optional<Session> get(String userId);

    void set(String userId, Session session);

    void delete(String userId);

    boolean exists(String userId);
}
