package com.ai.tarot.service;

import com.ai.tarot.conversation.Language;
import com.ai.tarot.entity.Session;
import com.ai.tarot.repository.SessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;

@Service
public class SessionService {

    private static final Logger log = LoggerFactory.getLogger(SessionService.class);

    private final SessionStore store;
    private final Clock clock;

    public SessionService(SessionStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    public Session getOrCreate(String userId) {
        return store.get(userId).orElseGet(() -> {
            log.info("New session for user {}", userId);
            return Session.create(userId, Language.DEFAULT, clock.instant());
        });
    }

    /** Language of an existing session without creating one. */
    public Language currentLanguage(String userId) {
        return store.get(userId).map(Session::getLanguage).orElse(Language.DEFAULT);
    }

    public void save(Session session) {
        session.touch(clock.instant());
        store.set(session.getUserId(), session);
    }
}
