package com.ai.tarot.repository;

import com.ai.tarot.entity.Session;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.stereotype.Component;

/**
 * JSON form of a persisted session, ISO-8601 timestamps. Shared by both store backends
 * so a session reads back the same whichever one wrote it.
 */
@Component
public class SessionCodec {

    private final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    public String encode(Session session) {
        try {
            return mapper.writeValueAsString(session);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize session for user " + session.getUserId(), e);
        }
    }

    public Session decode(String json) throws JsonProcessingException {
        return mapper.readValue(json, Session.class);
    }
}
