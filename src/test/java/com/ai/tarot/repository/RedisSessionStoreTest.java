package com.ai.tarot.repository;

import com.ai.tarot.conversation.Language;
import com.ai.tarot.entity.Session;
import com.ai.tarot.exception.StorageUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RedisSessionStoreTest {

    private static final Duration TTL = Duration.ofHours(24);

    @Mock
    private StringRedisTemplate redis;

    @Mock
    private ValueOperations<String, String> values;

    private final SessionCodec codec = new SessionCodec();
    private RedisSessionStore store;

    @BeforeEach
    void setUp() {
        store = new RedisSessionStore(redis, codec, TTL);
    }

    @Test
    void writesUnderPrefixedKeyWithTtl() {
        when(redis.opsForValue()).thenReturn(values);
        Session session = Session.create("42", Language.RU, Instant.parse("2024-05-01T10:00:00Z"));

        store.set("42", session);

        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        verify(values).set(eq("tarot:session:42"), json.capture(), eq(TTL));
        assertTrue(json.getValue().contains("\"userId\":\"42\""));
    }

    @Test
    void readsStoredSession() {
        Session session = Session.create("42", Language.UK, Instant.parse("2024-05-01T10:00:00Z"));
        when(redis.opsForValue()).thenReturn(values);
        when(values.get("tarot:session:42")).thenReturn(codec.encode(session));

        Optional<Session> loaded = store.get("42");

        assertEquals(Language.UK, loaded.orElseThrow().getLanguage());
    }

    @Test
    void unreadableRecordIsDroppedAndTreatedAsMissing() {
        when(redis.opsForValue()).thenReturn(values);
        when(values.get("tarot:session:42")).thenReturn("{not json");

        assertTrue(store.get("42").isEmpty());
        verify(redis).delete("tarot:session:42");
    }

    @Test
    void connectionFailureSurfacesAsStorageUnavailable() {
        when(redis.opsForValue()).thenReturn(values);
        when(values.get("tarot:session:42")).thenThrow(new RedisConnectionFailureException("refused"));

        assertThrows(StorageUnavailableException.class, () -> store.get("42"));
    }

    @Test
    void existsUsesHasKey() {
        when(redis.hasKey("tarot:session:42")).thenReturn(Boolean.TRUE);

        assertTrue(store.exists("42"));
    }
}
