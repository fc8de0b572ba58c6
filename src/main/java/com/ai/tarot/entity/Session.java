package com.ai.tarot.entity;

import com.ai.tarot.conversation.Language;
import com.ai.tarot.conversation.SessionState;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Conversation state of one user. Mutated only by the state machine, persisted
 * between turns through a {@code SessionStore}.
 * <p>
 * {@code readingCount} always equals the size of {@code readingHistory}; both change
 * together in {@link #recordReading(Reading)}.
 */
@Getter
@ToString(exclude = "readingHistory")
public class Session {

    public static final String CUSTOM_QUESTION = "custom_question";
    public static final String PENDING_FLOW = "pending_flow";
    public static final String INVOICE_PAYLOAD = "invoice_payload";

    private final String userId;

    private Language language;

    private SessionState state;

    private final Map<String, String> context;

    private int readingCount;

    private final List<Reading> readingHistory;

    private final Instant createdAt;

    private Instant updatedAt;

    @JsonCreator
    public Session(@JsonProperty("userId") String userId,
                   @JsonProperty("language") Language language,
                   @JsonProperty("state") SessionState state,
                   @JsonProperty("context") Map<String, String> context,
                   @JsonProperty("readingCount") int readingCount,
                   @JsonProperty("readingHistory") List<Reading> readingHistory,
                   @JsonProperty("createdAt") Instant createdAt,
                   @JsonProperty("updatedAt") Instant updatedAt) {
        this.userId = Objects.requireNonNull(userId, "userId");
        this.language = language == null ? Language.DEFAULT : language;
        this.state = state == null ? SessionState.IDLE : state;
        this.context = context == null ? new LinkedHashMap<>() : new LinkedHashMap<>(context);
        this.readingHistory = readingHistory == null ? new ArrayList<>() : new ArrayList<>(readingHistory);
        if (readingCount != this.readingHistory.size()) {
            throw new IllegalArgumentException("readingCount " + readingCount
                    + " does not match history size " + this.readingHistory.size() + " for user " + userId);
        }
        this.readingCount = readingCount;
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.updatedAt = updatedAt == null ? createdAt : updatedAt;
    }

    public static Session create(String userId, Language language, Instant now) {
        return new Session(userId, language, SessionState.IDLE, null, 0, null, now, now);
    }

    public Map<String, String> getContext() {
        return Collections.unmodifiableMap(context);
    }

    public List<Reading> getReadingHistory() {
        return Collections.unmodifiableList(readingHistory);
    }

    @JsonIgnore
    public Optional<Reading> getLastReading() {
        return readingHistory.isEmpty() ? Optional.empty() : Optional.of(readingHistory.get(readingHistory.size() - 1));
    }

    @JsonIgnore
    public Optional<String> getContextValue(String key) {
        return Optional.ofNullable(context.get(key));
    }

    public void putContext(String key, String value) {
        context.put(key, value);
    }

    public void clearTransientContext() {
        context.remove(CUSTOM_QUESTION);
        context.remove(PENDING_FLOW);
        context.remove(INVOICE_PAYLOAD);
    }

    public void setLanguage(Language language) {
        this.language = Objects.requireNonNull(language, "language");
    }

    public void setState(SessionState state) {
        this.state = Objects.requireNonNull(state, "state");
    }

    public void recordReading(Reading reading) {
        readingHistory.add(Objects.requireNonNull(reading, "reading"));
        readingCount = readingHistory.size();
    }

    public void touch(Instant now) {
        this.updatedAt = now;
    }
}
