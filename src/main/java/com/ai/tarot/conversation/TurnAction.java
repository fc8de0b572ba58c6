package com.ai.tarot.conversation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * Structured actions a user can send instead of free text (commands and menu buttons).
 */
public enum TurnAction {
    START("start"),
    HELP("help"),
    ASK_QUESTION("ask_question"),
    EXPLAIN_COMBINATION("explain_combination");

    private final String id;

    TurnAction(String id) {
        this.id = id;
    }

    @JsonValue
    public String getId() {
        return id;
    }

    public static Optional<TurnAction> fromId(String id) {
        if (id == null) return Optional.empty();
        String normalized = id.startsWith("/") ? id.substring(1) : id;
        for (TurnAction action : values()) {
            if (action.id.equalsIgnoreCase(normalized) || ("action:" + action.id).equalsIgnoreCase(normalized)) {
                return Optional.of(action);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    static TurnAction fromJson(String id) {
        return fromId(id).orElseThrow(() -> new IllegalArgumentException("Unknown action: " + id));
    }
}
