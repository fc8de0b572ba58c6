package com.ai.tarot.conversation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * States of the per-user reading conversation. IDLE is both initial and terminal.
 */
public enum SessionState {
    IDLE("idle"),
    AWAITING_PAYMENT("awaiting_payment"),
    AWAITING_QUESTION("awaiting_question"),
    AWAITING_CUSTOM_QUESTION("awaiting_custom_question"),
    AWAITING_CARDS("awaiting_cards"),
    PROCESSING("processing");

    private final String value;

    SessionState(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    static SessionState fromValue(String value) {
        for (SessionState state : values()) {
            if (state.value.equals(value)) {
                return state;
            }
        }
        throw new IllegalArgumentException("Unknown session state: " + value);
    }
}
