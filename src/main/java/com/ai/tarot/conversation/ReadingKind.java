package com.ai.tarot.conversation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * AUTOMATED readings draw cards for the user's question; CUSTOM readings interpret
 * cards the user names.
 */
public enum ReadingKind {
    AUTOMATED("automated"),
    CUSTOM("custom");

    private final String value;

    ReadingKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static ReadingKind fromValue(String value) {
        for (ReadingKind kind : values()) {
            if (kind.value.equals(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown reading kind: " + value);
    }
}
