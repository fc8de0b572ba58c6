package com.ai.tarot.conversation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Languages the bot converses in. English is the default; Ukrainian and Russian
 * share the Cyrillic script and need marker-based disambiguation.
 */
public enum Language {
    EN("en"),
    UK("uk"),
    RU("ru");

    public static final Language DEFAULT = EN;

    private final String code;

    Language(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static Optional<Language> fromCode(String code) {
        if (code == null) return Optional.empty();
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (Language language : values()) {
            if (language.code.equals(normalized)) {
                return Optional.of(language);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    static Language fromJson(String code) {
        return fromCode(code).orElseThrow(() -> new IllegalArgumentException("Unsupported language code: " + code));
    }
}
