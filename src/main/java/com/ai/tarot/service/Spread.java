package com.ai.tarot.service;

import com.ai.tarot.conversation.Language;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Layouts for automated readings with their localized position labels.
 */
public enum Spread {
    THREE_CARD(List.of("Past", "Present", "Future"),
            List.of("Прошлое", "Настоящее", "Будущее"),
            List.of("Минуле", "Теперішнє", "Майбутнє")),
    SINGLE(List.of("Guidance"),
            List.of("Совет"),
            List.of("Порада"));

    private final List<String> english;
    private final List<String> russian;
    private final List<String> ukrainian;

    Spread(List<String> english, List<String> russian, List<String> ukrainian) {
        this.english = english;
        this.russian = russian;
        this.ukrainian = ukrainian;
    }

    public int size() {
        return english.size();
    }

    public List<String> positionLabels(Language language) {
        return switch (language) {
            case EN -> english;
            case RU -> russian;
            case UK -> ukrainian;
        };
    }

    public static Optional<Spread> fromConfig(String value) {
        if (value == null) return Optional.empty();
        String name = value.trim().toUpperCase(Locale.ROOT);
        for (Spread spread : values()) {
            if (spread.name().equals(name)) {
                return Optional.of(spread);
            }
        }
        return Optional.empty();
    }
}
