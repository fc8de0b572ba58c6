package com.ai.tarot.service;

import com.ai.tarot.conversation.Language;

import java.util.Optional;

/**
 * Best guess of a statistical classifier; {@code language} is empty when it could not decide.
 */
public final class LanguageGuess {

    private static final LanguageGuess UNKNOWN = new LanguageGuess(null, 0.0);

    private final Language language;
    private final double confidence;

    private LanguageGuess(Language language, double confidence) {
        this.language = language;
        this.confidence = confidence;
    }

    public static LanguageGuess of(Language language, double confidence) {
        return new LanguageGuess(language, confidence);
    }

    public static LanguageGuess unknown() {
        return UNKNOWN;
    }

    public Optional<Language> getLanguage() {
        return Optional.ofNullable(language);
    }

    public double getConfidence() {
        return confidence;
    }

    @Override
    public String toString() {
        return "LanguageGuess{" + language + ", " + confidence + "}";
    }
}
