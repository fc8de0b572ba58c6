package com.ai.tarot.service;

import com.ai.tarot.conversation.Language;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Picks the conversation language for a turn. The statistical classifier handles
 * English; Ukrainian and Russian share the Cyrillic script and are told apart by
 * distinctive letters, then function words, then the ratio of {@code і} to {@code и}.
 */
@Service
public class LanguageResolver {

    private static final Logger log = LoggerFactory.getLogger(LanguageResolver.class);

    static final int MIN_LENGTH = 3;

    private static final String UK_CHARS = "іїєґ";
    private static final String RU_CHARS = "ыэъё";

    private static final Set<String> UK_WORDS = Set.of("чи", "який", "мені", "тобі", "цей", "той", "ця", "та", "ті", "тих");
    private static final Set<String> RU_WORDS = Set.of("или", "который", "мне", "тебе", "этот", "тот", "эта", "эти", "тех");

    private final StatisticalLanguageClassifier classifier;

    @Value("${app.language.min-confidence:0.8}")
    private double minConfidence = 0.8;

    public LanguageResolver(StatisticalLanguageClassifier classifier) {
        this.classifier = classifier;
    }

    public Language resolve(String text, Language fallback) {
        if (text == null || text.trim().length() < MIN_LENGTH) {
            return fallback;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        boolean cyrillic = containsCyrillic(lower);

        LanguageGuess guess;
        try {
            guess = classifier.classify(text);
        } catch (RuntimeException e) {
            log.warn("Language classifier failed, using script heuristics: {}", e.getMessage());
            return cyrillic ? disambiguateCyrillic(lower) : fallback;
        }

        if (guess.getLanguage().orElse(null) == Language.EN && guess.getConfidence() >= minConfidence) {
            return Language.EN;
        }
        if (!cyrillic) {
            return guess.getLanguage().orElse(fallback);
        }
        return disambiguateCyrillic(lower);
    }

    Language disambiguateCyrillic(String lower) {
        for (int i = 0; i < lower.length(); i++) {
            if (UK_CHARS.indexOf(lower.charAt(i)) >= 0) return Language.UK;
        }
        for (int i = 0; i < lower.length(); i++) {
            if (RU_CHARS.indexOf(lower.charAt(i)) >= 0) return Language.RU;
        }

        List<String> words = words(lower);
        for (String word : words) {
            if (UK_WORDS.contains(word)) return Language.UK;
        }
        for (String word : words) {
            if (RU_WORDS.contains(word)) return Language.RU;
        }

        int ukI = 0;
        int ruI = 0;
        for (int i = 0; i < lower.length(); i++) {
            char c = lower.charAt(i);
            if (c == 'і') ukI++;
            else if (c == 'и') ruI++;
        }
        if (ukI >= 1 && (double) ukI / (ukI + ruI) > 0.3) {
            return Language.UK;
        }
        return Language.RU;
    }

    static boolean containsCyrillic(String text) {
        for (int i = 0; i < text.length(); i++) {
            if (Character.UnicodeBlock.of(text.charAt(i)) == Character.UnicodeBlock.CYRILLIC) {
                return true;
            }
        }
        return false;
    }

    private static List<String> words(String text) {
        List<String> words = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (Character.isLetter(c) || c == '\'' || c == '’' || c == 'ʼ') {
                current.append(c);
            } else if (current.length() > 0) {
                words.add(current.toString());
                current.setLength(0);
            }
        }
        if (current.length() > 0) {
            words.add(current.toString());
        }
        return words;
    }
}
