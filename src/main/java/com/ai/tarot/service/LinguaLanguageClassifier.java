package com.ai.tarot.service;

import com.ai.tarot.conversation.Language;
import com.github.pemistahl.lingua.api.LanguageDetector;
import com.github.pemistahl.lingua.api.LanguageDetectorBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.SortedMap;

/**
 * Lingua detector restricted to the three supported languages.
 */
@Component
public class LinguaLanguageClassifier implements StatisticalLanguageClassifier {

    private static final Logger log = LoggerFactory.getLogger(LinguaLanguageClassifier.class);

    private final LanguageDetector detector;

    public LinguaLanguageClassifier() {
        this.detector = LanguageDetectorBuilder.fromLanguages(
                com.github.pemistahl.lingua.api.Language.ENGLISH,
                com.github.pemistahl.lingua.api.Language.RUSSIAN,
                com.github.pemistahl.lingua.api.Language.UKRAINIAN).build();
        log.info("Lingua detector ready for EN/RU/UK");
    }

    @Override
    public LanguageGuess classify(String text) {
        SortedMap<com.github.pemistahl.lingua.api.Language, Double> values =
                detector.computeLanguageConfidenceValues(text);
        Map.Entry<com.github.pemistahl.lingua.api.Language, Double> top = null;
        for (Map.Entry<com.github.pemistahl.lingua.api.Language, Double> entry : values.entrySet()) {
            if (top == null || entry.getValue() > top.getValue()) {
                top = entry;
            }
        }
        if (top == null) {
            return LanguageGuess.unknown();
        }
        Language language = toLanguage(top.getKey());
        return language == null ? LanguageGuess.unknown() : LanguageGuess.of(language, top.getValue());
    }

    private static Language toLanguage(com.github.pemistahl.lingua.api.Language detected) {
        switch (detected) {
            case ENGLISH:
                return Language.EN;
            case RUSSIAN:
                return Language.RU;
            case UKRAINIAN:
                return Language.UK;
            default:
                return null;
        }
    }
}
