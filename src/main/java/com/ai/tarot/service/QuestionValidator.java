package com.ai.tarot.service;

import com.ai.tarot.dto.TurnErrorKind;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Length bounds for a user question. Short is measured after trimming, long on the raw text.
 */
@Component
public class QuestionValidator {

    public static final int MIN_LENGTH = 5;
    public static final int MAX_LENGTH = 500;

    public Optional<TurnErrorKind> validate(String question) {
        if (question == null || question.trim().length() < MIN_LENGTH) {
            return Optional.of(TurnErrorKind.QUESTION_TOO_SHORT);
        }
        if (question.length() > MAX_LENGTH) {
            return Optional.of(TurnErrorKind.QUESTION_TOO_LONG);
        }
        return Optional.empty();
    }
}
