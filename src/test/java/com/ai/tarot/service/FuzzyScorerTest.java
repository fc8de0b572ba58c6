package com.ai.tarot.service;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FuzzyScorerTest {

    private final FuzzyScorer scorer = new FuzzyScorer();

    @Test
    void identicalStringsScoreFullMarks() {
        assertEquals(100, scorer.score("the moon", "the moon"));
    }

    @Test
    void emptyInputScoresZero() {
        assertEquals(0, scorer.score("", "moon"));
        assertEquals(0, scorer.score("moon", null));
    }

    @Test
    void typosStayAboveDefaultThreshold() {
        assertEquals(89, scorer.score("moonn", "moon"));
        assertEquals(93, scorer.score("magican", "magician"));
    }

    @Test
    void reorderedWordsAreTolerated() {
        assertEquals(95, scorer.score("fortune wheel of", "wheel of fortune"));
    }

    @Test
    void substringMatchIsDiscounted() {
        assertEquals(90, scorer.score("queen", "queen of cups"));
    }

    @Test
    void unrelatedStringsScoreLow() {
        assertEquals(0, scorer.score("abc", "xyz"));
        assertTrue(scorer.score("sun", "moon") < 50);
    }
}
