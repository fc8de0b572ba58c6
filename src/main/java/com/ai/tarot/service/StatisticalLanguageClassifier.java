package com.ai.tarot.service;

/**
 * General-purpose language identification. Implementations may throw on unusable input;
 * callers treat that as "no opinion".
 */
public interface StatisticalLanguageClassifier {

    LanguageGuess classify(String text);
}
