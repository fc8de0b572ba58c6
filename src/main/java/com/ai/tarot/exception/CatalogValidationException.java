package com.ai.tarot.exception;

import java.util.List;

/**
 * The card catalog is empty or structurally invalid. Raised at startup only.
 */
public class CatalogValidationException extends RuntimeException {

    private final List<String> problems;

    public CatalogValidationException(String message, List<String> problems) {
        super(problems.isEmpty() ? message : message + ": " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> getProblems() {
        return problems;
    }
}
