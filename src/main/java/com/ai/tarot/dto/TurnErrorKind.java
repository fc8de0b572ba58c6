package com.ai.tarot.dto;

/**
 * Why a turn was not carried out. Rendered to the user through {@code ResponsePhrases}.
 */
public enum TurnErrorKind {
    QUESTION_TOO_SHORT,
    QUESTION_TOO_LONG,
    NO_CARDS_RECOGNIZED,
    UPSTREAM_FAILURE,
    ADMISSION_REJECTED,
    INVALID_STATE,
    PAYMENT_PENDING,
    SESSION_BUSY
}
