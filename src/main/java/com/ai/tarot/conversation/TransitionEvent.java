package com.ai.tarot.conversation;

/**
 * Events that may move a session between states. See {@link SessionTransitions}.
 */
public enum TransitionEvent {
    START_AUTOMATED_PAYMENT_REQUIRED,
    START_AUTOMATED_PAYMENT_WAIVED,
    START_CUSTOM_PAYMENT_REQUIRED,
    START_CUSTOM_PAYMENT_WAIVED,
    PAYMENT_CONFIRMED_AUTOMATED,
    PAYMENT_CONFIRMED_CUSTOM,
    QUESTION_ACCEPTED,
    CUSTOM_QUESTION_ACCEPTED,
    CARDS_RESOLVED,
    PROCESSING_SUCCEEDED,
    PROCESSING_FAILED,
    /** Explicit /start from the user; abandons whatever flow was in progress. */
    RESET;

    public static TransitionEvent startFlow(ReadingKind kind, boolean paymentWaived) {
        return switch (kind) {
            case AUTOMATED -> paymentWaived ? START_AUTOMATED_PAYMENT_WAIVED : START_AUTOMATED_PAYMENT_REQUIRED;
            case CUSTOM -> paymentWaived ? START_CUSTOM_PAYMENT_WAIVED : START_CUSTOM_PAYMENT_REQUIRED;
        };
    }

    public static TransitionEvent paymentConfirmed(ReadingKind kind) {
        return switch (kind) {
            case AUTOMATED -> PAYMENT_CONFIRMED_AUTOMATED;
            case CUSTOM -> PAYMENT_CONFIRMED_CUSTOM;
        };
    }
}
