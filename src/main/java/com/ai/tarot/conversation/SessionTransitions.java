package com.ai.tarot.conversation;

import java.util.Optional;

/**
 * The complete transition table of the reading conversation. Any (state, event) pair
 * not listed here is rejected and leaves the state unchanged.
 */
public final class SessionTransitions {

    private SessionTransitions() {
    }

    public static Optional<SessionState> next(SessionState state, TransitionEvent event) {
        if (event == TransitionEvent.RESET) {
            return Optional.of(SessionState.IDLE);
        }
        SessionState target = switch (state) {
            case IDLE -> switch (event) {
                case START_AUTOMATED_PAYMENT_REQUIRED, START_CUSTOM_PAYMENT_REQUIRED -> SessionState.AWAITING_PAYMENT;
                case START_AUTOMATED_PAYMENT_WAIVED -> SessionState.AWAITING_QUESTION;
                case START_CUSTOM_PAYMENT_WAIVED -> SessionState.AWAITING_CUSTOM_QUESTION;
                default -> null;
            };
            case AWAITING_PAYMENT -> switch (event) {
                case PAYMENT_CONFIRMED_AUTOMATED -> SessionState.AWAITING_QUESTION;
                case PAYMENT_CONFIRMED_CUSTOM -> SessionState.AWAITING_CUSTOM_QUESTION;
                default -> null;
            };
            case AWAITING_QUESTION -> event == TransitionEvent.QUESTION_ACCEPTED ? SessionState.PROCESSING : null;
            case AWAITING_CUSTOM_QUESTION -> event == TransitionEvent.CUSTOM_QUESTION_ACCEPTED ? SessionState.AWAITING_CARDS : null;
            case AWAITING_CARDS -> event == TransitionEvent.CARDS_RESOLVED ? SessionState.PROCESSING : null;
            case PROCESSING -> switch (event) {
                case PROCESSING_SUCCEEDED, PROCESSING_FAILED -> SessionState.IDLE;
                default -> null;
            };
        };
        return Optional.ofNullable(target);
    }

    public static boolean isAllowed(SessionState state, TransitionEvent event) {
        return next(state, event).isPresent();
    }
}
