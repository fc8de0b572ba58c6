package com.ai.tarot.dto;

import lombok.Getter;
import lombok.ToString;

import java.time.Duration;

/**
 * Answer of the admission gate for one request. {@code retryAfter} is zero when admitted.
 */
@Getter
@ToString
public final class AdmissionDecision {

    private final boolean admitted;
    private final int remaining;
    private final Duration retryAfter;

    private AdmissionDecision(boolean admitted, int remaining, Duration retryAfter) {
        this.admitted = admitted;
        this.remaining = remaining;
        this.retryAfter = retryAfter;
    }

    public static AdmissionDecision admit(int remaining) {
        return new AdmissionDecision(true, remaining, Duration.ZERO);
    }

    public static AdmissionDecision reject(Duration retryAfter) {
        return new AdmissionDecision(false, 0, retryAfter);
    }

    /** Whole seconds until a slot frees, rounded up, at least one. */
    public long getRetryAfterSeconds() {
        long seconds = retryAfter.getSeconds() + (retryAfter.getNano() > 0 ? 1 : 0);
        return Math.max(1, seconds);
    }
}
