package com.ai.tarot.service;

import com.ai.tarot.dto.AdmissionDecision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Sliding-window admission gate per user. A user's timestamps are pruned when that user
 * asks again; users idle for a whole window are swept out at most once per window.
 */
@Service
public class RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    private final Clock clock;
    private final Map<String, Deque<Instant>> requests = new ConcurrentHashMap<>();
    private final AtomicReference<Instant> lastSweep;

    @Value("${app.rate-limit.max-requests:5}")
    private int maxRequests = 5;

    @Value("${app.rate-limit.window:60s}")
    private Duration window = Duration.ofSeconds(60);

    public RateLimiter(Clock clock) {
        this.clock = clock;
        this.lastSweep = new AtomicReference<>(clock.instant());
    }

    public AdmissionDecision tryAcquire(String userId) {
        Instant now = clock.instant();
        Instant cutoff = now.minus(window);
        sweepIdleUsers(now, cutoff);

        AdmissionDecision[] decision = new AdmissionDecision[1];
        requests.compute(userId, (key, existing) -> {
            Deque<Instant> timestamps = existing == null ? new ArrayDeque<>() : existing;
            prune(timestamps, cutoff);
            if (timestamps.size() >= maxRequests) {
                decision[0] = AdmissionDecision.reject(Duration.between(now, timestamps.peekFirst().plus(window)));
                log.info("Rate limit hit for user {} ({} requests in {})", userId, timestamps.size(), window);
                return timestamps.isEmpty() ? null : timestamps;
            }
            timestamps.addLast(now);
            decision[0] = AdmissionDecision.admit(maxRequests - timestamps.size());
            return timestamps;
        });
        return decision[0];
    }

    int trackedUsers() {
        return requests.size();
    }

    private void sweepIdleUsers(Instant now, Instant cutoff) {
        Instant previous = lastSweep.get();
        if (Duration.between(previous, now).compareTo(window) < 0 || !lastSweep.compareAndSet(previous, now)) {
            return;
        }
        for (String key : requests.keySet()) {
            requests.computeIfPresent(key, (k, timestamps) -> {
                prune(timestamps, cutoff);
                return timestamps.isEmpty() ? null : timestamps;
            });
        }
    }

    private static void prune(Deque<Instant> timestamps, Instant cutoff) {
        while (!timestamps.isEmpty() && !timestamps.peekFirst().isAfter(cutoff)) {
            timestamps.pollFirst();
        }
    }
}
