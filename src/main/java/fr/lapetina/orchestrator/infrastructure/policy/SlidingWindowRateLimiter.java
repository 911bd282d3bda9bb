package fr.lapetina.orchestrator.infrastructure.policy;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Counts admitted calls over a trailing window.
 */
final class SlidingWindowRateLimiter {

    private final int limit;
    private final Duration window;
    private final Deque<Instant> admissions = new ArrayDeque<>();

    SlidingWindowRateLimiter(int limit, Duration window) {
        this.limit = limit;
        this.window = window;
    }

    synchronized boolean hasCapacity(Instant now) {
        evictExpired(now);
        return admissions.size() < limit;
    }

    synchronized void record(Instant now) {
        evictExpired(now);
        admissions.addLast(now);
    }

    int limit() {
        return limit;
    }

    Duration window() {
        return window;
    }

    private void evictExpired(Instant now) {
        Instant threshold = now.minus(window);
        while (!admissions.isEmpty() && !admissions.peekFirst().isAfter(threshold)) {
            admissions.pollFirst();
        }
    }
}
