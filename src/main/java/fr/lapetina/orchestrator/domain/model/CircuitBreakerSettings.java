package fr.lapetina.orchestrator.domain.model;

import java.time.Duration;

/**
 * Circuit-breaker parameters.
 *
 * @param enabled          whether a breaker guards the target
 * @param failureThreshold consecutive errors that open the breaker
 * @param interval         window in which consecutive errors are counted
 * @param recoveryTimeout  time the breaker stays open before half-open probing
 * @param halfOpenRequests probe calls allowed (and successes required) while half-open
 */
public record CircuitBreakerSettings(
        boolean enabled,
        int failureThreshold,
        Duration interval,
        Duration recoveryTimeout,
        int halfOpenRequests
) {

    public CircuitBreakerSettings {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be at least 1");
        }
        if (halfOpenRequests < 1) {
            throw new IllegalArgumentException("halfOpenRequests must be at least 1");
        }
        if (interval == null) {
            interval = Duration.ofSeconds(30);
        }
        if (recoveryTimeout == null) {
            recoveryTimeout = Duration.ofSeconds(30);
        }
    }

    public static CircuitBreakerSettings defaults() {
        return new CircuitBreakerSettings(true, 5, Duration.ofSeconds(30), Duration.ofSeconds(30), 3);
    }

    public static CircuitBreakerSettings disabled() {
        return new CircuitBreakerSettings(false, 5, Duration.ofSeconds(30), Duration.ofSeconds(30), 3);
    }
}
