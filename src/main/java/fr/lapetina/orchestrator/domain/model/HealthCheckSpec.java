package fr.lapetina.orchestrator.domain.model;

import java.time.Duration;

/**
 * Health-check descriptor of a service.
 *
 * @param path             probe path on the instance
 * @param interval         nominal probe interval
 * @param timeout          upper bound for a single probe
 * @param successThreshold consecutive successes needed to become healthy
 * @param failureThreshold consecutive failures needed to become unhealthy
 */
public record HealthCheckSpec(
        String path,
        Duration interval,
        Duration timeout,
        int successThreshold,
        int failureThreshold
) {

    public HealthCheckSpec {
        if (path == null || path.isBlank()) {
            path = "/health";
        }
        if (interval == null) {
            interval = Duration.ofSeconds(30);
        }
        if (timeout == null) {
            timeout = Duration.ofSeconds(5);
        }
        if (successThreshold < 1 || failureThreshold < 1) {
            throw new IllegalArgumentException("Health check thresholds must be at least 1");
        }
    }

    public static HealthCheckSpec defaults() {
        return new HealthCheckSpec("/health", Duration.ofSeconds(30), Duration.ofSeconds(5), 1, 3);
    }
}
