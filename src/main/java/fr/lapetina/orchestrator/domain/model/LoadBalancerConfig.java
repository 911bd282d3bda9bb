package fr.lapetina.orchestrator.domain.model;

import java.time.Duration;
import java.util.Objects;
import java.util.Set;

/**
 * Load-balancer configuration bound to one or more services.
 */
public record LoadBalancerConfig(
        String id,
        LoadBalancingAlgorithm algorithm,
        Set<String> targetServices,
        boolean sessionAffinity,
        Duration healthCheckInterval,
        Duration connectionTimeout,
        int retries,
        CircuitBreakerSettings circuitBreaker
) {

    public LoadBalancerConfig {
        Objects.requireNonNull(id, "id is required");
        if (algorithm == null) {
            algorithm = LoadBalancingAlgorithm.ROUND_ROBIN;
        }
        targetServices = targetServices != null ? Set.copyOf(targetServices) : Set.of();
        if (healthCheckInterval == null) {
            healthCheckInterval = Duration.ofSeconds(30);
        }
        if (connectionTimeout == null) {
            connectionTimeout = Duration.ofSeconds(5);
        }
        if (retries < 0) {
            throw new IllegalArgumentException("retries must not be negative");
        }
        if (circuitBreaker == null) {
            circuitBreaker = CircuitBreakerSettings.disabled();
        }
    }

    public static LoadBalancerConfig of(String id, LoadBalancingAlgorithm algorithm, Set<String> targetServices) {
        return new LoadBalancerConfig(id, algorithm, targetServices, false,
                null, null, 0, null);
    }

    public boolean appliesTo(String serviceId) {
        return targetServices.contains(serviceId);
    }
}
