package fr.lapetina.orchestrator.domain.strategy;

import fr.lapetina.orchestrator.domain.model.LoadBalancingAlgorithm;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Factory for load balancing strategies.
 *
 * Each load-balancer configuration gets its own strategy instance, so
 * cursor state is never shared between configurations.
 */
public final class StrategyFactory {

    private static final Map<String, Supplier<LoadBalancingStrategy>> REGISTRY = new ConcurrentHashMap<>();

    static {
        register(LoadBalancingAlgorithm.ROUND_ROBIN.wireName(), RoundRobinStrategy::new);
        register(LoadBalancingAlgorithm.LEAST_CONNECTIONS.wireName(), LeastConnectionsStrategy::new);
        register(LoadBalancingAlgorithm.WEIGHTED_ROUND_ROBIN.wireName(), WeightedRoundRobinStrategy::new);
    }

    private StrategyFactory() {
        // Utility class
    }

    /**
     * Registers a strategy under a name, replacing any previous registration.
     */
    public static void register(String name, Supplier<LoadBalancingStrategy> supplier) {
        REGISTRY.put(name.toLowerCase(), supplier);
    }

    public static Optional<LoadBalancingStrategy> create(String name) {
        Supplier<LoadBalancingStrategy> supplier = REGISTRY.get(name.toLowerCase().replace('-', '_'));
        if (supplier == null) {
            return Optional.empty();
        }
        return Optional.of(supplier.get());
    }

    public static LoadBalancingStrategy create(LoadBalancingAlgorithm algorithm) {
        return create(algorithm.wireName())
                .orElseThrow(() -> new IllegalStateException("No strategy registered for " + algorithm));
    }
}
