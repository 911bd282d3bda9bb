package fr.lapetina.orchestrator.domain.model;

/**
 * Instance selection algorithms a load-balancer configuration can name.
 */
public enum LoadBalancingAlgorithm {
    ROUND_ROBIN("round_robin"),
    LEAST_CONNECTIONS("least_connections"),
    WEIGHTED_ROUND_ROBIN("weighted_round_robin");

    private final String wireName;

    LoadBalancingAlgorithm(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Parses an algorithm name, accepting both {@code round_robin} and {@code round-robin}.
     */
    public static LoadBalancingAlgorithm fromWireName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Algorithm name is required");
        }
        String normalized = name.trim().toLowerCase().replace('-', '_');
        for (LoadBalancingAlgorithm algorithm : values()) {
            if (algorithm.wireName.equals(normalized)) {
                return algorithm;
            }
        }
        throw new IllegalArgumentException("Unknown load balancing algorithm: " + name);
    }
}
