package fr.lapetina.orchestrator.domain.model;

import java.time.Duration;

/**
 * Canary rollout parameters.
 *
 * @param weightPercent share of calls routed to the new version during the window
 * @param window        observation window before promotion
 * @param criteria      bounds the new version must stay within during the window
 */
public record CanaryConfig(int weightPercent, Duration window, SuccessCriteria criteria) {

    public CanaryConfig {
        if (weightPercent < 1 || weightPercent > 100) {
            throw new IllegalArgumentException("Canary weight must be within [1, 100]: " + weightPercent);
        }
        if (window == null || window.isNegative()) {
            throw new IllegalArgumentException("Canary window must be a positive duration");
        }
        if (criteria == null) {
            criteria = SuccessCriteria.defaults();
        }
    }

    public static CanaryConfig defaults() {
        return new CanaryConfig(10, Duration.ofMinutes(5), SuccessCriteria.defaults());
    }

    /**
     * @param minSuccessRate    lowest acceptable share of successful calls (0..1)
     * @param maxResponseTimeMs highest acceptable mean response time
     * @param maxErrorRate      highest acceptable share of failed calls (0..1)
     */
    public record SuccessCriteria(double minSuccessRate, double maxResponseTimeMs, double maxErrorRate) {

        public static SuccessCriteria defaults() {
            return new SuccessCriteria(0.99, 1000, 0.01);
        }
    }
}
