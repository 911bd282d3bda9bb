package fr.lapetina.orchestrator.domain.model;

/**
 * Fleet-wide aggregate figures.
 *
 * @param healthyServiceCount services with at least one healthy instance
 * @param avgResponseTime     request-weighted mean response time in ms
 * @param errorRate           request-weighted error rate (0..1)
 */
public record SystemOverview(
        int serviceCount,
        int healthyServiceCount,
        int instanceCount,
        int healthyInstanceCount,
        long totalRequests,
        double avgResponseTime,
        double errorRate,
        ResourceUtilization resourceUtilization
) {

    /**
     * Mean usage across all instances.
     */
    public record ResourceUtilization(double cpu, double memory, double network) {
    }
}
