package fr.lapetina.orchestrator.domain.model;

/**
 * Call statistics of a service (or of one version of a service).
 *
 * @param requestCount     calls recorded
 * @param errorCount       failed calls recorded
 * @param avgResponseTime  smoothed response time in ms
 * @param errorRate        smoothed error rate (0..1)
 * @param meanResponseTime arithmetic mean response time in ms
 * @param throughput       calls per second since the first recorded call
 */
public record TrafficSnapshot(
        long requestCount,
        long errorCount,
        double avgResponseTime,
        double errorRate,
        double meanResponseTime,
        double throughput
) {

    public static TrafficSnapshot empty() {
        return new TrafficSnapshot(0, 0, 0, 0, 0, 0);
    }

    /**
     * Share of successful calls, 1 when nothing was recorded.
     */
    public double successRate() {
        if (requestCount == 0) {
            return 1.0;
        }
        return (double) (requestCount - errorCount) / requestCount;
    }

    /**
     * Share of failed calls, 0 when nothing was recorded.
     */
    public double observedErrorRate() {
        if (requestCount == 0) {
            return 0.0;
        }
        return (double) errorCount / requestCount;
    }
}
