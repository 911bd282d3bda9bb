package fr.lapetina.orchestrator.infrastructure.metrics;

import fr.lapetina.orchestrator.domain.model.TrafficSnapshot;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Call statistics per service and per service version.
 *
 * Response time and error rate are exponentially smoothed
 * ({@code 0.9 * previous + 0.1 * sample}); counts and the arithmetic mean
 * are kept alongside for canary analysis. Throughput is measured from the
 * first call of a window, over at least one second.
 */
public final class TrafficRecorder {

    private static final double DECAY = 0.9;

    private final Clock clock;
    private final Map<String, Stats> byService = new ConcurrentHashMap<>();
    private final Map<String, Stats> byVersion = new ConcurrentHashMap<>();

    public TrafficRecorder(Clock clock) {
        this.clock = clock;
    }

    public TrafficRecorder() {
        this(Clock.systemUTC());
    }

    /**
     * Records one completed call to a service.
     */
    public void recordCall(String serviceId, boolean success, long responseTimeMs) {
        byService.computeIfAbsent(serviceId, id -> new Stats(clock.instant())).record(success, responseTimeMs);
    }

    /**
     * Records one attempt served by an instance of a given version.
     */
    public void recordAttempt(String serviceId, String version, boolean success, long responseTimeMs) {
        byVersion.computeIfAbsent(versionKey(serviceId, version), id -> new Stats(clock.instant()))
                .record(success, responseTimeMs);
    }

    public TrafficSnapshot snapshot(String serviceId) {
        Stats stats = byService.get(serviceId);
        return stats != null ? stats.snapshot(clock.instant()) : TrafficSnapshot.empty();
    }

    public TrafficSnapshot snapshot(String serviceId, String version) {
        Stats stats = byVersion.get(versionKey(serviceId, version));
        return stats != null ? stats.snapshot(clock.instant()) : TrafficSnapshot.empty();
    }

    /**
     * Clears the statistics of one version, starting a fresh observation window.
     */
    public void resetVersion(String serviceId, String version) {
        byVersion.remove(versionKey(serviceId, version));
    }

    private static String versionKey(String serviceId, String version) {
        return serviceId + "@" + version;
    }

    private static final class Stats {
        private final Instant since;
        private long requestCount;
        private long errorCount;
        private long totalResponseTimeMs;
        private double avgResponseTime;
        private double errorRate;

        Stats(Instant since) {
            this.since = since;
        }

        synchronized void record(boolean success, long responseTimeMs) {
            requestCount++;
            totalResponseTimeMs += responseTimeMs;
            if (!success) {
                errorCount++;
            }
            if (requestCount == 1) {
                avgResponseTime = responseTimeMs;
                errorRate = success ? 0.0 : 1.0;
            } else {
                avgResponseTime = avgResponseTime * DECAY + responseTimeMs * (1 - DECAY);
                errorRate = errorRate * DECAY + (success ? 0.0 : 1 - DECAY);
            }
        }

        synchronized TrafficSnapshot snapshot(Instant now) {
            double mean = requestCount == 0 ? 0.0 : (double) totalResponseTimeMs / requestCount;
            double seconds = Math.max(1.0, Duration.between(since, now).toMillis() / 1000.0);
            return new TrafficSnapshot(requestCount, errorCount, avgResponseTime, errorRate, mean,
                    requestCount / seconds);
        }
    }
}
