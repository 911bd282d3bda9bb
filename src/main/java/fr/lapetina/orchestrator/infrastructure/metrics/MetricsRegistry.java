package fr.lapetina.orchestrator.infrastructure.metrics;

import fr.lapetina.orchestrator.domain.model.CallResult;
import fr.lapetina.orchestrator.domain.model.DeploymentStatus;
import fr.lapetina.orchestrator.domain.model.ErrorType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Centralized metrics registry using Micrometer.
 *
 * Provides:
 * - Call counters and latency timers per source/target
 * - Error counters by type and policy denial counters
 * - Scaling and deployment event counters
 * - Per-service instance gauges
 * - JVM and system metrics
 * - Prometheus exposition
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    // Cache for dynamic meters
    private final ConcurrentHashMap<String, Counter> callCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> latencyTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> errorCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> denialCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> scalingCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> deploymentCounters = new ConcurrentHashMap<>();
    private final Set<String> gaugedServices = ConcurrentHashMap.newKeySet();

    private final AtomicInteger ringBufferRemaining = new AtomicInteger(0);

    public MetricsRegistry(String prefix) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        // Register JVM metrics
        new JvmMemoryMetrics().bindTo(registry);
        new JvmGcMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);

        Gauge.builder(prefix + "_ringbuffer_remaining", ringBufferRemaining, AtomicInteger::get)
                .description("Remaining capacity in the call ring buffer")
                .register(registry);

        log.info("MetricsRegistry initialized with prefix: {}", prefix);
    }

    public MetricsRegistry() {
        this("orchestrator");
    }

    /**
     * Records a finished call: outcome counter, latency, and error counter on failure.
     */
    public void recordCall(String source, String target, CallResult result) {
        String outcome = result.success() ? "success" : "failure";
        String key = source + ":" + target + ":" + outcome;
        callCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_calls_total")
                        .description("Total number of inter-service calls")
                        .tag("source", source)
                        .tag("target", target)
                        .tag("outcome", outcome)
                        .register(registry)
        ).increment();

        latencyTimers.computeIfAbsent(target, k ->
                Timer.builder(prefix + "_call_latency")
                        .description("Inter-service call latency")
                        .tag("target", target)
                        .publishPercentiles(0.5, 0.9, 0.95, 0.99)
                        .register(registry)
        ).record(Duration.ofMillis(result.responseTimeMs()));

        if (!result.success()) {
            incrementErrorCount(target, result.errorType());
        }
    }

    public void incrementErrorCount(String target, ErrorType errorType) {
        String key = target + ":" + errorType.name();
        errorCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_errors_total")
                        .description("Total number of call errors")
                        .tag("target", target)
                        .tag("type", errorType.reason())
                        .register(registry)
        ).increment();
    }

    public void incrementPolicyDenial(String target, ErrorType reason) {
        String key = target + ":" + reason.name();
        denialCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_policy_denials_total")
                        .description("Calls denied by the policy engine")
                        .tag("target", target)
                        .tag("reason", reason.reason())
                        .register(registry)
        ).increment();
    }

    /**
     * Counts a scaling event; direction is {@code up}, {@code down} or {@code failed}.
     */
    public void incrementScalingEvent(String serviceId, String direction) {
        String key = serviceId + ":" + direction;
        scalingCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_scaling_events_total")
                        .description("Auto-scaling actions")
                        .tag("service", serviceId)
                        .tag("direction", direction)
                        .register(registry)
        ).increment();
    }

    public void incrementDeployment(String serviceId, DeploymentStatus status) {
        String key = serviceId + ":" + status.name();
        deploymentCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_deployments_total")
                        .description("Deployments by final status")
                        .tag("service", serviceId)
                        .tag("status", status.wireName())
                        .register(registry)
        ).increment();
    }

    /**
     * Registers instance gauges for a service, once.
     */
    public void registerServiceGauges(String serviceId, Supplier<Number> instances, Supplier<Number> healthyInstances) {
        if (!gaugedServices.add(serviceId)) {
            return;
        }
        Gauge.builder(prefix + "_service_instances", instances, s -> s.get().doubleValue())
                .description("Instances per service")
                .tag("service", serviceId)
                .register(registry);
        Gauge.builder(prefix + "_service_healthy_instances", healthyInstances, s -> s.get().doubleValue())
                .description("Healthy instances per service")
                .tag("service", serviceId)
                .register(registry);
    }

    /**
     * Updates the ring buffer remaining capacity.
     */
    public void setRingBufferRemaining(int value) {
        ringBufferRemaining.set(value);
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        registry.close();
    }
}
