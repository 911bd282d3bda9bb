package fr.lapetina.orchestrator.infrastructure.health;

import fr.lapetina.orchestrator.domain.exception.NotFoundException;
import fr.lapetina.orchestrator.domain.model.HealthCheckSpec;
import fr.lapetina.orchestrator.domain.model.InstanceState;
import fr.lapetina.orchestrator.domain.model.Service;
import fr.lapetina.orchestrator.domain.model.ServiceInstance;
import fr.lapetina.orchestrator.infrastructure.registry.ServiceRegistry;
import fr.lapetina.orchestrator.infrastructure.runtime.ProbeTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Background health monitor for service instances.
 *
 * Periodically probes every non-stopping instance of every registered
 * service and applies hysteresis before changing its state:
 * - HEALTHY to UNHEALTHY after {@code failureThreshold} consecutive failures
 * - UNHEALTHY or STARTING to HEALTHY after {@code successThreshold} consecutive successes
 * - STARTING to UNHEALTHY after {@code failureThreshold} consecutive failures
 *
 * Probes run concurrently, bounded by a worker limit, each under the probe
 * timeout of its service. A failing probe never affects other instances.
 * Streak counters are dropped when their instance leaves the registry.
 */
public final class HealthMonitor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HealthMonitor.class);

    private final ServiceRegistry registry;
    private final ProbeTransport probeTransport;
    private final Duration checkInterval;
    private final ScheduledExecutorService scheduler;
    private final ExecutorService probeWorkers;
    private final Semaphore probePermits;
    private final Map<String, ProbeCounters> counters = new ConcurrentHashMap<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Consumer<ServiceRegistry.RegistryEvent> removalListener = this::onRegistryEvent;

    public HealthMonitor(
            ServiceRegistry registry,
            ProbeTransport probeTransport,
            Duration checkInterval,
            int maxConcurrentProbes
    ) {
        this.registry = registry;
        this.probeTransport = probeTransport;
        this.checkInterval = checkInterval;
        this.probePermits = new Semaphore(maxConcurrentProbes);
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "health-monitor");
            t.setDaemon(true);
            return t;
        });
        AtomicInteger workerCount = new AtomicInteger();
        this.probeWorkers = Executors.newFixedThreadPool(maxConcurrentProbes, r -> {
            Thread t = new Thread(r, "health-probe-" + workerCount.getAndIncrement());
            t.setDaemon(true);
            return t;
        });
        registry.addListener(removalListener);
    }

    public HealthMonitor(ServiceRegistry registry, ProbeTransport probeTransport) {
        this(registry, probeTransport, Duration.ofSeconds(30), 16);
    }

    /**
     * Starts the periodic health checking.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            scheduler.scheduleWithFixedDelay(
                    this::runScheduledCycle,
                    0,
                    checkInterval.toMillis(),
                    TimeUnit.MILLISECONDS
            );
            log.info("Health monitor started with interval: {}", checkInterval);
        }
    }

    private void runScheduledCycle() {
        try {
            // Wait so cycles never overlap
            runCycle().join();
        } catch (Exception e) {
            log.error("Health check cycle failed", e);
        }
    }

    /**
     * Probes every instance of every service once.
     *
     * @return future completing when all probes of the cycle have been applied
     */
    public CompletableFuture<Void> runCycle() {
        List<CompletableFuture<InstanceState>> probes = new ArrayList<>();
        List<Service> services = registry.listServices();

        for (Service service : services) {
            List<ServiceInstance> instances;
            try {
                instances = registry.listInstances(service.getId());
            } catch (NotFoundException e) {
                continue;
            }
            for (ServiceInstance instance : instances) {
                if (instance.getState() != InstanceState.STOPPING) {
                    probes.add(checkInstance(service, instance));
                }
            }
        }

        log.debug("Health check cycle started: serviceCount={}, probeCount={}", services.size(), probes.size());
        return CompletableFuture.allOf(probes.toArray(new CompletableFuture[0]));
    }

    /**
     * Probes one instance and applies the result.
     *
     * @return future completing with the instance state after the probe
     */
    public CompletableFuture<InstanceState> checkInstance(Service service, ServiceInstance instance) {
        HealthCheckSpec spec = service.getHealthCheck();

        return CompletableFuture
                .supplyAsync(() -> issueProbe(instance, spec), probeWorkers)
                .thenCompose(probe -> probe)
                .handle((healthy, ex) -> {
                    if (ex != null) {
                        log.warn("Health probe failed: serviceId={}, instanceId={}, error={}",
                                service.getId(), instance.getId(), rootMessage(ex));
                        return applyResult(spec, instance, false);
                    }
                    if (!Boolean.TRUE.equals(healthy)) {
                        log.warn("Health probe returned unhealthy: serviceId={}, instanceId={}",
                                service.getId(), instance.getId());
                    }
                    return applyResult(spec, instance, Boolean.TRUE.equals(healthy));
                });
    }

    private CompletableFuture<Boolean> issueProbe(ServiceInstance instance, HealthCheckSpec spec) {
        probePermits.acquireUninterruptibly();
        CompletableFuture<Boolean> probe;
        try {
            probe = probeTransport.probe(instance, spec);
        } catch (Exception e) {
            probe = CompletableFuture.failedFuture(e);
        }
        return probe
                .orTimeout(spec.timeout().toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((result, ex) -> probePermits.release());
    }

    private InstanceState applyResult(HealthCheckSpec spec, ServiceInstance probed, boolean healthy) {
        ProbeCounters counter = counters.computeIfAbsent(probed.getId(), id -> new ProbeCounters());

        try {
            InstanceState next = registry.updateInstanceHealth(probed.getId(), current ->
                    current == InstanceState.STOPPING
                            ? InstanceState.STOPPING
                            : counter.record(healthy, current, spec.successThreshold(), spec.failureThreshold()));
            if (next == InstanceState.STOPPING) {
                counters.remove(probed.getId());
            }
            return next;
        } catch (NotFoundException e) {
            log.debug("Probed instance no longer registered: instanceId={}", probed.getId());
            counters.remove(probed.getId());
            return InstanceState.STOPPING;
        }
    }

    private void onRegistryEvent(ServiceRegistry.RegistryEvent event) {
        if (event.type() == ServiceRegistry.RegistryEvent.Type.INSTANCE_REMOVED && event.instance() != null) {
            if (counters.remove(event.instance().getId()) != null) {
                log.debug("Dropped probe counters: instanceId={}", event.instance().getId());
            }
        }
    }

    int trackedInstanceCount() {
        return counters.size();
    }

    private static String rootMessage(Throwable ex) {
        Throwable cause = ex;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    @Override
    public void close() {
        running.set(false);
        registry.removeListener(removalListener);
        scheduler.shutdown();
        probeWorkers.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
            if (!probeWorkers.awaitTermination(5, TimeUnit.SECONDS)) {
                probeWorkers.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            probeWorkers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Health monitor stopped");
    }

    /**
     * Consecutive probe outcomes of one instance.
     */
    static final class ProbeCounters {
        private int consecutiveSuccesses;
        private int consecutiveFailures;

        synchronized InstanceState record(boolean healthy, InstanceState current,
                                          int successThreshold, int failureThreshold) {
            if (healthy) {
                consecutiveSuccesses++;
                consecutiveFailures = 0;
                if (current != InstanceState.HEALTHY && consecutiveSuccesses >= successThreshold) {
                    return InstanceState.HEALTHY;
                }
            } else {
                consecutiveFailures++;
                consecutiveSuccesses = 0;
                if (current != InstanceState.UNHEALTHY && consecutiveFailures >= failureThreshold) {
                    return InstanceState.UNHEALTHY;
                }
            }
            return current;
        }
    }
}
