package fr.lapetina.orchestrator.infrastructure.metrics;

import fr.lapetina.orchestrator.domain.exception.NotFoundException;
import fr.lapetina.orchestrator.domain.model.InstanceUsage;
import fr.lapetina.orchestrator.domain.model.Service;
import fr.lapetina.orchestrator.domain.model.ServiceInstance;
import fr.lapetina.orchestrator.infrastructure.registry.ServiceRegistry;
import fr.lapetina.orchestrator.infrastructure.runtime.MetricsSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Background loop copying instance usage from the metrics source into the registry.
 */
public final class UsageCollector implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(UsageCollector.class);

    private final ServiceRegistry registry;
    private final MetricsSource metricsSource;
    private final Duration interval;
    private final ScheduledExecutorService scheduler;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public UsageCollector(ServiceRegistry registry, MetricsSource metricsSource, Duration interval) {
        this.registry = registry;
        this.metricsSource = metricsSource;
        this.interval = interval;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "usage-collector");
            t.setDaemon(true);
            return t;
        });
    }

    public void start() {
        if (running.compareAndSet(false, true)) {
            scheduler.scheduleWithFixedDelay(this::collectSafely, 0, interval.toMillis(), TimeUnit.MILLISECONDS);
            log.info("Usage collector started with interval: {}", interval);
        }
    }

    private void collectSafely() {
        try {
            collect();
        } catch (Exception e) {
            log.error("Usage collection cycle failed", e);
        }
    }

    /**
     * Refreshes the usage of every instance once.
     *
     * @return number of instances updated
     */
    public int collect() {
        int updated = 0;
        for (Service service : registry.listServices()) {
            for (ServiceInstance instance : registry.listInstances(service.getId())) {
                Optional<InstanceUsage> usage;
                try {
                    usage = metricsSource.sample(instance);
                } catch (Exception e) {
                    log.warn("Metrics sample failed: serviceId={}, instanceId={}, error={}",
                            service.getId(), instance.getId(), e.getMessage());
                    continue;
                }
                if (usage.isEmpty()) {
                    continue;
                }
                try {
                    registry.updateInstanceUsage(instance.getId(), usage.get());
                    updated++;
                } catch (NotFoundException e) {
                    log.debug("Instance removed before usage update: instanceId={}", instance.getId());
                }
            }
        }
        return updated;
    }

    @Override
    public void close() {
        running.set(false);
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Usage collector stopped");
    }
}
