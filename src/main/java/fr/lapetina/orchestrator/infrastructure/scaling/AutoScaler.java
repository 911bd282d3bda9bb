package fr.lapetina.orchestrator.infrastructure.scaling;

import fr.lapetina.orchestrator.domain.exception.NotFoundException;
import fr.lapetina.orchestrator.domain.model.AutoScalingPolicy;
import fr.lapetina.orchestrator.domain.model.InstanceState;
import fr.lapetina.orchestrator.domain.model.Service;
import fr.lapetina.orchestrator.domain.model.ServiceInstance;
import fr.lapetina.orchestrator.infrastructure.balancer.LoadBalancer;
import fr.lapetina.orchestrator.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.orchestrator.infrastructure.registry.ServiceRegistry;
import fr.lapetina.orchestrator.infrastructure.runtime.InstanceProvisioner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Closed-loop auto-scaler, one control loop per service.
 *
 * Each tick averages CPU% and memory% (usage over the memory limit) across
 * the non-stopping instances of the service, then:
 * - adds exactly one STARTING instance when either average exceeds the
 *   scale-up threshold and the count is below the maximum
 * - otherwise removes the instance with the lowest uptime when both averages
 *   are below the scale-down threshold and the count is above the minimum
 *
 * Ticks skip services held by a deployment and services whose previous
 * scaling action has not finished. Registry writes go through the guarded
 * registry operations, so a deployment that starts mid-tick wins.
 *
 * An instance whose termination failed stays registered as STOPPING; the
 * next ticks retry its termination before evaluating utilization again.
 */
public final class AutoScaler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AutoScaler.class);

    private final ServiceRegistry registry;
    private final LoadBalancer loadBalancer;
    private final InstanceProvisioner provisioner;
    private final MetricsRegistry metricsRegistry;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;

    private final Map<String, ScalingLoop> loops = new ConcurrentHashMap<>();

    public AutoScaler(
            ServiceRegistry registry,
            LoadBalancer loadBalancer,
            InstanceProvisioner provisioner,
            MetricsRegistry metricsRegistry,
            Clock clock
    ) {
        this.registry = registry;
        this.loadBalancer = loadBalancer;
        this.provisioner = provisioner;
        this.metricsRegistry = metricsRegistry;
        this.clock = clock;
        AtomicInteger threadCount = new AtomicInteger();
        this.scheduler = Executors.newScheduledThreadPool(2, r -> {
            Thread t = new Thread(r, "auto-scaler-" + threadCount.getAndIncrement());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Starts (or replaces) the control loop of a service.
     *
     * @return false if the service is unknown
     */
    public boolean enable(String serviceId, AutoScalingPolicy policy) {
        if (!registry.contains(serviceId)) {
            log.warn("Auto-scaling not enabled, unknown service: serviceId={}", serviceId);
            return false;
        }

        ScalingLoop loop = new ScalingLoop(policy);
        ScalingLoop previous = loops.put(serviceId, loop);
        if (previous != null) {
            loop.pendingTerminations.addAll(previous.pendingTerminations);
            previous.cancel();
        }
        long intervalMs = policy.checkInterval().toMillis();
        loop.future = scheduler.scheduleWithFixedDelay(
                () -> runScheduledTick(serviceId), intervalMs, intervalMs, TimeUnit.MILLISECONDS);

        log.info("Auto-scaling enabled: serviceId={}, min={}, max={}, scaleUp={}, scaleDown={}, interval={}",
                serviceId, policy.minInstances(), policy.maxInstances(),
                policy.scaleUpThreshold(), policy.scaleDownThreshold(), policy.checkInterval());
        return true;
    }

    /**
     * Stops the control loop of a service.
     *
     * @return false if auto-scaling was not enabled for it
     */
    public boolean disable(String serviceId) {
        ScalingLoop loop = loops.remove(serviceId);
        if (loop == null) {
            return false;
        }
        loop.cancel();
        log.info("Auto-scaling disabled: serviceId={}", serviceId);
        return true;
    }

    public Optional<AutoScalingPolicy> policyFor(String serviceId) {
        return Optional.ofNullable(loops.get(serviceId)).map(loop -> loop.policy);
    }

    private void runScheduledTick(String serviceId) {
        try {
            tick(serviceId).join();
        } catch (Exception e) {
            log.error("Auto-scaling tick failed: serviceId={}", serviceId, e);
        }
    }

    /**
     * Runs one evaluation for a service.
     *
     * @return future completing with the decision once any scaling action finished
     */
    public CompletableFuture<ScalingDecision> tick(String serviceId) {
        ScalingLoop loop = loops.get(serviceId);
        if (loop == null) {
            return CompletableFuture.completedFuture(ScalingDecision.NO_CHANGE);
        }
        if (registry.isDeploymentInProgress(serviceId)) {
            log.debug("Auto-scaling skipped, deployment in progress: serviceId={}", serviceId);
            return CompletableFuture.completedFuture(ScalingDecision.SKIPPED);
        }
        if (!loop.busy.compareAndSet(false, true)) {
            log.debug("Auto-scaling skipped, previous action still running: serviceId={}", serviceId);
            return CompletableFuture.completedFuture(ScalingDecision.SKIPPED);
        }

        CompletableFuture<ScalingDecision> action;
        try {
            action = loop.pendingTerminations.isEmpty()
                    ? evaluate(serviceId, loop)
                    : retryTerminations(serviceId, loop);
        } catch (NotFoundException e) {
            log.warn("Auto-scaling target disappeared: serviceId={}", serviceId);
            action = CompletableFuture.completedFuture(ScalingDecision.NO_CHANGE);
        } catch (RuntimeException e) {
            loop.busy.set(false);
            throw e;
        }
        return action.whenComplete((decision, ex) -> loop.busy.set(false));
    }

    private CompletableFuture<ScalingDecision> evaluate(String serviceId, ScalingLoop loop) {
        AutoScalingPolicy policy = loop.policy;
        Service service = registry.getService(serviceId);
        List<ServiceInstance> instances = registry.listInstances(serviceId).stream()
                .filter(instance -> instance.getState() != InstanceState.STOPPING)
                .toList();
        int count = instances.size();

        double avgCpu = instances.stream().mapToDouble(ServiceInstance::getCpuPercent).average().orElse(0);
        double avgMemory = instances.stream()
                .mapToDouble(instance -> service.getResources().memoryPercent(instance.getMemoryMb()))
                .average()
                .orElse(0);

        log.debug("Auto-scaling evaluation: serviceId={}, instances={}, avgCpu={}, avgMemory={}",
                serviceId, count, avgCpu, avgMemory);

        boolean overloaded = avgCpu > policy.scaleUpThreshold().cpuPercent()
                || avgMemory > policy.scaleUpThreshold().memoryPercent();
        boolean underloaded = avgCpu < policy.scaleDownThreshold().cpuPercent()
                && avgMemory < policy.scaleDownThreshold().memoryPercent();

        if (count < policy.minInstances() || (overloaded && count < policy.maxInstances())) {
            return scaleUp(service, count, avgCpu, avgMemory);
        }
        if (!overloaded && underloaded && count > policy.minInstances()) {
            return scaleDown(service, instances, avgCpu, avgMemory, loop);
        }
        return CompletableFuture.completedFuture(ScalingDecision.NO_CHANGE);
    }

    private CompletableFuture<ScalingDecision> scaleUp(Service service, int count, double avgCpu, double avgMemory) {
        String serviceId = service.getId();
        String version = loadBalancer.activeVersion(serviceId).orElse(service.getVersion());
        log.info("Scaling up: serviceId={}, instances={} -> {}, avgCpu={}, avgMemory={}",
                serviceId, count, count + 1, avgCpu, avgMemory);

        CompletableFuture<ServiceInstance> provisioning;
        try {
            provisioning = provisioner.provisionInstance(service, version);
        } catch (Exception e) {
            provisioning = CompletableFuture.failedFuture(e);
        }

        return provisioning.handle((created, ex) -> {
            if (ex != null) {
                log.warn("Scale-up provisioning failed: serviceId={}, error={}", serviceId, ex.getMessage());
                metricsRegistry.incrementScalingEvent(serviceId, "failed");
                return ScalingDecision.FAILED;
            }

            ServiceInstance starting = created.toBuilder()
                    .serviceId(serviceId)
                    .state(InstanceState.STARTING)
                    .startedAt(clock.instant())
                    .build();

            try {
                if (!registry.addInstanceUnlessDeploying(serviceId, starting)) {
                    // A rollout took the service while provisioning; do not touch its instance list
                    log.info("Scale-up abandoned, deployment started meanwhile: serviceId={}, instanceId={}",
                            serviceId, starting.getId());
                    terminateQuietly(serviceId, starting);
                    return ScalingDecision.SKIPPED;
                }
            } catch (RuntimeException e) {
                log.warn("Scale-up registration failed: serviceId={}, instanceId={}, error={}",
                        serviceId, starting.getId(), e.getMessage());
                terminateQuietly(serviceId, starting);
                metricsRegistry.incrementScalingEvent(serviceId, "failed");
                return ScalingDecision.FAILED;
            }
            metricsRegistry.incrementScalingEvent(serviceId, "up");
            return ScalingDecision.SCALED_UP;
        });
    }

    private CompletableFuture<ScalingDecision> scaleDown(Service service, List<ServiceInstance> instances,
                                                         double avgCpu, double avgMemory, ScalingLoop loop) {
        String serviceId = service.getId();
        Instant now = clock.instant();
        ServiceInstance victim = instances.stream()
                .min(Comparator.comparing((ServiceInstance instance) -> instance.uptime(now))
                        .thenComparing(ServiceInstance::getId))
                .orElseThrow();

        if (!registry.stopInstanceUnlessDeploying(victim.getId())) {
            log.info("Scale-down abandoned, deployment started meanwhile: serviceId={}, instanceId={}",
                    serviceId, victim.getId());
            return CompletableFuture.completedFuture(ScalingDecision.SKIPPED);
        }
        log.info("Scaling down: serviceId={}, instances={} -> {}, removing={}, uptime={}, avgCpu={}, avgMemory={}",
                serviceId, instances.size(), instances.size() - 1, victim.getId(), victim.uptime(now),
                avgCpu, avgMemory);

        return terminate(serviceId, victim, loop);
    }

    private CompletableFuture<ScalingDecision> retryTerminations(String serviceId, ScalingLoop loop) {
        List<CompletableFuture<ScalingDecision>> retries = List.copyOf(loop.pendingTerminations).stream()
                .map(instanceId -> registry.findInstance(instanceId)
                        .map(instance -> {
                            log.info("Retrying termination: serviceId={}, instanceId={}", serviceId, instanceId);
                            return terminate(serviceId, instance, loop);
                        })
                        .orElseGet(() -> {
                            loop.pendingTerminations.remove(instanceId);
                            return CompletableFuture.completedFuture(ScalingDecision.SCALED_DOWN);
                        }))
                .toList();

        return CompletableFuture.allOf(retries.toArray(new CompletableFuture[0]))
                .thenApply(ignored -> retries.stream().allMatch(r -> r.join() == ScalingDecision.SCALED_DOWN)
                        ? ScalingDecision.SCALED_DOWN
                        : ScalingDecision.FAILED);
    }

    /**
     * Terminates a STOPPING instance and removes it from the registry. On
     * failure the instance stays registered and is queued for another attempt.
     */
    private CompletableFuture<ScalingDecision> terminate(String serviceId, ServiceInstance victim, ScalingLoop loop) {
        CompletableFuture<Void> termination;
        try {
            termination = provisioner.terminateInstance(victim);
        } catch (Exception e) {
            termination = CompletableFuture.failedFuture(e);
        }

        return termination.handle((ignored, ex) -> {
            if (ex != null) {
                loop.pendingTerminations.add(victim.getId());
                log.warn("Scale-down termination failed, will retry: serviceId={}, instanceId={}, error={}",
                        serviceId, victim.getId(), ex.getMessage());
                metricsRegistry.incrementScalingEvent(serviceId, "failed");
                return ScalingDecision.FAILED;
            }
            loop.pendingTerminations.remove(victim.getId());
            try {
                registry.removeInstance(serviceId, victim.getId());
            } catch (NotFoundException e) {
                log.debug("Scaled-down instance already removed: instanceId={}", victim.getId());
            }
            metricsRegistry.incrementScalingEvent(serviceId, "down");
            return ScalingDecision.SCALED_DOWN;
        });
    }

    private void terminateQuietly(String serviceId, ServiceInstance instance) {
        CompletableFuture<Void> termination;
        try {
            termination = provisioner.terminateInstance(instance);
        } catch (Exception e) {
            termination = CompletableFuture.failedFuture(e);
        }
        termination.whenComplete((ignored, ex) -> {
            if (ex != null) {
                log.warn("Termination of unregistered instance failed: serviceId={}, instanceId={}, error={}",
                        serviceId, instance.getId(), ex.getMessage());
            }
        });
    }

    @Override
    public void close() {
        loops.values().forEach(ScalingLoop::cancel);
        loops.clear();
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Auto-scaler stopped");
    }

    private static final class ScalingLoop {
        private final AutoScalingPolicy policy;
        private final AtomicBoolean busy = new AtomicBoolean(false);
        private final Set<String> pendingTerminations = ConcurrentHashMap.newKeySet();
        private volatile ScheduledFuture<?> future;

        ScalingLoop(AutoScalingPolicy policy) {
            this.policy = policy;
        }

        void cancel() {
            if (future != null) {
                future.cancel(false);
            }
        }
    }
}
