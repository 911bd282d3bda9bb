package fr.lapetina.orchestrator.infrastructure.balancer;

import fr.lapetina.orchestrator.domain.exception.NoHealthyInstanceException;
import fr.lapetina.orchestrator.domain.model.LoadBalancerConfig;
import fr.lapetina.orchestrator.domain.model.Service;
import fr.lapetina.orchestrator.domain.model.ServiceInstance;
import fr.lapetina.orchestrator.domain.strategy.LoadBalancingStrategy;
import fr.lapetina.orchestrator.domain.strategy.RoundRobinStrategy;
import fr.lapetina.orchestrator.domain.strategy.SelectionContext;
import fr.lapetina.orchestrator.domain.strategy.StrategyFactory;
import fr.lapetina.orchestrator.infrastructure.registry.ServiceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Selects one routable instance per call.
 *
 * Responsibilities:
 * - Holds the load-balancer configurations and one strategy per configuration
 * - Holds the version routing of each service (active version, canary split);
 *   services without routing entry route every healthy instance
 * - Session affinity for configurations that request it
 * - Tracks calls in flight per instance for least-connections selection
 */
public final class LoadBalancer {

    private static final Logger log = LoggerFactory.getLogger(LoadBalancer.class);

    private final ServiceRegistry registry;
    private final Random canaryRandom;

    private final Map<String, LoadBalancerConfig> configs = new ConcurrentHashMap<>();
    private final Map<String, LoadBalancingStrategy> strategies = new ConcurrentHashMap<>();
    private final LoadBalancingStrategy defaultStrategy = new RoundRobinStrategy();
    private final Map<String, RoutingTable> routes = new ConcurrentHashMap<>();
    private final Map<String, String> affinity = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> activeCalls = new ConcurrentHashMap<>();

    public LoadBalancer(ServiceRegistry registry, Random canaryRandom) {
        this.registry = registry;
        this.canaryRandom = canaryRandom;
    }

    public LoadBalancer(ServiceRegistry registry) {
        this(registry, new Random());
    }

    // ==================== CONFIGURATION ====================

    /**
     * Binds a configuration, replacing any configuration with the same id.
     */
    public void bind(LoadBalancerConfig config) {
        LoadBalancerConfig previous = configs.put(config.id(), config);
        if (previous == null || previous.algorithm() != config.algorithm()) {
            strategies.put(config.id(), StrategyFactory.create(config.algorithm()));
        }
        log.info("Load balancer bound: id={}, algorithm={}, services={}, sessionAffinity={}",
                config.id(), config.algorithm().wireName(), config.targetServices(), config.sessionAffinity());
    }

    /**
     * Replaces all configurations with a new set.
     * Used for configuration reload.
     */
    public void replaceConfigs(Collection<LoadBalancerConfig> newConfigs) {
        Map<String, LoadBalancerConfig> incoming = new ConcurrentHashMap<>();
        newConfigs.forEach(config -> incoming.put(config.id(), config));

        for (String existingId : List.copyOf(configs.keySet())) {
            if (!incoming.containsKey(existingId)) {
                configs.remove(existingId);
                strategies.remove(existingId);
                log.info("Load balancer unbound: id={}", existingId);
            }
        }
        incoming.values().forEach(this::bind);
    }

    public List<LoadBalancerConfig> getConfigs() {
        return configs.values().stream()
                .sorted(Comparator.comparing(LoadBalancerConfig::id))
                .toList();
    }

    /**
     * Returns the configuration bound to a service. When several bind the
     * same service, the one with the lowest id wins.
     */
    public Optional<LoadBalancerConfig> configFor(String serviceId) {
        return configs.values().stream()
                .filter(config -> config.appliesTo(serviceId))
                .min(Comparator.comparing(LoadBalancerConfig::id));
    }

    // ==================== SELECTION ====================

    /**
     * Selects an instance of a service.
     *
     * @throws fr.lapetina.orchestrator.domain.exception.NotFoundException if the service is unknown
     * @throws NoHealthyInstanceException if no routable instance is healthy
     */
    public ServiceInstance selectInstance(String serviceId) {
        return selectInstance(serviceId, null);
    }

    /**
     * Selects an instance of a service for a caller, honouring session affinity.
     */
    public ServiceInstance selectInstance(String serviceId, String callerId) {
        List<ServiceInstance> healthy = registry.listHealthyInstances(serviceId);
        RoutingTable route = routes.get(serviceId);

        List<ServiceInstance> pool;
        String routingKey = serviceId;
        if (route == null) {
            pool = healthy;
        } else {
            List<ServiceInstance> stable = withVersion(healthy, route.activeVersion());
            List<ServiceInstance> canary = route.hasCanary() ? withVersion(healthy, route.canaryVersion()) : List.of();
            if (!canary.isEmpty() && (stable.isEmpty() || drawCanary(route.canaryWeight()))) {
                pool = canary;
                routingKey = serviceId + "#canary";
            } else {
                pool = stable;
            }
        }

        if (pool.isEmpty()) {
            log.debug("No routable instance: serviceId={}, healthy={}, route={}", serviceId, healthy.size(), route);
            throw new NoHealthyInstanceException(serviceId);
        }

        Optional<LoadBalancerConfig> config = configFor(serviceId);
        boolean sticky = callerId != null && config.map(LoadBalancerConfig::sessionAffinity).orElse(false);
        String affinityKey = serviceId + "|" + callerId;
        if (sticky) {
            String pinnedId = affinity.get(affinityKey);
            Optional<ServiceInstance> pinned = pool.stream()
                    .filter(instance -> instance.getId().equals(pinnedId))
                    .findFirst();
            if (pinned.isPresent()) {
                return pinned.get();
            }
        }

        LoadBalancingStrategy strategy = config.map(c -> strategies.get(c.id())).orElse(defaultStrategy);
        if (strategy == null) {
            strategy = defaultStrategy;
        }
        ServiceInstance selected = strategy
                .selectInstance(pool, new SelectionContext(routingKey, this::activeCalls))
                .orElseThrow(() -> new NoHealthyInstanceException(serviceId));

        if (sticky) {
            affinity.put(affinityKey, selected.getId());
        }
        log.debug("Instance selected: serviceId={}, instanceId={}, strategy={}",
                serviceId, selected.getId(), strategy.getName());
        return selected;
    }

    /**
     * Returns the healthy instances currently eligible for traffic.
     */
    public List<ServiceInstance> routableInstances(String serviceId) {
        List<ServiceInstance> healthy = registry.listHealthyInstances(serviceId);
        RoutingTable route = routes.get(serviceId);
        if (route == null) {
            return healthy;
        }
        return healthy.stream()
                .filter(instance -> route.isRoutable(instance.getVersion()))
                .toList();
    }

    // ==================== VERSION ROUTING ====================

    /**
     * Restricts regular traffic of a service to one version and drops any canary.
     * A null version makes the service unroutable until a version is promoted.
     */
    public void pinVersion(String serviceId, String version) {
        RoutingTable previous = routes.put(serviceId, RoutingTable.pinned(version));
        log.info("Routing updated: serviceId={}, activeVersion={}, previous={}", serviceId, version, previous);
    }

    /**
     * Sends a share of the traffic of a service to a canary version.
     */
    public void startCanary(String serviceId, String version, int weightPercent) {
        RoutingTable route = routes.compute(serviceId, (id, current) -> {
            RoutingTable base = current != null
                    ? current
                    : RoutingTable.pinned(registry.getService(serviceId).getVersion());
            return base.withCanary(version, weightPercent);
        });
        log.info("Canary routing started: serviceId={}, canaryVersion={}, weight={}%, activeVersion={}",
                serviceId, version, weightPercent, route.activeVersion());
    }

    /**
     * Removes the canary share, sending all traffic back to the active version.
     */
    public void clearCanary(String serviceId) {
        routes.computeIfPresent(serviceId, (id, current) -> RoutingTable.pinned(current.activeVersion()));
        log.info("Canary routing cleared: serviceId={}", serviceId);
    }

    public Optional<RoutingTable> routingFor(String serviceId) {
        return Optional.ofNullable(routes.get(serviceId));
    }

    /**
     * Returns the version receiving regular traffic: the pinned version, or the
     * registered descriptor version for services without routing entry.
     */
    public Optional<String> activeVersion(String serviceId) {
        RoutingTable route = routes.get(serviceId);
        if (route != null) {
            return Optional.ofNullable(route.activeVersion());
        }
        return registry.findService(serviceId).map(Service::getVersion);
    }

    // ==================== CALL ACCOUNTING ====================

    public void callStarted(String instanceId) {
        activeCalls.computeIfAbsent(instanceId, id -> new AtomicInteger()).incrementAndGet();
    }

    public void callFinished(String instanceId) {
        AtomicInteger counter = activeCalls.get(instanceId);
        if (counter != null) {
            counter.updateAndGet(value -> Math.max(0, value - 1));
        }
    }

    public int activeCalls(String instanceId) {
        AtomicInteger counter = activeCalls.get(instanceId);
        return counter != null ? counter.get() : 0;
    }

    private boolean drawCanary(int weightPercent) {
        synchronized (canaryRandom) {
            return canaryRandom.nextInt(100) < weightPercent;
        }
    }

    private static List<ServiceInstance> withVersion(List<ServiceInstance> instances, String version) {
        if (version == null) {
            return List.of();
        }
        return instances.stream()
                .filter(instance -> version.equals(instance.getVersion()))
                .toList();
    }
}
