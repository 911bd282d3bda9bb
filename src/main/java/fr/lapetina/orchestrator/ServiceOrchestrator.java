package fr.lapetina.orchestrator;

import fr.lapetina.orchestrator.disruptor.CallPipeline;
import fr.lapetina.orchestrator.disruptor.exception.BackpressureException;
import fr.lapetina.orchestrator.domain.exception.NotFoundException;
import fr.lapetina.orchestrator.domain.model.AutoScalingPolicy;
import fr.lapetina.orchestrator.domain.model.CallRequest;
import fr.lapetina.orchestrator.domain.model.CallResult;
import fr.lapetina.orchestrator.domain.model.DeploymentRecord;
import fr.lapetina.orchestrator.domain.model.DeploymentRequest;
import fr.lapetina.orchestrator.domain.model.DeploymentStrategy;
import fr.lapetina.orchestrator.domain.model.ErrorType;
import fr.lapetina.orchestrator.domain.model.InstanceUsage;
import fr.lapetina.orchestrator.domain.model.LoadBalancerConfig;
import fr.lapetina.orchestrator.domain.model.Policy;
import fr.lapetina.orchestrator.domain.model.Service;
import fr.lapetina.orchestrator.domain.model.ServiceInstance;
import fr.lapetina.orchestrator.domain.model.SystemOverview;
import fr.lapetina.orchestrator.domain.model.TrafficSnapshot;
import fr.lapetina.orchestrator.infrastructure.balancer.LoadBalancer;
import fr.lapetina.orchestrator.infrastructure.config.ConfigChangeListener;
import fr.lapetina.orchestrator.infrastructure.config.ConfigMapper;
import fr.lapetina.orchestrator.infrastructure.config.OrchestratorConfig;
import fr.lapetina.orchestrator.infrastructure.deployment.DeploymentController;
import fr.lapetina.orchestrator.infrastructure.deployment.DeploymentSettings;
import fr.lapetina.orchestrator.infrastructure.deployment.ProbeDeploymentValidator;
import fr.lapetina.orchestrator.infrastructure.health.HealthMonitor;
import fr.lapetina.orchestrator.infrastructure.http.HttpProbeTransport;
import fr.lapetina.orchestrator.infrastructure.http.HttpServiceTransport;
import fr.lapetina.orchestrator.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.orchestrator.infrastructure.metrics.TrafficRecorder;
import fr.lapetina.orchestrator.infrastructure.metrics.UsageCollector;
import fr.lapetina.orchestrator.infrastructure.policy.PolicyEngine;
import fr.lapetina.orchestrator.infrastructure.registry.InMemoryInstanceStore;
import fr.lapetina.orchestrator.infrastructure.registry.InMemoryServiceStore;
import fr.lapetina.orchestrator.infrastructure.registry.InstanceStore;
import fr.lapetina.orchestrator.infrastructure.registry.ServiceRegistry;
import fr.lapetina.orchestrator.infrastructure.registry.ServiceRegistry.RegistryEvent;
import fr.lapetina.orchestrator.infrastructure.registry.ServiceStore;
import fr.lapetina.orchestrator.infrastructure.runtime.DeploymentValidator;
import fr.lapetina.orchestrator.infrastructure.runtime.InstanceProvisioner;
import fr.lapetina.orchestrator.infrastructure.runtime.LocalInstanceProvisioner;
import fr.lapetina.orchestrator.infrastructure.runtime.MetricsSource;
import fr.lapetina.orchestrator.infrastructure.runtime.ProbeTransport;
import fr.lapetina.orchestrator.infrastructure.runtime.ReportedMetricsSource;
import fr.lapetina.orchestrator.infrastructure.runtime.ServiceTransport;
import fr.lapetina.orchestrator.infrastructure.scaling.AutoScaler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Explicitly constructed orchestrator owning every component.
 *
 * Owns:
 * - Service registry and its stores
 * - Health monitor and usage collector background loops
 * - Load balancer, policy engine and the call pipeline
 * - Auto-scaler and deployment controller
 * - Metrics (Micrometer) and per-service traffic statistics
 *
 * Several orchestrators may live in one JVM; nothing is shared between them.
 *
 * <p>Usage:
 * <pre>{@code
 * try (ServiceOrchestrator orchestrator = ServiceOrchestrator.builder()
 *         .fromConfig(config)
 *         .build()
 *         .start()) {
 *     CallResult result = orchestrator.callService("web", "auth", "/login", payload);
 * }
 * }</pre>
 */
public final class ServiceOrchestrator implements ConfigChangeListener, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ServiceOrchestrator.class);

    private final Clock clock;
    private final ServiceRegistry registry;
    private final InstanceProvisioner provisioner;
    private final MetricsSource metricsSource;
    private final MetricsRegistry metricsRegistry;
    private final TrafficRecorder trafficRecorder;
    private final LoadBalancer loadBalancer;
    private final PolicyEngine policyEngine;
    private final HealthMonitor healthMonitor;
    private final UsageCollector usageCollector;
    private final AutoScaler autoScaler;
    private final DeploymentController deploymentController;
    private final CallPipeline pipeline;

    private final boolean healthMonitorEnabled;
    private final List<Service> initialServices;
    private final Map<String, Integer> initialInstances;
    private final Map<String, AutoScalingPolicy> initialAutoScaling;
    private final AtomicBoolean started = new AtomicBoolean(false);

    private ServiceOrchestrator(Builder builder) {
        this.clock = builder.clock;
        this.registry = new ServiceRegistry(builder.serviceStore, builder.instanceStore, clock);
        this.provisioner = builder.provisioner;
        this.metricsSource = builder.metricsSource;
        this.metricsRegistry = new MetricsRegistry(builder.metricsPrefix);
        this.trafficRecorder = new TrafficRecorder(clock);

        this.loadBalancer = builder.canaryRandom != null
                ? new LoadBalancer(registry, builder.canaryRandom)
                : new LoadBalancer(registry);
        builder.loadBalancerConfigs.forEach(loadBalancer::bind);

        this.policyEngine = new PolicyEngine(loadBalancer::configFor, clock, builder.defaultCallTimeout);
        policyEngine.replacePolicies(builder.policies);

        this.healthMonitor = new HealthMonitor(registry, builder.probeTransport,
                builder.healthCheckInterval, builder.maxConcurrentProbes);
        this.healthMonitorEnabled = builder.healthMonitorEnabled;
        this.usageCollector = new UsageCollector(registry, metricsSource, builder.usageCollectionInterval);
        this.autoScaler = new AutoScaler(registry, loadBalancer, provisioner, metricsRegistry, clock);

        DeploymentValidator validator = builder.validator != null
                ? builder.validator
                : new ProbeDeploymentValidator(builder.probeTransport);
        this.deploymentController = new DeploymentController(registry, loadBalancer, provisioner, validator,
                trafficRecorder, metricsRegistry, builder.deploymentSettings, clock);

        this.pipeline = CallPipeline.builder()
                .ringBufferSize(builder.ringBufferSize)
                .waitStrategy(builder.waitStrategy)
                .registry(registry)
                .policyEngine(policyEngine)
                .loadBalancer(loadBalancer)
                .transport(builder.serviceTransport)
                .trafficRecorder(trafficRecorder)
                .metricsRegistry(metricsRegistry)
                .build();

        this.initialServices = List.copyOf(builder.services);
        this.initialInstances = Map.copyOf(builder.initialInstances);
        this.initialAutoScaling = Map.copyOf(builder.autoScaling);

        registry.addListener(this::onRegistryEvent);

        log.info("ServiceOrchestrator created: services={}, loadBalancers={}, policies={}",
                initialServices.size(), builder.loadBalancerConfigs.size(), builder.policies.size());
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Registers the initial services, provisions their initial instances and
     * starts the background loops and the call pipeline.
     */
    public ServiceOrchestrator start() {
        if (!started.compareAndSet(false, true)) {
            return this;
        }

        for (Service service : initialServices) {
            registry.register(service);
            int count = initialInstances.getOrDefault(service.getId(), 0);
            for (int i = 0; i < count; i++) {
                ServiceInstance instance = provisioner.provisionInstance(service, service.getVersion()).join();
                registry.addInstance(service.getId(), instance);
            }
        }

        pipeline.start();
        if (healthMonitorEnabled) {
            healthMonitor.start();
        }
        usageCollector.start();
        initialAutoScaling.forEach(autoScaler::enable);

        log.info("ServiceOrchestrator started: services={}", registry.listServices().size());
        return this;
    }

    // ==================== DEPLOYMENTS ====================

    /**
     * Deploys a service descriptor with a rolling update.
     *
     * @return the deployment id
     */
    public String deployService(Service service) {
        return deployService(DeploymentRequest.of(service, DeploymentStrategy.ROLLING_UPDATE));
    }

    public String deployService(DeploymentRequest request) {
        return deploymentController.deploy(request);
    }

    public DeploymentRecord getDeploymentStatus(String deploymentId) {
        return deploymentController.getStatus(deploymentId);
    }

    public List<DeploymentRecord> getDeploymentHistory(String serviceId) {
        return deploymentController.history(serviceId);
    }

    public CompletableFuture<DeploymentRecord> awaitDeployment(String deploymentId) {
        return deploymentController.awaitCompletion(deploymentId);
    }

    public boolean cancelDeployment(String deploymentId) {
        return deploymentController.cancel(deploymentId);
    }

    public CompletableFuture<DeploymentRecord> rollback(String deploymentId) {
        return deploymentController.rollback(deploymentId);
    }

    // ==================== AUTO-SCALING ====================

    public boolean enableAutoScaling(String serviceId, AutoScalingPolicy policy) {
        return autoScaler.enable(serviceId, policy);
    }

    public boolean disableAutoScaling(String serviceId) {
        return autoScaler.disable(serviceId);
    }

    // ==================== CALLS ====================

    /**
     * Routes a call from one service to another and waits for its result.
     * Never throws: every failure is carried by the returned result.
     */
    public CallResult callService(String sourceService, String targetService, String endpoint, Object payload) {
        CallRequest request = CallRequest.of(sourceService, targetService, endpoint, payload);
        try {
            return submit(request).join();
        } catch (CompletionException e) {
            log.error("Call pipeline failure: requestId={}", request.requestId(), e);
            return CallResult.failure(request.requestId(), ErrorType.INTERNAL_ERROR,
                    String.valueOf(e.getCause() != null ? e.getCause().getMessage() : e.getMessage()), null, 0);
        }
    }

    /**
     * Asynchronous variant of {@link #callService}; the future never completes exceptionally.
     */
    public CompletableFuture<CallResult> callServiceAsync(String sourceService, String targetService,
                                                          String endpoint, Object payload) {
        return submit(CallRequest.of(sourceService, targetService, endpoint, payload));
    }

    private CompletableFuture<CallResult> submit(CallRequest request) {
        try {
            return pipeline.submit(request);
        } catch (BackpressureException e) {
            log.warn("Call rejected: requestId={}, target={}, reason={}",
                    request.requestId(), request.targetService(), e.getReason());
            CallResult rejected = CallResult.failure(request.requestId(), ErrorType.CAPACITY, e.getMessage(), null, 0);
            metricsRegistry.recordCall(request.sourceService(), request.targetService(), rejected);
            return CompletableFuture.completedFuture(rejected);
        }
    }

    /**
     * Picks an instance of a service the way a call would.
     */
    public ServiceInstance selectInstance(String serviceId) {
        return loadBalancer.selectInstance(serviceId);
    }

    // ==================== DISCOVERY & OVERVIEW ====================

    /**
     * Returns the healthy instances of the service with the given display name.
     */
    public List<ServiceInstance> discoverService(String serviceName) {
        return registry.listServices().stream()
                .filter(service -> serviceName.equals(service.getName()))
                .findFirst()
                .map(service -> registry.listHealthyInstances(service.getId()))
                .orElse(List.of());
    }

    public List<Service> getServices() {
        return registry.listServices();
    }

    public Service getService(String serviceId) {
        return registry.getService(serviceId);
    }

    public List<ServiceInstance> getInstances(String serviceId) {
        return registry.listInstances(serviceId);
    }

    public TrafficSnapshot getServiceMetrics(String serviceId) {
        if (!registry.contains(serviceId)) {
            throw NotFoundException.service(serviceId);
        }
        return trafficRecorder.snapshot(serviceId);
    }

    public List<LoadBalancerConfig> getLoadBalancerConfigs() {
        return loadBalancer.getConfigs();
    }

    public List<Policy> getPolicies() {
        return policyEngine.getPolicies();
    }

    /**
     * Aggregates fleet-wide figures. Response time and error rate are
     * weighted by each service's request count. Reading has no side effect.
     */
    public SystemOverview getSystemOverview() {
        int serviceCount = 0;
        int healthyServiceCount = 0;
        int instanceCount = 0;
        int healthyInstanceCount = 0;
        long totalRequests = 0;
        double weightedResponseTime = 0;
        double weightedErrorRate = 0;
        double cpu = 0;
        double memory = 0;
        double network = 0;

        for (Service service : registry.listServices()) {
            serviceCount++;
            List<ServiceInstance> instances = registry.listInstances(service.getId());
            long healthy = instances.stream().filter(ServiceInstance::isHealthy).count();
            instanceCount += instances.size();
            healthyInstanceCount += (int) healthy;
            if (healthy > 0) {
                healthyServiceCount++;
            }
            for (ServiceInstance instance : instances) {
                cpu += instance.getCpuPercent();
                memory += service.getResources().memoryPercent(instance.getMemoryMb());
                network += instance.getNetworkLoad();
            }

            TrafficSnapshot traffic = trafficRecorder.snapshot(service.getId());
            totalRequests += traffic.requestCount();
            weightedResponseTime += traffic.avgResponseTime() * traffic.requestCount();
            weightedErrorRate += traffic.errorRate() * traffic.requestCount();
        }

        double avgResponseTime = totalRequests > 0 ? weightedResponseTime / totalRequests : 0;
        double errorRate = totalRequests > 0 ? weightedErrorRate / totalRequests : 0;
        SystemOverview.ResourceUtilization utilization = instanceCount > 0
                ? new SystemOverview.ResourceUtilization(cpu / instanceCount, memory / instanceCount,
                        network / instanceCount)
                : new SystemOverview.ResourceUtilization(0, 0, 0);

        return new SystemOverview(serviceCount, healthyServiceCount, instanceCount, healthyInstanceCount,
                totalRequests, avgResponseTime, errorRate, utilization);
    }

    /**
     * Records the usage an instance reports and applies it to the registry immediately.
     *
     * @throws NotFoundException if the instance is unknown
     */
    public void reportUsage(String instanceId, InstanceUsage usage) {
        registry.updateInstanceUsage(instanceId, usage);
        if (metricsSource instanceof ReportedMetricsSource reported) {
            reported.report(instanceId, usage);
        }
    }

    // ==================== CONFIGURATION ====================

    /**
     * Applies a reloaded configuration: policies and load-balancer bindings are
     * replaced. Service definitions are not reloaded, the registry is
     * authoritative once running.
     */
    @Override
    public void onConfigChanged(OrchestratorConfig oldConfig, OrchestratorConfig newConfig) {
        if (oldConfig == null) {
            return;
        }
        log.info("Configuration changed, applying policies and load balancers...");
        loadBalancer.replaceConfigs(newConfig.getLoadBalancers().stream()
                .map(ConfigMapper::toLoadBalancerConfig)
                .toList());
        policyEngine.replacePolicies(newConfig.getPolicies().stream()
                .map(ConfigMapper::toPolicy)
                .toList());
        log.info("Configuration updates applied: loadBalancers={}, policies={}",
                loadBalancer.getConfigs().size(), policyEngine.getPolicies().size());
    }

    private void onRegistryEvent(RegistryEvent event) {
        switch (event.type()) {
            case SERVICE_REGISTERED -> {
                String serviceId = event.serviceId();
                metricsRegistry.registerServiceGauges(serviceId,
                        () -> registry.listInstances(serviceId).size(),
                        () -> registry.listHealthyInstances(serviceId).size());
            }
            case INSTANCE_REMOVED -> {
                if (metricsSource instanceof ReportedMetricsSource reported) {
                    reported.forget(event.instance().getId());
                }
            }
            default -> {
                // other events carry nothing for the orchestrator itself
            }
        }
    }

    // ==================== COMPONENTS ====================

    public ServiceRegistry getRegistry() {
        return registry;
    }

    public LoadBalancer getLoadBalancer() {
        return loadBalancer;
    }

    public PolicyEngine getPolicyEngine() {
        return policyEngine;
    }

    public HealthMonitor getHealthMonitor() {
        return healthMonitor;
    }

    public AutoScaler getAutoScaler() {
        return autoScaler;
    }

    public DeploymentController getDeploymentController() {
        return deploymentController;
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public TrafficRecorder getTrafficRecorder() {
        return trafficRecorder;
    }

    public UsageCollector getUsageCollector() {
        return usageCollector;
    }

    public Clock getClock() {
        return clock;
    }

    @Override
    public void close() {
        log.info("Shutting down ServiceOrchestrator...");

        try {
            deploymentController.close();
        } catch (Exception e) {
            log.warn("Error closing deployment controller", e);
        }

        try {
            autoScaler.close();
        } catch (Exception e) {
            log.warn("Error closing auto-scaler", e);
        }

        try {
            healthMonitor.close();
        } catch (Exception e) {
            log.warn("Error closing health monitor", e);
        }

        try {
            usageCollector.close();
        } catch (Exception e) {
            log.warn("Error closing usage collector", e);
        }

        try {
            pipeline.close();
        } catch (Exception e) {
            log.warn("Error closing call pipeline", e);
        }

        try {
            metricsRegistry.close();
        } catch (Exception e) {
            log.warn("Error closing metrics registry", e);
        }

        log.info("ServiceOrchestrator shut down");
    }

    /**
     * Builder for ServiceOrchestrator. Collaborators left unset default to the
     * local instance model and the HTTP transports.
     */
    public static final class Builder {
        private Clock clock = Clock.systemUTC();
        private ServiceStore serviceStore = new InMemoryServiceStore();
        private InstanceStore instanceStore = new InMemoryInstanceStore();
        private InstanceProvisioner provisioner;
        private ProbeTransport probeTransport;
        private ServiceTransport serviceTransport;
        private MetricsSource metricsSource;
        private DeploymentValidator validator;
        private Random canaryRandom;

        private boolean healthMonitorEnabled = true;
        private Duration healthCheckInterval = Duration.ofSeconds(30);
        private int maxConcurrentProbes = 16;
        private Duration usageCollectionInterval = Duration.ofSeconds(10);
        private Duration defaultCallTimeout = Duration.ofSeconds(30);
        private Duration connectTimeout = Duration.ofSeconds(2);
        private DeploymentSettings deploymentSettings = DeploymentSettings.defaults();
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";
        private String metricsPrefix = "orchestrator";
        private List<LocalInstanceProvisioner.Node> nodes = List.of(new LocalInstanceProvisioner.Node("local", null, 0));

        private final List<Service> services = new ArrayList<>();
        private final Map<String, Integer> initialInstances = new LinkedHashMap<>();
        private final List<LoadBalancerConfig> loadBalancerConfigs = new ArrayList<>();
        private final List<Policy> policies = new ArrayList<>();
        private final Map<String, AutoScalingPolicy> autoScaling = new LinkedHashMap<>();

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder serviceStore(ServiceStore serviceStore) {
            this.serviceStore = serviceStore;
            return this;
        }

        public Builder instanceStore(InstanceStore instanceStore) {
            this.instanceStore = instanceStore;
            return this;
        }

        public Builder provisioner(InstanceProvisioner provisioner) {
            this.provisioner = provisioner;
            return this;
        }

        public Builder probeTransport(ProbeTransport probeTransport) {
            this.probeTransport = probeTransport;
            return this;
        }

        public Builder serviceTransport(ServiceTransport serviceTransport) {
            this.serviceTransport = serviceTransport;
            return this;
        }

        public Builder metricsSource(MetricsSource metricsSource) {
            this.metricsSource = metricsSource;
            return this;
        }

        public Builder validator(DeploymentValidator validator) {
            this.validator = validator;
            return this;
        }

        public Builder canaryRandom(Random random) {
            this.canaryRandom = random;
            return this;
        }

        public Builder healthMonitorEnabled(boolean enabled) {
            this.healthMonitorEnabled = enabled;
            return this;
        }

        public Builder healthCheckInterval(Duration interval) {
            this.healthCheckInterval = interval;
            return this;
        }

        public Builder maxConcurrentProbes(int maxConcurrentProbes) {
            this.maxConcurrentProbes = maxConcurrentProbes;
            return this;
        }

        public Builder usageCollectionInterval(Duration interval) {
            this.usageCollectionInterval = interval;
            return this;
        }

        public Builder defaultCallTimeout(Duration timeout) {
            this.defaultCallTimeout = timeout;
            return this;
        }

        public Builder deploymentSettings(DeploymentSettings settings) {
            this.deploymentSettings = settings;
            return this;
        }

        public Builder ringBufferSize(int size) {
            this.ringBufferSize = size;
            return this;
        }

        public Builder waitStrategy(String strategy) {
            this.waitStrategy = strategy;
            return this;
        }

        public Builder metricsPrefix(String prefix) {
            this.metricsPrefix = prefix;
            return this;
        }

        /**
         * Adds a service registered at start with a number of initial instances.
         */
        public Builder service(Service service, int instances) {
            this.services.add(service);
            this.initialInstances.put(service.getId(), instances);
            return this;
        }

        public Builder loadBalancer(LoadBalancerConfig config) {
            this.loadBalancerConfigs.add(config);
            return this;
        }

        public Builder policy(Policy policy) {
            this.policies.add(policy);
            return this;
        }

        public Builder autoScaling(String serviceId, AutoScalingPolicy policy) {
            this.autoScaling.put(serviceId, policy);
            return this;
        }

        public Builder fromConfig(OrchestratorConfig config) {
            this.healthMonitorEnabled = config.getHealthMonitor().isEnabled();
            this.healthCheckInterval = Duration.ofMillis(config.getHealthMonitor().getIntervalMs());
            this.maxConcurrentProbes = config.getHealthMonitor().getMaxConcurrentProbes();
            this.usageCollectionInterval = Duration.ofMillis(config.getMetrics().getUsageCollectionIntervalMs());
            this.defaultCallTimeout = Duration.ofMillis(config.getTimeouts().getCallTimeoutMs());
            this.connectTimeout = Duration.ofMillis(config.getTimeouts().getConnectTimeoutMs());
            this.deploymentSettings = ConfigMapper.toDeploymentSettings(config.getDeployment());
            this.ringBufferSize = config.getPipeline().getRingBufferSize();
            this.waitStrategy = config.getPipeline().getWaitStrategy();
            this.metricsPrefix = config.getMetrics().getPrefix();
            this.nodes = ConfigMapper.toNodes(config.getNodes());

            for (OrchestratorConfig.ServiceConfig serviceConfig : config.getServices()) {
                service(ConfigMapper.toService(serviceConfig), serviceConfig.getInstances());
            }
            config.getLoadBalancers().forEach(entry -> loadBalancer(ConfigMapper.toLoadBalancerConfig(entry)));
            config.getPolicies().forEach(entry -> policy(ConfigMapper.toPolicy(entry)));
            config.getAutoScaling().forEach(entry ->
                    autoScaling(entry.getServiceId(), ConfigMapper.toAutoScalingPolicy(entry)));
            return this;
        }

        public ServiceOrchestrator build() {
            if (clock == null) {
                throw new IllegalStateException("Clock is required");
            }
            if (serviceStore == null || instanceStore == null) {
                throw new IllegalStateException("Service and instance stores are required");
            }
            if (provisioner == null) {
                provisioner = new LocalInstanceProvisioner(nodes, clock);
            }
            if (probeTransport == null) {
                probeTransport = new HttpProbeTransport(connectTimeout);
            }
            if (serviceTransport == null) {
                serviceTransport = new HttpServiceTransport(connectTimeout);
            }
            if (metricsSource == null) {
                metricsSource = new ReportedMetricsSource();
            }
            return new ServiceOrchestrator(this);
        }
    }
}
