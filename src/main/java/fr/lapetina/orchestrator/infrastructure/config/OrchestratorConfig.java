package fr.lapetina.orchestrator.infrastructure.config;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Root configuration object for the orchestrator.
 * Designed to be populated from YAML; all durations are milliseconds.
 */
public class OrchestratorConfig {

    private ServerConfig server = new ServerConfig();
    private List<NodeConfig> nodes = new ArrayList<>();
    private List<ServiceConfig> services = new ArrayList<>();
    private List<LoadBalancerEntry> loadBalancers = new ArrayList<>();
    private List<PolicyEntry> policies = new ArrayList<>();
    private List<AutoScalingEntry> autoScaling = new ArrayList<>();
    private HealthMonitorConfig healthMonitor = new HealthMonitorConfig();
    private DeploymentConfig deployment = new DeploymentConfig();
    private PipelineConfig pipeline = new PipelineConfig();
    private TimeoutsConfig timeouts = new TimeoutsConfig();
    private MetricsConfig metrics = new MetricsConfig();

    public ServerConfig getServer() { return server; }
    public void setServer(ServerConfig server) { this.server = server; }

    public List<NodeConfig> getNodes() { return nodes; }
    public void setNodes(List<NodeConfig> nodes) { this.nodes = nodes; }

    public List<ServiceConfig> getServices() { return services; }
    public void setServices(List<ServiceConfig> services) { this.services = services; }

    public List<LoadBalancerEntry> getLoadBalancers() { return loadBalancers; }
    public void setLoadBalancers(List<LoadBalancerEntry> loadBalancers) { this.loadBalancers = loadBalancers; }

    public List<PolicyEntry> getPolicies() { return policies; }
    public void setPolicies(List<PolicyEntry> policies) { this.policies = policies; }

    public List<AutoScalingEntry> getAutoScaling() { return autoScaling; }
    public void setAutoScaling(List<AutoScalingEntry> autoScaling) { this.autoScaling = autoScaling; }

    public HealthMonitorConfig getHealthMonitor() { return healthMonitor; }
    public void setHealthMonitor(HealthMonitorConfig healthMonitor) { this.healthMonitor = healthMonitor; }

    public DeploymentConfig getDeployment() { return deployment; }
    public void setDeployment(DeploymentConfig deployment) { this.deployment = deployment; }

    public PipelineConfig getPipeline() { return pipeline; }
    public void setPipeline(PipelineConfig pipeline) { this.pipeline = pipeline; }

    public TimeoutsConfig getTimeouts() { return timeouts; }
    public void setTimeouts(TimeoutsConfig timeouts) { this.timeouts = timeouts; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * HTTP server configuration.
     */
    public static class ServerConfig {
        private int port = 8080;
        private String host = "0.0.0.0";
        private int backlog = 100;
        private int threads = 16;

        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }

        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }

        public int getBacklog() { return backlog; }
        public void setBacklog(int backlog) { this.backlog = backlog; }

        public int getThreads() { return threads; }
        public void setThreads(int threads) { this.threads = threads; }
    }

    /**
     * Placement target for locally modelled instances.
     * Without a host, instances get no address and are served in-process.
     */
    public static class NodeConfig {
        private String id;
        private String host;
        private int firstPort = 9000;

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }

        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }

        public int getFirstPort() { return firstPort; }
        public void setFirstPort(int firstPort) { this.firstPort = firstPort; }
    }

    /**
     * Initial service definition.
     */
    public static class ServiceConfig {
        private String id;
        private String name;
        private String version = "1.0.0";
        private List<String> dependencies = new ArrayList<>();
        private ResourceConfig resources = new ResourceConfig();
        private List<EndpointConfig> endpoints = new ArrayList<>();
        private HealthCheckConfig healthCheck = new HealthCheckConfig();
        private Map<String, Object> configuration = new HashMap<>();
        private int instances = 1;

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public String getVersion() { return version; }
        public void setVersion(String version) { this.version = version; }

        public List<String> getDependencies() { return dependencies; }
        public void setDependencies(List<String> dependencies) { this.dependencies = dependencies; }

        public ResourceConfig getResources() { return resources; }
        public void setResources(ResourceConfig resources) { this.resources = resources; }

        public List<EndpointConfig> getEndpoints() { return endpoints; }
        public void setEndpoints(List<EndpointConfig> endpoints) { this.endpoints = endpoints; }

        public HealthCheckConfig getHealthCheck() { return healthCheck; }
        public void setHealthCheck(HealthCheckConfig healthCheck) { this.healthCheck = healthCheck; }

        public Map<String, Object> getConfiguration() { return configuration; }
        public void setConfiguration(Map<String, Object> configuration) { this.configuration = configuration; }

        public int getInstances() { return instances; }
        public void setInstances(int instances) { this.instances = instances; }
    }

    public static class ResourceConfig {
        private double cpuRequest = 0.5;
        private double cpuLimit = 1.0;
        private long memoryRequestMb = 512;
        private long memoryLimitMb = 1024;
        private long diskGb = 10;
        private long networkMbps = 100;

        public double getCpuRequest() { return cpuRequest; }
        public void setCpuRequest(double cpuRequest) { this.cpuRequest = cpuRequest; }

        public double getCpuLimit() { return cpuLimit; }
        public void setCpuLimit(double cpuLimit) { this.cpuLimit = cpuLimit; }

        public long getMemoryRequestMb() { return memoryRequestMb; }
        public void setMemoryRequestMb(long memoryRequestMb) { this.memoryRequestMb = memoryRequestMb; }

        public long getMemoryLimitMb() { return memoryLimitMb; }
        public void setMemoryLimitMb(long memoryLimitMb) { this.memoryLimitMb = memoryLimitMb; }

        public long getDiskGb() { return diskGb; }
        public void setDiskGb(long diskGb) { this.diskGb = diskGb; }

        public long getNetworkMbps() { return networkMbps; }
        public void setNetworkMbps(long networkMbps) { this.networkMbps = networkMbps; }
    }

    public static class EndpointConfig {
        private String path;
        private String method = "GET";
        private int rateLimit;
        private boolean authenticationRequired;
        private boolean cacheable;
        private long timeoutMs = 5000;

        public String getPath() { return path; }
        public void setPath(String path) { this.path = path; }

        public String getMethod() { return method; }
        public void setMethod(String method) { this.method = method; }

        public int getRateLimit() { return rateLimit; }
        public void setRateLimit(int rateLimit) { this.rateLimit = rateLimit; }

        public boolean isAuthenticationRequired() { return authenticationRequired; }
        public void setAuthenticationRequired(boolean authenticationRequired) { this.authenticationRequired = authenticationRequired; }

        public boolean isCacheable() { return cacheable; }
        public void setCacheable(boolean cacheable) { this.cacheable = cacheable; }

        public long getTimeoutMs() { return timeoutMs; }
        public void setTimeoutMs(long timeoutMs) { this.timeoutMs = timeoutMs; }
    }

    /**
     * Per-service probe descriptor.
     */
    public static class HealthCheckConfig {
        private String path = "/health";
        private long intervalMs = 30000;
        private long timeoutMs = 5000;
        private int successThreshold = 1;
        private int failureThreshold = 3;

        public String getPath() { return path; }
        public void setPath(String path) { this.path = path; }

        public long getIntervalMs() { return intervalMs; }
        public void setIntervalMs(long intervalMs) { this.intervalMs = intervalMs; }

        public long getTimeoutMs() { return timeoutMs; }
        public void setTimeoutMs(long timeoutMs) { this.timeoutMs = timeoutMs; }

        public int getSuccessThreshold() { return successThreshold; }
        public void setSuccessThreshold(int successThreshold) { this.successThreshold = successThreshold; }

        public int getFailureThreshold() { return failureThreshold; }
        public void setFailureThreshold(int failureThreshold) { this.failureThreshold = failureThreshold; }
    }

    /**
     * Load balancer bound to one or more services.
     */
    public static class LoadBalancerEntry {
        private String id;
        private String algorithm = "round_robin";
        private List<String> targetServices = new ArrayList<>();
        private boolean sessionAffinity;
        private long healthCheckIntervalMs = 30000;
        private long connectionTimeoutMs = 5000;
        private int retries = 3;
        private CircuitBreakerConfig circuitBreaker = new CircuitBreakerConfig();

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }

        public String getAlgorithm() { return algorithm; }
        public void setAlgorithm(String algorithm) { this.algorithm = algorithm; }

        public List<String> getTargetServices() { return targetServices; }
        public void setTargetServices(List<String> targetServices) { this.targetServices = targetServices; }

        public boolean isSessionAffinity() { return sessionAffinity; }
        public void setSessionAffinity(boolean sessionAffinity) { this.sessionAffinity = sessionAffinity; }

        public long getHealthCheckIntervalMs() { return healthCheckIntervalMs; }
        public void setHealthCheckIntervalMs(long healthCheckIntervalMs) { this.healthCheckIntervalMs = healthCheckIntervalMs; }

        public long getConnectionTimeoutMs() { return connectionTimeoutMs; }
        public void setConnectionTimeoutMs(long connectionTimeoutMs) { this.connectionTimeoutMs = connectionTimeoutMs; }

        public int getRetries() { return retries; }
        public void setRetries(int retries) { this.retries = retries; }

        public CircuitBreakerConfig getCircuitBreaker() { return circuitBreaker; }
        public void setCircuitBreaker(CircuitBreakerConfig circuitBreaker) { this.circuitBreaker = circuitBreaker; }
    }

    public static class CircuitBreakerConfig {
        private boolean enabled = true;
        private int failureThreshold = 5;
        private long intervalMs = 30000;
        private long recoveryTimeoutMs = 30000;
        private int halfOpenRequests = 3;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public int getFailureThreshold() { return failureThreshold; }
        public void setFailureThreshold(int failureThreshold) { this.failureThreshold = failureThreshold; }

        public long getIntervalMs() { return intervalMs; }
        public void setIntervalMs(long intervalMs) { this.intervalMs = intervalMs; }

        public long getRecoveryTimeoutMs() { return recoveryTimeoutMs; }
        public void setRecoveryTimeoutMs(long recoveryTimeoutMs) { this.recoveryTimeoutMs = recoveryTimeoutMs; }

        public int getHalfOpenRequests() { return halfOpenRequests; }
        public void setHalfOpenRequests(int halfOpenRequests) { this.halfOpenRequests = halfOpenRequests; }
    }

    /**
     * Mesh policy; the configuration bag depends on the type.
     */
    public static class PolicyEntry {
        private String id;
        private String type;
        private String target = "*";
        private boolean enabled = true;
        private Map<String, Object> configuration = new HashMap<>();

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }

        public String getTarget() { return target; }
        public void setTarget(String target) { this.target = target; }

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public Map<String, Object> getConfiguration() { return configuration; }
        public void setConfiguration(Map<String, Object> configuration) { this.configuration = configuration; }
    }

    /**
     * Auto-scaling enabled at startup for one service.
     */
    public static class AutoScalingEntry {
        private String serviceId;
        private int minInstances = 1;
        private int maxInstances = 5;
        private double scaleUpCpu = 70;
        private double scaleUpMemory = 80;
        private double scaleDownCpu = 30;
        private double scaleDownMemory = 30;
        private long checkIntervalMs = 60000;

        public String getServiceId() { return serviceId; }
        public void setServiceId(String serviceId) { this.serviceId = serviceId; }

        public int getMinInstances() { return minInstances; }
        public void setMinInstances(int minInstances) { this.minInstances = minInstances; }

        public int getMaxInstances() { return maxInstances; }
        public void setMaxInstances(int maxInstances) { this.maxInstances = maxInstances; }

        public double getScaleUpCpu() { return scaleUpCpu; }
        public void setScaleUpCpu(double scaleUpCpu) { this.scaleUpCpu = scaleUpCpu; }

        public double getScaleUpMemory() { return scaleUpMemory; }
        public void setScaleUpMemory(double scaleUpMemory) { this.scaleUpMemory = scaleUpMemory; }

        public double getScaleDownCpu() { return scaleDownCpu; }
        public void setScaleDownCpu(double scaleDownCpu) { this.scaleDownCpu = scaleDownCpu; }

        public double getScaleDownMemory() { return scaleDownMemory; }
        public void setScaleDownMemory(double scaleDownMemory) { this.scaleDownMemory = scaleDownMemory; }

        public long getCheckIntervalMs() { return checkIntervalMs; }
        public void setCheckIntervalMs(long checkIntervalMs) { this.checkIntervalMs = checkIntervalMs; }
    }

    /**
     * Health monitor loop configuration.
     */
    public static class HealthMonitorConfig {
        private boolean enabled = true;
        private long intervalMs = 30000;
        private int maxConcurrentProbes = 16;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public long getIntervalMs() { return intervalMs; }
        public void setIntervalMs(long intervalMs) { this.intervalMs = intervalMs; }

        public int getMaxConcurrentProbes() { return maxConcurrentProbes; }
        public void setMaxConcurrentProbes(int maxConcurrentProbes) { this.maxConcurrentProbes = maxConcurrentProbes; }
    }

    /**
     * Deployment step timeouts.
     */
    public static class DeploymentConfig {
        private long provisionTimeoutMs = 120000;
        private long healthGateTimeoutMs = 300000;
        private long validationTimeoutMs = 60000;
        private long teardownTimeoutMs = 60000;

        public long getProvisionTimeoutMs() { return provisionTimeoutMs; }
        public void setProvisionTimeoutMs(long provisionTimeoutMs) { this.provisionTimeoutMs = provisionTimeoutMs; }

        public long getHealthGateTimeoutMs() { return healthGateTimeoutMs; }
        public void setHealthGateTimeoutMs(long healthGateTimeoutMs) { this.healthGateTimeoutMs = healthGateTimeoutMs; }

        public long getValidationTimeoutMs() { return validationTimeoutMs; }
        public void setValidationTimeoutMs(long validationTimeoutMs) { this.validationTimeoutMs = validationTimeoutMs; }

        public long getTeardownTimeoutMs() { return teardownTimeoutMs; }
        public void setTeardownTimeoutMs(long teardownTimeoutMs) { this.teardownTimeoutMs = teardownTimeoutMs; }
    }

    /**
     * LMAX Disruptor configuration for the call pipeline.
     */
    public static class PipelineConfig {
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";

        public int getRingBufferSize() { return ringBufferSize; }
        public void setRingBufferSize(int ringBufferSize) { this.ringBufferSize = ringBufferSize; }

        public String getWaitStrategy() { return waitStrategy; }
        public void setWaitStrategy(String waitStrategy) { this.waitStrategy = waitStrategy; }
    }

    /**
     * Timeout configuration.
     */
    public static class TimeoutsConfig {
        private long callTimeoutMs = 30000;
        private long connectTimeoutMs = 2000;

        public long getCallTimeoutMs() { return callTimeoutMs; }
        public void setCallTimeoutMs(long callTimeoutMs) { this.callTimeoutMs = callTimeoutMs; }

        public long getConnectTimeoutMs() { return connectTimeoutMs; }
        public void setConnectTimeoutMs(long connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private boolean enabled = true;
        private String prefix = "orchestrator";
        private long usageCollectionIntervalMs = 10000;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }

        public long getUsageCollectionIntervalMs() { return usageCollectionIntervalMs; }
        public void setUsageCollectionIntervalMs(long usageCollectionIntervalMs) { this.usageCollectionIntervalMs = usageCollectionIntervalMs; }
    }
}
