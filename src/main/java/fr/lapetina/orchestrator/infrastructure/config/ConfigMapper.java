package fr.lapetina.orchestrator.infrastructure.config;

import fr.lapetina.orchestrator.domain.model.AutoScalingPolicy;
import fr.lapetina.orchestrator.domain.model.CircuitBreakerSettings;
import fr.lapetina.orchestrator.domain.model.HealthCheckSpec;
import fr.lapetina.orchestrator.domain.model.HttpMethod;
import fr.lapetina.orchestrator.domain.model.LoadBalancerConfig;
import fr.lapetina.orchestrator.domain.model.LoadBalancingAlgorithm;
import fr.lapetina.orchestrator.domain.model.Policy;
import fr.lapetina.orchestrator.domain.model.PolicyType;
import fr.lapetina.orchestrator.domain.model.ResourceAllocation;
import fr.lapetina.orchestrator.domain.model.Service;
import fr.lapetina.orchestrator.domain.model.ServiceEndpoint;
import fr.lapetina.orchestrator.infrastructure.config.ConfigLoader.ConfigurationException;
import fr.lapetina.orchestrator.infrastructure.deployment.DeploymentSettings;
import fr.lapetina.orchestrator.infrastructure.runtime.LocalInstanceProvisioner;

import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;

/**
 * Converts configuration beans into domain objects.
 * Invalid values surface as {@link ConfigurationException}.
 */
public final class ConfigMapper {

    private ConfigMapper() {
    }

    public static Service toService(OrchestratorConfig.ServiceConfig config) {
        try {
            OrchestratorConfig.ResourceConfig resources = config.getResources();
            OrchestratorConfig.HealthCheckConfig healthCheck = config.getHealthCheck();
            return Service.builder()
                    .id(config.getId())
                    .name(config.getName() != null ? config.getName() : config.getId())
                    .version(config.getVersion())
                    .dependencies(config.getDependencies())
                    .resources(new ResourceAllocation(
                            resources.getCpuRequest(),
                            resources.getCpuLimit(),
                            resources.getMemoryRequestMb(),
                            resources.getMemoryLimitMb(),
                            resources.getDiskGb(),
                            resources.getNetworkMbps()))
                    .endpoints(config.getEndpoints().stream().map(ConfigMapper::toEndpoint).toList())
                    .healthCheck(new HealthCheckSpec(
                            healthCheck.getPath(),
                            Duration.ofMillis(healthCheck.getIntervalMs()),
                            Duration.ofMillis(healthCheck.getTimeoutMs()),
                            healthCheck.getSuccessThreshold(),
                            healthCheck.getFailureThreshold()))
                    .configuration(config.getConfiguration())
                    .build();
        } catch (IllegalArgumentException | IllegalStateException | NullPointerException e) {
            throw new ConfigurationException("Invalid service '" + config.getId() + "': " + e.getMessage(), e);
        }
    }

    private static ServiceEndpoint toEndpoint(OrchestratorConfig.EndpointConfig config) {
        return new ServiceEndpoint(
                config.getPath(),
                HttpMethod.valueOf(config.getMethod().toUpperCase(Locale.ROOT)),
                config.getRateLimit(),
                config.isAuthenticationRequired(),
                config.isCacheable(),
                Duration.ofMillis(config.getTimeoutMs()));
    }

    public static LoadBalancerConfig toLoadBalancerConfig(OrchestratorConfig.LoadBalancerEntry entry) {
        try {
            OrchestratorConfig.CircuitBreakerConfig breaker = entry.getCircuitBreaker();
            return new LoadBalancerConfig(
                    entry.getId(),
                    LoadBalancingAlgorithm.fromWireName(entry.getAlgorithm()),
                    new HashSet<>(entry.getTargetServices()),
                    entry.isSessionAffinity(),
                    Duration.ofMillis(entry.getHealthCheckIntervalMs()),
                    Duration.ofMillis(entry.getConnectionTimeoutMs()),
                    entry.getRetries(),
                    new CircuitBreakerSettings(
                            breaker.isEnabled(),
                            breaker.getFailureThreshold(),
                            Duration.ofMillis(breaker.getIntervalMs()),
                            Duration.ofMillis(breaker.getRecoveryTimeoutMs()),
                            breaker.getHalfOpenRequests()));
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new ConfigurationException("Invalid load balancer '" + entry.getId() + "': " + e.getMessage(), e);
        }
    }

    public static Policy toPolicy(OrchestratorConfig.PolicyEntry entry) {
        try {
            return new Policy(
                    entry.getId(),
                    PolicyType.fromWireName(entry.getType()),
                    entry.getTarget(),
                    entry.getConfiguration(),
                    entry.isEnabled());
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new ConfigurationException("Invalid policy '" + entry.getId() + "': " + e.getMessage(), e);
        }
    }

    public static AutoScalingPolicy toAutoScalingPolicy(OrchestratorConfig.AutoScalingEntry entry) {
        try {
            return AutoScalingPolicy.builder()
                    .minInstances(entry.getMinInstances())
                    .maxInstances(entry.getMaxInstances())
                    .scaleUpCpu(entry.getScaleUpCpu())
                    .scaleUpMemory(entry.getScaleUpMemory())
                    .scaleDownCpu(entry.getScaleDownCpu())
                    .scaleDownMemory(entry.getScaleDownMemory())
                    .checkInterval(Duration.ofMillis(entry.getCheckIntervalMs()))
                    .build();
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid auto-scaling policy for '" + entry.getServiceId() + "': "
                    + e.getMessage(), e);
        }
    }

    public static DeploymentSettings toDeploymentSettings(OrchestratorConfig.DeploymentConfig config) {
        return new DeploymentSettings(
                Duration.ofMillis(config.getProvisionTimeoutMs()),
                Duration.ofMillis(config.getHealthGateTimeoutMs()),
                Duration.ofMillis(config.getValidationTimeoutMs()),
                Duration.ofMillis(config.getTeardownTimeoutMs()));
    }

    /**
     * Placement nodes; a single anonymous node when none is configured.
     */
    public static List<LocalInstanceProvisioner.Node> toNodes(List<OrchestratorConfig.NodeConfig> nodes) {
        if (nodes.isEmpty()) {
            return List.of(new LocalInstanceProvisioner.Node("local", null, 0));
        }
        return nodes.stream()
                .map(node -> new LocalInstanceProvisioner.Node(node.getId(), node.getHost(), node.getFirstPort()))
                .toList();
    }
}
