package fr.lapetina.orchestrator.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import fr.lapetina.orchestrator.domain.model.CanaryConfig;
import fr.lapetina.orchestrator.domain.model.DeploymentRequest;
import fr.lapetina.orchestrator.domain.model.DeploymentStrategy;
import fr.lapetina.orchestrator.infrastructure.config.ConfigMapper;
import fr.lapetina.orchestrator.infrastructure.config.OrchestratorConfig;

import java.time.Duration;

/**
 * Body of {@code POST /v1/deployments}. The service descriptor uses the same
 * shape as a {@code services} entry of the YAML configuration.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class DeploymentApiRequest {

    private OrchestratorConfig.ServiceConfig service;
    private String strategy;
    private Integer replicas;
    private Canary canary;

    public OrchestratorConfig.ServiceConfig getService() { return service; }
    public void setService(OrchestratorConfig.ServiceConfig service) { this.service = service; }

    public String getStrategy() { return strategy; }
    public void setStrategy(String strategy) { this.strategy = strategy; }

    public Integer getReplicas() { return replicas; }
    public void setReplicas(Integer replicas) { this.replicas = replicas; }

    public Canary getCanary() { return canary; }
    public void setCanary(Canary canary) { this.canary = canary; }

    /**
     * Converts to a domain DeploymentRequest.
     *
     * @throws IllegalArgumentException if the service or strategy is missing or invalid
     */
    public DeploymentRequest toDeploymentRequest() {
        if (service == null) {
            throw new IllegalArgumentException("Service name and version are required");
        }
        return new DeploymentRequest(
                ConfigMapper.toService(service),
                DeploymentStrategy.fromWireName(strategy),
                replicas,
                canary != null ? canary.toCanaryConfig() : null
        );
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Canary {
        private int weightPercent = 10;
        private long windowMs = 300_000;
        private double minSuccessRate = 0.99;
        private double maxResponseTimeMs = 1000;
        private double maxErrorRate = 0.01;

        public int getWeightPercent() { return weightPercent; }
        public void setWeightPercent(int weightPercent) { this.weightPercent = weightPercent; }

        public long getWindowMs() { return windowMs; }
        public void setWindowMs(long windowMs) { this.windowMs = windowMs; }

        public double getMinSuccessRate() { return minSuccessRate; }
        public void setMinSuccessRate(double minSuccessRate) { this.minSuccessRate = minSuccessRate; }

        public double getMaxResponseTimeMs() { return maxResponseTimeMs; }
        public void setMaxResponseTimeMs(double maxResponseTimeMs) { this.maxResponseTimeMs = maxResponseTimeMs; }

        public double getMaxErrorRate() { return maxErrorRate; }
        public void setMaxErrorRate(double maxErrorRate) { this.maxErrorRate = maxErrorRate; }

        CanaryConfig toCanaryConfig() {
            return new CanaryConfig(weightPercent, Duration.ofMillis(windowMs),
                    new CanaryConfig.SuccessCriteria(minSuccessRate, maxResponseTimeMs, maxErrorRate));
        }
    }
}
