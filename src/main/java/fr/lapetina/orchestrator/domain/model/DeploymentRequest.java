package fr.lapetina.orchestrator.domain.model;

/**
 * Request to roll a service out at a new version.
 *
 * @param service  target descriptor, its id and version identify what is deployed
 * @param strategy rollout strategy
 * @param replicas instances to create, null to mirror the current instance count
 * @param canary   canary parameters, used only by the canary strategy
 */
public record DeploymentRequest(
        Service service,
        DeploymentStrategy strategy,
        Integer replicas,
        CanaryConfig canary
) {

    public DeploymentRequest {
        if (service == null) {
            throw new IllegalArgumentException("Service name and version are required");
        }
        if (strategy == null) {
            strategy = DeploymentStrategy.ROLLING_UPDATE;
        }
        if (replicas != null && replicas < 1) {
            throw new IllegalArgumentException("replicas must be at least 1");
        }
        if (strategy == DeploymentStrategy.CANARY && canary == null) {
            canary = CanaryConfig.defaults();
        }
    }

    public static DeploymentRequest of(Service service, DeploymentStrategy strategy) {
        return new DeploymentRequest(service, strategy, null, null);
    }
}
