package fr.lapetina.orchestrator.infrastructure.deployment;

import java.time.Duration;

/**
 * Time bounds of the deployment workflow steps.
 *
 * @param provisionTimeout   creation of all new instances
 * @param healthGateTimeout  wait for all new instances to become healthy
 * @param validationTimeout  post-cutover validation
 * @param teardownTimeout    termination of one old instance
 */
public record DeploymentSettings(
        Duration provisionTimeout,
        Duration healthGateTimeout,
        Duration validationTimeout,
        Duration teardownTimeout
) {

    public static DeploymentSettings defaults() {
        return new DeploymentSettings(
                Duration.ofMinutes(2),
                Duration.ofMinutes(5),
                Duration.ofMinutes(1),
                Duration.ofMinutes(1)
        );
    }
}
