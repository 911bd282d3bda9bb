package fr.lapetina.orchestrator.infrastructure.runtime;

import fr.lapetina.orchestrator.domain.model.DeploymentRecord;
import fr.lapetina.orchestrator.domain.model.ServiceInstance;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Post-cutover check of a deployment.
 */
@FunctionalInterface
public interface DeploymentValidator {

    /**
     * Validates a deployment once traffic reaches the new instances.
     */
    CompletableFuture<Result> validate(DeploymentRecord deployment, List<ServiceInstance> newInstances);

    record Result(boolean valid, String reason) {

        public static Result ok() {
            return new Result(true, null);
        }

        public static Result failed(String reason) {
            return new Result(false, reason);
        }
    }
}
