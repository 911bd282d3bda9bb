package fr.lapetina.orchestrator.infrastructure.runtime;

import fr.lapetina.orchestrator.domain.model.Service;
import fr.lapetina.orchestrator.domain.model.ServiceInstance;

import java.util.concurrent.CompletableFuture;

/**
 * Container or process runtime that creates and destroys instances.
 *
 * The orchestrator never assumes an instance is healthy because it was
 * provisioned: returned instances enter the registry as STARTING.
 */
public interface InstanceProvisioner {

    /**
     * Creates one instance of a service at a version.
     *
     * @return future completing with the created instance, or exceptionally if provisioning failed
     */
    CompletableFuture<ServiceInstance> provisionInstance(Service service, String version);

    /**
     * Destroys an instance. Completes normally if the instance no longer exists.
     */
    CompletableFuture<Void> terminateInstance(ServiceInstance instance);
}
