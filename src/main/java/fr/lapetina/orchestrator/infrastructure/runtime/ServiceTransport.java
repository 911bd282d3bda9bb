package fr.lapetina.orchestrator.infrastructure.runtime;

import fr.lapetina.orchestrator.domain.model.CallRequest;
import fr.lapetina.orchestrator.domain.model.ServiceInstance;

import java.util.concurrent.CompletableFuture;

/**
 * RPC layer carrying calls between services.
 */
@FunctionalInterface
public interface ServiceTransport {

    /**
     * Sends a call to an instance.
     *
     * @return future completing with the response data, or exceptionally if the call failed
     */
    CompletableFuture<Object> invoke(ServiceInstance instance, CallRequest request);
}
