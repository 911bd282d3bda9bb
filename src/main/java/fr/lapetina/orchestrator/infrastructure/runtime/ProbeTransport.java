package fr.lapetina.orchestrator.infrastructure.runtime;

import fr.lapetina.orchestrator.domain.model.HealthCheckSpec;
import fr.lapetina.orchestrator.domain.model.ServiceInstance;

import java.util.concurrent.CompletableFuture;

/**
 * Transport used by the health monitor to probe instances.
 */
@FunctionalInterface
public interface ProbeTransport {

    /**
     * Probes an instance.
     *
     * @return future completing with true if the instance answered healthy; a
     *         false result and an exceptional completion both count as a failed probe
     */
    CompletableFuture<Boolean> probe(ServiceInstance instance, HealthCheckSpec healthCheck);
}
