package fr.lapetina.orchestrator.infrastructure.runtime;

import fr.lapetina.orchestrator.domain.model.InstanceUsage;
import fr.lapetina.orchestrator.domain.model.ServiceInstance;

import java.util.Optional;

/**
 * Source of CPU, memory and network figures per instance.
 */
@FunctionalInterface
public interface MetricsSource {

    /**
     * Returns the latest usage of an instance, empty if none is known.
     */
    Optional<InstanceUsage> sample(ServiceInstance instance);
}
