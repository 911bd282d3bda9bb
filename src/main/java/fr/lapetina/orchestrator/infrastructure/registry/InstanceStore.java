package fr.lapetina.orchestrator.infrastructure.registry;

import fr.lapetina.orchestrator.domain.model.ServiceInstance;

import java.util.List;
import java.util.Optional;

/**
 * Storage of service instances.
 *
 * Implementations must be thread-safe. Returned values are snapshots.
 */
public interface InstanceStore {

    void save(ServiceInstance instance);

    /**
     * Saves an instance only if no instance with the same id exists, atomically.
     *
     * @return false if the id is already taken
     */
    boolean saveIfAbsent(ServiceInstance instance);

    Optional<ServiceInstance> find(String instanceId);

    /**
     * Returns the instances of a service ordered by instance id.
     */
    List<ServiceInstance> findByService(String serviceId);

    boolean delete(String instanceId);
}
