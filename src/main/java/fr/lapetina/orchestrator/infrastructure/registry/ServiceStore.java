package fr.lapetina.orchestrator.infrastructure.registry;

import fr.lapetina.orchestrator.domain.model.Service;

import java.util.List;
import java.util.Optional;

/**
 * Storage of service descriptors.
 *
 * Implementations must be thread-safe. Returned values are snapshots; the
 * registry never relies on reference identity between calls.
 */
public interface ServiceStore {

    void save(Service service);

    Optional<Service> find(String serviceId);

    /**
     * Returns all services ordered by id.
     */
    List<Service> findAll();

    boolean delete(String serviceId);
}
