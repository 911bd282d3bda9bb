package fr.lapetina.orchestrator.domain.strategy;

import fr.lapetina.orchestrator.domain.model.ServiceInstance;

import java.util.List;
import java.util.Optional;

/**
 * Strategy interface for selecting one instance among the routable instances
 * of a service.
 *
 * Implementations must be thread-safe: they are called from pipeline
 * threads and API threads concurrently. Candidates arrive ordered by
 * instance id.
 */
public interface LoadBalancingStrategy {

    /**
     * Returns the name of this strategy for configuration and metrics.
     */
    String getName();

    /**
     * Selects an instance.
     *
     * @param candidates routable instances, ordered by id
     * @param context    routing key and live connection counts
     * @return selected instance, or empty if there is no candidate
     */
    Optional<ServiceInstance> selectInstance(List<ServiceInstance> candidates, SelectionContext context);
}
