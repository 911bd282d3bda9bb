package fr.lapetina.orchestrator.domain.strategy;

import fr.lapetina.orchestrator.domain.model.ServiceInstance;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Least-connections load balancing strategy.
 *
 * Picks the instance with the fewest calls currently dispatched to it, then
 * the lowest observed network load. Remaining ties go to the lowest instance
 * id so the choice is deterministic.
 */
public final class LeastConnectionsStrategy implements LoadBalancingStrategy {

    @Override
    public String getName() {
        return "least_connections";
    }

    @Override
    public Optional<ServiceInstance> selectInstance(List<ServiceInstance> candidates, SelectionContext context) {
        if (candidates == null || candidates.isEmpty()) {
            return Optional.empty();
        }

        Comparator<ServiceInstance> byLoad = Comparator
                .comparingInt((ServiceInstance instance) -> context.activeCalls().applyAsInt(instance.getId()))
                .thenComparingDouble(ServiceInstance::getNetworkLoad)
                .thenComparing(ServiceInstance::getId);

        return candidates.stream().min(byLoad);
    }
}
