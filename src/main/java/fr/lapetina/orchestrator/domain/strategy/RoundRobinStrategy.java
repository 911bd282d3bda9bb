package fr.lapetina.orchestrator.domain.strategy;

import fr.lapetina.orchestrator.domain.model.ServiceInstance;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Round-robin load balancing strategy.
 *
 * Cycles through the candidate list with one cursor per routing key, so
 * {@code n} consecutive selections over {@code n} stable candidates visit
 * each exactly once.
 *
 * Thread-safe via atomic counters.
 */
public final class RoundRobinStrategy implements LoadBalancingStrategy {

    private final Map<String, AtomicInteger> cursors = new ConcurrentHashMap<>();

    @Override
    public String getName() {
        return "round_robin";
    }

    @Override
    public Optional<ServiceInstance> selectInstance(List<ServiceInstance> candidates, SelectionContext context) {
        if (candidates == null || candidates.isEmpty()) {
            return Optional.empty();
        }

        AtomicInteger cursor = cursors.computeIfAbsent(context.routingKey(), key -> new AtomicInteger(0));
        int index = Math.floorMod(cursor.getAndIncrement(), candidates.size());
        return Optional.of(candidates.get(index));
    }
}
