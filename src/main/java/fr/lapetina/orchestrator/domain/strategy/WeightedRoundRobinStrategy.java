package fr.lapetina.orchestrator.domain.strategy;

import fr.lapetina.orchestrator.domain.model.ServiceInstance;

import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

/**
 * CPU-weighted load balancing strategy.
 *
 * Each candidate weighs {@code max(1, 100 - cpu%)}; a uniform draw over the
 * cumulative weights picks the instance. Busy instances are chosen less
 * often but never starved.
 */
public final class WeightedRoundRobinStrategy implements LoadBalancingStrategy {

    private static final double MIN_WEIGHT = 1.0;

    private final Supplier<Random> random;

    public WeightedRoundRobinStrategy() {
        this(ThreadLocalRandom::current);
    }

    /**
     * Creates a strategy drawing from the given source, for reproducible selection.
     */
    public WeightedRoundRobinStrategy(Random random) {
        this(() -> random);
    }

    private WeightedRoundRobinStrategy(Supplier<Random> random) {
        this.random = random;
    }

    @Override
    public String getName() {
        return "weighted_round_robin";
    }

    @Override
    public Optional<ServiceInstance> selectInstance(List<ServiceInstance> candidates, SelectionContext context) {
        if (candidates == null || candidates.isEmpty()) {
            return Optional.empty();
        }

        double[] cumulative = new double[candidates.size()];
        double total = 0;
        for (int i = 0; i < candidates.size(); i++) {
            total += weightOf(candidates.get(i));
            cumulative[i] = total;
        }

        double draw = nextDouble() * total;
        for (int i = 0; i < cumulative.length; i++) {
            if (draw < cumulative[i]) {
                return Optional.of(candidates.get(i));
            }
        }
        return Optional.of(candidates.get(candidates.size() - 1));
    }

    /**
     * Selection weight of an instance.
     */
    public static double weightOf(ServiceInstance instance) {
        return Math.max(MIN_WEIGHT, 100.0 - instance.getCpuPercent());
    }

    private double nextDouble() {
        Random source = random.get();
        // Shared seeded sources are not thread-safe on their own
        synchronized (source) {
            return source.nextDouble();
        }
    }
}
