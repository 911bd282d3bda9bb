package fr.lapetina.orchestrator.infrastructure.runtime;

import fr.lapetina.orchestrator.domain.model.InstanceUsage;
import fr.lapetina.orchestrator.domain.model.ServiceInstance;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Metrics source serving the last usage each instance reported.
 */
public final class ReportedMetricsSource implements MetricsSource {

    private final Map<String, InstanceUsage> reports = new ConcurrentHashMap<>();

    public void report(String instanceId, InstanceUsage usage) {
        reports.put(instanceId, usage);
    }

    public void forget(String instanceId) {
        reports.remove(instanceId);
    }

    @Override
    public Optional<InstanceUsage> sample(ServiceInstance instance) {
        return Optional.ofNullable(reports.get(instance.getId()));
    }
}
