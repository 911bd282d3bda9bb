package fr.lapetina.orchestrator.support;

import fr.lapetina.orchestrator.domain.model.HealthCheckSpec;
import fr.lapetina.orchestrator.domain.model.InstanceState;
import fr.lapetina.orchestrator.domain.model.ResourceAllocation;
import fr.lapetina.orchestrator.domain.model.Service;
import fr.lapetina.orchestrator.domain.model.ServiceInstance;

import java.time.Duration;
import java.time.Instant;

/**
 * Builders for the services and instances tests share.
 */
public final class Fixtures {

    private Fixtures() {
    }

    public static Service service(String id, String version) {
        return Service.builder()
                .id(id)
                .name(id + "-service")
                .version(version)
                .resources(new ResourceAllocation(0.5, 1.0, 256, 1000, 1, 100))
                .healthCheck(new HealthCheckSpec("/health", Duration.ofSeconds(10), Duration.ofSeconds(1), 1, 2))
                .build();
    }

    public static ServiceInstance instance(String id, String serviceId, String version, InstanceState state) {
        return ServiceInstance.builder()
                .id(id)
                .serviceId(serviceId)
                .nodeId("node-1")
                .version(version)
                .state(state)
                .startedAt(Instant.parse("2024-01-01T00:00:00Z"))
                .build();
    }

    public static ServiceInstance healthy(String id, String serviceId) {
        return instance(id, serviceId, "1.0.0", InstanceState.HEALTHY);
    }
}
