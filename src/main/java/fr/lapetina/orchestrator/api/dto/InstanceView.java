package fr.lapetina.orchestrator.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import fr.lapetina.orchestrator.domain.model.ServiceInstance;

import java.time.Instant;

/**
 * JSON view of a service instance.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record InstanceView(
        String id,
        @JsonProperty("service_id") String serviceId,
        @JsonProperty("node_id") String nodeId,
        String version,
        String state,
        @JsonProperty("cpu_percent") double cpuPercent,
        @JsonProperty("memory_mb") double memoryMb,
        @JsonProperty("network_load") double networkLoad,
        @JsonProperty("started_at") Instant startedAt,
        @JsonProperty("last_health_check") Instant lastHealthCheck,
        String address
) {

    public static InstanceView fromInstance(ServiceInstance instance) {
        return new InstanceView(
                instance.getId(),
                instance.getServiceId(),
                instance.getNodeId(),
                instance.getVersion(),
                instance.getState().wireName(),
                instance.getCpuPercent(),
                instance.getMemoryMb(),
                instance.getNetworkLoad(),
                instance.getStartedAt(),
                instance.getLastHealthCheck(),
                instance.getAddress() != null ? instance.getAddress().toString() : null
        );
    }
}
