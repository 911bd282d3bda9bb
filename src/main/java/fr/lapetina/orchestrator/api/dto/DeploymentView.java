package fr.lapetina.orchestrator.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import fr.lapetina.orchestrator.domain.model.DeploymentRecord;

import java.time.Instant;
import java.util.List;

/**
 * JSON view of a deployment record.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DeploymentView(
        String id,
        @JsonProperty("service_id") String serviceId,
        String version,
        String strategy,
        String status,
        @JsonProperty("start_time") Instant startTime,
        @JsonProperty("end_time") Instant endTime,
        @JsonProperty("rollback_version") String rollbackVersion,
        String error,
        @JsonProperty("error_message") String errorMessage,
        @JsonProperty("instance_ids") List<String> instanceIds
) {

    public static DeploymentView fromRecord(DeploymentRecord record) {
        return new DeploymentView(
                record.id(),
                record.serviceId(),
                record.version(),
                record.strategy().wireName(),
                record.status().wireName(),
                record.startTime(),
                record.endTime(),
                record.rollbackVersion(),
                record.errorType() != null ? record.errorType().reason() : null,
                record.error(),
                record.instanceIds()
        );
    }
}
