package fr.lapetina.orchestrator.domain.model;

import java.time.Instant;
import java.util.UUID;

/**
 * An inter-service call routed through the orchestrator.
 */
public record CallRequest(
        String requestId,
        String sourceService,
        String targetService,
        String endpoint,
        Object payload,
        Instant createdAt
) {

    public CallRequest {
        if (requestId == null || requestId.isBlank()) {
            requestId = UUID.randomUUID().toString();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    public static CallRequest of(String sourceService, String targetService, String endpoint, Object payload) {
        return new CallRequest(null, sourceService, targetService, endpoint, payload, null);
    }
}
