package fr.lapetina.orchestrator.domain.model;

import java.time.Duration;
import java.util.Objects;

/**
 * An endpoint exposed by a service.
 */
public record ServiceEndpoint(
        String path,
        HttpMethod method,
        int rateLimitPerMinute,
        boolean authenticationRequired,
        boolean cacheable,
        Duration timeout
) {

    public ServiceEndpoint {
        Objects.requireNonNull(path, "path is required");
        if (method == null) {
            method = HttpMethod.GET;
        }
        if (timeout == null) {
            timeout = Duration.ofSeconds(5);
        }
    }

    public static ServiceEndpoint of(String path, HttpMethod method) {
        return new ServiceEndpoint(path, method, 0, false, false, Duration.ofSeconds(5));
    }
}
