package fr.lapetina.orchestrator.infrastructure.http;

import fr.lapetina.orchestrator.domain.model.HealthCheckSpec;
import fr.lapetina.orchestrator.domain.model.ServiceInstance;
import fr.lapetina.orchestrator.infrastructure.runtime.ProbeTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Probes instances with an HTTP GET on the service's health-check path.
 *
 * A 2xx answer is healthy, anything else (status, connection error) is a
 * failed probe. Instances without an address are modelled in-process and
 * always answer healthy.
 */
public final class HttpProbeTransport implements ProbeTransport {

    private static final Logger log = LoggerFactory.getLogger(HttpProbeTransport.class);

    private final HttpClient httpClient;

    public HttpProbeTransport(Duration connectTimeout) {
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .version(HttpClient.Version.HTTP_1_1)
                .build();
    }

    @Override
    public CompletableFuture<Boolean> probe(ServiceInstance instance, HealthCheckSpec healthCheck) {
        if (instance.getAddress() == null) {
            return CompletableFuture.completedFuture(true);
        }

        URI uri = resolve(instance.getAddress(), healthCheck.path());
        HttpRequest request = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(healthCheck.timeout())
                .GET()
                .build();

        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.discarding())
                .thenApply(response -> {
                    boolean healthy = response.statusCode() >= 200 && response.statusCode() < 300;
                    if (!healthy) {
                        log.debug("Probe answered unhealthy: instanceId={}, uri={}, status={}",
                                instance.getId(), uri, response.statusCode());
                    }
                    return healthy;
                });
    }

    static URI resolve(URI base, String path) {
        String basePath = base.toString();
        if (basePath.endsWith("/")) {
            basePath = basePath.substring(0, basePath.length() - 1);
        }
        return URI.create(basePath + (path.startsWith("/") ? path : "/" + path));
    }
}
