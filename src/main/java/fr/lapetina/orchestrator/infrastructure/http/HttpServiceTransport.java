package fr.lapetina.orchestrator.infrastructure.http;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import fr.lapetina.orchestrator.domain.exception.OrchestrationException;
import fr.lapetina.orchestrator.domain.model.CallRequest;
import fr.lapetina.orchestrator.domain.model.ErrorType;
import fr.lapetina.orchestrator.domain.model.ServiceInstance;
import fr.lapetina.orchestrator.infrastructure.runtime.ServiceTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Carries inter-service calls as JSON over HTTP.
 *
 * The payload is POSTed to the instance address plus the call endpoint.
 * A 2xx answer completes with the parsed JSON body; other statuses fail with
 * a ServiceError. Instances without an address are modelled in-process and
 * answer with an acknowledgement naming the serving instance.
 */
public final class HttpServiceTransport implements ServiceTransport {

    private static final Logger log = LoggerFactory.getLogger(HttpServiceTransport.class);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public HttpServiceTransport(Duration connectTimeout) {
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .version(HttpClient.Version.HTTP_1_1)
                .build();

        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Override
    public CompletableFuture<Object> invoke(ServiceInstance instance, CallRequest request) {
        if (instance.getAddress() == null) {
            return CompletableFuture.completedFuture(
                    Map.of("message", "Service call successful", "instance", instance.getId()));
        }

        HttpRequest httpRequest;
        try {
            httpRequest = HttpRequest.newBuilder()
                    .uri(HttpProbeTransport.resolve(instance.getAddress(), request.endpoint()))
                    .header("Content-Type", "application/json")
                    .header("X-Request-ID", request.requestId())
                    .header("X-Source-Service", request.sourceService())
                    .POST(HttpRequest.BodyPublishers.ofString(
                            request.payload() != null ? objectMapper.writeValueAsString(request.payload()) : "{}"))
                    .build();
        } catch (JsonProcessingException | IllegalArgumentException e) {
            return CompletableFuture.failedFuture(new OrchestrationException(ErrorType.VALIDATION_ERROR,
                    "Cannot build request to " + instance.getId() + ": " + e.getMessage(), e));
        }

        log.debug("Sending call: requestId={}, instanceId={}, uri={}",
                request.requestId(), instance.getId(), httpRequest.uri());

        return httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofString())
                .thenApply(response -> handleResponse(instance, request, response));
    }

    private Object handleResponse(ServiceInstance instance, CallRequest request, HttpResponse<String> response) {
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            log.debug("Call answered with HTTP error: requestId={}, instanceId={}, status={}",
                    request.requestId(), instance.getId(), status);
            throw new OrchestrationException(ErrorType.SERVICE_ERROR,
                    "Instance " + instance.getId() + " answered HTTP " + status);
        }
        String body = response.body();
        if (body == null || body.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(body, Object.class);
        } catch (JsonProcessingException e) {
            // Non-JSON answers are passed through as text
            return body;
        }
    }
}
