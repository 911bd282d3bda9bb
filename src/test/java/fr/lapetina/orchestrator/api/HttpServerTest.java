package fr.lapetina.orchestrator.api;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.orchestrator.domain.model.ErrorType;
import fr.lapetina.orchestrator.infrastructure.config.ConfigLoader;
import fr.lapetina.orchestrator.integration.TestOrchestratorFactory;
import fr.lapetina.orchestrator.integration.TestOrchestratorFactory.TestOrchestrator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class HttpServerTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final HttpClient client = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(2))
            .build();

    private TestOrchestrator harness;
    private HttpServer server;
    private String baseUrl;

    @BeforeEach
    void setUp() throws Exception {
        harness = TestOrchestratorFactory.create();
        ConfigLoader configLoader = new ConfigLoader("test-config.yaml");
        configLoader.load();
        server = new HttpServer(harness.config().getServer(), true, harness.orchestrator(), configLoader);
        server.start();
        baseUrl = "http://127.0.0.1:" + server.getPort();
    }

    @AfterEach
    void tearDown() {
        server.close();
        harness.close();
    }

    @Nested
    @DisplayName("Calls")
    class CallTests {

        @Test
        @DisplayName("should route a call and return the serving instance")
        void shouldRouteCall() throws Exception {
            harness.markHealthy("auth-1");

            HttpResponse<String> response = post("/v1/calls",
                    "{\"source_service\":\"web\",\"target_service\":\"auth\",\"endpoint\":\"/login\",\"payload\":{\"user\":\"alice\"}}");

            assertThat(response.statusCode()).isEqualTo(200);
            Map<String, Object> body = json(response);
            assertThat(body).containsEntry("success", true).containsEntry("instance_id", "auth-1");
            assertThat(body).containsKey("request_id").doesNotContainKey("error");
        }

        @Test
        @DisplayName("should take the source service from the header")
        void shouldTakeSourceFromHeader() throws Exception {
            harness.markHealthy("orders-4");

            HttpRequest request = HttpRequest.newBuilder(URI.create(baseUrl + "/v1/calls"))
                    .header("Content-Type", "application/json")
                    .header("X-Source-Service", "web")
                    .POST(HttpRequest.BodyPublishers.ofString("{\"target_service\":\"orders\",\"endpoint\":\"/orders\"}"))
                    .build();
            HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());

            assertThat(response.statusCode()).isEqualTo(200);
        }

        @Test
        @DisplayName("should map authorization denial to 403")
        void shouldMapDenialTo403() throws Exception {
            harness.markHealthy("orders-4");

            HttpResponse<String> response = post("/v1/calls",
                    "{\"source_service\":\"billing\",\"target_service\":\"orders\",\"endpoint\":\"/orders\"}");

            assertThat(response.statusCode()).isEqualTo(403);
            assertThat(json(response)).containsEntry("error", "AuthorizationDenied");
        }

        @Test
        @DisplayName("should map an unroutable service to 503")
        void shouldMapNoHealthyInstanceTo503() throws Exception {
            HttpResponse<String> response = post("/v1/calls",
                    "{\"source_service\":\"web\",\"target_service\":\"auth\",\"endpoint\":\"/login\"}");

            assertThat(response.statusCode()).isEqualTo(503);
            assertThat(json(response)).containsEntry("error", "NoHealthyInstance");
        }

        @Test
        @DisplayName("should reject malformed JSON with 400")
        void shouldRejectMalformedJson() throws Exception {
            HttpResponse<String> response = post("/v1/calls", "{not json");

            assertThat(response.statusCode()).isEqualTo(400);
            assertThat(json(response)).containsEntry("error", "ValidationError");
        }

        @Test
        @DisplayName("should reject other methods with 405")
        void shouldRejectGet() throws Exception {
            HttpResponse<String> response = get("/v1/calls");

            assertThat(response.statusCode()).isEqualTo(405);
        }
    }

    @Nested
    @DisplayName("Services and instances")
    class ServiceTests {

        @Test
        @DisplayName("should list services with instance counts")
        void shouldListServices() throws Exception {
            harness.markHealthy("auth-1");

            HttpResponse<String> response = get("/v1/services");

            assertThat(response.statusCode()).isEqualTo(200);
            List<Map<String, Object>> services = mapper.readValue(response.body(), new TypeReference<>() {
            });
            assertThat(services).hasSize(2);
            Map<String, Object> auth = services.stream()
                    .filter(service -> "auth".equals(service.get("id")))
                    .findFirst()
                    .orElseThrow();
            assertThat(auth).containsEntry("instances", 3).containsEntry("healthy_instances", 1);
        }

        @Test
        @DisplayName("should return 404 for the instances of an unknown service")
        void shouldReturn404ForUnknownService() throws Exception {
            HttpResponse<String> response = get("/v1/services/payments/instances");

            assertThat(response.statusCode()).isEqualTo(404);
            assertThat(json(response)).containsEntry("error", "NotFound");
        }

        @Test
        @DisplayName("should accept reported usage")
        void shouldAcceptUsage() throws Exception {
            HttpResponse<String> response = post("/v1/instances/auth-2/usage",
                    "{\"cpuPercent\":55.0,\"memoryMb\":300.0,\"networkLoad\":1.5}");

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(harness.orchestrator().getRegistry().findInstance("auth-2").orElseThrow().getCpuPercent())
                    .isEqualTo(55.0);
        }

        @Test
        @DisplayName("should return 404 for usage of an unknown instance")
        void shouldReturn404ForUnknownInstance() throws Exception {
            HttpResponse<String> response = post("/v1/instances/auth-99/usage",
                    "{\"cpuPercent\":1.0,\"memoryMb\":1.0,\"networkLoad\":1.0}");

            assertThat(response.statusCode()).isEqualTo(404);
        }

        @Test
        @DisplayName("should toggle auto-scaling")
        void shouldToggleAutoScaling() throws Exception {
            HttpResponse<String> enabled = post("/v1/services/auth/autoscaling",
                    "{\"minInstances\":1,\"maxInstances\":4,\"checkIntervalMs\":3600000}");
            assertThat(enabled.statusCode()).isEqualTo(200);
            assertThat(harness.orchestrator().getAutoScaler().policyFor("auth")).isPresent();

            HttpRequest delete = HttpRequest.newBuilder(URI.create(baseUrl + "/v1/services/auth/autoscaling"))
                    .DELETE()
                    .build();
            HttpResponse<String> disabled = client.send(delete, HttpResponse.BodyHandlers.ofString());
            assertThat(json(disabled)).containsEntry("auto_scaling", "disabled");
        }
    }

    @Nested
    @DisplayName("Health and overview")
    class HealthTests {

        @Test
        @DisplayName("should report DOWN while no service is healthy")
        void shouldReportDown() throws Exception {
            HttpResponse<String> response = get("/health");

            assertThat(response.statusCode()).isEqualTo(503);
            assertThat(json(response)).containsEntry("status", "DOWN");
        }

        @Test
        @DisplayName("should report DEGRADED while some services are healthy")
        void shouldReportDegraded() throws Exception {
            harness.markHealthy("auth-1");

            HttpResponse<String> response = get("/health");

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(json(response))
                    .containsEntry("status", "DEGRADED")
                    .containsEntry("healthy_instances", 1);
        }

        @Test
        @DisplayName("should serve the system overview")
        void shouldServeOverview() throws Exception {
            HttpResponse<String> response = get("/v1/overview");

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(json(response))
                    .containsEntry("serviceCount", 2)
                    .containsEntry("instanceCount", 4);
        }

        @Test
        @DisplayName("should expose Prometheus metrics")
        void shouldExposeMetrics() throws Exception {
            HttpResponse<String> response = get("/metrics");

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(response.headers().firstValue("Content-Type")).hasValueSatisfying(
                    type -> assertThat(type).startsWith("text/plain"));
        }
    }

    @Nested
    @DisplayName("Status mapping")
    class StatusMappingTests {

        @Test
        @DisplayName("should map error types to HTTP statuses")
        void shouldMapErrorTypes() {
            assertThat(HttpServer.statusFor(ErrorType.VALIDATION_ERROR)).isEqualTo(400);
            assertThat(HttpServer.statusFor(ErrorType.AUTHORIZATION_DENIED)).isEqualTo(403);
            assertThat(HttpServer.statusFor(ErrorType.NOT_FOUND)).isEqualTo(404);
            assertThat(HttpServer.statusFor(ErrorType.CONFLICT)).isEqualTo(409);
            assertThat(HttpServer.statusFor(ErrorType.RATE_LIMIT_EXCEEDED)).isEqualTo(429);
            assertThat(HttpServer.statusFor(ErrorType.SERVICE_ERROR)).isEqualTo(502);
            assertThat(HttpServer.statusFor(ErrorType.CIRCUIT_OPEN)).isEqualTo(503);
            assertThat(HttpServer.statusFor(ErrorType.TIMEOUT)).isEqualTo(504);
            assertThat(HttpServer.statusFor(ErrorType.DEPLOYMENT_TIMEOUT)).isEqualTo(500);
            assertThat(HttpServer.statusFor(null)).isEqualTo(500);
        }
    }

    private HttpResponse<String> get(String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(URI.create(baseUrl + path)).GET().build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> post(String path, String body) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(URI.create(baseUrl + path))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private Map<String, Object> json(HttpResponse<String> response) throws Exception {
        return mapper.readValue(response.body(), new TypeReference<>() {
        });
    }
}
