package fr.lapetina.orchestrator.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import fr.lapetina.orchestrator.ServiceOrchestrator;
import fr.lapetina.orchestrator.api.dto.CallApiRequest;
import fr.lapetina.orchestrator.api.dto.CallApiResponse;
import fr.lapetina.orchestrator.api.dto.DeploymentApiRequest;
import fr.lapetina.orchestrator.api.dto.DeploymentView;
import fr.lapetina.orchestrator.api.dto.InstanceView;
import fr.lapetina.orchestrator.domain.exception.OrchestrationException;
import fr.lapetina.orchestrator.domain.model.CallResult;
import fr.lapetina.orchestrator.domain.model.ErrorType;
import fr.lapetina.orchestrator.domain.model.InstanceUsage;
import fr.lapetina.orchestrator.domain.model.Service;
import fr.lapetina.orchestrator.domain.model.ServiceInstance;
import fr.lapetina.orchestrator.domain.model.SystemOverview;
import fr.lapetina.orchestrator.infrastructure.config.ConfigLoader;
import fr.lapetina.orchestrator.infrastructure.config.ConfigMapper;
import fr.lapetina.orchestrator.infrastructure.config.OrchestratorConfig;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lightweight HTTP server using JDK's built-in HttpServer.
 *
 * Endpoints:
 * - POST /v1/deployments - Submit a deployment
 * - GET /v1/deployments/{id} - Deployment status
 * - POST /v1/deployments/{id}/cancel - Cancel a running deployment
 * - POST /v1/deployments/{id}/rollback - Restore the previous version
 * - POST /v1/services/{id}/autoscaling - Enable auto-scaling
 * - DELETE /v1/services/{id}/autoscaling - Disable auto-scaling
 * - GET /v1/services - List services with instance counts and traffic
 * - GET /v1/services/{id}/instances - List instances of a service
 * - POST /v1/calls - Route an inter-service call
 * - POST /v1/instances/{id}/usage - Report instance resource usage
 * - GET /v1/overview - Fleet-wide overview
 * - GET /health - Health check endpoint
 * - GET /metrics - Prometheus metrics endpoint
 * - POST /admin/reload - Reload configuration
 */
public final class HttpServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    private static final Pattern DEPLOYMENT_PATH = Pattern.compile("^/v1/deployments/([^/]+)(/cancel|/rollback)?$");
    private static final Pattern AUTOSCALING_PATH = Pattern.compile("^/v1/services/([^/]+)/autoscaling$");
    private static final Pattern INSTANCES_PATH = Pattern.compile("^/v1/services/([^/]+)/instances$");
    private static final Pattern USAGE_PATH = Pattern.compile("^/v1/instances/([^/]+)/usage$");

    private final com.sun.net.httpserver.HttpServer server;
    private final ExecutorService executor;
    private final ObjectMapper objectMapper;
    private final ServiceOrchestrator orchestrator;
    private final ConfigLoader configLoader;
    private final boolean metricsEnabled;

    public HttpServer(
            OrchestratorConfig.ServerConfig serverConfig,
            boolean metricsEnabled,
            ServiceOrchestrator orchestrator,
            ConfigLoader configLoader
    ) throws IOException {
        this.orchestrator = orchestrator;
        this.configLoader = configLoader;
        this.metricsEnabled = metricsEnabled;

        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        InetSocketAddress address = serverConfig.getHost() != null
                ? new InetSocketAddress(serverConfig.getHost(), serverConfig.getPort())
                : new InetSocketAddress(serverConfig.getPort());
        this.server = com.sun.net.httpserver.HttpServer.create(address, serverConfig.getBacklog());

        AtomicInteger threadCount = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(serverConfig.getThreads(), r -> {
            Thread t = new Thread(r, "http-" + threadCount.getAndIncrement());
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(executor);

        server.createContext("/v1/deployments", new DeploymentHandler());
        server.createContext("/v1/services", new ServiceHandler());
        server.createContext("/v1/calls", new CallHandler());
        server.createContext("/v1/instances", new InstanceHandler());
        server.createContext("/v1/overview", new OverviewHandler());
        server.createContext("/health", new HealthHandler());
        server.createContext("/metrics", new MetricsHandler());
        server.createContext("/admin", new AdminHandler());

        log.info("HTTP server configured on port {}", serverConfig.getPort());
    }

    public void start() {
        server.start();
        log.info("HTTP server started");
    }

    /**
     * Port the server is bound to, useful when configured with port 0.
     */
    public int getPort() {
        return server.getAddress().getPort();
    }

    @Override
    public void close() {
        server.stop(5);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("HTTP server stopped");
    }

    /**
     * Base handler mapping domain failures onto HTTP statuses.
     */
    private abstract class JsonHandler implements HttpHandler {

        @Override
        public final void handle(HttpExchange exchange) throws IOException {
            try {
                route(exchange, exchange.getRequestURI().getPath(), exchange.getRequestMethod());
            } catch (OrchestrationException e) {
                sendError(exchange, statusFor(e.getErrorType()), e.getErrorType().reason(), e.getMessage());
            } catch (JsonProcessingException e) {
                sendError(exchange, 400, ErrorType.VALIDATION_ERROR.reason(),
                        "Malformed JSON body: " + e.getOriginalMessage());
            } catch (IllegalArgumentException | ConfigLoader.ConfigurationException e) {
                sendError(exchange, 400, ErrorType.VALIDATION_ERROR.reason(), e.getMessage());
            } catch (Exception e) {
                log.error("Error handling request: method={}, path={}",
                        exchange.getRequestMethod(), exchange.getRequestURI().getPath(), e);
                sendError(exchange, 500, ErrorType.INTERNAL_ERROR.reason(), "Internal server error: " + e.getMessage());
            }
        }

        abstract void route(HttpExchange exchange, String path, String method) throws Exception;
    }

    // ==================== DEPLOYMENT HANDLER ====================

    private class DeploymentHandler extends JsonHandler {
        @Override
        void route(HttpExchange exchange, String path, String method) throws Exception {
            if (path.equals("/v1/deployments") && "POST".equals(method)) {
                DeploymentApiRequest request = readBody(exchange, DeploymentApiRequest.class);
                String deploymentId = orchestrator.deployService(request.toDeploymentRequest());
                sendJson(exchange, 202, DeploymentView.fromRecord(orchestrator.getDeploymentStatus(deploymentId)));
                return;
            }

            Matcher matcher = DEPLOYMENT_PATH.matcher(path);
            if (!matcher.matches()) {
                sendError(exchange, 404, ErrorType.NOT_FOUND.reason(), "Not Found");
                return;
            }
            String deploymentId = matcher.group(1);
            String action = matcher.group(2);

            if (action == null && "GET".equals(method)) {
                sendJson(exchange, 200, DeploymentView.fromRecord(orchestrator.getDeploymentStatus(deploymentId)));
            } else if ("/cancel".equals(action) && "POST".equals(method)) {
                boolean cancelled = orchestrator.cancelDeployment(deploymentId);
                sendJson(exchange, cancelled ? 202 : 409, Map.of(
                        "deployment_id", deploymentId,
                        "cancelled", cancelled
                ));
            } else if ("/rollback".equals(action) && "POST".equals(method)) {
                orchestrator.rollback(deploymentId);
                sendJson(exchange, 202, DeploymentView.fromRecord(orchestrator.getDeploymentStatus(deploymentId)));
            } else {
                sendError(exchange, 405, ErrorType.VALIDATION_ERROR.reason(), "Method Not Allowed");
            }
        }
    }

    // ==================== SERVICE HANDLER ====================

    private class ServiceHandler extends JsonHandler {
        @Override
        void route(HttpExchange exchange, String path, String method) throws Exception {
            if (path.equals("/v1/services") && "GET".equals(method)) {
                handleListServices(exchange);
                return;
            }

            Matcher instances = INSTANCES_PATH.matcher(path);
            if (instances.matches() && "GET".equals(method)) {
                List<InstanceView> views = orchestrator.getInstances(instances.group(1)).stream()
                        .map(InstanceView::fromInstance)
                        .toList();
                sendJson(exchange, 200, views);
                return;
            }

            Matcher autoscaling = AUTOSCALING_PATH.matcher(path);
            if (autoscaling.matches()) {
                String serviceId = autoscaling.group(1);
                if ("POST".equals(method)) {
                    OrchestratorConfig.AutoScalingEntry entry = readBody(exchange, OrchestratorConfig.AutoScalingEntry.class);
                    entry.setServiceId(serviceId);
                    if (!orchestrator.enableAutoScaling(serviceId, ConfigMapper.toAutoScalingPolicy(entry))) {
                        sendError(exchange, 404, ErrorType.NOT_FOUND.reason(), "Service not found: " + serviceId);
                        return;
                    }
                    sendJson(exchange, 200, Map.of("service_id", serviceId, "auto_scaling", "enabled"));
                } else if ("DELETE".equals(method)) {
                    boolean disabled = orchestrator.disableAutoScaling(serviceId);
                    sendJson(exchange, 200, Map.of("service_id", serviceId, "auto_scaling",
                            disabled ? "disabled" : "not_enabled"));
                } else {
                    sendError(exchange, 405, ErrorType.VALIDATION_ERROR.reason(), "Method Not Allowed");
                }
                return;
            }

            sendError(exchange, 404, ErrorType.NOT_FOUND.reason(), "Not Found");
        }

        private void handleListServices(HttpExchange exchange) throws IOException {
            List<Map<String, Object>> services = new ArrayList<>();
            for (Service service : orchestrator.getServices()) {
                List<ServiceInstance> instances = orchestrator.getInstances(service.getId());
                Map<String, Object> info = new LinkedHashMap<>();
                info.put("id", service.getId());
                info.put("name", service.getName());
                info.put("version", service.getVersion());
                info.put("dependencies", service.getDependencies());
                info.put("instances", instances.size());
                info.put("healthy_instances", instances.stream().filter(ServiceInstance::isHealthy).count());
                info.put("metrics", orchestrator.getServiceMetrics(service.getId()));
                services.add(info);
            }
            sendJson(exchange, 200, services);
        }
    }

    // ==================== CALL HANDLER ====================

    private class CallHandler extends JsonHandler {
        @Override
        void route(HttpExchange exchange, String path, String method) throws Exception {
            if (!"POST".equals(method)) {
                sendError(exchange, 405, ErrorType.VALIDATION_ERROR.reason(), "Method Not Allowed");
                return;
            }

            CallApiRequest request = readBody(exchange, CallApiRequest.class);
            String source = request.getSourceService();
            String sourceHeader = exchange.getRequestHeaders().getFirst("X-Source-Service");
            if (source == null && sourceHeader != null) {
                source = sourceHeader;
            }

            MDC.put("sourceService", String.valueOf(source));
            MDC.put("targetService", String.valueOf(request.getTargetService()));
            try {
                CallResult result = orchestrator.callService(
                        source, request.getTargetService(), request.getEndpoint(), request.getPayload());
                int statusCode = result.success() ? 200 : statusFor(result.errorType());
                sendJson(exchange, statusCode, CallApiResponse.fromCallResult(result));
            } finally {
                MDC.clear();
            }
        }
    }

    // ==================== INSTANCE HANDLER ====================

    private class InstanceHandler extends JsonHandler {
        @Override
        void route(HttpExchange exchange, String path, String method) throws Exception {
            Matcher matcher = USAGE_PATH.matcher(path);
            if (!matcher.matches()) {
                sendError(exchange, 404, ErrorType.NOT_FOUND.reason(), "Not Found");
                return;
            }
            if (!"POST".equals(method)) {
                sendError(exchange, 405, ErrorType.VALIDATION_ERROR.reason(), "Method Not Allowed");
                return;
            }

            String instanceId = matcher.group(1);
            InstanceUsage usage = readBody(exchange, InstanceUsage.class);
            orchestrator.reportUsage(instanceId, usage);
            sendJson(exchange, 200, Map.of("instance_id", instanceId, "usage", usage));
        }
    }

    // ==================== OVERVIEW HANDLER ====================

    private class OverviewHandler extends JsonHandler {
        @Override
        void route(HttpExchange exchange, String path, String method) throws Exception {
            if (!"GET".equals(method)) {
                sendError(exchange, 405, ErrorType.VALIDATION_ERROR.reason(), "Method Not Allowed");
                return;
            }
            sendJson(exchange, 200, orchestrator.getSystemOverview());
        }
    }

    // ==================== HEALTH HANDLER ====================

    private class HealthHandler extends JsonHandler {
        @Override
        void route(HttpExchange exchange, String path, String method) throws Exception {
            if (!"GET".equals(method)) {
                sendError(exchange, 405, ErrorType.VALIDATION_ERROR.reason(), "Method Not Allowed");
                return;
            }

            SystemOverview overview = orchestrator.getSystemOverview();
            String status = determineOverallHealth(overview);

            Map<String, Object> health = new LinkedHashMap<>();
            health.put("status", status);
            health.put("timestamp", orchestrator.getClock().millis());
            health.put("services", overview.serviceCount());
            health.put("healthy_services", overview.healthyServiceCount());
            health.put("instances", overview.instanceCount());
            health.put("healthy_instances", overview.healthyInstanceCount());

            int statusCode = "DOWN".equals(status) ? 503 : 200;
            sendJson(exchange, statusCode, health);
        }

        private String determineOverallHealth(SystemOverview overview) {
            if (overview.serviceCount() == 0) {
                return "UP";
            }
            if (overview.healthyServiceCount() == 0) {
                return "DOWN";
            } else if (overview.healthyServiceCount() < overview.serviceCount()) {
                return "DEGRADED";
            }
            return "UP";
        }
    }

    // ==================== METRICS HANDLER ====================

    private class MetricsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, ErrorType.VALIDATION_ERROR.reason(), "Method Not Allowed");
                return;
            }
            if (!metricsEnabled) {
                sendError(exchange, 404, ErrorType.NOT_FOUND.reason(), "Metrics disabled");
                return;
            }

            String metrics = orchestrator.getMetricsRegistry().scrape();
            exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4");
            byte[] bytes = metrics.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        }
    }

    // ==================== ADMIN HANDLER ====================

    private class AdminHandler extends JsonHandler {
        @Override
        void route(HttpExchange exchange, String path, String method) throws Exception {
            if (path.equals("/admin/reload") && "POST".equals(method)) {
                OrchestratorConfig newConfig = configLoader.reload();
                sendJson(exchange, 200, Map.of(
                        "message", "Configuration reloaded",
                        "load_balancers", newConfig.getLoadBalancers().size(),
                        "policies", newConfig.getPolicies().size()
                ));
            } else {
                sendError(exchange, 404, ErrorType.NOT_FOUND.reason(), "Not Found");
            }
        }
    }

    // ==================== HELPER METHODS ====================

    static int statusFor(ErrorType errorType) {
        if (errorType == null) return 500;
        return switch (errorType) {
            case VALIDATION_ERROR -> 400;
            case AUTHORIZATION_DENIED -> 403;
            case NOT_FOUND -> 404;
            case CONFLICT -> 409;
            case RATE_LIMIT_EXCEEDED -> 429;
            case SERVICE_ERROR -> 502;
            case NO_HEALTHY_INSTANCE, CIRCUIT_OPEN, CAPACITY -> 503;
            case TIMEOUT -> 504;
            default -> 500;
        };
    }

    private <T> T readBody(HttpExchange exchange, Class<T> type) throws IOException {
        try (InputStream is = exchange.getRequestBody()) {
            T body = objectMapper.readValue(is, type);
            if (body == null) {
                throw new IllegalArgumentException("Request body is required");
            }
            return body;
        }
    }

    private void sendJson(HttpExchange exchange, int statusCode, Object body) throws IOException {
        byte[] bytes = objectMapper.writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(statusCode, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private void sendError(HttpExchange exchange, int statusCode, String error, String message) throws IOException {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("message", message);
        sendJson(exchange, statusCode, body);
    }
}
