package fr.lapetina.orchestrator;

import fr.lapetina.orchestrator.api.HttpServer;
import fr.lapetina.orchestrator.infrastructure.config.ConfigLoader;
import fr.lapetina.orchestrator.infrastructure.config.OrchestratorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Main entry point for the Service Orchestrator.
 */
public class OrchestratorApplication implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorApplication.class);

    private final ConfigLoader configLoader;
    private final OrchestratorConfig config;
    private final ServiceOrchestrator orchestrator;
    private final HttpServer httpServer;
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);

    public OrchestratorApplication(String configPath) throws Exception {
        log.info("Starting Service Orchestrator...");

        this.configLoader = new ConfigLoader(configPath);
        this.config = configLoader.load();

        this.orchestrator = ServiceOrchestrator.builder()
                .fromConfig(config)
                .build()
                .start();

        configLoader.addListener(orchestrator);
        configLoader.startWatching();

        this.httpServer = new HttpServer(
                config.getServer(),
                config.getMetrics().isEnabled(),
                orchestrator,
                configLoader
        );

        log.info("Service Orchestrator initialized");
    }

    public void start() {
        httpServer.start();
        log.info("Service Orchestrator started on port {}", httpServer.getPort());
    }

    public void awaitShutdown() throws InterruptedException {
        shutdownLatch.await();
    }

    public void requestShutdown() {
        shutdownLatch.countDown();
    }

    public ServiceOrchestrator getOrchestrator() {
        return orchestrator;
    }

    @Override
    public void close() {
        log.info("Shutting down Service Orchestrator...");

        try {
            httpServer.close();
        } catch (Exception e) {
            log.warn("Error closing HTTP server", e);
        }

        try {
            configLoader.close();
        } catch (Exception e) {
            log.warn("Error closing config loader", e);
        }

        try {
            orchestrator.close();
        } catch (Exception e) {
            log.warn("Error closing orchestrator", e);
        }

        log.info("Service Orchestrator shut down");
    }

    public static void main(String[] args) {
        String configPath = args.length > 0 ? args[0] : "config.yaml";

        try {
            OrchestratorApplication app = new OrchestratorApplication(configPath);

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                app.requestShutdown();
                app.close();
            }));

            app.start();
            app.awaitShutdown();

        } catch (Exception e) {
            log.error("Failed to start Service Orchestrator", e);
            System.exit(1);
        }
    }
}
