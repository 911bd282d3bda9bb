package fr.lapetina.orchestrator.infrastructure.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Loads the orchestrator configuration and keeps it current.
 *
 * The file system is tried first, then the classpath. A configuration is
 * only published once it passes {@link #validate}, which also maps the
 * hot-reloadable sections (policies and load balancers) so that a reload
 * with a bad entry is rejected as a whole. While watching, the file is
 * polled and reloaded whenever its size or modification time changes.
 */
public final class ConfigLoader implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(1);

    private final AtomicReference<OrchestratorConfig> currentConfig = new AtomicReference<>();
    private final List<ConfigChangeListener> listeners = new CopyOnWriteArrayList<>();
    private final Path configPath;
    private final Duration pollInterval;
    private final Yaml yaml;

    private ScheduledExecutorService watcher;
    private volatile FileStamp lastSeen;

    public ConfigLoader(String configPath) {
        this(configPath, DEFAULT_POLL_INTERVAL);
    }

    public ConfigLoader(String configPath, Duration pollInterval) {
        this.configPath = Paths.get(configPath);
        this.pollInterval = pollInterval;
        this.yaml = new Yaml(new Constructor(OrchestratorConfig.class, new LoaderOptions()));
    }

    /**
     * Loads, validates and publishes the configuration.
     *
     * @throws ConfigurationException if the file is missing, unreadable or invalid
     */
    public OrchestratorConfig load() {
        return publish(validate(read()));
    }

    /**
     * Loads, validates and publishes a configuration read from a stream.
     */
    public OrchestratorConfig loadFromStream(InputStream inputStream) {
        return publish(validate(parse(inputStream)));
    }

    private OrchestratorConfig read() {
        if (Files.exists(configPath)) {
            log.info("Loading configuration from file: {}", configPath);
            FileStamp stamp = FileStamp.of(configPath);
            try (InputStream is = Files.newInputStream(configPath)) {
                OrchestratorConfig config = parse(is);
                lastSeen = stamp;
                return config;
            } catch (IOException e) {
                throw new ConfigurationException("Failed to load configuration from: " + configPath, e);
            }
        }

        String resource = configPath.toString().replace('\\', '/');
        if (resource.startsWith("/")) {
            resource = resource.substring(1);
        }
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(resource)) {
            if (is == null) {
                throw new ConfigurationException("Configuration file not found: " + configPath);
            }
            log.info("Loading configuration from classpath: {}", resource);
            return parse(is);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load from classpath: " + resource, e);
        }
    }

    private OrchestratorConfig parse(InputStream inputStream) {
        try {
            OrchestratorConfig config = yaml.load(inputStream);
            return config != null ? config : new OrchestratorConfig();
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid configuration: " + e.getMessage(), e);
        }
    }

    private OrchestratorConfig publish(OrchestratorConfig config) {
        OrchestratorConfig previous = currentConfig.getAndSet(config);
        for (ConfigChangeListener listener : listeners) {
            try {
                listener.onConfigChanged(previous, config);
            } catch (RuntimeException e) {
                log.error("Config change listener failed: listener={}", listener.getClass().getName(), e);
            }
        }
        return config;
    }

    /**
     * Rejects configurations the orchestrator could not start with or apply.
     */
    static OrchestratorConfig validate(OrchestratorConfig config) {
        int ringBufferSize = config.getPipeline().getRingBufferSize();
        if (Integer.bitCount(ringBufferSize) != 1) {
            throw new ConfigurationException("pipeline.ringBufferSize must be a power of 2: " + ringBufferSize);
        }

        Set<String> serviceIds = new HashSet<>();
        for (OrchestratorConfig.ServiceConfig service : config.getServices()) {
            if (service.getId() == null || service.getId().isBlank()) {
                throw new ConfigurationException("Every service needs an id");
            }
            if (!serviceIds.add(service.getId())) {
                throw new ConfigurationException("Duplicate service id: " + service.getId());
            }
            if (service.getInstances() < 0) {
                throw new ConfigurationException("services[" + service.getId() + "].instances must not be negative");
            }
        }

        Set<String> balancerIds = new HashSet<>();
        for (OrchestratorConfig.LoadBalancerEntry entry : config.getLoadBalancers()) {
            if (entry.getId() == null || entry.getId().isBlank()) {
                throw new ConfigurationException("Every load balancer needs an id");
            }
            if (!balancerIds.add(entry.getId())) {
                throw new ConfigurationException("Duplicate load balancer id: " + entry.getId());
            }
            ConfigMapper.toLoadBalancerConfig(entry);
        }

        for (OrchestratorConfig.PolicyEntry entry : config.getPolicies()) {
            if (entry.getId() == null || entry.getType() == null) {
                throw new ConfigurationException("Every policy needs an id and a type");
            }
            ConfigMapper.toPolicy(entry);
        }

        for (OrchestratorConfig.AutoScalingEntry entry : config.getAutoScaling()) {
            if (entry.getMaxInstances() < entry.getMinInstances()) {
                throw new ConfigurationException("autoScaling[" + entry.getServiceId()
                        + "]: maxInstances must be >= minInstances");
            }
        }
        return config;
    }

    public OrchestratorConfig getCurrentConfig() {
        return currentConfig.get();
    }

    /**
     * Starts polling the configuration file. Classpath configurations are not watched.
     */
    public synchronized void startWatching() {
        if (watcher != null) {
            return;
        }
        if (!Files.exists(configPath)) {
            log.warn("Config file does not exist, hot reload disabled: {}", configPath);
            return;
        }

        watcher = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "config-watcher");
            t.setDaemon(true);
            return t;
        });
        long periodMs = pollInterval.toMillis();
        watcher.scheduleWithFixedDelay(this::pollFile, periodMs, periodMs, TimeUnit.MILLISECONDS);
        log.info("Configuration hot-reload enabled: path={}, pollInterval={}", configPath, pollInterval);
    }

    private void pollFile() {
        FileStamp stamp;
        try {
            stamp = FileStamp.of(configPath);
        } catch (ConfigurationException e) {
            log.warn("Config file not readable, skipping reload check: path={}", configPath);
            return;
        }
        if (stamp.equals(lastSeen)) {
            return;
        }
        log.info("Configuration file changed, reloading: path={}", configPath);
        lastSeen = stamp;
        reload();
    }

    /**
     * Reloads the configuration. A configuration that fails to load or
     * validate is logged and the current one is kept.
     */
    public OrchestratorConfig reload() {
        try {
            return load();
        } catch (ConfigurationException e) {
            log.error("Failed to reload configuration, keeping current: path={}", configPath, e);
            return currentConfig.get();
        }
    }

    public void addListener(ConfigChangeListener listener) {
        listeners.add(listener);
    }

    public void removeListener(ConfigChangeListener listener) {
        listeners.remove(listener);
    }

    @Override
    public synchronized void close() {
        if (watcher == null) {
            return;
        }
        watcher.shutdownNow();
        try {
            if (!watcher.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Config watcher did not stop in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        watcher = null;
    }

    /**
     * Size and modification time of the watched file.
     */
    private record FileStamp(long size, long modifiedMillis) {

        static FileStamp of(Path path) {
            try {
                BasicFileAttributes attributes = Files.readAttributes(path, BasicFileAttributes.class);
                return new FileStamp(attributes.size(), attributes.lastModifiedTime().toMillis());
            } catch (IOException e) {
                throw new ConfigurationException("Cannot stat configuration file: " + path, e);
            }
        }
    }

    /**
     * Raised when a configuration cannot be read, parsed or validated.
     */
    public static class ConfigurationException extends RuntimeException {
        public ConfigurationException(String message) {
            super(message);
        }

        public ConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
