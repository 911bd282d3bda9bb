package fr.lapetina.orchestrator.domain.model;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * One running replica of a service.
 *
 * Immutable snapshot. Every change (health, usage) produces a new value that
 * the registry stores in place of the previous one, so callers never observe
 * a half-updated instance.
 */
public final class ServiceInstance {

    private final String id;
    private final String serviceId;
    private final String nodeId;
    private final String version;
    private final InstanceState state;
    private final double cpuPercent;
    private final double memoryMb;
    private final double networkLoad;
    private final Instant startedAt;
    private final Instant lastHealthCheck;
    private final URI address;

    private ServiceInstance(Builder builder) {
        this.id = builder.id;
        this.serviceId = builder.serviceId;
        this.nodeId = builder.nodeId;
        this.version = builder.version;
        this.state = builder.state;
        this.cpuPercent = builder.cpuPercent;
        this.memoryMb = builder.memoryMb;
        this.networkLoad = builder.networkLoad;
        this.startedAt = builder.startedAt;
        this.lastHealthCheck = builder.lastHealthCheck;
        this.address = builder.address;
    }

    public String getId() {
        return id;
    }

    public String getServiceId() {
        return serviceId;
    }

    public String getNodeId() {
        return nodeId;
    }

    public String getVersion() {
        return version;
    }

    public InstanceState getState() {
        return state;
    }

    public double getCpuPercent() {
        return cpuPercent;
    }

    public double getMemoryMb() {
        return memoryMb;
    }

    public double getNetworkLoad() {
        return networkLoad;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    /**
     * Time of the last probe, null if never probed.
     */
    public Instant getLastHealthCheck() {
        return lastHealthCheck;
    }

    /**
     * Network address of the instance, null for instances modelled without one.
     */
    public URI getAddress() {
        return address;
    }

    public boolean isHealthy() {
        return state == InstanceState.HEALTHY;
    }

    /**
     * Cumulative uptime as of the given instant.
     */
    public Duration uptime(Instant now) {
        Duration uptime = Duration.between(startedAt, now);
        return uptime.isNegative() ? Duration.ZERO : uptime;
    }

    public ServiceInstance withState(InstanceState newState, Instant checkedAt) {
        return toBuilder().state(newState).lastHealthCheck(checkedAt).build();
    }

    public ServiceInstance withUsage(InstanceUsage usage) {
        return toBuilder()
                .cpuPercent(usage.cpuPercent())
                .memoryMb(usage.memoryMb())
                .networkLoad(usage.networkLoad())
                .build();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .serviceId(serviceId)
                .nodeId(nodeId)
                .version(version)
                .state(state)
                .cpuPercent(cpuPercent)
                .memoryMb(memoryMb)
                .networkLoad(networkLoad)
                .startedAt(startedAt)
                .lastHealthCheck(lastHealthCheck)
                .address(address);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ServiceInstance other)) return false;
        return id.equals(other.id)
                && serviceId.equals(other.serviceId)
                && Objects.equals(nodeId, other.nodeId)
                && version.equals(other.version)
                && state == other.state
                && Double.compare(cpuPercent, other.cpuPercent) == 0
                && Double.compare(memoryMb, other.memoryMb) == 0
                && Double.compare(networkLoad, other.networkLoad) == 0
                && startedAt.equals(other.startedAt)
                && Objects.equals(lastHealthCheck, other.lastHealthCheck)
                && Objects.equals(address, other.address);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, serviceId, state);
    }

    @Override
    public String toString() {
        return "ServiceInstance{" +
                "id='" + id + '\'' +
                ", serviceId='" + serviceId + '\'' +
                ", version='" + version + '\'' +
                ", state=" + state +
                ", cpu=" + cpuPercent +
                '}';
    }

    public static final class Builder {
        private String id;
        private String serviceId;
        private String nodeId;
        private String version;
        private InstanceState state = InstanceState.STARTING;
        private double cpuPercent;
        private double memoryMb;
        private double networkLoad;
        private Instant startedAt;
        private Instant lastHealthCheck;
        private URI address;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder serviceId(String serviceId) {
            this.serviceId = serviceId;
            return this;
        }

        public Builder nodeId(String nodeId) {
            this.nodeId = nodeId;
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder state(InstanceState state) {
            this.state = state;
            return this;
        }

        public Builder cpuPercent(double cpuPercent) {
            this.cpuPercent = cpuPercent;
            return this;
        }

        public Builder memoryMb(double memoryMb) {
            this.memoryMb = memoryMb;
            return this;
        }

        public Builder networkLoad(double networkLoad) {
            this.networkLoad = networkLoad;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder lastHealthCheck(Instant lastHealthCheck) {
            this.lastHealthCheck = lastHealthCheck;
            return this;
        }

        public Builder address(URI address) {
            this.address = address;
            return this;
        }

        public ServiceInstance build() {
            if (id == null || id.isBlank()) {
                throw new IllegalStateException("Instance id is required");
            }
            if (serviceId == null || serviceId.isBlank()) {
                throw new IllegalStateException("Instance serviceId is required");
            }
            if (version == null || version.isBlank()) {
                throw new IllegalStateException("Instance version is required");
            }
            if (state == null) {
                throw new IllegalStateException("Instance state is required");
            }
            if (startedAt == null) {
                startedAt = Instant.now();
            }
            return new ServiceInstance(this);
        }
    }
}
