package fr.lapetina.orchestrator.domain.model;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Canonical description of a logical service.
 *
 * Immutable: the registry replaces the whole descriptor when the deployment
 * controller changes the version or configuration.
 */
public final class Service {

    private final String id;
    private final String name;
    private final String version;
    private final List<String> dependencies;
    private final ResourceAllocation resources;
    private final List<ServiceEndpoint> endpoints;
    private final HealthCheckSpec healthCheck;
    private final Map<String, Object> configuration;

    private Service(Builder builder) {
        this.id = builder.id;
        this.name = builder.name != null ? builder.name : builder.id;
        this.version = builder.version;
        this.dependencies = List.copyOf(builder.dependencies);
        this.resources = builder.resources;
        this.endpoints = List.copyOf(builder.endpoints);
        this.healthCheck = builder.healthCheck;
        this.configuration = Map.copyOf(builder.configuration);
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getVersion() {
        return version;
    }

    public List<String> getDependencies() {
        return dependencies;
    }

    public ResourceAllocation getResources() {
        return resources;
    }

    public List<ServiceEndpoint> getEndpoints() {
        return endpoints;
    }

    public HealthCheckSpec getHealthCheck() {
        return healthCheck;
    }

    public Map<String, Object> getConfiguration() {
        return configuration;
    }

    /**
     * Returns a copy of this descriptor at another version.
     */
    public Service withVersion(String newVersion) {
        return toBuilder().version(newVersion).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .name(name)
                .version(version)
                .dependencies(dependencies)
                .resources(resources)
                .endpoints(endpoints)
                .healthCheck(healthCheck)
                .configuration(configuration);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Service other)) return false;
        return id.equals(other.id)
                && name.equals(other.name)
                && version.equals(other.version)
                && dependencies.equals(other.dependencies)
                && resources.equals(other.resources)
                && endpoints.equals(other.endpoints)
                && healthCheck.equals(other.healthCheck)
                && configuration.equals(other.configuration);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, version);
    }

    @Override
    public String toString() {
        return "Service{id='" + id + "', name='" + name + "', version='" + version + "'}";
    }

    public static final class Builder {
        private String id;
        private String name;
        private String version;
        private List<String> dependencies = List.of();
        private ResourceAllocation resources = ResourceAllocation.defaults();
        private List<ServiceEndpoint> endpoints = List.of();
        private HealthCheckSpec healthCheck = HealthCheckSpec.defaults();
        private Map<String, Object> configuration = Map.of();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder dependencies(List<String> dependencies) {
            this.dependencies = dependencies != null ? dependencies : List.of();
            return this;
        }

        public Builder resources(ResourceAllocation resources) {
            this.resources = resources != null ? resources : ResourceAllocation.defaults();
            return this;
        }

        public Builder endpoints(List<ServiceEndpoint> endpoints) {
            this.endpoints = endpoints != null ? endpoints : List.of();
            return this;
        }

        public Builder healthCheck(HealthCheckSpec healthCheck) {
            this.healthCheck = healthCheck != null ? healthCheck : HealthCheckSpec.defaults();
            return this;
        }

        public Builder configuration(Map<String, Object> configuration) {
            this.configuration = configuration != null ? configuration : Map.of();
            return this;
        }

        public Service build() {
            if (id == null || id.isBlank()) {
                throw new IllegalStateException("Service id is required");
            }
            if (version == null || version.isBlank()) {
                throw new IllegalStateException("Service version is required");
            }
            return new Service(this);
        }
    }
}
