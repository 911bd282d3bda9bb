package fr.lapetina.orchestrator.domain.model;

/**
 * Lifecycle state of a service instance.
 */
public enum InstanceState {
    /** Passed its health probes, eligible for routing */
    HEALTHY("healthy"),

    /** Failed consecutive probes, excluded from routing */
    UNHEALTHY("unhealthy"),

    /** Provisioned but not yet confirmed by a probe */
    STARTING("starting"),

    /** Being torn down, never probed nor routed to */
    STOPPING("stopping");

    private final String wireName;

    InstanceState(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static InstanceState fromWireName(String name) {
        for (InstanceState state : values()) {
            if (state.wireName.equalsIgnoreCase(name) || state.name().equalsIgnoreCase(name)) {
                return state;
            }
        }
        throw new IllegalArgumentException("Unknown instance state: " + name);
    }
}
