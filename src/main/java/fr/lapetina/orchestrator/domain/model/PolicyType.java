package fr.lapetina.orchestrator.domain.model;

public enum PolicyType {
    RETRY("retry"),
    TIMEOUT("timeout"),
    RATE_LIMIT("rate_limit"),
    CIRCUIT_BREAKER("circuit_breaker"),
    AUTHORIZATION("authorization");

    private final String wireName;

    PolicyType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static PolicyType fromWireName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Policy type is required");
        }
        String normalized = name.trim().toLowerCase().replace('-', '_');
        for (PolicyType type : values()) {
            if (type.wireName.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown policy type: " + name);
    }
}
