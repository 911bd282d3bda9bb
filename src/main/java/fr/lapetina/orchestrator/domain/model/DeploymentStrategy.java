package fr.lapetina.orchestrator.domain.model;

public enum DeploymentStrategy {
    ROLLING_UPDATE("rolling_update"),
    BLUE_GREEN("blue_green"),
    CANARY("canary");

    private final String wireName;

    DeploymentStrategy(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static DeploymentStrategy fromWireName(String name) {
        if (name == null) {
            return ROLLING_UPDATE;
        }
        String normalized = name.trim().toLowerCase().replace('-', '_');
        for (DeploymentStrategy strategy : values()) {
            if (strategy.wireName.equals(normalized)) {
                return strategy;
            }
        }
        throw new IllegalArgumentException("Unknown deployment strategy: " + name);
    }
}
