package fr.lapetina.orchestrator.domain.model;

/**
 * Point-in-time resource usage of an instance.
 */
public record InstanceUsage(double cpuPercent, double memoryMb, double networkLoad) {

    public InstanceUsage {
        if (cpuPercent < 0 || memoryMb < 0 || networkLoad < 0) {
            throw new IllegalArgumentException("Usage values must not be negative");
        }
    }

    public static InstanceUsage idle() {
        return new InstanceUsage(0, 0, 0);
    }
}
