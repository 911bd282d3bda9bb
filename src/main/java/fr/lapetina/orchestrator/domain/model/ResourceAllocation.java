package fr.lapetina.orchestrator.domain.model;

/**
 * Resource envelope of a service: per-instance CPU and memory request/limit,
 * disk and network bandwidth.
 *
 * @param cpuRequest    CPU cores requested
 * @param cpuLimit      CPU cores limit
 * @param memoryRequestMb memory requested in MiB
 * @param memoryLimitMb memory limit in MiB, the reference for memory utilization
 * @param diskGb        disk in GiB
 * @param networkMbps   network bandwidth in Mbit/s
 */
public record ResourceAllocation(
        double cpuRequest,
        double cpuLimit,
        long memoryRequestMb,
        long memoryLimitMb,
        long diskGb,
        long networkMbps
) {

    public ResourceAllocation {
        if (cpuRequest < 0 || cpuLimit < 0 || memoryRequestMb < 0 || memoryLimitMb < 0
                || diskGb < 0 || networkMbps < 0) {
            throw new IllegalArgumentException("Resource values must not be negative");
        }
    }

    public static ResourceAllocation defaults() {
        return new ResourceAllocation(0.5, 1.0, 512, 1024, 10, 100);
    }

    /**
     * Memory usage as a percentage of the memory limit, 0 when no limit is declared.
     */
    public double memoryPercent(double memoryMb) {
        if (memoryLimitMb <= 0) {
            return 0.0;
        }
        return memoryMb / memoryLimitMb * 100.0;
    }
}
