package fr.lapetina.orchestrator.domain.model;

import java.time.Duration;

/**
 * Auto-scaling bounds and thresholds for one service.
 */
public record AutoScalingPolicy(
        int minInstances,
        int maxInstances,
        ResourceThreshold scaleUpThreshold,
        ResourceThreshold scaleDownThreshold,
        Duration checkInterval
) {

    public AutoScalingPolicy {
        if (minInstances < 0) {
            throw new IllegalArgumentException("minInstances must not be negative");
        }
        if (maxInstances < minInstances || maxInstances < 1) {
            throw new IllegalArgumentException(
                    "maxInstances must be at least 1 and not below minInstances: " + minInstances + ".." + maxInstances);
        }
        if (scaleUpThreshold == null) {
            scaleUpThreshold = new ResourceThreshold(70, 80);
        }
        if (scaleDownThreshold == null) {
            scaleDownThreshold = new ResourceThreshold(30, 30);
        }
        if (checkInterval == null || checkInterval.isZero() || checkInterval.isNegative()) {
            checkInterval = Duration.ofSeconds(60);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * CPU and memory utilization percentages.
     */
    public record ResourceThreshold(double cpuPercent, double memoryPercent) {
    }

    public static final class Builder {
        private int minInstances = 1;
        private int maxInstances = 1;
        private double scaleUpCpu = 70;
        private double scaleUpMemory = 80;
        private double scaleDownCpu = 30;
        private double scaleDownMemory = 30;
        private Duration checkInterval = Duration.ofSeconds(60);

        public Builder minInstances(int minInstances) {
            this.minInstances = minInstances;
            return this;
        }

        public Builder maxInstances(int maxInstances) {
            this.maxInstances = maxInstances;
            return this;
        }

        public Builder scaleUpCpu(double cpuPercent) {
            this.scaleUpCpu = cpuPercent;
            return this;
        }

        public Builder scaleUpMemory(double memoryPercent) {
            this.scaleUpMemory = memoryPercent;
            return this;
        }

        public Builder scaleDownCpu(double cpuPercent) {
            this.scaleDownCpu = cpuPercent;
            return this;
        }

        public Builder scaleDownMemory(double memoryPercent) {
            this.scaleDownMemory = memoryPercent;
            return this;
        }

        public Builder checkInterval(Duration checkInterval) {
            this.checkInterval = checkInterval;
            return this;
        }

        public AutoScalingPolicy build() {
            return new AutoScalingPolicy(
                    minInstances,
                    maxInstances,
                    new ResourceThreshold(scaleUpCpu, scaleUpMemory),
                    new ResourceThreshold(scaleDownCpu, scaleDownMemory),
                    checkInterval
            );
        }
    }
}
