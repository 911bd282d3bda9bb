package fr.lapetina.orchestrator.domain.model;

import java.time.Instant;
import java.util.List;

/**
 * One rollout attempt. Immutable; each status change produces a new record.
 *
 * @param rollbackVersion version that was live when the deployment was submitted,
 *                        null when the service did not exist before
 * @param errorType       failure classification, null unless failed
 * @param error           failure detail, null unless failed
 * @param instanceIds     instances created by this deployment
 */
public record DeploymentRecord(
        String id,
        String serviceId,
        String version,
        DeploymentStrategy strategy,
        DeploymentStatus status,
        Instant startTime,
        Instant endTime,
        Service configuration,
        String rollbackVersion,
        ErrorType errorType,
        String error,
        List<String> instanceIds
) {

    public DeploymentRecord {
        instanceIds = instanceIds != null ? List.copyOf(instanceIds) : List.of();
    }

    public static DeploymentRecord pending(String id, Service configuration, DeploymentStrategy strategy,
                                           String rollbackVersion, Instant now) {
        return new DeploymentRecord(id, configuration.getId(), configuration.getVersion(), strategy,
                DeploymentStatus.PENDING, now, null, configuration, rollbackVersion, null, null, List.of());
    }

    /**
     * Moves to a new status.
     *
     * @throws IllegalStateException if the transition is not allowed
     */
    public DeploymentRecord transitionTo(DeploymentStatus next, Instant now) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Invalid deployment transition: " + status + " -> " + next);
        }
        Instant end = next == DeploymentStatus.IN_PROGRESS ? null : now;
        return new DeploymentRecord(id, serviceId, version, strategy, next, startTime, end,
                configuration, rollbackVersion, errorType, error, instanceIds);
    }

    public DeploymentRecord fail(ErrorType type, String message, Instant now) {
        DeploymentRecord failed = transitionTo(DeploymentStatus.FAILED, now);
        return new DeploymentRecord(id, serviceId, version, strategy, failed.status, startTime, now,
                configuration, rollbackVersion, type, message, instanceIds);
    }

    public DeploymentRecord withInstanceIds(List<String> ids) {
        return new DeploymentRecord(id, serviceId, version, strategy, status, startTime, endTime,
                configuration, rollbackVersion, errorType, error, ids);
    }

    /**
     * Error reason string, null unless failed.
     */
    public String errorReason() {
        return errorType != null ? errorType.reason() : null;
    }
}
