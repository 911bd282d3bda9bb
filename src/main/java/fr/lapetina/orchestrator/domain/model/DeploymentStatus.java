package fr.lapetina.orchestrator.domain.model;

import java.util.Set;

/**
 * Status of a deployment attempt.
 *
 * <pre>
 * PENDING -> IN_PROGRESS -> COMPLETED -> ROLLED_BACK
 *        \              \-> FAILED    -> ROLLED_BACK
 *         \-> FAILED
 * </pre>
 */
public enum DeploymentStatus {
    PENDING("pending"),
    IN_PROGRESS("in_progress"),
    COMPLETED("completed"),
    FAILED("failed"),
    ROLLED_BACK("rolled_back");

    private final String wireName;

    DeploymentStatus(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public Set<DeploymentStatus> validTransitions() {
        return switch (this) {
            case PENDING -> Set.of(IN_PROGRESS, FAILED);
            case IN_PROGRESS -> Set.of(COMPLETED, FAILED);
            case COMPLETED, FAILED -> Set.of(ROLLED_BACK);
            case ROLLED_BACK -> Set.of();
        };
    }

    public boolean canTransitionTo(DeploymentStatus target) {
        return validTransitions().contains(target);
    }
}
