package fr.lapetina.orchestrator.infrastructure.scaling;

/**
 * Outcome of one auto-scaling tick.
 */
public enum ScalingDecision {
    /** One instance was added */
    SCALED_UP,

    /** One instance was removed */
    SCALED_DOWN,

    /** Utilization within bounds, or at a bound */
    NO_CHANGE,

    /** A deployment owns the service, or a previous action is still running */
    SKIPPED,

    /** Provisioning or termination failed; the next tick re-evaluates */
    FAILED
}
