package fr.lapetina.orchestrator.domain.event;

/**
 * Lifecycle state of a call event in the Disruptor pipeline.
 */
public enum EventState {
    /** Event just created, awaiting validation */
    CREATED,

    /** Call validated successfully */
    VALIDATED,

    /** Validation failed (unknown target, missing fields) */
    VALIDATION_FAILED,

    /** Policy engine admitted the call */
    AUTHORIZED,

    /** Policy engine denied the call */
    DENIED,

    /** Instance has been selected for this call */
    INSTANCE_SELECTED,

    /** No routable healthy instance */
    NO_INSTANCE_AVAILABLE,

    /** Call handed to the service transport, completes asynchronously */
    DISPATCHED,

    /** Call completed successfully */
    COMPLETED,

    /** Call failed after all retries */
    FAILED
}
