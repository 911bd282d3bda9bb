package fr.lapetina.orchestrator.domain.model;

/**
 * Classification of orchestration errors.
 *
 * Each type carries the reason string exposed to callers (call results,
 * deployment records, JSON responses). Reason strings are part of the
 * external contract and must not change.
 */
public enum ErrorType {
    NOT_FOUND("NotFound"),
    NO_HEALTHY_INSTANCE("NoHealthyInstance"),
    RATE_LIMIT_EXCEEDED("RateLimitExceeded"),
    CIRCUIT_OPEN("CircuitOpen"),
    AUTHORIZATION_DENIED("AuthorizationDenied"),
    DEPLOYMENT_TIMEOUT("DeploymentTimeout"),
    DEPLOYMENT_VALIDATION_FAILED("DeploymentValidationFailed"),
    PROVISIONING_FAILED("ProvisioningFailed"),
    CONFLICT("Conflict"),
    VALIDATION_ERROR("ValidationError"),
    TIMEOUT("Timeout"),
    SERVICE_ERROR("ServiceError"),
    CAPACITY("Capacity"),
    CANCELLED("Cancelled"),
    INTERNAL_ERROR("InternalError");

    private final String reason;

    ErrorType(String reason) {
        this.reason = reason;
    }

    public String reason() {
        return reason;
    }

    /**
     * Whether a call failing with this error may be retried on another instance.
     */
    public boolean isRetryable() {
        return this == TIMEOUT || this == SERVICE_ERROR;
    }
}
