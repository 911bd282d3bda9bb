package fr.lapetina.orchestrator.domain.exception;

import fr.lapetina.orchestrator.domain.model.ErrorType;

/**
 * The routing target has no eligible instance. Callers should treat the
 * service as unavailable and back off before retrying.
 */
public final class NoHealthyInstanceException extends OrchestrationException {

    private final String serviceId;

    public NoHealthyInstanceException(String serviceId) {
        super(ErrorType.NO_HEALTHY_INSTANCE, "No healthy instances available for service: " + serviceId);
        this.serviceId = serviceId;
    }

    public String getServiceId() {
        return serviceId;
    }
}
