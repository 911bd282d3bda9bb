package fr.lapetina.orchestrator.domain.exception;

import fr.lapetina.orchestrator.domain.model.ErrorType;

/**
 * Unknown service, instance or deployment.
 */
public final class NotFoundException extends OrchestrationException {

    public NotFoundException(String message) {
        super(ErrorType.NOT_FOUND, message);
    }

    public static NotFoundException service(String serviceId) {
        return new NotFoundException("Service not found: " + serviceId);
    }

    public static NotFoundException instance(String instanceId) {
        return new NotFoundException("Instance not found: " + instanceId);
    }

    public static NotFoundException deployment(String deploymentId) {
        return new NotFoundException("Deployment not found: " + deploymentId);
    }
}
