package fr.lapetina.orchestrator.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.orchestrator.domain.event.CallEvent;
import fr.lapetina.orchestrator.domain.event.EventState;
import fr.lapetina.orchestrator.domain.model.CallRequest;
import fr.lapetina.orchestrator.domain.model.ErrorType;
import fr.lapetina.orchestrator.infrastructure.registry.ServiceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * First stage handler: validates incoming calls.
 *
 * Validates:
 * - Source, target and endpoint are present
 * - Target service is registered
 */
public final class ValidationHandler implements EventHandler<CallEvent> {

    private static final Logger log = LoggerFactory.getLogger(ValidationHandler.class);

    private final ServiceRegistry registry;

    public ValidationHandler(ServiceRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void onEvent(CallEvent event, long sequence, boolean endOfBatch) {
        if (event.shouldSkip()) {
            log.debug("Skipping already processed event: sequence={}", sequence);
            return;
        }

        event.setSequence(sequence);
        CallRequest request = event.getRequest();

        if (request == null) {
            event.reject(EventState.VALIDATION_FAILED, ErrorType.VALIDATION_ERROR, "Request is null");
            return;
        }
        if (isBlank(request.sourceService()) || isBlank(request.targetService())) {
            reject(event, ErrorType.VALIDATION_ERROR, "Source and target services are required");
            return;
        }
        if (isBlank(request.endpoint())) {
            reject(event, ErrorType.VALIDATION_ERROR, "Endpoint is required");
            return;
        }
        if (!registry.contains(request.targetService())) {
            reject(event, ErrorType.NOT_FOUND, "Service not found: " + request.targetService());
            return;
        }

        event.markValidated();
        log.debug("Call validated: requestId={}, source={}, target={}, endpoint={}, sequence={}",
                request.requestId(), request.sourceService(), request.targetService(), request.endpoint(), sequence);
    }

    private void reject(CallEvent event, ErrorType errorType, String message) {
        event.reject(EventState.VALIDATION_FAILED, errorType, message);
        log.warn("Validation failed: requestId={}, target={}, reason={}",
                event.getRequest().requestId(), event.getRequest().targetService(), message);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
