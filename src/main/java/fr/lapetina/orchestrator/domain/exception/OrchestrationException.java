package fr.lapetina.orchestrator.domain.exception;

import fr.lapetina.orchestrator.domain.model.ErrorType;

/**
 * Base class of typed orchestration errors.
 */
public class OrchestrationException extends RuntimeException {

    private final ErrorType errorType;

    public OrchestrationException(ErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    public OrchestrationException(ErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }

    public ErrorType getErrorType() {
        return errorType;
    }
}
