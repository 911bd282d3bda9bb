package fr.lapetina.orchestrator.domain.exception;

import fr.lapetina.orchestrator.domain.model.ErrorType;

public final class ConflictException extends OrchestrationException {

    public ConflictException(String message) {
        super(ErrorType.CONFLICT, message);
    }
}
