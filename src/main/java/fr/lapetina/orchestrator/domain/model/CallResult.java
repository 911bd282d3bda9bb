package fr.lapetina.orchestrator.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Result of {@code callService}: either success data or a typed error, plus elapsed time.
 *
 * @param error        error reason string ({@link ErrorType#reason()}), null on success
 * @param errorMessage human readable detail, null on success
 * @param instanceId   instance that served the call, null if none was reached
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CallResult(
        String requestId,
        boolean success,
        Object data,
        String error,
        String errorMessage,
        String instanceId,
        long responseTimeMs
) {

    public static CallResult success(String requestId, Object data, String instanceId, long responseTimeMs) {
        return new CallResult(requestId, true, data, null, null, instanceId, responseTimeMs);
    }

    public static CallResult failure(String requestId, ErrorType errorType, String message,
                                     String instanceId, long responseTimeMs) {
        return new CallResult(requestId, false, null, errorType.reason(), message, instanceId, responseTimeMs);
    }

    /**
     * Error classification, null on success.
     */
    @JsonIgnore
    public ErrorType errorType() {
        if (error == null) {
            return null;
        }
        for (ErrorType type : ErrorType.values()) {
            if (type.reason().equals(error)) {
                return type;
            }
        }
        return ErrorType.INTERNAL_ERROR;
    }
}
