package fr.lapetina.orchestrator.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.orchestrator.domain.event.CallEvent;
import fr.lapetina.orchestrator.domain.event.EventState;
import fr.lapetina.orchestrator.domain.model.CallResult;
import fr.lapetina.orchestrator.domain.model.ErrorType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;

/**
 * Final stage handler: completes calls that never reached an instance and
 * clears the event for reuse.
 *
 * Dispatched calls are completed by their transport callback; every other
 * event gets an error result carrying the reason recorded by the stage that
 * stopped it.
 */
public final class CompletionHandler implements EventHandler<CallEvent> {

    private static final Logger log = LoggerFactory.getLogger(CompletionHandler.class);

    @Override
    public void onEvent(CallEvent event, long sequence, boolean endOfBatch) {
        try {
            if (event.getState() != EventState.DISPATCHED) {
                completeWithError(event);
            }
        } finally {
            event.clear();
        }
    }

    private void completeWithError(CallEvent event) {
        CompletableFuture<CallResult> future = event.getResultFuture();
        if (future == null || future.isDone()) {
            return;
        }

        ErrorType errorType = event.getErrorType() != null ? event.getErrorType() : ErrorType.INTERNAL_ERROR;
        String message = event.getErrorMessage() != null
                ? event.getErrorMessage()
                : "Call stopped in state " + event.getState();
        String requestId = event.getRequest() != null ? event.getRequest().requestId() : null;
        String instanceId = event.getSelectedInstance() != null ? event.getSelectedInstance().getId() : null;

        log.debug("Completing call with pre-dispatch error: requestId={}, errorType={}, error={}",
                requestId, errorType.reason(), message);

        future.complete(CallResult.failure(requestId, errorType, message, instanceId, event.elapsedMs()));
    }
}
