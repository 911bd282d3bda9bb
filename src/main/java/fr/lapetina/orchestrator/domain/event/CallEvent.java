package fr.lapetina.orchestrator.domain.event;

import fr.lapetina.orchestrator.domain.model.CallRequest;
import fr.lapetina.orchestrator.domain.model.CallResult;
import fr.lapetina.orchestrator.domain.model.ErrorType;
import fr.lapetina.orchestrator.domain.model.ServiceInstance;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * Event object for the LMAX Disruptor ring buffer.
 *
 * Mutable holder reused across the ring buffer; each handler stage updates it
 * as the call progresses. It must never escape the pipeline handlers: anything
 * that completes asynchronously copies what it needs before the event is cleared.
 */
public final class CallEvent {

    private CallRequest request;

    private EventState state;
    private ServiceInstance selectedInstance;
    private ErrorType errorType;
    private String errorMessage;

    private Instant acceptedAt;
    private Instant validatedAt;
    private Instant instanceSelectedAt;
    private Instant dispatchedAt;

    private CompletableFuture<CallResult> resultFuture;

    private long sequence;

    /**
     * Clears the event for reuse.
     */
    public void clear() {
        this.request = null;
        this.state = null;
        this.selectedInstance = null;
        this.errorType = null;
        this.errorMessage = null;
        this.acceptedAt = null;
        this.validatedAt = null;
        this.instanceSelectedAt = null;
        this.dispatchedAt = null;
        this.resultFuture = null;
        this.sequence = -1;
    }

    /**
     * Initializes the event with a new call.
     */
    public void initialize(CallRequest request, CompletableFuture<CallResult> resultFuture) {
        clear();
        this.request = request;
        this.resultFuture = resultFuture;
        this.state = EventState.CREATED;
        this.acceptedAt = Instant.now();
    }

    public CallRequest getRequest() {
        return request;
    }

    public EventState getState() {
        return state;
    }

    public ServiceInstance getSelectedInstance() {
        return selectedInstance;
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public Instant getAcceptedAt() {
        return acceptedAt;
    }

    public Instant getValidatedAt() {
        return validatedAt;
    }

    public Instant getInstanceSelectedAt() {
        return instanceSelectedAt;
    }

    public Instant getDispatchedAt() {
        return dispatchedAt;
    }

    public CompletableFuture<CallResult> getResultFuture() {
        return resultFuture;
    }

    public long getSequence() {
        return sequence;
    }

    public void setState(EventState state) {
        this.state = state;
    }

    public void setSequence(long sequence) {
        this.sequence = sequence;
    }

    public void setSelectedInstance(ServiceInstance instance) {
        this.selectedInstance = instance;
        this.instanceSelectedAt = Instant.now();
        this.state = EventState.INSTANCE_SELECTED;
    }

    public void markValidated() {
        this.state = EventState.VALIDATED;
        this.validatedAt = Instant.now();
    }

    public void markDispatched() {
        this.state = EventState.DISPATCHED;
        this.dispatchedAt = Instant.now();
    }

    /**
     * Stops the event at the current stage with an error.
     */
    public void reject(EventState rejectedState, ErrorType errorType, String message) {
        this.state = rejectedState;
        this.errorType = errorType;
        this.errorMessage = message;
    }

    /**
     * Milliseconds spent in the pipeline so far.
     */
    public long elapsedMs() {
        return acceptedAt != null ? Duration.between(acceptedAt, Instant.now()).toMillis() : 0;
    }

    /**
     * Checks if the event was stopped before dispatch.
     */
    public boolean isRejected() {
        return state == EventState.VALIDATION_FAILED
            || state == EventState.DENIED
            || state == EventState.NO_INSTANCE_AVAILABLE
            || state == EventState.FAILED;
    }

    /**
     * Checks if processing should skip remaining handlers.
     */
    public boolean shouldSkip() {
        return isRejected()
            || state == EventState.DISPATCHED
            || state == EventState.COMPLETED;
    }

    @Override
    public String toString() {
        return "CallEvent{" +
                "requestId=" + (request != null ? request.requestId() : "null") +
                ", target=" + (request != null ? request.targetService() : "null") +
                ", state=" + state +
                ", instance=" + (selectedInstance != null ? selectedInstance.getId() : "null") +
                ", seq=" + sequence +
                '}';
    }
}
