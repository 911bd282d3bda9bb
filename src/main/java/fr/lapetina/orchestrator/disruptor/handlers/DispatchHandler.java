package fr.lapetina.orchestrator.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.orchestrator.domain.event.CallEvent;
import fr.lapetina.orchestrator.domain.event.EventState;
import fr.lapetina.orchestrator.domain.exception.OrchestrationException;
import fr.lapetina.orchestrator.domain.model.CallRequest;
import fr.lapetina.orchestrator.domain.model.CallResult;
import fr.lapetina.orchestrator.domain.model.ErrorType;
import fr.lapetina.orchestrator.domain.model.ServiceInstance;
import fr.lapetina.orchestrator.infrastructure.balancer.LoadBalancer;
import fr.lapetina.orchestrator.infrastructure.metrics.TrafficRecorder;
import fr.lapetina.orchestrator.infrastructure.policy.CallOptions;
import fr.lapetina.orchestrator.infrastructure.policy.CircuitBreaker;
import fr.lapetina.orchestrator.infrastructure.policy.PolicyEngine;
import fr.lapetina.orchestrator.infrastructure.runtime.ServiceTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Fourth stage handler: dispatches calls to the selected instance.
 *
 * The transport call is asynchronous; the outcome is handled in future
 * callbacks, never in onEvent. Everything the callbacks need is copied into a
 * {@link CallAttempt} first because the ring buffer slot is recycled as soon
 * as the last stage has run.
 *
 * Per attempt:
 * - Timeout from the target's timeout policy or load-balancer configuration
 * - In-flight accounting for least-connections selection
 * - Outcome fed to the circuit breaker and to per-version traffic statistics
 * - Retryable failures (timeouts, service errors) re-select an instance and
 *   try again while retries remain and the breaker is closed. Retries do not
 *   go through authorization again.
 */
public final class DispatchHandler implements EventHandler<CallEvent> {

    private static final Logger log = LoggerFactory.getLogger(DispatchHandler.class);

    private final ServiceTransport transport;
    private final LoadBalancer loadBalancer;
    private final PolicyEngine policyEngine;
    private final TrafficRecorder trafficRecorder;

    public DispatchHandler(
            ServiceTransport transport,
            LoadBalancer loadBalancer,
            PolicyEngine policyEngine,
            TrafficRecorder trafficRecorder
    ) {
        this.transport = transport;
        this.loadBalancer = loadBalancer;
        this.policyEngine = policyEngine;
        this.trafficRecorder = trafficRecorder;
    }

    @Override
    public void onEvent(CallEvent event, long sequence, boolean endOfBatch) {
        if (event.shouldSkip()) {
            return;
        }

        if (event.getState() != EventState.INSTANCE_SELECTED) {
            event.reject(EventState.FAILED, ErrorType.INTERNAL_ERROR, "Invalid state for dispatch: " + event.getState());
            return;
        }

        CallRequest request = event.getRequest();
        CallAttempt attempt = new CallAttempt(
                request,
                policyEngine.callOptions(request.targetService()),
                event.getResultFuture(),
                System.nanoTime() - event.elapsedMs() * 1_000_000L
        );
        event.markDispatched();
        attempt.send(event.getSelectedInstance());
    }

    /**
     * Maps a transport failure onto the error taxonomy.
     */
    static ErrorType classifyError(Throwable throwable) {
        Throwable cause = unwrap(throwable);
        if (cause instanceof TimeoutException) {
            return ErrorType.TIMEOUT;
        }
        if (cause instanceof OrchestrationException orchestrationException) {
            return orchestrationException.getErrorType();
        }
        return ErrorType.SERVICE_ERROR;
    }

    private static Throwable unwrap(Throwable throwable) {
        Throwable cause = throwable;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }

    /**
     * State of one call across its attempts, detached from the ring buffer.
     */
    private final class CallAttempt {
        private final CallRequest request;
        private final CallOptions options;
        private final CompletableFuture<CallResult> resultFuture;
        private final long startNanos;
        private int attempt;

        CallAttempt(CallRequest request, CallOptions options, CompletableFuture<CallResult> resultFuture,
                    long startNanos) {
            this.request = request;
            this.options = options;
            this.resultFuture = resultFuture;
            this.startNanos = startNanos;
        }

        void send(ServiceInstance instance) {
            String target = request.targetService();
            long attemptStart = System.nanoTime();
            loadBalancer.callStarted(instance.getId());

            log.debug("Dispatching call: requestId={}, target={}, instanceId={}, attempt={}, timeoutMs={}",
                    request.requestId(), target, instance.getId(), attempt + 1, options.timeout().toMillis());

            CompletableFuture<Object> call;
            try {
                call = transport.invoke(instance, request);
            } catch (RuntimeException e) {
                call = CompletableFuture.failedFuture(e);
            }

            call.orTimeout(options.timeout().toMillis(), TimeUnit.MILLISECONDS)
                    .whenComplete((data, throwable) -> {
                        loadBalancer.callFinished(instance.getId());
                        long attemptMs = elapsedMs(attemptStart);
                        boolean success = throwable == null;
                        policyEngine.recordOutcome(target, success);
                        trafficRecorder.recordAttempt(target, instance.getVersion(), success, attemptMs);

                        if (success) {
                            finish(CallResult.success(request.requestId(), data, instance.getId(), elapsedMs(startNanos)));
                        } else {
                            onFailure(instance, throwable);
                        }
                    });
        }

        private void onFailure(ServiceInstance instance, Throwable throwable) {
            ErrorType errorType = classifyError(throwable);
            String message = unwrap(throwable).getMessage();

            if (errorType.isRetryable() && attempt < options.maxRetries() && breakerClosed()) {
                attempt++;
                log.info("Retrying call: requestId={}, target={}, failedInstance={}, errorType={}, retry={}/{}",
                        request.requestId(), request.targetService(), instance.getId(),
                        errorType.reason(), attempt, options.maxRetries());
                try {
                    send(loadBalancer.selectInstance(request.targetService(), request.sourceService()));
                } catch (OrchestrationException e) {
                    finish(CallResult.failure(request.requestId(), e.getErrorType(), e.getMessage(),
                            instance.getId(), elapsedMs(startNanos)));
                }
                return;
            }

            finish(CallResult.failure(request.requestId(), errorType,
                    message != null ? message : "Internal service error", instance.getId(), elapsedMs(startNanos)));
        }

        private boolean breakerClosed() {
            return policyEngine.circuitState(request.targetService())
                    .map(state -> state == CircuitBreaker.State.CLOSED)
                    .orElse(true);
        }

        private void finish(CallResult result) {
            trafficRecorder.recordCall(request.targetService(), result.success(), result.responseTimeMs());
            if (result.success()) {
                log.debug("Call completed: requestId={}, target={}, instanceId={}, responseTimeMs={}, retries={}",
                        request.requestId(), request.targetService(), result.instanceId(),
                        result.responseTimeMs(), attempt);
            } else {
                log.warn("Call failed: requestId={}, target={}, instanceId={}, error={}, message={}, retries={}",
                        request.requestId(), request.targetService(), result.instanceId(),
                        result.error(), result.errorMessage(), attempt);
            }
            resultFuture.complete(result);
        }

        private long elapsedMs(long fromNanos) {
            return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - fromNanos);
        }
    }
}
