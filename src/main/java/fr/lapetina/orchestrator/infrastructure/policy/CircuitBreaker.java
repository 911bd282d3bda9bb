package fr.lapetina.orchestrator.infrastructure.policy;

import fr.lapetina.orchestrator.domain.model.CircuitBreakerSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Circuit breaker guarding calls to one target service.
 *
 * States:
 * - CLOSED: Normal operation, calls pass through
 * - OPEN: Consecutive errors within the interval reached the threshold, calls rejected
 * - HALF_OPEN: After the recovery timeout, a limited number of probe calls pass
 *
 * Thread-safe via atomic operations.
 */
public final class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    public enum State {
        CLOSED,
        OPEN,
        HALF_OPEN
    }

    private final String targetService;
    private final CircuitBreakerSettings settings;
    private final Clock clock;

    private final AtomicReference<State> state = new AtomicReference<>(State.CLOSED);
    private final AtomicInteger failureCount = new AtomicInteger(0);
    private final AtomicInteger halfOpenPermits = new AtomicInteger(0);
    private final AtomicInteger successCountInHalfOpen = new AtomicInteger(0);
    private volatile Instant lastFailureTime;
    private volatile Instant openedAt;

    public CircuitBreaker(String targetService, CircuitBreakerSettings settings, Clock clock) {
        this.targetService = targetService;
        this.settings = settings;
        this.clock = clock;
    }

    /**
     * Checks whether a call may proceed. In HALF_OPEN each allowed call
     * consumes one probe permit.
     *
     * @return true if the call should proceed, false if the circuit is open
     */
    public boolean tryAcquirePermission() {
        switch (getState()) {
            case CLOSED:
                return true;

            case HALF_OPEN:
                int issued = halfOpenPermits.incrementAndGet();
                if (issued <= settings.halfOpenRequests()) {
                    return true;
                }
                halfOpenPermits.decrementAndGet();
                return false;

            default:
                return false;
        }
    }

    /**
     * Records a successful call.
     */
    public void recordSuccess() {
        State currentState = state.get();

        if (currentState == State.CLOSED) {
            failureCount.set(0);
            return;
        }

        if (currentState == State.HALF_OPEN) {
            int successes = successCountInHalfOpen.incrementAndGet();
            if (successes >= settings.halfOpenRequests()
                    && state.compareAndSet(State.HALF_OPEN, State.CLOSED)) {
                failureCount.set(0);
                log.info("Circuit breaker CLOSED after recovery: targetService={}", targetService);
            }
        }
    }

    /**
     * Records a failed call.
     */
    public void recordFailure() {
        Instant now = clock.instant();
        Instant previousFailure = lastFailureTime;
        lastFailureTime = now;
        State currentState = state.get();

        if (currentState == State.HALF_OPEN) {
            // Any failure in half-open immediately opens the circuit
            if (state.compareAndSet(State.HALF_OPEN, State.OPEN)) {
                openedAt = now;
                log.warn("Circuit breaker OPENED (half-open failure): targetService={}", targetService);
            }
            return;
        }

        if (currentState == State.CLOSED) {
            if (previousFailure != null
                    && Duration.between(previousFailure, now).compareTo(settings.interval()) > 0) {
                // Errors outside the interval are not consecutive
                failureCount.set(0);
            }
            int failures = failureCount.incrementAndGet();
            if (failures >= settings.failureThreshold() && state.compareAndSet(State.CLOSED, State.OPEN)) {
                openedAt = now;
                log.warn("Circuit breaker OPENED: targetService={}, failures={}", targetService, failures);
            }
        }
    }

    /**
     * Returns a probe permit taken by a call that never reached an instance.
     * Only meaningful in HALF_OPEN; in other states permits are not counted.
     */
    public void releasePermission() {
        if (state.get() != State.HALF_OPEN) {
            return;
        }
        halfOpenPermits.updateAndGet(issued -> Math.max(0, issued - 1));
        log.debug("Circuit breaker half-open permit released: targetService={}", targetService);
    }

    /**
     * Returns the current state, moving OPEN to HALF_OPEN once the recovery timeout elapsed.
     */
    public State getState() {
        if (state.get() == State.OPEN && openedAt != null
                && !clock.instant().isBefore(openedAt.plus(settings.recoveryTimeout()))
                && state.compareAndSet(State.OPEN, State.HALF_OPEN)) {
            halfOpenPermits.set(0);
            successCountInHalfOpen.set(0);
            log.info("Circuit breaker transitioning to HALF_OPEN: targetService={}", targetService);
        }
        return state.get();
    }

    public int getFailureCount() {
        return failureCount.get();
    }

    public CircuitBreakerSettings getSettings() {
        return settings;
    }

    @Override
    public String toString() {
        return "CircuitBreaker{" +
                "targetService='" + targetService + '\'' +
                ", state=" + state.get() +
                ", failures=" + failureCount.get() +
                '}';
    }
}
