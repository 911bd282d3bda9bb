package fr.lapetina.orchestrator.integration;

import fr.lapetina.orchestrator.ServiceOrchestrator;
import fr.lapetina.orchestrator.domain.model.CallResult;
import fr.lapetina.orchestrator.domain.model.InstanceState;
import fr.lapetina.orchestrator.domain.model.Policy;
import fr.lapetina.orchestrator.domain.model.PolicyType;
import fr.lapetina.orchestrator.infrastructure.policy.CircuitBreaker;
import fr.lapetina.orchestrator.support.FakeProvisioner;
import fr.lapetina.orchestrator.support.Fixtures;
import fr.lapetina.orchestrator.support.MutableClock;
import fr.lapetina.orchestrator.support.ScriptedProbeTransport;
import fr.lapetina.orchestrator.support.StubServiceTransport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Calls through the whole pipeline against a two-instance "api" service
 * (api-1, api-2), with a controllable clock for circuit breaker recovery.
 */
class CallDispatchIntegrationTest {

    private MutableClock clock;
    private StubServiceTransport transport;
    private ServiceOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        transport = new StubServiceTransport();
    }

    @AfterEach
    void tearDown() {
        if (orchestrator != null) {
            orchestrator.close();
        }
    }

    private void start(Policy... policies) {
        ServiceOrchestrator.Builder builder = ServiceOrchestrator.builder()
                .clock(clock)
                .provisioner(new FakeProvisioner(clock))
                .probeTransport(new ScriptedProbeTransport())
                .serviceTransport(transport)
                .healthMonitorEnabled(false)
                .usageCollectionInterval(Duration.ofHours(1))
                .defaultCallTimeout(Duration.ofSeconds(2))
                .ringBufferSize(64)
                .service(Fixtures.service("api", "1.0.0"), 2);
        for (Policy policy : policies) {
            builder.policy(policy);
        }
        orchestrator = builder.build().start();
    }

    private void setState(String instanceId, InstanceState state) {
        orchestrator.getRegistry().updateInstanceHealth(instanceId, state);
    }

    private CallResult call() {
        return orchestrator.callService("web", "api", "/items", null);
    }

    private static Policy breaker(int consecutiveErrors, long recoveryTimeoutMs, int halfOpenRequests) {
        return Policy.of("api-breaker", PolicyType.CIRCUIT_BREAKER, "api", Map.of(
                "consecutiveErrors", consecutiveErrors,
                "intervalMs", 60_000,
                "recoveryTimeoutMs", recoveryTimeoutMs,
                "halfOpenRequests", halfOpenRequests));
    }

    private static Policy retry(int retries) {
        return Policy.of("api-retry", PolicyType.RETRY, "api", Map.of("retries", retries));
    }

    @Nested
    @DisplayName("Circuit breaker recovery")
    class BreakerRecoveryTests {

        @Test
        @DisplayName("should keep the half-open budget when no instance was available")
        void shouldRecoverAfterCallWithoutInstance() {
            start(breaker(1, 1000, 1));
            setState("api-1", InstanceState.HEALTHY);
            transport.failOn("api-1");

            assertThat(call().error()).isEqualTo("ServiceError");
            assertThat(orchestrator.getPolicyEngine().circuitState("api")).contains(CircuitBreaker.State.OPEN);

            setState("api-1", InstanceState.UNHEALTHY);
            clock.advance(Duration.ofSeconds(2));
            assertThat(call().error()).isEqualTo("NoHealthyInstance");
            assertThat(orchestrator.getPolicyEngine().circuitState("api")).contains(CircuitBreaker.State.HALF_OPEN);

            setState("api-1", InstanceState.HEALTHY);
            transport.reset();
            CallResult recovered = call();

            assertThat(recovered.success()).isTrue();
            assertThat(recovered.instanceId()).isEqualTo("api-1");
            assertThat(orchestrator.getPolicyEngine().circuitState("api")).contains(CircuitBreaker.State.CLOSED);
        }

        @Test
        @DisplayName("should reject calls while open")
        void shouldRejectWhileOpen() {
            start(breaker(1, 60_000, 1));
            setState("api-1", InstanceState.HEALTHY);
            transport.failOn("api-1");
            call();

            CallResult rejected = call();

            assertThat(rejected.error()).isEqualTo("CircuitOpen");
            assertThat(transport.getServedBy()).containsExactly("api-1");
        }
    }

    @Nested
    @DisplayName("Retries")
    class RetryTests {

        @Test
        @DisplayName("should retry a failed call on another instance")
        void shouldRetryOnAnotherInstance() {
            start(retry(1));
            setState("api-1", InstanceState.HEALTHY);
            setState("api-2", InstanceState.HEALTHY);
            transport.failOn("api-1");

            CallResult result = call();

            assertThat(result.success()).isTrue();
            assertThat(result.instanceId()).isEqualTo("api-2");
            assertThat(transport.getServedBy()).containsExactly("api-1", "api-2");
        }

        @Test
        @DisplayName("should report the last failure once retries are exhausted")
        void shouldStopWhenRetriesExhausted() {
            start(retry(2));
            setState("api-1", InstanceState.HEALTHY);
            transport.failOn("api-1");

            CallResult result = call();

            assertThat(result.success()).isFalse();
            assertThat(result.error()).isEqualTo("ServiceError");
            assertThat(transport.getServedBy()).containsExactly("api-1", "api-1", "api-1");
        }

        @Test
        @DisplayName("should stop retrying once the breaker opened")
        void shouldStopRetryingWhenBreakerOpens() {
            start(retry(3), breaker(1, 60_000, 1));
            setState("api-1", InstanceState.HEALTHY);
            setState("api-2", InstanceState.HEALTHY);
            transport.failOn("api-1");
            transport.failOn("api-2");

            CallResult result = call();

            assertThat(result.error()).isEqualTo("ServiceError");
            assertThat(transport.getServedBy()).containsExactly("api-1");
            assertThat(orchestrator.getPolicyEngine().circuitState("api")).contains(CircuitBreaker.State.OPEN);
        }

        @Test
        @DisplayName("should not retry half-open trial calls")
        void shouldNotRetryHalfOpenTrialCall() {
            start(retry(3), breaker(1, 1000, 1));
            setState("api-1", InstanceState.HEALTHY);
            setState("api-2", InstanceState.HEALTHY);
            transport.failOn("api-1");
            transport.failOn("api-2");
            call();
            clock.advance(Duration.ofSeconds(2));
            transport.reset();
            transport.failOn("api-1");
            transport.failOn("api-2");

            CallResult trialCall = call();

            assertThat(trialCall.success()).isFalse();
            assertThat(transport.getServedBy()).hasSize(1);
            assertThat(orchestrator.getPolicyEngine().circuitState("api")).contains(CircuitBreaker.State.OPEN);
        }
    }

    @Nested
    @DisplayName("Timeouts")
    class TimeoutTests {

        @Test
        @DisplayName("should fail a hanging call with Timeout under a timeout policy")
        void shouldTimeOut() {
            start(Policy.of("api-timeout", PolicyType.TIMEOUT, "api", Map.of("timeoutMs", 100)));
            setState("api-1", InstanceState.HEALTHY);
            transport.hang(true);

            CallResult result = call();

            assertThat(result.success()).isFalse();
            assertThat(result.error()).isEqualTo("Timeout");
            assertThat(result.instanceId()).isEqualTo("api-1");
            assertThat(result.responseTimeMs()).isGreaterThanOrEqualTo(100);
        }

        @Test
        @DisplayName("should retry a timed-out call on another instance")
        void shouldRetryAfterTimeout() {
            start(Policy.of("api-timeout", PolicyType.TIMEOUT, "api", Map.of("timeoutMs", 100)), retry(1));
            setState("api-1", InstanceState.HEALTHY);
            transport.hang(true);

            CallResult result = call();

            assertThat(result.error()).isEqualTo("Timeout");
            assertThat(transport.getServedBy()).containsExactly("api-1", "api-1");
        }
    }
}
