package fr.lapetina.orchestrator.infrastructure.health;

import fr.lapetina.orchestrator.domain.model.HealthCheckSpec;
import fr.lapetina.orchestrator.domain.model.InstanceState;
import fr.lapetina.orchestrator.domain.model.Service;
import fr.lapetina.orchestrator.infrastructure.registry.ServiceRegistry;
import fr.lapetina.orchestrator.support.Fixtures;
import fr.lapetina.orchestrator.support.ScriptedProbeTransport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;

class HealthMonitorTest {

    private ServiceRegistry registry;
    private ScriptedProbeTransport probes;
    private HealthMonitor monitor;

    @BeforeEach
    void setUp() {
        registry = new ServiceRegistry();
        // successThreshold 1, failureThreshold 2
        registry.register(Fixtures.service("auth", "1.0.0"));
        probes = new ScriptedProbeTransport();
        monitor = new HealthMonitor(registry, probes, Duration.ofHours(1), 4);
    }

    @AfterEach
    void tearDown() {
        monitor.close();
    }

    private InstanceState stateOf(String instanceId) {
        return registry.findInstance(instanceId).orElseThrow().getState();
    }

    @Nested
    @DisplayName("Hysteresis")
    class HysteresisTests {

        @Test
        @DisplayName("should promote a starting instance after the success threshold")
        void shouldPromoteStartingInstance() {
            registry.addInstance("auth", Fixtures.instance("auth-1", "auth", "1.0.0", InstanceState.STARTING));

            monitor.runCycle().join();

            assertThat(stateOf("auth-1")).isEqualTo(InstanceState.HEALTHY);
        }

        @Test
        @DisplayName("should require consecutive failures before marking unhealthy")
        void shouldRequireConsecutiveFailures() {
            registry.addInstance("auth", Fixtures.healthy("auth-1", "auth"));
            probes.answer("auth-1", false);

            monitor.runCycle().join();
            assertThat(stateOf("auth-1")).isEqualTo(InstanceState.HEALTHY);

            monitor.runCycle().join();
            assertThat(stateOf("auth-1")).isEqualTo(InstanceState.UNHEALTHY);
        }

        @Test
        @DisplayName("should reset the failure streak on success")
        void shouldResetFailureStreak() {
            registry.addInstance("auth", Fixtures.healthy("auth-1", "auth"));

            probes.answer("auth-1", false);
            monitor.runCycle().join();
            probes.answer("auth-1", true);
            monitor.runCycle().join();
            probes.answer("auth-1", false);
            monitor.runCycle().join();

            assertThat(stateOf("auth-1")).isEqualTo(InstanceState.HEALTHY);
        }

        @Test
        @DisplayName("should recover an unhealthy instance")
        void shouldRecoverUnhealthyInstance() {
            registry.addInstance("auth", Fixtures.instance("auth-1", "auth", "1.0.0", InstanceState.UNHEALTHY));

            monitor.runCycle().join();

            assertThat(stateOf("auth-1")).isEqualTo(InstanceState.HEALTHY);
        }

        @Test
        @DisplayName("should honour a higher success threshold")
        void shouldHonourSuccessThreshold() {
            Service strict = Fixtures.service("orders", "1.0.0").toBuilder()
                    .healthCheck(new HealthCheckSpec("/health", Duration.ofSeconds(10), Duration.ofSeconds(1), 3, 1))
                    .build();
            registry.register(strict);
            registry.addInstance("orders", Fixtures.instance("orders-1", "orders", "1.0.0", InstanceState.STARTING));

            monitor.runCycle().join();
            monitor.runCycle().join();
            assertThat(stateOf("orders-1")).isEqualTo(InstanceState.STARTING);

            monitor.runCycle().join();
            assertThat(stateOf("orders-1")).isEqualTo(InstanceState.HEALTHY);
        }
    }

    @Nested
    @DisplayName("Probe handling")
    class ProbeHandlingTests {

        @Test
        @DisplayName("should count a failing probe as a failure")
        void shouldCountExceptionsAsFailures() {
            registry.addInstance("auth", Fixtures.healthy("auth-1", "auth"));
            HealthMonitor throwing = new HealthMonitor(registry,
                    (instance, spec) -> CompletableFuture.failedFuture(new IllegalStateException("connection refused")),
                    Duration.ofHours(1), 2);
            try {
                throwing.runCycle().join();
                throwing.runCycle().join();
            } finally {
                throwing.close();
            }

            assertThat(stateOf("auth-1")).isEqualTo(InstanceState.UNHEALTHY);
        }

        @Test
        @DisplayName("should time out a hanging probe")
        void shouldTimeOutHangingProbe() {
            Service quick = Fixtures.service("orders", "1.0.0").toBuilder()
                    .healthCheck(new HealthCheckSpec("/health", Duration.ofSeconds(10), Duration.ofMillis(50), 1, 1))
                    .build();
            registry.register(quick);
            registry.addInstance("orders", Fixtures.healthy("orders-1", "orders"));
            HealthMonitor hanging = new HealthMonitor(registry,
                    (instance, spec) -> new CompletableFuture<>(), Duration.ofHours(1), 2);
            try {
                hanging.checkInstance(quick, registry.findInstance("orders-1").orElseThrow()).join();
            } finally {
                hanging.close();
            }

            assertThat(stateOf("orders-1")).isEqualTo(InstanceState.UNHEALTHY);
        }

        @Test
        @DisplayName("should isolate failures to the failing instance")
        void shouldIsolateFailures() {
            registry.addInstance("auth", Fixtures.healthy("auth-1", "auth"));
            registry.addInstance("auth", Fixtures.healthy("auth-2", "auth"));
            probes.answer("auth-2", false);

            monitor.runCycle().join();
            monitor.runCycle().join();

            assertThat(stateOf("auth-1")).isEqualTo(InstanceState.HEALTHY);
            assertThat(stateOf("auth-2")).isEqualTo(InstanceState.UNHEALTHY);
        }

        @Test
        @DisplayName("should skip stopping instances")
        void shouldSkipStoppingInstances() {
            registry.addInstance("auth", Fixtures.instance("auth-1", "auth", "1.0.0", InstanceState.STOPPING));

            monitor.runCycle().join();

            assertThat(probes.getProbeCount()).isZero();
            assertThat(stateOf("auth-1")).isEqualTo(InstanceState.STOPPING);
        }
    }

    @Nested
    @DisplayName("Counter bookkeeping")
    class CounterTests {

        @Test
        @DisplayName("should forget counters of removed instances")
        void shouldForgetRemovedInstances() {
            registry.addInstance("auth", Fixtures.healthy("auth-1", "auth"));
            registry.addInstance("auth", Fixtures.healthy("auth-2", "auth"));
            probes.answer("auth-1", false);
            monitor.runCycle().join();
            assertThat(monitor.trackedInstanceCount()).isEqualTo(2);

            registry.removeInstance("auth", "auth-1");

            assertThat(monitor.trackedInstanceCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("should start a fresh streak for a re-added instance id")
        void shouldStartFreshStreakForReAddedId() {
            registry.addInstance("auth", Fixtures.healthy("auth-1", "auth"));
            probes.answer("auth-1", false);
            monitor.runCycle().join();

            registry.removeInstance("auth", "auth-1");
            registry.addInstance("auth", Fixtures.healthy("auth-1", "auth"));
            monitor.runCycle().join();

            // One failure since re-adding stays below the threshold of two
            assertThat(stateOf("auth-1")).isEqualTo(InstanceState.HEALTHY);
        }
    }
}
