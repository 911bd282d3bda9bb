package fr.lapetina.orchestrator.infrastructure.deployment;

import fr.lapetina.orchestrator.domain.exception.ConflictException;
import fr.lapetina.orchestrator.domain.exception.NotFoundException;
import fr.lapetina.orchestrator.domain.model.CanaryConfig;
import fr.lapetina.orchestrator.domain.model.DeploymentRecord;
import fr.lapetina.orchestrator.domain.model.DeploymentRequest;
import fr.lapetina.orchestrator.domain.model.DeploymentStatus;
import fr.lapetina.orchestrator.domain.model.DeploymentStrategy;
import fr.lapetina.orchestrator.domain.model.ErrorType;
import fr.lapetina.orchestrator.domain.model.Service;
import fr.lapetina.orchestrator.domain.model.ServiceInstance;
import fr.lapetina.orchestrator.infrastructure.balancer.LoadBalancer;
import fr.lapetina.orchestrator.infrastructure.balancer.RoutingTable;
import fr.lapetina.orchestrator.infrastructure.health.HealthMonitor;
import fr.lapetina.orchestrator.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.orchestrator.infrastructure.metrics.TrafficRecorder;
import fr.lapetina.orchestrator.infrastructure.registry.InMemoryInstanceStore;
import fr.lapetina.orchestrator.infrastructure.registry.InMemoryServiceStore;
import fr.lapetina.orchestrator.infrastructure.registry.ServiceRegistry;
import fr.lapetina.orchestrator.infrastructure.runtime.DeploymentValidator;
import fr.lapetina.orchestrator.support.Await;
import fr.lapetina.orchestrator.support.FakeProvisioner;
import fr.lapetina.orchestrator.support.Fixtures;
import fr.lapetina.orchestrator.support.ScriptedProbeTransport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DeploymentControllerTest {

    private static final Duration WAIT = Duration.ofSeconds(10);

    private ServiceRegistry registry;
    private LoadBalancer loadBalancer;
    private FakeProvisioner provisioner;
    private ScriptedProbeTransport probes;
    private HealthMonitor healthMonitor;
    private TrafficRecorder trafficRecorder;
    private MetricsRegistry metrics;
    private AtomicReference<DeploymentValidator.Result> validation;
    private DeploymentController controller;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.systemUTC();
        registry = new ServiceRegistry(new InMemoryServiceStore(), new InMemoryInstanceStore(), clock);
        registry.register(Fixtures.service("orders", "1.0.0"));
        registry.addInstance("orders", Fixtures.healthy("orders-a", "orders"));
        registry.addInstance("orders", Fixtures.healthy("orders-b", "orders"));

        loadBalancer = new LoadBalancer(registry);
        provisioner = new FakeProvisioner(clock);
        probes = new ScriptedProbeTransport();
        healthMonitor = new HealthMonitor(registry, probes, Duration.ofMillis(20), 4);
        healthMonitor.start();
        trafficRecorder = new TrafficRecorder();
        metrics = new MetricsRegistry("test");
        validation = new AtomicReference<>(DeploymentValidator.Result.ok());

        controller = new DeploymentController(registry, loadBalancer, provisioner,
                (record, instances) -> CompletableFuture.completedFuture(validation.get()),
                trafficRecorder, metrics,
                new DeploymentSettings(Duration.ofSeconds(2), Duration.ofMillis(500),
                        Duration.ofSeconds(2), Duration.ofSeconds(2)),
                clock);
    }

    @AfterEach
    void tearDown() {
        controller.close();
        healthMonitor.close();
        metrics.close();
    }

    private DeploymentRecord deployAndWait(DeploymentRequest request) throws Exception {
        String id = controller.deploy(request);
        return controller.awaitCompletion(id).get(WAIT.toMillis(), TimeUnit.MILLISECONDS);
    }

    private static Service version2() {
        return Fixtures.service("orders", "2.0.0");
    }

    @Nested
    @DisplayName("Rolling update")
    class RollingUpdateTests {

        @Test
        @DisplayName("should replace every instance with the new version")
        void shouldReplaceEveryInstance() throws Exception {
            DeploymentRecord record = deployAndWait(DeploymentRequest.of(version2(), DeploymentStrategy.ROLLING_UPDATE));

            assertThat(record.status()).isEqualTo(DeploymentStatus.COMPLETED);
            assertThat(record.rollbackVersion()).isEqualTo("1.0.0");
            assertThat(record.instanceIds()).containsExactly("orders-1", "orders-2");
            assertThat(record.endTime()).isNotNull();

            assertThat(registry.listInstances("orders")).extracting(ServiceInstance::getVersion)
                    .containsOnly("2.0.0")
                    .hasSize(2);
            assertThat(loadBalancer.routableInstances("orders")).extracting(ServiceInstance::getVersion)
                    .containsOnly("2.0.0");
            assertThat(registry.getService("orders").getVersion()).isEqualTo("2.0.0");
            assertThat(provisioner.getTerminated()).containsExactlyInAnyOrder("orders-a", "orders-b");
            assertThat(registry.isDeploymentInProgress("orders")).isFalse();
        }

        @Test
        @DisplayName("should honour an explicit replica count")
        void shouldHonourReplicas() throws Exception {
            DeploymentRecord record = deployAndWait(
                    new DeploymentRequest(version2(), DeploymentStrategy.ROLLING_UPDATE, 3, null));

            assertThat(record.status()).isEqualTo(DeploymentStatus.COMPLETED);
            assertThat(registry.listInstances("orders")).hasSize(3);
        }

        @Test
        @DisplayName("should time out when new instances never become healthy")
        void shouldTimeOutHealthGate() throws Exception {
            probes.answerAll(instance -> instance.getVersion().equals("1.0.0"));

            DeploymentRecord record = deployAndWait(DeploymentRequest.of(version2(), DeploymentStrategy.ROLLING_UPDATE));

            assertThat(record.status()).isEqualTo(DeploymentStatus.FAILED);
            assertThat(record.errorType()).isEqualTo(ErrorType.DEPLOYMENT_TIMEOUT);
            assertThat(record.errorReason()).isEqualTo("DeploymentTimeout");
            assertThat(registry.listInstances("orders")).extracting(ServiceInstance::getId)
                    .containsExactly("orders-a", "orders-b");
            assertThat(loadBalancer.activeVersion("orders")).contains("1.0.0");
            assertThat(registry.getService("orders").getVersion()).isEqualTo("1.0.0");
        }

        @Test
        @DisplayName("should fail on provisioning errors and discard created instances")
        void shouldFailOnProvisioningError() throws Exception {
            provisioner.failNext(1);

            DeploymentRecord record = deployAndWait(DeploymentRequest.of(version2(), DeploymentStrategy.ROLLING_UPDATE));

            assertThat(record.status()).isEqualTo(DeploymentStatus.FAILED);
            assertThat(record.errorType()).isEqualTo(ErrorType.PROVISIONING_FAILED);
            assertThat(registry.listInstances("orders")).extracting(ServiceInstance::getVersion).containsOnly("1.0.0");
            assertThat(provisioner.getTerminated()).hasSize(1);
        }

        @Test
        @DisplayName("should terminate instances that arrive after the provisioning timeout")
        void shouldTerminateLateInstances() throws Exception {
            provisioner.delay(Duration.ofMillis(500));
            DeploymentController impatient = new DeploymentController(registry, loadBalancer, provisioner,
                    (record, instances) -> CompletableFuture.completedFuture(validation.get()),
                    trafficRecorder, metrics,
                    new DeploymentSettings(Duration.ofMillis(100), Duration.ofMillis(500),
                            Duration.ofSeconds(2), Duration.ofSeconds(2)),
                    Clock.systemUTC());
            try {
                String id = impatient.deploy(
                        new DeploymentRequest(version2(), DeploymentStrategy.ROLLING_UPDATE, 2, null));
                DeploymentRecord record = impatient.awaitCompletion(id).get(WAIT.toMillis(), TimeUnit.MILLISECONDS);

                assertThat(record.status()).isEqualTo(DeploymentStatus.FAILED);
                assertThat(record.errorType()).isEqualTo(ErrorType.PROVISIONING_FAILED);

                Await.until(() -> provisioner.getProvisioned().size() == 2, WAIT);
                Await.until(() -> provisioner.getTerminated().size() == 2, WAIT);
                assertThat(provisioner.getTerminated()).containsExactlyInAnyOrder("orders-1", "orders-2");
                assertThat(registry.listInstances("orders")).extracting(ServiceInstance::getId)
                        .containsExactly("orders-a", "orders-b");
            } finally {
                impatient.close();
            }
        }
    }

    @Nested
    @DisplayName("Blue-green")
    class BlueGreenTests {

        @Test
        @DisplayName("should switch traffic and retire the previous environment")
        void shouldSwitchEnvironment() throws Exception {
            DeploymentRecord record = deployAndWait(DeploymentRequest.of(version2(), DeploymentStrategy.BLUE_GREEN));

            assertThat(record.status()).isEqualTo(DeploymentStatus.COMPLETED);
            assertThat(loadBalancer.activeVersion("orders")).contains("2.0.0");
            assertThat(registry.listInstances("orders")).extracting(ServiceInstance::getVersion).containsOnly("2.0.0");
        }

        @Test
        @DisplayName("should deploy a service that was never registered")
        void shouldDeployNewService() throws Exception {
            DeploymentRecord record = deployAndWait(
                    DeploymentRequest.of(Fixtures.service("billing", "1.0.0"), DeploymentStrategy.BLUE_GREEN));

            assertThat(record.status()).isEqualTo(DeploymentStatus.COMPLETED);
            assertThat(record.rollbackVersion()).isNull();
            assertThat(registry.listHealthyInstances("billing")).hasSize(1);
            assertThat(loadBalancer.selectInstance("billing").getId()).isEqualTo("billing-1");
        }
    }

    @Nested
    @DisplayName("Canary")
    class CanaryTests {

        private DeploymentRequest canaryRequest() {
            return new DeploymentRequest(version2(), DeploymentStrategy.CANARY, 1,
                    new CanaryConfig(25, Duration.ofMillis(400), new CanaryConfig.SuccessCriteria(0.9, 500, 0.1)));
        }

        @Test
        @DisplayName("should promote a canary without traffic")
        void shouldPromoteQuietCanary() throws Exception {
            DeploymentRecord record = deployAndWait(canaryRequest());

            assertThat(record.status()).isEqualTo(DeploymentStatus.COMPLETED);
            assertThat(loadBalancer.routingFor("orders")).get()
                    .satisfies(route -> {
                        assertThat(route.activeVersion()).isEqualTo("2.0.0");
                        assertThat(route.hasCanary()).isFalse();
                    });
        }

        @Test
        @DisplayName("should abort a canary that breaks its success criteria")
        void shouldAbortFailingCanary() throws Exception {
            String id = controller.deploy(canaryRequest());
            Await.until(() -> loadBalancer.routingFor("orders").map(RoutingTable::hasCanary).orElse(false), WAIT);
            for (int i = 0; i < 10; i++) {
                trafficRecorder.recordAttempt("orders", "2.0.0", false, 20);
            }

            DeploymentRecord record = controller.awaitCompletion(id).get(WAIT.toMillis(), TimeUnit.MILLISECONDS);

            assertThat(record.status()).isEqualTo(DeploymentStatus.FAILED);
            assertThat(record.errorType()).isEqualTo(ErrorType.DEPLOYMENT_VALIDATION_FAILED);
            assertThat(record.error()).contains("successRate");
            assertThat(loadBalancer.routingFor("orders")).get()
                    .satisfies(route -> {
                        assertThat(route.activeVersion()).isEqualTo("1.0.0");
                        assertThat(route.hasCanary()).isFalse();
                    });
            assertThat(registry.listInstances("orders")).extracting(ServiceInstance::getVersion).containsOnly("1.0.0");
        }
    }

    @Nested
    @DisplayName("Validation and rollback")
    class RollbackTests {

        @Test
        @DisplayName("should leave the new version live when validation fails")
        void shouldLeaveNewVersionLive() throws Exception {
            validation.set(DeploymentValidator.Result.failed("smoke test returned 500"));

            DeploymentRecord record = deployAndWait(DeploymentRequest.of(version2(), DeploymentStrategy.ROLLING_UPDATE));

            assertThat(record.status()).isEqualTo(DeploymentStatus.FAILED);
            assertThat(record.errorType()).isEqualTo(ErrorType.DEPLOYMENT_VALIDATION_FAILED);
            assertThat(loadBalancer.activeVersion("orders")).contains("2.0.0");
            assertThat(registry.listInstances("orders")).hasSize(4);
        }

        @Test
        @DisplayName("should restore the previous version on rollback")
        void shouldRollBack() throws Exception {
            validation.set(DeploymentValidator.Result.failed("smoke test returned 500"));
            DeploymentRecord failed = deployAndWait(DeploymentRequest.of(version2(), DeploymentStrategy.ROLLING_UPDATE));

            DeploymentRecord rolledBack = controller.rollback(failed.id()).get(WAIT.toMillis(), TimeUnit.MILLISECONDS);

            assertThat(rolledBack.status()).isEqualTo(DeploymentStatus.ROLLED_BACK);
            assertThat(controller.getStatus(failed.id()).status()).isEqualTo(DeploymentStatus.ROLLED_BACK);
            assertThat(loadBalancer.activeVersion("orders")).contains("1.0.0");
            assertThat(registry.getService("orders").getVersion()).isEqualTo("1.0.0");
            assertThat(registry.listInstances("orders")).extracting(ServiceInstance::getId)
                    .containsExactly("orders-a", "orders-b");
        }

        @Test
        @DisplayName("should reprovision the previous version after a completed deployment")
        void shouldReprovisionAfterCompletion() throws Exception {
            DeploymentRecord completed = deployAndWait(DeploymentRequest.of(version2(), DeploymentStrategy.ROLLING_UPDATE));

            DeploymentRecord rolledBack = controller.rollback(completed.id()).get(WAIT.toMillis(), TimeUnit.MILLISECONDS);

            assertThat(rolledBack.status()).isEqualTo(DeploymentStatus.ROLLED_BACK);
            assertThat(registry.listInstances("orders")).extracting(ServiceInstance::getVersion)
                    .containsOnly("1.0.0")
                    .hasSize(2);
        }

        @Test
        @DisplayName("should terminate reprovisioned instances when the rollback fails")
        void shouldCleanUpFailedRollback() throws Exception {
            DeploymentRecord completed = deployAndWait(DeploymentRequest.of(version2(), DeploymentStrategy.ROLLING_UPDATE));
            provisioner.failNext(1);

            CompletableFuture<DeploymentRecord> rollback = controller.rollback(completed.id());

            assertThatThrownBy(() -> rollback.get(WAIT.toMillis(), TimeUnit.MILLISECONDS))
                    .hasRootCauseMessage("Provisioning failed: No capacity left on node");
            assertThat(provisioner.getTerminated()).containsExactlyInAnyOrder("orders-a", "orders-b", "orders-3");
            assertThat(registry.listInstances("orders")).extracting(ServiceInstance::getVersion)
                    .containsOnly("2.0.0");
            assertThat(controller.getStatus(completed.id()).status()).isEqualTo(DeploymentStatus.COMPLETED);
            assertThat(registry.isDeploymentInProgress("orders")).isFalse();
        }

        @Test
        @DisplayName("should refuse to roll back a deployment twice")
        void shouldRefuseSecondRollback() throws Exception {
            validation.set(DeploymentValidator.Result.failed("smoke test returned 500"));
            DeploymentRecord failed = deployAndWait(DeploymentRequest.of(version2(), DeploymentStrategy.ROLLING_UPDATE));
            controller.rollback(failed.id()).get(WAIT.toMillis(), TimeUnit.MILLISECONDS);

            assertThatThrownBy(() -> controller.rollback(failed.id()))
                    .isInstanceOf(ConflictException.class);
        }
    }

    @Nested
    @DisplayName("Lifecycle")
    class LifecycleTests {

        @Test
        @DisplayName("should reject a second deployment of the same service")
        void shouldRejectConcurrentDeployment() throws Exception {
            provisioner.hang(true);
            String first = controller.deploy(DeploymentRequest.of(version2(), DeploymentStrategy.ROLLING_UPDATE));

            assertThatThrownBy(() -> controller.deploy(
                    DeploymentRequest.of(Fixtures.service("orders", "3.0.0"), DeploymentStrategy.ROLLING_UPDATE)))
                    .isInstanceOf(ConflictException.class);

            assertThat(controller.cancel(first)).isTrue();
            controller.awaitCompletion(first).get(WAIT.toMillis(), TimeUnit.MILLISECONDS);
        }

        @Test
        @DisplayName("should end a cancelled deployment as failed")
        void shouldCancelDeployment() throws Exception {
            provisioner.hang(true);
            String id = controller.deploy(DeploymentRequest.of(version2(), DeploymentStrategy.ROLLING_UPDATE));
            assertThat(controller.getStatus(id).status()).isEqualTo(DeploymentStatus.IN_PROGRESS);

            assertThat(controller.cancel(id)).isTrue();
            DeploymentRecord record = controller.awaitCompletion(id).get(WAIT.toMillis(), TimeUnit.MILLISECONDS);

            assertThat(record.status()).isEqualTo(DeploymentStatus.FAILED);
            assertThat(record.errorType()).isEqualTo(ErrorType.CANCELLED);
            assertThat(controller.cancel(id)).isFalse();
            assertThat(loadBalancer.activeVersion("orders")).contains("1.0.0");
            assertThat(registry.isDeploymentInProgress("orders")).isFalse();
        }

        @Test
        @DisplayName("should keep the history of a service in start order")
        void shouldKeepHistory() throws Exception {
            DeploymentRecord first = deployAndWait(DeploymentRequest.of(version2(), DeploymentStrategy.ROLLING_UPDATE));
            Thread.sleep(5);
            DeploymentRecord second = deployAndWait(
                    DeploymentRequest.of(Fixtures.service("orders", "3.0.0"), DeploymentStrategy.ROLLING_UPDATE));

            assertThat(controller.history("orders")).extracting(DeploymentRecord::id)
                    .containsExactly(first.id(), second.id());
            assertThat(controller.history("billing")).isEmpty();
        }

        @Test
        @DisplayName("should throw NotFound for unknown deployments")
        void shouldThrowForUnknownDeployment() {
            assertThatThrownBy(() -> controller.getStatus("deploy-missing"))
                    .isInstanceOf(NotFoundException.class);
        }
    }
}
