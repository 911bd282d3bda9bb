package fr.lapetina.orchestrator.infrastructure.registry;

import fr.lapetina.orchestrator.domain.exception.ConflictException;
import fr.lapetina.orchestrator.domain.exception.NotFoundException;
import fr.lapetina.orchestrator.domain.model.InstanceState;
import fr.lapetina.orchestrator.domain.model.InstanceUsage;
import fr.lapetina.orchestrator.domain.model.ServiceInstance;
import fr.lapetina.orchestrator.support.Fixtures;
import fr.lapetina.orchestrator.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ServiceRegistryTest {

    private MutableClock clock;
    private ServiceRegistry registry;
    private List<ServiceRegistry.RegistryEvent> events;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        registry = new ServiceRegistry(new InMemoryServiceStore(), new InMemoryInstanceStore(), clock);
        events = new CopyOnWriteArrayList<>();
        registry.addListener(events::add);
        registry.register(Fixtures.service("auth", "1.0.0"));
    }

    @Nested
    @DisplayName("Services")
    class ServiceTests {

        @Test
        @DisplayName("should register and look up a service")
        void shouldRegisterService() {
            assertThat(registry.contains("auth")).isTrue();
            assertThat(registry.getService("auth").getVersion()).isEqualTo("1.0.0");
            assertThat(events).extracting(ServiceRegistry.RegistryEvent::type)
                    .containsExactly(ServiceRegistry.RegistryEvent.Type.SERVICE_REGISTERED);
        }

        @Test
        @DisplayName("should publish an update when re-registering")
        void shouldPublishUpdate() {
            registry.register(Fixtures.service("auth", "2.0.0"));

            assertThat(registry.getService("auth").getVersion()).isEqualTo("2.0.0");
            assertThat(registry.listServices()).hasSize(1);
            assertThat(events).extracting(ServiceRegistry.RegistryEvent::type)
                    .endsWith(ServiceRegistry.RegistryEvent.Type.SERVICE_UPDATED);
        }

        @Test
        @DisplayName("should throw NotFound for unknown services")
        void shouldThrowForUnknownService() {
            assertThatThrownBy(() -> registry.getService("billing"))
                    .isInstanceOf(NotFoundException.class)
                    .hasMessage("Service not found: billing");
            assertThatThrownBy(() -> registry.listInstances("billing"))
                    .isInstanceOf(NotFoundException.class);
        }
    }

    @Nested
    @DisplayName("Instances")
    class InstanceTests {

        @Test
        @DisplayName("should list instances ordered by id")
        void shouldListInstancesOrdered() {
            registry.addInstance("auth", Fixtures.healthy("auth-b", "auth"));
            registry.addInstance("auth", Fixtures.healthy("auth-a", "auth"));
            registry.addInstance("auth", Fixtures.instance("auth-c", "auth", "1.0.0", InstanceState.STARTING));

            assertThat(registry.listInstances("auth")).extracting(ServiceInstance::getId)
                    .containsExactly("auth-a", "auth-b", "auth-c");
            assertThat(registry.listHealthyInstances("auth")).extracting(ServiceInstance::getId)
                    .containsExactly("auth-a", "auth-b");
        }

        @Test
        @DisplayName("should reject duplicate instance ids")
        void shouldRejectDuplicates() {
            registry.addInstance("auth", Fixtures.healthy("auth-1", "auth"));

            assertThatThrownBy(() -> registry.addInstance("auth", Fixtures.healthy("auth-1", "auth")))
                    .isInstanceOf(ConflictException.class);
        }

        @Test
        @DisplayName("should reject instances of another service")
        void shouldRejectForeignInstance() {
            assertThatThrownBy(() -> registry.addInstance("auth", Fixtures.healthy("orders-1", "orders")))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("should reject instances of unknown services")
        void shouldRejectUnknownService() {
            assertThatThrownBy(() -> registry.addInstance("orders", Fixtures.healthy("orders-1", "orders")))
                    .isInstanceOf(NotFoundException.class);
        }

        @Test
        @DisplayName("should remove an instance")
        void shouldRemoveInstance() {
            registry.addInstance("auth", Fixtures.healthy("auth-1", "auth"));

            ServiceInstance removed = registry.removeInstance("auth", "auth-1");

            assertThat(removed.getId()).isEqualTo("auth-1");
            assertThat(registry.listInstances("auth")).isEmpty();
            assertThat(registry.findInstance("auth-1")).isEmpty();
            assertThatThrownBy(() -> registry.removeInstance("auth", "auth-1"))
                    .isInstanceOf(NotFoundException.class);
        }
    }

    @Nested
    @DisplayName("Health and usage updates")
    class UpdateTests {

        @BeforeEach
        void addInstance() {
            registry.addInstance("auth", Fixtures.instance("auth-1", "auth", "1.0.0", InstanceState.STARTING));
            events.clear();
        }

        @Test
        @DisplayName("should return previous state and stamp health check time")
        void shouldUpdateHealth() {
            clock.advance(Duration.ofMinutes(5));

            InstanceState previous = registry.updateInstanceHealth("auth-1", InstanceState.HEALTHY);

            ServiceInstance updated = registry.findInstance("auth-1").orElseThrow();
            assertThat(previous).isEqualTo(InstanceState.STARTING);
            assertThat(updated.getState()).isEqualTo(InstanceState.HEALTHY);
            assertThat(updated.getLastHealthCheck()).isEqualTo(clock.instant());
            assertThat(events).singleElement().satisfies(event -> {
                assertThat(event.type()).isEqualTo(ServiceRegistry.RegistryEvent.Type.INSTANCE_STATE_CHANGED);
                assertThat(event.previousState()).isEqualTo(InstanceState.STARTING);
            });
        }

        @Test
        @DisplayName("should not publish when the state is unchanged")
        void shouldNotPublishWhenUnchanged() {
            registry.updateInstanceHealth("auth-1", InstanceState.STARTING);

            assertThat(events).isEmpty();
        }

        @Test
        @DisplayName("should record usage")
        void shouldRecordUsage() {
            registry.updateInstanceUsage("auth-1", new InstanceUsage(42.0, 300.0, 7.0));

            ServiceInstance updated = registry.findInstance("auth-1").orElseThrow();
            assertThat(updated.getCpuPercent()).isEqualTo(42.0);
            assertThat(updated.getMemoryMb()).isEqualTo(300.0);
            assertThat(updated.getNetworkLoad()).isEqualTo(7.0);
            assertThat(updated.getState()).isEqualTo(InstanceState.STARTING);
        }

        @Test
        @DisplayName("should throw NotFound for unknown instances")
        void shouldThrowForUnknownInstance() {
            assertThatThrownBy(() -> registry.updateInstanceHealth("ghost", InstanceState.HEALTHY))
                    .isInstanceOf(NotFoundException.class)
                    .hasMessage("Instance not found: ghost");
        }

        @Test
        @DisplayName("should serialize concurrent transitions")
        void shouldSerializeConcurrentTransitions() throws InterruptedException {
            int threads = 8;
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            CountDownLatch latch = new CountDownLatch(threads);
            List<InstanceState> observed = new CopyOnWriteArrayList<>();

            for (int t = 0; t < threads; t++) {
                executor.submit(() -> {
                    try {
                        observed.add(registry.updateInstanceHealth("auth-1",
                                current -> current == InstanceState.STARTING ? InstanceState.HEALTHY : InstanceState.UNHEALTHY));
                    } finally {
                        latch.countDown();
                    }
                });
            }

            assertThat(latch.await(10, TimeUnit.SECONDS)).isTrue();
            executor.shutdown();

            // Exactly one thread sees STARTING
            assertThat(observed).filteredOn(state -> state == InstanceState.HEALTHY).hasSize(1);
        }
    }

    @Nested
    @DisplayName("Deployment guard")
    class DeploymentGuardTests {

        @Test
        @DisplayName("should grant the guard once until released")
        void shouldGrantGuardOnce() {
            assertThat(registry.beginDeployment("auth")).isTrue();
            assertThat(registry.beginDeployment("auth")).isFalse();
            assertThat(registry.isDeploymentInProgress("auth")).isTrue();

            registry.endDeployment("auth");

            assertThat(registry.isDeploymentInProgress("auth")).isFalse();
            assertThat(registry.beginDeployment("auth")).isTrue();
        }

        @Test
        @DisplayName("should refuse guarded additions while a deployment holds the guard")
        void shouldRefuseGuardedAddition() {
            registry.beginDeployment("auth");

            assertThat(registry.addInstanceUnlessDeploying("auth", Fixtures.healthy("auth-1", "auth"))).isFalse();
            assertThat(registry.listInstances("auth")).isEmpty();

            registry.endDeployment("auth");

            assertThat(registry.addInstanceUnlessDeploying("auth", Fixtures.healthy("auth-1", "auth"))).isTrue();
            assertThat(registry.findInstance("auth-1")).isPresent();
        }

        @Test
        @DisplayName("should refuse guarded stops while a deployment holds the guard")
        void shouldRefuseGuardedStop() {
            registry.addInstance("auth", Fixtures.healthy("auth-1", "auth"));
            registry.beginDeployment("auth");

            assertThat(registry.stopInstanceUnlessDeploying("auth-1")).isFalse();
            assertThat(registry.findInstance("auth-1").orElseThrow().getState()).isEqualTo(InstanceState.HEALTHY);

            registry.endDeployment("auth");

            assertThat(registry.stopInstanceUnlessDeploying("auth-1")).isTrue();
            assertThat(registry.findInstance("auth-1").orElseThrow().getState()).isEqualTo(InstanceState.STOPPING);
        }
    }

    @Nested
    @DisplayName("Instance id uniqueness")
    class InstanceIdTests {

        @BeforeEach
        void registerSecondService() {
            registry.register(Fixtures.service("orders", "1.0.0"));
        }

        @Test
        @DisplayName("should reject an instance id already used by another service")
        void shouldRejectIdUsedByAnotherService() {
            registry.addInstance("auth", Fixtures.healthy("shared-1", "auth"));

            assertThatThrownBy(() -> registry.addInstance("orders", Fixtures.healthy("shared-1", "orders")))
                    .isInstanceOf(ConflictException.class);
            assertThat(registry.listInstances("orders")).isEmpty();
            assertThat(registry.findInstance("shared-1").orElseThrow().getServiceId()).isEqualTo("auth");
        }

        @Test
        @DisplayName("should register a contended id exactly once across services")
        void shouldRegisterContendedIdOnce() throws InterruptedException {
            int rounds = 50;
            ExecutorService executor = Executors.newFixedThreadPool(2);
            try {
                for (int round = 0; round < rounds; round++) {
                    String id = "shared-" + round;
                    CountDownLatch start = new CountDownLatch(1);
                    CountDownLatch done = new CountDownLatch(2);
                    List<String> winners = new CopyOnWriteArrayList<>();

                    for (String service : List.of("auth", "orders")) {
                        executor.submit(() -> {
                            try {
                                start.await();
                                registry.addInstance(service, Fixtures.healthy(id, service));
                                winners.add(service);
                            } catch (ConflictException expected) {
                                // the other service won the id
                            } catch (InterruptedException e) {
                                Thread.currentThread().interrupt();
                            } finally {
                                done.countDown();
                            }
                        });
                    }
                    start.countDown();

                    assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();
                    assertThat(winners).hasSize(1);
                    assertThat(registry.findInstance(id).orElseThrow().getServiceId()).isEqualTo(winners.get(0));
                }
            } finally {
                executor.shutdownNow();
            }

            assertThat(registry.listInstances("auth").size() + registry.listInstances("orders").size())
                    .isEqualTo(rounds);
        }
    }
}
