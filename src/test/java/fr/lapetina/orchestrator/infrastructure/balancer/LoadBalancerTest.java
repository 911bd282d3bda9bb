package fr.lapetina.orchestrator.infrastructure.balancer;

import fr.lapetina.orchestrator.domain.exception.NoHealthyInstanceException;
import fr.lapetina.orchestrator.domain.exception.NotFoundException;
import fr.lapetina.orchestrator.domain.model.InstanceState;
import fr.lapetina.orchestrator.domain.model.LoadBalancerConfig;
import fr.lapetina.orchestrator.domain.model.LoadBalancingAlgorithm;
import fr.lapetina.orchestrator.domain.model.ServiceInstance;
import fr.lapetina.orchestrator.infrastructure.registry.ServiceRegistry;
import fr.lapetina.orchestrator.support.Fixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LoadBalancerTest {

    private ServiceRegistry registry;
    private LoadBalancer loadBalancer;

    @BeforeEach
    void setUp() {
        registry = new ServiceRegistry();
        registry.register(Fixtures.service("auth", "1.0.0"));
        registry.addInstance("auth", Fixtures.healthy("auth-1", "auth"));
        registry.addInstance("auth", Fixtures.healthy("auth-2", "auth"));
        registry.addInstance("auth", Fixtures.instance("auth-3", "auth", "1.0.0", InstanceState.UNHEALTHY));
        loadBalancer = new LoadBalancer(registry, new Random(7));
    }

    @Nested
    @DisplayName("Selection")
    class SelectionTests {

        @Test
        @DisplayName("should only select healthy instances")
        void shouldOnlySelectHealthy() {
            for (int i = 0; i < 20; i++) {
                assertThat(loadBalancer.selectInstance("auth").getId()).isIn("auth-1", "auth-2");
            }
        }

        @Test
        @DisplayName("should fail when no instance is healthy")
        void shouldFailWithoutHealthyInstance() {
            registry.updateInstanceHealth("auth-1", InstanceState.UNHEALTHY);
            registry.updateInstanceHealth("auth-2", InstanceState.STARTING);

            assertThatThrownBy(() -> loadBalancer.selectInstance("auth"))
                    .isInstanceOf(NoHealthyInstanceException.class);
        }

        @Test
        @DisplayName("should fail for unknown services")
        void shouldFailForUnknownService() {
            assertThatThrownBy(() -> loadBalancer.selectInstance("billing"))
                    .isInstanceOf(NotFoundException.class);
        }

        @Test
        @DisplayName("should use the algorithm of the bound configuration")
        void shouldUseBoundAlgorithm() {
            loadBalancer.bind(LoadBalancerConfig.of("auth-lb", LoadBalancingAlgorithm.LEAST_CONNECTIONS, Set.of("auth")));
            loadBalancer.callStarted("auth-1");

            assertThat(loadBalancer.selectInstance("auth").getId()).isEqualTo("auth-2");

            loadBalancer.callFinished("auth-1");
            assertThat(loadBalancer.activeCalls("auth-1")).isZero();
        }

        @Test
        @DisplayName("should pick the lowest config id when several bind a service")
        void shouldPickLowestConfigId() {
            loadBalancer.bind(LoadBalancerConfig.of("z-lb", LoadBalancingAlgorithm.LEAST_CONNECTIONS, Set.of("auth")));
            loadBalancer.bind(LoadBalancerConfig.of("a-lb", LoadBalancingAlgorithm.ROUND_ROBIN, Set.of("auth")));

            assertThat(loadBalancer.configFor("auth")).map(LoadBalancerConfig::id).contains("a-lb");
        }

        @Test
        @DisplayName("should unbind configurations missing from a reload")
        void shouldUnbindOnReplace() {
            loadBalancer.bind(LoadBalancerConfig.of("old-lb", LoadBalancingAlgorithm.ROUND_ROBIN, Set.of("auth")));

            loadBalancer.replaceConfigs(List.of(
                    LoadBalancerConfig.of("new-lb", LoadBalancingAlgorithm.ROUND_ROBIN, Set.of("orders"))));

            assertThat(loadBalancer.getConfigs()).extracting(LoadBalancerConfig::id).containsExactly("new-lb");
            assertThat(loadBalancer.configFor("auth")).isEmpty();
        }
    }

    @Nested
    @DisplayName("Session affinity")
    class AffinityTests {

        @Test
        @DisplayName("should keep a caller on the same instance")
        void shouldKeepCallerOnSameInstance() {
            loadBalancer.bind(new LoadBalancerConfig("auth-lb", LoadBalancingAlgorithm.ROUND_ROBIN, Set.of("auth"),
                    true, null, null, 0, null));

            String first = loadBalancer.selectInstance("auth", "web").getId();
            for (int i = 0; i < 5; i++) {
                assertThat(loadBalancer.selectInstance("auth", "web").getId()).isEqualTo(first);
            }
        }

        @Test
        @DisplayName("should move the caller when its instance becomes unhealthy")
        void shouldMoveWhenPinnedInstanceFails() {
            loadBalancer.bind(new LoadBalancerConfig("auth-lb", LoadBalancingAlgorithm.ROUND_ROBIN, Set.of("auth"),
                    true, null, null, 0, null));
            String first = loadBalancer.selectInstance("auth", "web").getId();

            registry.updateInstanceHealth(first, InstanceState.UNHEALTHY);

            assertThat(loadBalancer.selectInstance("auth", "web").getId()).isNotEqualTo(first);
        }
    }

    @Nested
    @DisplayName("Version routing")
    class VersionRoutingTests {

        @BeforeEach
        void addNewVersion() {
            registry.addInstance("auth", Fixtures.instance("auth-4", "auth", "2.0.0", InstanceState.HEALTHY));
        }

        @Test
        @DisplayName("should route every healthy version without routing entry")
        void shouldRouteAnyVersionWithoutEntry() {
            assertThat(loadBalancer.routableInstances("auth")).extracting(ServiceInstance::getId)
                    .containsExactly("auth-1", "auth-2", "auth-4");
            assertThat(loadBalancer.activeVersion("auth")).contains("1.0.0");
        }

        @Test
        @DisplayName("should restrict traffic to the pinned version")
        void shouldRestrictToPinnedVersion() {
            loadBalancer.pinVersion("auth", "2.0.0");

            for (int i = 0; i < 5; i++) {
                assertThat(loadBalancer.selectInstance("auth").getId()).isEqualTo("auth-4");
            }
            assertThat(loadBalancer.activeVersion("auth")).contains("2.0.0");
        }

        @Test
        @DisplayName("should make the service unroutable when pinned to no version")
        void shouldBeUnroutableWithoutVersion() {
            loadBalancer.pinVersion("auth", null);

            assertThatThrownBy(() -> loadBalancer.selectInstance("auth"))
                    .isInstanceOf(NoHealthyInstanceException.class);
            assertThat(loadBalancer.activeVersion("auth")).isEmpty();
        }

        @Test
        @DisplayName("should send roughly the canary share to the canary version")
        void shouldSplitCanaryTraffic() {
            loadBalancer.startCanary("auth", "2.0.0", 20);
            Map<String, Integer> versions = new HashMap<>();

            for (int i = 0; i < 2_000; i++) {
                versions.merge(loadBalancer.selectInstance("auth").getVersion(), 1, Integer::sum);
            }

            assertThat(versions.get("2.0.0")).isBetween(300, 500);
            assertThat(loadBalancer.routingFor("auth")).get()
                    .satisfies(route -> assertThat(route.activeVersion()).isEqualTo("1.0.0"));
        }

        @Test
        @DisplayName("should return all traffic to the active version when the canary is cleared")
        void shouldClearCanary() {
            loadBalancer.startCanary("auth", "2.0.0", 50);

            loadBalancer.clearCanary("auth");

            for (int i = 0; i < 20; i++) {
                assertThat(loadBalancer.selectInstance("auth").getVersion()).isEqualTo("1.0.0");
            }
        }
    }
}
