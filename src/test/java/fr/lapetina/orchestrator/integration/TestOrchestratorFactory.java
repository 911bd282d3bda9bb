package fr.lapetina.orchestrator.integration;

import fr.lapetina.orchestrator.ServiceOrchestrator;
import fr.lapetina.orchestrator.domain.model.InstanceState;
import fr.lapetina.orchestrator.infrastructure.config.ConfigLoader;
import fr.lapetina.orchestrator.infrastructure.config.OrchestratorConfig;
import fr.lapetina.orchestrator.support.FakeProvisioner;
import fr.lapetina.orchestrator.support.ScriptedProbeTransport;
import fr.lapetina.orchestrator.support.StubServiceTransport;

import java.time.Clock;

/**
 * Builds an orchestrator from test-config.yaml with in-memory collaborators.
 *
 * Instances are provisioned in configuration order with a global sequence:
 * auth-1, auth-2, auth-3, then orders-4. All start STARTING because the
 * health monitor is disabled.
 */
public final class TestOrchestratorFactory {

    private TestOrchestratorFactory() {
    }

    public static TestOrchestrator create() {
        OrchestratorConfig config = new ConfigLoader("test-config.yaml").load();
        Clock clock = Clock.systemUTC();
        FakeProvisioner provisioner = new FakeProvisioner(clock);
        ScriptedProbeTransport probes = new ScriptedProbeTransport();
        StubServiceTransport transport = new StubServiceTransport();

        ServiceOrchestrator orchestrator = ServiceOrchestrator.builder()
                .fromConfig(config)
                .clock(clock)
                .provisioner(provisioner)
                .probeTransport(probes)
                .serviceTransport(transport)
                .build()
                .start();
        return new TestOrchestrator(orchestrator, config, provisioner, probes, transport);
    }

    public record TestOrchestrator(
            ServiceOrchestrator orchestrator,
            OrchestratorConfig config,
            FakeProvisioner provisioner,
            ScriptedProbeTransport probes,
            StubServiceTransport transport
    ) implements AutoCloseable {

        public void markHealthy(String... instanceIds) {
            for (String id : instanceIds) {
                orchestrator.getRegistry().updateInstanceHealth(id, InstanceState.HEALTHY);
            }
        }

        @Override
        public void close() {
            orchestrator.close();
        }
    }
}
