package fr.lapetina.orchestrator.infrastructure.deployment;

import fr.lapetina.orchestrator.domain.model.DeploymentRecord;
import fr.lapetina.orchestrator.domain.model.HealthCheckSpec;
import fr.lapetina.orchestrator.domain.model.ServiceInstance;
import fr.lapetina.orchestrator.infrastructure.runtime.DeploymentValidator;
import fr.lapetina.orchestrator.infrastructure.runtime.ProbeTransport;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Validates a deployment by probing every new instance once more after cutover.
 */
public final class ProbeDeploymentValidator implements DeploymentValidator {

    private final ProbeTransport probeTransport;

    public ProbeDeploymentValidator(ProbeTransport probeTransport) {
        this.probeTransport = probeTransport;
    }

    @Override
    public CompletableFuture<Result> validate(DeploymentRecord deployment, List<ServiceInstance> newInstances) {
        HealthCheckSpec spec = deployment.configuration().getHealthCheck();

        List<CompletableFuture<Boolean>> probes = newInstances.stream()
                .map(instance -> probeTransport.probe(instance, spec)
                        .orTimeout(spec.timeout().toMillis(), TimeUnit.MILLISECONDS)
                        .exceptionally(ex -> false))
                .toList();

        return CompletableFuture.allOf(probes.toArray(new CompletableFuture[0]))
                .thenApply(ignored -> {
                    long failed = probes.stream().filter(probe -> !probe.join()).count();
                    if (failed > 0) {
                        return Result.failed(failed + " of " + probes.size()
                                + " new instances failed the post-cutover probe");
                    }
                    return Result.ok();
                });
    }
}
