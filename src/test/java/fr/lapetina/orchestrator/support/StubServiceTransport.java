package fr.lapetina.orchestrator.support;

import fr.lapetina.orchestrator.domain.model.CallRequest;
import fr.lapetina.orchestrator.domain.model.ServiceInstance;
import fr.lapetina.orchestrator.infrastructure.runtime.ServiceTransport;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Service transport answering in-process. Calls succeed with an echo of the
 * serving instance unless the instance is marked failing.
 */
public final class StubServiceTransport implements ServiceTransport {

    private final List<String> servedBy = new CopyOnWriteArrayList<>();
    private final Set<String> failing = ConcurrentHashMap.newKeySet();
    private volatile boolean hang;

    public void failOn(String instanceId) {
        failing.add(instanceId);
    }

    public void hang(boolean hang) {
        this.hang = hang;
    }

    public List<String> getServedBy() {
        return List.copyOf(servedBy);
    }

    public void reset() {
        servedBy.clear();
        failing.clear();
        hang = false;
    }

    @Override
    public CompletableFuture<Object> invoke(ServiceInstance instance, CallRequest request) {
        servedBy.add(instance.getId());
        if (hang) {
            return new CompletableFuture<>();
        }
        if (failing.contains(instance.getId())) {
            return CompletableFuture.failedFuture(new IllegalStateException("Connection refused by " + instance.getId()));
        }
        return CompletableFuture.completedFuture(Map.of(
                "message", "Service call successful",
                "instance", instance.getId()
        ));
    }
}
