package fr.lapetina.orchestrator.infrastructure.runtime;

import fr.lapetina.orchestrator.domain.model.InstanceState;
import fr.lapetina.orchestrator.domain.model.Service;
import fr.lapetina.orchestrator.domain.model.ServiceInstance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Provisioner modelling instances abstractly by placing them on configured nodes.
 *
 * Nodes are used round-robin. A node with a base address gives each instance
 * its own port, starting at the node's first port. No process is started:
 * whatever runs behind the address is expected to be managed outside the
 * orchestrator.
 */
public final class LocalInstanceProvisioner implements InstanceProvisioner {

    private static final Logger log = LoggerFactory.getLogger(LocalInstanceProvisioner.class);

    private final List<Node> nodes;
    private final Clock clock;
    private final AtomicInteger placementCursor = new AtomicInteger(0);
    private final Map<String, AtomicInteger> nextPorts = new ConcurrentHashMap<>();
    private final Map<String, ServiceInstance> running = new ConcurrentHashMap<>();

    public LocalInstanceProvisioner(List<Node> nodes, Clock clock) {
        if (nodes.isEmpty()) {
            throw new IllegalArgumentException("At least one node is required");
        }
        this.nodes = List.copyOf(nodes);
        this.clock = clock;
    }

    @Override
    public CompletableFuture<ServiceInstance> provisionInstance(Service service, String version) {
        Node node = nodes.get(Math.floorMod(placementCursor.getAndIncrement(), nodes.size()));
        String instanceId = service.getId() + "-" + UUID.randomUUID().toString().substring(0, 8);

        URI address = null;
        if (node.host() != null) {
            int port = nextPorts.computeIfAbsent(node.id(), id -> new AtomicInteger(node.firstPort()))
                    .getAndIncrement();
            address = URI.create("http://" + node.host() + ":" + port);
        }

        ServiceInstance instance = ServiceInstance.builder()
                .id(instanceId)
                .serviceId(service.getId())
                .nodeId(node.id())
                .version(version)
                .state(InstanceState.STARTING)
                .startedAt(clock.instant())
                .address(address)
                .build();
        running.put(instanceId, instance);

        log.info("Instance provisioned: serviceId={}, instanceId={}, version={}, nodeId={}, address={}",
                service.getId(), instanceId, version, node.id(), address);
        return CompletableFuture.completedFuture(instance);
    }

    @Override
    public CompletableFuture<Void> terminateInstance(ServiceInstance instance) {
        if (running.remove(instance.getId()) != null) {
            log.info("Instance terminated: serviceId={}, instanceId={}", instance.getServiceId(), instance.getId());
        } else {
            log.debug("Terminate ignored, instance not running here: instanceId={}", instance.getId());
        }
        return CompletableFuture.completedFuture(null);
    }

    public int runningCount() {
        return running.size();
    }

    /**
     * Placement target.
     *
     * @param host      host name, null for instances without address
     * @param firstPort first port handed out on this node
     */
    public record Node(String id, String host, int firstPort) {
    }
}
