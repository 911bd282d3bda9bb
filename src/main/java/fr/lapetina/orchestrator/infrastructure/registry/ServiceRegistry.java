package fr.lapetina.orchestrator.infrastructure.registry;

import fr.lapetina.orchestrator.domain.exception.ConflictException;
import fr.lapetina.orchestrator.domain.exception.NotFoundException;
import fr.lapetina.orchestrator.domain.model.InstanceState;
import fr.lapetina.orchestrator.domain.model.InstanceUsage;
import fr.lapetina.orchestrator.domain.model.Service;
import fr.lapetina.orchestrator.domain.model.ServiceInstance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Registry of services and their live instances.
 *
 * Concurrency:
 * - Writes to one service (descriptor or instance list) are serialized by a
 *   per-service read/write lock
 * - Reads take the shared side of the same lock, so reads of different
 *   services never contend
 * - Listeners are notified after the lock is released
 *
 * The registry also holds the per-service "deployment in progress" guard that
 * keeps the auto-scaler away from a service while a rollout owns it. The guard
 * is taken under the service lock, so the guarded writes below either happen
 * before a deployment starts or not at all.
 */
public final class ServiceRegistry {

    private static final Logger log = LoggerFactory.getLogger(ServiceRegistry.class);

    private final ServiceStore serviceStore;
    private final InstanceStore instanceStore;
    private final Clock clock;

    private final Map<String, ReentrantReadWriteLock> locks = new ConcurrentHashMap<>();
    private final Set<String> deploymentsInProgress = ConcurrentHashMap.newKeySet();
    private final List<Consumer<RegistryEvent>> listeners = new CopyOnWriteArrayList<>();

    public ServiceRegistry(ServiceStore serviceStore, InstanceStore instanceStore, Clock clock) {
        this.serviceStore = serviceStore;
        this.instanceStore = instanceStore;
        this.clock = clock;
    }

    public ServiceRegistry() {
        this(new InMemoryServiceStore(), new InMemoryInstanceStore(), Clock.systemUTC());
    }

    /**
     * Registers a new service or replaces the descriptor of an existing one.
     */
    public void register(Service service) {
        boolean created = writeLocked(service.getId(), () -> {
            boolean exists = serviceStore.find(service.getId()).isPresent();
            serviceStore.save(service);
            return !exists;
        });

        if (created) {
            log.info("Service registered: serviceId={}, name={}, version={}",
                    service.getId(), service.getName(), service.getVersion());
            notifyListeners(new RegistryEvent(RegistryEvent.Type.SERVICE_REGISTERED, service.getId(), null, null));
        } else {
            log.info("Service updated: serviceId={}, version={}", service.getId(), service.getVersion());
            notifyListeners(new RegistryEvent(RegistryEvent.Type.SERVICE_UPDATED, service.getId(), null, null));
        }
    }

    /**
     * Returns a service descriptor.
     *
     * @throws NotFoundException if the service is unknown
     */
    public Service getService(String serviceId) {
        return findService(serviceId).orElseThrow(() -> NotFoundException.service(serviceId));
    }

    public Optional<Service> findService(String serviceId) {
        return readLocked(serviceId, () -> serviceStore.find(serviceId));
    }

    public boolean contains(String serviceId) {
        return findService(serviceId).isPresent();
    }

    public List<Service> listServices() {
        return serviceStore.findAll();
    }

    /**
     * Returns every instance of a service, whatever its state.
     *
     * @throws NotFoundException if the service is unknown
     */
    public List<ServiceInstance> listInstances(String serviceId) {
        return readLocked(serviceId, () -> {
            requireService(serviceId);
            return instanceStore.findByService(serviceId);
        });
    }

    /**
     * Returns the healthy instances of a service, ordered by instance id.
     *
     * @throws NotFoundException if the service is unknown
     */
    public List<ServiceInstance> listHealthyInstances(String serviceId) {
        return listInstances(serviceId).stream()
                .filter(ServiceInstance::isHealthy)
                .toList();
    }

    public Optional<ServiceInstance> findInstance(String instanceId) {
        return instanceStore.find(instanceId);
    }

    /**
     * Adds an instance to a service.
     *
     * @throws NotFoundException if the service is unknown
     * @throws ConflictException if an instance with the same id already exists
     */
    public void addInstance(String serviceId, ServiceInstance instance) {
        insertInstance(serviceId, instance, false);
    }

    /**
     * Adds an instance unless a deployment holds the service.
     *
     * @return false if a deployment is in progress; nothing was added
     * @throws NotFoundException if the service is unknown
     * @throws ConflictException if an instance with the same id already exists
     */
    public boolean addInstanceUnlessDeploying(String serviceId, ServiceInstance instance) {
        return insertInstance(serviceId, instance, true);
    }

    private boolean insertInstance(String serviceId, ServiceInstance instance, boolean respectGuard) {
        if (!serviceId.equals(instance.getServiceId())) {
            throw new IllegalArgumentException("Instance " + instance.getId()
                    + " belongs to service " + instance.getServiceId() + ", not " + serviceId);
        }

        boolean added = writeLocked(serviceId, () -> {
            requireService(serviceId);
            if (respectGuard && deploymentsInProgress.contains(serviceId)) {
                return false;
            }
            // Instance ids are global; the store settles races between services
            if (!instanceStore.saveIfAbsent(instance)) {
                throw new ConflictException("Instance already exists: " + instance.getId());
            }
            return true;
        });
        if (!added) {
            return false;
        }

        log.info("Instance added: serviceId={}, instanceId={}, version={}, state={}",
                serviceId, instance.getId(), instance.getVersion(), instance.getState());
        notifyListeners(new RegistryEvent(RegistryEvent.Type.INSTANCE_ADDED, serviceId, instance, null));
        return true;
    }

    /**
     * Removes an instance from a service.
     *
     * @return the removed instance
     * @throws NotFoundException if the service or the instance is unknown
     */
    public ServiceInstance removeInstance(String serviceId, String instanceId) {
        ServiceInstance removed = writeLocked(serviceId, () -> {
            requireService(serviceId);
            ServiceInstance existing = instanceStore.find(instanceId)
                    .filter(instance -> instance.getServiceId().equals(serviceId))
                    .orElseThrow(() -> NotFoundException.instance(instanceId));
            instanceStore.delete(instanceId);
            return existing;
        });

        log.info("Instance removed: serviceId={}, instanceId={}", serviceId, instanceId);
        notifyListeners(new RegistryEvent(RegistryEvent.Type.INSTANCE_REMOVED, serviceId, removed, null));
        return removed;
    }

    /**
     * Sets the state of an instance and stamps its last health check time.
     *
     * @return the state before the update
     * @throws NotFoundException if the instance is unknown
     */
    public InstanceState updateInstanceHealth(String instanceId, InstanceState state) {
        return transitionInstance(instanceId, current -> state)[0];
    }

    /**
     * Computes the next state of an instance from its current state under the
     * service lock and stamps its last health check time.
     *
     * @return the state after the update
     * @throws NotFoundException if the instance is unknown
     */
    public InstanceState updateInstanceHealth(String instanceId, UnaryOperator<InstanceState> transition) {
        return transitionInstance(instanceId, transition)[1];
    }

    /**
     * Moves an instance to STOPPING unless a deployment holds its service.
     *
     * @return false if a deployment is in progress; the instance is unchanged
     * @throws NotFoundException if the instance is unknown
     */
    public boolean stopInstanceUnlessDeploying(String instanceId) {
        return transitionInstance(instanceId, current -> InstanceState.STOPPING, true) != null;
    }

    private InstanceState[] transitionInstance(String instanceId, UnaryOperator<InstanceState> transition) {
        return transitionInstance(instanceId, transition, false);
    }

    private InstanceState[] transitionInstance(String instanceId, UnaryOperator<InstanceState> transition,
                                               boolean respectGuard) {
        String serviceId = owningService(instanceId);
        AtomicReference<ServiceInstance> updated = new AtomicReference<>();

        InstanceState previous = writeLocked(serviceId, () -> {
            ServiceInstance current = instanceStore.find(instanceId)
                    .orElseThrow(() -> NotFoundException.instance(instanceId));
            if (respectGuard && deploymentsInProgress.contains(serviceId)) {
                return null;
            }
            updated.set(current.withState(transition.apply(current.getState()), clock.instant()));
            instanceStore.save(updated.get());
            return current.getState();
        });
        if (previous == null) {
            return null;
        }

        InstanceState next = updated.get().getState();
        if (previous != next) {
            log.info("Instance health changed: serviceId={}, instanceId={}, {} -> {}",
                    serviceId, instanceId, previous, next);
            notifyListeners(new RegistryEvent(RegistryEvent.Type.INSTANCE_STATE_CHANGED, serviceId, updated.get(), previous));
        }
        return new InstanceState[]{previous, next};
    }

    /**
     * Records the latest resource usage of an instance.
     *
     * @throws NotFoundException if the instance is unknown
     */
    public void updateInstanceUsage(String instanceId, InstanceUsage usage) {
        String serviceId = owningService(instanceId);
        writeLocked(serviceId, () -> {
            ServiceInstance current = instanceStore.find(instanceId)
                    .orElseThrow(() -> NotFoundException.instance(instanceId));
            instanceStore.save(current.withUsage(usage));
            return null;
        });
        log.debug("Instance usage updated: serviceId={}, instanceId={}, cpu={}, memoryMb={}",
                serviceId, instanceId, usage.cpuPercent(), usage.memoryMb());
    }

    /**
     * Sets the deployment guard of a service.
     *
     * @return false if a deployment already holds the guard
     */
    public boolean beginDeployment(String serviceId) {
        boolean acquired = writeLocked(serviceId, () -> deploymentsInProgress.add(serviceId));
        if (acquired) {
            log.debug("Deployment guard acquired: serviceId={}", serviceId);
        }
        return acquired;
    }

    public void endDeployment(String serviceId) {
        if (deploymentsInProgress.remove(serviceId)) {
            log.debug("Deployment guard released: serviceId={}", serviceId);
        }
    }

    public boolean isDeploymentInProgress(String serviceId) {
        return deploymentsInProgress.contains(serviceId);
    }

    /**
     * Adds a listener for registry events.
     */
    public void addListener(Consumer<RegistryEvent> listener) {
        listeners.add(listener);
    }

    public void removeListener(Consumer<RegistryEvent> listener) {
        listeners.remove(listener);
    }

    public Clock getClock() {
        return clock;
    }

    private void requireService(String serviceId) {
        if (serviceStore.find(serviceId).isEmpty()) {
            throw NotFoundException.service(serviceId);
        }
    }

    private String owningService(String instanceId) {
        return instanceStore.find(instanceId)
                .map(ServiceInstance::getServiceId)
                .orElseThrow(() -> NotFoundException.instance(instanceId));
    }

    private ReentrantReadWriteLock lockFor(String serviceId) {
        return locks.computeIfAbsent(serviceId, id -> new ReentrantReadWriteLock());
    }

    private <T> T readLocked(String serviceId, Supplier<T> action) {
        ReentrantReadWriteLock.ReadLock lock = lockFor(serviceId).readLock();
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    private <T> T writeLocked(String serviceId, Supplier<T> action) {
        ReentrantReadWriteLock.WriteLock lock = lockFor(serviceId).writeLock();
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    private void notifyListeners(RegistryEvent event) {
        for (Consumer<RegistryEvent> listener : new ArrayList<>(listeners)) {
            try {
                listener.accept(event);
            } catch (Exception e) {
                log.error("Error notifying registry listener: event={}", event.type(), e);
            }
        }
    }

    /**
     * Change notification published after a mutation is applied.
     *
     * @param instance      instance after the change, null for service-level events
     * @param previousState state before a health change, null otherwise
     */
    public record RegistryEvent(Type type, String serviceId, ServiceInstance instance, InstanceState previousState) {
        public enum Type {
            SERVICE_REGISTERED,
            SERVICE_UPDATED,
            INSTANCE_ADDED,
            INSTANCE_REMOVED,
            INSTANCE_STATE_CHANGED
        }
    }
}
