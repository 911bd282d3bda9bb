package fr.lapetina.orchestrator.infrastructure.registry;

import fr.lapetina.orchestrator.domain.model.ServiceInstance;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public final class InMemoryInstanceStore implements InstanceStore {

    private final Map<String, ServiceInstance> instances = new ConcurrentHashMap<>();

    @Override
    public void save(ServiceInstance instance) {
        instances.put(instance.getId(), instance);
    }

    @Override
    public boolean saveIfAbsent(ServiceInstance instance) {
        return instances.putIfAbsent(instance.getId(), instance) == null;
    }

    @Override
    public Optional<ServiceInstance> find(String instanceId) {
        return Optional.ofNullable(instances.get(instanceId));
    }

    @Override
    public List<ServiceInstance> findByService(String serviceId) {
        return instances.values().stream()
                .filter(instance -> instance.getServiceId().equals(serviceId))
                .sorted(Comparator.comparing(ServiceInstance::getId))
                .toList();
    }

    @Override
    public boolean delete(String instanceId) {
        return instances.remove(instanceId) != null;
    }
}
