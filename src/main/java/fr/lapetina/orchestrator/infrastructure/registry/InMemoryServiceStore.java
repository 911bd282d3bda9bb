package fr.lapetina.orchestrator.infrastructure.registry;

import fr.lapetina.orchestrator.domain.model.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public final class InMemoryServiceStore implements ServiceStore {

    private final Map<String, Service> services = new ConcurrentHashMap<>();

    @Override
    public void save(Service service) {
        services.put(service.getId(), service);
    }

    @Override
    public Optional<Service> find(String serviceId) {
        return Optional.ofNullable(services.get(serviceId));
    }

    @Override
    public List<Service> findAll() {
        return services.values().stream()
                .sorted(Comparator.comparing(Service::getId))
                .toList();
    }

    @Override
    public boolean delete(String serviceId) {
        return services.remove(serviceId) != null;
    }
}
