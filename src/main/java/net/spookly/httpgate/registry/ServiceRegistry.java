package net.spookly.httpgate.registry;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.regex.Pattern;

import net.spookly.httpgate.config.HttpgateConfig;

/**
 * Thread-safe map of service id to namespace, consulted for hosts no static route matches.
 */
public final class ServiceRegistry {
    /**
     * Lowercase alphanumerics and inner hyphens; the id must be usable as a DNS label.
     */
    public static final Pattern SERVICE_ID = Pattern.compile("^[a-z\\d](?:[-a-z\\d]*[a-z\\d])?$");

    private final ConcurrentMap<String, RegisteredService> services = new ConcurrentHashMap<>();
    private final RegistryEventListener eventListener;
    private final Clock clock;

    public ServiceRegistry(RegistryEventListener eventListener, Clock clock) {
        this.eventListener = eventListener == null ? RegistryEventListener.NOOP : eventListener;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public ServiceRegistry() {
        this(RegistryEventListener.NOOP, Clock.systemUTC());
    }

    /**
     * Registry seeded with the services listed in {@code routing.serviceRegistry.services}.
     */
    public static ServiceRegistry fromConfig(HttpgateConfig config, RegistryEventListener eventListener) {
        ServiceRegistry registry = new ServiceRegistry(eventListener, Clock.systemUTC());
        if (config == null || config.routing == null || config.routing.serviceRegistry == null
                || config.routing.serviceRegistry.services == null) {
            return registry;
        }
        for (HttpgateConfig.ServiceEntryConfig service : config.routing.serviceRegistry.services) {
            if (service != null) {
                registry.register(service.id, service.namespace);
            }
        }
        return registry;
    }

    /**
     * Register or update a service.
     *
     * @return true when the id was not registered before
     */
    public boolean register(String id, String namespace) {
        String normalizedId = requireServiceId(id);
        if (namespace == null || namespace.isBlank()) {
            throw new IllegalArgumentException("namespace is required");
        }
        RegisteredService service = new RegisteredService(normalizedId, namespace.trim(), clock.instant());
        RegisteredService previous = services.put(normalizedId, service);
        emit(previous == null ? RegistryEventType.REGISTER : RegistryEventType.UPDATE, service);
        return previous == null;
    }

    /**
     * @return true when the id was registered
     */
    public boolean unregister(String id) {
        if (id == null) {
            return false;
        }
        RegisteredService removed = services.remove(id.trim().toLowerCase());
        if (removed == null) {
            return false;
        }
        emit(RegistryEventType.UNREGISTER, removed);
        return true;
    }

    public void clear() {
        services.clear();
        emit(RegistryEventType.CLEAR, null);
    }

    public RegisteredService get(String id) {
        if (id == null) {
            return null;
        }
        return services.get(id);
    }

    public int size() {
        return services.size();
    }

    public boolean isEmpty() {
        return services.isEmpty();
    }

    /**
     * All services ordered by id.
     */
    public List<RegisteredService> list() {
        List<RegisteredService> snapshot = new ArrayList<>(services.values());
        snapshot.sort(Comparator.comparing(RegisteredService::id));
        return snapshot;
    }

    private static String requireServiceId(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id is required");
        }
        String normalized = id.trim().toLowerCase();
        if (!SERVICE_ID.matcher(normalized).matches()) {
            throw new IllegalArgumentException("id must be lowercase alphanumerics with inner hyphens: " + id);
        }
        return normalized;
    }

    private void emit(RegistryEventType type, RegisteredService service) {
        eventListener.onEvent(RegistryEvent.from(type, service, services.size(), clock.instant()));
    }
}
