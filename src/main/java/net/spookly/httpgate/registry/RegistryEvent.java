package net.spookly.httpgate.registry;

import java.time.Instant;

import lombok.Value;
import lombok.experimental.Accessors;

/**
 * Snapshot of a registry change for audit logging.
 */
@Value
@Accessors(fluent = true)
public class RegistryEvent {
    RegistryEventType type;
    Instant timestamp;
    String serviceId;
    String namespace;
    /**
     * Registry size after the change.
     */
    int size;

    public static RegistryEvent from(RegistryEventType type, RegisteredService service, int size, Instant timestamp) {
        return new RegistryEvent(type, timestamp, service == null ? null : service.id(),
                service == null ? null : service.namespace(), size);
    }
}
