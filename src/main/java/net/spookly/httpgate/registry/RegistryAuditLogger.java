package net.spookly.httpgate.registry;

import lombok.extern.slf4j.Slf4j;

/**
 * Default registry audit logger that emits one line per event.
 */
@Slf4j
public final class RegistryAuditLogger implements RegistryEventListener {
    public static final RegistryAuditLogger INSTANCE = new RegistryAuditLogger();

    private RegistryAuditLogger() {
    }

    @Override
    public void onEvent(RegistryEvent event) {
        StringBuilder builder = new StringBuilder("registry_event");
        append(builder, "type", event.type());
        append(builder, "serviceId", event.serviceId());
        append(builder, "namespace", event.namespace());
        append(builder, "size", event.size());
        append(builder, "timestamp", event.timestamp());
        log.info(builder.toString());
    }

    private void append(StringBuilder builder, String key, Object value) {
        if (value == null) {
            return;
        }
        builder.append(' ').append(key).append('=').append(value);
    }
}
