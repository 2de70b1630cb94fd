package net.spookly.httpgate.registry;

import java.time.Instant;

import lombok.Value;
import lombok.experimental.Accessors;

/**
 * Service known to the registry: its id and the namespace it runs in.
 */
@Value
@Accessors(fluent = true)
public class RegisteredService {
    String id;
    String namespace;
    Instant registeredAt;
}
