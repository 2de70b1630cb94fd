package net.spookly.httpgate.registry;

/**
 * Audit event types emitted by the service registry.
 */
public enum RegistryEventType {
    REGISTER,
    UPDATE,
    UNREGISTER,
    CLEAR
}
