package net.spookly.httpgate.registry;

/**
 * Request payloads for admin API endpoints.
 */
public final class AdminRequests {
    /**
     * Register or update a service in the registry.
     */
    public static final class RegisterServiceRequest {
        public String id;
        public String namespace;
    }

    private AdminRequests() {
    }
}
