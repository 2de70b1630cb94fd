package net.spookly.httpgate.routing;

import java.util.Objects;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Immutable upstream address a request may be forwarded to. Identity is {@code host:port}.
 */
@Getter
@Accessors(fluent = true)
@EqualsAndHashCode(of = {"host", "port"})
public final class UpstreamTarget {
    private final String id;
    private final String host;
    private final int port;
    private final int weight;

    public UpstreamTarget(String id, String host, int port, int weight) {
        this.host = Objects.requireNonNull(host, "host").trim();
        if (this.host.isEmpty()) {
            throw new IllegalArgumentException("host is required");
        }
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("port must be between 1 and 65535: " + port);
        }
        this.port = port;
        this.weight = Math.max(1, weight);
        this.id = id == null || id.isBlank() ? key() : id.trim();
    }

    public static UpstreamTarget of(String host, int port) {
        return new UpstreamTarget(null, host, port, 1);
    }

    /**
     * Stable key used by the connection pools and circuit breakers.
     */
    public String key() {
        return host + ":" + port;
    }

    @Override
    public String toString() {
        return id.equals(key()) ? key() : id + "(" + key() + ")";
    }
}
