package net.spookly.httpgate.pool;

import java.time.Duration;
import java.util.Objects;

/**
 * Per-target connection pool limits.
 */
public record PoolSettings(int maxConnections,
                           int maxPendingAcquires,
                           Duration idleTimeout,
                           Duration connectTimeout) {
    public static final int DEFAULT_MAX_CONNECTIONS = 64;
    public static final int DEFAULT_MAX_PENDING_ACQUIRES = 256;
    public static final Duration DEFAULT_IDLE_TIMEOUT = Duration.ofSeconds(60);
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(2);

    public PoolSettings {
        Objects.requireNonNull(idleTimeout, "idleTimeout");
        Objects.requireNonNull(connectTimeout, "connectTimeout");
        if (maxConnections <= 0) {
            throw new IllegalArgumentException("maxConnections must be greater than 0");
        }
        if (maxPendingAcquires < 0) {
            throw new IllegalArgumentException("maxPendingAcquires must be >= 0");
        }
    }

    public static PoolSettings defaults() {
        return new PoolSettings(DEFAULT_MAX_CONNECTIONS, DEFAULT_MAX_PENDING_ACQUIRES,
                DEFAULT_IDLE_TIMEOUT, DEFAULT_CONNECT_TIMEOUT);
    }
}
