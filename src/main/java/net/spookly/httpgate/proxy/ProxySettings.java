package net.spookly.httpgate.proxy;

import java.time.Duration;
import java.util.Objects;

import net.spookly.httpgate.util.ListenAddress;

/**
 * Listener and forwarding settings resolved from the {@code proxy} config section.
 */
public record ProxySettings(ListenAddress listen,
                            int workerThreads,
                            long maxReplayBytes,
                            int maxInitialLineLength,
                            int maxHeaderSize,
                            boolean forwardedHeaders,
                            Duration shutdownGrace,
                            Duration idleClientTimeout) {
    public static final long DEFAULT_MAX_REPLAY_BYTES = 64 * 1024L;
    public static final int DEFAULT_MAX_INITIAL_LINE_LENGTH = 4096;
    public static final int DEFAULT_MAX_HEADER_SIZE = 8192;
    public static final Duration DEFAULT_SHUTDOWN_GRACE = Duration.ofSeconds(10);
    public static final Duration DEFAULT_IDLE_CLIENT_TIMEOUT = Duration.ofSeconds(60);

    public ProxySettings {
        Objects.requireNonNull(listen, "listen");
        Objects.requireNonNull(shutdownGrace, "shutdownGrace");
        Objects.requireNonNull(idleClientTimeout, "idleClientTimeout");
        if (workerThreads < 0) {
            throw new IllegalArgumentException("workerThreads must be >= 0");
        }
        if (maxReplayBytes < 0) {
            throw new IllegalArgumentException("maxReplayBytes must be >= 0");
        }
    }

    public static ProxySettings defaults(ListenAddress listen) {
        return new ProxySettings(listen, 0, DEFAULT_MAX_REPLAY_BYTES, DEFAULT_MAX_INITIAL_LINE_LENGTH,
                DEFAULT_MAX_HEADER_SIZE, true, DEFAULT_SHUTDOWN_GRACE, DEFAULT_IDLE_CLIENT_TIMEOUT);
    }
}
