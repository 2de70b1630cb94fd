package net.spookly.httpgate.routing;

import java.time.Duration;
import java.util.Objects;

import lombok.Getter;
import lombok.ToString;
import lombok.experimental.Accessors;

/**
 * Per-route forwarding policy.
 */
@Getter
@Accessors(fluent = true)
@ToString
public final class RoutePolicy {
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);
    public static final int DEFAULT_RETRIES = 1;
    public static final int DEFAULT_MAX_CONCURRENCY = 256;
    public static final int DEFAULT_MAX_QUEUED = 128;

    /**
     * Deadline for the whole request, retries included.
     */
    private final Duration timeout;
    /**
     * Optional per-attempt limit on waiting for the response head; {@code null} means the request deadline only.
     */
    private final Duration attemptTimeout;
    private final int retries;
    private final int maxConcurrency;
    private final int maxQueued;
    private final SelectionPolicy selection;

    public RoutePolicy(Duration timeout,
                       Duration attemptTimeout,
                       int retries,
                       int maxConcurrency,
                       int maxQueued,
                       SelectionPolicy selection) {
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.attemptTimeout = attemptTimeout;
        this.retries = Math.max(0, retries);
        this.maxConcurrency = Math.max(1, maxConcurrency);
        this.maxQueued = Math.max(0, maxQueued);
        this.selection = selection == null ? SelectionPolicy.ORDERED : selection;
    }

    public static RoutePolicy defaults() {
        return new RoutePolicy(DEFAULT_TIMEOUT, null, DEFAULT_RETRIES, DEFAULT_MAX_CONCURRENCY,
                DEFAULT_MAX_QUEUED, SelectionPolicy.ORDERED);
    }
}
