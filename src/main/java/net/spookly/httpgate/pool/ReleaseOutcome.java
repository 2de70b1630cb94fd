package net.spookly.httpgate.pool;

/**
 * How a checked-out connection finished its request.
 */
public enum ReleaseOutcome {
    /**
     * Exchange completed cleanly; the connection may serve another request.
     */
    REUSABLE,
    /**
     * Transport failure or incomplete exchange; the connection is closed, never pooled again.
     */
    BROKEN
}
