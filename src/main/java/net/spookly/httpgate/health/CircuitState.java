package net.spookly.httpgate.health;

/**
 * Circuit breaker state of an upstream target.
 */
public enum CircuitState {
    /**
     * Healthy; receives traffic.
     */
    CLOSED,
    /**
     * Unhealthy; excluded from routing until the cool-down elapses.
     */
    OPEN,
    /**
     * Cool-down elapsed; a single trial request decides between CLOSED and OPEN.
     */
    HALF_OPEN
}
