package net.spookly.httpgate.health;

/**
 * Sink for circuit state transitions.
 */
@FunctionalInterface
public interface CircuitStateListener {
    CircuitStateListener NOOP = transition -> {
    };

    void onTransition(CircuitTransition transition);
}
