package net.spookly.httpgate.proxy;

/**
 * Receives one event per finished request.
 */
@FunctionalInterface
public interface ProxyEventListener {
    ProxyEventListener NOOP = outcome -> {
    };

    void onRequestCompleted(RequestOutcome outcome);
}
