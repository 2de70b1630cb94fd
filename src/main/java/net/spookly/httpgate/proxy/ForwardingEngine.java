package net.spookly.httpgate.proxy;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

import io.netty.channel.Channel;
import io.netty.handler.codec.http.HttpRequest;
import lombok.extern.slf4j.Slf4j;
import net.spookly.httpgate.admission.AdmissionController;
import net.spookly.httpgate.health.UpstreamHealthTracker;
import net.spookly.httpgate.pool.UpstreamPoolManager;
import net.spookly.httpgate.routing.RoutingService;

/**
 * Forwards client requests: route, admit, pick a healthy target, borrow a pooled connection, relay the
 * exchange and retry transport failures while nothing has reached the client yet.
 */
@Slf4j
public final class ForwardingEngine {
    private final RoutingService routing;
    private final AdmissionController admission;
    private final UpstreamPoolManager pools;
    private final UpstreamHealthTracker health;
    private final ProxySettings settings;
    private final ProxyEventListener listener;
    private final AtomicInteger activeRequests = new AtomicInteger();
    private volatile boolean draining;

    public ForwardingEngine(RoutingService routing,
                            AdmissionController admission,
                            UpstreamPoolManager pools,
                            UpstreamHealthTracker health,
                            ProxySettings settings,
                            ProxyEventListener listener) {
        this.routing = Objects.requireNonNull(routing, "routing");
        this.admission = Objects.requireNonNull(admission, "admission");
        this.pools = Objects.requireNonNull(pools, "pools");
        this.health = Objects.requireNonNull(health, "health");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.listener = listener == null ? ProxyEventListener.NOOP : listener;
    }

    /**
     * Number of requests started and not yet finished.
     */
    public int activeRequests() {
        return activeRequests.get();
    }

    /**
     * Stop offering keep-alive so client connections wind down after their current request.
     */
    public void beginDraining() {
        draining = true;
    }

    public boolean isDraining() {
        return draining;
    }

    InFlightRequest begin(ProxyFrontendHandler frontend, Channel client, HttpRequest request) {
        return new InFlightRequest(this, frontend, client, request);
    }

    void requestStarted() {
        activeRequests.incrementAndGet();
    }

    void requestFinished(RequestOutcome outcome) {
        activeRequests.decrementAndGet();
        publish(outcome);
    }

    /**
     * Outcome of a request that was rejected before it could start.
     */
    void publish(RequestOutcome outcome) {
        try {
            listener.onRequestCompleted(outcome);
        } catch (RuntimeException e) {
            log.warn("Request listener failed", e);
        }
    }

    RoutingService routing() {
        return routing;
    }

    AdmissionController admission() {
        return admission;
    }

    UpstreamPoolManager pools() {
        return pools;
    }

    UpstreamHealthTracker health() {
        return health;
    }

    ProxySettings settings() {
        return settings;
    }
}
