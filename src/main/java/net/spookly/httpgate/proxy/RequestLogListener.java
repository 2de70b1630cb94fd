package net.spookly.httpgate.proxy;

import lombok.extern.slf4j.Slf4j;

/**
 * Access log of finished requests.
 */
@Slf4j
public final class RequestLogListener implements ProxyEventListener {
    public static final RequestLogListener INSTANCE = new RequestLogListener();

    private RequestLogListener() {
    }

    @Override
    public void onRequestCompleted(RequestOutcome outcome) {
        if (outcome.succeeded()) {
            log.info("request_completed method={} uri={} route={} target={} status={} latencyMs={} retries={}",
                    outcome.method(), outcome.uri(), outcome.routeId(), outcome.target(), outcome.status(),
                    outcome.latency().toMillis(), outcome.retries());
        } else {
            log.warn("request_failed method={} uri={} route={} target={} status={} latencyMs={} retries={} failure={}",
                    outcome.method(), outcome.uri(), outcome.routeId(), outcome.target(), outcome.status(),
                    outcome.latency().toMillis(), outcome.retries(), outcome.failure().reason());
        }
    }
}
