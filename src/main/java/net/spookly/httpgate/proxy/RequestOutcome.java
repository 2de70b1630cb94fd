package net.spookly.httpgate.proxy;

import java.time.Duration;

import lombok.Value;
import lombok.experimental.Accessors;
import net.spookly.httpgate.GatewayFailure;

/**
 * Summary of one finished request.
 */
@Value
@Accessors(fluent = true)
public class RequestOutcome {
    String method;
    String uri;
    /**
     * Matched route id, or {@code null} when nothing matched.
     */
    String routeId;
    /**
     * Last target attempted, or {@code null} when no attempt was made.
     */
    String target;
    /**
     * Status sent to the client, or 0 when none was sent.
     */
    int status;
    Duration latency;
    int retries;
    boolean degraded;
    /**
     * Failure that ended the request, or {@code null} on success.
     */
    GatewayFailure failure;

    public boolean succeeded() {
        return failure == null;
    }
}
