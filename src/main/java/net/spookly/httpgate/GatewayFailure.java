package net.spookly.httpgate;

/**
 * Failure taxonomy of the forwarding path and the client-visible outcome of each.
 */
public enum GatewayFailure {
    NO_ROUTE("no_route", 404),
    POOL_EXHAUSTED("pool_exhausted", 503),
    REJECTED("rejected", 503),
    UPSTREAM_UNREACHABLE("upstream_unreachable", 502),
    UPSTREAM_TIMEOUT("upstream_timeout", 504),
    /**
     * The client went away; nothing is written back.
     */
    CLIENT_DISCONNECTED("client_disconnected", 0),
    /**
     * Upstream failed after response bytes reached the client; the client connection is terminated.
     */
    PARTIAL_RESPONSE_FAILURE("partial_response_failure", 0),
    BAD_REQUEST("bad_request", 400);

    private final String reason;
    private final int status;

    GatewayFailure(String reason, int status) {
        this.reason = reason;
        this.status = status;
    }

    public String reason() {
        return reason;
    }

    /**
     * HTTP status sent to the client, or 0 when no response is written.
     */
    public int status() {
        return status;
    }

    public boolean respondsToClient() {
        return status > 0;
    }

    /**
     * Transport failures that may be retried against another target before any response byte is relayed.
     */
    public boolean isTransport() {
        return this == UPSTREAM_UNREACHABLE || this == UPSTREAM_TIMEOUT;
    }
}
