package net.spookly.httpgate;

import java.util.Objects;

/**
 * Failure raised inside the forwarding path; recovered into a client-visible outcome by the forwarding engine.
 */
public class GatewayException extends RuntimeException {
    private final GatewayFailure failure;

    public GatewayException(GatewayFailure failure, String message) {
        super(message);
        this.failure = Objects.requireNonNull(failure, "failure");
    }

    public GatewayException(GatewayFailure failure, String message, Throwable cause) {
        super(message, cause);
        this.failure = Objects.requireNonNull(failure, "failure");
    }

    public GatewayFailure failure() {
        return failure;
    }

    /**
     * Failure carried by {@code cause}, or {@code fallback} when it is not a gateway exception.
     */
    public static GatewayFailure failureOf(Throwable cause, GatewayFailure fallback) {
        Throwable current = cause;
        while (current != null) {
            if (current instanceof GatewayException) {
                return ((GatewayException) current).failure();
            }
            current = current.getCause();
        }
        return fallback;
    }
}
