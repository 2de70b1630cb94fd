package net.spookly.httpgate.admission;

import java.util.Objects;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.experimental.Accessors;
import net.spookly.httpgate.routing.Route;

/**
 * Capacity domain a request is admitted into: the whole gateway, or a single route.
 * Scopes are equal by key; the limits only seed the scope's limiter.
 */
@Getter
@Accessors(fluent = true)
@EqualsAndHashCode(of = "key")
public final class AdmissionScope {
    private static final AdmissionScope GLOBAL = new AdmissionScope("global", null, null);

    private final String key;
    private final String routeId;
    private final AdmissionLimits limits;

    private AdmissionScope(String key, String routeId, AdmissionLimits limits) {
        this.key = key;
        this.routeId = routeId;
        this.limits = limits;
    }

    public static AdmissionScope global() {
        return GLOBAL;
    }

    /**
     * Route scope using the controller's default route limits.
     */
    public static AdmissionScope route(String routeId) {
        return route(routeId, null);
    }

    public static AdmissionScope route(String routeId, AdmissionLimits limits) {
        Objects.requireNonNull(routeId, "routeId");
        return new AdmissionScope("route:" + routeId, routeId, limits);
    }

    /**
     * Route scope carrying the route policy's concurrency limits.
     */
    public static AdmissionScope of(Route route) {
        return route(route.id(), new AdmissionLimits(route.policy().maxConcurrency(), route.policy().maxQueued()));
    }

    public boolean isGlobal() {
        return routeId == null;
    }

    @Override
    public String toString() {
        return key;
    }
}
