package net.spookly.httpgate.routing;

import java.util.List;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Outcome of resolving a request: the matched route and the candidates to try, in order.
 * A resolution without a route is the normal "no route" outcome.
 */
@Getter
@Accessors(fluent = true)
@AllArgsConstructor(access = AccessLevel.PACKAGE)
public final class RouteResolution {
    private static final RouteResolution NO_ROUTE = new RouteResolution(null, List.of(), false, 0L);

    private final Route route;
    private final List<UpstreamTarget> candidates;
    /**
     * True when every target was unavailable and all of them are offered anyway.
     */
    private final boolean degraded;
    private final long tableVersion;

    public static RouteResolution noRoute() {
        return NO_ROUTE;
    }

    public boolean found() {
        return route != null;
    }
}
