package net.spookly.httpgate.routing;

import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Immutable snapshot of the route rules, in registration order.
 */
public final class RouteTable {
    private static final AtomicLong VERSIONS = new AtomicLong();

    private final List<Route> routes;
    private final long version;

    public RouteTable(List<Route> routes) {
        this.routes = List.copyOf(routes);
        this.version = VERSIONS.incrementAndGet();
    }

    public static RouteTable empty() {
        return new RouteTable(List.of());
    }

    public List<Route> routes() {
        return routes;
    }

    /**
     * Monotonic publication number, distinct for every table built in this process.
     */
    public long version() {
        return version;
    }

    /**
     * Most specific route for the request, or {@code null} when nothing matches.
     * Longest path prefix wins, then longest host match, then registration order.
     */
    public Route match(String normalizedHost, String path) {
        Route best = null;
        for (Route route : routes) {
            RouteMatch match = route.match();
            if (!match.matches(normalizedHost, path)) {
                continue;
            }
            if (best == null || isMoreSpecific(match, best.match())) {
                best = route;
            }
        }
        return best;
    }

    public Route findById(String id) {
        for (Route route : routes) {
            if (route.id().equals(id)) {
                return route;
            }
        }
        return null;
    }

    private boolean isMoreSpecific(RouteMatch candidate, RouteMatch current) {
        if (candidate.pathSpecificity() != current.pathSpecificity()) {
            return candidate.pathSpecificity() > current.pathSpecificity();
        }
        return candidate.hostSpecificity() > current.hostSpecificity();
    }
}
