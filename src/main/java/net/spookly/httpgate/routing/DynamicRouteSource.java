package net.spookly.httpgate.routing;

/**
 * Fallback consulted when no static route matches, such as host-pattern service routing.
 */
@FunctionalInterface
public interface DynamicRouteSource {
    DynamicRouteSource NONE = (host, path) -> null;

    /**
     * @return a route for the request, or {@code null} when the source does not know the host
     */
    Route resolve(String normalizedHost, String path);
}
