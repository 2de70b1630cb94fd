package net.spookly.httpgate.routing;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import net.spookly.httpgate.config.HttpgateConfig;

/**
 * Builds immutable route tables from the routing config section.
 */
public final class RouteTableFactory {
    private RouteTableFactory() {
    }

    public static RouteTable fromConfig(HttpgateConfig config) {
        if (config == null || config.routing == null || config.routing.routes == null) {
            return RouteTable.empty();
        }
        RoutePolicy defaults = defaultPolicy(config);
        List<Route> routes = new ArrayList<>(config.routing.routes.size());
        for (HttpgateConfig.RouteConfig route : config.routing.routes) {
            if (route == null) {
                continue;
            }
            routes.add(toRoute(route, defaults));
        }
        return new RouteTable(routes);
    }

    /**
     * Policy from {@code routing.defaults}, falling back to built-in defaults per field.
     */
    public static RoutePolicy defaultPolicy(HttpgateConfig config) {
        RoutePolicy builtIn = RoutePolicy.defaults();
        HttpgateConfig.RoutePolicyConfig defaults = config == null || config.routing == null
                ? null
                : config.routing.defaults;
        if (defaults == null) {
            return builtIn;
        }
        return new RoutePolicy(
                millisOr(defaults.timeoutMs, builtIn.timeout()),
                millisOr(defaults.attemptTimeoutMs, null),
                valueOr(defaults.retries, builtIn.retries()),
                valueOr(defaults.maxConcurrency, builtIn.maxConcurrency()),
                valueOr(defaults.maxQueued, builtIn.maxQueued()),
                SelectionPolicy.fromConfig(defaults.policy, builtIn.selection())
        );
    }

    private static Route toRoute(HttpgateConfig.RouteConfig route, RoutePolicy defaults) {
        HttpgateConfig.MatchConfig match = route.match;
        RouteMatch routeMatch = new RouteMatch(
                match == null ? null : match.host,
                match == null ? null : match.pathPrefix
        );
        List<UpstreamTarget> targets = new ArrayList<>();
        if (route.targets != null) {
            for (HttpgateConfig.TargetConfig target : route.targets) {
                if (target == null) {
                    continue;
                }
                targets.add(new UpstreamTarget(
                        target.id,
                        target.host,
                        target.port,
                        target.weight == null ? 1 : target.weight
                ));
            }
        }
        RoutePolicy policy = new RoutePolicy(
                millisOr(route.timeoutMs, defaults.timeout()),
                millisOr(route.attemptTimeoutMs, defaults.attemptTimeout()),
                valueOr(route.retries, defaults.retries()),
                valueOr(route.maxConcurrency, defaults.maxConcurrency()),
                valueOr(route.maxQueued, defaults.maxQueued()),
                SelectionPolicy.fromConfig(route.policy, defaults.selection())
        );
        return new Route(route.id, routeMatch, targets, policy);
    }

    private static Duration millisOr(Integer millis, Duration fallback) {
        return millis == null ? fallback : Duration.ofMillis(millis);
    }

    private static int valueOr(Integer value, int fallback) {
        return value == null ? fallback : value;
    }
}
