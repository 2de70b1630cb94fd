package net.spookly.httpgate.routing;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import lombok.extern.slf4j.Slf4j;
import net.spookly.httpgate.health.UpstreamHealthTracker;
import net.spookly.httpgate.util.HostNames;

/**
 * Resolves requests against the published route table snapshot and orders candidates by health and policy.
 */
@Slf4j
public final class RoutingService {
    private final AtomicReference<RouteTable> table;
    private final UpstreamHealthTracker healthTracker;
    private final DynamicRouteSource dynamicRoutes;
    private final Map<String, AtomicInteger> rotationCounters = new ConcurrentHashMap<>();

    public RoutingService(RouteTable initial, UpstreamHealthTracker healthTracker, DynamicRouteSource dynamicRoutes) {
        this.table = new AtomicReference<>(Objects.requireNonNull(initial, "initial"));
        this.healthTracker = healthTracker;
        this.dynamicRoutes = dynamicRoutes == null ? DynamicRouteSource.NONE : dynamicRoutes;
    }

    /**
     * Replace the route table wholesale. Lookups already running keep the snapshot they started with.
     */
    public void publish(RouteTable next) {
        Objects.requireNonNull(next, "next");
        RouteTable previous = table.getAndSet(next);
        log.info("Published route table version={} routes={} (previous version={})",
                next.version(), next.routes().size(), previous.version());
    }

    public RouteTable currentTable() {
        return table.get();
    }

    /**
     * Resolve a request by its {@code Host} header and path.
     */
    public RouteResolution resolve(String hostHeader, String path) {
        RouteTable snapshot = table.get();
        String host = HostNames.normalize(hostHeader);
        String normalizedPath = path == null || path.isEmpty() ? "/" : path;
        Route route = snapshot.match(host, normalizedPath);
        if (route == null) {
            route = dynamicRoutes.resolve(host, normalizedPath);
        }
        if (route == null) {
            return RouteResolution.noRoute();
        }
        List<UpstreamTarget> targets = route.targets();
        List<UpstreamTarget> routable = filterRoutable(targets);
        if (routable.isEmpty()) {
            // Every target is unavailable: offer all of them rather than failing the route closed.
            return new RouteResolution(route, rotate(targets, nextRotation(route)), true, snapshot.version());
        }
        return new RouteResolution(route, order(route, routable), false, snapshot.version());
    }

    private List<UpstreamTarget> order(Route route, List<UpstreamTarget> routable) {
        if (routable.size() == 1) {
            return routable;
        }
        switch (route.policy().selection()) {
            case ROUND_ROBIN:
                return rotate(routable, nextRotation(route));
            case WEIGHTED:
                return rotate(routable, weightedIndex(routable));
            case ORDERED:
            default:
                return routable;
        }
    }

    private List<UpstreamTarget> filterRoutable(List<UpstreamTarget> targets) {
        if (healthTracker == null) {
            return targets;
        }
        List<UpstreamTarget> routable = new ArrayList<>(targets.size());
        for (UpstreamTarget target : targets) {
            if (healthTracker.isRoutable(target)) {
                routable.add(target);
            }
        }
        return routable;
    }

    private int nextRotation(Route route) {
        AtomicInteger counter = rotationCounters.computeIfAbsent(route.id(), key -> new AtomicInteger());
        return counter.getAndIncrement();
    }

    private int weightedIndex(List<UpstreamTarget> candidates) {
        long totalWeight = 0;
        for (UpstreamTarget candidate : candidates) {
            totalWeight += candidate.weight();
        }
        long pick = ThreadLocalRandom.current().nextLong(totalWeight);
        long running = 0;
        for (int i = 0; i < candidates.size(); i++) {
            running += candidates.get(i).weight();
            if (pick < running) {
                return i;
            }
        }
        return candidates.size() - 1;
    }

    private static List<UpstreamTarget> rotate(List<UpstreamTarget> targets, int offset) {
        int size = targets.size();
        if (size <= 1) {
            return targets;
        }
        int start = Math.floorMod(offset, size);
        if (start == 0) {
            return targets;
        }
        List<UpstreamTarget> rotated = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            rotated.add(targets.get((start + i) % size));
        }
        return List.copyOf(rotated);
    }
}
