package net.spookly.httpgate.routing;

import java.util.List;
import java.util.Objects;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Immutable routing rule: match predicate, ordered upstream targets and forwarding policy.
 */
@Getter
@Accessors(fluent = true)
public final class Route {
    private final String id;
    private final RouteMatch match;
    private final List<UpstreamTarget> targets;
    private final RoutePolicy policy;

    public Route(String id, RouteMatch match, List<UpstreamTarget> targets, RoutePolicy policy) {
        this.id = Objects.requireNonNull(id, "id");
        this.match = Objects.requireNonNull(match, "match");
        this.targets = List.copyOf(Objects.requireNonNull(targets, "targets"));
        if (this.targets.isEmpty()) {
            throw new IllegalArgumentException("route " + id + " has no targets");
        }
        this.policy = policy == null ? RoutePolicy.defaults() : policy;
    }

    @Override
    public String toString() {
        return "Route[" + id + " " + match + " -> " + targets + "]";
    }
}
