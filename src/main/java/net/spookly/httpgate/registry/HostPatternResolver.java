package net.spookly.httpgate.registry;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.experimental.Accessors;
import lombok.extern.slf4j.Slf4j;
import net.spookly.httpgate.routing.DynamicRouteSource;
import net.spookly.httpgate.routing.Route;
import net.spookly.httpgate.routing.RouteMatch;
import net.spookly.httpgate.routing.RoutePolicy;
import net.spookly.httpgate.routing.UpstreamTarget;

/**
 * Routes hosts of the form {@code <id>-<port>.<domainSuffix>} to the registered service {@code id}.
 * For example {@code outdoor-before-78648-8080.devbox.example.com} reaches
 * {@code outdoor-before-78648.<namespace>.svc.cluster.local:8080}.
 */
@Slf4j
public final class HostPatternResolver implements DynamicRouteSource {
    /**
     * Route id, and admission scope, shared by every registry-resolved request.
     */
    public static final String ROUTE_ID = "service-registry";
    public static final String DEFAULT_BACKEND_HOST_TEMPLATE = "{id}.{namespace}.svc.cluster.local";

    private static final Pattern HOST_PATTERN = Pattern.compile("^([a-z\\d](?:[-a-z\\d]*[a-z\\d])?)-(\\d+)\\.");

    private final ServiceRegistry registry;
    private final String domainSuffix;
    private final String backendHostTemplate;
    private final RoutePolicy policy;

    public HostPatternResolver(ServiceRegistry registry, String domainSuffix, String backendHostTemplate, RoutePolicy policy) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.domainSuffix = normalizeSuffix(domainSuffix);
        this.backendHostTemplate = backendHostTemplate == null || backendHostTemplate.isBlank()
                ? DEFAULT_BACKEND_HOST_TEMPLATE
                : backendHostTemplate.trim();
        this.policy = policy == null ? RoutePolicy.defaults() : policy;
    }

    /**
     * Extract the service id and port from a host header, ignoring any {@code :port} suffix.
     */
    public static ParsedHost parseHost(String host) {
        if (host == null || host.isEmpty()) {
            return null;
        }
        int colon = host.indexOf(':');
        String hostWithoutPort = colon >= 0 ? host.substring(0, colon) : host;
        Matcher matcher = HOST_PATTERN.matcher(hostWithoutPort);
        if (!matcher.find()) {
            return null;
        }
        int port;
        try {
            port = Integer.parseInt(matcher.group(2));
        } catch (NumberFormatException e) {
            return null;
        }
        if (port < 1 || port > 65535) {
            return null;
        }
        return new ParsedHost(matcher.group(1), port, hostWithoutPort.substring(matcher.end()));
    }

    @Override
    public Route resolve(String normalizedHost, String path) {
        ParsedHost parsed = parseHost(normalizedHost);
        if (parsed == null) {
            return null;
        }
        if (domainSuffix != null && !domainSuffix.equals(parsed.domain())) {
            return null;
        }
        RegisteredService service = registry.get(parsed.serviceId());
        if (service == null) {
            log.debug("No registered service for host {}", normalizedHost);
            return null;
        }
        String backendHost = backendHost(service);
        UpstreamTarget target = new UpstreamTarget(parsed.serviceId() + "-" + parsed.port(), backendHost, parsed.port(), 1);
        return new Route(ROUTE_ID, new RouteMatch(normalizedHost, "/"), List.of(target), policy);
    }

    /**
     * Upstream host of every service registered right now.
     */
    public Set<String> backendHosts() {
        Set<String> hosts = new HashSet<>();
        for (RegisteredService service : registry.list()) {
            hosts.add(backendHost(service));
        }
        return hosts;
    }

    String backendHost(RegisteredService service) {
        return backendHostTemplate
                .replace("{id}", service.id())
                .replace("{namespace}", service.namespace());
    }

    private static String normalizeSuffix(String suffix) {
        if (suffix == null || suffix.isBlank()) {
            return null;
        }
        String normalized = suffix.trim().toLowerCase(Locale.ROOT);
        while (normalized.startsWith(".")) {
            normalized = normalized.substring(1);
        }
        while (normalized.endsWith(".")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        return normalized.isEmpty() ? null : normalized;
    }

    /**
     * Service id, port and remaining domain taken from a host name.
     */
    @Getter
    @Accessors(fluent = true)
    @AllArgsConstructor
    public static final class ParsedHost {
        private final String serviceId;
        private final int port;
        private final String domain;
    }
}
