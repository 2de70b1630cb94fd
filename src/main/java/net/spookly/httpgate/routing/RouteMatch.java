package net.spookly.httpgate.routing;

import java.util.Locale;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Host and path-prefix predicate of a route.
 * <p>
 * Hosts are exact names, {@code *.suffix} wildcards, or absent/{@code *} for any host. Path prefixes are
 * segment aware: {@code /api} (or {@code /api/*}) matches {@code /api} and {@code /api/users} but not
 * {@code /apis}.
 */
@Getter
@Accessors(fluent = true)
public final class RouteMatch {
    private static final String ANY_HOST = "*";

    private final String host;
    private final String pathPrefix;
    private final String wildcardSuffix;

    public RouteMatch(String host, String pathPrefix) {
        this.host = normalizeHost(host);
        this.pathPrefix = normalizePrefix(pathPrefix);
        this.wildcardSuffix = this.host.startsWith("*.") ? this.host.substring(1) : null;
    }

    public static RouteMatch anyHost(String pathPrefix) {
        return new RouteMatch(null, pathPrefix);
    }

    /**
     * Host must already be normalized (lower-case, no port).
     */
    public boolean matchesHost(String normalizedHost) {
        if (ANY_HOST.equals(host)) {
            return true;
        }
        if (normalizedHost == null || normalizedHost.isEmpty()) {
            return false;
        }
        if (wildcardSuffix != null) {
            return normalizedHost.length() > wildcardSuffix.length() && normalizedHost.endsWith(wildcardSuffix);
        }
        return host.equals(normalizedHost);
    }

    public boolean matchesPath(String path) {
        if ("/".equals(pathPrefix)) {
            return true;
        }
        if (path == null || !path.startsWith(pathPrefix)) {
            return false;
        }
        return path.length() == pathPrefix.length() || path.charAt(pathPrefix.length()) == '/';
    }

    public boolean matches(String normalizedHost, String path) {
        return matchesHost(normalizedHost) && matchesPath(path);
    }

    /**
     * Longer prefixes are more specific; {@code /} scores lowest.
     */
    public int pathSpecificity() {
        return "/".equals(pathPrefix) ? 0 : pathPrefix.length();
    }

    /**
     * Exact hosts beat wildcards matching the same name; any-host scores 0.
     */
    public int hostSpecificity() {
        if (ANY_HOST.equals(host)) {
            return 0;
        }
        return wildcardSuffix != null ? wildcardSuffix.length() : host.length();
    }

    @Override
    public String toString() {
        return host + pathPrefix;
    }

    private static String normalizeHost(String raw) {
        if (raw == null || raw.isBlank()) {
            return ANY_HOST;
        }
        return raw.trim().toLowerCase(Locale.ROOT);
    }

    private static String normalizePrefix(String raw) {
        if (raw == null || raw.isBlank()) {
            return "/";
        }
        String prefix = raw.trim();
        if (prefix.endsWith("*")) {
            prefix = prefix.substring(0, prefix.length() - 1);
        }
        while (prefix.length() > 1 && prefix.endsWith("/")) {
            prefix = prefix.substring(0, prefix.length() - 1);
        }
        if (!prefix.startsWith("/")) {
            prefix = "/" + prefix;
        }
        return prefix;
    }
}
