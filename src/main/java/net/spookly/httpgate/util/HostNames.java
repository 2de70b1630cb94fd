package net.spookly.httpgate.util;

import java.util.Locale;

/**
 * Normalizes {@code Host} header values for matching.
 */
public final class HostNames {
    private HostNames() {
    }

    /**
     * Lower-case host without port or trailing dot; IPv6 literals keep their brackets stripped.
     * Returns an empty string for a missing header.
     */
    public static String normalize(String hostHeader) {
        if (hostHeader == null) {
            return "";
        }
        String host = hostHeader.trim();
        if (host.isEmpty()) {
            return "";
        }
        if (host.startsWith("[")) {
            int close = host.indexOf(']');
            host = close > 0 ? host.substring(1, close) : host.substring(1);
        } else {
            int colon = host.indexOf(':');
            if (colon >= 0 && colon == host.lastIndexOf(':')) {
                host = host.substring(0, colon);
            }
        }
        if (host.endsWith(".")) {
            host = host.substring(0, host.length() - 1);
        }
        return host.toLowerCase(Locale.ROOT);
    }
}
