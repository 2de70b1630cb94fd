package net.spookly.httpgate.util;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.experimental.Accessors;

import java.net.InetSocketAddress;

/**
 * Host/port pair parsed from {@code host:port} or {@code [v6-host]:port}.
 */
@Getter
@Accessors(fluent = true)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class ListenAddress {
    private final String host;
    private final int port;

    public static ListenAddress of(String host, int port) {
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("listen host is required");
        }
        checkPort(port);
        return new ListenAddress(host.trim(), port);
    }

    /**
     * Port 0 binds an ephemeral port.
     */
    public static ListenAddress ephemeral(String host) {
        return of(host, 0);
    }

    /**
     * Parse a listen address such as {@code 0.0.0.0:8080} or {@code [::1]:8081}.
     */
    public static ListenAddress parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("listen address is required");
        }
        String value = raw.trim();
        String host;
        String portRaw;
        if (value.startsWith("[")) {
            int close = value.indexOf(']');
            if (close < 0 || close + 1 >= value.length() || value.charAt(close + 1) != ':') {
                throw new IllegalArgumentException("listen address must be [host]:port: " + raw);
            }
            host = value.substring(1, close);
            portRaw = value.substring(close + 2);
        } else {
            int lastColon = value.lastIndexOf(':');
            if (lastColon <= 0 || lastColon == value.length() - 1) {
                throw new IllegalArgumentException("listen address must be host:port: " + raw);
            }
            host = value.substring(0, lastColon).trim();
            portRaw = value.substring(lastColon + 1).trim();
        }
        int port;
        try {
            port = Integer.parseInt(portRaw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("listen port must be numeric: " + portRaw, e);
        }
        return of(host, port);
    }

    public InetSocketAddress toSocketAddress() {
        return new InetSocketAddress(host, port);
    }

    @Override
    public String toString() {
        return host.indexOf(':') >= 0 ? "[" + host + "]:" + port : host + ":" + port;
    }

    private static void checkPort(int port) {
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("listen port must be between 0 and 65535: " + port);
        }
    }
}
