package net.spookly.httpgate.proxy;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import io.netty.handler.codec.http.DefaultHttpRequest;
import io.netty.handler.codec.http.DefaultHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpRequest;
import io.netty.handler.codec.http.HttpResponse;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpVersion;
import net.spookly.httpgate.routing.UpstreamTarget;

/**
 * Header rewriting between the client and upstream hops.
 */
public final class ProxyHeaders {
    public static final String X_FORWARDED_FOR = "X-Forwarded-For";
    public static final String X_FORWARDED_HOST = "X-Forwarded-Host";
    public static final String X_FORWARDED_PROTO = "X-Forwarded-Proto";

    private static final Set<String> HOP_BY_HOP = Set.of(
            "connection",
            "keep-alive",
            "proxy-connection",
            "proxy-authenticate",
            "proxy-authorization",
            "te",
            "trailer",
            "upgrade"
    );

    private ProxyHeaders() {
    }

    public static boolean isHopByHop(String name) {
        return name != null && HOP_BY_HOP.contains(name.toLowerCase(Locale.ROOT));
    }

    /**
     * Remove hop-by-hop headers, including those nominated by {@code Connection}.
     * {@code Transfer-Encoding} and {@code Content-Length} stay because they frame the body on both hops.
     */
    public static void stripHopByHop(HttpHeaders headers) {
        List<String> nominated = new ArrayList<>();
        for (String value : headers.getAll(HttpHeaderNames.CONNECTION)) {
            for (String token : value.split(",")) {
                String trimmed = token.trim();
                if (!trimmed.isEmpty()) {
                    nominated.add(trimmed);
                }
            }
        }
        for (String name : nominated) {
            if (!HttpHeaderNames.TRANSFER_ENCODING.contentEqualsIgnoreCase(name)
                    && !HttpHeaderNames.CONTENT_LENGTH.contentEqualsIgnoreCase(name)) {
                headers.remove(name);
            }
        }
        for (String name : HOP_BY_HOP) {
            headers.remove(name);
        }
    }

    /**
     * Request head sent upstream: HTTP/1.1, origin-form URI, hop-by-hop headers removed, client
     * {@code Host} preserved and forwarding headers appended.
     */
    public static HttpRequest upstreamRequest(HttpRequest client,
                                              SocketAddress clientAddress,
                                              UpstreamTarget target,
                                              boolean forwardedHeaders) {
        DefaultHttpRequest request = new DefaultHttpRequest(HttpVersion.HTTP_1_1, client.method(), originForm(client.uri()));
        HttpHeaders headers = request.headers();
        headers.set(client.headers());
        stripHopByHop(headers);
        String host = client.headers().get(HttpHeaderNames.HOST);
        if (host == null || host.isBlank()) {
            host = authorityOf(client.uri());
        }
        if (host == null || host.isBlank()) {
            headers.set(HttpHeaderNames.HOST, target.key());
        } else {
            headers.set(HttpHeaderNames.HOST, host);
        }
        if (forwardedHeaders) {
            String clientIp = clientIp(clientAddress);
            if (clientIp != null) {
                String existing = headers.get(X_FORWARDED_FOR);
                headers.set(X_FORWARDED_FOR, existing == null || existing.isBlank() ? clientIp : existing + ", " + clientIp);
            }
            if (!headers.contains(X_FORWARDED_HOST) && host != null && !host.isBlank()) {
                headers.set(X_FORWARDED_HOST, host);
            }
            if (!headers.contains(X_FORWARDED_PROTO)) {
                headers.set(X_FORWARDED_PROTO, "http");
            }
        }
        return request;
    }

    /**
     * Response head relayed to the client in the client's protocol version with hop-by-hop headers removed.
     * Framing and {@code Connection} are settled by the caller.
     */
    public static HttpResponse clientResponse(HttpResponse upstream, HttpVersion clientVersion) {
        DefaultHttpResponse response = new DefaultHttpResponse(clientVersion, upstream.status());
        response.headers().set(upstream.headers());
        stripHopByHop(response.headers());
        return response;
    }

    /**
     * True when the response to {@code method} with {@code status} carries no body.
     */
    public static boolean isBodyless(HttpMethod method, HttpResponseStatus status) {
        int code = status.code();
        return HttpMethod.HEAD.equals(method)
                || (code >= 100 && code < 200)
                || code == HttpResponseStatus.NO_CONTENT.code()
                || code == HttpResponseStatus.NOT_MODIFIED.code();
    }

    /**
     * Interim 1xx responses other than {@code 101}; they are not relayed.
     */
    public static boolean isInformational(HttpResponseStatus status) {
        int code = status.code();
        return code >= 100 && code < 200 && code != HttpResponseStatus.SWITCHING_PROTOCOLS.code();
    }

    /**
     * Path of a request target in origin or absolute form, or {@code null} when it cannot be parsed.
     */
    public static String requestPath(String uri) {
        if (uri == null || uri.isEmpty()) {
            return null;
        }
        if (uri.startsWith("/")) {
            int end = indexOfAny(uri, '?', '#');
            return end < 0 ? uri : uri.substring(0, end);
        }
        if ("*".equals(uri)) {
            return "/";
        }
        try {
            URI parsed = URI.create(uri);
            if (parsed.getScheme() == null) {
                return null;
            }
            String path = parsed.getRawPath();
            return path == null || path.isEmpty() ? "/" : path;
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    static String originForm(String uri) {
        if (uri == null || uri.isEmpty() || uri.startsWith("/") || "*".equals(uri)) {
            return uri == null || uri.isEmpty() ? "/" : uri;
        }
        try {
            URI parsed = URI.create(uri);
            String path = parsed.getRawPath();
            StringBuilder builder = new StringBuilder(path == null || path.isEmpty() ? "/" : path);
            if (parsed.getRawQuery() != null) {
                builder.append('?').append(parsed.getRawQuery());
            }
            return builder.toString();
        } catch (IllegalArgumentException e) {
            return uri;
        }
    }

    static String clientIp(SocketAddress address) {
        if (address instanceof InetSocketAddress) {
            InetSocketAddress inet = (InetSocketAddress) address;
            return inet.getAddress() == null ? inet.getHostString() : inet.getAddress().getHostAddress();
        }
        return null;
    }

    private static String authorityOf(String uri) {
        if (uri == null || uri.startsWith("/")) {
            return null;
        }
        try {
            return URI.create(uri).getRawAuthority();
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private static int indexOfAny(String value, char first, char second) {
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == first || c == second) {
                return i;
            }
        }
        return -1;
    }
}
