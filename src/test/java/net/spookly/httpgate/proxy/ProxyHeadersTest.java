package net.spookly.httpgate.proxy;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.net.InetSocketAddress;

import io.netty.handler.codec.http.DefaultHttpRequest;
import io.netty.handler.codec.http.DefaultHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpRequest;
import io.netty.handler.codec.http.HttpResponse;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpVersion;
import net.spookly.httpgate.routing.UpstreamTarget;
import org.junit.jupiter.api.Test;

class ProxyHeadersTest {
    private static final InetSocketAddress CLIENT = new InetSocketAddress("192.0.2.7", 51000);
    private static final UpstreamTarget TARGET = UpstreamTarget.of("10.0.0.1", 8080);

    @Test
    void stripsHopByHopAndNominatedHeaders() {
        HttpRequest client = new DefaultHttpRequest(HttpVersion.HTTP_1_1, HttpMethod.GET, "/a");
        client.headers()
                .set(HttpHeaderNames.HOST, "api.example.com")
                .set(HttpHeaderNames.CONNECTION, "keep-alive, X-Session-Hint")
                .set("X-Session-Hint", "abc")
                .set(HttpHeaderNames.UPGRADE, "websocket")
                .set("Proxy-Authorization", "Basic Zm9v")
                .set("X-Keep", "yes");

        HttpRequest upstream = ProxyHeaders.upstreamRequest(client, CLIENT, TARGET, true);

        assertFalse(upstream.headers().contains(HttpHeaderNames.CONNECTION));
        assertFalse(upstream.headers().contains("X-Session-Hint"));
        assertFalse(upstream.headers().contains(HttpHeaderNames.UPGRADE));
        assertFalse(upstream.headers().contains("Proxy-Authorization"));
        assertEquals("yes", upstream.headers().get("X-Keep"));
    }

    @Test
    void preservesHostAndAddsForwardingHeaders() {
        HttpRequest client = new DefaultHttpRequest(HttpVersion.HTTP_1_0, HttpMethod.POST, "/submit?x=1");
        client.headers().set(HttpHeaderNames.HOST, "api.example.com:8443");

        HttpRequest upstream = ProxyHeaders.upstreamRequest(client, CLIENT, TARGET, true);

        assertEquals(HttpVersion.HTTP_1_1, upstream.protocolVersion());
        assertEquals("/submit?x=1", upstream.uri());
        assertEquals("api.example.com:8443", upstream.headers().get(HttpHeaderNames.HOST));
        assertEquals("192.0.2.7", upstream.headers().get(ProxyHeaders.X_FORWARDED_FOR));
        assertEquals("api.example.com:8443", upstream.headers().get(ProxyHeaders.X_FORWARDED_HOST));
        assertEquals("http", upstream.headers().get(ProxyHeaders.X_FORWARDED_PROTO));
    }

    @Test
    void appendsToExistingForwardedFor() {
        HttpRequest client = new DefaultHttpRequest(HttpVersion.HTTP_1_1, HttpMethod.GET, "/");
        client.headers().set(HttpHeaderNames.HOST, "a.example.com").set(ProxyHeaders.X_FORWARDED_FOR, "203.0.113.1");

        HttpRequest upstream = ProxyHeaders.upstreamRequest(client, CLIENT, TARGET, true);

        assertEquals("203.0.113.1, 192.0.2.7", upstream.headers().get(ProxyHeaders.X_FORWARDED_FOR));
    }

    @Test
    void forwardingHeadersCanBeDisabled() {
        HttpRequest client = new DefaultHttpRequest(HttpVersion.HTTP_1_1, HttpMethod.GET, "/");
        client.headers().set(HttpHeaderNames.HOST, "a.example.com");

        HttpRequest upstream = ProxyHeaders.upstreamRequest(client, CLIENT, TARGET, false);

        assertFalse(upstream.headers().contains(ProxyHeaders.X_FORWARDED_FOR));
        assertFalse(upstream.headers().contains(ProxyHeaders.X_FORWARDED_PROTO));
    }

    @Test
    void absoluteFormBecomesOriginFormWithAuthorityAsHost() {
        HttpRequest client = new DefaultHttpRequest(HttpVersion.HTTP_1_1, HttpMethod.GET, "http://svc.example.com/x/y?q=2");

        HttpRequest upstream = ProxyHeaders.upstreamRequest(client, CLIENT, TARGET, false);

        assertEquals("/x/y?q=2", upstream.uri());
        assertEquals("svc.example.com", upstream.headers().get(HttpHeaderNames.HOST));
    }

    @Test
    void missingHostFallsBackToTarget() {
        HttpRequest client = new DefaultHttpRequest(HttpVersion.HTTP_1_0, HttpMethod.GET, "/");

        HttpRequest upstream = ProxyHeaders.upstreamRequest(client, CLIENT, TARGET, false);

        assertEquals("10.0.0.1:8080", upstream.headers().get(HttpHeaderNames.HOST));
    }

    @Test
    void clientResponseUsesClientVersion() {
        HttpResponse upstream = new DefaultHttpResponse(HttpVersion.HTTP_1_1, HttpResponseStatus.OK);
        upstream.headers().set(HttpHeaderNames.KEEP_ALIVE, "timeout=5").set(HttpHeaderNames.CONTENT_LENGTH, 3);

        HttpResponse response = ProxyHeaders.clientResponse(upstream, HttpVersion.HTTP_1_0);

        assertEquals(HttpVersion.HTTP_1_0, response.protocolVersion());
        assertFalse(response.headers().contains(HttpHeaderNames.KEEP_ALIVE));
        assertEquals("3", response.headers().get(HttpHeaderNames.CONTENT_LENGTH));
    }

    @Test
    void requestPathHandlesOriginAndAbsoluteForms() {
        assertEquals("/api/users", ProxyHeaders.requestPath("/api/users?limit=5"));
        assertEquals("/x", ProxyHeaders.requestPath("http://host/x#frag"));
        assertEquals("/", ProxyHeaders.requestPath("http://host"));
        assertEquals("/", ProxyHeaders.requestPath("*"));
        assertNull(ProxyHeaders.requestPath("not a uri"));
        assertNull(ProxyHeaders.requestPath(""));
    }

    @Test
    void bodylessResponses() {
        assertTrue(ProxyHeaders.isBodyless(HttpMethod.HEAD, HttpResponseStatus.OK));
        assertTrue(ProxyHeaders.isBodyless(HttpMethod.GET, HttpResponseStatus.NO_CONTENT));
        assertTrue(ProxyHeaders.isBodyless(HttpMethod.GET, HttpResponseStatus.NOT_MODIFIED));
        assertFalse(ProxyHeaders.isBodyless(HttpMethod.GET, HttpResponseStatus.OK));
        assertTrue(ProxyHeaders.isInformational(HttpResponseStatus.CONTINUE));
        assertFalse(ProxyHeaders.isInformational(HttpResponseStatus.SWITCHING_PROTOCOLS));
    }
}
