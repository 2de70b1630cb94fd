package net.spookly.httpgate.proxy;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import io.netty.channel.nio.NioEventLoopGroup;
import net.spookly.httpgate.GatewayFailure;
import net.spookly.httpgate.admission.AdmissionController;
import net.spookly.httpgate.admission.AdmissionLimits;
import net.spookly.httpgate.health.CircuitSettings;
import net.spookly.httpgate.health.CircuitStateListener;
import net.spookly.httpgate.health.UpstreamHealthTracker;
import net.spookly.httpgate.pool.NettyUpstreamConnector;
import net.spookly.httpgate.pool.PoolSettings;
import net.spookly.httpgate.pool.UpstreamPoolManager;
import net.spookly.httpgate.routing.DynamicRouteSource;
import net.spookly.httpgate.routing.RouteTable;
import net.spookly.httpgate.routing.RoutingService;
import net.spookly.httpgate.util.ListenAddress;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class ForwardingEngineTest {
    private final NioEventLoopGroup bossGroup = new NioEventLoopGroup(1);
    private final NioEventLoopGroup workerGroup = new NioEventLoopGroup(1);
    private final BlockingQueue<RequestOutcome> outcomes = new LinkedBlockingQueue<>();
    private HttpProxyServer server;

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop(Duration.ZERO);
        }
        bossGroup.shutdownGracefully(0, 1, TimeUnit.SECONDS).syncUninterruptibly();
        workerGroup.shutdownGracefully(0, 1, TimeUnit.SECONDS).syncUninterruptibly();
    }

    @Test
    void failingRouteLookupAnswersBadGatewayAndFinishesRequest() throws Exception {
        DynamicRouteSource broken = (host, path) -> {
            throw new IllegalStateException("route source unavailable");
        };
        ForwardingEngine engine = startProxy(broken);

        String response = exchange("GET /anything HTTP/1.1\r\nHost: broken.test\r\nConnection: close\r\n\r\n");

        assertTrue(response.startsWith("HTTP/1.1 502"), response);
        assertTrue(response.contains("X-Httpgate-Failure: upstream_unreachable"), response);
        RequestOutcome outcome = outcomes.poll(5, TimeUnit.SECONDS);
        assertNotNull(outcome);
        assertEquals(GatewayFailure.UPSTREAM_UNREACHABLE, outcome.failure());
        assertEquals(502, outcome.status());
        assertEquals(0, engine.activeRequests());
    }

    @Test
    void proxyKeepsServingAfterFailedLookup() throws Exception {
        DynamicRouteSource flaky = (host, path) -> {
            if ("broken.test".equals(host)) {
                throw new IllegalStateException("route source unavailable");
            }
            return null;
        };
        ForwardingEngine engine = startProxy(flaky);

        exchange("GET / HTTP/1.1\r\nHost: broken.test\r\nConnection: close\r\n\r\n");
        String response = exchange("GET / HTTP/1.1\r\nHost: other.test\r\nConnection: close\r\n\r\n");

        assertTrue(response.startsWith("HTTP/1.1 404"), response);
        assertEquals(0, engine.activeRequests());
    }

    private ForwardingEngine startProxy(DynamicRouteSource dynamicRoutes) {
        UpstreamHealthTracker health = new UpstreamHealthTracker(CircuitSettings.defaults(), Clock.systemUTC(),
                CircuitStateListener.NOOP);
        RoutingService routing = new RoutingService(RouteTable.empty(), health, dynamicRoutes);
        AdmissionController admission = new AdmissionController(AdmissionLimits.globalDefaults(),
                AdmissionLimits.globalDefaults(), workerGroup.next());
        UpstreamPoolManager pools = new UpstreamPoolManager(PoolSettings.defaults(),
                new NettyUpstreamConnector(workerGroup), workerGroup.next(), Clock.systemUTC());
        ProxySettings settings = ProxySettings.defaults(ListenAddress.ephemeral("127.0.0.1"));
        ForwardingEngine engine = new ForwardingEngine(routing, admission, pools, health, settings, outcomes::add);
        server = new HttpProxyServer(settings, engine, bossGroup, workerGroup);
        server.start();
        return engine;
    }

    private String exchange(String request) throws IOException {
        try (Socket socket = new Socket("127.0.0.1", server.boundAddress().getPort())) {
            socket.setSoTimeout(10_000);
            socket.getOutputStream().write(request.getBytes(StandardCharsets.US_ASCII));
            socket.getOutputStream().flush();
            InputStream input = socket.getInputStream();
            ByteArrayOutputStream buffer = new ByteArrayOutputStream();
            byte[] chunk = new byte[4096];
            int read;
            while ((read = input.read(chunk)) != -1) {
                buffer.write(chunk, 0, read);
            }
            return buffer.toString(StandardCharsets.ISO_8859_1);
        }
    }
}
