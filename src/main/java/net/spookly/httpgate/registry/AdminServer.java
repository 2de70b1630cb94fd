package net.spookly.httpgate.registry;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import lombok.extern.slf4j.Slf4j;
import net.spookly.httpgate.config.ConfigException;
import net.spookly.httpgate.health.CircuitState;
import net.spookly.httpgate.health.UpstreamHealthTracker;
import net.spookly.httpgate.pool.UpstreamPoolManager;
import net.spookly.httpgate.util.ListenAddress;

/**
 * HTTP control plane for the service registry and upstream state.
 */
@Slf4j
public final class AdminServer {
    public static final int DEFAULT_MAX_REQUEST_BYTES = 16 * 1024;

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);
    private static final String SERVICES_PATH = "/v1/services";

    private final ServiceRegistry registry;
    private final UpstreamHealthTracker healthTracker;
    private final UpstreamPoolManager pools;
    private final RouteReloader routeReloader;
    private final byte[] token;
    private final int maxRequestBytes;
    private final HttpServer server;
    private final ExecutorService executor;

    public AdminServer(ListenAddress listen,
                       String token,
                       Integer maxRequestBytes,
                       ServiceRegistry registry,
                       UpstreamHealthTracker healthTracker,
                       UpstreamPoolManager pools,
                       RouteReloader routeReloader) {
        Objects.requireNonNull(listen, "listen");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.healthTracker = healthTracker;
        this.pools = pools;
        this.routeReloader = routeReloader;
        this.token = token == null || token.isBlank() ? null : token.getBytes(StandardCharsets.UTF_8);
        this.maxRequestBytes = maxRequestBytes != null && maxRequestBytes > 0 ? maxRequestBytes : DEFAULT_MAX_REQUEST_BYTES;
        try {
            this.server = HttpServer.create(listen.toSocketAddress(), 0);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to bind admin listener on " + listen, e);
        }
        this.executor = Executors.newFixedThreadPool(2);
        this.server.setExecutor(executor);
        this.server.createContext(SERVICES_PATH, new ServicesHandler());
        this.server.createContext("/v1/targets", new TargetsHandler());
        this.server.createContext("/v1/routes/reload", new ReloadHandler());
    }

    public void start() {
        server.start();
        log.info("Admin API listening on {}:{}", server.getAddress().getHostString(), server.getAddress().getPort());
    }

    public InetSocketAddress boundAddress() {
        return server.getAddress();
    }

    public void stop() {
        server.stop(0);
        executor.shutdownNow();
    }

    private abstract class BaseHandler implements HttpHandler {
        @Override
        public final void handle(HttpExchange exchange) throws IOException {
            try {
                if (!authorized(exchange)) {
                    writeResponse(exchange, 401, AdminResponse.error("unauthorized"));
                    return;
                }
                byte[] body = readBodyBytes(exchange);
                handleAuthorized(exchange, body);
            } catch (RequestTooLargeException e) {
                writeResponse(exchange, 413, AdminResponse.error("request too large"));
            } catch (IllegalArgumentException e) {
                writeResponse(exchange, 400, AdminResponse.error(e.getMessage()));
            } catch (ConfigException e) {
                log.warn("Route reload rejected: {}", e.getMessage());
                writeResponse(exchange, 422, AdminResponse.error(e.getMessage()));
            } catch (Exception e) {
                log.error("Admin request {} {} failed", exchange.getRequestMethod(), exchange.getRequestURI(), e);
                writeResponse(exchange, 500, AdminResponse.error("internal error"));
            } finally {
                exchange.close();
            }
        }

        protected abstract void handleAuthorized(HttpExchange exchange, byte[] body) throws IOException;

        protected <T> T readJson(byte[] payload, Class<T> type) throws IOException {
            if (payload == null || payload.length == 0) {
                throw new IllegalArgumentException("request body required");
            }
            try {
                return MAPPER.readValue(payload, type);
            } catch (JsonProcessingException e) {
                throw new IllegalArgumentException("invalid json");
            }
        }

        protected byte[] readBodyBytes(HttpExchange exchange) throws IOException {
            try (InputStream input = exchange.getRequestBody()) {
                if (input == null) {
                    return new byte[0];
                }
                ByteArrayOutputStream output = new ByteArrayOutputStream();
                byte[] buffer = new byte[4096];
                int total = 0;
                int read;
                while ((read = input.read(buffer)) != -1) {
                    total += read;
                    if (total > maxRequestBytes) {
                        throw new RequestTooLargeException();
                    }
                    output.write(buffer, 0, read);
                }
                return output.toByteArray();
            }
        }
    }

    private final class ServicesHandler extends BaseHandler {
        @Override
        protected void handleAuthorized(HttpExchange exchange, byte[] body) throws IOException {
            String method = exchange.getRequestMethod();
            String path = exchange.getRequestURI().getPath();
            String id = serviceIdFromPath(path);
            if (id == null) {
                if ("GET".equalsIgnoreCase(method)) {
                    listServices(exchange);
                } else if ("POST".equalsIgnoreCase(method)) {
                    registerService(exchange, body);
                } else {
                    writeResponse(exchange, 405, AdminResponse.error("method not allowed"));
                }
                return;
            }
            if ("GET".equalsIgnoreCase(method)) {
                RegisteredService service = registry.get(id);
                if (service == null) {
                    writeResponse(exchange, 404, AdminResponse.error("service not found: " + id));
                    return;
                }
                writeResponse(exchange, 200, AdminResponse.ok("ok", toView(service)));
            } else if ("DELETE".equalsIgnoreCase(method)) {
                if (!registry.unregister(id)) {
                    writeResponse(exchange, 404, AdminResponse.error("service not found: " + id));
                    return;
                }
                Map<String, Object> data = new LinkedHashMap<>();
                data.put("id", id);
                writeResponse(exchange, 200, AdminResponse.ok("unregistered", data));
            } else {
                writeResponse(exchange, 405, AdminResponse.error("method not allowed"));
            }
        }

        private void listServices(HttpExchange exchange) throws IOException {
            List<Map<String, Object>> services = new ArrayList<>();
            for (RegisteredService service : registry.list()) {
                services.add(toView(service));
            }
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("count", services.size());
            data.put("services", services);
            writeResponse(exchange, 200, AdminResponse.ok("ok", data));
        }

        private void registerService(HttpExchange exchange, byte[] body) throws IOException {
            AdminRequests.RegisterServiceRequest request = readJson(body, AdminRequests.RegisterServiceRequest.class);
            boolean created = registry.register(request.id, request.namespace);
            RegisteredService stored = registry.get(request.id.trim().toLowerCase());
            writeResponse(exchange, created ? 201 : 200,
                    AdminResponse.ok(created ? "registered" : "updated", toView(stored)));
        }
    }

    private final class TargetsHandler extends BaseHandler {
        @Override
        protected void handleAuthorized(HttpExchange exchange, byte[] body) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                writeResponse(exchange, 405, AdminResponse.error("method not allowed"));
                return;
            }
            Map<String, Map<String, Object>> targets = new TreeMap<>();
            if (healthTracker != null) {
                for (Map.Entry<String, CircuitState> entry : healthTracker.snapshot().entrySet()) {
                    targets.computeIfAbsent(entry.getKey(), key -> new LinkedHashMap<>())
                            .put("circuit", entry.getValue().name());
                }
            }
            if (pools != null) {
                for (Map.Entry<String, UpstreamPoolManager.PoolStats> entry : pools.stats().entrySet()) {
                    UpstreamPoolManager.PoolStats stats = entry.getValue();
                    Map<String, Object> view = targets.computeIfAbsent(entry.getKey(), key -> new LinkedHashMap<>());
                    view.put("open", stats.open());
                    view.put("inUse", stats.inUse());
                    view.put("idle", stats.idle());
                    view.put("pendingAcquires", stats.pendingAcquires());
                }
            }
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("targets", targets);
            writeResponse(exchange, 200, AdminResponse.ok("ok", data));
        }
    }

    private final class ReloadHandler extends BaseHandler {
        @Override
        protected void handleAuthorized(HttpExchange exchange, byte[] body) throws IOException {
            if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
                writeResponse(exchange, 405, AdminResponse.error("method not allowed"));
                return;
            }
            if (routeReloader == null) {
                writeResponse(exchange, 501, AdminResponse.error("route reload not configured"));
                return;
            }
            long version = routeReloader.reload();
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("version", version);
            writeResponse(exchange, 200, AdminResponse.ok("reloaded", data));
        }
    }

    static String serviceIdFromPath(String path) {
        if (path == null || path.length() <= SERVICES_PATH.length()) {
            return null;
        }
        String rest = path.substring(SERVICES_PATH.length());
        if (!rest.startsWith("/")) {
            throw new IllegalArgumentException("unknown path: " + path);
        }
        rest = rest.substring(1);
        if (rest.endsWith("/")) {
            rest = rest.substring(0, rest.length() - 1);
        }
        if (rest.isEmpty()) {
            return null;
        }
        if (rest.contains("/")) {
            throw new IllegalArgumentException("unknown path: " + path);
        }
        return rest.toLowerCase();
    }

    private boolean authorized(HttpExchange exchange) {
        if (token == null) {
            return true;
        }
        String header = exchange.getRequestHeaders().getFirst("Authorization");
        if (header == null || !header.startsWith("Bearer ")) {
            return false;
        }
        byte[] presented = header.substring("Bearer ".length()).trim().getBytes(StandardCharsets.UTF_8);
        return MessageDigest.isEqual(token, presented);
    }

    private static Map<String, Object> toView(RegisteredService service) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("id", service.id());
        view.put("namespace", service.namespace());
        view.put("registeredAt", service.registeredAt().toString());
        return view;
    }

    private void writeResponse(HttpExchange exchange, int status, AdminResponse response) throws IOException {
        byte[] payload = MAPPER.writeValueAsBytes(response);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, payload.length);
        try (OutputStream output = exchange.getResponseBody()) {
            output.write(payload);
        }
    }

    private static final class RequestTooLargeException extends RuntimeException {
    }
}
