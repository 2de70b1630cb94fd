package net.spookly.httpgate.registry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import net.spookly.httpgate.config.ConfigException;
import net.spookly.httpgate.health.CircuitSettings;
import net.spookly.httpgate.health.UpstreamHealthTracker;
import net.spookly.httpgate.routing.UpstreamTarget;
import net.spookly.httpgate.util.ListenAddress;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class AdminServerTest {
    private static final String TOKEN = "admin-secret";
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final HttpClient client = HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_1_1)
            .connectTimeout(Duration.ofSeconds(5))
            .build();
    private final ServiceRegistry registry = new ServiceRegistry();
    private AdminServer server;

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop();
        }
    }

    private void start(UpstreamHealthTracker tracker, RouteReloader reloader) {
        server = new AdminServer(ListenAddress.ephemeral("127.0.0.1"), TOKEN, 256, registry, tracker, null, reloader);
        server.start();
    }

    private HttpRequest.Builder request(String path) {
        return HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + server.boundAddress().getPort() + path))
                .timeout(Duration.ofSeconds(5))
                .header("Authorization", "Bearer " + TOKEN);
    }

    private HttpResponse<String> send(HttpRequest request) throws IOException, InterruptedException {
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private static JsonNode json(HttpResponse<String> response) throws IOException {
        return MAPPER.readTree(response.body());
    }

    private static HttpRequest.BodyPublisher body(String json) {
        return HttpRequest.BodyPublishers.ofString(json);
    }

    @Test
    void registersListsAndUnregistersServices() throws Exception {
        start(null, null);

        HttpResponse<String> created = send(request("/v1/services")
                .POST(body("{\"id\":\"Shop\",\"namespace\":\"retail\"}")).build());
        assertEquals(201, created.statusCode());
        JsonNode createdBody = json(created);
        assertTrue(createdBody.get("ok").asBoolean());
        assertEquals("registered", createdBody.get("message").asText());
        assertEquals("shop", createdBody.get("data").get("id").asText());

        HttpResponse<String> updated = send(request("/v1/services")
                .POST(body("{\"id\":\"shop\",\"namespace\":\"retail-v2\"}")).build());
        assertEquals(200, updated.statusCode());
        assertEquals("updated", json(updated).get("message").asText());

        HttpResponse<String> listed = send(request("/v1/services").GET().build());
        JsonNode data = json(listed).get("data");
        assertEquals(1, data.get("count").asInt());
        assertEquals("retail-v2", data.get("services").get(0).get("namespace").asText());

        HttpResponse<String> fetched = send(request("/v1/services/shop").GET().build());
        assertEquals(200, fetched.statusCode());

        HttpResponse<String> deleted = send(request("/v1/services/shop").DELETE().build());
        assertEquals(200, deleted.statusCode());
        assertEquals("unregistered", json(deleted).get("message").asText());
        assertTrue(registry.isEmpty());

        assertEquals(404, send(request("/v1/services/shop").GET().build()).statusCode());
        assertEquals(404, send(request("/v1/services/shop").DELETE().build()).statusCode());
    }

    @Test
    void rejectsMissingOrWrongToken() throws Exception {
        start(null, null);
        URI uri = URI.create("http://127.0.0.1:" + server.boundAddress().getPort() + "/v1/services");

        HttpResponse<String> missing = send(HttpRequest.newBuilder(uri).GET().build());
        HttpResponse<String> wrong = send(HttpRequest.newBuilder(uri).header("Authorization", "Bearer nope").GET().build());

        assertEquals(401, missing.statusCode());
        assertEquals(401, wrong.statusCode());
        assertFalse(json(wrong).get("ok").asBoolean());
    }

    @Test
    void mapsBadInputToClientErrors() throws Exception {
        start(null, null);

        assertEquals(400, send(request("/v1/services").POST(body("{not json")).build()).statusCode());
        assertEquals(400, send(request("/v1/services").POST(body("{\"id\":\"-bad\",\"namespace\":\"ns\"}")).build()).statusCode());
        assertEquals(400, send(request("/v1/services").POST(body("{\"id\":\"shop\"}")).build()).statusCode());
        assertEquals(400, send(request("/v1/services").POST(body("{\"id\":\"shop\",\"ns\":\"x\"}")).build()).statusCode());
        assertEquals(400, send(request("/v1/services/a/b").GET().build()).statusCode());
        assertEquals(405, send(request("/v1/services").PUT(body("{}")).build()).statusCode());
        String large = "{\"id\":\"shop\",\"namespace\":\"" + "x".repeat(512) + "\"}";
        assertEquals(413, send(request("/v1/services").POST(body(large)).build()).statusCode());
        assertTrue(registry.isEmpty());
    }

    @Test
    void reportsTargetCircuitStates() throws Exception {
        UpstreamHealthTracker tracker = new UpstreamHealthTracker(CircuitSettings.defaults());
        UpstreamTarget target = UpstreamTarget.of("10.0.0.1", 8080);
        tracker.recordFailure(tracker.tryAcquire(target));
        start(tracker, null);

        HttpResponse<String> response = send(request("/v1/targets").GET().build());

        assertEquals(200, response.statusCode());
        JsonNode targets = json(response).get("data").get("targets");
        assertEquals("CLOSED", targets.get("10.0.0.1:8080").get("circuit").asText());
    }

    @Test
    void reloadsRoutesThroughReloader() throws Exception {
        AtomicLong versions = new AtomicLong(1);
        start(null, versions::incrementAndGet);

        HttpResponse<String> response = send(request("/v1/routes/reload").POST(body("")).build());

        assertEquals(200, response.statusCode());
        assertEquals(2, json(response).get("data").get("version").asLong());
        assertEquals(405, send(request("/v1/routes/reload").GET().build()).statusCode());
    }

    @Test
    void reportsRejectedReload() throws Exception {
        start(null, () -> {
            throw new ConfigException("routing section is required");
        });

        HttpResponse<String> response = send(request("/v1/routes/reload").POST(body("")).build());

        assertEquals(422, response.statusCode());
        assertEquals("routing section is required", json(response).get("message").asText());
    }

    @Test
    void reloadWithoutReloaderIsNotImplemented() throws Exception {
        start(null, null);

        assertEquals(501, send(request("/v1/routes/reload").POST(body("")).build()).statusCode());
    }

    @Test
    void extractsServiceIdFromPath() {
        assertNull(AdminServer.serviceIdFromPath("/v1/services"));
        assertNull(AdminServer.serviceIdFromPath("/v1/services/"));
        assertEquals("shop", AdminServer.serviceIdFromPath("/v1/services/Shop"));
        assertEquals("shop", AdminServer.serviceIdFromPath("/v1/services/shop/"));
        assertThrows(IllegalArgumentException.class, () -> AdminServer.serviceIdFromPath("/v1/servicesx"));
        assertThrows(IllegalArgumentException.class, () -> AdminServer.serviceIdFromPath("/v1/services/a/b"));
    }
}
