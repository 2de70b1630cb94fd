package net.spookly.httpgate.config;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

class ConfigValidatorTest {
    private static HttpgateConfig minimal() {
        HttpgateConfig config = new HttpgateConfig();
        config.proxy = new HttpgateConfig.ProxyConfig();
        config.proxy.listen = new HttpgateConfig.ListenConfig();
        config.proxy.listen.host = "0.0.0.0";
        config.proxy.listen.port = 8080;
        config.routing = new HttpgateConfig.RoutingConfig();
        config.routing.routes = List.of(route("api", "/api", 9000));
        return config;
    }

    private static HttpgateConfig.RouteConfig route(String id, String prefix, int port) {
        HttpgateConfig.RouteConfig route = new HttpgateConfig.RouteConfig();
        route.id = id;
        route.match = new HttpgateConfig.MatchConfig();
        route.match.pathPrefix = prefix;
        HttpgateConfig.TargetConfig target = new HttpgateConfig.TargetConfig();
        target.host = "10.0.0.1";
        target.port = port;
        route.targets = List.of(target);
        return route;
    }

    private static String errorsOf(HttpgateConfig config) {
        return assertThrows(ConfigException.class, () -> ConfigValidator.validate(config)).getMessage();
    }

    @Test
    void acceptsMinimalConfig() {
        assertDoesNotThrow(() -> ConfigValidator.validate(minimal()));
    }

    @Test
    void acceptsEphemeralListenPort() {
        HttpgateConfig config = minimal();
        config.proxy.listen.port = 0;

        assertDoesNotThrow(() -> ConfigValidator.validate(config));
    }

    @Test
    void reportsEveryViolationAtOnce() {
        HttpgateConfig config = minimal();
        config.proxy.listen.port = 70000;
        config.pool = new HttpgateConfig.PoolConfig();
        config.pool.maxConnectionsPerTarget = 0;
        config.health = new HttpgateConfig.HealthConfig();
        config.health.backoffMultiplier = 0.5D;

        String message = errorsOf(config);

        assertTrue(message.contains("proxy.listen.port"), message);
        assertTrue(message.contains("pool.maxConnectionsPerTarget"), message);
        assertTrue(message.contains("health.backoffMultiplier"), message);
    }

    @Test
    void rejectsDuplicateRouteIds() {
        HttpgateConfig config = minimal();
        config.routing.routes = List.of(route("api", "/a", 9000), route("api", "/b", 9001));

        assertTrue(errorsOf(config).contains("route id must be unique: api"));
    }

    @Test
    void rejectsBadRouteShapes() {
        HttpgateConfig config = minimal();
        HttpgateConfig.RouteConfig route = route("api", "api", 0);
        route.match.host = "api.*.example.com";
        route.policy = "random";
        route.retries = -1;
        config.routing.routes = List.of(route);

        String message = errorsOf(config);

        assertTrue(message.contains("pathPrefix must start with /"), message);
        assertTrue(message.contains("wildcard"), message);
        assertTrue(message.contains(".policy must be"), message);
        assertTrue(message.contains(".retries must be >= 0"), message);
        assertTrue(message.contains(".targets.port"), message);
    }

    @Test
    void requiresRoutesUnlessRegistryEnabled() {
        HttpgateConfig config = minimal();
        config.routing.routes = List.of();
        assertTrue(errorsOf(config).contains("routing.routes must include at least one route"));

        config.routing.serviceRegistry = new HttpgateConfig.ServiceRegistryConfig();
        config.routing.serviceRegistry.enabled = true;
        config.routing.serviceRegistry.domainSuffix = "devbox.test";
        assertDoesNotThrow(() -> ConfigValidator.validate(config));
    }

    @Test
    void validatesRegistrySection() {
        HttpgateConfig config = minimal();
        config.routing.serviceRegistry = new HttpgateConfig.ServiceRegistryConfig();
        config.routing.serviceRegistry.enabled = true;
        config.routing.serviceRegistry.backendHostTemplate = "{namespace}.svc";
        HttpgateConfig.ServiceEntryConfig service = new HttpgateConfig.ServiceEntryConfig();
        service.id = "shop";
        config.routing.serviceRegistry.services = List.of(service);

        String message = errorsOf(config);

        assertTrue(message.contains("routing.serviceRegistry.domainSuffix is required"), message);
        assertTrue(message.contains("must contain {id}"), message);
        assertTrue(message.contains("services.namespace is required"), message);
    }

    @Test
    void kubernetesWatchRequiresEnabledRegistry() {
        HttpgateConfig config = minimal();
        config.routing.serviceRegistry = new HttpgateConfig.ServiceRegistryConfig();
        config.routing.serviceRegistry.kubernetes = new HttpgateConfig.KubernetesWatchConfig();
        config.routing.serviceRegistry.kubernetes.enabled = true;
        config.routing.serviceRegistry.kubernetes.uniqueIdPath = "status..uniqueID";
        config.routing.serviceRegistry.kubernetes.restartBackoffMs = -1;

        String message = errorsOf(config);

        assertTrue(message.contains("kubernetes requires routing.serviceRegistry.enabled"), message);
        assertTrue(message.contains("uniqueIdPath must be a dot-separated field path"), message);
        assertTrue(message.contains("restartBackoffMs"), message);

        config.routing.serviceRegistry.enabled = true;
        config.routing.serviceRegistry.domainSuffix = "devbox.test";
        config.routing.serviceRegistry.kubernetes.uniqueIdPath = "status.network.uniqueID";
        config.routing.serviceRegistry.kubernetes.restartBackoffMs = 5000;
        assertDoesNotThrow(() -> ConfigValidator.validate(config));
    }

    @Test
    void validatesAdminListenerOnlyWhenEnabled() {
        HttpgateConfig config = minimal();
        config.admin = new HttpgateConfig.AdminConfig();
        config.admin.listen = "not-an-address";
        assertDoesNotThrow(() -> ConfigValidator.validate(config));

        config.admin.enabled = true;
        assertTrue(errorsOf(config).contains("admin.listen is invalid"));
    }
}
