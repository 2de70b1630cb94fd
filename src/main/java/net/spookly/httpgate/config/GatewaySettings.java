package net.spookly.httpgate.config;

import java.time.Duration;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.experimental.Accessors;
import net.spookly.httpgate.admission.AdmissionLimits;
import net.spookly.httpgate.health.CircuitSettings;
import net.spookly.httpgate.pool.PoolSettings;
import net.spookly.httpgate.proxy.ProxySettings;
import net.spookly.httpgate.registry.DevboxWatchSettings;
import net.spookly.httpgate.routing.RoutePolicy;
import net.spookly.httpgate.routing.RouteTableFactory;
import net.spookly.httpgate.util.ListenAddress;

/**
 * Typed component settings derived from a validated {@link HttpgateConfig}, with defaults for absent fields.
 */
@Getter
@Accessors(fluent = true)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class GatewaySettings {
    private final ProxySettings proxy;
    private final PoolSettings pool;
    private final CircuitSettings circuit;
    private final AdmissionLimits globalLimits;
    private final AdmissionLimits defaultRouteLimits;
    private final DevboxWatchSettings devboxWatch;

    public static GatewaySettings from(HttpgateConfig config) {
        HttpgateConfig.ServiceRegistryConfig registry = config.routing == null ? null : config.routing.serviceRegistry;
        return new GatewaySettings(
                proxySettings(config.proxy),
                poolSettings(config.pool),
                circuitSettings(config.health),
                globalLimits(config.admission),
                routeLimits(RouteTableFactory.defaultPolicy(config)),
                devboxWatchSettings(registry == null ? null : registry.kubernetes)
        );
    }

    static ProxySettings proxySettings(HttpgateConfig.ProxyConfig proxy) {
        ListenAddress listen = ListenAddress.of(proxy.listen.host, proxy.listen.port);
        ProxySettings defaults = ProxySettings.defaults(listen);
        return new ProxySettings(
                listen,
                valueOr(proxy.workerThreads, defaults.workerThreads()),
                proxy.maxReplayBytes == null ? defaults.maxReplayBytes() : proxy.maxReplayBytes.longValue(),
                valueOr(proxy.maxInitialLineLength, defaults.maxInitialLineLength()),
                valueOr(proxy.maxHeaderSize, defaults.maxHeaderSize()),
                proxy.forwardedHeaders == null ? defaults.forwardedHeaders() : proxy.forwardedHeaders,
                millisOr(proxy.shutdownGraceMs, defaults.shutdownGrace()),
                millisOr(proxy.idleClientTimeoutMs, defaults.idleClientTimeout())
        );
    }

    static PoolSettings poolSettings(HttpgateConfig.PoolConfig pool) {
        PoolSettings defaults = PoolSettings.defaults();
        if (pool == null) {
            return defaults;
        }
        return new PoolSettings(
                valueOr(pool.maxConnectionsPerTarget, defaults.maxConnections()),
                valueOr(pool.maxPendingAcquires, defaults.maxPendingAcquires()),
                millisOr(pool.idleTimeoutMs, defaults.idleTimeout()),
                millisOr(pool.connectTimeoutMs, defaults.connectTimeout())
        );
    }

    static CircuitSettings circuitSettings(HttpgateConfig.HealthConfig health) {
        CircuitSettings defaults = CircuitSettings.defaults();
        if (health == null) {
            return defaults;
        }
        return new CircuitSettings(
                valueOr(health.failureThreshold, defaults.failureThreshold()),
                millisOr(health.failureWindowMs, defaults.failureWindow()),
                millisOr(health.cooldownMs, defaults.cooldown()),
                millisOr(health.maxCooldownMs, defaults.maxCooldown()),
                health.backoffMultiplier == null ? defaults.backoffMultiplier() : health.backoffMultiplier
        );
    }

    static AdmissionLimits globalLimits(HttpgateConfig.AdmissionConfig admission) {
        AdmissionLimits defaults = AdmissionLimits.globalDefaults();
        if (admission == null) {
            return defaults;
        }
        return new AdmissionLimits(
                valueOr(admission.maxInFlight, defaults.maxConcurrent()),
                valueOr(admission.maxQueued, defaults.maxQueued())
        );
    }

    static DevboxWatchSettings devboxWatchSettings(HttpgateConfig.KubernetesWatchConfig kubernetes) {
        DevboxWatchSettings defaults = DevboxWatchSettings.defaults();
        if (kubernetes == null) {
            return defaults;
        }
        return new DevboxWatchSettings(
                Boolean.TRUE.equals(kubernetes.enabled),
                stringOr(kubernetes.group, defaults.group()),
                stringOr(kubernetes.version, defaults.version()),
                stringOr(kubernetes.plural, defaults.plural()),
                stringOr(kubernetes.uniqueIdPath, defaults.uniqueIdPath()),
                millisOr(kubernetes.restartBackoffMs, defaults.restartBackoff())
        );
    }

    static AdmissionLimits routeLimits(RoutePolicy policy) {
        return new AdmissionLimits(policy.maxConcurrency(), policy.maxQueued());
    }

    private static Duration millisOr(Integer millis, Duration fallback) {
        return millis == null ? fallback : Duration.ofMillis(millis);
    }

    private static String stringOr(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value.trim();
    }

    private static int valueOr(Integer value, int fallback) {
        return value == null ? fallback : value;
    }
}
