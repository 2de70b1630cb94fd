package net.spookly.httpgate.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;

import net.spookly.httpgate.admission.AdmissionLimits;
import net.spookly.httpgate.health.CircuitSettings;
import net.spookly.httpgate.pool.PoolSettings;
import net.spookly.httpgate.registry.DevboxWatchSettings;
import org.junit.jupiter.api.Test;

class GatewaySettingsTest {
    @Test
    void fillsDefaultsForAbsentSections() {
        GatewaySettings settings = GatewaySettings.from(ConfigLoader.parse("""
                proxy:
                  listen:
                    host: 127.0.0.1
                    port: 8080
                routing:
                  routes:
                    - id: api
                      match:
                        pathPrefix: /
                      targets:
                        - host: 10.0.0.1
                          port: 80
                """));

        assertEquals(PoolSettings.defaults(), settings.pool());
        assertEquals(CircuitSettings.defaults(), settings.circuit());
        assertEquals(AdmissionLimits.globalDefaults(), settings.globalLimits());
        assertEquals(new AdmissionLimits(256, 128), settings.defaultRouteLimits());
        assertEquals(Duration.ofSeconds(10), settings.proxy().shutdownGrace());
        assertEquals(DevboxWatchSettings.defaults(), settings.devboxWatch());
    }

    @Test
    void readsDevboxWatchSection() {
        GatewaySettings settings = GatewaySettings.from(ConfigLoader.parse("""
                proxy:
                  listen:
                    host: 127.0.0.1
                    port: 8080
                routing:
                  serviceRegistry:
                    enabled: true
                    domainSuffix: devbox.test
                    kubernetes:
                      enabled: true
                      version: v1alpha1
                      uniqueIdPath: spec.network.uniqueID
                      restartBackoffMs: 250
                """));

        DevboxWatchSettings watch = settings.devboxWatch();
        assertTrue(watch.enabled());
        assertEquals(DevboxWatchSettings.DEFAULT_GROUP, watch.group());
        assertEquals("v1alpha1", watch.version());
        assertEquals(DevboxWatchSettings.DEFAULT_PLURAL, watch.plural());
        assertEquals("spec.network.uniqueID", watch.uniqueIdPath());
        assertEquals(Duration.ofMillis(250), watch.restartBackoff());
    }

    @Test
    void appliesConfiguredValues() {
        GatewaySettings settings = GatewaySettings.from(ConfigLoader.parse("""
                proxy:
                  listen:
                    host: 127.0.0.1
                    port: 8080
                  workerThreads: 3
                  maxReplayBytes: 1024
                  forwardedHeaders: false
                admission:
                  maxInFlight: 50
                  maxQueued: 5
                pool:
                  maxConnectionsPerTarget: 8
                  idleTimeoutMs: 1500
                health:
                  failureThreshold: 2
                  cooldownMs: 250
                  maxCooldownMs: 1000
                routing:
                  defaults:
                    maxConcurrency: 20
                    maxQueued: 2
                  routes:
                    - id: api
                      match:
                        pathPrefix: /
                      targets:
                        - host: 10.0.0.1
                          port: 80
                """));

        assertEquals(3, settings.proxy().workerThreads());
        assertEquals(1024L, settings.proxy().maxReplayBytes());
        assertFalse(settings.proxy().forwardedHeaders());
        assertEquals(new AdmissionLimits(50, 5), settings.globalLimits());
        assertEquals(8, settings.pool().maxConnections());
        assertEquals(Duration.ofMillis(1500), settings.pool().idleTimeout());
        assertEquals(PoolSettings.DEFAULT_MAX_PENDING_ACQUIRES, settings.pool().maxPendingAcquires());
        assertEquals(2, settings.circuit().failureThreshold());
        assertEquals(Duration.ofMillis(250), settings.circuit().cooldown());
        assertEquals(new AdmissionLimits(20, 2), settings.defaultRouteLimits());
    }
}
