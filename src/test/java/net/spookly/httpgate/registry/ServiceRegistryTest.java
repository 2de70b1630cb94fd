package net.spookly.httpgate.registry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import net.spookly.httpgate.config.ConfigLoader;
import net.spookly.httpgate.util.MutableClock;
import org.junit.jupiter.api.Test;

class ServiceRegistryTest {
    @Test
    void registerReportsWhetherServiceIsNew() {
        MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        ServiceRegistry registry = new ServiceRegistry(null, clock);

        assertTrue(registry.register("shop", "retail"));
        clock.advance(Duration.ofMinutes(1));
        assertFalse(registry.register("shop", "retail-v2"));

        RegisteredService stored = registry.get("shop");
        assertEquals("retail-v2", stored.namespace());
        assertEquals(Instant.parse("2024-01-01T00:01:00Z"), stored.registeredAt());
        assertEquals(1, registry.size());
    }

    @Test
    void normalizesServiceIds() {
        ServiceRegistry registry = new ServiceRegistry();

        registry.register("  Shop-Front ", " retail ");

        RegisteredService stored = registry.get("shop-front");
        assertNotNull(stored);
        assertEquals("retail", stored.namespace());
        assertTrue(registry.unregister("SHOP-FRONT"));
    }

    @Test
    void rejectsInvalidIdsAndMissingNamespace() {
        ServiceRegistry registry = new ServiceRegistry();

        assertThrows(IllegalArgumentException.class, () -> registry.register("-shop", "retail"));
        assertThrows(IllegalArgumentException.class, () -> registry.register("shop-", "retail"));
        assertThrows(IllegalArgumentException.class, () -> registry.register("shop.front", "retail"));
        assertThrows(IllegalArgumentException.class, () -> registry.register(" ", "retail"));
        assertThrows(IllegalArgumentException.class, () -> registry.register("shop", null));
        assertTrue(registry.isEmpty());
    }

    @Test
    void unregisterAndClear() {
        ServiceRegistry registry = new ServiceRegistry();
        registry.register("a", "ns");
        registry.register("b", "ns");

        assertTrue(registry.unregister("a"));
        assertFalse(registry.unregister("a"));
        assertFalse(registry.unregister(null));
        assertNull(registry.get("a"));

        registry.clear();
        assertTrue(registry.isEmpty());
    }

    @Test
    void listsServicesSortedById() {
        ServiceRegistry registry = new ServiceRegistry();
        registry.register("charlie", "ns");
        registry.register("alpha", "ns");
        registry.register("bravo", "ns");

        List<String> ids = new ArrayList<>();
        for (RegisteredService service : registry.list()) {
            ids.add(service.id());
        }

        assertEquals(List.of("alpha", "bravo", "charlie"), ids);
    }

    @Test
    void emitsEventForEveryChange() {
        List<RegistryEvent> events = new CopyOnWriteArrayList<>();
        ServiceRegistry registry = new ServiceRegistry(events::add, null);

        registry.register("shop", "retail");
        registry.register("shop", "retail");
        registry.unregister("shop");
        registry.unregister("shop");
        registry.clear();

        assertEquals(4, events.size());
        assertEquals(RegistryEventType.REGISTER, events.get(0).type());
        assertEquals(1, events.get(0).size());
        assertEquals(RegistryEventType.UPDATE, events.get(1).type());
        assertEquals(RegistryEventType.UNREGISTER, events.get(2).type());
        assertEquals("shop", events.get(2).serviceId());
        assertEquals(0, events.get(2).size());
        assertEquals(RegistryEventType.CLEAR, events.get(3).type());
        assertNull(events.get(3).serviceId());
    }

    @Test
    void seedsFromConfiguration() {
        ServiceRegistry registry = ServiceRegistry.fromConfig(ConfigLoader.parse("""
                proxy:
                  listen:
                    host: 127.0.0.1
                    port: 8080
                routing:
                  serviceRegistry:
                    enabled: true
                    domainSuffix: devbox.test
                    services:
                      - id: outdoor-before-78648
                        namespace: ns-admin
                      - id: shop
                        namespace: retail
                """), null);

        assertEquals(2, registry.size());
        assertEquals("ns-admin", registry.get("outdoor-before-78648").namespace());
    }

    @Test
    void concurrentWritersAllLand() throws Exception {
        ServiceRegistry registry = new ServiceRegistry();
        int writers = 100;
        ExecutorService executor = Executors.newFixedThreadPool(16);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < writers; i++) {
                String id = "service-" + i;
                futures.add(executor.submit(() -> {
                    start.await();
                    registry.register(id, "ns");
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(writers, registry.size());
        assertEquals(writers, registry.list().size());
    }

    @Test
    void readersSeeConsistentEntriesDuringWrites() throws Exception {
        ServiceRegistry registry = new ServiceRegistry();
        for (int i = 0; i < 50; i++) {
            registry.register("seed-" + i, "ns");
        }
        ExecutorService executor = Executors.newFixedThreadPool(8);
        List<Throwable> failures = new CopyOnWriteArrayList<>();
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int w = 0; w < 4; w++) {
                int writer = w;
                futures.add(executor.submit(() -> {
                    for (int i = 0; i < 200; i++) {
                        registry.register("writer-" + writer + "-" + i, "ns");
                        if (i % 2 == 0) {
                            registry.unregister("writer-" + writer + "-" + i);
                        }
                    }
                }));
            }
            for (int r = 0; r < 4; r++) {
                futures.add(executor.submit(() -> {
                    for (int i = 0; i < 500; i++) {
                        RegisteredService seed = registry.get("seed-" + (i % 50));
                        if (seed == null || !"ns".equals(seed.namespace())) {
                            failures.add(new AssertionError("seed entry missing"));
                        }
                        registry.list();
                    }
                }));
            }
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertTrue(failures.isEmpty(), failures.toString());
        assertEquals(50 + 4 * 100, registry.size());
    }
}
