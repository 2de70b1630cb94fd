package net.spookly.httpgate.health;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Set;

import net.spookly.httpgate.routing.UpstreamTarget;
import net.spookly.httpgate.util.MutableClock;
import org.junit.jupiter.api.Test;

class UpstreamHealthTrackerTest {
    private final MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
    private final UpstreamHealthTracker tracker = new UpstreamHealthTracker(
            new CircuitSettings(2, Duration.ofSeconds(10), Duration.ofSeconds(1), Duration.ofSeconds(4), 2.0D),
            clock,
            CircuitStateListener.NOOP);

    @Test
    void unknownTargetIsClosedAndRoutable() {
        UpstreamTarget target = UpstreamTarget.of("10.0.0.1", 80);
        assertEquals(CircuitState.CLOSED, tracker.state(target));
        assertTrue(tracker.isRoutable(target));
    }

    @Test
    void tracksTargetsIndependently() {
        UpstreamTarget bad = UpstreamTarget.of("10.0.0.1", 80);
        UpstreamTarget good = UpstreamTarget.of("10.0.0.2", 80);

        tracker.recordFailure(tracker.tryAcquire(bad));
        tracker.recordFailure(tracker.tryAcquire(bad));
        tracker.recordSuccess(tracker.tryAcquire(good));

        assertFalse(tracker.isRoutable(bad));
        assertTrue(tracker.isRoutable(good));
        Map<String, CircuitState> snapshot = tracker.snapshot();
        assertEquals(CircuitState.OPEN, snapshot.get("10.0.0.1:80"));
        assertEquals(CircuitState.CLOSED, snapshot.get("10.0.0.2:80"));
    }

    @Test
    void evictDropsBreakersOfTargetsNoLongerReachable() {
        UpstreamTarget removed = UpstreamTarget.of("10.0.0.1", 80);
        UpstreamTarget kept = UpstreamTarget.of("10.0.0.2", 80);
        tracker.recordFailure(tracker.tryAcquire(removed));
        tracker.recordFailure(tracker.tryAcquire(removed));
        tracker.recordFailure(tracker.tryAcquire(kept));

        int evicted = tracker.evict(Set.of(kept.key())::contains);

        assertEquals(1, evicted);
        assertEquals(Set.of("10.0.0.2:80"), tracker.snapshot().keySet());
        assertEquals(CircuitState.CLOSED, tracker.state(removed));
        assertTrue(tracker.isRoutable(removed));
    }

    @Test
    void evictKeepsLiveBreakersThatRememberFailures() {
        UpstreamTarget failing = UpstreamTarget.of("10.0.0.1", 80);
        UpstreamTarget healthy = UpstreamTarget.of("10.0.0.2", 80);
        tracker.recordFailure(tracker.tryAcquire(failing));
        tracker.recordSuccess(tracker.tryAcquire(healthy));

        assertEquals(1, tracker.evict(key -> true));

        assertEquals(Set.of("10.0.0.1:80"), tracker.snapshot().keySet());
    }

    @Test
    void evictForgetsFailuresOutsideTheWindow() {
        UpstreamTarget target = UpstreamTarget.of("10.0.0.1", 80);
        tracker.recordFailure(tracker.tryAcquire(target));

        clock.advance(Duration.ofSeconds(11));

        assertEquals(1, tracker.evict(key -> true));
        assertTrue(tracker.snapshot().isEmpty());
    }

    @Test
    void targetsWithSameAddressShareOneCircuit() {
        UpstreamTarget first = new UpstreamTarget("a", "10.0.0.1", 80, 1);
        UpstreamTarget second = new UpstreamTarget("b", "10.0.0.1", 80, 1);

        tracker.recordFailure(tracker.tryAcquire(first));
        tracker.recordFailure(tracker.tryAcquire(second));

        assertEquals(CircuitState.OPEN, tracker.state(first));
    }

    @Test
    void bypassPermitIsIgnored() {
        UpstreamTarget target = UpstreamTarget.of("10.0.0.1", 80);
        tracker.recordFailure(tracker.bypass(target));
        tracker.recordFailure(tracker.bypass(target));

        assertEquals(CircuitState.CLOSED, tracker.state(target));
    }
}
