package net.spookly.httpgate.health;

import java.time.Clock;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Predicate;

import net.spookly.httpgate.routing.UpstreamTarget;

/**
 * Owns the circuit breaker of every upstream target. The only component that changes target health.
 */
public final class UpstreamHealthTracker {
    private final CircuitSettings settings;
    private final Clock clock;
    private final CircuitStateListener listener;
    private final ConcurrentMap<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();

    public UpstreamHealthTracker(CircuitSettings settings, Clock clock, CircuitStateListener listener) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.listener = listener == null ? CircuitStateListener.NOOP : listener;
    }

    public UpstreamHealthTracker(CircuitSettings settings) {
        this(settings, Clock.systemUTC(), CircuitLogListener.INSTANCE);
    }

    public CircuitState state(UpstreamTarget target) {
        CircuitBreaker breaker = breakers.get(target.key());
        return breaker == null ? CircuitState.CLOSED : breaker.state();
    }

    /**
     * True when the target may be offered to routing: closed, or half-open with the trial unclaimed.
     */
    public boolean isRoutable(UpstreamTarget target) {
        CircuitBreaker breaker = breakers.get(target.key());
        return breaker == null || breaker.isRoutable();
    }

    /**
     * Claim a permit for one request, or {@code null} when the circuit refuses traffic.
     */
    public HealthPermit tryAcquire(UpstreamTarget target) {
        return breaker(target).tryAcquire();
    }

    /**
     * Permit for a forced attempt made while every candidate is unavailable.
     */
    public HealthPermit bypass(UpstreamTarget target) {
        return breaker(target).bypass();
    }

    public void recordSuccess(HealthPermit permit) {
        CircuitBreaker breaker = lookup(permit);
        if (breaker != null) {
            breaker.onSuccess(permit);
        }
    }

    public void recordFailure(HealthPermit permit) {
        CircuitBreaker breaker = lookup(permit);
        if (breaker != null) {
            breaker.onFailure(permit);
        }
    }

    /**
     * Return a permit whose request never reached the upstream (rejected, cancelled, pool exhausted).
     */
    public void release(HealthPermit permit) {
        CircuitBreaker breaker = lookup(permit);
        if (breaker != null) {
            breaker.release(permit);
        }
    }

    /**
     * Current state of every target seen so far, keyed by {@code host:port}.
     */
    public Map<String, CircuitState> snapshot() {
        Map<String, CircuitState> states = new TreeMap<>();
        for (Map.Entry<String, CircuitBreaker> entry : breakers.entrySet()) {
            states.put(entry.getKey(), entry.getValue().state());
        }
        return Collections.unmodifiableMap(states);
    }

    /**
     * Forget breakers of targets {@code live} rejects, and breakers of live targets that are at rest.
     * A forgotten target starts over with a fresh closed circuit.
     *
     * @param live tests a target key ({@code host:port}) for a route or service that can still reach it
     * @return number of breakers removed
     */
    public int evict(Predicate<String> live) {
        Objects.requireNonNull(live, "live");
        int evicted = 0;
        for (Map.Entry<String, CircuitBreaker> entry : breakers.entrySet()) {
            CircuitBreaker breaker = entry.getValue();
            if ((!live.test(entry.getKey()) || breaker.isAtRest()) && breakers.remove(entry.getKey(), breaker)) {
                evicted++;
            }
        }
        return evicted;
    }

    private CircuitBreaker breaker(UpstreamTarget target) {
        Objects.requireNonNull(target, "target");
        return breakers.computeIfAbsent(target.key(), key -> new CircuitBreaker(key, settings, clock, listener));
    }

    private CircuitBreaker lookup(HealthPermit permit) {
        if (permit == null || permit.kind() == HealthPermit.Kind.BYPASS) {
            return null;
        }
        return breakers.get(permit.targetKey());
    }
}
