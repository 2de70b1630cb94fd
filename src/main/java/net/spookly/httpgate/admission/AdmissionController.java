package net.spookly.httpgate.admission;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import io.netty.util.concurrent.EventExecutor;
import io.netty.util.concurrent.Future;
import net.spookly.httpgate.util.Deadline;

/**
 * Bounds concurrent in-flight requests globally and per route.
 */
public final class AdmissionController {
    private final AdmissionLimiter global;
    private final AdmissionLimits defaultRouteLimits;
    private final EventExecutor timer;
    private final ConcurrentMap<String, AdmissionLimiter> routeLimiters = new ConcurrentHashMap<>();

    public AdmissionController(AdmissionLimits globalLimits, AdmissionLimits defaultRouteLimits, EventExecutor timer) {
        this.timer = Objects.requireNonNull(timer, "timer");
        this.global = new AdmissionLimiter(AdmissionScope.global(), globalLimits, timer);
        this.defaultRouteLimits = Objects.requireNonNull(defaultRouteLimits, "defaultRouteLimits");
    }

    /**
     * Acquire one slot in {@code scope}, waiting no later than {@code deadline}. Fails with
     * {@link net.spookly.httpgate.GatewayFailure#REJECTED} when the scope is saturated.
     */
    public Future<AdmissionSlot> acquire(AdmissionScope scope, Deadline deadline) {
        return limiter(scope).acquire(deadline);
    }

    public int inUse(AdmissionScope scope) {
        if (scope.isGlobal()) {
            return global.inUse();
        }
        AdmissionLimiter limiter = routeLimiters.get(scope.key());
        return limiter == null ? 0 : limiter.inUse();
    }

    public int queued(AdmissionScope scope) {
        if (scope.isGlobal()) {
            return global.queued();
        }
        AdmissionLimiter limiter = routeLimiters.get(scope.key());
        return limiter == null ? 0 : limiter.queued();
    }

    /**
     * In-use counts of every scope seen so far.
     */
    public Map<String, Integer> snapshot() {
        Map<String, Integer> counts = new TreeMap<>();
        counts.put(global.scope().key(), global.inUse());
        for (Map.Entry<String, AdmissionLimiter> entry : routeLimiters.entrySet()) {
            counts.put(entry.getKey(), entry.getValue().inUse());
        }
        return Collections.unmodifiableMap(counts);
    }

    private AdmissionLimiter limiter(AdmissionScope scope) {
        Objects.requireNonNull(scope, "scope");
        if (scope.isGlobal()) {
            return global;
        }
        AdmissionLimits limits = scope.limits() == null ? defaultRouteLimits : scope.limits();
        AdmissionLimiter limiter = routeLimiters.computeIfAbsent(scope.key(),
                key -> new AdmissionLimiter(scope, limits, timer));
        limiter.updateLimits(limits);
        return limiter;
    }
}
