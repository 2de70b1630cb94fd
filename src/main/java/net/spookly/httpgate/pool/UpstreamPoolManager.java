package net.spookly.httpgate.pool;

import java.time.Clock;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Predicate;

import io.netty.util.concurrent.EventExecutor;
import io.netty.util.concurrent.Future;
import lombok.extern.slf4j.Slf4j;
import net.spookly.httpgate.routing.UpstreamTarget;
import net.spookly.httpgate.util.Deadline;

/**
 * Owns one connection pool per upstream target, created on first use and dropped by
 * {@link #evictUnused(Predicate)} once nothing uses it.
 */
@Slf4j
public final class UpstreamPoolManager implements AutoCloseable {
    private final PoolSettings settings;
    private final UpstreamConnector connector;
    private final EventExecutor timer;
    private final Clock clock;
    private final ConcurrentMap<String, UpstreamConnectionPool> pools = new ConcurrentHashMap<>();
    private volatile boolean closed;

    public UpstreamPoolManager(PoolSettings settings, UpstreamConnector connector, EventExecutor timer, Clock clock) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.connector = Objects.requireNonNull(connector, "connector");
        this.timer = Objects.requireNonNull(timer, "timer");
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public PoolSettings settings() {
        return settings;
    }

    /**
     * Check out a connection to {@code target}, completing no later than {@code deadline}.
     */
    public Future<PooledConnection> acquire(UpstreamTarget target, Deadline deadline) {
        while (true) {
            UpstreamConnectionPool pool = pool(target);
            Future<PooledConnection> future = pool.tryAcquire(deadline);
            if (future != null) {
                return future;
            }
            // retired between lookup and acquire
            pools.remove(target.key(), pool);
        }
    }

    public void release(PooledConnection connection, ReleaseOutcome outcome) {
        if (connection != null) {
            connection.release(outcome == null ? ReleaseOutcome.BROKEN : outcome);
        }
    }

    public int inUse(UpstreamTarget target) {
        UpstreamConnectionPool pool = pools.get(target.key());
        return pool == null ? 0 : pool.inUse();
    }

    public int idleCount(UpstreamTarget target) {
        UpstreamConnectionPool pool = pools.get(target.key());
        return pool == null ? 0 : pool.idleCount();
    }

    /**
     * Per-target counters keyed by {@code host:port}.
     */
    public Map<String, PoolStats> stats() {
        Map<String, PoolStats> stats = new TreeMap<>();
        for (Map.Entry<String, UpstreamConnectionPool> entry : pools.entrySet()) {
            UpstreamConnectionPool pool = entry.getValue();
            stats.put(entry.getKey(), new PoolStats(pool.openCount(), pool.inUse(), pool.idleCount(),
                    pool.pendingAcquires()));
        }
        return Collections.unmodifiableMap(stats);
    }

    /**
     * Drop pools nothing is using. Pools of targets {@code live} rejects are closed along with their idle
     * connections; pools of live targets only go once their idle connections have expired.
     *
     * @param live tests a target key ({@code host:port}) for a route or service that can still reach it
     * @return number of pools removed
     */
    public int evictUnused(Predicate<String> live) {
        Objects.requireNonNull(live, "live");
        int evicted = 0;
        for (Map.Entry<String, UpstreamConnectionPool> entry : pools.entrySet()) {
            UpstreamConnectionPool pool = entry.getValue();
            if (pool.retireIfUnused(live.test(entry.getKey())) && pools.remove(entry.getKey(), pool)) {
                evicted++;
            }
        }
        if (evicted > 0) {
            log.debug("Evicted {} unused upstream pools, {} remain", evicted, pools.size());
        }
        return evicted;
    }

    @Override
    public void close() {
        closed = true;
        for (UpstreamConnectionPool pool : pools.values()) {
            pool.close();
        }
        log.info("Closed {} upstream pools", pools.size());
    }

    private UpstreamConnectionPool pool(UpstreamTarget target) {
        Objects.requireNonNull(target, "target");
        UpstreamConnectionPool pool = pools.computeIfAbsent(target.key(),
                key -> new UpstreamConnectionPool(target, settings, connector, timer, clock));
        if (closed) {
            pool.close();
        }
        return pool;
    }

    /**
     * Snapshot of one pool's counters.
     */
    public record PoolStats(int open, int inUse, int idle, int pendingAcquires) {
    }
}
