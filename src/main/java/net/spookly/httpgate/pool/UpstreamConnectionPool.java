package net.spookly.httpgate.pool;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

import io.netty.channel.Channel;
import io.netty.util.concurrent.EventExecutor;
import io.netty.util.concurrent.Future;
import io.netty.util.concurrent.Promise;
import io.netty.util.concurrent.ScheduledFuture;
import lombok.extern.slf4j.Slf4j;
import net.spookly.httpgate.GatewayException;
import net.spookly.httpgate.GatewayFailure;
import net.spookly.httpgate.routing.UpstreamTarget;
import net.spookly.httpgate.util.Deadline;

/**
 * Bounded set of reusable connections to a single upstream target.
 * <p>
 * Connections that are idle, checked out, or still connecting all count against {@code maxConnections}.
 * Callers beyond that cap queue in FIFO order until a connection is released or their deadline passes.
 * Promises are completed outside the pool lock.
 */
@Slf4j
public final class UpstreamConnectionPool {
    private final UpstreamTarget target;
    private final PoolSettings settings;
    private final UpstreamConnector connector;
    private final EventExecutor timer;
    private final Clock clock;

    private final Object lock = new Object();
    private final Deque<Entry> idle = new ArrayDeque<>();
    private final Deque<Waiter> waiters = new ArrayDeque<>();
    private int open;
    private int inUse;
    private boolean closed;
    private boolean retired;

    public UpstreamConnectionPool(UpstreamTarget target,
                                  PoolSettings settings,
                                  UpstreamConnector connector,
                                  EventExecutor timer,
                                  Clock clock) {
        this.target = Objects.requireNonNull(target, "target");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.connector = Objects.requireNonNull(connector, "connector");
        this.timer = Objects.requireNonNull(timer, "timer");
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public UpstreamTarget target() {
        return target;
    }

    /**
     * Check out a connection: the most recently used idle one, a new one while under the cap,
     * or the next one released before {@code deadline}.
     */
    public Future<PooledConnection> acquire(Deadline deadline) {
        Future<PooledConnection> future = tryAcquire(deadline);
        if (future == null) {
            return timer.newFailedFuture(new GatewayException(GatewayFailure.POOL_EXHAUSTED,
                    "pool for " + target.key() + " is closed"));
        }
        return future;
    }

    /**
     * Like {@link #acquire(Deadline)}, but returns {@code null} once the pool has been retired so the
     * caller can replace it with a fresh one.
     */
    Future<PooledConnection> tryAcquire(Deadline deadline) {
        Objects.requireNonNull(deadline, "deadline");
        Promise<PooledConnection> promise = timer.newPromise();
        List<Channel> expired = new ArrayList<>();
        Entry reusable = null;
        boolean connect = false;
        Waiter waiter = null;
        GatewayException rejection = null;
        synchronized (lock) {
            if (retired) {
                return null;
            } else if (closed) {
                rejection = new GatewayException(GatewayFailure.POOL_EXHAUSTED, "pool for " + target.key() + " is closed");
            } else {
                reapIdle(expired);
                reusable = idle.pollFirst();
                if (reusable != null) {
                    inUse++;
                } else if (open < settings.maxConnections()) {
                    open++;
                    inUse++;
                    connect = true;
                } else if (deadline.isExpired() || waiters.size() >= settings.maxPendingAcquires()) {
                    rejection = new GatewayException(GatewayFailure.POOL_EXHAUSTED,
                            "no connection available for " + target.key());
                } else {
                    waiter = new Waiter(promise, deadline);
                    waiters.addLast(waiter);
                }
            }
        }
        closeAll(expired);

        if (rejection != null) {
            promise.tryFailure(rejection);
        } else if (reusable != null) {
            PooledConnection lease = new PooledConnection(this, reusable, true);
            if (!promise.trySuccess(lease)) {
                release(lease, ReleaseOutcome.REUSABLE);
            }
        } else if (connect) {
            connect(promise, deadline);
        } else {
            armWaiter(waiter);
        }
        return promise;
    }

    /**
     * Return a lease. Reusable connections go to the oldest waiter, else back to the idle set.
     * Broken ones are closed and free capacity for a waiter. Repeat releases of a lease are ignored.
     */
    void release(PooledConnection lease, ReleaseOutcome outcome) {
        if (!lease.markReleased()) {
            return;
        }
        Entry entry = lease.entry();
        boolean reusable = outcome == ReleaseOutcome.REUSABLE && entry.channel.isActive();
        while (reusable) {
            Waiter waiter;
            synchronized (lock) {
                if (closed) {
                    break;
                }
                waiter = waiters.pollFirst();
                if (waiter == null) {
                    inUse--;
                    entry.lastUsedMillis = clock.millis();
                    idle.addFirst(entry);
                    return;
                }
            }
            waiter.disarm();
            if (waiter.promise.trySuccess(new PooledConnection(this, entry, true))) {
                return;
            }
        }
        synchronized (lock) {
            open--;
            inUse--;
        }
        entry.channel.close();
        dispatchFreedCapacity();
    }

    /**
     * Close idle connections and fail every waiter. Checked-out connections close when released.
     */
    public void close() {
        List<Channel> channels = new ArrayList<>();
        List<Waiter> pending;
        synchronized (lock) {
            if (closed) {
                return;
            }
            closed = true;
            for (Entry entry : idle) {
                channels.add(entry.channel);
            }
            open -= idle.size();
            idle.clear();
            pending = new ArrayList<>(waiters);
            waiters.clear();
        }
        closeAll(channels);
        for (Waiter waiter : pending) {
            waiter.disarm();
            waiter.promise.tryFailure(new GatewayException(GatewayFailure.POOL_EXHAUSTED,
                    "pool for " + target.key() + " is closed"));
        }
    }

    /**
     * Close the pool if nothing is checked out, connecting or waiting. With {@code requireEmpty} the pool
     * must also hold no idle connection that is still fresh. Expired idle connections are reaped either way.
     *
     * @return true when the pool was retired and must no longer be handed out
     */
    boolean retireIfUnused(boolean requireEmpty) {
        List<Channel> channels = new ArrayList<>();
        boolean retire;
        synchronized (lock) {
            if (closed) {
                return retired;
            }
            reapIdle(channels);
            retire = inUse == 0 && waiters.isEmpty() && (!requireEmpty || open == 0);
            if (retire) {
                closed = true;
                retired = true;
                for (Entry entry : idle) {
                    channels.add(entry.channel);
                }
                open -= idle.size();
                idle.clear();
            }
        }
        closeAll(channels);
        return retire;
    }

    public int inUse() {
        synchronized (lock) {
            return inUse;
        }
    }

    public int idleCount() {
        synchronized (lock) {
            return idle.size();
        }
    }

    public int openCount() {
        synchronized (lock) {
            return open;
        }
    }

    public int pendingAcquires() {
        synchronized (lock) {
            return waiters.size();
        }
    }

    private void connect(Promise<PooledConnection> promise, Deadline deadline) {
        long remainingNanos = deadline.remainingNanos();
        if (remainingNanos <= 0) {
            onConnectFailed(promise, new GatewayException(GatewayFailure.UPSTREAM_TIMEOUT,
                    "deadline passed before connecting to " + target.key()));
            return;
        }
        Duration connectTimeout = Duration.ofNanos(Math.min(remainingNanos, settings.connectTimeout().toNanos()));
        Future<Channel> connecting;
        try {
            connecting = connector.connect(target, connectTimeout);
        } catch (RuntimeException e) {
            onConnectFailed(promise, e);
            return;
        }
        connecting.addListener(future -> {
            if (!future.isSuccess()) {
                onConnectFailed(promise, future.cause());
                return;
            }
            Entry entry = new Entry((Channel) future.getNow(), clock.millis());
            PooledConnection lease = new PooledConnection(this, entry, false);
            if (!promise.trySuccess(lease)) {
                release(lease, ReleaseOutcome.REUSABLE);
            }
        });
    }

    private void onConnectFailed(Promise<PooledConnection> promise, Throwable cause) {
        synchronized (lock) {
            open--;
            inUse--;
        }
        log.debug("Connect to {} failed: {}", target.key(), cause == null ? "unknown" : cause.toString());
        if (cause instanceof GatewayException) {
            promise.tryFailure(cause);
        } else {
            promise.tryFailure(new GatewayException(GatewayFailure.UPSTREAM_UNREACHABLE,
                    "connect to " + target.key() + " failed", cause));
        }
        dispatchFreedCapacity();
    }

    private void dispatchFreedCapacity() {
        while (true) {
            Waiter waiter;
            synchronized (lock) {
                if (closed || waiters.isEmpty() || open >= settings.maxConnections()) {
                    return;
                }
                waiter = waiters.pollFirst();
                open++;
                inUse++;
            }
            waiter.disarm();
            if (waiter.promise.isDone()) {
                synchronized (lock) {
                    open--;
                    inUse--;
                }
                continue;
            }
            connect(waiter.promise, waiter.deadline);
        }
    }

    private void armWaiter(Waiter waiter) {
        waiter.timeout = timer.schedule(() -> {
            boolean removed;
            synchronized (lock) {
                removed = waiters.remove(waiter);
            }
            if (removed) {
                waiter.promise.tryFailure(new GatewayException(GatewayFailure.POOL_EXHAUSTED,
                        "timed out waiting for a connection to " + target.key()));
            }
        }, Math.max(0L, waiter.deadline.remainingNanos()), TimeUnit.NANOSECONDS);
        waiter.promise.addListener(future -> {
            if (future.isCancelled()) {
                synchronized (lock) {
                    waiters.remove(waiter);
                }
                waiter.disarm();
            }
        });
    }

    private void reapIdle(List<Channel> expired) {
        long now = clock.millis();
        long idleTimeout = settings.idleTimeout().toMillis();
        Iterator<Entry> iterator = idle.iterator();
        while (iterator.hasNext()) {
            Entry entry = iterator.next();
            if (!entry.channel.isActive() || now - entry.lastUsedMillis >= idleTimeout) {
                iterator.remove();
                open--;
                expired.add(entry.channel);
            }
        }
    }

    private static void closeAll(List<Channel> channels) {
        for (Channel channel : channels) {
            channel.close();
        }
    }

    static final class Entry {
        private final Channel channel;
        private long lastUsedMillis;

        private Entry(Channel channel, long lastUsedMillis) {
            this.channel = channel;
            this.lastUsedMillis = lastUsedMillis;
        }

        Channel channel() {
            return channel;
        }
    }

    private static final class Waiter {
        private final Promise<PooledConnection> promise;
        private final Deadline deadline;
        private volatile ScheduledFuture<?> timeout;

        private Waiter(Promise<PooledConnection> promise, Deadline deadline) {
            this.promise = promise;
            this.deadline = deadline;
        }

        private void disarm() {
            ScheduledFuture<?> scheduled = timeout;
            if (scheduled != null) {
                scheduled.cancel(false);
            }
        }
    }
}
