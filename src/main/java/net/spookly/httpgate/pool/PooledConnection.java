package net.spookly.httpgate.pool;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

import io.netty.channel.Channel;
import net.spookly.httpgate.routing.UpstreamTarget;

/**
 * One checkout of a pooled upstream connection. Each checkout is a new lease, so releasing a stale lease
 * can never return a connection that another request now holds.
 */
public final class PooledConnection {
    private final UpstreamConnectionPool pool;
    private final UpstreamConnectionPool.Entry entry;
    private final boolean reused;
    private final AtomicBoolean released = new AtomicBoolean(false);

    PooledConnection(UpstreamConnectionPool pool, UpstreamConnectionPool.Entry entry, boolean reused) {
        this.pool = Objects.requireNonNull(pool, "pool");
        this.entry = Objects.requireNonNull(entry, "entry");
        this.reused = reused;
    }

    public Channel channel() {
        return entry.channel();
    }

    public UpstreamTarget target() {
        return pool.target();
    }

    /**
     * True when the connection was taken from the idle set rather than freshly established.
     */
    public boolean reused() {
        return reused;
    }

    public boolean isReleased() {
        return released.get();
    }

    /**
     * Return the connection to its pool. Only the first call has an effect.
     */
    public void release(ReleaseOutcome outcome) {
        pool.release(this, outcome);
    }

    UpstreamConnectionPool.Entry entry() {
        return entry;
    }

    boolean markReleased() {
        return released.compareAndSet(false, true);
    }

    @Override
    public String toString() {
        return "PooledConnection[" + target().key() + " " + channel().id().asShortText() + (reused ? " reused" : "") + "]";
    }
}
