package net.spookly.httpgate.admission;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

import io.netty.util.concurrent.EventExecutor;
import io.netty.util.concurrent.Future;
import io.netty.util.concurrent.Promise;
import io.netty.util.concurrent.ScheduledFuture;
import net.spookly.httpgate.GatewayException;
import net.spookly.httpgate.GatewayFailure;
import net.spookly.httpgate.util.Deadline;

/**
 * Counting limiter for one scope with a bounded FIFO of waiters. Released capacity goes straight to the
 * oldest waiter, so a burst of new arrivals cannot overtake queued requests.
 */
public final class AdmissionLimiter {
    private final AdmissionScope scope;
    private final EventExecutor timer;

    private final Object lock = new Object();
    private final Deque<Waiter> waiters = new ArrayDeque<>();
    private AdmissionLimits limits;
    private int inUse;

    public AdmissionLimiter(AdmissionScope scope, AdmissionLimits limits, EventExecutor timer) {
        this.scope = Objects.requireNonNull(scope, "scope");
        this.limits = Objects.requireNonNull(limits, "limits");
        this.timer = Objects.requireNonNull(timer, "timer");
    }

    public AdmissionScope scope() {
        return scope;
    }

    public Future<AdmissionSlot> acquire(Deadline deadline) {
        Objects.requireNonNull(deadline, "deadline");
        Promise<AdmissionSlot> promise = timer.newPromise();
        Waiter waiter = null;
        boolean admitted = false;
        synchronized (lock) {
            if (inUse < limits.maxConcurrent() && waiters.isEmpty()) {
                inUse++;
                admitted = true;
            } else if (!deadline.isExpired() && waiters.size() < limits.maxQueued()) {
                waiter = new Waiter(promise);
                waiters.addLast(waiter);
            }
        }
        if (admitted) {
            AdmissionSlot slot = new AdmissionSlot(this);
            if (!promise.trySuccess(slot)) {
                slot.release();
            }
        } else if (waiter != null) {
            arm(waiter, deadline);
        } else {
            promise.tryFailure(new GatewayException(GatewayFailure.REJECTED, "admission rejected for " + scope));
        }
        return promise;
    }

    /**
     * Apply new limits; capacity freed by a larger ceiling is handed to waiters immediately.
     */
    public void updateLimits(AdmissionLimits next) {
        Objects.requireNonNull(next, "next");
        synchronized (lock) {
            if (limits.equals(next)) {
                return;
            }
            limits = next;
        }
        drain();
    }

    public AdmissionLimits limits() {
        synchronized (lock) {
            return limits;
        }
    }

    public int inUse() {
        synchronized (lock) {
            return inUse;
        }
    }

    public int queued() {
        synchronized (lock) {
            return waiters.size();
        }
    }

    void release() {
        while (true) {
            Waiter waiter;
            synchronized (lock) {
                if (inUse > limits.maxConcurrent()) {
                    inUse--;
                    return;
                }
                waiter = waiters.pollFirst();
                if (waiter == null) {
                    inUse--;
                    return;
                }
            }
            waiter.disarm();
            if (waiter.promise.trySuccess(new AdmissionSlot(this))) {
                return;
            }
        }
    }

    private void drain() {
        List<Waiter> admitted = new ArrayList<>();
        synchronized (lock) {
            while (inUse < limits.maxConcurrent() && !waiters.isEmpty()) {
                admitted.add(waiters.pollFirst());
                inUse++;
            }
        }
        for (Waiter waiter : admitted) {
            waiter.disarm();
            AdmissionSlot slot = new AdmissionSlot(this);
            if (!waiter.promise.trySuccess(slot)) {
                slot.release();
            }
        }
    }

    private void arm(Waiter waiter, Deadline deadline) {
        waiter.timeout = timer.schedule(() -> {
            boolean removed;
            synchronized (lock) {
                removed = waiters.remove(waiter);
            }
            if (removed) {
                waiter.promise.tryFailure(new GatewayException(GatewayFailure.REJECTED,
                        "admission wait timed out for " + scope));
            }
        }, Math.max(0L, deadline.remainingNanos()), TimeUnit.NANOSECONDS);
        waiter.promise.addListener(future -> {
            if (future.isCancelled()) {
                synchronized (lock) {
                    waiters.remove(waiter);
                }
                waiter.disarm();
            }
        });
    }

    private static final class Waiter {
        private final Promise<AdmissionSlot> promise;
        private volatile ScheduledFuture<?> timeout;

        private Waiter(Promise<AdmissionSlot> promise) {
            this.promise = promise;
        }

        private void disarm() {
            ScheduledFuture<?> scheduled = timeout;
            if (scheduled != null) {
                scheduled.cancel(false);
            }
        }
    }
}
