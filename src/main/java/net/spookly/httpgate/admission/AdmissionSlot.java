package net.spookly.httpgate.admission;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One unit of capacity held in an admission scope.
 */
public final class AdmissionSlot implements AutoCloseable {
    private final AdmissionLimiter limiter;
    private final AtomicBoolean released = new AtomicBoolean(false);

    AdmissionSlot(AdmissionLimiter limiter) {
        this.limiter = Objects.requireNonNull(limiter, "limiter");
    }

    public AdmissionScope scope() {
        return limiter.scope();
    }

    public boolean isReleased() {
        return released.get();
    }

    /**
     * Free the capacity. Only the first call has an effect.
     */
    public void release() {
        if (released.compareAndSet(false, true)) {
            limiter.release();
        }
    }

    @Override
    public void close() {
        release();
    }

    @Override
    public String toString() {
        return "AdmissionSlot[" + scope() + (released.get() ? " released" : "") + "]";
    }
}
