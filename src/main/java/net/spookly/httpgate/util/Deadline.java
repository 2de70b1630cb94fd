package net.spookly.httpgate.util;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Absolute instant on the monotonic clock by which an operation must complete.
 */
public final class Deadline {
    private final long deadlineNanos;

    private Deadline(long deadlineNanos) {
        this.deadlineNanos = deadlineNanos;
    }

    /**
     * Deadline that elapses after the given timeout, starting now.
     */
    public static Deadline after(Duration timeout) {
        long now = System.nanoTime();
        long timeoutNanos = timeout == null || timeout.isNegative() ? 0L : saturatedNanos(timeout);
        long target = now + timeoutNanos;
        if (target - now < 0) {
            target = now + Long.MAX_VALUE / 2;
        }
        return new Deadline(target);
    }

    /**
     * Deadline that has already elapsed; waits against it fail immediately.
     */
    public static Deadline expired() {
        return new Deadline(System.nanoTime());
    }

    public long remainingNanos() {
        long remaining = deadlineNanos - System.nanoTime();
        return remaining > 0 ? remaining : 0L;
    }

    public long remainingMillis() {
        return TimeUnit.NANOSECONDS.toMillis(remainingNanos());
    }

    public boolean isExpired() {
        return deadlineNanos - System.nanoTime() <= 0;
    }

    /**
     * The earlier of this deadline and one that elapses after {@code timeout}.
     */
    public Deadline cappedAt(Duration timeout) {
        if (timeout == null) {
            return this;
        }
        return earliest(this, after(timeout));
    }

    public static Deadline earliest(Deadline first, Deadline second) {
        if (first == null) {
            return second;
        }
        if (second == null) {
            return first;
        }
        return first.deadlineNanos - second.deadlineNanos <= 0 ? first : second;
    }

    @Override
    public String toString() {
        return "Deadline[remainingMs=" + remainingMillis() + "]";
    }

    private static long saturatedNanos(Duration timeout) {
        try {
            return timeout.toNanos();
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE / 2;
        }
    }
}
