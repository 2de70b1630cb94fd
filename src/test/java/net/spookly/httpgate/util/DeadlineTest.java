package net.spookly.httpgate.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;

import org.junit.jupiter.api.Test;

class DeadlineTest {
    @Test
    void expiredDeadlineHasNothingRemaining() {
        Deadline deadline = Deadline.expired();
        assertTrue(deadline.isExpired());
        assertEquals(0L, deadline.remainingNanos());
    }

    @Test
    void futureDeadlineIsNotExpired() {
        Deadline deadline = Deadline.after(Duration.ofMinutes(1));
        assertFalse(deadline.isExpired());
        assertTrue(deadline.remainingMillis() > 50_000L);
    }

    @Test
    void hugeTimeoutDoesNotOverflow() {
        Deadline deadline = Deadline.after(Duration.ofSeconds(Long.MAX_VALUE));
        assertFalse(deadline.isExpired());
    }

    @Test
    void cappedAtPicksTheEarlierDeadline() {
        Deadline overall = Deadline.after(Duration.ofMinutes(10));
        Deadline capped = overall.cappedAt(Duration.ofSeconds(1));
        assertTrue(capped.remainingMillis() <= 1_000L);
        assertSame(overall, overall.cappedAt(null));
        assertSame(overall, Deadline.earliest(overall, Deadline.after(Duration.ofHours(1))));
    }
}
