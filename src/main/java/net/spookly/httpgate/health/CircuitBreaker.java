package net.spookly.httpgate.health;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

import lombok.extern.slf4j.Slf4j;

/**
 * Closed/Open/HalfOpen state machine for a single upstream target.
 */
@Slf4j
public final class CircuitBreaker {
    private final String targetKey;
    private final CircuitSettings settings;
    private final Clock clock;
    private final CircuitStateListener listener;

    private final Deque<Long> recentFailures = new ArrayDeque<>();
    private CircuitState state = CircuitState.CLOSED;
    private long generation;
    private long openedAtMillis;
    private long cooldownMillis;
    private boolean trialInFlight;

    public CircuitBreaker(String targetKey, CircuitSettings settings, Clock clock, CircuitStateListener listener) {
        this.targetKey = Objects.requireNonNull(targetKey, "targetKey");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.listener = listener == null ? CircuitStateListener.NOOP : listener;
        this.cooldownMillis = settings.cooldown().toMillis();
    }

    public String targetKey() {
        return targetKey;
    }

    public CircuitState state() {
        List<CircuitTransition> transitions = new ArrayList<>(1);
        CircuitState current;
        synchronized (this) {
            advance(transitions);
            current = state;
        }
        emit(transitions);
        return current;
    }

    /**
     * True when a request could be admitted right now: closed, or half-open with the trial unclaimed.
     */
    public boolean isRoutable() {
        List<CircuitTransition> transitions = new ArrayList<>(1);
        boolean routable;
        synchronized (this) {
            advance(transitions);
            routable = state == CircuitState.CLOSED || (state == CircuitState.HALF_OPEN && !trialInFlight);
        }
        emit(transitions);
        return routable;
    }

    /**
     * Claim permission to send a request, or {@code null} when the circuit denies traffic.
     */
    public HealthPermit tryAcquire() {
        List<CircuitTransition> transitions = new ArrayList<>(1);
        HealthPermit permit = null;
        synchronized (this) {
            advance(transitions);
            if (state == CircuitState.CLOSED) {
                permit = new HealthPermit(targetKey, HealthPermit.Kind.NORMAL, generation);
            } else if (state == CircuitState.HALF_OPEN && !trialInFlight) {
                trialInFlight = true;
                permit = new HealthPermit(targetKey, HealthPermit.Kind.TRIAL, generation);
            }
        }
        emit(transitions);
        return permit;
    }

    public HealthPermit bypass() {
        return new HealthPermit(targetKey, HealthPermit.Kind.BYPASS, -1L);
    }

    public void onSuccess(HealthPermit permit) {
        List<CircuitTransition> transitions = new ArrayList<>(1);
        synchronized (this) {
            if (!isCurrent(permit)) {
                return;
            }
            if (state == CircuitState.CLOSED && permit.kind() == HealthPermit.Kind.NORMAL) {
                recentFailures.clear();
            } else if (state == CircuitState.HALF_OPEN && permit.isTrial()) {
                trialInFlight = false;
                recentFailures.clear();
                cooldownMillis = settings.cooldown().toMillis();
                transition(CircuitState.CLOSED, "trial_succeeded", transitions);
            }
        }
        emit(transitions);
    }

    public void onFailure(HealthPermit permit) {
        List<CircuitTransition> transitions = new ArrayList<>(1);
        synchronized (this) {
            if (!isCurrent(permit)) {
                return;
            }
            long now = clock.millis();
            if (state == CircuitState.CLOSED && permit.kind() == HealthPermit.Kind.NORMAL) {
                pruneFailures(now);
                recentFailures.addLast(now);
                if (recentFailures.size() >= settings.failureThreshold()) {
                    recentFailures.clear();
                    openedAtMillis = now;
                    transition(CircuitState.OPEN, "failure_threshold", transitions);
                }
            } else if (state == CircuitState.HALF_OPEN && permit.isTrial()) {
                trialInFlight = false;
                long next = (long) Math.ceil(cooldownMillis * settings.backoffMultiplier());
                cooldownMillis = Math.min(next, settings.maxCooldown().toMillis());
                openedAtMillis = now;
                transition(CircuitState.OPEN, "trial_failed", transitions);
            }
        }
        emit(transitions);
    }

    /**
     * Return a permit whose request never reached the upstream.
     */
    public void release(HealthPermit permit) {
        synchronized (this) {
            if (isCurrent(permit) && state == CircuitState.HALF_OPEN && permit.isTrial()) {
                trialInFlight = false;
            }
        }
    }

    /**
     * True when the breaker holds nothing worth keeping: closed with no failure inside the window.
     */
    boolean isAtRest() {
        synchronized (this) {
            if (state != CircuitState.CLOSED) {
                return false;
            }
            pruneFailures(clock.millis());
            return recentFailures.isEmpty();
        }
    }

    synchronized Duration currentCooldown() {
        return Duration.ofMillis(cooldownMillis);
    }

    private boolean isCurrent(HealthPermit permit) {
        return permit != null
                && permit.kind() != HealthPermit.Kind.BYPASS
                && permit.generation() == generation
                && targetKey.equals(permit.targetKey());
    }

    private void advance(List<CircuitTransition> transitions) {
        if (state == CircuitState.OPEN && clock.millis() - openedAtMillis >= cooldownMillis) {
            trialInFlight = false;
            transition(CircuitState.HALF_OPEN, "cooldown_elapsed", transitions);
        }
    }

    private void pruneFailures(long now) {
        long cutoff = now - settings.failureWindow().toMillis();
        while (!recentFailures.isEmpty() && recentFailures.peekFirst() < cutoff) {
            recentFailures.removeFirst();
        }
    }

    private void transition(CircuitState next, String reason, List<CircuitTransition> transitions) {
        CircuitState previous = state;
        state = next;
        generation++;
        transitions.add(new CircuitTransition(
                targetKey,
                previous,
                next,
                reason,
                Duration.ofMillis(cooldownMillis),
                clock.instant()
        ));
    }

    private void emit(List<CircuitTransition> transitions) {
        for (CircuitTransition transition : transitions) {
            try {
                listener.onTransition(transition);
            } catch (RuntimeException e) {
                log.warn("Circuit listener failed for {}", targetKey, e);
            }
        }
    }
}
