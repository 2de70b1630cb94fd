package net.spookly.httpgate.health;

import java.time.Duration;
import java.util.Objects;

/**
 * Thresholds and cool-down parameters shared by every circuit breaker.
 */
public record CircuitSettings(int failureThreshold,
                              Duration failureWindow,
                              Duration cooldown,
                              Duration maxCooldown,
                              double backoffMultiplier) {
    public static final int DEFAULT_FAILURE_THRESHOLD = 5;
    public static final Duration DEFAULT_FAILURE_WINDOW = Duration.ofSeconds(10);
    public static final Duration DEFAULT_COOLDOWN = Duration.ofSeconds(5);
    public static final Duration DEFAULT_MAX_COOLDOWN = Duration.ofSeconds(60);
    public static final double DEFAULT_BACKOFF_MULTIPLIER = 2.0D;

    public CircuitSettings {
        Objects.requireNonNull(failureWindow, "failureWindow");
        Objects.requireNonNull(cooldown, "cooldown");
        Objects.requireNonNull(maxCooldown, "maxCooldown");
        if (failureThreshold <= 0) {
            throw new IllegalArgumentException("failureThreshold must be greater than 0");
        }
        if (backoffMultiplier < 1.0D) {
            throw new IllegalArgumentException("backoffMultiplier must be >= 1.0");
        }
        if (maxCooldown.compareTo(cooldown) < 0) {
            maxCooldown = cooldown;
        }
    }

    public static CircuitSettings defaults() {
        return new CircuitSettings(
                DEFAULT_FAILURE_THRESHOLD,
                DEFAULT_FAILURE_WINDOW,
                DEFAULT_COOLDOWN,
                DEFAULT_MAX_COOLDOWN,
                DEFAULT_BACKOFF_MULTIPLIER
        );
    }
}
