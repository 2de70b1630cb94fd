package net.spookly.httpgate.health;

import java.time.Duration;
import java.time.Instant;

import lombok.Value;
import lombok.experimental.Accessors;

/**
 * Circuit state change of one upstream target.
 */
@Value
@Accessors(fluent = true)
public class CircuitTransition {
    String targetKey;
    CircuitState from;
    CircuitState to;
    String reason;
    Duration cooldown;
    Instant timestamp;
}
