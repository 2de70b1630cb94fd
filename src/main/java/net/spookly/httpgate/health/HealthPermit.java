package net.spookly.httpgate.health;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.Accessors;

/**
 * Permission to send one request to a target, tied to the circuit generation that granted it.
 * Outcomes are reported with the permit so late results from an earlier generation are ignored.
 */
@Getter
@Accessors(fluent = true)
@ToString
@AllArgsConstructor(access = AccessLevel.PACKAGE)
public final class HealthPermit {
    public enum Kind {
        /**
         * Regular traffic through a closed circuit.
         */
        NORMAL,
        /**
         * The single half-open trial.
         */
        TRIAL,
        /**
         * Forced attempt while every candidate is unavailable; never moves circuit state.
         */
        BYPASS
    }

    private final String targetKey;
    private final Kind kind;
    private final long generation;

    public boolean isTrial() {
        return kind == Kind.TRIAL;
    }
}
