package net.spookly.httpgate.admission;

/**
 * Concurrency ceiling and wait-queue bound of one admission scope.
 */
public record AdmissionLimits(int maxConcurrent, int maxQueued) {
    public static final int DEFAULT_MAX_IN_FLIGHT = 10_000;
    public static final int DEFAULT_MAX_QUEUED = 1_000;

    public AdmissionLimits {
        if (maxConcurrent <= 0) {
            throw new IllegalArgumentException("maxConcurrent must be greater than 0");
        }
        if (maxQueued < 0) {
            throw new IllegalArgumentException("maxQueued must be >= 0");
        }
    }

    public static AdmissionLimits globalDefaults() {
        return new AdmissionLimits(DEFAULT_MAX_IN_FLIGHT, DEFAULT_MAX_QUEUED);
    }
}
