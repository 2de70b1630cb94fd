package net.spookly.httpgate.registry;

import java.time.Duration;
import java.util.Objects;

/**
 * Where the Devbox custom resources live and how to read a service id out of one.
 */
public record DevboxWatchSettings(boolean enabled,
                                  String group,
                                  String version,
                                  String plural,
                                  String uniqueIdPath,
                                  Duration restartBackoff) {
    public static final String DEFAULT_GROUP = "devbox.sealos.io";
    public static final String DEFAULT_VERSION = "v1alpha2";
    public static final String DEFAULT_PLURAL = "devboxes";
    public static final String DEFAULT_UNIQUE_ID_PATH = "status.network.uniqueID";
    public static final Duration DEFAULT_RESTART_BACKOFF = Duration.ofSeconds(5);

    public DevboxWatchSettings {
        Objects.requireNonNull(group, "group");
        Objects.requireNonNull(version, "version");
        Objects.requireNonNull(plural, "plural");
        Objects.requireNonNull(uniqueIdPath, "uniqueIdPath");
        Objects.requireNonNull(restartBackoff, "restartBackoff");
        if (restartBackoff.isNegative()) {
            throw new IllegalArgumentException("restartBackoff must be >= 0");
        }
    }

    public static DevboxWatchSettings defaults() {
        return new DevboxWatchSettings(false, DEFAULT_GROUP, DEFAULT_VERSION, DEFAULT_PLURAL, DEFAULT_UNIQUE_ID_PATH,
                DEFAULT_RESTART_BACKOFF);
    }
}
