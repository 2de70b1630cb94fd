package net.spookly.httpgate.registry;

import java.util.concurrent.CompletionStage;

/**
 * One running watch over the Devbox resources.
 */
public interface DevboxWatch {
    /**
     * Completes once the initial listing has been delivered, exceptionally when it could not be.
     */
    CompletionStage<Void> started();

    /**
     * Completes when the watch ends for good, exceptionally when it ended on an error.
     */
    CompletionStage<Void> stopped();

    void stop();
}
