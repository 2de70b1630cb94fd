package net.spookly.httpgate.registry;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import lombok.extern.slf4j.Slf4j;

/**
 * Keeps the registry equal to the Devbox resources of the cluster. Every run starts from an empty
 * registry and relists; a run that fails or ends is replaced after {@code restartBackoff}.
 */
@Slf4j
public final class DevboxWatcher implements AutoCloseable {
    private final ServiceRegistry registry;
    private final DevboxInformerLauncher launcher;
    private final ScheduledExecutorService scheduler;
    private final DevboxWatchSettings settings;

    private DevboxWatch current;
    private int runs;
    private boolean started;
    private volatile boolean closed;

    public DevboxWatcher(ServiceRegistry registry,
                         DevboxInformerLauncher launcher,
                         ScheduledExecutorService scheduler,
                         DevboxWatchSettings settings) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.launcher = Objects.requireNonNull(launcher, "launcher");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    public synchronized void start() {
        if (started || closed) {
            return;
        }
        started = true;
        log.info("Starting Devbox watcher on {}/{} {}", settings.group(), settings.version(), settings.plural());
        run();
    }

    /**
     * Number of watch runs launched so far, restarts included.
     */
    public synchronized int runs() {
        return runs;
    }

    @Override
    public void close() {
        DevboxWatch watch;
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            watch = current;
            current = null;
        }
        if (watch != null) {
            watch.stop();
        }
        log.info("Devbox watcher stopped");
    }

    private synchronized void run() {
        if (closed) {
            return;
        }
        runs++;
        registry.clear();
        DevboxWatch watch;
        try {
            watch = launcher.launch(new DevboxEventHandler(registry, settings.uniqueIdPath()));
        } catch (RuntimeException e) {
            log.error("Devbox watcher failed to start, restarting in {}ms", settings.restartBackoff().toMillis(), e);
            scheduleRestart();
            return;
        }
        current = watch;
        watch.started().whenComplete((ignored, error) -> {
            if (error != null) {
                ended(watch, error);
            } else {
                log.info("Devbox watcher synced, {} services registered", registry.size());
            }
        });
        watch.stopped().whenComplete((ignored, error) -> ended(watch, error));
    }

    private void ended(DevboxWatch watch, Throwable error) {
        synchronized (this) {
            if (closed || current != watch) {
                return;
            }
            current = null;
        }
        watch.stop();
        if (error != null) {
            log.error("Devbox watcher failed, restarting in {}ms", settings.restartBackoff().toMillis(), error);
        } else {
            log.warn("Devbox watcher ended unexpectedly, restarting in {}ms", settings.restartBackoff().toMillis());
        }
        scheduleRestart();
    }

    private void scheduleRestart() {
        if (closed) {
            return;
        }
        Duration backoff = settings.restartBackoff();
        try {
            scheduler.schedule(this::run, backoff.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.warn("Devbox watcher restart dropped, scheduler is shutting down");
        }
    }
}
