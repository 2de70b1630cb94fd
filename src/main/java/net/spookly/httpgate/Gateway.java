package net.spookly.httpgate;

import java.net.InetSocketAddress;
import java.time.Clock;
import java.time.Duration;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;
import java.util.function.Supplier;

import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.util.concurrent.DefaultThreadFactory;
import io.netty.util.concurrent.EventExecutor;
import io.netty.util.concurrent.ScheduledFuture;
import lombok.extern.slf4j.Slf4j;
import net.spookly.httpgate.admission.AdmissionController;
import net.spookly.httpgate.config.ConfigException;
import net.spookly.httpgate.config.GatewaySettings;
import net.spookly.httpgate.config.HttpgateConfig;
import net.spookly.httpgate.health.CircuitLogListener;
import net.spookly.httpgate.health.UpstreamHealthTracker;
import net.spookly.httpgate.pool.NettyUpstreamConnector;
import net.spookly.httpgate.pool.UpstreamPoolManager;
import net.spookly.httpgate.proxy.ForwardingEngine;
import net.spookly.httpgate.proxy.HttpProxyServer;
import net.spookly.httpgate.proxy.ProxyEventListener;
import net.spookly.httpgate.registry.AdminServer;
import net.spookly.httpgate.registry.DevboxWatchSettings;
import net.spookly.httpgate.registry.DevboxWatcher;
import net.spookly.httpgate.registry.HostPatternResolver;
import net.spookly.httpgate.registry.KubernetesDevboxInformers;
import net.spookly.httpgate.registry.RegistryAuditLogger;
import net.spookly.httpgate.registry.RegistryEvent;
import net.spookly.httpgate.registry.RegistryEventType;
import net.spookly.httpgate.registry.ServiceRegistry;
import net.spookly.httpgate.routing.DynamicRouteSource;
import net.spookly.httpgate.routing.Route;
import net.spookly.httpgate.routing.RouteTable;
import net.spookly.httpgate.routing.RouteTableFactory;
import net.spookly.httpgate.routing.RoutingService;
import net.spookly.httpgate.routing.UpstreamTarget;
import net.spookly.httpgate.util.ListenAddress;

/**
 * Wires the routing, admission, health, pooling and forwarding components from one configuration
 * and owns their event loops.
 */
@Slf4j
public final class Gateway implements AutoCloseable {
    private static final Duration MIN_SWEEP_INTERVAL = Duration.ofSeconds(1);
    private static final Duration MAX_SWEEP_INTERVAL = Duration.ofSeconds(60);

    private final GatewaySettings settings;
    private final Supplier<HttpgateConfig> configSource;
    private final EventLoopGroup bossGroup;
    private final EventLoopGroup workerGroup;
    private final EventExecutor timer;
    private final UpstreamHealthTracker healthTracker;
    private final ServiceRegistry registry;
    private final HostPatternResolver registryRoutes;
    private final RoutingService routing;
    private final AdmissionController admission;
    private final UpstreamPoolManager pools;
    private final ForwardingEngine engine;
    private final HttpProxyServer proxyServer;
    private final AdminServer adminServer;
    private final KubernetesDevboxInformers devboxInformers;
    private final DevboxWatcher devboxWatcher;
    private ScheduledFuture<?> sweepTask;
    private volatile boolean stopped;

    /**
     * @param configSource re-reads configuration for route reloads; may be null when reloads are not supported
     */
    public Gateway(HttpgateConfig config, Supplier<HttpgateConfig> configSource, ProxyEventListener eventListener) {
        Objects.requireNonNull(config, "config");
        this.settings = GatewaySettings.from(config);
        this.configSource = configSource;
        this.bossGroup = new NioEventLoopGroup(1, new DefaultThreadFactory("httpgate-boss"));
        this.workerGroup = new NioEventLoopGroup(settings.proxy().workerThreads(), new DefaultThreadFactory("httpgate-worker"));
        this.timer = workerGroup.next();
        Clock clock = Clock.systemUTC();

        this.healthTracker = new UpstreamHealthTracker(settings.circuit(), clock, CircuitLogListener.INSTANCE);
        HttpgateConfig.ServiceRegistryConfig registryConfig = config.routing == null ? null : config.routing.serviceRegistry;
        boolean registryEnabled = registryConfig != null && Boolean.TRUE.equals(registryConfig.enabled);
        this.registry = ServiceRegistry.fromConfig(config, registryEnabled ? this::onRegistryEvent : null);
        DynamicRouteSource dynamicRoutes = DynamicRouteSource.NONE;
        if (registryEnabled) {
            this.registryRoutes = new HostPatternResolver(registry, registryConfig.domainSuffix,
                    registryConfig.backendHostTemplate, RouteTableFactory.defaultPolicy(config));
            dynamicRoutes = registryRoutes;
        } else {
            this.registryRoutes = null;
        }
        this.routing = new RoutingService(RouteTableFactory.fromConfig(config), healthTracker, dynamicRoutes);
        this.admission = new AdmissionController(settings.globalLimits(), settings.defaultRouteLimits(), timer);
        this.pools = new UpstreamPoolManager(settings.pool(), new NettyUpstreamConnector(workerGroup), timer, clock);
        this.engine = new ForwardingEngine(routing, admission, pools, healthTracker, settings.proxy(),
                eventListener == null ? ProxyEventListener.NOOP : eventListener);
        this.proxyServer = new HttpProxyServer(settings.proxy(), engine, bossGroup, workerGroup);

        HttpgateConfig.AdminConfig admin = config.admin;
        if (admin != null && Boolean.TRUE.equals(admin.enabled)) {
            this.adminServer = new AdminServer(ListenAddress.parse(admin.listen), admin.token, admin.maxRequestBytes,
                    registry, healthTracker, pools, configSource == null ? null : this::reloadRoutes);
        } else {
            this.adminServer = null;
        }

        DevboxWatchSettings watchSettings = settings.devboxWatch();
        if (registryEnabled && watchSettings.enabled()) {
            this.devboxInformers = KubernetesDevboxInformers.connect(watchSettings);
            this.devboxWatcher = new DevboxWatcher(registry, devboxInformers, timer, watchSettings);
        } else {
            this.devboxInformers = null;
            this.devboxWatcher = null;
        }
    }

    /**
     * Bind the proxy listener and, when enabled, the admin API and the Devbox watcher.
     */
    public synchronized Gateway start() {
        try {
            proxyServer.start();
            if (adminServer != null) {
                adminServer.start();
            }
            if (devboxWatcher != null) {
                devboxWatcher.start();
            }
            if (sweepTask == null) {
                long sweepMillis = sweepInterval().toMillis();
                sweepTask = timer.scheduleAtFixedRate(this::sweepSafely, sweepMillis, sweepMillis, TimeUnit.MILLISECONDS);
            }
        } catch (RuntimeException e) {
            close();
            throw e;
        }
        return this;
    }

    /**
     * Re-read configuration and publish a new static route table.
     *
     * @return version of the published table
     * @throws ConfigException when the new configuration is invalid; the current table stays in place
     */
    public long reloadRoutes() {
        if (configSource == null) {
            throw new IllegalStateException("route reload is not configured");
        }
        RouteTable table = RouteTableFactory.fromConfig(configSource.get());
        routing.publish(table);
        sweepUpstreams();
        return table.version();
    }

    /**
     * Drop connection pools and circuit breakers of targets that neither a static route nor a registered
     * service can reach any more, plus those that are merely unused.
     */
    public void sweepUpstreams() {
        Set<String> staticTargets = new HashSet<>();
        for (Route route : routing.currentTable().routes()) {
            for (UpstreamTarget target : route.targets()) {
                staticTargets.add(target.key());
            }
        }
        Set<String> serviceHosts = registryRoutes == null ? Set.of() : registryRoutes.backendHosts();
        Predicate<String> live = key -> staticTargets.contains(key) || serviceHosts.contains(hostOf(key));
        int evictedPools = pools.evictUnused(live);
        int evictedCircuits = healthTracker.evict(live);
        if (evictedPools > 0 || evictedCircuits > 0) {
            log.debug("Swept {} pools and {} circuits", evictedPools, evictedCircuits);
        }
    }

    public InetSocketAddress boundAddress() {
        return proxyServer.boundAddress();
    }

    public InetSocketAddress adminAddress() {
        return adminServer == null ? null : adminServer.boundAddress();
    }

    public GatewaySettings settings() {
        return settings;
    }

    public ServiceRegistry registry() {
        return registry;
    }

    public RoutingService routing() {
        return routing;
    }

    public AdmissionController admission() {
        return admission;
    }

    public UpstreamHealthTracker healthTracker() {
        return healthTracker;
    }

    public UpstreamPoolManager pools() {
        return pools;
    }

    public ForwardingEngine engine() {
        return engine;
    }

    /**
     * Drain in-flight requests for up to {@code grace}, then release every connection and event loop.
     */
    public synchronized void stop(Duration grace) {
        if (stopped) {
            return;
        }
        stopped = true;
        if (sweepTask != null) {
            sweepTask.cancel(false);
        }
        if (devboxWatcher != null) {
            devboxWatcher.close();
        }
        if (devboxInformers != null) {
            devboxInformers.close();
        }
        if (adminServer != null) {
            adminServer.stop();
        }
        proxyServer.stop(grace);
        pools.close();
        bossGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).syncUninterruptibly();
        workerGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).syncUninterruptibly();
        log.info("Gateway stopped");
    }

    @Override
    public void close() {
        stop(settings.proxy().shutdownGrace());
    }

    private void onRegistryEvent(RegistryEvent event) {
        RegistryAuditLogger.INSTANCE.onEvent(event);
        if (pools != null && event.type() != RegistryEventType.REGISTER) {
            sweepUpstreams();
        }
    }

    private void sweepSafely() {
        try {
            sweepUpstreams();
        } catch (RuntimeException e) {
            log.warn("Upstream sweep failed", e);
        }
    }

    private Duration sweepInterval() {
        Duration idle = settings.pool().idleTimeout();
        if (idle.compareTo(MIN_SWEEP_INTERVAL) < 0) {
            return MIN_SWEEP_INTERVAL;
        }
        return idle.compareTo(MAX_SWEEP_INTERVAL) > 0 ? MAX_SWEEP_INTERVAL : idle;
    }

    private static String hostOf(String targetKey) {
        int colon = targetKey.lastIndexOf(':');
        return colon < 0 ? targetKey : targetKey.substring(0, colon);
    }
}
