package net.spookly.httpgate.config;

import java.util.List;

public class HttpgateConfig {
    public ProxyConfig proxy;
    public AdmissionConfig admission;
    public PoolConfig pool;
    public HealthConfig health;
    public RoutingConfig routing;
    public AdminConfig admin;

    public static class ProxyConfig {
        public ListenConfig listen;
        public Integer workerThreads;
        /**
         * Request body bytes retained so an attempt can be replayed against another target.
         */
        public Integer maxReplayBytes;
        public Integer maxInitialLineLength;
        public Integer maxHeaderSize;
        public Boolean forwardedHeaders;
        public Integer shutdownGraceMs;
        public Integer idleClientTimeoutMs;
    }

    public static class ListenConfig {
        public String host;
        public Integer port;
    }

    public static class AdmissionConfig {
        public Integer maxInFlight;
        public Integer maxQueued;
    }

    public static class PoolConfig {
        public Integer maxConnectionsPerTarget;
        public Integer maxPendingAcquires;
        public Integer idleTimeoutMs;
        public Integer connectTimeoutMs;
    }

    public static class HealthConfig {
        public Integer failureThreshold;
        public Integer failureWindowMs;
        public Integer cooldownMs;
        public Integer maxCooldownMs;
        public Double backoffMultiplier;
    }

    public static class RoutingConfig {
        public RoutePolicyConfig defaults;
        public List<RouteConfig> routes;
        public ServiceRegistryConfig serviceRegistry;
    }

    public static class RoutePolicyConfig {
        public String policy;
        public Integer timeoutMs;
        public Integer attemptTimeoutMs;
        public Integer retries;
        public Integer maxConcurrency;
        public Integer maxQueued;
    }

    public static class RouteConfig {
        public String id;
        public MatchConfig match;
        public String policy;
        public Integer timeoutMs;
        public Integer attemptTimeoutMs;
        public Integer retries;
        public Integer maxConcurrency;
        public Integer maxQueued;
        public List<TargetConfig> targets;
    }

    public static class MatchConfig {
        public String host;
        public String pathPrefix;
    }

    public static class TargetConfig {
        public String id;
        public String host;
        public Integer port;
        public Integer weight;
    }

    public static class ServiceRegistryConfig {
        public Boolean enabled;
        public String domainSuffix;
        /**
         * Upstream host template, {@code {id}} and {@code {namespace}} are substituted.
         */
        public String backendHostTemplate;
        public List<ServiceEntryConfig> services;
        public KubernetesWatchConfig kubernetes;
    }

    /**
     * Keeps the registry in sync with Devbox custom resources across all namespaces.
     */
    public static class KubernetesWatchConfig {
        public Boolean enabled;
        public String group;
        public String version;
        public String plural;
        /**
         * Dot-separated path to the service id inside the resource, e.g. {@code status.network.uniqueID}.
         */
        public String uniqueIdPath;
        public Integer restartBackoffMs;
    }

    public static class ServiceEntryConfig {
        public String id;
        public String namespace;
    }

    public static class AdminConfig {
        public Boolean enabled;
        public String listen;
        public String token;
        public Integer maxRequestBytes;
    }
}
