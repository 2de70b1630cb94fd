package net.spookly.httpgate.config;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import net.spookly.httpgate.util.ListenAddress;

public final class ConfigValidator {
    private ConfigValidator() {
    }

    /**
     * Validate configuration, throwing ConfigException listing every violation.
     */
    public static void validate(HttpgateConfig config) {
        List<String> errors = new ArrayList<>();
        if (config == null) {
            errors.add("config is required");
            throwIfErrors(errors);
            return;
        }

        validateProxy(config, errors);
        validateAdmission(config, errors);
        validatePool(config, errors);
        validateHealth(config, errors);
        validateRouting(config, errors);
        validateAdmin(config, errors);

        throwIfErrors(errors);
    }

    private static void validateProxy(HttpgateConfig config, List<String> errors) {
        HttpgateConfig.ProxyConfig proxy = config.proxy;
        if (proxy == null) {
            errors.add("proxy section is required");
            return;
        }
        HttpgateConfig.ListenConfig listen = proxy.listen;
        if (listen == null) {
            errors.add("proxy.listen is required");
        } else {
            requireNonBlank(errors, listen.host, "proxy.listen.host");
            requireListenPort(errors, listen.port, "proxy.listen.port");
        }
        requireNonNegative(errors, proxy.workerThreads, "proxy.workerThreads");
        requireNonNegative(errors, proxy.maxReplayBytes, "proxy.maxReplayBytes");
        requirePositive(errors, proxy.maxInitialLineLength, "proxy.maxInitialLineLength");
        requirePositive(errors, proxy.maxHeaderSize, "proxy.maxHeaderSize");
        requireNonNegative(errors, proxy.shutdownGraceMs, "proxy.shutdownGraceMs");
        requirePositive(errors, proxy.idleClientTimeoutMs, "proxy.idleClientTimeoutMs");
    }

    private static void validateAdmission(HttpgateConfig config, List<String> errors) {
        HttpgateConfig.AdmissionConfig admission = config.admission;
        if (admission == null) {
            return;
        }
        requirePositive(errors, admission.maxInFlight, "admission.maxInFlight");
        requireNonNegative(errors, admission.maxQueued, "admission.maxQueued");
    }

    private static void validatePool(HttpgateConfig config, List<String> errors) {
        HttpgateConfig.PoolConfig pool = config.pool;
        if (pool == null) {
            return;
        }
        requirePositive(errors, pool.maxConnectionsPerTarget, "pool.maxConnectionsPerTarget");
        requireNonNegative(errors, pool.maxPendingAcquires, "pool.maxPendingAcquires");
        requirePositive(errors, pool.idleTimeoutMs, "pool.idleTimeoutMs");
        requirePositive(errors, pool.connectTimeoutMs, "pool.connectTimeoutMs");
    }

    private static void validateHealth(HttpgateConfig config, List<String> errors) {
        HttpgateConfig.HealthConfig health = config.health;
        if (health == null) {
            return;
        }
        requirePositive(errors, health.failureThreshold, "health.failureThreshold");
        requirePositive(errors, health.failureWindowMs, "health.failureWindowMs");
        requirePositive(errors, health.cooldownMs, "health.cooldownMs");
        requirePositive(errors, health.maxCooldownMs, "health.maxCooldownMs");
        if (health.backoffMultiplier != null && health.backoffMultiplier < 1.0D) {
            errors.add("health.backoffMultiplier must be >= 1.0");
        }
        if (health.cooldownMs != null && health.maxCooldownMs != null && health.maxCooldownMs < health.cooldownMs) {
            errors.add("health.maxCooldownMs must be >= health.cooldownMs");
        }
    }

    private static void validateRouting(HttpgateConfig config, List<String> errors) {
        HttpgateConfig.RoutingConfig routing = config.routing;
        if (routing == null) {
            errors.add("routing section is required");
            return;
        }
        if (routing.defaults != null) {
            validatePolicy(errors, "routing.defaults", routing.defaults.policy, routing.defaults.timeoutMs,
                    routing.defaults.attemptTimeoutMs, routing.defaults.retries,
                    routing.defaults.maxConcurrency, routing.defaults.maxQueued);
        }
        boolean registryEnabled = routing.serviceRegistry != null && isTrue(routing.serviceRegistry.enabled);
        if ((routing.routes == null || routing.routes.isEmpty()) && !registryEnabled) {
            errors.add("routing.routes must include at least one route unless routing.serviceRegistry is enabled");
        }
        if (routing.routes != null) {
            Set<String> routeIds = new HashSet<>();
            for (HttpgateConfig.RouteConfig route : routing.routes) {
                if (route == null) {
                    continue;
                }
                validateRoute(route, routeIds, errors);
            }
        }
        if (registryEnabled) {
            HttpgateConfig.ServiceRegistryConfig registry = routing.serviceRegistry;
            requireNonBlank(errors, registry.domainSuffix, "routing.serviceRegistry.domainSuffix");
            if (!isBlank(registry.backendHostTemplate) && !registry.backendHostTemplate.contains("{id}")) {
                errors.add("routing.serviceRegistry.backendHostTemplate must contain {id}");
            }
            if (registry.services != null) {
                for (HttpgateConfig.ServiceEntryConfig service : registry.services) {
                    if (service == null) {
                        continue;
                    }
                    requireNonBlank(errors, service.id, "routing.serviceRegistry.services.id");
                    requireNonBlank(errors, service.namespace, "routing.serviceRegistry.services.namespace");
                }
            }
        }
        HttpgateConfig.KubernetesWatchConfig kubernetes = routing.serviceRegistry == null
                ? null
                : routing.serviceRegistry.kubernetes;
        if (kubernetes != null && isTrue(kubernetes.enabled)) {
            if (!registryEnabled) {
                errors.add("routing.serviceRegistry.kubernetes requires routing.serviceRegistry.enabled");
            }
            if (kubernetes.uniqueIdPath != null
                    && (kubernetes.uniqueIdPath.isBlank() || kubernetes.uniqueIdPath.contains(".."))) {
                errors.add("routing.serviceRegistry.kubernetes.uniqueIdPath must be a dot-separated field path");
            }
            requireNonNegative(errors, kubernetes.restartBackoffMs, "routing.serviceRegistry.kubernetes.restartBackoffMs");
        }
    }

    private static void validateRoute(HttpgateConfig.RouteConfig route, Set<String> routeIds, List<String> errors) {
        requireNonBlank(errors, route.id, "routing.routes.id");
        String prefix = "routing.routes." + (isBlank(route.id) ? "?" : route.id);
        if (!isBlank(route.id) && !routeIds.add(route.id)) {
            errors.add("route id must be unique: " + route.id);
        }
        if (route.match == null) {
            errors.add(prefix + ".match is required");
        } else {
            if (!isBlank(route.match.pathPrefix) && !route.match.pathPrefix.startsWith("/")) {
                errors.add(prefix + ".match.pathPrefix must start with /");
            }
            if (!isBlank(route.match.host)) {
                String host = route.match.host.trim();
                int wildcard = host.indexOf('*');
                if (wildcard >= 0 && !"*".equals(host) && !(host.startsWith("*.") && wildcard == host.lastIndexOf('*'))) {
                    errors.add(prefix + ".match.host wildcard must be * or a leading *.suffix");
                }
            }
        }
        validatePolicy(errors, prefix, route.policy, route.timeoutMs, route.attemptTimeoutMs, route.retries,
                route.maxConcurrency, route.maxQueued);
        if (route.targets == null || route.targets.isEmpty()) {
            errors.add(prefix + ".targets must include at least one target");
            return;
        }
        Set<String> targetIds = new HashSet<>();
        for (HttpgateConfig.TargetConfig target : route.targets) {
            if (target == null) {
                continue;
            }
            requireNonBlank(errors, target.host, prefix + ".targets.host");
            requirePort(errors, target.port, prefix + ".targets.port");
            if (target.weight != null && target.weight <= 0) {
                errors.add(prefix + ".targets.weight must be greater than 0");
            }
            if (!isBlank(target.id) && !targetIds.add(target.id)) {
                errors.add(prefix + ".targets id must be unique within a route: " + target.id);
            }
        }
    }

    private static void validatePolicy(List<String> errors,
                                       String prefix,
                                       String policy,
                                       Integer timeoutMs,
                                       Integer attemptTimeoutMs,
                                       Integer retries,
                                       Integer maxConcurrency,
                                       Integer maxQueued) {
        if (!isBlank(policy) && !isOneOf(policy, "ordered", "round_robin", "weighted")) {
            errors.add(prefix + ".policy must be ordered, round_robin or weighted");
        }
        requirePositive(errors, timeoutMs, prefix + ".timeoutMs");
        requirePositive(errors, attemptTimeoutMs, prefix + ".attemptTimeoutMs");
        requireNonNegative(errors, retries, prefix + ".retries");
        requirePositive(errors, maxConcurrency, prefix + ".maxConcurrency");
        requireNonNegative(errors, maxQueued, prefix + ".maxQueued");
    }

    private static void validateAdmin(HttpgateConfig config, List<String> errors) {
        HttpgateConfig.AdminConfig admin = config.admin;
        if (admin == null || !isTrue(admin.enabled)) {
            return;
        }
        requireNonBlank(errors, admin.listen, "admin.listen");
        if (!isBlank(admin.listen)) {
            try {
                ListenAddress.parse(admin.listen);
            } catch (IllegalArgumentException e) {
                errors.add("admin.listen is invalid: " + e.getMessage());
            }
        }
        requirePositive(errors, admin.maxRequestBytes, "admin.maxRequestBytes");
    }

    private static void requireNonBlank(List<String> errors, String value, String field) {
        if (isBlank(value)) {
            errors.add(field + " is required");
        }
    }

    private static void requirePort(List<String> errors, Integer port, String field) {
        if (port == null) {
            errors.add(field + " is required");
            return;
        }
        if (port < 1 || port > 65535) {
            errors.add(field + " must be between 1 and 65535");
        }
    }

    private static void requireListenPort(List<String> errors, Integer port, String field) {
        if (port == null) {
            errors.add(field + " is required");
            return;
        }
        if (port < 0 || port > 65535) {
            errors.add(field + " must be between 0 and 65535");
        }
    }

    private static void requirePositive(List<String> errors, Integer value, String field) {
        if (value != null && value <= 0) {
            errors.add(field + " must be greater than 0");
        }
    }

    private static void requireNonNegative(List<String> errors, Integer value, String field) {
        if (value != null && value < 0) {
            errors.add(field + " must be >= 0");
        }
    }

    private static boolean isOneOf(String value, String... options) {
        if (value == null) {
            return false;
        }
        for (String option : options) {
            if (option.equalsIgnoreCase(value)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isTrue(Boolean value) {
        return Boolean.TRUE.equals(value);
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    private static void throwIfErrors(List<String> errors) {
        if (!errors.isEmpty()) {
            throw new ConfigException("Invalid config:\n - " + String.join("\n - ", errors));
        }
    }
}
