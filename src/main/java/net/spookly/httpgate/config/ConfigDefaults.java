package net.spookly.httpgate.config;

/**
 * Default configuration template written when no config file exists.
 */
public final class ConfigDefaults {
    private static final String DEFAULT_YAML = """
            # Generated default httpgate config.
            proxy:
              listen:
                host: 0.0.0.0
                port: 8080
              maxReplayBytes: 65536
              forwardedHeaders: true
              shutdownGraceMs: 10000
              idleClientTimeoutMs: 60000

            admission:
              maxInFlight: 1024
              maxQueued: 512

            pool:
              maxConnectionsPerTarget: 64
              maxPendingAcquires: 256
              idleTimeoutMs: 60000
              connectTimeoutMs: 2000

            health:
              failureThreshold: 5
              failureWindowMs: 10000
              cooldownMs: 5000
              maxCooldownMs: 60000
              backoffMultiplier: 2.0

            routing:
              defaults:
                policy: ordered
                timeoutMs: 30000
                retries: 1
                maxConcurrency: 256
                maxQueued: 128
              routes:
                - id: default
                  match:
                    pathPrefix: /
                  targets:
                    - id: local-1
                      host: 127.0.0.1
                      port: 8081
              serviceRegistry:
                enabled: false
                domainSuffix: env:DOMAIN_SUFFIX:-devbox.example.com
                backendHostTemplate: "{id}.{namespace}.svc.cluster.local"
                kubernetes:
                  enabled: false
                  group: devbox.sealos.io
                  version: v1alpha2
                  plural: devboxes
                  uniqueIdPath: status.network.uniqueID
                  restartBackoffMs: 5000

            admin:
              enabled: false
              listen: 127.0.0.1:9080
            """;

    private ConfigDefaults() {
    }

    public static String defaultYaml() {
        return DEFAULT_YAML;
    }
}
