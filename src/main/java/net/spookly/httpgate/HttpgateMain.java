package net.spookly.httpgate;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.CountDownLatch;

import lombok.extern.slf4j.Slf4j;
import net.spookly.httpgate.config.ConfigException;
import net.spookly.httpgate.config.ConfigLoader;
import net.spookly.httpgate.config.ConfigPrinter;
import net.spookly.httpgate.config.HttpgateConfig;
import net.spookly.httpgate.proxy.RequestLogListener;

/**
 * Standalone entry point for the httpgate process.
 */
@Slf4j
public final class HttpgateMain {
    private static final String DEFAULT_CONFIG = "config/httpgate.yaml";

    private HttpgateMain() {
    }

    public static void main(String[] args) {
        CliOptions options = parseArgs(args);
        Path configPath = options.configPath;
        HttpgateConfig config;
        try {
            config = ConfigLoader.load(configPath);
        } catch (ConfigException e) {
            log.error("{}", e.getMessage(), e.getCause());
            System.exit(2);
            return;
        }
        if (options.printEffectiveConfig) {
            System.out.println(ConfigPrinter.toYaml(config));
            return;
        }
        if (options.dryRun) {
            System.out.println("Config OK (--dry-run).");
            return;
        }
        log.info("httpgate config loaded: listen={}:{} routes={}", config.proxy.listen.host, config.proxy.listen.port,
                config.routing.routes == null ? 0 : config.routing.routes.size());

        Gateway gateway;
        try {
            gateway = new Gateway(config, () -> ConfigLoader.load(configPath), RequestLogListener.INSTANCE).start();
        } catch (IllegalStateException e) {
            log.error("Failed to start httpgate", e);
            System.exit(1);
            return;
        }

        CountDownLatch latch = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            gateway.close();
            latch.countDown();
        }, "httpgate-shutdown"));

        try {
            latch.await();
        } catch (InterruptedException ignored) {
            Thread.currentThread().interrupt();
        }
    }

    static CliOptions parseArgs(String[] args) {
        Path configPath = Paths.get(DEFAULT_CONFIG);
        boolean dryRun = false;
        boolean printEffectiveConfig = false;
        if (args == null) {
            return new CliOptions(configPath, dryRun, printEffectiveConfig);
        }
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if ("--config".equals(arg) || "-c".equals(arg)) {
                if (i + 1 < args.length) {
                    configPath = Paths.get(args[++i]);
                    continue;
                }
            }
            if ("--dry-run".equals(arg)) {
                dryRun = true;
                continue;
            }
            if ("--print-effective-config".equals(arg)) {
                printEffectiveConfig = true;
            }
        }
        return new CliOptions(configPath, dryRun, printEffectiveConfig);
    }

    record CliOptions(Path configPath, boolean dryRun, boolean printEffectiveConfig) {
    }
}
