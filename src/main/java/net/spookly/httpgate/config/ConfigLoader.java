package net.spookly.httpgate.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

public final class ConfigLoader {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);

    private ConfigLoader() {
    }

    /**
     * Load and validate the httpgate YAML configuration.
     */
    public static HttpgateConfig load(Path path) {
        if (path == null) {
            throw new ConfigException("Config path is required");
        }
        if (!Files.exists(path)) {
            writeDefaultConfig(path);
            throw new ConfigException("Config file did not exist, generated default at: " + path);
        }
        Object raw;
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            raw = new Yaml().load(reader);
        } catch (IOException | YAMLException e) {
            throw new ConfigException("Failed to read config: " + path, e);
        }
        if (raw == null) {
            throw new ConfigException("Config file is empty: " + path);
        }
        return fromRaw(raw, path.getParent(), path.toString());
    }

    /**
     * Parse and validate configuration from an in-memory YAML document.
     */
    public static HttpgateConfig parse(String yamlText) {
        Object raw;
        try {
            raw = new Yaml().load(yamlText);
        } catch (YAMLException e) {
            throw new ConfigException("Failed to parse config document", e);
        }
        if (raw == null) {
            throw new ConfigException("Config document is empty");
        }
        return fromRaw(raw, null, "<inline>");
    }

    private static HttpgateConfig fromRaw(Object raw, Path baseDir, String source) {
        Object expanded = EnvExpander.expand(raw, baseDir);
        HttpgateConfig config;
        try {
            config = MAPPER.convertValue(expanded, HttpgateConfig.class);
        } catch (IllegalArgumentException e) {
            throw new ConfigException("Failed to parse config: " + source, e);
        }
        ConfigValidator.validate(config);
        return config;
    }

    private static void writeDefaultConfig(Path path) {
        try {
            Path parent = path.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(path, ConfigDefaults.defaultYaml(), StandardCharsets.UTF_8, StandardOpenOption.CREATE_NEW);
        } catch (IOException e) {
            throw new ConfigException("Failed to write default config: " + path, e);
        }
    }
}
