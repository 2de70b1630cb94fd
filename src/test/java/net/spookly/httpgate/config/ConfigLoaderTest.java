package net.spookly.httpgate.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;

class ConfigLoaderTest {
    @Test
    void createsDefaultConfigWhenMissing() throws IOException {
        Path tempDir = Files.createTempDirectory("httpgate-config");
        Path configPath = tempDir.resolve("nested").resolve("httpgate.yaml");

        ConfigException exception = assertThrows(ConfigException.class, () -> ConfigLoader.load(configPath));

        assertTrue(Files.exists(configPath));
        assertTrue(exception.getMessage().contains("generated default"));
        String content = Files.readString(configPath, StandardCharsets.UTF_8);
        assertTrue(content.contains("routing:"));

        HttpgateConfig config = ConfigLoader.load(configPath);
        assertEquals(8080, config.proxy.listen.port);
        assertEquals("default", config.routing.routes.get(0).id);
    }

    @Test
    void expandsPathSecretsRelativeToConfig() throws IOException {
        Path tempDir = Files.createTempDirectory("httpgate-config");
        Path configPath = tempDir.resolve("httpgate.yaml");
        Path tokenPath = tempDir.resolve("secret").resolve("admin_token");
        Files.createDirectories(tokenPath.getParent());
        Files.writeString(tokenPath, "from-file\n", StandardCharsets.UTF_8);
        Files.writeString(configPath, """
                proxy:
                  listen:
                    host: 127.0.0.1
                    port: 8080
                routing:
                  routes:
                    - id: api
                      match:
                        pathPrefix: /
                      targets:
                        - host: 10.0.0.1
                          port: 80
                admin:
                  enabled: true
                  listen: 127.0.0.1:9080
                  token: path:secret/admin_token
                """, StandardCharsets.UTF_8);

        HttpgateConfig config = ConfigLoader.load(configPath);

        assertEquals("from-file", config.admin.token);
    }

    @Test
    void rejectsEmptyDocument() throws IOException {
        Path configPath = Files.createTempFile("httpgate", ".yaml");

        assertThrows(ConfigException.class, () -> ConfigLoader.load(configPath));
        assertThrows(ConfigException.class, () -> ConfigLoader.parse(""));
    }

    @Test
    void rejectsUnknownKeys() {
        ConfigException exception = assertThrows(ConfigException.class, () -> ConfigLoader.parse("""
                proxy:
                  listen:
                    host: 127.0.0.1
                    port: 8080
                  lisen: typo
                routing:
                  routes: []
                """));

        assertTrue(exception.getMessage().contains("Failed to parse config"));
    }

    @Test
    void rejectsMalformedYaml() {
        assertThrows(ConfigException.class, () -> ConfigLoader.parse("proxy: [unclosed"));
    }
}
