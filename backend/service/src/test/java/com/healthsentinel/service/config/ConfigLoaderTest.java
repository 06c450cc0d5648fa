package com.healthsentinel.service.config;

import com.healthsentinel.core.model.MonitorConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigLoaderTest {
    @TempDir
    Path tempDir;

    @Test
    void loadsYamlConfiguration() throws Exception {
        Path file = tempDir.resolve("monitor.yaml");
        Files.writeString(file, """
                global:
                  check_interval: 12
                services:
                  cache-a:
                    type: tcp
                    host: localhost
                    port: 6379
                notifiers:
                  console:
                    type: log
                """, StandardCharsets.UTF_8);

        MonitorConfig config = ConfigLoader.load(file, ConfigValidatorTest.validator());

        assertEquals(Duration.ofSeconds(12), config.services().get("cache-a").interval());
        assertEquals(List.of("console"), List.copyOf(config.notifiers().keySet()));
    }

    @Test
    void loadsJsonConfiguration() throws Exception {
        Path file = tempDir.resolve("monitor.json");
        Files.writeString(file, """
                {"services": {"api": {"type": "http", "url": "http://localhost:8080/health", "timeout": 3}}}
                """, StandardCharsets.UTF_8);

        MonitorConfig config = ConfigLoader.load(file, ConfigValidatorTest.validator());

        assertEquals(Duration.ofSeconds(3), config.services().get("api").timeout());
    }

    @Test
    void emptyFileIsAnEmptyDocument() throws Exception {
        Path file = tempDir.resolve("empty.yml");
        Files.writeString(file, "", StandardCharsets.UTF_8);

        assertEquals(Map.of(), ConfigLoader.readDocument(file));
    }

    @Test
    void syntaxErrorNamesTheFile() throws Exception {
        Path file = tempDir.resolve("broken.yaml");
        Files.writeString(file, "services: [unclosed", StandardCharsets.UTF_8);

        IllegalStateException error = assertThrows(IllegalStateException.class,
                () -> ConfigLoader.readDocument(file));

        assertEquals("Failed loading config from " + file, error.getMessage());
    }

    @Test
    void missingFileNamesTheFile() {
        Path file = tempDir.resolve("absent.yaml");

        IllegalStateException error = assertThrows(IllegalStateException.class,
                () -> ConfigLoader.load(file, ConfigValidatorTest.validator()));

        assertTrue(error.getMessage().contains("absent.yaml"));
    }

    @Test
    void bundledExampleConfigurationIsValid() {
        Path example = Path.of("../../config/monitor.yaml");

        MonitorConfig config = ConfigLoader.load(example, ConfigValidatorTest.validator());

        assertEquals(3, config.services().size());
        assertEquals(2, config.services().get("user-db").failureThreshold());
        assertEquals(2, config.notifiers().size());
        assertEquals(8080, config.global().statusPort());
    }
}
