package net.spookly.arbiter.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigLoaderTest {
    @Test
    void createsDefaultConfigWhenMissing() throws IOException {
        Path tempDir = Files.createTempDirectory("arbiter-config");
        Path configPath = tempDir.resolve("arbiter.yaml");

        ConfigException exception = assertThrows(ConfigException.class, () -> ConfigLoader.load(configPath));

        assertTrue(Files.exists(configPath));
        String content = Files.readString(configPath, StandardCharsets.UTF_8);
        assertTrue(content.contains("dispatch:"));
        assertTrue(content.contains("fallback: true"));
        assertTrue(exception.getMessage().contains("generated default"));
    }

    @Test
    void generatedDefaultLoadsCleanly(@TempDir Path tempDir) throws IOException {
        Path configPath = tempDir.resolve("arbiter.yaml");
        Files.writeString(configPath, ConfigDefaults.defaultYaml(), StandardCharsets.UTF_8);

        ArbiterConfig config = ConfigLoader.load(configPath);

        assertEquals(3, config.dispatch.bindings.size());
        assertEquals(2, config.dispatch.exemptRoutes.size());
        assertEquals(ConfigDefaults.DEFAULT_RATE_LIMIT_PER_MINUTE, config.admission.rateLimitPerMinute);
        assertEquals("/batch", config.admission.batchEndpointPath);
        assertTrue(ConfigWarnings.collect(config).isEmpty());
    }

    @Test
    void expandsPathValuesRelativeToConfig(@TempDir Path tempDir) throws IOException {
        Path targetFile = tempDir.resolve("targets").resolve("ask");
        Files.createDirectories(targetFile.getParent());
        Files.writeString(targetFile, "/ask/v2\n", StandardCharsets.UTF_8);
        Path configPath = tempDir.resolve("arbiter.yaml");
        Files.writeString(configPath, """
                dispatch:
                  bindings:
                    - id: ask
                      priority: 10
                      methods: [POST]
                      exactPaths: [/ask, /ask/v2]
                      conflictPolicy: refresh_then_reroute
                      rerouteTarget: path:targets/ask
                    - id: catch-all
                      priority: 1
                      methods: [POST]
                      conflictPolicy: strict_block
                      fallback: true
                """, StandardCharsets.UTF_8);

        ArbiterConfig config = ConfigLoader.load(configPath);

        assertEquals("/ask/v2", config.dispatch.bindings.get(0).rerouteTarget);
        assertNull(config.admission);
    }

    @Test
    void rejectsUnknownProperties() {
        ConfigException exception = assertThrows(ConfigException.class, () -> ConfigLoader.parse("""
                dispatch:
                  bindings: []
                  routes: []
                """, null));
        assertTrue(exception.getMessage().contains("Failed to parse config"));
    }

    @Test
    void rejectsEmptyDocument() {
        assertThrows(ConfigException.class, () -> ConfigLoader.parse("", null));
    }
}
