package net.spookly.arbiter.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

public final class ConfigLoader {
    private static final Logger LOGGER = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);

    private ConfigLoader() {
    }

    /**
     * Load and validate the Arbiter YAML configuration.
     */
    public static ArbiterConfig load(Path path) {
        if (path == null) {
            throw new ConfigException("Config path is required");
        }
        if (!Files.exists(path)) {
            writeDefaultConfig(path);
            throw new ConfigException("Config file did not exist, generated default at: " + path);
        }
        Object raw;
        Yaml yaml = new Yaml();
        try (Reader reader = Files.newBufferedReader(path)) {
            raw = yaml.load(reader);
        } catch (IOException e) {
            throw new ConfigException("Failed to read config: " + path, e);
        }
        return bind(raw, path.getParent(), path.toString());
    }

    /**
     * Parse and validate configuration from YAML text; {@code path:} values resolve against {@code baseDir}.
     */
    public static ArbiterConfig parse(String content, Path baseDir) {
        if (content == null) {
            throw new ConfigException("Config content is required");
        }
        Object raw = new Yaml().load(content);
        return bind(raw, baseDir, "<inline>");
    }

    private static ArbiterConfig bind(Object raw, Path baseDir, String source) {
        if (raw == null) {
            throw new ConfigException("Config file is empty: " + source);
        }
        Object expanded = EnvExpander.expand(raw, baseDir);
        ArbiterConfig config;
        try {
            config = MAPPER.convertValue(expanded, ArbiterConfig.class);
        } catch (IllegalArgumentException e) {
            throw new ConfigException("Failed to parse config: " + source, e);
        }
        ConfigValidator.validate(config);
        for (String warning : ConfigWarnings.collect(config)) {
            LOGGER.warn("Config warning ({}): {}", source, warning);
        }
        return config;
    }

    private static void writeDefaultConfig(Path path) {
        try {
            Path parent = path.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(
                    path,
                    ConfigDefaults.defaultYaml(),
                    StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE_NEW
            );
        } catch (IOException e) {
            throw new ConfigException("Failed to write default config: " + path, e);
        }
    }
}
