package net.spookly.arbiter.config;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Resolves indirect scalar values in a raw YAML tree before binding.
 * <p>
 * {@code env:NAME} reads an environment variable and {@code env:NAME:fallback} falls back when it is unset.
 * {@code path:file} reads a file relative to the config directory, which is how long regex lists or
 * reroute targets can be kept out of the main document.
 */
final class EnvExpander {
    private static final String ENV_PREFIX = "env:";
    private static final String PATH_PREFIX = "path:";

    private final Path baseDir;
    private final Function<String, String> environment;

    EnvExpander(Path baseDir, Function<String, String> environment) {
        this.baseDir = baseDir;
        this.environment = environment;
    }

    static Object expand(Object tree, Path baseDir) {
        return new EnvExpander(baseDir, System::getenv).expandNode(tree);
    }

    static Object expand(Object tree, Path baseDir, Function<String, String> environment) {
        return new EnvExpander(baseDir, environment).expandNode(tree);
    }

    Object expandNode(Object node) {
        if (node instanceof Map) {
            Map<Object, Object> result = new LinkedHashMap<>();
            ((Map<?, ?>) node).forEach((key, value) -> result.put(key, expandNode(value)));
            return result;
        }
        if (node instanceof List) {
            List<Object> result = new ArrayList<>();
            for (Object item : (List<?>) node) {
                result.add(expandNode(item));
            }
            return result;
        }
        if (node instanceof String) {
            return expandScalar((String) node);
        }
        return node;
    }

    private String expandScalar(String value) {
        if (value.startsWith(ENV_PREFIX)) {
            return resolveEnv(value.substring(ENV_PREFIX.length()));
        }
        if (value.startsWith(PATH_PREFIX)) {
            return readFile(value.substring(PATH_PREFIX.length()));
        }
        return value;
    }

    private String resolveEnv(String reference) {
        int separator = reference.indexOf(':');
        String name = separator < 0 ? reference : reference.substring(0, separator);
        if (name.isBlank()) {
            throw new ConfigException("Environment reference is missing a variable name");
        }
        String resolved = environment.apply(name);
        if (resolved != null) {
            return resolved;
        }
        if (separator >= 0) {
            return reference.substring(separator + 1);
        }
        throw new ConfigException("Missing required environment variable: " + name);
    }

    private String readFile(String location) {
        if (location.isBlank()) {
            throw new ConfigException("Path value is empty");
        }
        Path file;
        try {
            file = Path.of(location);
        } catch (InvalidPathException e) {
            throw new ConfigException("Invalid path value: " + location, e);
        }
        if (baseDir != null && !file.isAbsolute()) {
            file = baseDir.resolve(file).normalize();
        }
        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8).strip();
        } catch (IOException e) {
            throw new ConfigException("Failed to read config path: " + file, e);
        }
        if (content.isEmpty()) {
            throw new ConfigException("Path value is empty: " + file);
        }
        return content;
    }
}
