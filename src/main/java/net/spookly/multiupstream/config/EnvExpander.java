package net.spookly.multiupstream.config;

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
 * Expands secret references in a raw config tree so credentials need not live in the file.
 * <p>
 * {@code env:NAME} reads an environment variable, {@code path:file} reads a file relative to the
 * config directory.
 */
final class EnvExpander {
    private static final String ENV_PREFIX = "env:";
    private static final String PATH_PREFIX = "path:";

    private final Path baseDir;
    private final Function<String, String> environment;

    EnvExpander(Path baseDir, Function<String, String> environment) {
        this.baseDir = baseDir;
        this.environment = environment == null ? System::getenv : environment;
    }

    static Object expand(Object value, Path baseDir) {
        return new EnvExpander(baseDir, System::getenv).expand(value);
    }

    Object expand(Object value) {
        if (value instanceof Map) {
            Map<Object, Object> expanded = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                expanded.put(entry.getKey(), expand(entry.getValue()));
            }
            return expanded;
        }
        if (value instanceof List) {
            List<?> items = (List<?>) value;
            List<Object> expanded = new ArrayList<>(items.size());
            for (Object item : items) {
                expanded.add(expand(item));
            }
            return expanded;
        }
        if (value instanceof String) {
            return expandString((String) value);
        }
        return value;
    }

    private String expandString(String raw) {
        if (raw.startsWith(ENV_PREFIX)) {
            String key = raw.substring(ENV_PREFIX.length());
            String resolved = environment.apply(key);
            if (resolved == null) {
                throw new ConfigException("Missing required environment variable: " + key);
            }
            return resolved;
        }
        if (raw.startsWith(PATH_PREFIX)) {
            return readSecretFile(raw.substring(PATH_PREFIX.length()));
        }
        return raw;
    }

    private String readSecretFile(String location) {
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
            content = Files.readString(file, StandardCharsets.UTF_8).stripTrailing();
        } catch (IOException e) {
            throw new ConfigException("Failed to read config path: " + file, e);
        }
        if (content.isEmpty()) {
            throw new ConfigException("Path value is empty: " + file);
        }
        return content;
    }
}
