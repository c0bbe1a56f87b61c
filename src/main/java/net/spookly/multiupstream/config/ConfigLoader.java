package net.spookly.multiupstream.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.yaml.snakeyaml.Yaml;

public final class ConfigLoader {
    /**
     * File name that wins over any other candidate in the config directory.
     */
    public static final String PREFERRED_FILE = "proxies.yaml";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);

    private ConfigLoader() {
    }

    /**
     * Pick the config file in a directory: {@code proxies.yaml} first, otherwise the alphabetically
     * first {@code *.yaml}, {@code *.yml} or {@code *.json} file. Returns null when none exists.
     */
    public static Path findConfigFile(Path directory) {
        if (directory == null || !Files.isDirectory(directory)) {
            return null;
        }
        Path preferred = directory.resolve(PREFERRED_FILE);
        if (Files.isRegularFile(preferred)) {
            return preferred;
        }
        List<Path> candidates = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "*.{yaml,yml,json}")) {
            for (Path entry : stream) {
                if (Files.isRegularFile(entry)) {
                    candidates.add(entry);
                }
            }
        } catch (IOException e) {
            throw new ConfigException("Failed to list config directory: " + directory, e);
        }
        if (candidates.isEmpty()) {
            return null;
        }
        candidates.sort((left, right) -> left.getFileName().toString().compareTo(right.getFileName().toString()));
        return candidates.get(0);
    }

    /**
     * Load and validate a proxies configuration file (YAML or JSON).
     */
    public static MultiUpstreamConfig load(Path path) {
        if (path == null) {
            throw new ConfigException("Config path is required");
        }
        if (!Files.isRegularFile(path)) {
            throw new ConfigException("Config file does not exist: " + path);
        }
        Object raw = readRaw(path);
        if (raw == null) {
            throw new ConfigException("Config file is empty: " + path);
        }
        Object expanded = EnvExpander.expand(raw, path.toAbsolutePath().getParent());
        MultiUpstreamConfig config;
        try {
            config = MAPPER.convertValue(expanded, MultiUpstreamConfig.class);
        } catch (IllegalArgumentException e) {
            throw new ConfigException("Failed to parse config: " + path, e);
        }
        ConfigValidator.validate(config);
        return config;
    }

    private static Object readRaw(Path path) {
        boolean json = path.getFileName().toString().endsWith(".json");
        try (Reader reader = Files.newBufferedReader(path)) {
            if (json) {
                return MAPPER.readValue(reader, Object.class);
            }
            return new Yaml().load(reader);
        } catch (IOException e) {
            throw new ConfigException("Failed to read config: " + path, e);
        } catch (RuntimeException e) {
            throw new ConfigException("Failed to parse config: " + path, e);
        }
    }
}
