package net.spookly.multiupstream.registry;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

import net.spookly.multiupstream.config.ConfigException;
import net.spookly.multiupstream.config.ConfigLoader;
import net.spookly.multiupstream.config.ConfigWarnings;
import net.spookly.multiupstream.config.MultiUpstreamConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads the proxies configuration from a directory into the registry store.
 */
public final class UpstreamConfigService {
    private static final Logger log = LoggerFactory.getLogger(UpstreamConfigService.class);

    private final ProxyRegistryStore store;

    public UpstreamConfigService(ProxyRegistryStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    /**
     * Reload from {@code directory}.
     * <p>
     * A missing directory or one without config files leaves the registry untouched. A file that
     * fails to load discards the current registry, so selection stops until the next good reload.
     *
     * @return true when a new registry was installed
     */
    public boolean reload(Path directory) {
        if (directory == null || !Files.exists(directory)) {
            log.warn("Configuration directory {} does not exist", directory);
            return false;
        }
        if (!Files.isDirectory(directory)) {
            log.warn("{} is not a directory", directory);
            return false;
        }
        Path file;
        try {
            file = ConfigLoader.findConfigFile(directory);
        } catch (ConfigException e) {
            log.warn("{}", e.getMessage());
            return false;
        }
        if (file == null) {
            log.warn("No configuration files found in {}", directory);
            return false;
        }
        log.info("Loading configuration from {}", file);
        MultiUpstreamConfig config;
        try {
            config = ConfigLoader.load(file);
        } catch (ConfigException e) {
            log.error("Error loading configuration from {}: {}", file, e.getMessage());
            store.unload();
            return false;
        }
        for (String warning : ConfigWarnings.collect(config, file)) {
            log.warn("Config warning: {}", warning);
        }
        ProxyRegistry registry = ProxyRegistry.fromConfig(config, file.toString());
        store.replace(registry);
        log.info("Loaded {} proxy configurations from {}", registry.candidates().size(), file);
        if (registry.defaultProxy() != null) {
            log.info("Default proxy: {}", registry.defaultProxy().name());
        }
        return true;
    }

    public ProxyRegistryStore store() {
        return store;
    }
}
