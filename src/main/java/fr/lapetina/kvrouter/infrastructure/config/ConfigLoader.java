package fr.lapetina.kvrouter.infrastructure.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Loads {@link RouterConfig} from YAML, on the file system first and then on the classpath.
 *
 * Loaded configuration is validated before it replaces the current one. {@link #reload()}
 * keeps the current configuration when the new one is broken.
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private final AtomicReference<RouterConfig> currentConfig = new AtomicReference<>();
    private final List<ConfigChangeListener> listeners = new CopyOnWriteArrayList<>();
    private final Path configPath;
    private final Yaml yaml;

    public ConfigLoader(String configPath) {
        this.configPath = Paths.get(configPath);
        this.yaml = new Yaml(new Constructor(RouterConfig.class, new LoaderOptions()));
    }

    /**
     * Loads and validates the configuration, then notifies listeners.
     *
     * @throws ConfigurationException if the file is missing, unreadable or invalid
     */
    public RouterConfig load() {
        RouterConfig config = validate(loadFromPath());
        RouterConfig previous = currentConfig.getAndSet(config);
        notifyListeners(previous, config);
        return config;
    }

    /**
     * Loads configuration from an input stream.
     */
    public RouterConfig loadFromStream(InputStream inputStream) {
        RouterConfig config = validate(parse(inputStream, "stream"));
        RouterConfig previous = currentConfig.getAndSet(config);
        notifyListeners(previous, config);
        return config;
    }

    /**
     * Forces a configuration reload, keeping the current one on failure.
     */
    public RouterConfig reload() {
        try {
            return load();
        } catch (ConfigurationException e) {
            log.error("Failed to reload configuration, keeping current", e);
            return currentConfig.get();
        }
    }

    public RouterConfig getCurrentConfig() {
        return currentConfig.get();
    }

    public void addListener(ConfigChangeListener listener) {
        listeners.add(listener);
    }

    public void removeListener(ConfigChangeListener listener) {
        listeners.remove(listener);
    }

    private RouterConfig loadFromPath() {
        if (Files.exists(configPath)) {
            log.info("Loading configuration from file: {}", configPath);
            try (InputStream is = Files.newInputStream(configPath)) {
                return parse(is, configPath.toString());
            } catch (IOException e) {
                throw new ConfigurationException("Failed to load configuration from: " + configPath, e);
            }
        }

        String resource = configPath.toString();
        if (resource.startsWith("/")) {
            resource = resource.substring(1);
        }

        try (InputStream is = getClass().getClassLoader().getResourceAsStream(resource)) {
            if (is != null) {
                log.info("Loading configuration from classpath: {}", resource);
                return parse(is, resource);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load from classpath: " + resource, e);
        }

        throw new ConfigurationException("Configuration file not found: " + configPath);
    }

    private RouterConfig parse(InputStream is, String source) {
        try {
            RouterConfig config = yaml.load(is);
            return config != null ? config : new RouterConfig();
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid YAML in " + source + ": " + e.getMessage(), e);
        }
    }

    static RouterConfig validate(RouterConfig config) {
        RouterConfig.KvAwareConfig kvAware = config.getPicker().getKvAware();
        if (kvAware.getThreshold() < 0) {
            throw new ConfigurationException("picker.kvAware.threshold must be >= 0");
        }
        if (kvAware.getTimeoutMs() <= 0) {
            throw new ConfigurationException("picker.kvAware.timeoutMs must be positive");
        }
        if (kvAware.getFailureThreshold() < 1) {
            throw new ConfigurationException("picker.kvAware.failureThreshold must be positive");
        }

        RouterConfig.PrefixConfig prefix = config.getPicker().getPrefix();
        if (prefix.getChunkSize() < 1) {
            throw new ConfigurationException("picker.prefix.chunkSize must be positive");
        }
        if (prefix.getMaxNodes() < 0) {
            throw new ConfigurationException("picker.prefix.maxNodes must be >= 0");
        }

        RouterConfig.HealthCheckConfig healthCheck = config.getHealthCheck();
        if (healthCheck.getIntervalMs() <= 0 || healthCheck.getTimeoutMs() <= 0) {
            throw new ConfigurationException("healthCheck.intervalMs and healthCheck.timeoutMs must be positive");
        }
        if (healthCheck.getFailureThreshold() < 1) {
            throw new ConfigurationException("healthCheck.failureThreshold must be positive");
        }
        if (healthCheck.getPath() == null || !healthCheck.getPath().startsWith("/")) {
            throw new ConfigurationException("healthCheck.path must start with '/'");
        }

        if (Integer.bitCount(config.getDisruptor().getRingBufferSize()) != 1) {
            throw new ConfigurationException("disruptor.ringBufferSize must be a power of 2");
        }
        if (config.getDisruptor().getPickWorkers() < 1) {
            throw new ConfigurationException("disruptor.pickWorkers must be positive");
        }

        Set<String> names = new HashSet<>();
        Set<String> urls = new HashSet<>();
        for (RouterConfig.BackendConfig backend : config.getServers()) {
            if (backend.getName() == null || backend.getName().isBlank()) {
                throw new ConfigurationException("Every server needs a name");
            }
            if (backend.getUrl() == null || backend.getUrl().isBlank()) {
                throw new ConfigurationException("Server " + backend.getName() + " needs a url");
            }
            if (!names.add(backend.getName())) {
                throw new ConfigurationException("Duplicate server name: " + backend.getName());
            }
            // The prefix trie keys servers by URL
            if (!urls.add(backend.getUrl().strip())) {
                throw new ConfigurationException("Duplicate server url: " + backend.getUrl()
                        + " (server " + backend.getName() + ")");
            }
        }
        return config;
    }

    private void notifyListeners(RouterConfig oldConfig, RouterConfig newConfig) {
        for (ConfigChangeListener listener : listeners) {
            try {
                listener.onConfigChanged(oldConfig, newConfig);
            } catch (RuntimeException e) {
                log.error("Error notifying config change listener", e);
            }
        }
    }

    /**
     * Exception for configuration errors.
     */
    public static class ConfigurationException extends RuntimeException {
        public ConfigurationException(String message) {
            super(message);
        }

        public ConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
