package fr.lapetina.kvrouter;

import fr.lapetina.kvrouter.disruptor.RoutingPipeline;
import fr.lapetina.kvrouter.domain.cacheindex.CacheIndexService;
import fr.lapetina.kvrouter.domain.picker.Picker;
import fr.lapetina.kvrouter.domain.picker.PickerContext;
import fr.lapetina.kvrouter.domain.picker.PickerFactory;
import fr.lapetina.kvrouter.infrastructure.cacheindex.CircuitBreaker;
import fr.lapetina.kvrouter.infrastructure.cacheindex.HttpCacheIndexClient;
import fr.lapetina.kvrouter.infrastructure.config.ConfigLoader;
import fr.lapetina.kvrouter.infrastructure.config.RouterConfig;
import fr.lapetina.kvrouter.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.kvrouter.infrastructure.registry.ServerHealthChecker;
import fr.lapetina.kvrouter.infrastructure.registry.ServerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Wires a complete router from configuration: registry, health checker, metrics, cache-index
 * client, picker and pipeline.
 *
 * <p>Usage:
 * <pre>{@code
 * try (RouterFactory factory = RouterFactory.create("config.yaml").start()) {
 *     RoutingResponse response = factory.getPipeline().submit(request).get();
 * }
 * }</pre>
 */
public class RouterFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RouterFactory.class);

    private final ConfigLoader configLoader;
    private final ServerRegistry serverRegistry;
    private final MetricsRegistry metricsRegistry;
    private final CacheIndexService cacheIndexOverride;
    private final RoutingPipeline pipeline;

    private volatile CacheIndexService cacheIndex;
    private volatile ServerHealthChecker healthChecker;
    private volatile boolean started;

    /**
     * @param cacheIndexOverride used instead of an HTTP client to the configured controller
     */
    protected RouterFactory(String configPath, CacheIndexService cacheIndexOverride) {
        log.info("Initializing RouterFactory from config: {}", configPath);

        this.configLoader = new ConfigLoader(configPath);
        RouterConfig config = configLoader.load();

        this.metricsRegistry = new MetricsRegistry(config.getMetrics().getPrefix());

        this.serverRegistry = new ServerRegistry();
        serverRegistry.addListener(event -> metricsRegistry.setActiveServers(serverRegistry.getActiveCount()));
        serverRegistry.replaceAll(ServerRegistry.fromConfig(config.getServers()));

        this.healthChecker = createHealthChecker(config);

        this.cacheIndexOverride = cacheIndexOverride;
        this.cacheIndex = cacheIndexOverride != null ? cacheIndexOverride : createCacheIndexClient(config);

        Picker picker = createConfiguredPicker(config);
        log.info("Using picker: {}", picker.getName());

        this.pipeline = RoutingPipeline.builder()
                .fromConfig(config)
                .serverRegistry(serverRegistry)
                .metricsRegistry(metricsRegistry)
                .initialPicker(picker)
                .build();

        configLoader.addListener(this::onConfigChanged);

        log.info("RouterFactory initialized with {} servers", serverRegistry.size());
    }

    public static RouterFactory create(String configPath) {
        return new RouterFactory(configPath, null);
    }

    public static RouterFactory create() {
        return create("config.yaml");
    }

    public RouterFactory start() {
        pipeline.start();
        ServerHealthChecker checker = healthChecker;
        if (checker != null) {
            checker.start();
        }
        started = true;
        log.info("Router started");
        return this;
    }

    /**
     * Builds a fresh picker from the current configuration.
     *
     * @return empty for an unknown name
     * @throws IllegalStateException if the picker needs a controller and none is configured
     */
    public Optional<Picker> createPicker(String name) {
        return PickerFactory.create(name, pickerContext(getConfig()));
    }

    public RoutingPipeline getPipeline() {
        return pipeline;
    }

    public ServerRegistry getServerRegistry() {
        return serverRegistry;
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public RouterConfig getConfig() {
        return configLoader.getCurrentConfig();
    }

    public ConfigLoader getConfigLoader() {
        return configLoader;
    }

    /**
     * @return empty when health checking is disabled
     */
    public Optional<ServerHealthChecker> getHealthChecker() {
        return Optional.ofNullable(healthChecker);
    }

    private ServerHealthChecker createHealthChecker(RouterConfig config) {
        if (!config.getHealthCheck().isEnabled()) {
            return null;
        }
        return ServerHealthChecker.fromConfig(serverRegistry, config.getHealthCheck());
    }

    private PickerContext pickerContext(RouterConfig config) {
        RouterConfig.PickerConfig picker = config.getPicker();
        return new PickerContext(
                cacheIndex,
                picker.getKvAware().getThreshold(),
                picker.getPrefix().getChunkSize(),
                picker.getPrefix().getMaxNodes(),
                metricsRegistry.pickObserver()
        );
    }

    private Picker createConfiguredPicker(RouterConfig config) {
        String type = config.getPicker().getType();
        if (!PickerFactory.getRegisteredNames().contains(type.toLowerCase())) {
            log.warn("Unknown picker '{}', using {}", type, PickerFactory.DEFAULT_PICKER);
        }
        try {
            return PickerFactory.createOrDefault(type, pickerContext(config));
        } catch (IllegalStateException e) {
            throw new ConfigLoader.ConfigurationException(e.getMessage(), e);
        }
    }

    private CacheIndexService createCacheIndexClient(RouterConfig config) {
        RouterConfig.KvAwareConfig kvAware = config.getPicker().getKvAware();
        String controller = kvAware.getControllerAddress();
        if (controller == null || controller.isBlank()) {
            return null;
        }
        log.info("Cache index controller: address={}, timeoutMs={}", controller, kvAware.getTimeoutMs());
        return new HttpCacheIndexClient(
                controller,
                Duration.ofMillis(kvAware.getTimeoutMs()),
                new CircuitBreaker(controller, kvAware.getFailureThreshold(), Duration.ofMillis(kvAware.getCooldownMs())),
                metricsRegistry.cacheIndexRecorder()
        );
    }

    private void onConfigChanged(RouterConfig oldConfig, RouterConfig newConfig) {
        if (oldConfig == null) {
            return;
        }
        log.info("Configuration changed, applying updates...");

        serverRegistry.replaceAll(ServerRegistry.fromConfig(newConfig.getServers()));

        if (!oldConfig.getHealthCheck().equals(newConfig.getHealthCheck())) {
            ServerHealthChecker previous = healthChecker;
            healthChecker = createHealthChecker(newConfig);
            if (previous != null) {
                previous.close();
            }
            if (healthChecker != null && started) {
                healthChecker.start();
            }
        }

        RouterConfig.KvAwareConfig oldKv = oldConfig.getPicker().getKvAware();
        RouterConfig.KvAwareConfig newKv = newConfig.getPicker().getKvAware();
        boolean controllerChanged = !Objects.equals(oldKv.getControllerAddress(), newKv.getControllerAddress())
                || oldKv.getTimeoutMs() != newKv.getTimeoutMs()
                || oldKv.getFailureThreshold() != newKv.getFailureThreshold()
                || oldKv.getCooldownMs() != newKv.getCooldownMs();
        if (controllerChanged && cacheIndexOverride == null) {
            CacheIndexService previous = cacheIndex;
            cacheIndex = createCacheIndexClient(newConfig);
            closeQuietly(previous);
        }

        if (controllerChanged || pickerChanged(oldConfig.getPicker(), newConfig.getPicker())) {
            try {
                pipeline.setPicker(createConfiguredPicker(newConfig));
            } catch (ConfigLoader.ConfigurationException e) {
                log.error("Keeping picker {}: {}", pipeline.getPicker().getName(), e.getMessage());
            }
        }

        log.info("Configuration updates applied");
    }

    private static boolean pickerChanged(RouterConfig.PickerConfig oldPicker, RouterConfig.PickerConfig newPicker) {
        return !oldPicker.getType().equalsIgnoreCase(newPicker.getType())
                || oldPicker.getKvAware().getThreshold() != newPicker.getKvAware().getThreshold()
                || oldPicker.getPrefix().getChunkSize() != newPicker.getPrefix().getChunkSize()
                || oldPicker.getPrefix().getMaxNodes() != newPicker.getPrefix().getMaxNodes();
    }

    private static void closeQuietly(CacheIndexService service) {
        if (service instanceof AutoCloseable closeable) {
            try {
                closeable.close();
            } catch (Exception e) {
                log.warn("Error closing cache index client", e);
            }
        }
    }

    @Override
    public void close() {
        log.info("Shutting down RouterFactory...");

        try {
            pipeline.close();
        } catch (Exception e) {
            log.warn("Error closing pipeline", e);
        }

        ServerHealthChecker checker = healthChecker;
        if (checker != null) {
            checker.close();
        }

        if (cacheIndexOverride == null) {
            closeQuietly(cacheIndex);
        }

        try {
            metricsRegistry.close();
        } catch (Exception e) {
            log.warn("Error closing metrics registry", e);
        }

        log.info("RouterFactory shut down");
    }
}
