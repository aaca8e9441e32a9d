package fr.lapetina.kvrouter.infrastructure.config;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Root configuration object for the router.
 * Designed to be populated from YAML.
 */
public class RouterConfig {

    private ServerConfig server = new ServerConfig();
    private List<BackendConfig> servers = new ArrayList<>();
    private HealthCheckConfig healthCheck = new HealthCheckConfig();
    private PickerConfig picker = new PickerConfig();
    private DisruptorConfig disruptor = new DisruptorConfig();
    private ValidationConfig validation = new ValidationConfig();
    private MetricsConfig metrics = new MetricsConfig();

    public ServerConfig getServer() { return server; }
    public void setServer(ServerConfig server) { this.server = server; }

    public List<BackendConfig> getServers() { return servers; }
    public void setServers(List<BackendConfig> servers) { this.servers = servers; }

    public HealthCheckConfig getHealthCheck() { return healthCheck; }
    public void setHealthCheck(HealthCheckConfig healthCheck) { this.healthCheck = healthCheck; }

    public PickerConfig getPicker() { return picker; }
    public void setPicker(PickerConfig picker) { this.picker = picker; }

    public DisruptorConfig getDisruptor() { return disruptor; }
    public void setDisruptor(DisruptorConfig disruptor) { this.disruptor = disruptor; }

    public ValidationConfig getValidation() { return validation; }
    public void setValidation(ValidationConfig validation) { this.validation = validation; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * HTTP server configuration.
     */
    public static class ServerConfig {
        private int port = 8080;
        private int backlog = 100;
        private int threads = 16;

        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }

        public int getBacklog() { return backlog; }
        public void setBacklog(int backlog) { this.backlog = backlog; }

        public int getThreads() { return threads; }
        public void setThreads(int threads) { this.threads = threads; }
    }

    /**
     * One inference server in the static pool.
     */
    public static class BackendConfig {
        private String name;
        private String url;
        private String address;
        private Set<String> models = new HashSet<>();
        private boolean enabled = true;

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }

        /** Address the cache-index controller knows this server by; defaults to the URL host. */
        public String getAddress() { return address; }
        public void setAddress(String address) { this.address = address; }

        public Set<String> getModels() { return models; }
        public void setModels(Set<String> models) { this.models = models; }

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }

    /**
     * Periodic health probing of the static servers. Off by default.
     */
    public static class HealthCheckConfig {
        private boolean enabled = false;
        private long intervalMs = 60000;
        private long timeoutMs = 5000;
        private String path = "/health";
        private int failureThreshold = 1;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public long getIntervalMs() { return intervalMs; }
        public void setIntervalMs(long intervalMs) { this.intervalMs = intervalMs; }

        public long getTimeoutMs() { return timeoutMs; }
        public void setTimeoutMs(long timeoutMs) { this.timeoutMs = timeoutMs; }

        public String getPath() { return path; }
        public void setPath(String path) { this.path = path; }

        /** Consecutive failed probes before a server is marked DOWN. */
        public int getFailureThreshold() { return failureThreshold; }
        public void setFailureThreshold(int failureThreshold) { this.failureThreshold = failureThreshold; }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof HealthCheckConfig that)) return false;
            return enabled == that.enabled
                    && intervalMs == that.intervalMs
                    && timeoutMs == that.timeoutMs
                    && failureThreshold == that.failureThreshold
                    && Objects.equals(path, that.path);
        }

        @Override
        public int hashCode() {
            return Objects.hash(enabled, intervalMs, timeoutMs, path, failureThreshold);
        }
    }

    /**
     * Picker selection and tuning.
     */
    public static class PickerConfig {
        private String type = "prefixmatch";
        private KvAwareConfig kvAware = new KvAwareConfig();
        private PrefixConfig prefix = new PrefixConfig();

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }

        public KvAwareConfig getKvAware() { return kvAware; }
        public void setKvAware(KvAwareConfig kvAware) { this.kvAware = kvAware; }

        public PrefixConfig getPrefix() { return prefix; }
        public void setPrefix(PrefixConfig prefix) { this.prefix = prefix; }
    }

    /**
     * Cache-index controller settings for the kvaware picker.
     */
    public static class KvAwareConfig {
        private String controllerAddress;
        private int threshold = 0;
        private long timeoutMs = 2000;
        private int failureThreshold = 5;
        private long cooldownMs = 10000;

        public String getControllerAddress() { return controllerAddress; }
        public void setControllerAddress(String controllerAddress) { this.controllerAddress = controllerAddress; }

        public int getThreshold() { return threshold; }
        public void setThreshold(int threshold) { this.threshold = threshold; }

        public long getTimeoutMs() { return timeoutMs; }
        public void setTimeoutMs(long timeoutMs) { this.timeoutMs = timeoutMs; }

        public int getFailureThreshold() { return failureThreshold; }
        public void setFailureThreshold(int failureThreshold) { this.failureThreshold = failureThreshold; }

        public long getCooldownMs() { return cooldownMs; }
        public void setCooldownMs(long cooldownMs) { this.cooldownMs = cooldownMs; }
    }

    /**
     * Prefix trie settings for the prefixmatch picker.
     */
    public static class PrefixConfig {
        private int chunkSize = 128;
        private int maxNodes = 0;

        public int getChunkSize() { return chunkSize; }
        public void setChunkSize(int chunkSize) { this.chunkSize = chunkSize; }

        public int getMaxNodes() { return maxNodes; }
        public void setMaxNodes(int maxNodes) { this.maxNodes = maxNodes; }
    }

    /**
     * LMAX Disruptor configuration.
     */
    public static class DisruptorConfig {
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";
        private int pickWorkers = 4;

        public int getRingBufferSize() { return ringBufferSize; }
        public void setRingBufferSize(int ringBufferSize) { this.ringBufferSize = ringBufferSize; }

        public String getWaitStrategy() { return waitStrategy; }
        public void setWaitStrategy(String waitStrategy) { this.waitStrategy = waitStrategy; }

        /** Threads running the pick stage; kvaware lookups block on the controller. */
        public int getPickWorkers() { return pickWorkers; }
        public void setPickWorkers(int pickWorkers) { this.pickWorkers = pickWorkers; }
    }

    /**
     * Request validation configuration.
     */
    public static class ValidationConfig {
        private int maxPromptLength = 1_000_000;
        private Set<String> allowedModels = new HashSet<>();

        public int getMaxPromptLength() { return maxPromptLength; }
        public void setMaxPromptLength(int maxPromptLength) { this.maxPromptLength = maxPromptLength; }

        public Set<String> getAllowedModels() { return allowedModels; }
        public void setAllowedModels(Set<String> allowedModels) { this.allowedModels = allowedModels; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private String prefix = "kv_router";

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }
}
