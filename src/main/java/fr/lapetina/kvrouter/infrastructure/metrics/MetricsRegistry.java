package fr.lapetina.kvrouter.infrastructure.metrics;

import fr.lapetina.kvrouter.domain.event.EventState;
import fr.lapetina.kvrouter.domain.model.ErrorType;
import fr.lapetina.kvrouter.domain.picker.PickObserver;
import fr.lapetina.kvrouter.infrastructure.cacheindex.HttpCacheIndexClient;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer metrics for the router, exposed in Prometheus format.
 *
 * Provides:
 * - Picker decisions by picker and decision path
 * - Request and error counters per model
 * - Pipeline stage latency
 * - Cache-index controller call outcomes
 * - Active server and ring buffer gauges, JVM and system metrics
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    private final ConcurrentHashMap<String, Counter> decisionCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> requestCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> errorCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> cacheIndexCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> stageTimers = new ConcurrentHashMap<>();

    private final AtomicInteger ringBufferRemaining = new AtomicInteger(0);
    private final AtomicInteger activeServers = new AtomicInteger(0);

    public MetricsRegistry(String prefix) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        new JvmMemoryMetrics().bindTo(registry);
        new JvmGcMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);

        Gauge.builder(prefix + "_ringbuffer_remaining", ringBufferRemaining, AtomicInteger::get)
                .description("Remaining capacity in the ring buffer")
                .register(registry);

        Gauge.builder(prefix + "_active_servers", activeServers, AtomicInteger::get)
                .description("Number of enabled and healthy servers")
                .register(registry);

        log.info("MetricsRegistry initialized with prefix: {}", prefix);
    }

    public MetricsRegistry() {
        this("kv_router");
    }

    /**
     * Observer counting every picker decision by picker and path.
     */
    public PickObserver pickObserver() {
        return (picker, path, request, server) -> {
            String key = picker + ":" + path.name();
            decisionCounters.computeIfAbsent(key, k ->
                    Counter.builder(prefix + "_decisions_total")
                            .description("Routing decisions by picker and decision path")
                            .tag("picker", picker)
                            .tag("path", path.name())
                            .register(registry)
            ).increment();
        };
    }

    /**
     * Recorder counting cache-index controller calls by operation and outcome.
     */
    public HttpCacheIndexClient.CallRecorder cacheIndexRecorder() {
        return this::recordCacheIndexCall;
    }

    public void recordCacheIndexCall(String operation, HttpCacheIndexClient.Outcome outcome) {
        String key = operation + ":" + outcome.name();
        cacheIndexCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_cache_index_calls_total")
                        .description("Calls to the cache-index controller")
                        .tag("operation", operation)
                        .tag("outcome", outcome.name())
                        .register(registry)
        ).increment();
    }

    public void incrementRequestCount(String model, EventState state) {
        String key = model + ":" + state.name();
        requestCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_requests_total")
                        .description("Total number of routing requests")
                        .tag("model", model)
                        .tag("state", state.name())
                        .register(registry)
        ).increment();
    }

    /**
     * Records stage-specific latency (validation, candidates, pick).
     */
    public void recordStageLatency(String stage, Duration latency) {
        stageTimers.computeIfAbsent(stage, k ->
                Timer.builder(prefix + "_stage_latency")
                        .description("Pipeline stage latency")
                        .tag("stage", stage)
                        .publishPercentileHistogram()
                        .register(registry)
        ).record(latency);
    }

    public void incrementErrorCount(String model, ErrorType errorType) {
        String key = model + ":" + errorType.name();
        errorCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_errors_total")
                        .description("Total number of errors")
                        .tag("model", model)
                        .tag("type", errorType.name())
                        .register(registry)
        ).increment();
    }

    public void setRingBufferRemaining(int value) {
        ringBufferRemaining.set(value);
    }

    public void setActiveServers(int value) {
        activeServers.set(value);
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    public String getPrefix() {
        return prefix;
    }

    @Override
    public void close() {
        registry.close();
    }
}
