package fr.lapetina.kvrouter.infrastructure.metrics;

import fr.lapetina.kvrouter.domain.event.EventState;
import fr.lapetina.kvrouter.domain.model.DecisionPath;
import fr.lapetina.kvrouter.domain.model.ErrorType;
import fr.lapetina.kvrouter.domain.model.RoutingRequest;
import fr.lapetina.kvrouter.infrastructure.cacheindex.HttpCacheIndexClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class MetricsRegistryTest {

    private MetricsRegistry metrics;

    @BeforeEach
    void setUp() {
        metrics = new MetricsRegistry("kv_test");
    }

    @AfterEach
    void tearDown() {
        metrics.close();
    }

    @Test
    @DisplayName("should count decisions by picker and path")
    void decisions() {
        RoutingRequest request = RoutingRequest.ofPrompt("llama", "hi");
        metrics.pickObserver().onDecision("kvaware", DecisionPath.CACHE_HIT, request, null);
        metrics.pickObserver().onDecision("kvaware", DecisionPath.CACHE_HIT, request, null);
        metrics.pickObserver().onDecision("kvaware", DecisionPath.ROUND_ROBIN, request, null);

        assertThat(metrics.getRegistry().get("kv_test_decisions_total")
                .tag("picker", "kvaware").tag("path", "CACHE_HIT").counter().count()).isEqualTo(2.0);
        assertThat(metrics.scrape()).contains("kv_test_decisions_total");
    }

    @Test
    @DisplayName("should count cache index calls by outcome")
    void cacheIndexCalls() {
        metrics.cacheIndexRecorder().record("lookup", HttpCacheIndexClient.Outcome.TIMEOUT);

        assertThat(metrics.getRegistry().get("kv_test_cache_index_calls_total")
                .tag("operation", "lookup").tag("outcome", "TIMEOUT").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should record requests, errors and stage latency")
    void requestsAndErrors() {
        metrics.incrementRequestCount("llama", EventState.COMPLETED);
        metrics.incrementErrorCount("llama", ErrorType.VALIDATION_ERROR);
        metrics.recordStageLatency("pick", Duration.ofMillis(3));

        assertThat(metrics.getRegistry().get("kv_test_requests_total").counter().count()).isEqualTo(1.0);
        assertThat(metrics.getRegistry().get("kv_test_errors_total").tag("type", "VALIDATION_ERROR")
                .counter().count()).isEqualTo(1.0);
        assertThat(metrics.getRegistry().get("kv_test_stage_latency").tag("stage", "pick").timer().count())
                .isEqualTo(1);
    }

    @Test
    @DisplayName("gauges follow the latest value")
    void gauges() {
        metrics.setActiveServers(3);
        metrics.setRingBufferRemaining(60);

        assertThat(metrics.getRegistry().get("kv_test_active_servers").gauge().value()).isEqualTo(3.0);
        assertThat(metrics.getRegistry().get("kv_test_ringbuffer_remaining").gauge().value()).isEqualTo(60.0);
    }
}
