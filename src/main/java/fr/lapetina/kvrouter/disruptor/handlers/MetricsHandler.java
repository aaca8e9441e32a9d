package fr.lapetina.kvrouter.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.kvrouter.domain.event.RoutingEvent;
import fr.lapetina.kvrouter.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.time.Instant;

/**
 * Fourth stage handler: records metrics with the request's MDC context set.
 */
public final class MetricsHandler implements EventHandler<RoutingEvent> {

    private static final Logger log = LoggerFactory.getLogger(MetricsHandler.class);

    private final MetricsRegistry metricsRegistry;

    public MetricsHandler(MetricsRegistry metricsRegistry) {
        this.metricsRegistry = metricsRegistry;
    }

    @Override
    public void onEvent(RoutingEvent event, long sequence, boolean endOfBatch) {
        setupMDC(event);

        try {
            recordMetrics(event);
        } finally {
            clearMDC();
        }
    }

    private void setupMDC(RoutingEvent event) {
        if (event.getRequest() != null) {
            MDC.put("requestId", event.getRequest().requestId());
            MDC.put("model", event.getRequest().model());
        }
        if (event.getSelectedServer() != null) {
            MDC.put("server", event.getSelectedServer().getName());
        }
        if (event.getPickerName() != null) {
            MDC.put("picker", event.getPickerName());
        }
    }

    private void clearMDC() {
        MDC.remove("requestId");
        MDC.remove("model");
        MDC.remove("server");
        MDC.remove("picker");
    }

    private void recordMetrics(RoutingEvent event) {
        String model = event.getRequest() != null ? event.getRequest().model() : "unknown";

        if (event.getState() != null) {
            metricsRegistry.incrementRequestCount(model, event.getState());
        }

        recordStage("validation", event.getAcceptedAt(), event.getValidatedAt());
        recordStage("candidates", event.getValidatedAt(), event.getCandidatesResolvedAt());
        recordStage("pick", event.getCandidatesResolvedAt(), event.getPickedAt());
        if (event.getAcceptedAt() != null) {
            metricsRegistry.recordStageLatency("total", Duration.between(event.getAcceptedAt(), Instant.now()));
        }

        if (event.getErrorType() != null) {
            metricsRegistry.incrementErrorCount(model, event.getErrorType());

            log.warn("Request error recorded: model={}, errorType={}, message={}",
                    model, event.getErrorType(), event.getErrorMessage());
        }
    }

    private void recordStage(String stage, Instant start, Instant end) {
        if (start != null && end != null) {
            metricsRegistry.recordStageLatency(stage, Duration.between(start, end));
        }
    }
}
