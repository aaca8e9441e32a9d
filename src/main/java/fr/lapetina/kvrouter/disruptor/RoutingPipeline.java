package fr.lapetina.kvrouter.disruptor;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.BusySpinWaitStrategy;
import com.lmax.disruptor.ExceptionHandler;
import com.lmax.disruptor.InsufficientCapacityException;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.SleepingWaitStrategy;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.YieldingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import fr.lapetina.kvrouter.disruptor.exception.BackpressureException;
import fr.lapetina.kvrouter.disruptor.handlers.CandidateHandler;
import fr.lapetina.kvrouter.disruptor.handlers.CompletionHandler;
import fr.lapetina.kvrouter.disruptor.handlers.MetricsHandler;
import fr.lapetina.kvrouter.disruptor.handlers.PickHandler;
import fr.lapetina.kvrouter.disruptor.handlers.ValidationHandler;
import fr.lapetina.kvrouter.domain.event.RoutingEvent;
import fr.lapetina.kvrouter.domain.event.RoutingEventFactory;
import fr.lapetina.kvrouter.domain.model.RoutingRequest;
import fr.lapetina.kvrouter.domain.model.RoutingResponse;
import fr.lapetina.kvrouter.domain.picker.Picker;
import fr.lapetina.kvrouter.infrastructure.config.RouterConfig;
import fr.lapetina.kvrouter.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.kvrouter.infrastructure.registry.ServerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Disruptor pipeline turning routing requests into routing decisions.
 *
 * <pre>
 * Validation -> Candidates -> Pick (worker pool) -> Metrics -> Completion
 * </pre>
 *
 * MULTI producer: HTTP handler threads publish concurrently. A full ring buffer is reported
 * to the publisher as a {@link BackpressureException} instead of blocking it.
 *
 * The pick stage is a worker pool because the kvaware picker blocks on the cache-index
 * controller for up to its timeout; the other stages are cheap and single-threaded.
 */
public final class RoutingPipeline implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RoutingPipeline.class);

    private final Disruptor<RoutingEvent> disruptor;
    private final RingBuffer<RoutingEvent> ringBuffer;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicReference<Picker> pickerRef;
    private final MetricsRegistry metricsRegistry;

    private RoutingPipeline(Builder builder) {
        this.metricsRegistry = builder.metricsRegistry;
        this.pickerRef = new AtomicReference<>(builder.initialPicker);

        this.disruptor = new Disruptor<>(
                new RoutingEventFactory(),
                builder.ringBufferSize,
                new PipelineThreadFactory("router-pipeline"),
                ProducerType.MULTI,
                createWaitStrategy(builder.waitStrategy)
        );

        PickHandler[] pickWorkers = new PickHandler[builder.pickWorkers];
        for (int i = 0; i < pickWorkers.length; i++) {
            pickWorkers[i] = new PickHandler(pickerRef);
        }

        disruptor
                .handleEventsWith(new ValidationHandler(builder.allowedModels, builder.maxPromptLength))
                .then(new CandidateHandler(builder.serverRegistry))
                .thenHandleEventsWithWorkerPool(pickWorkers)
                .then(new MetricsHandler(builder.metricsRegistry))
                .then(new CompletionHandler());

        disruptor.setDefaultExceptionHandler(new PipelineExceptionHandler());

        this.ringBuffer = disruptor.getRingBuffer();

        log.info("RoutingPipeline created: ringBufferSize={}, waitStrategy={}, pickWorkers={}, picker={}",
                builder.ringBufferSize, builder.waitStrategy, builder.pickWorkers, builder.initialPicker.getName());
    }

    public void start() {
        if (running.compareAndSet(false, true)) {
            disruptor.start();
            metricsRegistry.setRingBufferRemaining((int) ringBuffer.remainingCapacity());
            log.info("RoutingPipeline started");
        }
    }

    /**
     * Submits a request for routing.
     *
     * @return future completed with the decision, or exceptionally if a stage blew up
     * @throws BackpressureException if the pipeline is stopped or the ring buffer is full
     */
    public CompletableFuture<RoutingResponse> submit(RoutingRequest request) {
        if (!running.get()) {
            throw BackpressureException.pipelineStopped();
        }

        CompletableFuture<RoutingResponse> responseFuture = new CompletableFuture<>();

        long sequence;
        try {
            sequence = ringBuffer.tryNext();
        } catch (InsufficientCapacityException e) {
            metricsRegistry.setRingBufferRemaining(0);
            throw BackpressureException.ringBufferFull(ringBuffer.remainingCapacity());
        }

        try {
            ringBuffer.get(sequence).initialize(request, responseFuture);
        } finally {
            ringBuffer.publish(sequence);
        }

        metricsRegistry.setRingBufferRemaining((int) ringBuffer.remainingCapacity());
        log.debug("Request submitted: requestId={}, sequence={}", request.requestId(), sequence);

        return responseFuture;
    }

    /**
     * Swaps the active picker. In-flight events finish with whichever picker their worker read.
     */
    public void setPicker(Picker picker) {
        Picker old = pickerRef.getAndSet(picker);
        log.info("Picker changed: {} -> {}", old.getName(), picker.getName());
    }

    public Picker getPicker() {
        return pickerRef.get();
    }

    public long getRemainingCapacity() {
        return ringBuffer.remainingCapacity();
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Drains published events, then stops the handler threads.
     */
    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            log.info("Shutting down RoutingPipeline...");
            try {
                disruptor.shutdown(30, TimeUnit.SECONDS);
                log.info("RoutingPipeline shut down gracefully");
            } catch (TimeoutException e) {
                log.warn("RoutingPipeline shutdown timed out, halting...");
                disruptor.halt();
            }
        }
    }

    private static WaitStrategy createWaitStrategy(String name) {
        return switch (name.toLowerCase()) {
            case "blocking" -> new BlockingWaitStrategy();
            case "yielding" -> new YieldingWaitStrategy();
            case "busy-spin" -> new BusySpinWaitStrategy();
            case "sleeping" -> new SleepingWaitStrategy();
            default -> {
                log.warn("Unknown wait strategy '{}', using BlockingWaitStrategy", name);
                yield new BlockingWaitStrategy();
            }
        };
    }

    public static Builder builder() {
        return new Builder();
    }

    private static class PipelineThreadFactory implements ThreadFactory {
        private final String namePrefix;
        private final AtomicInteger counter = new AtomicInteger(0);

        PipelineThreadFactory(String namePrefix) {
            this.namePrefix = namePrefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, namePrefix + "-" + counter.getAndIncrement());
            t.setDaemon(false);
            return t;
        }
    }

    /**
     * Fails the caller's future instead of letting a handler exception kill the stage.
     */
    private static class PipelineExceptionHandler implements ExceptionHandler<RoutingEvent> {

        private static final Logger log = LoggerFactory.getLogger(PipelineExceptionHandler.class);

        @Override
        public void handleEventException(Throwable ex, long sequence, RoutingEvent event) {
            log.error("Exception in event handler: sequence={}, event={}", sequence, event, ex);

            if (event.getResponseFuture() != null && !event.getResponseFuture().isDone()) {
                event.getResponseFuture().completeExceptionally(ex);
            }
        }

        @Override
        public void handleOnStartException(Throwable ex) {
            log.error("Exception during Disruptor start", ex);
        }

        @Override
        public void handleOnShutdownException(Throwable ex) {
            log.error("Exception during Disruptor shutdown", ex);
        }
    }

    public static final class Builder {
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";
        private int pickWorkers = 4;
        private int maxPromptLength = 1_000_000;
        private Set<String> allowedModels = Set.of();
        private ServerRegistry serverRegistry;
        private MetricsRegistry metricsRegistry;
        private Picker initialPicker;

        public Builder ringBufferSize(int size) {
            if (Integer.bitCount(size) != 1) {
                throw new IllegalArgumentException("Ring buffer size must be power of 2");
            }
            this.ringBufferSize = size;
            return this;
        }

        public Builder waitStrategy(String strategy) {
            this.waitStrategy = strategy;
            return this;
        }

        public Builder pickWorkers(int workers) {
            if (workers < 1) {
                throw new IllegalArgumentException("Pick workers must be positive");
            }
            this.pickWorkers = workers;
            return this;
        }

        public Builder maxPromptLength(int maxLength) {
            this.maxPromptLength = maxLength;
            return this;
        }

        public Builder allowedModels(Set<String> models) {
            this.allowedModels = models;
            return this;
        }

        public Builder serverRegistry(ServerRegistry registry) {
            this.serverRegistry = registry;
            return this;
        }

        public Builder metricsRegistry(MetricsRegistry registry) {
            this.metricsRegistry = registry;
            return this;
        }

        public Builder initialPicker(Picker picker) {
            this.initialPicker = picker;
            return this;
        }

        public Builder fromConfig(RouterConfig config) {
            ringBufferSize(config.getDisruptor().getRingBufferSize());
            pickWorkers(config.getDisruptor().getPickWorkers());
            this.waitStrategy = config.getDisruptor().getWaitStrategy();
            this.maxPromptLength = config.getValidation().getMaxPromptLength();
            this.allowedModels = config.getValidation().getAllowedModels();
            return this;
        }

        public RoutingPipeline build() {
            if (serverRegistry == null) {
                throw new IllegalStateException("ServerRegistry is required");
            }
            if (metricsRegistry == null) {
                throw new IllegalStateException("MetricsRegistry is required");
            }
            if (initialPicker == null) {
                throw new IllegalStateException("Initial Picker is required");
            }
            return new RoutingPipeline(this);
        }
    }
}
