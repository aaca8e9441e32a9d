package fr.lapetina.kvrouter.infrastructure.registry;

import fr.lapetina.kvrouter.domain.model.CandidateServer;
import fr.lapetina.kvrouter.domain.model.ServerHealth;
import fr.lapetina.kvrouter.infrastructure.config.RouterConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Background health checker for the static server pool.
 *
 * Periodically sends {@code GET {url}{path}} to every enabled server. A 2xx answer marks the
 * server UP; {@code failureThreshold} consecutive failures (non-2xx, timeout, connection error)
 * mark it DOWN, which removes it from the candidate lists until a later probe succeeds.
 */
public final class ServerHealthChecker implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ServerHealthChecker.class);

    private final ServerRegistry serverRegistry;
    private final HttpClient httpClient;
    private final ScheduledExecutorService scheduler;
    private final Duration checkInterval;
    private final Duration timeout;
    private final String path;
    private final int failureThreshold;
    private final Map<String, AtomicInteger> consecutiveFailures = new ConcurrentHashMap<>();
    private final AtomicBoolean running = new AtomicBoolean(false);

    public ServerHealthChecker(
            ServerRegistry serverRegistry,
            Duration checkInterval,
            Duration timeout,
            String path,
            int failureThreshold
    ) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("Failure threshold must be positive: " + failureThreshold);
        }
        this.serverRegistry = serverRegistry;
        this.checkInterval = checkInterval;
        this.timeout = timeout;
        this.path = path;
        this.failureThreshold = failureThreshold;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .version(HttpClient.Version.HTTP_1_1)
                .build();
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "health-checker");
            t.setDaemon(true);
            return t;
        });
    }

    public static ServerHealthChecker fromConfig(ServerRegistry serverRegistry, RouterConfig.HealthCheckConfig config) {
        return new ServerHealthChecker(
                serverRegistry,
                Duration.ofMillis(config.getIntervalMs()),
                Duration.ofMillis(config.getTimeoutMs()),
                config.getPath(),
                config.getFailureThreshold()
        );
    }

    /**
     * Starts the periodic health checking, first round immediately.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            scheduler.scheduleWithFixedDelay(
                    this::runCycle,
                    0,
                    checkInterval.toMillis(),
                    TimeUnit.MILLISECONDS
            );
            log.info("Health checker started: interval={}, path={}, failureThreshold={}",
                    checkInterval, path, failureThreshold);
        }
    }

    private void runCycle() {
        try {
            checkAllServers().join();
        } catch (RuntimeException e) {
            // An escaped exception would cancel the schedule
            log.error("Health check cycle failed", e);
        }
    }

    /**
     * Probes every enabled server once.
     *
     * @return completes when every probe has been applied to the registry
     */
    public CompletableFuture<Void> checkAllServers() {
        List<CandidateServer> enabled = serverRegistry.getAllServers().stream()
                .filter(CandidateServer::isEnabled)
                .toList();
        log.debug("Starting health check cycle: serverCount={}", enabled.size());

        Set<String> names = enabled.stream().map(CandidateServer::getName).collect(Collectors.toSet());
        consecutiveFailures.keySet().retainAll(names);

        return CompletableFuture.allOf(enabled.stream()
                .map(this::checkServer)
                .toArray(CompletableFuture[]::new));
    }

    /**
     * Probes one server and applies the outcome.
     *
     * @return whether the probe succeeded
     */
    public CompletableFuture<Boolean> checkServer(CandidateServer server) {
        URI uri = healthUri(server);
        HttpRequest request = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(timeout)
                .GET()
                .build();

        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.discarding())
                .thenApply(response -> {
                    boolean healthy = response.statusCode() >= 200 && response.statusCode() < 300;
                    if (!healthy) {
                        log.warn("Health check returned unhealthy: server={}, uri={}, status={}",
                                server.getName(), uri, response.statusCode());
                    }
                    return healthy;
                })
                .exceptionally(ex -> {
                    log.warn("Health check failed: server={}, uri={}, error={}",
                            server.getName(), uri, ex.getMessage());
                    return false;
                })
                .thenApply(healthy -> {
                    apply(server, healthy);
                    return healthy;
                });
    }

    private void apply(CandidateServer server, boolean healthy) {
        if (healthy) {
            consecutiveFailures.remove(server.getName());
            serverRegistry.updateHealth(server.getName(), ServerHealth.UP);
            return;
        }
        int failures = consecutiveFailures
                .computeIfAbsent(server.getName(), name -> new AtomicInteger())
                .incrementAndGet();
        if (failures >= failureThreshold) {
            serverRegistry.updateHealth(server.getName(), ServerHealth.DOWN);
        } else {
            log.debug("Health check failure below threshold: server={}, consecutiveFailures={}",
                    server.getName(), failures);
        }
    }

    private URI healthUri(CandidateServer server) {
        String base = server.getEndpoint();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return URI.create(base + path);
    }

    public int getConsecutiveFailures(String serverName) {
        AtomicInteger failures = consecutiveFailures.get(serverName);
        return failures != null ? failures.get() : 0;
    }

    public boolean isRunning() {
        return running.get();
    }

    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            log.info("Health checker stopped");
        }
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
