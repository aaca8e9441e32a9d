package fr.lapetina.kvrouter.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import fr.lapetina.kvrouter.api.dto.RouteRequest;
import fr.lapetina.kvrouter.api.dto.RouteResponse;
import fr.lapetina.kvrouter.disruptor.RoutingPipeline;
import fr.lapetina.kvrouter.disruptor.exception.BackpressureException;
import fr.lapetina.kvrouter.domain.model.CandidateServer;
import fr.lapetina.kvrouter.domain.model.RoutingRequest;
import fr.lapetina.kvrouter.domain.model.RoutingResponse;
import fr.lapetina.kvrouter.domain.picker.Picker;
import fr.lapetina.kvrouter.domain.picker.PickerFactory;
import fr.lapetina.kvrouter.infrastructure.config.ConfigLoader;
import fr.lapetina.kvrouter.infrastructure.config.RouterConfig;
import fr.lapetina.kvrouter.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.kvrouter.infrastructure.registry.ServerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Lightweight HTTP server using JDK's built-in HttpServer.
 *
 * Endpoints:
 * - POST /v1/route - Route a request, returns the chosen server or "no decision"
 * - GET /v1/models - Models served by the available servers
 * - GET /health - Health check endpoint
 * - GET /metrics - Prometheus metrics endpoint
 * - GET /admin/servers - List all servers
 * - POST /admin/servers/{name}/enable - Enable a server
 * - POST /admin/servers/{name}/disable - Disable a server
 * - GET /admin/picker - Current and available pickers
 * - POST /admin/picker - Switch picker
 * - POST /admin/reload - Reload configuration
 */
public final class HttpServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    private static final long ROUTE_TIMEOUT_SECONDS = 30;
    private static final String SERVERS_PREFIX = "/admin/servers/";

    private final com.sun.net.httpserver.HttpServer server;
    private final ExecutorService executor;
    private final ObjectMapper objectMapper;
    private final RoutingPipeline pipeline;
    private final ServerRegistry serverRegistry;
    private final MetricsRegistry metricsRegistry;
    private final ConfigLoader configLoader;
    private final Function<String, Optional<Picker>> pickerCreator;

    public HttpServer(
            RouterConfig.ServerConfig serverConfig,
            RoutingPipeline pipeline,
            ServerRegistry serverRegistry,
            MetricsRegistry metricsRegistry,
            ConfigLoader configLoader,
            Function<String, Optional<Picker>> pickerCreator
    ) throws IOException {
        this.pipeline = pipeline;
        this.serverRegistry = serverRegistry;
        this.metricsRegistry = metricsRegistry;
        this.configLoader = configLoader;
        this.pickerCreator = pickerCreator;

        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule());

        this.server = com.sun.net.httpserver.HttpServer.create(
                new InetSocketAddress(serverConfig.getPort()), serverConfig.getBacklog()
        );

        this.executor = Executors.newFixedThreadPool(serverConfig.getThreads());
        server.setExecutor(executor);

        server.createContext("/v1/route", new RouteHandler());
        server.createContext("/v1/models", new ModelsHandler());
        server.createContext("/health", new HealthHandler());
        server.createContext("/metrics", new MetricsHandler());
        server.createContext("/admin", new AdminHandler());

        log.info("HTTP server configured on port {}", serverConfig.getPort());
    }

    public void start() {
        server.start();
        log.info("HTTP server started");
    }

    /**
     * Bound port; differs from the configured one when that was 0.
     */
    public int getPort() {
        return server.getAddress().getPort();
    }

    @Override
    public void close() {
        server.stop(5);
        executor.shutdown();
        log.info("HTTP server stopped");
    }

    // ==================== ROUTE HANDLER ====================

    private class RouteHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            try {
                if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
                    sendError(exchange, 405, "Method Not Allowed");
                    return;
                }

                RoutingRequest request;
                try (InputStream is = exchange.getRequestBody()) {
                    RouteRequest body = objectMapper.readValue(is, RouteRequest.class);
                    if (body == null) {
                        throw new IllegalArgumentException("Body must be a JSON object");
                    }
                    request = body.toRoutingRequest();
                } catch (JsonProcessingException | IllegalArgumentException e) {
                    sendError(exchange, 400, "Invalid request body: " + e.getMessage());
                    return;
                }
                MDC.put("requestId", request.requestId());
                MDC.put("model", request.model());

                CompletableFuture<RoutingResponse> future;
                try {
                    future = pipeline.submit(request);
                } catch (BackpressureException e) {
                    log.warn("Request rejected: requestId={}, reason={}", request.requestId(), e.getReason());
                    if (e.isRetryable()) {
                        exchange.getResponseHeaders().set("Retry-After", "1");
                    }
                    sendError(exchange, 503, e.getMessage());
                    return;
                }

                RoutingResponse response = future.get(ROUTE_TIMEOUT_SECONDS, TimeUnit.SECONDS);
                if (response.isError()) {
                    sendError(exchange, mapErrorToStatus(response), response.errorMessage());
                    return;
                }
                sendJson(exchange, 200, RouteResponse.fromRoutingResponse(response));

            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                sendError(exchange, 500, "Interrupted");
            } catch (ExecutionException | TimeoutException | RuntimeException e) {
                log.error("Error handling route request", e);
                sendError(exchange, 500, "Internal server error: " + e.getMessage());
            } finally {
                MDC.clear();
            }
        }

        private int mapErrorToStatus(RoutingResponse response) {
            return switch (response.errorType()) {
                case VALIDATION_ERROR -> 400;
                case CAPACITY_ERROR -> 503;
                case INTERNAL_ERROR -> 500;
            };
        }
    }

    // ==================== MODELS HANDLER ====================

    private class ModelsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }

            List<Map<String, Object>> data = new ArrayList<>();
            for (Map.Entry<String, List<String>> entry : serverRegistry.getServedModels().entrySet()) {
                Map<String, Object> card = new LinkedHashMap<>();
                card.put("id", entry.getKey());
                card.put("object", "model");
                card.put("owned_by", "vllm");
                card.put("servers", entry.getValue());
                data.add(card);
            }
            sendJson(exchange, 200, Map.of("object", "list", "data", data));
        }
    }

    // ==================== HEALTH HANDLER ====================

    private class HealthHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }

            int active = serverRegistry.getActiveCount();

            Map<String, Object> health = new LinkedHashMap<>();
            health.put("status", active > 0 && pipeline.isRunning() ? "UP" : "DOWN");
            health.put("timestamp", System.currentTimeMillis());
            health.put("servers", Map.of("registered", serverRegistry.size(), "active", active));

            Map<String, Object> pipelineStats = new LinkedHashMap<>();
            pipelineStats.put("running", pipeline.isRunning());
            pipelineStats.put("ringBufferRemaining", pipeline.getRemainingCapacity());
            pipelineStats.put("picker", pipeline.getPicker().getName());
            health.put("pipeline", pipelineStats);

            int statusCode = "UP".equals(health.get("status")) ? 200 : 503;
            sendJson(exchange, statusCode, health);
        }
    }

    // ==================== METRICS HANDLER ====================

    private class MetricsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }

            metricsRegistry.setRingBufferRemaining((int) pipeline.getRemainingCapacity());
            metricsRegistry.setActiveServers(serverRegistry.getActiveCount());

            String metrics = metricsRegistry.scrape();
            exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4");
            byte[] bytes = metrics.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        }
    }

    // ==================== ADMIN HANDLER ====================

    private class AdminHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            String path = exchange.getRequestURI().getPath();
            String rawPath = exchange.getRequestURI().getRawPath();
            String method = exchange.getRequestMethod();

            try {
                if (path.equals("/admin/servers") && "GET".equals(method)) {
                    handleListServers(exchange);
                } else if (path.startsWith(SERVERS_PREFIX) && path.endsWith("/enable") && "POST".equals(method)) {
                    handleServerAction(exchange, serverName(rawPath, "/enable"), true);
                } else if (path.startsWith(SERVERS_PREFIX) && path.endsWith("/disable") && "POST".equals(method)) {
                    handleServerAction(exchange, serverName(rawPath, "/disable"), false);
                } else if (path.equals("/admin/picker") && "POST".equals(method)) {
                    handleChangePicker(exchange);
                } else if (path.equals("/admin/picker") && "GET".equals(method)) {
                    handleGetPicker(exchange);
                } else if (path.equals("/admin/reload") && "POST".equals(method)) {
                    handleReloadConfig(exchange);
                } else {
                    sendError(exchange, 404, "Not Found");
                }
            } catch (IOException e) {
                throw e;
            } catch (RuntimeException e) {
                log.error("Error in admin handler", e);
                sendError(exchange, 500, e.getMessage());
            }
        }

        // Names may contain '/', e.g. namespace/pod
        private String serverName(String rawPath, String suffix) {
            String encoded = rawPath.substring(SERVERS_PREFIX.length(), rawPath.length() - suffix.length());
            return URLDecoder.decode(encoded, StandardCharsets.UTF_8);
        }

        private void handleListServers(HttpExchange exchange) throws IOException {
            List<Map<String, Object>> servers = new ArrayList<>();
            for (CandidateServer candidate : serverRegistry.getAllServers()) {
                Map<String, Object> info = new LinkedHashMap<>();
                info.put("name", candidate.getName());
                info.put("url", candidate.getEndpoint());
                info.put("address", candidate.getAddress());
                info.put("models", candidate.getModels());
                info.put("health", candidate.getHealth().name());
                info.put("enabled", candidate.isEnabled());
                servers.add(info);
            }
            sendJson(exchange, 200, servers);
        }

        private void handleServerAction(HttpExchange exchange, String name, boolean enable) throws IOException {
            if (serverRegistry.setEnabled(name, enable).isEmpty()) {
                sendError(exchange, 404, "Server not found: " + name);
                return;
            }

            sendJson(exchange, 200, Map.of(
                    "server", name,
                    "action", enable ? "enabled" : "disabled"
            ));
        }

        private void handleChangePicker(HttpExchange exchange) throws IOException {
            Map<?, ?> request;
            try (InputStream is = exchange.getRequestBody()) {
                request = objectMapper.readValue(is, Map.class);
            } catch (JsonProcessingException e) {
                sendError(exchange, 400, "Invalid request body: " + e.getOriginalMessage());
                return;
            }
            if (request == null) {
                sendError(exchange, 400, "Invalid request body: expected a JSON object");
                return;
            }

            Object pickerName = request.get("picker");
            if (!(pickerName instanceof String name) || name.isBlank()) {
                sendError(exchange, 400, "Missing 'picker' field");
                return;
            }

            Optional<Picker> picker;
            try {
                picker = pickerCreator.apply(name);
            } catch (IllegalStateException e) {
                sendError(exchange, 400, e.getMessage());
                return;
            }
            if (picker.isEmpty()) {
                sendError(exchange, 400, "Unknown picker: " + name +
                        ". Available: " + PickerFactory.getRegisteredNames());
                return;
            }

            pipeline.setPicker(picker.get());
            sendJson(exchange, 200, Map.of(
                    "picker", picker.get().getName(),
                    "message", "Picker changed successfully"
            ));
        }

        private void handleGetPicker(HttpExchange exchange) throws IOException {
            sendJson(exchange, 200, Map.of(
                    "current", pipeline.getPicker().getName(),
                    "available", PickerFactory.getRegisteredNames()
            ));
        }

        private void handleReloadConfig(HttpExchange exchange) throws IOException {
            RouterConfig newConfig = configLoader.reload();
            sendJson(exchange, 200, Map.of(
                    "message", "Configuration reloaded",
                    "servers", newConfig.getServers().size(),
                    "picker", pipeline.getPicker().getName()
            ));
        }
    }

    // ==================== HELPER METHODS ====================

    private void sendJson(HttpExchange exchange, int statusCode, Object body) throws IOException {
        byte[] bytes = objectMapper.writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(statusCode, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private void sendError(HttpExchange exchange, int statusCode, String message) throws IOException {
        Map<String, String> error = Map.of("error", message != null ? message : "Unknown error");
        sendJson(exchange, statusCode, error);
    }
}
