package fr.lapetina.kvrouter.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.kvrouter.KvRouterApplication;
import fr.lapetina.kvrouter.disruptor.RoutingPipeline;
import fr.lapetina.kvrouter.domain.model.CandidateServer;
import fr.lapetina.kvrouter.domain.model.RoutingRequest;
import fr.lapetina.kvrouter.domain.model.RoutingResponse;
import fr.lapetina.kvrouter.domain.picker.Picker;
import fr.lapetina.kvrouter.infrastructure.config.ConfigLoader;
import fr.lapetina.kvrouter.infrastructure.config.RouterConfig;
import fr.lapetina.kvrouter.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.kvrouter.infrastructure.registry.ServerRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * End-to-end tests over HTTP against a router bound to an ephemeral port.
 */
class HttpServerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final HttpClient client = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build();

    private KvRouterApplication app;
    private String baseUrl;

    @BeforeEach
    void setUp() throws Exception {
        app = new KvRouterApplication("test-config.yaml");
        app.start();
        baseUrl = "http://127.0.0.1:" + app.getPort();
    }

    @AfterEach
    void tearDown() {
        if (app != null) {
            app.close();
        }
    }

    private HttpResponse<String> get(String path) throws Exception {
        return client.send(HttpRequest.newBuilder(URI.create(baseUrl + path)).GET().build(),
                HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> post(String path, String body) throws Exception {
        return client.send(HttpRequest.newBuilder(URI.create(baseUrl + path))
                        .header("Content-Type", "application/json")
                        .POST(HttpRequest.BodyPublishers.ofString(body))
                        .build(),
                HttpResponse.BodyHandlers.ofString());
    }

    private JsonNode json(HttpResponse<String> response) throws Exception {
        return objectMapper.readTree(response.body());
    }

    @Nested
    @DisplayName("POST /v1/route")
    class RouteTests {

        @Test
        @DisplayName("should return the chosen server")
        void routesPrompt() throws Exception {
            HttpResponse<String> response = post("/v1/route",
                    "{\"model\":\"llama\",\"prompt\":\"hello there\",\"request_id\":\"req-1\"}");

            assertThat(response.statusCode()).isEqualTo(200);
            JsonNode body = json(response);
            assertThat(body.get("request_id").asText()).isEqualTo("req-1");
            assertThat(body.get("decided").asBoolean()).isTrue();
            assertThat(body.get("picker").asText()).isEqualTo("prefixmatch");
            assertThat(body.get("server").get("name").asText())
                    .isIn("ns/server-a", "ns/server-b", "ns/server-c");
        }

        @Test
        @DisplayName("should accept chat messages with content parts")
        void routesChat() throws Exception {
            String body = "{\"model\":\"mistral\",\"messages\":["
                    + "{\"role\":\"system\",\"content\":\"be brief\"},"
                    + "{\"role\":\"user\",\"content\":[{\"type\":\"text\",\"text\":\"hi\"},"
                    + "{\"type\":\"image_url\",\"image_url\":{\"url\":\"x\"}}]}]}";

            HttpResponse<String> response = post("/v1/route", body);

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(json(response).get("server").get("name").asText()).isEqualTo("ns/server-c");
        }

        @Test
        @DisplayName("should answer no decision for an unserved model")
        void noDecision() throws Exception {
            HttpResponse<String> response = post("/v1/route", "{\"model\":\"gpt\",\"prompt\":\"hi\"}");

            assertThat(response.statusCode()).isEqualTo(200);
            JsonNode body = json(response);
            assertThat(body.get("decided").asBoolean()).isFalse();
            assertThat(body.has("server")).isFalse();
        }

        @Test
        @DisplayName("should reject malformed JSON")
        void malformed() throws Exception {
            assertThat(post("/v1/route", "{not json").statusCode()).isEqualTo(400);
        }

        @Test
        @DisplayName("should reject a JSON null body")
        void nullBody() throws Exception {
            HttpResponse<String> response = post("/v1/route", "null");

            assertThat(response.statusCode()).isEqualTo(400);
            assertThat(json(response).get("error").asText()).contains("JSON object");
        }

        @Test
        @DisplayName("should reject a null message")
        void nullMessage() throws Exception {
            HttpResponse<String> response = post("/v1/route", "{\"model\":\"llama\",\"messages\":[null]}");

            assertThat(response.statusCode()).isEqualTo(400);
            assertThat(json(response).get("error").asText()).contains("Messages must not contain null");
        }

        @Test
        @DisplayName("should reject a null candidate name")
        void nullCandidate() throws Exception {
            HttpResponse<String> response = post("/v1/route", "{\"model\":\"llama\",\"candidates\":[null]}");

            assertThat(response.statusCode()).isEqualTo(400);
            assertThat(json(response).get("error").asText()).contains("Candidates must not contain null");
        }

        @Test
        @DisplayName("should reject a request without model")
        void missingModel() throws Exception {
            HttpResponse<String> response = post("/v1/route", "{\"prompt\":\"hi\"}");

            assertThat(response.statusCode()).isEqualTo(400);
            assertThat(json(response).get("error").asText()).contains("Model");
        }

        @Test
        @DisplayName("should refuse other methods")
        void wrongMethod() throws Exception {
            assertThat(get("/v1/route").statusCode()).isEqualTo(405);
        }
    }

    @Test
    @DisplayName("GET /health reports the pipeline")
    void health() throws Exception {
        HttpResponse<String> response = get("/health");

        assertThat(response.statusCode()).isEqualTo(200);
        JsonNode body = json(response);
        assertThat(body.get("status").asText()).isEqualTo("UP");
        assertThat(body.get("servers").get("active").asInt()).isEqualTo(3);
        assertThat(body.get("pipeline").get("picker").asText()).isEqualTo("prefixmatch");
    }

    @Test
    @DisplayName("GET /v1/models lists the models of the available servers")
    void models() throws Exception {
        post("/admin/servers/ns%2Fserver-c/disable", "");

        HttpResponse<String> response = get("/v1/models");

        assertThat(response.statusCode()).isEqualTo(200);
        JsonNode body = json(response);
        assertThat(body.get("object").asText()).isEqualTo("list");
        assertThat(body.get("data")).hasSize(1);
        JsonNode llama = body.get("data").get(0);
        assertThat(llama.get("id").asText()).isEqualTo("llama");
        assertThat(llama.get("object").asText()).isEqualTo("model");
        assertThat(llama.get("servers").toString()).isEqualTo("[\"ns/server-a\",\"ns/server-b\"]");
    }

    @Test
    @DisplayName("GET /metrics exposes decision counters")
    void metrics() throws Exception {
        post("/v1/route", "{\"model\":\"llama\",\"prompt\":\"hello\"}");

        HttpResponse<String> response = get("/metrics");

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.body()).contains("kv_router_test_decisions_total");
    }

    @Nested
    @DisplayName("admin")
    class AdminTests {

        @Test
        @DisplayName("should disable a server whose name contains a slash")
        void disableServer() throws Exception {
            assertThat(post("/admin/servers/ns%2Fserver-a/disable", "").statusCode()).isEqualTo(200);
            assertThat(post("/admin/servers/ns/server-b/disable", "").statusCode()).isEqualTo(200);

            JsonNode servers = json(get("/admin/servers"));
            for (JsonNode server : servers) {
                String name = server.get("name").asText();
                if (name.equals("ns/server-a") || name.equals("ns/server-b")) {
                    assertThat(server.get("enabled").asBoolean()).isFalse();
                }
            }

            for (int i = 0; i < 5; i++) {
                HttpResponse<String> routed = post("/v1/route", "{\"model\":\"llama\",\"prompt\":\"p" + i + "\"}");
                assertThat(json(routed).get("server").get("name").asText()).isEqualTo("ns/server-c");
            }
        }

        @Test
        @DisplayName("should answer 404 for an unknown server")
        void unknownServer() throws Exception {
            assertThat(post("/admin/servers/ns%2Fnope/enable", "").statusCode()).isEqualTo(404);
        }

        @Test
        @DisplayName("should switch the picker at runtime")
        void switchPicker() throws Exception {
            assertThat(post("/admin/picker", "{\"picker\":\"roundrobin\"}").statusCode()).isEqualTo(200);

            assertThat(json(get("/admin/picker")).get("current").asText()).isEqualTo("roundrobin");
            assertThat(json(post("/v1/route", "{\"model\":\"llama\",\"prompt\":\"x\"}")).get("picker").asText())
                    .isEqualTo("roundrobin");
        }

        @Test
        @DisplayName("should refuse kvaware without a controller")
        void kvAwareWithoutController() throws Exception {
            HttpResponse<String> response = post("/admin/picker", "{\"picker\":\"kvaware\"}");

            assertThat(response.statusCode()).isEqualTo(400);
            assertThat(json(get("/admin/picker")).get("current").asText()).isEqualTo("prefixmatch");
        }

        @Test
        @DisplayName("should refuse an unknown picker")
        void unknownPicker() throws Exception {
            assertThat(post("/admin/picker", "{\"picker\":\"magic\"}").statusCode()).isEqualTo(400);
            assertThat(post("/admin/picker", "{}").statusCode()).isEqualTo(400);
            assertThat(post("/admin/picker", "null").statusCode()).isEqualTo(400);
            assertThat(json(get("/admin/picker")).get("current").asText()).isEqualTo("prefixmatch");
        }

        @Test
        @DisplayName("should reload the configuration")
        void reload() throws Exception {
            post("/admin/servers/ns%2Fserver-a/disable", "");

            HttpResponse<String> response = post("/admin/reload", "");

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(json(response).get("servers").asInt()).isEqualTo(4);
            assertThat(json(get("/health")).get("servers").get("active").asInt()).isEqualTo(3);
        }
    }

    @Nested
    @DisplayName("backpressure")
    class BackpressureTests {

        private final CountDownLatch release = new CountDownLatch(1);
        private MetricsRegistry metrics;
        private RoutingPipeline pipeline;
        private HttpServer server;
        private String url;

        @BeforeEach
        void setUpSaturatedRouter() throws Exception {
            ServerRegistry registry = new ServerRegistry();
            registry.registerServer(CandidateServer.builder()
                    .name("ns/only")
                    .url("http://10.0.0.9:8000")
                    .addModel("llama")
                    .build());

            Picker blocking = new Picker() {
                @Override
                public String getName() {
                    return "blocking";
                }

                @Override
                public Optional<CandidateServer> pick(RoutingRequest request, List<CandidateServer> candidates) {
                    try {
                        release.await(10, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    return candidates.stream().findFirst();
                }
            };

            metrics = new MetricsRegistry("kv_router_backpressure");
            pipeline = RoutingPipeline.builder()
                    .ringBufferSize(1)
                    .pickWorkers(1)
                    .serverRegistry(registry)
                    .metricsRegistry(metrics)
                    .initialPicker(blocking)
                    .build();

            RouterConfig.ServerConfig serverConfig = new RouterConfig.ServerConfig();
            serverConfig.setPort(0);
            serverConfig.setThreads(2);
            server = new HttpServer(serverConfig, pipeline, registry, metrics,
                    new ConfigLoader("test-config.yaml"), name -> Optional.empty());
            server.start();
            url = "http://127.0.0.1:" + server.getPort();
        }

        @AfterEach
        void tearDownSaturatedRouter() {
            release.countDown();
            server.close();
            pipeline.close();
            metrics.close();
        }

        private HttpResponse<String> route() throws Exception {
            return client.send(HttpRequest.newBuilder(URI.create(url + "/v1/route"))
                            .POST(HttpRequest.BodyPublishers.ofString("{\"model\":\"llama\",\"prompt\":\"hi\"}"))
                            .build(),
                    HttpResponse.BodyHandlers.ofString());
        }

        @Test
        @DisplayName("should answer 503 with Retry-After when the ring buffer is full")
        void ringBufferFull() throws Exception {
            pipeline.start();
            CompletableFuture<RoutingResponse> inFlight = pipeline.submit(RoutingRequest.ofPrompt("llama", "first"));

            HttpResponse<String> response = route();

            assertThat(response.statusCode()).isEqualTo(503);
            assertThat(response.headers().firstValue("Retry-After")).contains("1");
            assertThat(json(response).get("error").asText()).contains("saturated");

            release.countDown();
            assertThat(inFlight.get(5, TimeUnit.SECONDS).server().getName()).isEqualTo("ns/only");
        }

        @Test
        @DisplayName("should answer 503 without Retry-After when the pipeline is not running")
        void pipelineStopped() throws Exception {
            HttpResponse<String> response = route();

            assertThat(response.statusCode()).isEqualTo(503);
            assertThat(response.headers().firstValue("Retry-After")).isEmpty();
            assertThat(json(response).get("error").asText()).contains("not running");
        }
    }
}
