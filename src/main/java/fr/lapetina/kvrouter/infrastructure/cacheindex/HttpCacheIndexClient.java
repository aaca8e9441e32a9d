package fr.lapetina.kvrouter.infrastructure.cacheindex;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.kvrouter.domain.cacheindex.CacheIndexService;
import fr.lapetina.kvrouter.domain.cacheindex.LookupResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Client for the cache-index controller.
 *
 * <pre>
 * POST /lookup          {"model": ..., "prompt": ...}  -> {"instance_id": ..., "tokens": n}
 * GET  /query?ip=ADDR                                  -> {"instance_id": ...}
 * </pre>
 *
 * Every call is bounded by the request timeout. Failures of any kind are logged and returned
 * as empty results. A {@link CircuitBreaker} short-circuits calls while the controller keeps
 * failing at the transport level or with 5xx statuses.
 */
public class HttpCacheIndexClient implements CacheIndexService, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HttpCacheIndexClient.class);

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(2);

    static final String LOOKUP = "lookup";
    static final String QUERY = "query";

    private final URI baseUri;
    private final Duration timeout;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final CircuitBreaker circuitBreaker;
    private final CallRecorder recorder;

    /**
     * Receives the outcome of every controller call, for metrics.
     */
    @FunctionalInterface
    public interface CallRecorder {
        CallRecorder NOOP = (operation, outcome) -> { };

        void record(String operation, Outcome outcome);
    }

    public enum Outcome {
        SUCCESS,
        NOT_FOUND,
        HTTP_ERROR,
        TIMEOUT,
        IO_ERROR,
        DECODE_ERROR,
        SHORT_CIRCUITED
    }

    public HttpCacheIndexClient(
            String controllerAddress,
            Duration timeout,
            CircuitBreaker circuitBreaker,
            CallRecorder recorder
    ) {
        this.baseUri = toBaseUri(controllerAddress);
        this.timeout = timeout;
        this.circuitBreaker = circuitBreaker;
        this.recorder = recorder != null ? recorder : CallRecorder.NOOP;

        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .version(HttpClient.Version.HTTP_1_1)
                .build();

        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public HttpCacheIndexClient(String controllerAddress) {
        this(controllerAddress, DEFAULT_TIMEOUT,
                new CircuitBreaker(controllerAddress, 5, Duration.ofSeconds(10)), CallRecorder.NOOP);
    }

    @Override
    public Optional<LookupResult> lookup(String model, String prompt) {
        String body;
        try {
            body = objectMapper.writeValueAsString(Map.of("model", model, "prompt", prompt));
        } catch (JsonProcessingException e) {
            log.warn("Failed to encode lookup request: model={}", model, e);
            return Optional.empty();
        }

        HttpRequest request = HttpRequest.newBuilder()
                .uri(baseUri.resolve("/lookup"))
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();

        return send(LOOKUP, request, LookupResponse.class)
                .map(response -> new LookupResult(response.instanceId(), response.tokens()));
    }

    @Override
    public Optional<String> resolveInstance(String address) {
        if (address == null || address.isBlank()) {
            return Optional.empty();
        }

        HttpRequest request = HttpRequest.newBuilder()
                .uri(baseUri.resolve("/query?ip=" + URLEncoder.encode(address, StandardCharsets.UTF_8)))
                .timeout(timeout)
                .GET()
                .build();

        return send(QUERY, request, QueryResponse.class)
                .map(QueryResponse::instanceId)
                .filter(id -> !id.isBlank());
    }

    private <T> Optional<T> send(String operation, HttpRequest request, Class<T> type) {
        if (!circuitBreaker.allowRequest()) {
            log.debug("Cache index call short-circuited: operation={}, uri={}", operation, request.uri());
            recorder.record(operation, Outcome.SHORT_CIRCUITED);
            return Optional.empty();
        }

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            circuitBreaker.recordFailure();
            recorder.record(operation, Outcome.TIMEOUT);
            log.warn("Cache index call timed out: operation={}, uri={}, timeoutMs={}",
                    operation, request.uri(), timeout.toMillis());
            return Optional.empty();
        } catch (IOException e) {
            circuitBreaker.recordFailure();
            recorder.record(operation, Outcome.IO_ERROR);
            log.warn("Cache index call failed: operation={}, uri={}, error={}",
                    operation, request.uri(), e.toString());
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            recorder.record(operation, Outcome.IO_ERROR);
            log.warn("Cache index call interrupted: operation={}, uri={}", operation, request.uri());
            return Optional.empty();
        }

        int status = response.statusCode();
        if (status >= 500) {
            circuitBreaker.recordFailure();
        } else {
            circuitBreaker.recordSuccess();
        }

        if (status < 200 || status >= 300) {
            recorder.record(operation, status == 404 ? Outcome.NOT_FOUND : Outcome.HTTP_ERROR);
            log.debug("Cache index returned non-success status: operation={}, uri={}, status={}",
                    operation, request.uri(), status);
            return Optional.empty();
        }

        try {
            T decoded = objectMapper.readValue(response.body(), type);
            if (decoded == null) {
                recorder.record(operation, Outcome.DECODE_ERROR);
                return Optional.empty();
            }
            recorder.record(operation, Outcome.SUCCESS);
            return Optional.of(decoded);
        } catch (JsonProcessingException e) {
            recorder.record(operation, Outcome.DECODE_ERROR);
            log.warn("Malformed cache index response: operation={}, uri={}, error={}",
                    operation, request.uri(), e.getOriginalMessage());
            return Optional.empty();
        }
    }

    private static URI toBaseUri(String controllerAddress) {
        if (controllerAddress == null || controllerAddress.isBlank()) {
            throw new IllegalArgumentException("Controller address is required");
        }
        String base = controllerAddress.contains("://") ? controllerAddress : "http://" + controllerAddress;
        return URI.create(base);
    }

    public URI getBaseUri() {
        return baseUri;
    }

    public CircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }

    @Override
    public void close() {
        // java.net.http.HttpClient has no close() before JDK 21; connections are released on GC
        log.debug("Cache index client closed: baseUri={}", baseUri);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record LookupResponse(
            @JsonProperty("instance_id") String instanceId,
            @JsonProperty("tokens") int tokens
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record QueryResponse(@JsonProperty("instance_id") String instanceId) {
        QueryResponse {
            if (instanceId == null) {
                instanceId = "";
            }
        }
    }
}
