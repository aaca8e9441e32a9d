package fr.lapetina.kvrouter.domain.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a routing request. A response without a server and without an error is a
 * "no decision": the caller should proceed with its own primary choice.
 */
public record RoutingResponse(
        String requestId,
        String model,
        CandidateServer server,
        String picker,
        Instant createdAt,
        Instant completedAt,
        ErrorType errorType,
        String errorMessage
) {
    public RoutingResponse {
        Objects.requireNonNull(requestId, "Request ID is required");
        if (completedAt == null) {
            completedAt = Instant.now();
        }
    }

    public boolean isDecided() {
        return server != null;
    }

    public boolean isError() {
        return errorType != null;
    }

    public Optional<CandidateServer> selected() {
        return Optional.ofNullable(server);
    }

    public Duration latency() {
        return createdAt != null ? Duration.between(createdAt, completedAt) : Duration.ZERO;
    }

    public static RoutingResponse decided(RoutingRequest request, CandidateServer server, String picker) {
        return new RoutingResponse(request.requestId(), request.model(), server, picker,
                request.createdAt(), Instant.now(), null, null);
    }

    public static RoutingResponse noDecision(RoutingRequest request, String picker) {
        return new RoutingResponse(request.requestId(), request.model(), null, picker,
                request.createdAt(), Instant.now(), null, null);
    }

    public static RoutingResponse error(RoutingRequest request, ErrorType errorType, String message) {
        return new RoutingResponse(request.requestId(), request.model(), null, null,
                request.createdAt(), Instant.now(), errorType, message);
    }
}
