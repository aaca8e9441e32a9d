package fr.lapetina.kvrouter.domain.event;

import fr.lapetina.kvrouter.domain.model.CandidateServer;
import fr.lapetina.kvrouter.domain.model.ErrorType;
import fr.lapetina.kvrouter.domain.model.RoutingRequest;
import fr.lapetina.kvrouter.domain.model.RoutingResponse;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Mutable ring buffer slot carrying one routing request through the pipeline.
 *
 * Reused across requests: {@link #initialize} on publish, {@link #clear()} after completion.
 * Only pipeline handlers may touch it.
 */
public final class RoutingEvent {

    private RoutingRequest request;

    private EventState state;
    private List<CandidateServer> candidates = List.of();
    private CandidateServer selectedServer;
    private String pickerName;
    private ErrorType errorType;
    private String errorMessage;

    private Instant acceptedAt;
    private Instant validatedAt;
    private Instant candidatesResolvedAt;
    private Instant pickedAt;

    private CompletableFuture<RoutingResponse> responseFuture;

    private long sequence;

    public void clear() {
        this.request = null;
        this.state = null;
        this.candidates = List.of();
        this.selectedServer = null;
        this.pickerName = null;
        this.errorType = null;
        this.errorMessage = null;
        this.acceptedAt = null;
        this.validatedAt = null;
        this.candidatesResolvedAt = null;
        this.pickedAt = null;
        this.responseFuture = null;
        this.sequence = -1;
    }

    public void initialize(RoutingRequest request, CompletableFuture<RoutingResponse> responseFuture) {
        clear();
        this.request = request;
        this.responseFuture = responseFuture;
        this.state = EventState.CREATED;
        this.acceptedAt = Instant.now();
    }

    public RoutingRequest getRequest() {
        return request;
    }

    public EventState getState() {
        return state;
    }

    public List<CandidateServer> getCandidates() {
        return candidates;
    }

    public CandidateServer getSelectedServer() {
        return selectedServer;
    }

    public String getPickerName() {
        return pickerName;
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public Instant getAcceptedAt() {
        return acceptedAt;
    }

    public Instant getValidatedAt() {
        return validatedAt;
    }

    public Instant getCandidatesResolvedAt() {
        return candidatesResolvedAt;
    }

    public Instant getPickedAt() {
        return pickedAt;
    }

    public CompletableFuture<RoutingResponse> getResponseFuture() {
        return responseFuture;
    }

    public long getSequence() {
        return sequence;
    }

    public void setState(EventState state) {
        this.state = state;
    }

    public void setSequence(long sequence) {
        this.sequence = sequence;
    }

    public void setError(ErrorType errorType, String message) {
        this.errorType = errorType;
        this.errorMessage = message;
    }

    public void markValidated() {
        this.state = EventState.VALIDATED;
        this.validatedAt = Instant.now();
    }

    public void markCandidates(List<CandidateServer> candidates) {
        this.candidates = List.copyOf(candidates);
        this.state = candidates.isEmpty() ? EventState.NO_CANDIDATES : EventState.CANDIDATES_RESOLVED;
        this.candidatesResolvedAt = Instant.now();
    }

    public void markPicked(String pickerName, CandidateServer server) {
        this.pickerName = pickerName;
        this.selectedServer = server;
        this.state = server != null ? EventState.PICKED : EventState.NO_DECISION;
        this.pickedAt = Instant.now();
    }

    public void markFailed(ErrorType errorType, String message) {
        this.state = EventState.FAILED;
        this.errorType = errorType;
        this.errorMessage = message;
    }

    /**
     * Builds the response the caller receives for the current state.
     */
    public RoutingResponse toResponse() {
        if (errorType != null) {
            return RoutingResponse.error(request, errorType, errorMessage);
        }
        if (selectedServer != null) {
            return RoutingResponse.decided(request, selectedServer, pickerName);
        }
        return RoutingResponse.noDecision(request, pickerName);
    }

    /**
     * True once a stage has failed the request; later stages leave it alone.
     */
    public boolean shouldSkip() {
        return state == EventState.VALIDATION_FAILED || state == EventState.FAILED;
    }

    @Override
    public String toString() {
        return "RoutingEvent{" +
                "requestId=" + (request != null ? request.requestId() : "null") +
                ", state=" + state +
                ", server=" + (selectedServer != null ? selectedServer.getName() : "null") +
                ", picker=" + pickerName +
                ", seq=" + sequence +
                '}';
    }
}
