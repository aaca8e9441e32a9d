package fr.lapetina.kvrouter.domain.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Per-request routing context: the model and the prompt, either as plain text or as a
 * chat message list. Immutable and thread-safe.
 *
 * @param candidates optional server names the caller restricts the decision to; empty means
 *                   every routable server for the model
 */
public record RoutingRequest(
        String requestId,
        String model,
        String prompt,
        List<Message> messages,
        List<String> candidates,
        Instant createdAt
) {
    public RoutingRequest {
        Objects.requireNonNull(model, "Model is required");
        if (requestId == null) {
            requestId = UUID.randomUUID().toString();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        messages = messages != null ? List.copyOf(messages) : List.of();
        candidates = candidates != null ? List.copyOf(candidates) : List.of();
    }

    public boolean hasMessages() {
        return !messages.isEmpty();
    }

    /**
     * Chat message. Content is either plain {@code text} or a list of typed {@code parts};
     * exactly one of the two is set.
     */
    public record Message(String role, String text, List<ContentPart> parts) {
        public Message {
            Objects.requireNonNull(role, "Role is required");
            parts = parts != null ? List.copyOf(parts) : List.of();
        }

        public static Message text(String role, String text) {
            return new Message(role, Objects.requireNonNull(text, "Text is required"), null);
        }

        public static Message parts(String role, List<ContentPart> parts) {
            return new Message(role, null, parts);
        }

        public boolean isPlainText() {
            return text != null;
        }
    }

    /**
     * One element of a multi-part message. Only {@code "text"} parts carry prompt text.
     */
    public record ContentPart(String type, String text) {
        public static final String TEXT = "text";

        public static ContentPart text(String text) {
            return new ContentPart(TEXT, text);
        }

        public boolean isText() {
            return TEXT.equals(type) && text != null;
        }
    }

    public static RoutingRequest ofPrompt(String model, String prompt) {
        return new RoutingRequest(null, model, prompt, null, null, null);
    }

    public static RoutingRequest ofChat(String model, List<Message> messages) {
        return new RoutingRequest(null, model, null, messages, null, null);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String requestId;
        private String model;
        private String prompt;
        private List<Message> messages;
        private List<String> candidates;
        private Instant createdAt;

        public Builder requestId(String requestId) {
            this.requestId = requestId;
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder prompt(String prompt) {
            this.prompt = prompt;
            return this;
        }

        public Builder messages(List<Message> messages) {
            this.messages = messages;
            return this;
        }

        public Builder candidates(List<String> candidates) {
            this.candidates = candidates;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public RoutingRequest build() {
            return new RoutingRequest(requestId, model, prompt, messages, candidates, createdAt);
        }
    }
}
