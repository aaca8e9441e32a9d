package fr.lapetina.kvrouter.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import fr.lapetina.kvrouter.domain.model.RoutingRequest;

import java.util.ArrayList;
import java.util.List;

/**
 * Body of {@code POST /v1/route}. Message content follows the OpenAI chat format: either a
 * string or an array of {@code {"type", "text"}} parts.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class RouteRequest {

    private String model;
    private String prompt;
    private List<Message> messages;
    private List<String> candidates;

    @JsonProperty("request_id")
    private String requestId;

    public String getModel() { return model; }
    public void setModel(String model) { this.model = model; }

    public String getPrompt() { return prompt; }
    public void setPrompt(String prompt) { this.prompt = prompt; }

    public List<Message> getMessages() { return messages; }
    public void setMessages(List<Message> messages) { this.messages = messages; }

    public List<String> getCandidates() { return candidates; }
    public void setCandidates(List<String> candidates) { this.candidates = candidates; }

    public String getRequestId() { return requestId; }
    public void setRequestId(String requestId) { this.requestId = requestId; }

    /**
     * Converts to the domain request. A missing model becomes blank and is rejected by validation.
     *
     * @throws IllegalArgumentException if a message or candidate name is null, or a message has
     *                                  content that is neither a string nor an array
     */
    public RoutingRequest toRoutingRequest() {
        List<RoutingRequest.Message> domainMessages = null;
        if (messages != null) {
            domainMessages = new ArrayList<>(messages.size());
            for (Message message : messages) {
                if (message == null) {
                    throw new IllegalArgumentException("Messages must not contain null");
                }
                domainMessages.add(message.toDomain());
            }
        }
        if (candidates != null && candidates.contains(null)) {
            throw new IllegalArgumentException("Candidates must not contain null");
        }

        return RoutingRequest.builder()
                .requestId(requestId)
                .model(model != null ? model : "")
                .prompt(prompt)
                .messages(domainMessages)
                .candidates(candidates)
                .build();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Message {
        private String role;
        private JsonNode content;

        public String getRole() { return role; }
        public void setRole(String role) { this.role = role; }

        public JsonNode getContent() { return content; }
        public void setContent(JsonNode content) { this.content = content; }

        RoutingRequest.Message toDomain() {
            String messageRole = role != null ? role : "";
            if (content == null || content.isNull()) {
                return RoutingRequest.Message.text(messageRole, "");
            }
            if (content.isTextual()) {
                return RoutingRequest.Message.text(messageRole, content.asText());
            }
            if (content.isArray()) {
                List<RoutingRequest.ContentPart> parts = new ArrayList<>();
                for (JsonNode part : content) {
                    JsonNode text = part.get("text");
                    parts.add(new RoutingRequest.ContentPart(
                            part.path("type").asText(null),
                            text != null && text.isTextual() ? text.asText() : null));
                }
                return RoutingRequest.Message.parts(messageRole, parts);
            }
            throw new IllegalArgumentException("Message content must be a string or an array of parts");
        }
    }
}
