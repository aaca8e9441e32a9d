package fr.lapetina.kvrouter.domain.prompt;

import fr.lapetina.kvrouter.domain.model.RoutingRequest;
import fr.lapetina.kvrouter.domain.model.RoutingRequest.ContentPart;
import fr.lapetina.kvrouter.domain.model.RoutingRequest.Message;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PromptExtractorTest {

    @Test
    @DisplayName("should use the plain prompt when there are no messages")
    void plainPrompt() {
        assertThat(PromptExtractor.extract(RoutingRequest.ofPrompt("llama", "Hello there")))
                .isEqualTo("Hello there");
    }

    @Test
    @DisplayName("missing prompt is the empty string")
    void missingPrompt() {
        assertThat(PromptExtractor.extract(RoutingRequest.ofPrompt("llama", null))).isEmpty();
    }

    @Test
    @DisplayName("should join message texts with newlines in order")
    void joinsMessages() {
        RoutingRequest request = RoutingRequest.ofChat("llama", List.of(
                Message.text("system", "You are helpful."),
                Message.text("user", "Hi")
        ));

        assertThat(PromptExtractor.extract(request)).isEqualTo("You are helpful.\nHi");
    }

    @Test
    @DisplayName("should keep text parts and drop other part types")
    void keepsTextParts() {
        RoutingRequest request = RoutingRequest.ofChat("llama", List.of(
                Message.parts("user", List.of(
                        ContentPart.text("Describe"),
                        new ContentPart("image_url", null),
                        ContentPart.text("this image")
                )),
                Message.text("assistant", "Sure")
        ));

        assertThat(PromptExtractor.extract(request)).isEqualTo("Describe\nthis image\nSure");
    }

    @Test
    @DisplayName("should fall back to the prompt when messages carry no text")
    void fallsBackToPrompt() {
        RoutingRequest request = RoutingRequest.builder()
                .model("llama")
                .prompt("fallback")
                .messages(List.of(Message.parts("user", List.of(new ContentPart("image_url", null)))))
                .build();

        assertThat(PromptExtractor.extract(request)).isEqualTo("fallback");
    }
}
