package fr.lapetina.kvrouter.domain.prompt;

import fr.lapetina.kvrouter.domain.model.RoutingRequest;

import java.util.ArrayList;
import java.util.List;

/**
 * Flattens a routing request into the single string the pickers match on.
 *
 * Message text and text-typed parts are joined with newlines in order. Non-text parts are
 * dropped. When the messages produce nothing the plain prompt is used instead.
 */
public final class PromptExtractor {

    private static final String SEPARATOR = "\n";

    private PromptExtractor() {
        // Utility class
    }

    public static String extract(RoutingRequest request) {
        if (request.hasMessages()) {
            String flattened = flatten(request.messages());
            if (!flattened.isEmpty()) {
                return flattened;
            }
        }
        return request.prompt() != null ? request.prompt() : "";
    }

    static String flatten(List<RoutingRequest.Message> messages) {
        List<String> parts = new ArrayList<>();
        for (RoutingRequest.Message message : messages) {
            if (message.isPlainText()) {
                parts.add(message.text());
                continue;
            }
            for (RoutingRequest.ContentPart part : message.parts()) {
                if (part.isText()) {
                    parts.add(part.text());
                }
            }
        }
        return String.join(SEPARATOR, parts);
    }
}
