package fr.lapetina.kvrouter.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.kvrouter.domain.event.EventState;
import fr.lapetina.kvrouter.domain.event.RoutingEvent;
import fr.lapetina.kvrouter.domain.model.ErrorType;
import fr.lapetina.kvrouter.domain.model.RoutingRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;

/**
 * First stage handler: validates incoming routing requests.
 *
 * Validates:
 * - Model name is present and, if a whitelist is configured, allowed
 * - Prompt and message texts are within the length limit
 * - Every message has a role
 *
 * A request with neither prompt nor messages is valid; it routes on the empty prompt.
 */
public final class ValidationHandler implements EventHandler<RoutingEvent> {

    private static final Logger log = LoggerFactory.getLogger(ValidationHandler.class);

    private final Set<String> allowedModels;
    private final int maxPromptLength;

    public ValidationHandler(Set<String> allowedModels, int maxPromptLength) {
        this.allowedModels = allowedModels != null ? Set.copyOf(allowedModels) : Set.of();
        this.maxPromptLength = maxPromptLength;
    }

    @Override
    public void onEvent(RoutingEvent event, long sequence, boolean endOfBatch) {
        event.setSequence(sequence);
        RoutingRequest request = event.getRequest();

        try {
            validate(request);
            event.markValidated();

            log.debug("Request validated: requestId={}, model={}, sequence={}",
                    request.requestId(), request.model(), sequence);

        } catch (ValidationException e) {
            event.setState(EventState.VALIDATION_FAILED);
            event.setError(ErrorType.VALIDATION_ERROR, e.getMessage());

            log.warn("Validation failed: requestId={}, model={}, reason={}, sequence={}",
                    request != null ? request.requestId() : "null",
                    request != null ? request.model() : "null",
                    e.getMessage(),
                    sequence);
        }
    }

    void validate(RoutingRequest request) throws ValidationException {
        if (request == null) {
            throw new ValidationException("Request is null");
        }

        String model = request.model();
        if (model.isBlank()) {
            throw new ValidationException("Model name is required");
        }
        if (!allowedModels.isEmpty() && !allowedModels.contains(model)) {
            throw new ValidationException("Model not allowed: " + model);
        }

        checkLength(request.prompt(), "Prompt");

        for (RoutingRequest.Message message : request.messages()) {
            if (message.role().isBlank()) {
                throw new ValidationException("Message role is required");
            }
            checkLength(message.text(), "Message content");
            for (RoutingRequest.ContentPart part : message.parts()) {
                checkLength(part.text(), "Message content");
            }
        }
    }

    private void checkLength(String text, String what) throws ValidationException {
        if (text != null && text.length() > maxPromptLength) {
            throw new ValidationException(what + " exceeds maximum length of " + maxPromptLength);
        }
    }

    static class ValidationException extends Exception {
        ValidationException(String message) {
            super(message);
        }
    }
}
