package fr.lapetina.kvrouter.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.kvrouter.domain.event.EventState;
import fr.lapetina.kvrouter.domain.event.RoutingEvent;
import fr.lapetina.kvrouter.domain.model.RoutingResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;

/**
 * Final stage handler: hands the response to the caller and clears the event for reuse.
 */
public final class CompletionHandler implements EventHandler<RoutingEvent> {

    private static final Logger log = LoggerFactory.getLogger(CompletionHandler.class);

    @Override
    public void onEvent(RoutingEvent event, long sequence, boolean endOfBatch) {
        try {
            complete(event);
        } finally {
            event.clear();
        }
    }

    private void complete(RoutingEvent event) {
        CompletableFuture<RoutingResponse> future = event.getResponseFuture();
        if (event.getRequest() == null || future == null || future.isDone()) {
            return;
        }

        RoutingResponse response = event.toResponse();
        event.setState(EventState.COMPLETED);
        future.complete(response);

        if (response.isError()) {
            log.debug("Request rejected: requestId={}, errorType={}, latencyMs={}",
                    response.requestId(), response.errorType(), response.latency().toMillis());
        } else {
            log.debug("Request completed: requestId={}, decided={}, latencyMs={}",
                    response.requestId(), response.isDecided(), response.latency().toMillis());
        }
    }
}
