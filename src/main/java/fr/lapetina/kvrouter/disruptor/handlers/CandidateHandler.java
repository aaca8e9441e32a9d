package fr.lapetina.kvrouter.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.kvrouter.domain.event.EventState;
import fr.lapetina.kvrouter.domain.event.RoutingEvent;
import fr.lapetina.kvrouter.domain.model.CandidateServer;
import fr.lapetina.kvrouter.domain.model.RoutingRequest;
import fr.lapetina.kvrouter.infrastructure.registry.ServerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Second stage handler: resolves the servers the picker may choose from.
 *
 * Candidates are registry servers that are enabled, UP and serve the requested model,
 * restricted to the names the caller listed in {@link RoutingRequest#candidates()}.
 */
public final class CandidateHandler implements EventHandler<RoutingEvent> {

    private static final Logger log = LoggerFactory.getLogger(CandidateHandler.class);

    private final ServerRegistry serverRegistry;

    public CandidateHandler(ServerRegistry serverRegistry) {
        this.serverRegistry = serverRegistry;
    }

    @Override
    public void onEvent(RoutingEvent event, long sequence, boolean endOfBatch) {
        if (event.shouldSkip() || event.getState() != EventState.VALIDATED) {
            return;
        }

        RoutingRequest request = event.getRequest();
        List<CandidateServer> candidates = serverRegistry.getCandidates(request.model(), request.candidates());
        event.markCandidates(candidates);

        if (candidates.isEmpty()) {
            log.warn("No candidate servers: requestId={}, model={}, registered={}, restrictedTo={}",
                    request.requestId(), request.model(), serverRegistry.size(), request.candidates());
        } else {
            log.debug("Candidates resolved: requestId={}, model={}, count={}",
                    request.requestId(), request.model(), candidates.size());
        }
    }
}
