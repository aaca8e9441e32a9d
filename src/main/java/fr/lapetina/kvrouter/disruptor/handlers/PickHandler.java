package fr.lapetina.kvrouter.disruptor.handlers;

import com.lmax.disruptor.WorkHandler;
import fr.lapetina.kvrouter.domain.event.EventState;
import fr.lapetina.kvrouter.domain.event.RoutingEvent;
import fr.lapetina.kvrouter.domain.model.CandidateServer;
import fr.lapetina.kvrouter.domain.model.ErrorType;
import fr.lapetina.kvrouter.domain.model.RoutingRequest;
import fr.lapetina.kvrouter.domain.picker.Picker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Third stage handler: asks the active picker for a server.
 *
 * Runs as a worker pool; every worker shares the same picker reference, so a picker swap
 * is seen by the next event any worker takes. An empty pick is a "no decision", not an error.
 */
public final class PickHandler implements WorkHandler<RoutingEvent> {

    private static final Logger log = LoggerFactory.getLogger(PickHandler.class);

    private final AtomicReference<Picker> pickerRef;

    public PickHandler(AtomicReference<Picker> pickerRef) {
        this.pickerRef = pickerRef;
    }

    @Override
    public void onEvent(RoutingEvent event) {
        if (event.shouldSkip()) {
            return;
        }

        if (event.getState() != EventState.CANDIDATES_RESOLVED && event.getState() != EventState.NO_CANDIDATES) {
            return;
        }

        // Empty candidate lists still reach the picker; its observer counts NO_CANDIDATES
        Picker picker = pickerRef.get();

        RoutingRequest request = event.getRequest();
        try {
            Optional<CandidateServer> selected = picker.pick(request, event.getCandidates());
            event.markPicked(picker.getName(), selected.orElse(null));

            log.info("Routing decision: requestId={}, model={}, picker={}, server={}",
                    request.requestId(), request.model(), picker.getName(),
                    selected.map(CandidateServer::getName).orElse("none"));
        } catch (RuntimeException e) {
            event.markFailed(ErrorType.INTERNAL_ERROR, "Picker " + picker.getName() + " failed: " + e.getMessage());
            log.error("Picker failed: requestId={}, picker={}", request.requestId(), picker.getName(), e);
        }
    }
}
