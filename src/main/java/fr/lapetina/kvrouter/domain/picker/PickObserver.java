package fr.lapetina.kvrouter.domain.picker;

import fr.lapetina.kvrouter.domain.model.CandidateServer;
import fr.lapetina.kvrouter.domain.model.DecisionPath;
import fr.lapetina.kvrouter.domain.model.RoutingRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Callback told about every picker decision.
 */
@FunctionalInterface
public interface PickObserver {

    PickObserver NOOP = (picker, path, request, server) -> { };

    /**
     * @param server chosen server, or null for {@link DecisionPath#NO_CANDIDATES}
     */
    void onDecision(String picker, DecisionPath path, RoutingRequest request, CandidateServer server);

    /**
     * Notifies {@code observer}, logging and discarding anything it throws.
     */
    static void notifySafely(PickObserver observer, String picker, DecisionPath path,
                             RoutingRequest request, CandidateServer server) {
        try {
            observer.onDecision(picker, path, request, server);
        } catch (RuntimeException e) {
            Logger log = LoggerFactory.getLogger(PickObserver.class);
            log.warn("Pick observer failed: picker={}, path={}, requestId={}",
                    picker, path, request.requestId(), e);
        }
    }
}
