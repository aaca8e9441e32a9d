package fr.lapetina.kvrouter.domain.picker;

import fr.lapetina.kvrouter.domain.model.CandidateServer;
import fr.lapetina.kvrouter.domain.model.RoutingRequest;

import java.util.List;
import java.util.Optional;

/**
 * Chooses one server among already-scored candidates for a request.
 *
 * Implementations must be thread-safe: {@code pick} is called concurrently for
 * independent in-flight requests. The candidate list is read-only and owned by the caller.
 */
public interface Picker {

    /**
     * Returns the name of this picker for configuration and metrics.
     */
    String getName();

    /**
     * Picks the target server.
     *
     * @param request    The routing context (model and prompt)
     * @param candidates Servers eligible for this request
     * @return Chosen server; empty only when {@code candidates} is empty
     */
    Optional<CandidateServer> pick(RoutingRequest request, List<CandidateServer> candidates);

    /**
     * Drops learned state such as prefix history or cached instance mappings.
     */
    default void reset() {
        // Default no-op
    }
}
