package fr.lapetina.kvrouter.domain.picker;

import fr.lapetina.kvrouter.domain.model.CandidateServer;
import fr.lapetina.kvrouter.domain.model.DecisionPath;
import fr.lapetina.kvrouter.domain.model.RoutingRequest;

import java.util.List;
import java.util.Optional;

/**
 * Cache-oblivious baseline: plain round-robin over the sorted candidates.
 *
 * Uses the same cursor semantics as the KV-aware fallback, so the two can be compared
 * directly.
 */
public final class RoundRobinPicker implements Picker {

    private final RoundRobinCursor cursor;
    private final PickObserver observer;

    public RoundRobinPicker(RoundRobinCursor cursor, PickObserver observer) {
        this.cursor = cursor;
        this.observer = observer;
    }

    public RoundRobinPicker() {
        this(new RoundRobinCursor(), PickObserver.NOOP);
    }

    @Override
    public String getName() {
        return "roundrobin";
    }

    @Override
    public Optional<CandidateServer> pick(RoutingRequest request, List<CandidateServer> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            PickObserver.notifySafely(observer, getName(), DecisionPath.NO_CANDIDATES, request, null);
            return Optional.empty();
        }
        CandidateServer selected = cursor.next(candidates);
        PickObserver.notifySafely(observer, getName(), DecisionPath.ROUND_ROBIN, request, selected);
        return Optional.of(selected);
    }

    @Override
    public void reset() {
        cursor.reset();
    }
}
