package fr.lapetina.kvrouter.domain.picker;

import fr.lapetina.kvrouter.domain.model.CandidateServer;

import java.util.Comparator;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Deterministic round-robin over candidates sorted by name.
 *
 * Sorting makes the choice independent of the order the caller lists candidates in, so
 * two routers with the same cursor value pick the same server. Thread-safe via an atomic
 * cursor; share one instance to share the rotation.
 */
public final class RoundRobinCursor {

    private static final Comparator<CandidateServer> BY_NAME = Comparator.comparing(CandidateServer::getName);

    private final AtomicLong cursor;

    public RoundRobinCursor(AtomicLong cursor) {
        this.cursor = cursor;
    }

    public RoundRobinCursor() {
        this(new AtomicLong());
    }

    /**
     * Advances the cursor and returns the candidate at its previous position.
     *
     * @param candidates non-empty candidate list, not modified
     */
    public CandidateServer next(List<CandidateServer> candidates) {
        if (candidates.isEmpty()) {
            throw new IllegalArgumentException("Round-robin needs at least one candidate");
        }
        List<CandidateServer> sorted = candidates.stream().sorted(BY_NAME).toList();
        int index = (int) Math.floorMod(cursor.getAndIncrement(), (long) sorted.size());
        return sorted.get(index);
    }

    public long position() {
        return cursor.get();
    }

    public void reset() {
        cursor.set(0);
    }
}
