package fr.lapetina.kvrouter.domain.model;

/**
 * How a picker arrived at its decision. Reported to observers and metrics.
 */
public enum DecisionPath {
    /** Cache-index controller reported a long enough prefix on a current candidate */
    CACHE_HIT,

    /** Local trie matched a previously routed prefix */
    PREFIX_MATCH,

    /** Deterministic round-robin over the sorted candidates */
    ROUND_ROBIN,

    /** Uniform random choice over all candidates */
    RANDOM,

    /** Caller supplied no candidates, no decision made */
    NO_CANDIDATES
}
