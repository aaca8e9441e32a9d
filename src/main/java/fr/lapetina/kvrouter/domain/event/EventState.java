package fr.lapetina.kvrouter.domain.event;

/**
 * Lifecycle state of a routing event in the Disruptor pipeline.
 */
public enum EventState {
    /** Event just created, awaiting validation */
    CREATED,

    /** Request validated successfully */
    VALIDATED,

    /** Validation failed */
    VALIDATION_FAILED,

    /** At least one routable server was found */
    CANDIDATES_RESOLVED,

    /** No enabled, healthy server serves the model */
    NO_CANDIDATES,

    /** The picker chose a server */
    PICKED,

    /** The picker returned nothing */
    NO_DECISION,

    /** Caller's future completed with a response */
    COMPLETED,

    /** Processing failed unexpectedly */
    FAILED
}
