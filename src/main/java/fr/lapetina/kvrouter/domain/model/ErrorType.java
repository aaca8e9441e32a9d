package fr.lapetina.kvrouter.domain.model;

/**
 * Error taxonomy for routing requests that could not be decided.
 *
 * Remote cache-index failures are not listed here: pickers absorb them
 * and fall back, so they never reach the caller as errors.
 */
public enum ErrorType {
    /** Request rejected before routing (missing model, prompt too long, etc.) */
    VALIDATION_ERROR,

    /** Pipeline could not accept the request */
    CAPACITY_ERROR,

    /** Unexpected failure inside the router */
    INTERNAL_ERROR
}
