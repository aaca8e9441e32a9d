/**
 * Disruptor event carried through the routing pipeline.
 *
 * <pre>
 * CREATED -> VALIDATED -> CANDIDATES_RESOLVED -> PICKED      -> COMPLETED
 *         \-> VALIDATION_FAILED  \-> NO_CANDIDATES  \-> NO_DECISION
 * </pre>
 */
package fr.lapetina.kvrouter.domain.event;
