/**
 * Domain model for routing decisions.
 *
 * <ul>
 *   <li>{@link fr.lapetina.kvrouter.domain.model.CandidateServer} - an inference server eligible for a request</li>
 *   <li>{@link fr.lapetina.kvrouter.domain.model.RoutingRequest} - immutable per-request context (model, prompt or messages)</li>
 *   <li>{@link fr.lapetina.kvrouter.domain.model.RoutingResponse} - the decision, or "no decision", or an error</li>
 *   <li>{@link fr.lapetina.kvrouter.domain.model.DecisionPath} - which branch of a picker produced the decision</li>
 * </ul>
 *
 * <p>Records are immutable; {@code CandidateServer} keeps its one mutable field in an
 * {@code AtomicReference}.
 */
package fr.lapetina.kvrouter.domain.model;
