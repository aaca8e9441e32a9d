/**
 * LMAX Disruptor pipeline producing routing decisions.
 *
 * <h2>Handler Chain</h2>
 * <ol>
 *   <li>{@link fr.lapetina.kvrouter.disruptor.handlers.ValidationHandler} - model and prompt checks</li>
 *   <li>{@link fr.lapetina.kvrouter.disruptor.handlers.CandidateHandler} - routable servers for the model</li>
 *   <li>{@link fr.lapetina.kvrouter.disruptor.handlers.PickHandler} - active picker, worker pool</li>
 *   <li>{@link fr.lapetina.kvrouter.disruptor.handlers.MetricsHandler} - counters and stage timers</li>
 *   <li>{@link fr.lapetina.kvrouter.disruptor.handlers.CompletionHandler} - completes the caller's future</li>
 * </ol>
 *
 * <h2>Backpressure</h2>
 * <p>{@link fr.lapetina.kvrouter.disruptor.RoutingPipeline#submit} claims a slot with
 * {@code tryNext()}; a full ring buffer throws
 * {@link fr.lapetina.kvrouter.disruptor.exception.BackpressureException}, mapped to HTTP 503.
 */
package fr.lapetina.kvrouter.disruptor;
