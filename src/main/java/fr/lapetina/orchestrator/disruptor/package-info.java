/**
 * LMAX Disruptor-based pipeline for inter-service calls.
 *
 * <p>Every {@code callService} invocation is published as a
 * {@link fr.lapetina.orchestrator.domain.event.CallEvent} on a pre-allocated ring buffer
 * and flows through the handlers in sequence:
 * <pre>
 * Validation → Policy → Instance Selection → Dispatch → Metrics → Completion
 * </pre>
 *
 * <p>A stage that fails an event marks it and later stages skip it; the completion stage
 * always resolves the caller's future, so a call never ends without a result.
 *
 * @see fr.lapetina.orchestrator.disruptor.CallPipeline
 * @see fr.lapetina.orchestrator.disruptor.exception.BackpressureException
 */
package fr.lapetina.orchestrator.disruptor;
