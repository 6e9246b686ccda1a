/**
 * Per-item phase state machine package.
 *
 * <p>This package defines the fixed phase sequence a definition goes through and the
 * transition rules that keep the pipeline ordered.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.prp.core.pipeline.PipelinePhase} - Pipeline phases (enum, fixed order)</li>
 *   <li>{@link com.ryuqq.prp.core.pipeline.PhaseTransition} - Transition validation and execution</li>
 *   <li>{@link com.ryuqq.prp.core.pipeline.PhaseResult} - Ephemeral result of a single phase</li>
 * </ul>
 *
 * <h2>Transition Rules</h2>
 * <pre>
 * phase → phase.next()                 (normal progress)
 * any non-terminal → FAILED            (error)
 * COLLECT_CONTEXT → any later phase    (short-circuit on existing artifacts)
 *
 * Forbidden:
 * - DONE → *, FAILED → * (terminal)
 * - Backward transitions
 * - Skipping phases after the pipeline has started
 * </pre>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * PipelinePhase phase = PipelinePhase.initial();
 * phase = PhaseTransition.transition(phase, PipelinePhase.RATE_GATE_1);   // short-circuit
 * phase = PhaseTransition.transition(phase, PipelinePhase.SUBMIT_DRAFT);
 *
 * // This will throw IllegalStateException
 * PhaseTransition.validate(phase, PipelinePhase.DONE);
 * </pre>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.prp.core.pipeline;
