/**
 * Terminal outcome package.
 *
 * <p>Sealed hierarchy for what the scheduler learns when it drains the event buffer.</p>
 *
 * <ul>
 *   <li>{@link com.ryuqq.dispatcher.core.outcome.Outcome} - Sealed interface (permits Ok, Fail)</li>
 *   <li>{@link com.ryuqq.dispatcher.core.outcome.Ok} - SUCCESS</li>
 *   <li>{@link com.ryuqq.dispatcher.core.outcome.Fail} - FAILED, with error code and diagnostic cause</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.dispatcher.core.outcome;
