/**
 * Remote task state package.
 *
 * <ul>
 *   <li>{@link com.ryuqq.dispatcher.core.state.TaskState} - State reported by the broker</li>
 *   <li>{@link com.ryuqq.dispatcher.core.state.PollResult} - Closed variant for one state lookup (observed state or lookup error)</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.dispatcher.core.state;
