/**
 * Worker command contract package.
 *
 * <ul>
 *   <li>{@link com.ryuqq.dispatcher.core.contract.Command} - Opaque, immutable argument list run by the Task Runner</li>
 *   <li>{@link com.ryuqq.dispatcher.core.contract.ExecutionContext} - Flags that shape the command</li>
 *   <li>{@link com.ryuqq.dispatcher.core.contract.CommandBuilder} - Deterministic (key, context) → command function</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.dispatcher.core.contract;
