/**
 * Backpressure package.
 *
 * <ul>
 *   <li>{@link com.ryuqq.dispatcher.core.protection.ParallelismBudget} - Global and per-queue in-flight limits</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.dispatcher.core.protection;
