/**
 * Local process Task Runner.
 *
 * <p>{@link com.ryuqq.dispatcher.adapter.inmemory.process.LocalProcessBroker} executes each
 * {@link com.ryuqq.dispatcher.core.contract.Command} with {@link java.lang.ProcessBuilder} on a bounded
 * worker pool and reports the exit code through the {@link com.ryuqq.dispatcher.core.spi.RemoteTaskHandle}.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.dispatcher.adapter.inmemory.process;
