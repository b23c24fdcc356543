package com.ryuqq.dispatcher.core.spi;

import com.ryuqq.dispatcher.core.contract.Command;
import com.ryuqq.dispatcher.core.model.QueueName;

/**
 * Message Broker SPI for dispatching commands to remote workers.
 *
 * <p>This interface abstracts the broker/result-backend transport used by the
 * distributed executor. The executor never talks to the transport directly.</p>
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Submitting a command to a named queue and returning a correlation handle</li>
 *   <li>Reporting whether outstanding work can be revoked</li>
 *   <li>Releasing all transport resources on close</li>
 * </ul>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: submit may be called while handles are polled from other threads</li>
 *   <li>Handle isolation: cancelling or closing one handle must not affect another handle</li>
 *   <li>Failure surfacing: a non-zero exit or raised error on the worker must be reported as
 *       {@link com.ryuqq.dispatcher.core.state.TaskState#FAILED}, never as a silent SUCCESS</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * RemoteTaskHandle handle = broker.submit(command, QueueName.defaultQueue());
 * TaskState state = handle.fetchState(Duration.ofSeconds(1));
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface MessageBroker extends AutoCloseable {

    /**
     * Submits a command to the broker.
     *
     * <p>Returns synchronously once the broker has accepted the message.</p>
     *
     * @param command the command to run on a worker
     * @param queue the target queue
     * @return the handle for the dispatched unit of work
     * @throws IllegalArgumentException if command or queue is null
     * @throws DispatchException if the transport rejected or failed the submission
     */
    RemoteTaskHandle submit(Command command, QueueName queue);

    /**
     * Indicates whether {@link RemoteTaskHandle#cancel()} can revoke outstanding work.
     *
     * @return true if cancellation is supported by the transport
     */
    boolean supportsCancellation();

    /**
     * Releases all transport resources (connections, channels, worker threads).
     *
     * <p>Must be idempotent. Handles obtained before close may report lookup errors afterwards.</p>
     */
    @Override
    void close();
}
