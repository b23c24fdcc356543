package com.ryuqq.dispatcher.core.spi;

import com.ryuqq.dispatcher.core.state.TaskState;

import java.time.Duration;

/**
 * Handle for one dispatched, in-flight unit of work on the broker.
 *
 * <p>Wraps whatever correlation token the broker issued (for example a result-fetch id).
 * A handle is owned by exactly one in-flight entry of the executor.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>{@link #fetchState(Duration)} must not block longer than the given timeout,
 *       even if the underlying transport default would</li>
 *   <li>Lookup failures may be reported by throwing any {@link RuntimeException};
 *       the executor converts them into per-task lookup errors</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface RemoteTaskHandle {

    /**
     * Returns the broker-issued correlation token.
     *
     * @return the token (never null)
     */
    String token();

    /**
     * Fetches the current remote state with a bounded wait.
     *
     * @param timeout maximum time to wait for the result backend
     * @return the current state, or null if the backend answered with something
     *         that is not a recognizable state
     * @throws RuntimeException if the lookup itself failed or timed out
     */
    TaskState fetchState(Duration timeout);

    /**
     * Requests revocation of the remote work.
     *
     * <p>Only meaningful when {@link MessageBroker#supportsCancellation()} is true.
     * Must not affect any other handle.</p>
     *
     * @return true if the cancellation request was accepted
     */
    boolean cancel();
}
