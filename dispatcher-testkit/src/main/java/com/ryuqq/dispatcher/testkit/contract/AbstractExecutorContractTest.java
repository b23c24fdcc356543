package com.ryuqq.dispatcher.testkit.contract;

import com.ryuqq.dispatcher.core.contract.Command;
import com.ryuqq.dispatcher.core.executor.DuplicateKeyException;
import com.ryuqq.dispatcher.core.executor.Executor;
import com.ryuqq.dispatcher.core.executor.ExecutorFatalException;
import com.ryuqq.dispatcher.core.model.QueueName;
import com.ryuqq.dispatcher.core.model.TaskInstanceKey;
import com.ryuqq.dispatcher.core.outcome.Fail;
import com.ryuqq.dispatcher.core.outcome.Outcome;
import com.ryuqq.dispatcher.core.spi.MessageBroker;
import com.ryuqq.dispatcher.core.state.TaskState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Abstract base class for {@link Executor} contract tests.
 *
 * <p>Any executor implementation can be verified by extending this class and implementing
 * {@link #createExecutor(MessageBroker, int)}. The executor under test is driven against a
 * {@link ScriptedBroker}.</p>
 *
 * <p><strong>Contract Scenarios:</strong></p>
 * <ul>
 *   <li>Terminal outcomes are reported once and the key leaves the executor</li>
 *   <li>A failing state lookup only fails its own key</li>
 *   <li>Duplicate keys are rejected without changing state</li>
 *   <li>Draining is idempotent</li>
 *   <li>In-flight work never exceeds the parallelism budget</li>
 *   <li>A queued key is pending or in flight, never both and never neither</li>
 *   <li>Transport failures requeue work and escalate only past the threshold</li>
 *   <li>Cancellation and shutdown record CANCELLED outcomes and release the broker</li>
 * </ul>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class MyExecutorContractTest extends AbstractExecutorContractTest {
 *     {@literal @}Override
 *     protected Executor createExecutor(MessageBroker broker, int parallelism) {
 *         return new MyExecutor(broker, parallelism);
 *     }
 * }
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class AbstractExecutorContractTest {

    protected static final int PARALLELISM = 4;
    protected static final Instant LOGICAL_TS = Instant.parse("2024-01-01T00:00:00Z");
    protected static final String WORKFLOW = "contract_wf";

    protected ScriptedBroker broker;
    protected Executor executor;

    /**
     * Creates the executor under test.
     *
     * @param broker the broker the executor must dispatch to
     * @param parallelism the global parallelism budget
     * @return a fresh executor
     */
    protected abstract Executor createExecutor(MessageBroker broker, int parallelism);

    @BeforeEach
    void setUpExecutor() {
        broker = new ScriptedBroker();
        executor = createExecutor(broker, PARALLELISM);
    }

    @AfterEach
    void tearDownExecutor() {
        if (executor != null) {
            executor.shutdown(false);
        }
    }

    // ============================================================
    // Terminal outcomes
    // ============================================================

    @Test
    void testSync_SuccessAndFailCommands_OutcomesReportedAndKeysReleased() {
        // Given
        broker.scriptStates("true", TaskState.RUNNING, TaskState.SUCCESS);
        broker.scriptStates("false", TaskState.RUNNING, TaskState.FAILED);
        TaskInstanceKey success = key("success");
        TaskInstanceKey fail = key("fail");
        executor.queue(success, Command.of("true", "some_parameter"), QueueName.defaultQueue(), 0);
        executor.queue(fail, Command.of("false", "some_parameter"), QueueName.defaultQueue(), 0);

        // When: two trigger + sync cycles
        for (int i = 0; i < 2; i++) {
            executor.triggerPending();
            executor.sync();
        }

        // Then
        Map<TaskInstanceKey, Outcome> events = executor.drainEvents();
        assertEquals(2, events.size());
        assertEquals(TaskState.SUCCESS, events.get(success).state());
        assertEquals(TaskState.FAILED, events.get(fail).state());
        assertEquals(Fail.TASK_FAILED, ((Fail) events.get(fail)).errorCode());
        assertTrue(executor.inFlightKeys().isEmpty(), "in-flight table should be empty");
        assertFalse(executor.hasTask(success));
        assertFalse(executor.hasTask(fail));
    }

    @Test
    void testSync_NonTerminalState_NoEventWritten() {
        // Given
        broker.scriptStates("sleep", TaskState.PENDING, TaskState.RUNNING);
        TaskInstanceKey key = key("slow");
        executor.queue(key, Command.of("sleep", "60"), QueueName.defaultQueue(), 0);
        executor.triggerPending();

        // When
        executor.sync();
        executor.sync();
        executor.sync();

        // Then
        assertTrue(executor.drainEvents().isEmpty());
        assertEquals(Set.of(key), executor.inFlightKeys());
    }

    @Test
    void testSync_EveryInFlightKeyPolledOncePerPass() {
        // Given
        broker.scriptStates("sleep", TaskState.RUNNING);
        for (int i = 0; i < PARALLELISM; i++) {
            executor.queue(key("t" + i), Command.of("sleep", "60"), QueueName.defaultQueue(), 0);
        }
        executor.triggerPending();

        // When
        executor.sync();

        // Then
        for (ScriptedHandle handle : broker.handles()) {
            assertEquals(1, handle.fetchCount(), "each handle is polled exactly once: " + handle);
        }
    }

    // ============================================================
    // Lookup error isolation
    // ============================================================

    @Test
    void testSync_LookupAlwaysThrows_OnlyThatKeyFails() {
        // Given
        broker.scriptStates("true", TaskState.SUCCESS);
        broker.scriptFailure("broken", () -> new ClassCastException("result is not a task handle"));
        TaskInstanceKey before = key("before");
        TaskInstanceKey broken = key("broken");
        TaskInstanceKey after = key("after");
        executor.queue(before, Command.of("true"), QueueName.defaultQueue(), 2);
        executor.queue(broken, Command.of("broken"), QueueName.defaultQueue(), 1);
        executor.queue(after, Command.of("true"), QueueName.defaultQueue(), 0);
        executor.triggerPending();

        // When: a single pass
        executor.sync();

        // Then
        Map<TaskInstanceKey, Outcome> events = executor.drainEvents();
        assertEquals(TaskState.SUCCESS, events.get(before).state());
        assertEquals(TaskState.SUCCESS, events.get(after).state());

        Fail failure = assertInstanceOf(Fail.class, events.get(broken));
        assertEquals(Fail.STATE_FETCH_FAILED, failure.errorCode());
        assertNotNull(failure.cause());
        assertTrue(failure.cause().contains("ClassCastException"), failure.cause());
        assertTrue(failure.cause().contains("result is not a task handle"), failure.cause());
        assertTrue(executor.inFlightKeys().isEmpty());
    }

    @Test
    void testSync_MalformedStateAnswer_RecordedAsFailed() {
        // Given: empty script answers null
        broker.scriptStates("weird");
        TaskInstanceKey key = key("weird");
        executor.queue(key, Command.of("weird"), QueueName.defaultQueue(), 0);
        executor.triggerPending();

        // When
        executor.sync();

        // Then
        Outcome outcome = executor.drainEvents().get(key);
        assertNotNull(outcome);
        assertEquals(Fail.STATE_FETCH_FAILED, ((Fail) outcome).errorCode());
        assertFalse(executor.hasTask(key));
    }

    // ============================================================
    // Duplicate keys
    // ============================================================

    @Test
    void testQueue_SameKeyBeforeDispatch_RejectedAndStateUnchanged() {
        // Given
        TaskInstanceKey key = key("dup");
        executor.queue(key, Command.of("true"), QueueName.defaultQueue(), 5);
        Set<TaskInstanceKey> pendingBefore = executor.pendingKeys();
        Set<TaskInstanceKey> inFlightBefore = executor.inFlightKeys();

        // When / Then
        DuplicateKeyException error = assertThrows(DuplicateKeyException.class,
                () -> executor.queue(key, Command.of("false"), QueueName.defaultQueue(), 9));
        assertEquals(key, error.getKey());
        assertEquals(pendingBefore, executor.pendingKeys());
        assertEquals(inFlightBefore, executor.inFlightKeys());

        // the first command is the one dispatched
        executor.triggerPending();
        assertEquals("true", broker.lastHandleFor("true").program());
        assertEquals(1, broker.submissionCount());
    }

    @Test
    void testQueue_SameKeyWhileInFlight_Rejected() {
        // Given
        broker.scriptStates("sleep", TaskState.RUNNING);
        TaskInstanceKey key = key("busy");
        executor.queue(key, Command.of("sleep", "60"), QueueName.defaultQueue(), 0);
        executor.triggerPending();

        // When / Then
        assertThrows(DuplicateKeyException.class,
                () -> executor.queue(key, Command.of("sleep", "60"), QueueName.defaultQueue(), 0));
        assertEquals(Set.of(key), executor.inFlightKeys());
        assertTrue(executor.pendingKeys().isEmpty());
    }

    @Test
    void testQueue_NextAttemptOfFinishedKey_Accepted() {
        // Given
        TaskInstanceKey first = key("retry_me");
        executor.queue(first, Command.of("true"), QueueName.defaultQueue(), 0);
        executor.heartbeat();
        executor.drainEvents();

        // When
        TaskInstanceKey second = first.nextAttempt();
        executor.queue(second, Command.of("true"), QueueName.defaultQueue(), 0);

        // Then
        assertTrue(executor.hasTask(second));
    }

    // ============================================================
    // Event buffer
    // ============================================================

    @Test
    void testDrainEvents_CalledTwice_SecondIsEmpty() {
        // Given
        executor.queue(key("a"), Command.of("true"), QueueName.defaultQueue(), 0);
        executor.queue(key("b"), Command.of("true"), QueueName.defaultQueue(), 0);
        executor.heartbeat();

        // When
        Map<TaskInstanceKey, Outcome> first = executor.drainEvents();
        Map<TaskInstanceKey, Outcome> second = executor.drainEvents();

        // Then
        assertEquals(2, first.size());
        assertTrue(second.isEmpty());
    }

    @Test
    void testDrainEvents_FilteredByWorkflow_OtherEventsStayBuffered() {
        // Given
        TaskInstanceKey wfA = TaskInstanceKey.of("wf_a", "t1", LOGICAL_TS, 1);
        TaskInstanceKey wfB = TaskInstanceKey.of("wf_b", "t1", LOGICAL_TS, 1);
        executor.queue(wfA, Command.of("true"), QueueName.defaultQueue(), 0);
        executor.queue(wfB, Command.of("true"), QueueName.defaultQueue(), 0);
        executor.heartbeat();

        // When
        Map<TaskInstanceKey, Outcome> onlyA = executor.drainEvents(Set.of("wf_a"));

        // Then
        assertEquals(Set.of(wfA), onlyA.keySet());
        assertEquals(Set.of(wfB), executor.drainEvents().keySet());
    }

    // ============================================================
    // Backpressure
    // ============================================================

    @Test
    void testTriggerPending_MoreWorkThanBudget_InFlightBounded() {
        // Given
        broker.scriptStates("sleep", TaskState.RUNNING);
        List<TaskInstanceKey> keys = new ArrayList<>();
        for (int i = 0; i < PARALLELISM * 3; i++) {
            TaskInstanceKey key = key("t" + i);
            keys.add(key);
            executor.queue(key, Command.of("sleep", "60"), QueueName.defaultQueue(), 0);
        }

        // When
        for (int i = 0; i < 3; i++) {
            executor.heartbeat();

            // Then
            assertEquals(PARALLELISM, executor.inFlightKeys().size());
            assertEquals(0, executor.openSlots());
            assertEveryKeyInExactlyOneTable(keys);
        }
        assertEquals(PARALLELISM, broker.submissionCount());
    }

    @Test
    void testTriggerPending_SlotFreed_NextPendingDispatched() {
        // Given: first PARALLELISM finish, the rest keep running
        broker.scriptStates("true", TaskState.RUNNING, TaskState.SUCCESS);
        broker.scriptStates("sleep", TaskState.RUNNING);
        for (int i = 0; i < PARALLELISM; i++) {
            executor.queue(key("fast" + i), Command.of("true"), QueueName.defaultQueue(), 10);
        }
        executor.queue(key("slow"), Command.of("sleep", "60"), QueueName.defaultQueue(), 0);

        // When
        executor.heartbeat(); // dispatch fast*, observe RUNNING
        assertEquals(Set.of(key("slow")), executor.pendingKeys());
        executor.heartbeat(); // fast* SUCCESS
        executor.heartbeat(); // slow dispatched

        // Then
        assertEquals(Set.of(key("slow")), executor.inFlightKeys());
        assertEquals(PARALLELISM, executor.drainEvents().size());
    }

    @Test
    void testTriggerPending_HigherPriorityDispatchedFirst() {
        // Given
        broker.scriptStates("sleep", TaskState.RUNNING);
        executor.queue(key("low"), Command.of("sleep", "low"), QueueName.defaultQueue(), 1);
        for (int i = 0; i < PARALLELISM; i++) {
            executor.queue(key("high" + i), Command.of("sleep", "high"), QueueName.defaultQueue(), 100);
        }

        // When
        executor.triggerPending();

        // Then
        assertEquals(Set.of(key("low")), executor.pendingKeys());
    }

    // ============================================================
    // Dispatch failures
    // ============================================================

    @Test
    void testTriggerPending_TransientSubmitFailure_RequeuedNotDropped() {
        // Given
        broker.failSubmissions(1);
        TaskInstanceKey key = key("flaky");
        executor.queue(key, Command.of("true"), QueueName.defaultQueue(), 0);

        // When
        executor.triggerPending();

        // Then: still pending, nothing in flight
        assertEquals(Set.of(key), executor.pendingKeys());
        assertTrue(executor.inFlightKeys().isEmpty());

        // When: broker recovers
        executor.triggerPending();

        // Then
        assertEquals(Set.of(key), executor.inFlightKeys());
        assertTrue(executor.pendingKeys().isEmpty());
    }

    @Test
    void testHeartbeat_BrokerKeepsRejecting_FatalRaisedAndKeyKept() {
        // Given
        broker.failSubmissions(Integer.MAX_VALUE);
        TaskInstanceKey key = key("doomed");
        executor.queue(key, Command.of("true"), QueueName.defaultQueue(), 0);

        // When / Then
        assertThrows(ExecutorFatalException.class, () -> {
            for (int i = 0; i < 100; i++) {
                executor.heartbeat();
            }
        });
        assertEquals(Set.of(key), executor.pendingKeys());
        assertTrue(executor.drainEvents().isEmpty());
    }

    // ============================================================
    // Cancellation
    // ============================================================

    @Test
    void testCancel_PendingKey_RemovedWithCancelledOutcome() {
        // Given
        TaskInstanceKey key = key("queued");
        executor.queue(key, Command.of("true"), QueueName.defaultQueue(), 0);

        // When
        boolean cancelled = executor.cancel(key);

        // Then
        assertTrue(cancelled);
        assertFalse(executor.hasTask(key));
        assertEquals(Fail.CANCELLED, ((Fail) executor.drainEvents().get(key)).errorCode());
        executor.triggerPending();
        assertEquals(0, broker.submissionCount());
    }

    @Test
    void testCancel_InFlightKey_HandleRevokedWithCancelledOutcome() {
        // Given
        broker.scriptStates("sleep", TaskState.RUNNING);
        TaskInstanceKey key = key("running");
        executor.queue(key, Command.of("sleep", "60"), QueueName.defaultQueue(), 0);
        executor.heartbeat();

        // When
        boolean cancelled = executor.cancel(key);

        // Then
        assertTrue(cancelled);
        assertTrue(broker.lastHandleFor("sleep").isCancelled());
        assertFalse(executor.hasTask(key));
        assertEquals(Fail.CANCELLED, ((Fail) executor.drainEvents().get(key)).errorCode());
    }

    @Test
    void testCancel_UnknownKey_ReturnsFalse() {
        assertFalse(executor.cancel(key("ghost")));
        assertTrue(executor.drainEvents().isEmpty());
    }

    // ============================================================
    // Shutdown
    // ============================================================

    @Test
    void testShutdown_WaitForCompletion_InFlightResolvedAndBrokerClosed() {
        // Given
        broker.scriptStates("true", TaskState.SUCCESS);
        TaskInstanceKey key = key("finish_me");
        executor.queue(key, Command.of("true"), QueueName.defaultQueue(), 0);
        executor.triggerPending();

        // When
        executor.shutdown(true);

        // Then
        assertEquals(TaskState.SUCCESS, executor.drainEvents().get(key).state());
        assertTrue(executor.inFlightKeys().isEmpty());
        assertTrue(broker.isClosed());
    }

    @Test
    void testShutdown_NoWait_InFlightCancelledAndBrokerClosed() {
        // Given
        broker.scriptStates("sleep", TaskState.RUNNING);
        TaskInstanceKey key = key("abandoned");
        executor.queue(key, Command.of("sleep", "60"), QueueName.defaultQueue(), 0);
        executor.heartbeat();

        // When
        executor.shutdown(false);

        // Then
        assertTrue(broker.lastHandleFor("sleep").isCancelled());
        assertEquals(Fail.CANCELLED, ((Fail) executor.drainEvents().get(key)).errorCode());
        assertTrue(broker.isClosed());
    }

    @Test
    void testShutdown_CalledTwice_BrokerClosedOnce() {
        // When
        executor.shutdown(true);
        executor.shutdown(false);

        // Then
        assertEquals(1, broker.closeCount());
    }

    @Test
    void testQueue_AfterShutdown_Rejected() {
        // Given
        executor.shutdown(true);

        // When / Then
        assertThrows(IllegalStateException.class,
                () -> executor.queue(key("late"), Command.of("true"), QueueName.defaultQueue(), 0));
    }

    // ============================================================
    // Helpers
    // ============================================================

    /**
     * Creates a key in the contract workflow.
     *
     * @param taskId the task id
     * @return first-attempt key at {@link #LOGICAL_TS}
     */
    protected TaskInstanceKey key(String taskId) {
        return TaskInstanceKey.of(WORKFLOW, taskId, LOGICAL_TS, 1);
    }

    /**
     * Asserts that each key is in exactly one of pending and in-flight.
     *
     * @param keys the queued, unresolved keys
     */
    protected void assertEveryKeyInExactlyOneTable(List<TaskInstanceKey> keys) {
        Set<TaskInstanceKey> pending = executor.pendingKeys();
        Set<TaskInstanceKey> inFlight = executor.inFlightKeys();
        Set<TaskInstanceKey> overlap = new HashSet<>(pending);
        overlap.retainAll(inFlight);
        assertTrue(overlap.isEmpty(), "keys both pending and in flight: " + overlap);
        for (TaskInstanceKey key : keys) {
            assertTrue(pending.contains(key) || inFlight.contains(key),
                    String.format("Expected %s to be pending or in flight", key));
        }
    }
}
