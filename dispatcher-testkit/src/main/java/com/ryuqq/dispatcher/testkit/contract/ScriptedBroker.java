package com.ryuqq.dispatcher.testkit.contract;

import com.ryuqq.dispatcher.core.contract.Command;
import com.ryuqq.dispatcher.core.model.QueueName;
import com.ryuqq.dispatcher.core.spi.DispatchException;
import com.ryuqq.dispatcher.core.spi.MessageBroker;
import com.ryuqq.dispatcher.core.spi.RemoteTaskHandle;
import com.ryuqq.dispatcher.core.state.TaskState;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Test double for {@link MessageBroker} driven by per-program scripts.
 *
 * <p>The program of a submitted command (its first argument) selects the script of the
 * returned {@link ScriptedHandle}. Programs without a script report {@link TaskState#SUCCESS}.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * ScriptedBroker broker = new ScriptedBroker();
 * broker.scriptStates("true", TaskState.RUNNING, TaskState.SUCCESS);
 * broker.scriptStates("false", TaskState.RUNNING, TaskState.FAILED);
 * broker.scriptFailure("broken", () -&gt; new ClassCastException("not a task result"));
 * broker.failSubmissions(2);
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ScriptedBroker implements MessageBroker {

    private final boolean cancellationSupported;
    private final Map<String, List<TaskState>> stateScripts = new ConcurrentHashMap<>();
    private final Map<String, Supplier<? extends RuntimeException>> failureScripts = new ConcurrentHashMap<>();
    private final List<ScriptedHandle> handles = new CopyOnWriteArrayList<>();
    private final List<QueueName> queues = new CopyOnWriteArrayList<>();
    private final AtomicInteger submissionFailures = new AtomicInteger();
    private final AtomicInteger closeCount = new AtomicInteger();
    private final AtomicInteger tokenSequence = new AtomicInteger();

    /**
     * Creates a broker that supports cancellation.
     */
    public ScriptedBroker() {
        this(true);
    }

    /**
     * Creates a broker.
     *
     * @param cancellationSupported value reported by {@link #supportsCancellation()}
     */
    public ScriptedBroker(boolean cancellationSupported) {
        this.cancellationSupported = cancellationSupported;
    }

    /**
     * Scripts the states reported for commands of the given program.
     *
     * @param program the command program
     * @param states states for successive fetches; empty means a malformed (null) answer
     * @return this broker
     */
    public ScriptedBroker scriptStates(String program, TaskState... states) {
        stateScripts.put(program, List.of(states));
        failureScripts.remove(program);
        return this;
    }

    /**
     * Makes every fetch for commands of the given program throw.
     *
     * @param program the command program
     * @param failure supplier of the exception to throw
     * @return this broker
     */
    public ScriptedBroker scriptFailure(String program, Supplier<? extends RuntimeException> failure) {
        if (failure == null) {
            throw new IllegalArgumentException("failure cannot be null");
        }
        failureScripts.put(program, failure);
        return this;
    }

    /**
     * Rejects the next {@code count} submissions with a {@link DispatchException}.
     *
     * @param count number of submissions to reject
     * @return this broker
     */
    public ScriptedBroker failSubmissions(int count) {
        submissionFailures.set(count);
        return this;
    }

    @Override
    public RemoteTaskHandle submit(Command command, QueueName queue) {
        if (command == null) {
            throw new IllegalArgumentException("command cannot be null");
        }
        if (queue == null) {
            throw new IllegalArgumentException("queue cannot be null");
        }
        if (submissionFailures.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
            throw new DispatchException("Scripted submission failure", new IOException("Connection refused"));
        }

        String program = command.program();
        ScriptedHandle handle = new ScriptedHandle(
            "scripted-" + tokenSequence.incrementAndGet(),
            program,
            stateScripts.getOrDefault(program, List.of(TaskState.SUCCESS)),
            failureScripts.get(program)
        );
        handles.add(handle);
        queues.add(queue);
        return handle;
    }

    @Override
    public boolean supportsCancellation() {
        return cancellationSupported;
    }

    @Override
    public void close() {
        closeCount.incrementAndGet();
    }

    /**
     * Returns every handle issued so far, in submission order.
     *
     * @return immutable snapshot
     */
    public List<ScriptedHandle> handles() {
        return List.copyOf(handles);
    }

    /**
     * Returns the queue of every submission, in submission order.
     *
     * @return immutable snapshot
     */
    public List<QueueName> submittedQueues() {
        return List.copyOf(queues);
    }

    /**
     * Returns the most recent handle issued for the given program.
     *
     * @param program the command program
     * @return the handle
     * @throws IllegalStateException if no command of that program was submitted
     */
    public ScriptedHandle lastHandleFor(String program) {
        for (int i = handles.size() - 1; i >= 0; i--) {
            ScriptedHandle handle = handles.get(i);
            if (program.equals(handle.program())) {
                return handle;
            }
        }
        throw new IllegalStateException("No submission for program: " + program);
    }

    public int submissionCount() {
        return handles.size();
    }

    public int closeCount() {
        return closeCount.get();
    }

    public boolean isClosed() {
        return closeCount.get() > 0;
    }
}
