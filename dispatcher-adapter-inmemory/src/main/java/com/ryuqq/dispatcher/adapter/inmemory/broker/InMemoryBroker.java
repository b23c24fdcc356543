package com.ryuqq.dispatcher.adapter.inmemory.broker;

import com.ryuqq.dispatcher.core.contract.Command;
import com.ryuqq.dispatcher.core.model.QueueName;
import com.ryuqq.dispatcher.core.spi.DispatchException;
import com.ryuqq.dispatcher.core.spi.MessageBroker;
import com.ryuqq.dispatcher.core.spi.RemoteTaskHandle;
import com.ryuqq.dispatcher.core.state.TaskState;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

/**
 * In-memory implementation of {@link MessageBroker} SPI for testing and reference purposes.
 *
 * <p>Submitted commands are not executed. Each submission is recorded with a token and a
 * remote state that starts as {@link TaskState#PENDING} (or whatever the initial-state resolver
 * decides) and moves only when {@link #transition(String, TaskState)} is called.</p>
 *
 * <p><strong>Architecture:</strong></p>
 * <ul>
 *   <li><strong>Remote States:</strong> ConcurrentHashMap&lt;String, TaskState&gt; - token to current state</li>
 *   <li><strong>Submission Log:</strong> CopyOnWriteArrayList&lt;Submission&gt; - every accepted submission in order</li>
 *   <li><strong>Fault Injection:</strong> AtomicInteger - number of upcoming submissions to reject</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryBroker broker = new InMemoryBroker(command -&gt;
 *     "false".equals(command.program()) ? TaskState.FAILED : TaskState.SUCCESS);
 *
 * RemoteTaskHandle handle = broker.submit(Command.of("true"), QueueName.defaultQueue());
 * handle.fetchState(Duration.ofSeconds(1)); // SUCCESS
 *
 * broker.failNextSubmissions(2); // next two submit() calls throw DispatchException
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryBroker implements MessageBroker {

    private final Function<Command, TaskState> initialState;
    private final ConcurrentHashMap<String, TaskState> states = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, AtomicInteger> fetchCounts = new ConcurrentHashMap<>();
    private final List<Submission> submissions = new CopyOnWriteArrayList<>();
    private final AtomicInteger failuresToInject = new AtomicInteger();
    private final AtomicLong tokenSequence = new AtomicLong();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    /**
     * Creates a broker whose submissions start as PENDING.
     */
    public InMemoryBroker() {
        this(command -> TaskState.PENDING);
    }

    /**
     * Creates a broker whose submissions start in the state chosen by the resolver.
     *
     * @param initialState resolver from command to the state reported right after submission
     * @throws IllegalArgumentException if initialState is null
     */
    public InMemoryBroker(Function<Command, TaskState> initialState) {
        if (initialState == null) {
            throw new IllegalArgumentException("initialState cannot be null");
        }
        this.initialState = initialState;
    }

    @Override
    public RemoteTaskHandle submit(Command command, QueueName queue) {
        if (command == null) {
            throw new IllegalArgumentException("command cannot be null");
        }
        if (queue == null) {
            throw new IllegalArgumentException("queue cannot be null");
        }
        if (closed.get()) {
            throw new DispatchException("Broker is closed", new IOException("Connection closed"));
        }
        if (failuresToInject.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
            throw new DispatchException("Broker rejected submission", new IOException("Connection refused"));
        }

        String token = "mem-" + tokenSequence.incrementAndGet();
        TaskState state = initialState.apply(command);
        states.put(token, state == null ? TaskState.PENDING : state);
        submissions.add(new Submission(token, command, queue));
        return new InMemoryHandle(token);
    }

    @Override
    public boolean supportsCancellation() {
        return true;
    }

    @Override
    public void close() {
        closed.set(true);
    }

    /**
     * Moves the remote state of a submission.
     *
     * @param token the submission token
     * @param state the new state
     * @throws IllegalArgumentException if the token is unknown or state is null
     */
    public void transition(String token, TaskState state) {
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        if (states.replace(token, state) == null) {
            throw new IllegalArgumentException("Unknown token: " + token);
        }
    }

    /**
     * Rejects the next {@code count} submissions with a {@link DispatchException}.
     *
     * @param count number of submissions to reject
     */
    public void failNextSubmissions(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("count must not be negative (current: " + count + ")");
        }
        failuresToInject.set(count);
    }

    /**
     * Returns every accepted submission in submission order.
     *
     * @return immutable snapshot
     */
    public List<Submission> submissions() {
        return List.copyOf(submissions);
    }

    /**
     * Finds the most recent submission whose command starts with the given program.
     *
     * @param program the command program
     * @return the submission, if any
     */
    public Optional<Submission> lastSubmissionOf(String program) {
        for (int i = submissions.size() - 1; i >= 0; i--) {
            Submission submission = submissions.get(i);
            if (submission.command().program().equals(program)) {
                return Optional.of(submission);
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the current remote state of a submission.
     *
     * @param token the submission token
     * @return the state, or empty if the token is unknown
     */
    public Optional<TaskState> stateOf(String token) {
        return Optional.ofNullable(states.get(token));
    }

    /**
     * Returns how many times the state of a submission was fetched.
     *
     * @param token the submission token
     * @return fetch count
     */
    public int fetchCount(String token) {
        AtomicInteger count = fetchCounts.get(token);
        return count == null ? 0 : count.get();
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * One accepted submission.
     *
     * @param token the issued token
     * @param command the submitted command
     * @param queue the target queue
     */
    public record Submission(String token, Command command, QueueName queue) {
    }

    private final class InMemoryHandle implements RemoteTaskHandle {

        private final String token;

        private InMemoryHandle(String token) {
            this.token = token;
        }

        @Override
        public String token() {
            return token;
        }

        @Override
        public TaskState fetchState(Duration timeout) {
            if (closed.get()) {
                throw new IllegalStateException("Result backend connection is closed");
            }
            fetchCounts.computeIfAbsent(token, t -> new AtomicInteger()).incrementAndGet();
            return states.get(token);
        }

        @Override
        public boolean cancel() {
            TaskState current = states.get(token);
            if (current == null || current.isTerminal()) {
                return false;
            }
            return states.replace(token, current, TaskState.FAILED);
        }

        @Override
        public String toString() {
            return "InMemoryHandle{" + token + "}";
        }
    }
}
