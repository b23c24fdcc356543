package com.ryuqq.dispatcher.testkit.contract;

import com.ryuqq.dispatcher.core.spi.RemoteTaskHandle;
import com.ryuqq.dispatcher.core.state.TaskState;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Test double for {@link RemoteTaskHandle} that replays a scripted sequence of states.
 *
 * <p>Each {@link #fetchState(Duration)} returns the next scripted state; the last state repeats
 * once the script is exhausted. An empty script answers {@code null} (a malformed response),
 * and a failure supplier makes every fetch throw.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ScriptedHandle implements RemoteTaskHandle {

    private final String token;
    private final String program;
    private final List<TaskState> script;
    private final Supplier<? extends RuntimeException> failure;
    private final AtomicInteger fetchCount = new AtomicInteger();
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    /**
     * Creates a scripted handle.
     *
     * @param token the broker token
     * @param program the program of the submitted command
     * @param script states returned by successive fetches (may be empty)
     * @param failure supplier of the exception thrown by every fetch (null for none)
     */
    public ScriptedHandle(String token, String program, List<TaskState> script,
                          Supplier<? extends RuntimeException> failure) {
        if (token == null || token.isBlank()) {
            throw new IllegalArgumentException("token cannot be null or blank");
        }
        if (script == null) {
            throw new IllegalArgumentException("script cannot be null");
        }
        this.token = token;
        this.program = program;
        this.script = List.copyOf(script);
        this.failure = failure;
    }

    @Override
    public String token() {
        return token;
    }

    @Override
    public TaskState fetchState(Duration timeout) {
        int call = fetchCount.getAndIncrement();
        if (failure != null) {
            throw failure.get();
        }
        if (cancelled.get()) {
            return TaskState.FAILED;
        }
        if (script.isEmpty()) {
            return null;
        }
        return script.get(Math.min(call, script.size() - 1));
    }

    @Override
    public boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }

    public String program() {
        return program;
    }

    public int fetchCount() {
        return fetchCount.get();
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    @Override
    public String toString() {
        return "ScriptedHandle{" + token + ", " + program + "}";
    }
}
