package com.ryuqq.dispatcher.adapter.inmemory.process;

import com.ryuqq.dispatcher.core.contract.Command;
import com.ryuqq.dispatcher.core.model.QueueName;
import com.ryuqq.dispatcher.core.spi.DispatchException;
import com.ryuqq.dispatcher.core.spi.MessageBroker;
import com.ryuqq.dispatcher.core.spi.RemoteTaskHandle;
import com.ryuqq.dispatcher.core.state.TaskState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * {@link MessageBroker} that runs each command as a local OS process on a bounded worker pool.
 *
 * <p>This is the reference Task Runner: the worker pool plays the role of the remote workers,
 * and the process exit code is the reported outcome.</p>
 *
 * <p><strong>State Mapping:</strong></p>
 * <ul>
 *   <li>queued on the pool → {@link TaskState#PENDING}</li>
 *   <li>process started → {@link TaskState#RUNNING}</li>
 *   <li>exit code 0 → {@link TaskState#SUCCESS}</li>
 *   <li>non-zero exit, launch error or cancellation → {@link TaskState#FAILED}</li>
 * </ul>
 *
 * <p>Process output is discarded. Cancelling a handle destroys only that handle's process.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class LocalProcessBroker implements MessageBroker {

    private static final Logger log = LoggerFactory.getLogger(LocalProcessBroker.class);

    private static final long CLOSE_GRACE_MS = 5_000L;

    private final ExecutorService workers;
    private final Set<LocalProcessHandle> live = ConcurrentHashMap.newKeySet();
    private final AtomicLong tokenSequence = new AtomicLong();

    /**
     * Creates a broker with the given worker concurrency.
     *
     * @param workerConcurrency maximum number of concurrently running processes
     * @throws IllegalArgumentException if workerConcurrency is not positive
     */
    public LocalProcessBroker(int workerConcurrency) {
        if (workerConcurrency <= 0) {
            throw new IllegalArgumentException("workerConcurrency must be positive (current: " + workerConcurrency + ")");
        }
        AtomicInteger threadCounter = new AtomicInteger(1);
        this.workers = Executors.newFixedThreadPool(workerConcurrency, runnable -> {
            Thread thread = new Thread(runnable, "dispatcher-worker-" + threadCounter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public RemoteTaskHandle submit(Command command, QueueName queue) {
        if (command == null) {
            throw new IllegalArgumentException("command cannot be null");
        }
        if (queue == null) {
            throw new IllegalArgumentException("queue cannot be null");
        }

        LocalProcessHandle handle = new LocalProcessHandle("proc-" + tokenSequence.incrementAndGet(), command);
        live.add(handle);
        try {
            handle.future = workers.submit(handle::run);
        } catch (RejectedExecutionException e) {
            live.remove(handle);
            throw new DispatchException("Worker pool is not accepting commands", e);
        }
        log.debug("Submitted {} to {} as {}", command, queue.getValue(), handle.token());
        return handle;
    }

    @Override
    public boolean supportsCancellation() {
        return true;
    }

    @Override
    public void close() {
        if (workers.isShutdown()) {
            return;
        }
        workers.shutdownNow();
        for (LocalProcessHandle handle : live) {
            handle.cancel();
        }
        try {
            if (!workers.awaitTermination(CLOSE_GRACE_MS, TimeUnit.MILLISECONDS)) {
                log.warn("Worker pool did not terminate within {}ms", CLOSE_GRACE_MS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Number of submitted commands that have not finished yet.
     *
     * @return live process count
     */
    public int liveCount() {
        return live.size();
    }

    private final class LocalProcessHandle implements RemoteTaskHandle {

        private final String token;
        private final Command command;
        private final AtomicReference<TaskState> state = new AtomicReference<>(TaskState.PENDING);
        private volatile Process process;
        private volatile boolean cancelled;
        private volatile Future<?> future;

        private LocalProcessHandle(String token, Command command) {
            this.token = token;
            this.command = command;
        }

        private void run() {
            try {
                synchronized (this) {
                    if (cancelled) {
                        return;
                    }
                    process = new ProcessBuilder(command.arguments())
                        .redirectErrorStream(true)
                        .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                        .start();
                    state.set(TaskState.RUNNING);
                }

                int exitCode = process.waitFor();
                if (exitCode == 0 && !cancelled) {
                    state.set(TaskState.SUCCESS);
                } else {
                    log.info("{} ({}) exited with code {}", token, command.program(), exitCode);
                    state.set(TaskState.FAILED);
                }
            } catch (IOException e) {
                log.warn("Failed to launch {} ({})", token, command.program(), e);
                state.set(TaskState.FAILED);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                destroy();
                state.set(TaskState.FAILED);
            } finally {
                live.remove(this);
            }
        }

        @Override
        public String token() {
            return token;
        }

        @Override
        public TaskState fetchState(Duration timeout) {
            return state.get();
        }

        @Override
        public boolean cancel() {
            if (state.get().isTerminal()) {
                return false;
            }
            synchronized (this) {
                cancelled = true;
                destroy();
            }
            Future<?> running = future;
            if (running != null && running.cancel(false)) {
                // never started
                live.remove(this);
            }
            state.updateAndGet(current -> current.isTerminal() ? current : TaskState.FAILED);
            return true;
        }

        private void destroy() {
            Process current = process;
            if (current != null && current.isAlive()) {
                current.destroyForcibly();
            }
        }
    }
}
