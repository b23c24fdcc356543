package com.ryuqq.dispatcher.adapter.runner;

import com.ryuqq.dispatcher.application.executor.InFlightEntry;
import com.ryuqq.dispatcher.core.executor.ExecutorFatalException;
import com.ryuqq.dispatcher.core.spi.RemoteTaskHandle;
import com.ryuqq.dispatcher.core.state.PollResult;
import com.ryuqq.dispatcher.core.state.TaskState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * in-flight 핸들 상태 조회 fan-out.
 *
 * <p>고정 크기 스레드 풀에서 핸들별 조회를 병렬로 실행하고, 모든 조회가 끝날 때까지
 * 대기한 뒤 결과를 스냅샷 순서대로 반환합니다. 테이블 변경은 하지 않습니다.</p>
 *
 * <p><strong>조회 격리:</strong></p>
 * <ul>
 *   <li>fetchState 예외 → {@link PollResult.LookupError}</li>
 *   <li>null 응답 → {@link PollResult#malformed(String)}</li>
 *   <li>조회 타임아웃 → 해당 조회 취소 후 LookupError(TimeoutException)</li>
 *   <li>풀 종료로 실행되지 못한 조회 → LookupError</li>
 * </ul>
 *
 * <p><strong>타임아웃 기준:</strong> 각 조회의 대기 한도는 풀 스레드에서 실제로 시작된 시점부터
 * {@code pollTimeout + JOIN_GRACE_MS}입니다. 앞선 조회 때문에 큐에서 기다린 시간은 포함되지 않습니다.</p>
 *
 * <p><strong>멈춘 조회:</strong> 타임아웃된 조회는 인터럽트 후 포기하고, 풀을 새 풀로 교체합니다.
 * 대기 중이던 조회는 새 풀로 옮겨 실행되며, 인터럽트를 무시하는 스레드는 이전 풀에 남아
 * 호출이 반환될 때 종료됩니다.</p>
 *
 * <p>패스 한도({@code (pollTimeout + JOIN_GRACE_MS) × (rounds + 1)}) 안에 시작조차 못 한 조회는
 * 결과에서 제외되며, 해당 키는 in-flight에 남아 다음 패스에서 다시 조회됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class StatePoller {

    static final long JOIN_GRACE_MS = 250;

    private static final long START_CHECK_MS = 10;
    private static final Logger log = LoggerFactory.getLogger(StatePoller.class);

    private final Object poolLock = new Object();
    private final AtomicInteger threadCounter = new AtomicInteger(1);
    private final int concurrency;
    private final Duration pollTimeout;
    private volatile ThreadPoolExecutor pool;
    private volatile boolean shutdown;

    /**
     * 생성자.
     *
     * @param concurrency 동시 조회 수
     * @param pollTimeout 개별 조회 타임아웃
     */
    StatePoller(int concurrency, Duration pollTimeout) {
        if (concurrency <= 0) {
            throw new IllegalArgumentException("concurrency must be positive (current: " + concurrency + ")");
        }
        if (pollTimeout == null || pollTimeout.isZero() || pollTimeout.isNegative()) {
            throw new IllegalArgumentException("pollTimeout must be positive (current: " + pollTimeout + ")");
        }
        this.concurrency = concurrency;
        this.pollTimeout = pollTimeout;
        this.pool = newPool();
    }

    /**
     * 스냅샷의 핸들을 한 번씩 조회.
     *
     * @param entries in-flight 스냅샷
     * @return 스냅샷 순서대로의 조회 결과 (패스 안에 시작하지 못한 항목 제외)
     * @throws ExecutorFatalException 대기 중 제어 스레드가 인터럽트된 경우
     */
    List<Polled> pollAll(List<InFlightEntry> entries) {
        List<PollTask> tasks = new ArrayList<>(entries.size());
        for (InFlightEntry entry : entries) {
            tasks.add(submit(entry));
        }

        long pollBudgetNanos = TimeUnit.MILLISECONDS.toNanos(pollTimeout.toMillis() + JOIN_GRACE_MS);
        long rounds = (entries.size() + concurrency - 1) / concurrency;
        long passDeadline = System.nanoTime() + pollBudgetNanos * (rounds + 1);

        List<Polled> results = new ArrayList<>(entries.size());
        int deferred = 0;
        for (PollTask task : tasks) {
            PollResult result;
            try {
                result = join(task, pollBudgetNanos, passDeadline);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                for (PollTask remaining : tasks) {
                    remaining.future.cancel(true);
                }
                throw new ExecutorFatalException("Interrupted while waiting for task state polls", e);
            }
            if (result == null) {
                deferred++;
            } else {
                results.add(new Polled(task.entry, result));
            }
        }

        if (deferred > 0) {
            log.warn("{} state polls did not start within this pass, keys stay in flight for the next pass", deferred);
        }
        return results;
    }

    /**
     * 진행 중인 조회를 중단하고 풀 종료. 실행되지 못한 조회는 취소됩니다.
     *
     * @param grace 종료 대기 시간
     */
    void shutdownNow(Duration grace) {
        ThreadPoolExecutor current;
        synchronized (poolLock) {
            shutdown = true;
            current = pool;
        }
        for (Runnable queued : current.shutdownNow()) {
            if (queued instanceof Future<?> future) {
                future.cancel(false);
            }
        }
        try {
            current.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    boolean isShutdown() {
        return shutdown;
    }

    /**
     * 단일 핸들 조회 (풀 스레드에서 실행).
     */
    PollResult pollOne(RemoteTaskHandle handle) {
        try {
            TaskState state = handle.fetchState(pollTimeout);
            if (state == null) {
                return PollResult.malformed("Result backend returned no recognizable state for " + handle.token());
            }
            return PollResult.observed(state);
        } catch (Exception e) {
            return PollResult.lookupError(e);
        }
    }

    private PollTask submit(InFlightEntry entry) {
        PollTask task = new PollTask(entry);
        synchronized (poolLock) {
            try {
                task.future = pool.submit(task);
            } catch (RejectedExecutionException e) {
                task.future = CompletableFuture.completedFuture(PollResult.lookupError(e));
            }
        }
        return task;
    }

    /**
     * 조회 결과 대기.
     *
     * @return 조회 결과, 패스 한도 안에 시작하지 못했으면 null
     */
    private PollResult join(PollTask task, long pollBudgetNanos, long passDeadline) throws InterruptedException {
        Future<PollResult> future = task.future;
        while (true) {
            try {
                if (task.isStarted()) {
                    long remaining = task.startedAtNanos + pollBudgetNanos - System.nanoTime();
                    return future.get(Math.max(0, remaining), TimeUnit.NANOSECONDS);
                }

                long untilPassEnd = passDeadline - System.nanoTime();
                if (untilPassEnd <= 0) {
                    if (task.skip()) {
                        future.cancel(false);
                        return null;
                    }
                    continue;
                }
                return future.get(Math.min(untilPassEnd, TimeUnit.MILLISECONDS.toNanos(START_CHECK_MS)),
                    TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                if (task.isStarted() && System.nanoTime() - (task.startedAtNanos + pollBudgetNanos) >= 0) {
                    replacePool();
                    future.cancel(true);
                    return PollResult.lookupError(new TimeoutException(
                        "State poll for " + task.entry.key() + " exceeded " + pollTimeout.toMillis() + "ms"
                    ));
                }
            } catch (ExecutionException e) {
                return PollResult.lookupError(e.getCause() != null ? e.getCause() : e);
            } catch (CancellationException e) {
                return PollResult.lookupError(e);
            }
        }
    }

    /**
     * 타임아웃된 조회가 스레드를 붙잡고 있을 수 있으므로 풀을 교체하고 대기 중인 조회를 옮김.
     */
    private void replacePool() {
        synchronized (poolLock) {
            if (shutdown) {
                return;
            }
            ThreadPoolExecutor retired = pool;
            pool = newPool();

            List<Runnable> queued = new ArrayList<>();
            retired.getQueue().drainTo(queued);
            retired.shutdown();
            for (Runnable waiting : queued) {
                pool.execute(waiting);
            }
            log.debug("Replaced state poll pool after a timed-out poll ({} queued polls moved)", queued.size());
        }
    }

    private ThreadPoolExecutor newPool() {
        return new ThreadPoolExecutor(concurrency, concurrency, 0L, TimeUnit.MILLISECONDS,
            new LinkedBlockingQueue<>(), new PollThreadFactory(threadCounter));
    }

    /**
     * 조회 대상 항목과 결과.
     *
     * @param entry 스냅샷 시점의 in-flight 항목
     * @param result 조회 결과
     */
    record Polled(InFlightEntry entry, PollResult result) {
    }

    private final class PollTask implements Callable<PollResult> {

        private static final int NEW = 0;
        private static final int STARTED = 1;
        private static final int SKIPPED = 2;

        private final InFlightEntry entry;
        private final AtomicInteger phase = new AtomicInteger(NEW);
        private volatile long startedAtNanos;
        private volatile Future<PollResult> future;

        private PollTask(InFlightEntry entry) {
            this.entry = entry;
        }

        @Override
        public PollResult call() {
            startedAtNanos = System.nanoTime();
            if (!phase.compareAndSet(NEW, STARTED)) {
                return null;
            }
            return pollOne(entry.handle());
        }

        private boolean isStarted() {
            return phase.get() == STARTED;
        }

        private boolean skip() {
            return phase.compareAndSet(NEW, SKIPPED);
        }
    }

    private static final class PollThreadFactory implements ThreadFactory {

        private final AtomicInteger counter;

        private PollThreadFactory(AtomicInteger counter) {
            this.counter = counter;
        }

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "dispatcher-poll-" + counter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        }
    }
}
