package com.ryuqq.dispatcher.adapter.runner;

import com.ryuqq.dispatcher.application.executor.BaseExecutor;
import com.ryuqq.dispatcher.application.executor.InFlightEntry;
import com.ryuqq.dispatcher.application.executor.QueuedTask;
import com.ryuqq.dispatcher.core.executor.ExecutorFatalException;
import com.ryuqq.dispatcher.core.model.TaskInstanceKey;
import com.ryuqq.dispatcher.core.outcome.Fail;
import com.ryuqq.dispatcher.core.outcome.Ok;
import com.ryuqq.dispatcher.core.spi.DispatchException;
import com.ryuqq.dispatcher.core.spi.MessageBroker;
import com.ryuqq.dispatcher.core.spi.RemoteTaskHandle;
import com.ryuqq.dispatcher.core.state.PollResult;
import com.ryuqq.dispatcher.core.state.TaskState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 브로커 기반 분산 Executor.
 *
 * <p>MessageBroker로 명령을 제출하고, heartbeat마다 모든 in-flight 핸들의 원격 상태를
 * 병렬로 조회하여 종료 결과를 이벤트 버퍼에 기록합니다.</p>
 *
 * <p><strong>sync() 처리 규칙:</strong></p>
 * <pre>
 * snapshotInFlight() → StatePoller.pollAll() (모든 조회 완료까지 대기)
 *   ↓
 * For each (entry, result):
 *   - PENDING/RUNNING (이전과 동일) → 무시
 *   - PENDING/RUNNING (변경)       → last-observed 갱신
 *   - SUCCESS                      → Ok 기록, in-flight 제거
 *   - FAILED                       → Fail(TASK_FAILED) 기록, in-flight 제거
 *   - LookupError                  → error 로그 (FETCH_ERR_MSG_HEADER) + Fail(STATE_FETCH_FAILED) 기록, in-flight 제거
 * </pre>
 *
 * <p><strong>종료:</strong></p>
 * <ul>
 *   <li>shutdown(true): in-flight가 비거나 shutdownTimeout이 지날 때까지 sync 반복 (타임아웃 시 경고 후 진행)</li>
 *   <li>shutdown(false): 조회 풀을 중단하고, 브로커가 지원하면 in-flight 핸들을 취소하여 CANCELLED로 기록</li>
 *   <li>두 경우 모두 반환 전에 브로커를 close</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class DistributedExecutor extends BaseExecutor {

    /**
     * 상태 조회 실패 로그의 고정 마커. 로그 수집기의 알림 조건으로 사용됩니다.
     */
    public static final String FETCH_ERR_MSG_HEADER = "Error fetching task state";

    /**
     * 마커, 키, 오류 설명 순서. 원인 예외가 있으면 마지막 인자로 전달됩니다.
     */
    static final String FETCH_ERR_LOG_FORMAT = "{}:{}\n{}";

    private final Logger log;
    private final MessageBroker broker;
    private final DistributedExecutorConfig config;
    private final StatePoller poller;
    private final AtomicBoolean cancelRequested = new AtomicBoolean(false);

    /**
     * 생성자.
     *
     * @param broker 메시지 브로커
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public DistributedExecutor(MessageBroker broker, DistributedExecutorConfig config) {
        this(broker, config, LoggerFactory.getLogger(DistributedExecutor.class));
    }

    DistributedExecutor(MessageBroker broker, DistributedExecutorConfig config, Logger log) {
        super(requireConfig(config).toBudget(), config.maxConsecutiveDispatchFailures());
        if (broker == null) {
            throw new IllegalArgumentException("broker cannot be null");
        }
        if (log == null) {
            throw new IllegalArgumentException("log cannot be null");
        }
        this.log = log;
        this.broker = broker;
        this.config = config;
        this.poller = new StatePoller(config.pollConcurrency(), Duration.ofMillis(config.pollTimeoutMs()));

        log.info("DistributedExecutor started (broker={}, resultBackend={}, parallelism={}, pollConcurrency={})",
            config.brokerUri(), config.resultBackendUri(), config.parallelism(), config.pollConcurrency());
    }

    @Override
    protected RemoteTaskHandle executeAsync(QueuedTask task) {
        RemoteTaskHandle handle = broker.submit(task.command(), task.queue());
        if (handle == null) {
            throw new DispatchException("Broker returned no handle for " + task.key());
        }
        return handle;
    }

    @Override
    protected boolean supportsCancellation() {
        return broker.supportsCancellation();
    }

    @Override
    public void sync() {
        if (poller.isShutdown()) {
            return;
        }

        List<InFlightEntry> snapshot = state.snapshotInFlight();
        if (snapshot.isEmpty()) {
            return;
        }

        List<StatePoller.Polled> results = poller.pollAll(snapshot);
        for (StatePoller.Polled polled : results) {
            apply(polled.entry(), polled.result());
        }
    }

    @Override
    public void shutdown(boolean waitForCompletion) {
        if (!markShutdownRequested()) {
            log.debug("Shutdown already requested, ignoring");
            return;
        }

        log.info("Shutting down executor (wait={}, inFlight={}, pending={})",
            waitForCompletion, state.inFlightCount(), state.pendingCount());
        try {
            if (waitForCompletion) {
                awaitInFlight();
            } else {
                cancelOutstanding();
            }
        } finally {
            poller.shutdownNow(Duration.ofMillis(StatePoller.JOIN_GRACE_MS));
            closeBroker();
        }
        log.info("Executor shut down ({} tasks left pending)", state.pendingCount());
    }

    private void apply(InFlightEntry entry, PollResult result) {
        TaskInstanceKey key = entry.key();
        RemoteTaskHandle handle = entry.handle();

        if (result instanceof PollResult.Observed observed) {
            TaskState observedState = observed.state();
            switch (observedState) {
                case PENDING, RUNNING -> {
                    if (state.observe(key, handle, observedState)) {
                        log.debug("{} is now {}", key, observedState);
                    }
                }
                case SUCCESS -> {
                    if (state.resolve(key, handle, Ok.of())) {
                        log.debug("{} finished with SUCCESS", key);
                    }
                }
                case FAILED -> {
                    if (state.resolve(key, handle,
                            Fail.of(Fail.TASK_FAILED, "Task reported FAILED by broker", "token=" + handle.token()))) {
                        log.info("{} finished with FAILED", key);
                    }
                }
            }
            return;
        }

        PollResult.LookupError error = (PollResult.LookupError) result;
        if (cancelRequested.get()) {
            // shutdown(false) 경로가 정리함
            return;
        }

        log.error(FETCH_ERR_LOG_FORMAT, FETCH_ERR_MSG_HEADER, key, error.describe(), error.cause());
        state.resolve(key, handle, Fail.of(Fail.STATE_FETCH_FAILED, "Task state could not be fetched", error.describe()));
    }

    private void awaitInFlight() {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(config.shutdownTimeoutMs());

        while (true) {
            sync();
            int remaining = state.inFlightCount();
            if (remaining == 0) {
                return;
            }
            if (System.nanoTime() - deadline >= 0) {
                log.warn("Shutdown timed out after {}ms with {} tasks still in flight",
                    config.shutdownTimeoutMs(), remaining);
                return;
            }
            log.info("Waiting for {} in-flight tasks to finish", remaining);
            try {
                Thread.sleep(config.shutdownPollIntervalMs());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for {} in-flight tasks", remaining);
                return;
            }
        }
    }

    private void cancelOutstanding() {
        cancelRequested.set(true);
        poller.shutdownNow(Duration.ofMillis(StatePoller.JOIN_GRACE_MS));

        List<InFlightEntry> outstanding = state.snapshotInFlight();
        if (outstanding.isEmpty()) {
            return;
        }
        if (!broker.supportsCancellation()) {
            log.warn("Broker does not support cancellation, {} tasks left in flight", outstanding.size());
            return;
        }
        for (InFlightEntry entry : outstanding) {
            cancelInFlight(entry, "Cancelled by executor shutdown");
        }
    }

    private void closeBroker() {
        try {
            broker.close();
        } catch (RuntimeException e) {
            log.warn("Failed to close broker {}", config.brokerUri(), e);
        }
    }

    private static DistributedExecutorConfig requireConfig(DistributedExecutorConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        return config;
    }
}
