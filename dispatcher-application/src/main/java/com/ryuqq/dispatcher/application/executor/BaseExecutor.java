package com.ryuqq.dispatcher.application.executor;

import com.ryuqq.dispatcher.core.contract.Command;
import com.ryuqq.dispatcher.core.executor.Executor;
import com.ryuqq.dispatcher.core.executor.ExecutorFatalException;
import com.ryuqq.dispatcher.core.model.QueueName;
import com.ryuqq.dispatcher.core.model.TaskInstanceKey;
import com.ryuqq.dispatcher.core.outcome.Fail;
import com.ryuqq.dispatcher.core.outcome.Outcome;
import com.ryuqq.dispatcher.core.protection.ParallelismBudget;
import com.ryuqq.dispatcher.core.spi.DispatchException;
import com.ryuqq.dispatcher.core.spi.RemoteTaskHandle;
import com.ryuqq.dispatcher.core.state.TaskState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 브로커 중립적인 Executor 골격.
 *
 * <p>적재, 예산 기반 디스패치, 하트비트, 결과 drain, 취소 등 모든 Executor가 공유하는
 * 부기(bookkeeping)를 구현합니다. 하위 클래스는 실제 제출({@link #executeAsync}),
 * 상태 동기화({@link #sync}), 종료({@link #shutdown})만 구현합니다.</p>
 *
 * <p><strong>디스패치 흐름:</strong></p>
 * <pre>
 * triggerPending()
 *   ↓
 * selectDispatchable(budget) → [task1, task2, ...]   (pending에 남아 있음)
 *   ↓
 * For each task:
 *   - executeAsync(task) 성공 → markDispatched (pending → in-flight), 연속 실패 카운터 초기화
 *   - DispatchException     → requeue (pending 끝으로), 연속 실패 카운터 증가
 *                             임계값 도달 시 ExecutorFatalException
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class BaseExecutor implements Executor {

    private static final Logger log = LoggerFactory.getLogger(BaseExecutor.class);

    protected final ExecutorState state;
    private final ParallelismBudget budget;
    private final int maxConsecutiveDispatchFailures;
    private final AtomicBoolean shutdownRequested = new AtomicBoolean(false);
    private int consecutiveDispatchFailures;

    /**
     * 생성자.
     *
     * @param budget 병렬성 예산
     * @param maxConsecutiveDispatchFailures 치명적 오류로 승격할 연속 디스패치 실패 수
     * @throws IllegalArgumentException budget이 null이거나 임계값이 양수가 아닌 경우
     */
    protected BaseExecutor(ParallelismBudget budget, int maxConsecutiveDispatchFailures) {
        if (budget == null) {
            throw new IllegalArgumentException("budget cannot be null");
        }
        if (maxConsecutiveDispatchFailures <= 0) {
            throw new IllegalArgumentException(
                "maxConsecutiveDispatchFailures must be positive (current: " + maxConsecutiveDispatchFailures + ")"
            );
        }
        this.state = new ExecutorState();
        this.budget = budget;
        this.maxConsecutiveDispatchFailures = maxConsecutiveDispatchFailures;
    }

    /**
     * 브로커로 제출.
     *
     * @param task 디스패치할 항목
     * @return 브로커 핸들
     * @throws DispatchException 제출 실패 시
     */
    protected abstract RemoteTaskHandle executeAsync(QueuedTask task);

    /**
     * 원격 취소 지원 여부.
     *
     * @return 지원하면 true
     */
    protected abstract boolean supportsCancellation();

    @Override
    public void queue(TaskInstanceKey key, Command command, QueueName queue, int priority) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (command == null) {
            throw new IllegalArgumentException("command cannot be null");
        }
        if (queue == null) {
            throw new IllegalArgumentException("queue cannot be null");
        }
        if (isShutdownRequested()) {
            throw new IllegalStateException("Executor is shut down, cannot queue " + key);
        }

        state.enqueue(key, command, queue, priority);
        log.debug("Queued {} on {} with priority {}", key, queue.getValue(), priority);
    }

    @Override
    public void triggerPending() {
        if (isShutdownRequested()) {
            return;
        }

        List<QueuedTask> batch = state.selectDispatchable(budget);
        for (QueuedTask task : batch) {
            if (isShutdownRequested()) {
                return;
            }
            dispatch(task);
        }
    }

    @Override
    public void heartbeat() {
        int inFlight = state.inFlightCount();
        log.debug("{} running task instances", inFlight);
        log.debug("{} in queue", state.pendingCount());
        log.debug("{} open slots", budget.openSlots(inFlight));

        triggerPending();
        sync();
    }

    @Override
    public Map<TaskInstanceKey, Outcome> drainEvents() {
        return state.drainEvents();
    }

    @Override
    public Map<TaskInstanceKey, Outcome> drainEvents(Set<String> workflowIds) {
        return state.drainEvents(workflowIds);
    }

    @Override
    public boolean cancel(TaskInstanceKey key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }

        if (state.cancelPending(key, Fail.of(Fail.CANCELLED, "Cancelled before dispatch"))) {
            log.info("Cancelled pending task {}", key);
            return true;
        }

        Optional<InFlightEntry> entry = state.inFlightEntry(key);
        if (entry.isEmpty()) {
            return false;
        }
        return cancelInFlight(entry.get(), "Cancelled while in flight");
    }

    @Override
    public boolean hasTask(TaskInstanceKey key) {
        return state.contains(key);
    }

    @Override
    public Set<TaskInstanceKey> pendingKeys() {
        return state.pendingKeys();
    }

    @Override
    public Set<TaskInstanceKey> inFlightKeys() {
        return state.inFlightKeys();
    }

    @Override
    public int openSlots() {
        return budget.openSlots(state.inFlightCount());
    }

    /**
     * 마지막으로 관측된 비종료 상태 (중복 보고 억제용).
     *
     * @param key 태스크 인스턴스 키
     * @return 관측 상태 (없으면 empty)
     */
    public Optional<TaskState> lastObservedState(TaskInstanceKey key) {
        return state.lastObserved(key);
    }

    /**
     * in-flight 항목 취소: 지원 시 원격 취소를 요청하고, CANCELLED로 종결.
     *
     * @param entry in-flight 항목
     * @param reason 결과 메시지
     * @return 종결 여부
     */
    protected boolean cancelInFlight(InFlightEntry entry, String reason) {
        String cause = "token=" + entry.handle().token();
        if (supportsCancellation()) {
            try {
                if (!entry.handle().cancel()) {
                    cause += ", revoke not acknowledged";
                }
            } catch (RuntimeException e) {
                log.warn("Failed to revoke {} ({})", entry.key(), entry.handle().token(), e);
                cause += ", revoke failed: " + e.getClass().getName();
            }
        } else {
            cause += ", revoke unsupported by broker";
        }

        boolean resolved = state.resolve(entry.key(), entry.handle(), Fail.of(Fail.CANCELLED, reason, cause));
        if (resolved) {
            log.info("Cancelled in-flight task {} ({})", entry.key(), cause);
        }
        return resolved;
    }

    /**
     * 종료 요청 표시.
     *
     * @return 처음 요청한 경우 true (이미 종료 중이면 false)
     */
    protected boolean markShutdownRequested() {
        return shutdownRequested.compareAndSet(false, true);
    }

    protected boolean isShutdownRequested() {
        return shutdownRequested.get();
    }

    private void dispatch(QueuedTask task) {
        RemoteTaskHandle handle;
        try {
            handle = executeAsync(task);
        } catch (RuntimeException e) {
            DispatchException failure = e instanceof DispatchException dispatchException
                ? dispatchException
                : new DispatchException("Unexpected submit failure for " + task.key(), e);
            onDispatchFailure(task, failure);
            return;
        }

        consecutiveDispatchFailures = 0;
        if (state.markDispatched(task, handle)) {
            log.debug("Dispatched {} to {} ({})", task.key(), task.queue().getValue(), handle.token());
            return;
        }

        // cancelled between selection and submission
        log.warn("{} was cancelled during dispatch, revoking {}", task.key(), handle.token());
        if (supportsCancellation()) {
            try {
                handle.cancel();
            } catch (RuntimeException e) {
                log.warn("Failed to revoke {} ({})", task.key(), handle.token(), e);
            }
        }
    }

    private void onDispatchFailure(QueuedTask task, DispatchException failure) {
        state.requeue(task);
        consecutiveDispatchFailures++;
        log.warn("Dispatch of {} failed ({}/{} consecutive), requeued: {}",
            task.key(), consecutiveDispatchFailures, maxConsecutiveDispatchFailures, failure.getMessage());

        if (consecutiveDispatchFailures >= maxConsecutiveDispatchFailures) {
            int failures = consecutiveDispatchFailures;
            // 호출자가 heartbeat를 계속하면 새 재시도 예산으로 시작
            consecutiveDispatchFailures = 0;
            log.error("Broker unreachable after {} consecutive dispatch failures", failures, failure);
            throw new ExecutorFatalException(
                "Broker unreachable after " + failures + " consecutive dispatch failures",
                failure
            );
        }
    }
}
