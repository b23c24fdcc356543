package com.ryuqq.dispatcher.application.executor;

import com.ryuqq.dispatcher.core.contract.Command;
import com.ryuqq.dispatcher.core.executor.DuplicateKeyException;
import com.ryuqq.dispatcher.core.model.QueueName;
import com.ryuqq.dispatcher.core.model.TaskInstanceKey;
import com.ryuqq.dispatcher.core.outcome.Outcome;
import com.ryuqq.dispatcher.core.protection.ParallelismBudget;
import com.ryuqq.dispatcher.core.spi.RemoteTaskHandle;
import com.ryuqq.dispatcher.core.state.TaskState;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Executor 상태 테이블 (단일 락 도메인).
 *
 * <p>pending 큐, in-flight 테이블, last-observed 테이블, 이벤트 버퍼를 하나의 락 아래에서
 * 소유합니다. 모든 변경은 이 클래스의 메서드를 통해서만 이루어지며,
 * 외부에서 테이블에 직접 접근할 수 없습니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>키는 pending과 in-flight 중 최대 한 곳에만 존재</li>
 *   <li>in-flight 테이블에 키는 최대 한 번만 존재</li>
 *   <li>last-observed 항목은 in-flight 항목이 있는 키에만 존재</li>
 *   <li>종료 결과가 기록된 키는 in-flight와 last-observed에서 이미 제거됨</li>
 * </ul>
 *
 * <p><strong>Handle 검증:</strong> 결과 반영 메서드는 스냅샷 시점의 handle을 함께 받아,
 * 그 사이 취소 등으로 항목이 바뀐 경우 아무것도 변경하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ExecutorState {

    private final ReentrantLock lock = new ReentrantLock();
    private final PendingQueue pending = new PendingQueue();
    private final Map<TaskInstanceKey, InFlightEntry> inFlight = new LinkedHashMap<>();
    private final Map<TaskInstanceKey, TaskState> lastObserved = new HashMap<>();
    private final EventBuffer events = new EventBuffer();
    private long sequence;

    /**
     * pending 큐에 적재.
     *
     * @param key 태스크 인스턴스 키
     * @param command 워커 명령
     * @param queue 대상 큐
     * @param priority 우선순위
     * @return 적재된 항목
     * @throws DuplicateKeyException 이미 pending 또는 in-flight인 경우 (상태 변경 없음)
     */
    public QueuedTask enqueue(TaskInstanceKey key, Command command, QueueName queue, int priority) {
        lock.lock();
        try {
            if (pending.contains(key) || inFlight.containsKey(key)) {
                throw new DuplicateKeyException(key);
            }
            QueuedTask task = new QueuedTask(key, command, queue, priority, sequence++);
            pending.add(task);
            return task;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 예산 내에서 디스패치할 pending 항목 선택.
     *
     * <p>선택된 항목은 pending에 그대로 남아 있으며, {@link #markDispatched} 또는
     * {@link #requeue}로 처리되어야 합니다. 큐별 예산이 찬 항목은 건너뛰고
     * 다음 항목을 계속 검사하며, 전역 예산이 차면 중단합니다.</p>
     *
     * @param budget 병렬성 예산
     * @return 정렬 순서대로의 디스패치 대상
     */
    public List<QueuedTask> selectDispatchable(ParallelismBudget budget) {
        lock.lock();
        try {
            int globalSlots = budget.openSlots(inFlight.size());
            List<QueuedTask> selected = new ArrayList<>();
            if (globalSlots == 0) {
                return selected;
            }

            Map<QueueName, Integer> perQueue = new HashMap<>();
            for (InFlightEntry entry : inFlight.values()) {
                perQueue.merge(entry.queue(), 1, Integer::sum);
            }

            for (QueuedTask task : pending.inOrder()) {
                if (selected.size() >= globalSlots) {
                    break;
                }
                int onQueue = perQueue.getOrDefault(task.queue(), 0);
                if (!budget.hasQueueCapacity(task.queue(), onQueue)) {
                    continue;
                }
                perQueue.put(task.queue(), onQueue + 1);
                selected.add(task);
            }
            return selected;
        } finally {
            lock.unlock();
        }
    }

    /**
     * pending → in-flight 이동.
     *
     * @param task 디스패치된 항목
     * @param handle 브로커 핸들
     * @return 이동 성공 여부 (그 사이 취소되어 pending에 없으면 false)
     */
    public boolean markDispatched(QueuedTask task, RemoteTaskHandle handle) {
        lock.lock();
        try {
            if (pending.remove(task.key()) == null) {
                return false;
            }
            inFlight.put(task.key(), new InFlightEntry(task.key(), handle, task.queue(), System.currentTimeMillis()));
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 디스패치 실패 항목을 pending 큐 끝(새 순번)으로 재적재.
     *
     * @param task 재적재할 항목
     * @return 재적재 여부 (그 사이 취소되어 pending에 없으면 false)
     */
    public boolean requeue(QueuedTask task) {
        lock.lock();
        try {
            if (pending.remove(task.key()) == null) {
                return false;
            }
            pending.add(task.withSequence(sequence++));
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * in-flight 스냅샷.
     *
     * @return 현재 in-flight 항목 목록
     */
    public List<InFlightEntry> snapshotInFlight() {
        lock.lock();
        try {
            return new ArrayList<>(inFlight.values());
        } finally {
            lock.unlock();
        }
    }

    /**
     * 비종료 상태 관측 반영.
     *
     * <p>last-observed와 같으면 아무것도 하지 않습니다 (중복 보고 억제).</p>
     *
     * @param key 태스크 인스턴스 키
     * @param handle 스냅샷 시점의 핸들
     * @param observed 관측 상태 (PENDING 또는 RUNNING)
     * @return 상태가 바뀌어 갱신되었으면 true
     * @throws IllegalArgumentException observed가 종료 상태인 경우
     */
    public boolean observe(TaskInstanceKey key, RemoteTaskHandle handle, TaskState observed) {
        if (observed.isTerminal()) {
            throw new IllegalArgumentException("observe() accepts non-terminal states only (current: " + observed + ")");
        }
        lock.lock();
        try {
            if (!owns(key, handle)) {
                return false;
            }
            return lastObserved.put(key, observed) != observed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 종료 결과 반영: 이벤트 기록 후 in-flight와 last-observed에서 제거.
     *
     * @param key 태스크 인스턴스 키
     * @param handle 스냅샷 시점의 핸들
     * @param outcome 종료 결과
     * @return 반영 여부 (항목이 이미 제거되었거나 다른 핸들이면 false)
     */
    public boolean resolve(TaskInstanceKey key, RemoteTaskHandle handle, Outcome outcome) {
        lock.lock();
        try {
            if (!owns(key, handle)) {
                return false;
            }
            inFlight.remove(key);
            lastObserved.remove(key);
            events.put(key, outcome);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * pending 항목 취소: 큐에서 제거하고 결과 기록.
     *
     * @param key 태스크 인스턴스 키
     * @param outcome 기록할 결과
     * @return pending에 있었으면 true
     */
    public boolean cancelPending(TaskInstanceKey key, Outcome outcome) {
        lock.lock();
        try {
            if (pending.remove(key) == null) {
                return false;
            }
            events.put(key, outcome);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * in-flight 항목 조회.
     *
     * @param key 태스크 인스턴스 키
     * @return in-flight 항목
     */
    public Optional<InFlightEntry> inFlightEntry(TaskInstanceKey key) {
        lock.lock();
        try {
            return Optional.ofNullable(inFlight.get(key));
        } finally {
            lock.unlock();
        }
    }

    /**
     * 마지막으로 관측된 비종료 상태.
     *
     * @param key 태스크 인스턴스 키
     * @return 관측 상태 (없으면 empty)
     */
    public Optional<TaskState> lastObserved(TaskInstanceKey key) {
        lock.lock();
        try {
            return Optional.ofNullable(lastObserved.get(key));
        } finally {
            lock.unlock();
        }
    }

    public boolean contains(TaskInstanceKey key) {
        lock.lock();
        try {
            return pending.contains(key) || inFlight.containsKey(key);
        } finally {
            lock.unlock();
        }
    }

    public Set<TaskInstanceKey> pendingKeys() {
        lock.lock();
        try {
            List<TaskInstanceKey> keys = new ArrayList<>();
            for (QueuedTask task : pending.inOrder()) {
                keys.add(task.key());
            }
            return Set.copyOf(keys);
        } finally {
            lock.unlock();
        }
    }

    public Set<TaskInstanceKey> inFlightKeys() {
        lock.lock();
        try {
            return Set.copyOf(inFlight.keySet());
        } finally {
            lock.unlock();
        }
    }

    public int pendingCount() {
        lock.lock();
        try {
            return pending.size();
        } finally {
            lock.unlock();
        }
    }

    public int inFlightCount() {
        lock.lock();
        try {
            return inFlight.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * 정렬 순서대로의 pending 항목 스냅샷.
     *
     * @return pending 항목 목록
     */
    public List<QueuedTask> pendingInOrder() {
        lock.lock();
        try {
            return pending.inOrder();
        } finally {
            lock.unlock();
        }
    }

    public Map<TaskInstanceKey, Outcome> drainEvents() {
        return events.drain();
    }

    public Map<TaskInstanceKey, Outcome> drainEvents(Set<String> workflowIds) {
        return events.drain(workflowIds);
    }

    public int bufferedEventCount() {
        return events.size();
    }

    private boolean owns(TaskInstanceKey key, RemoteTaskHandle handle) {
        InFlightEntry entry = inFlight.get(key);
        return entry != null && entry.handle() == handle;
    }
}
