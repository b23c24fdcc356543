package com.ryuqq.dispatcher.application.executor;

import com.ryuqq.dispatcher.core.model.TaskInstanceKey;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * 디스패치 대기 큐.
 *
 * <p>(priority 내림차순, sequence 오름차순)으로 정렬됩니다.
 * 스레드 안전하지 않으며, {@link ExecutorState}의 락 아래에서만 사용됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class PendingQueue {

    private static final Comparator<QueuedTask> ORDER = Comparator
        .comparingInt(QueuedTask::priority).reversed()
        .thenComparingLong(QueuedTask::sequence);

    private final TreeSet<QueuedTask> ordered = new TreeSet<>(ORDER);
    private final Map<TaskInstanceKey, QueuedTask> byKey = new HashMap<>();

    void add(QueuedTask task) {
        byKey.put(task.key(), task);
        ordered.add(task);
    }

    QueuedTask remove(TaskInstanceKey key) {
        QueuedTask task = byKey.remove(key);
        if (task != null) {
            ordered.remove(task);
        }
        return task;
    }

    boolean contains(TaskInstanceKey key) {
        return byKey.containsKey(key);
    }

    /**
     * 정렬 순서대로의 스냅샷.
     */
    List<QueuedTask> inOrder() {
        return new ArrayList<>(ordered);
    }

    int size() {
        return byKey.size();
    }
}
