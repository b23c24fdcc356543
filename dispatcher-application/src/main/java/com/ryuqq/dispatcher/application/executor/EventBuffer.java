package com.ryuqq.dispatcher.application.executor;

import com.ryuqq.dispatcher.core.model.TaskInstanceKey;
import com.ryuqq.dispatcher.core.outcome.Outcome;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * 스케줄러로 돌려줄 종료 결과 버퍼.
 *
 * <p>키별 종료 결과를 drain될 때까지 누적합니다. 모든 메서드는 동기화되어 있어
 * 두 키가 동시에 종료되어도 갱신이 유실되지 않습니다.</p>
 *
 * <p>Executor 자신은 버퍼를 drain하지 않으며, drain은 스케줄러만 수행합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class EventBuffer {

    private final Map<TaskInstanceKey, Outcome> events = new LinkedHashMap<>();

    /**
     * 결과 기록. 같은 키의 이전 결과는 덮어씁니다.
     *
     * @param key 태스크 인스턴스 키
     * @param outcome 종료 결과
     * @throws IllegalArgumentException key 또는 outcome이 null인 경우
     */
    public synchronized void put(TaskInstanceKey key, Outcome outcome) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (outcome == null) {
            throw new IllegalArgumentException("outcome cannot be null");
        }
        events.put(key, outcome);
    }

    /**
     * 모든 결과를 반환하고 비움.
     *
     * @return 불변 맵 (기록 순서 유지)
     */
    public synchronized Map<TaskInstanceKey, Outcome> drain() {
        if (events.isEmpty()) {
            return Map.of();
        }
        Map<TaskInstanceKey, Outcome> drained = Collections.unmodifiableMap(new LinkedHashMap<>(events));
        events.clear();
        return drained;
    }

    /**
     * 지정한 워크플로우의 결과만 반환하고 제거.
     *
     * @param workflowIds 대상 워크플로우 ID 집합
     * @return 불변 맵 (기록 순서 유지)
     * @throws IllegalArgumentException workflowIds가 null인 경우
     */
    public synchronized Map<TaskInstanceKey, Outcome> drain(Set<String> workflowIds) {
        if (workflowIds == null) {
            throw new IllegalArgumentException("workflowIds cannot be null");
        }
        Map<TaskInstanceKey, Outcome> drained = new LinkedHashMap<>();
        Iterator<Map.Entry<TaskInstanceKey, Outcome>> it = events.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<TaskInstanceKey, Outcome> entry = it.next();
            if (workflowIds.contains(entry.getKey().workflowId())) {
                drained.put(entry.getKey(), entry.getValue());
                it.remove();
            }
        }
        return Collections.unmodifiableMap(drained);
    }

    /**
     * 버퍼에 쌓인 결과 수.
     *
     * @return 결과 수
     */
    public synchronized int size() {
        return events.size();
    }
}
