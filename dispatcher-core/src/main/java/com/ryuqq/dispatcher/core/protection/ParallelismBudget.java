package com.ryuqq.dispatcher.core.protection;

import com.ryuqq.dispatcher.core.model.QueueName;

import java.util.Map;

/**
 * 동시 in-flight 수 제한 (backpressure).
 *
 * <p>전역 예산과 선택적인 큐별 예산을 함께 표현합니다.
 * 큐별 예산이 없는 큐는 전역 예산만 적용됩니다.</p>
 *
 * <p><strong>불변식:</strong> size(in-flight) ≤ global, size(in-flight on queue) ≤ perQueue(queue)</p>
 *
 * @param global 전역 최대 in-flight 수 (양수)
 * @param perQueue 큐 이름별 최대 in-flight 수 (모든 값 양수, 빈 맵 허용)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ParallelismBudget(int global, Map<String, Integer> perQueue) {

    /**
     * Compact constructor with validation.
     *
     * @throws IllegalArgumentException if global is not positive or any per-queue limit is not positive
     */
    public ParallelismBudget {
        if (global <= 0) {
            throw new IllegalArgumentException("global must be positive (current: " + global + ")");
        }
        if (perQueue == null) {
            throw new IllegalArgumentException("perQueue cannot be null");
        }
        for (Map.Entry<String, Integer> entry : perQueue.entrySet()) {
            if (entry.getValue() == null || entry.getValue() <= 0) {
                throw new IllegalArgumentException(
                    "perQueue limit must be positive (queue: " + entry.getKey() + ", current: " + entry.getValue() + ")"
                );
            }
        }
        perQueue = Map.copyOf(perQueue);
    }

    /**
     * 전역 예산만 가진 인스턴스 생성.
     *
     * @param global 전역 최대 in-flight 수
     * @return ParallelismBudget 인스턴스
     */
    public static ParallelismBudget of(int global) {
        return new ParallelismBudget(global, Map.of());
    }

    /**
     * 전역 예산 기준 남은 슬롯 수.
     *
     * @param inFlight 현재 in-flight 수
     * @return 남은 슬롯 수 (0 이상)
     */
    public int openSlots(int inFlight) {
        return Math.max(0, global - inFlight);
    }

    /**
     * 큐에 적용되는 최대 in-flight 수.
     *
     * @param queue 큐
     * @return 큐별 예산이 있으면 그 값, 없으면 전역 예산
     */
    public int limitFor(QueueName queue) {
        Integer limit = perQueue.get(queue.getValue());
        return limit != null ? Math.min(limit, global) : global;
    }

    /**
     * 큐에 슬롯이 남아 있는지 확인.
     *
     * @param queue 큐
     * @param inFlightOnQueue 해당 큐의 현재 in-flight 수
     * @return 추가 디스패치 가능 여부
     */
    public boolean hasQueueCapacity(QueueName queue, int inFlightOnQueue) {
        return inFlightOnQueue < limitFor(queue);
    }
}
