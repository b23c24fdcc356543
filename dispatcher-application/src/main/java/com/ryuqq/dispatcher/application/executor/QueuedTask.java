package com.ryuqq.dispatcher.application.executor;

import com.ryuqq.dispatcher.core.contract.Command;
import com.ryuqq.dispatcher.core.model.QueueName;
import com.ryuqq.dispatcher.core.model.TaskInstanceKey;

/**
 * pending 큐의 항목.
 *
 * @param key 태스크 인스턴스 키
 * @param command 워커 명령
 * @param queue 대상 큐
 * @param priority 우선순위 (클수록 먼저)
 * @param sequence 적재 순번 (동순위 정렬용, 재적재 시 새 순번 부여)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record QueuedTask(
    TaskInstanceKey key,
    Command command,
    QueueName queue,
    int priority,
    long sequence
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null인 경우
     */
    public QueuedTask {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (command == null) {
            throw new IllegalArgumentException("command cannot be null");
        }
        if (queue == null) {
            throw new IllegalArgumentException("queue cannot be null");
        }
    }

    /**
     * 순번만 변경한 새 인스턴스 생성 (재적재용).
     */
    QueuedTask withSequence(long sequence) {
        return new QueuedTask(key, command, queue, priority, sequence);
    }
}
