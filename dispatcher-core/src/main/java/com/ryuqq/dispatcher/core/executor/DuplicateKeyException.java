package com.ryuqq.dispatcher.core.executor;

import com.ryuqq.dispatcher.core.model.TaskInstanceKey;

/**
 * 이미 pending 또는 in-flight인 키를 다시 적재하려 할 때 발생.
 *
 * <p>호출자 버그이며 재시도하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class DuplicateKeyException extends RuntimeException {

    private final TaskInstanceKey key;

    /**
     * 생성자.
     *
     * @param key 중복된 키
     */
    public DuplicateKeyException(TaskInstanceKey key) {
        super("Task is already queued or running: " + key);
        this.key = key;
    }

    /**
     * 중복된 키 조회.
     *
     * @return 중복된 키
     */
    public TaskInstanceKey getKey() {
        return key;
    }
}
