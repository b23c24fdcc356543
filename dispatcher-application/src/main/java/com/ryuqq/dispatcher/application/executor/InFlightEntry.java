package com.ryuqq.dispatcher.application.executor;

import com.ryuqq.dispatcher.core.model.QueueName;
import com.ryuqq.dispatcher.core.model.TaskInstanceKey;
import com.ryuqq.dispatcher.core.spi.RemoteTaskHandle;

/**
 * in-flight 테이블 항목.
 *
 * <p>handle은 이 항목이 독점 소유하며, 항목이 제거되면 함께 폐기됩니다.</p>
 *
 * @param key 태스크 인스턴스 키
 * @param handle 브로커 핸들
 * @param queue 디스패치된 큐
 * @param dispatchedAtMillis 디스패치 시각 (epoch millis)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record InFlightEntry(
    TaskInstanceKey key,
    RemoteTaskHandle handle,
    QueueName queue,
    long dispatchedAtMillis
) {

    public InFlightEntry {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (handle == null) {
            throw new IllegalArgumentException("handle cannot be null");
        }
        if (queue == null) {
            throw new IllegalArgumentException("queue cannot be null");
        }
    }
}
