package com.ryuqq.dispatcher.core.model;

import java.time.Instant;
import java.util.regex.Pattern;

/**
 * 태스크 인스턴스 시도(attempt) 식별자.
 *
 * <p>TaskInstanceKey는 (workflowId, taskId, logicalTimestamp, attemptNumber) 조합으로
 * 하나의 태스크 인스턴스의 한 번의 실행 시도를 고유하게 식별합니다.
 * Executor 내부의 모든 테이블(pending, in-flight, last-observed, event buffer)에서
 * 키로 사용됩니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>workflowId, taskId: null 또는 빈 문자열 불가, 1~250자, 영숫자/하이픈/언더스코어/점만 허용</li>
 *   <li>logicalTimestamp: null 불가</li>
 *   <li>attemptNumber: 1 이상</li>
 * </ul>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * TaskInstanceKey key = TaskInstanceKey.of(
 *     "daily_etl",
 *     "extract_orders",
 *     Instant.parse("2024-01-01T00:00:00Z"),
 *     1
 * );
 * </pre>
 *
 * @param workflowId 워크플로우 ID
 * @param taskId 태스크 ID
 * @param logicalTimestamp 논리적 스케줄 시각
 * @param attemptNumber 시도 번호 (1부터 시작)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record TaskInstanceKey(
    String workflowId,
    String taskId,
    Instant logicalTimestamp,
    int attemptNumber
) {

    private static final Pattern VALID_ID = Pattern.compile("^[a-zA-Z0-9\\-_.]+$");
    private static final int MAX_ID_LENGTH = 250;

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public TaskInstanceKey {
        validateId("workflowId", workflowId);
        validateId("taskId", taskId);
        if (logicalTimestamp == null) {
            throw new IllegalArgumentException("logicalTimestamp cannot be null");
        }
        if (attemptNumber < 1) {
            throw new IllegalArgumentException("attemptNumber must be positive (current: " + attemptNumber + ")");
        }
    }

    /**
     * TaskInstanceKey 생성.
     *
     * @param workflowId 워크플로우 ID
     * @param taskId 태스크 ID
     * @param logicalTimestamp 논리적 스케줄 시각
     * @param attemptNumber 시도 번호
     * @return TaskInstanceKey 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static TaskInstanceKey of(String workflowId, String taskId, Instant logicalTimestamp, int attemptNumber) {
        return new TaskInstanceKey(workflowId, taskId, logicalTimestamp, attemptNumber);
    }

    /**
     * 다음 시도 번호를 가진 키 생성.
     *
     * @return attemptNumber가 1 증가한 새 키
     */
    public TaskInstanceKey nextAttempt() {
        return new TaskInstanceKey(workflowId, taskId, logicalTimestamp, attemptNumber + 1);
    }

    @Override
    public String toString() {
        return workflowId + "." + taskId + "@" + logicalTimestamp + "#" + attemptNumber;
    }

    private static void validateId(String name, String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " cannot be null or blank");
        }
        if (value.length() > MAX_ID_LENGTH) {
            throw new IllegalArgumentException(name + " length cannot exceed " + MAX_ID_LENGTH + " characters");
        }
        if (!VALID_ID.matcher(value).matches()) {
            throw new IllegalArgumentException(
                name + " contains invalid characters. Only alphanumeric, hyphen, underscore and dot are allowed"
            );
        }
    }
}
