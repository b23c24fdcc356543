package com.ryuqq.dispatcher.core.model;

import java.util.regex.Pattern;

/**
 * 브로커 큐(리소스 풀) 이름.
 *
 * <p>QueueName은 태스크가 디스패치될 브로커 큐를 지정하며,
 * 큐별 병렬성 예산(per-queue parallelism)의 단위로도 사용됩니다.</p>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~100자</li>
 *   <li>패턴: 영숫자, 하이픈(-), 언더스코어(_), 점(.)만 허용</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class QueueName {

    /**
     * 큐를 지정하지 않았을 때 사용하는 기본 큐 이름.
     */
    public static final String DEFAULT_VALUE = "default";

    private static final Pattern VALID_PATTERN = Pattern.compile("^[a-zA-Z0-9\\-_.]+$");
    private static final QueueName DEFAULT = new QueueName(DEFAULT_VALUE);

    private final String value;

    private QueueName(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("QueueName cannot be null or blank");
        }
        if (value.length() > 100) {
            throw new IllegalArgumentException("QueueName length cannot exceed 100 characters");
        }
        if (!VALID_PATTERN.matcher(value).matches()) {
            throw new IllegalArgumentException(
                "QueueName contains invalid characters. Only alphanumeric, hyphen, underscore and dot are allowed"
            );
        }
        this.value = value;
    }

    /**
     * QueueName 생성.
     *
     * @param value 큐 이름
     * @return QueueName 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static QueueName of(String value) {
        return new QueueName(value);
    }

    /**
     * 기본 큐.
     *
     * @return {@value #DEFAULT_VALUE} 큐
     */
    public static QueueName defaultQueue() {
        return DEFAULT;
    }

    /**
     * QueueName 값 조회.
     *
     * @return 큐 이름
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        QueueName queueName = (QueueName) o;
        return value.equals(queueName.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "QueueName{" + value + '}';
    }
}
