package com.ryuqq.dispatcher.core.outcome;

import com.ryuqq.dispatcher.core.state.TaskState;

/**
 * 실패 결과.
 *
 * <p>워커에서의 실행 실패, 원격 상태 조회 실패, 명시적 취소를 모두 포함합니다.
 * errorCode로 원인을 구분합니다.</p>
 *
 * @param errorCode 오류 코드 (예: {@value #TASK_FAILED}, {@value #STATE_FETCH_FAILED})
 * @param message 오류 메시지
 * @param cause 원인 (선택, null 가능)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Fail(
    String errorCode,
    String message,
    String cause
) implements Outcome {

    /**
     * 워커가 FAILED 상태를 보고함.
     */
    public static final String TASK_FAILED = "TASK_FAILED";

    /**
     * 원격 상태 조회 자체가 실패함.
     */
    public static final String STATE_FETCH_FAILED = "STATE_FETCH_FAILED";

    /**
     * 명시적 취소 또는 종료 시 취소됨.
     */
    public static final String CANCELLED = "CANCELLED";

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException errorCode 또는 message가 null이거나 빈 문자열인 경우
     */
    public Fail {
        if (errorCode == null || errorCode.isBlank()) {
            throw new IllegalArgumentException("errorCode cannot be null or blank");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
        // cause는 null 허용
    }

    /**
     * Fail 생성 (cause 포함).
     *
     * @param errorCode 오류 코드
     * @param message 오류 메시지
     * @param cause 원인
     * @return Fail 인스턴스
     */
    public static Fail of(String errorCode, String message, String cause) {
        return new Fail(errorCode, message, cause);
    }

    /**
     * cause 없이 Fail 생성.
     *
     * @param errorCode 오류 코드
     * @param message 오류 메시지
     * @return Fail 인스턴스
     */
    public static Fail of(String errorCode, String message) {
        return new Fail(errorCode, message, null);
    }

    @Override
    public TaskState state() {
        return TaskState.FAILED;
    }
}
