package com.ryuqq.dispatcher.core.executor;

/**
 * Executor 수준의 치명적 오류.
 *
 * <p>재시도 예산을 넘어선 브로커 장애, 복구 불가능한 트랜스포트/프로토콜 오류 등
 * 시스템 전체에 영향을 주는 경우에만 heartbeat()에서 던져집니다.
 * 스케줄러가 제어 루프 중단 여부를 결정합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ExecutorFatalException extends RuntimeException {

    /**
     * 생성자.
     *
     * @param message 오류 메시지
     * @param cause 원인 예외
     */
    public ExecutorFatalException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * 원인 예외 없는 생성자.
     *
     * @param message 오류 메시지
     */
    public ExecutorFatalException(String message) {
        super(message);
    }
}
