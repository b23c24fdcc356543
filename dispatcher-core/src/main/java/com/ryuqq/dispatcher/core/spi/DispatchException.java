package com.ryuqq.dispatcher.core.spi;

/**
 * 브로커 제출 실패.
 *
 * <p>{@link MessageBroker#submit}이 트랜스포트 오류로 실패했을 때 발생하며,
 * 원인 예외를 보존합니다. Executor는 해당 항목을 pending 큐 끝에 재적재하고,
 * 연속 실패 임계값에 도달하면 치명적 오류로 승격합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class DispatchException extends RuntimeException {

    /**
     * 생성자.
     *
     * @param message 오류 메시지
     * @param cause 트랜스포트 원인 예외
     */
    public DispatchException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * 원인 예외 없는 생성자.
     *
     * @param message 오류 메시지
     */
    public DispatchException(String message) {
        super(message);
    }
}
