package com.ryuqq.dispatcher.core.state;

/**
 * 브로커가 보고하는 원격 태스크 상태.
 *
 * <p><strong>상태 전이:</strong></p>
 * <pre>
 * PENDING
 *    │
 *    ▼ (워커 수신)
 * RUNNING
 *    │
 *    ├─► SUCCESS (성공)
 *    │
 *    └─► FAILED (실패)
 * </pre>
 *
 * <p>브로커는 중간 상태를 건너뛸 수 있습니다 (예: PENDING → SUCCESS).
 * SUCCESS와 FAILED는 종료 상태이며, 해당 시도에 대해 더 이상 전이가 없습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum TaskState {

    /**
     * 브로커에 적재됨 (워커 미수신).
     */
    PENDING,

    /**
     * 워커에서 실행 중.
     */
    RUNNING,

    /**
     * 성공 종료.
     */
    SUCCESS,

    /**
     * 실패 종료.
     */
    FAILED;

    /**
     * 종료 상태인지 확인.
     *
     * @return SUCCESS 또는 FAILED인 경우 true
     */
    public boolean isTerminal() {
        return this == SUCCESS || this == FAILED;
    }
}
