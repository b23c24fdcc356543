package com.ryuqq.dispatcher.core.outcome;

import com.ryuqq.dispatcher.core.state.TaskState;

/**
 * 태스크 시도의 종료 결과.
 *
 * <p>Outcome은 두 가지 종료 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Ok}: 성공 (SUCCESS)</li>
 *   <li>{@link Fail}: 실패 (FAILED), 진단 정보 포함</li>
 * </ul>
 *
 * <p>원격 상태 조회 실패도 {@link Fail}로 표현되므로, 사용자에게는
 * 실행 실패와 동일하게 보이며 진단 정보로 구분할 수 있습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface Outcome permits Ok, Fail {

    /**
     * 결과에 대응하는 종료 상태.
     *
     * @return SUCCESS 또는 FAILED
     */
    TaskState state();

    /**
     * 결과가 성공인지 확인.
     *
     * @return 성공 여부
     */
    default boolean isOk() {
        return this instanceof Ok;
    }

    /**
     * 결과가 실패인지 확인.
     *
     * @return 실패 여부
     */
    default boolean isFail() {
        return this instanceof Fail;
    }
}
