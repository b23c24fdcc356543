package com.ryuqq.dispatcher.core.outcome;

import com.ryuqq.dispatcher.core.state.TaskState;

/**
 * 성공 결과.
 *
 * @param message 성공 메시지 (선택, null 가능)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Ok(String message) implements Outcome {

    private static final Ok EMPTY = new Ok(null);

    /**
     * 메시지 없이 성공 결과 생성.
     *
     * @return Ok 인스턴스
     */
    public static Ok of() {
        return EMPTY;
    }

    @Override
    public TaskState state() {
        return TaskState.SUCCESS;
    }
}
