package com.ryuqq.dispatcher.core.spi;

import com.ryuqq.dispatcher.core.state.TaskState;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * RemoteTaskHandle 보조 유틸리티.
 *
 * <p>종료 상태 대기(terminal wait)는 Executor의 sync 루프 바깥의 협력자
 * (테스트, 관리 도구, 동기 실행 경로)를 위한 것입니다.
 * sync()는 이 메서드를 사용하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class RemoteTaskHandles {

    // Utility class - prevent instantiation
    private RemoteTaskHandles() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 종료 상태가 될 때까지 대기 (소프트 폴링).
     *
     * <p>timeout이 {@link Duration#ZERO}이면 무제한 대기하되,
     * 스레드 인터럽트로 취소할 수 있습니다.</p>
     *
     * @param handle 대기할 핸들
     * @param timeout 최대 대기 시간 (ZERO는 무제한)
     * @param pollInterval 폴링 간격 (양수)
     * @return 종료 상태 (SUCCESS 또는 FAILED)
     * @throws IllegalArgumentException 인자가 유효하지 않은 경우
     * @throws TimeoutException timeout 내에 종료 상태가 되지 않은 경우
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    public static TaskState awaitTerminal(RemoteTaskHandle handle, Duration timeout, Duration pollInterval)
            throws TimeoutException, InterruptedException {
        if (handle == null) {
            throw new IllegalArgumentException("handle cannot be null");
        }
        if (timeout == null || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be zero or positive (current: " + timeout + ")");
        }
        if (pollInterval == null || pollInterval.isZero() || pollInterval.isNegative()) {
            throw new IllegalArgumentException("pollInterval must be positive (current: " + pollInterval + ")");
        }

        boolean unbounded = timeout.isZero();
        long deadlineNanos = System.nanoTime() + timeout.toNanos();

        while (true) {
            if (Thread.currentThread().isInterrupted()) {
                throw new InterruptedException("Terminal wait interrupted for " + handle.token());
            }

            TaskState state = handle.fetchState(pollInterval);
            if (state != null && state.isTerminal()) {
                return state;
            }

            if (!unbounded && System.nanoTime() - deadlineNanos >= 0) {
                throw new TimeoutException(
                    "Handle " + handle.token() + " did not reach a terminal state within " + timeout.toMillis() + "ms"
                );
            }

            Thread.sleep(pollInterval.toMillis());
        }
    }
}
