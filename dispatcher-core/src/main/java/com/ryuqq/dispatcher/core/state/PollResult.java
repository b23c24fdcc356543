package com.ryuqq.dispatcher.core.state;

/**
 * 원격 상태 조회(poll) 결과.
 *
 * <p>브로커 경계에서 모든 조회 결과를 닫힌 variant로 표현합니다:</p>
 * <ul>
 *   <li>{@link Observed}: 브로커가 PENDING / RUNNING / SUCCESS / FAILED 중 하나를 보고함</li>
 *   <li>{@link LookupError}: 조회 자체가 실패함 (예외, 타임아웃, 잘못된 응답 형태)</li>
 * </ul>
 *
 * <p>트랜스포트에서 예상치 못한 형태의 응답이 오면 예외로 전파하지 않고
 * {@link LookupError}로 변환합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface PollResult permits PollResult.Observed, PollResult.LookupError {

    /**
     * 관측된 상태 결과 생성.
     *
     * @param state 관측 상태
     * @return Observed 인스턴스
     * @throws IllegalArgumentException state가 null인 경우
     */
    static PollResult observed(TaskState state) {
        return new Observed(state);
    }

    /**
     * 조회 실패 결과 생성.
     *
     * @param error 조회 중 발생한 예외
     * @return LookupError 인스턴스
     * @throws IllegalArgumentException error가 null인 경우
     */
    static PollResult lookupError(Throwable error) {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
        return new LookupError(error.getClass().getName(), String.valueOf(error.getMessage()), error);
    }

    /**
     * 예외 없이 잘못된 응답을 받은 경우의 조회 실패 결과 생성.
     *
     * @param detail 응답 형태에 대한 설명
     * @return LookupError 인스턴스
     */
    static PollResult malformed(String detail) {
        return new LookupError(IllegalStateException.class.getName(), detail, null);
    }

    /**
     * 브로커가 보고한 상태.
     *
     * @param state 관측 상태
     */
    record Observed(TaskState state) implements PollResult {

        public Observed {
            if (state == null) {
                throw new IllegalArgumentException("state cannot be null");
            }
        }
    }

    /**
     * 상태 조회 실패.
     *
     * @param errorClass 원인 예외 클래스 이름
     * @param message 원인 메시지
     * @param cause 원인 예외 (null 가능)
     */
    record LookupError(String errorClass, String message, Throwable cause) implements PollResult {

        public LookupError {
            if (errorClass == null || errorClass.isBlank()) {
                throw new IllegalArgumentException("errorClass cannot be null or blank");
            }
            // message, cause는 null 허용
        }

        /**
         * 로그 및 진단 정보용 요약.
         *
         * @return "errorClass: message"
         */
        public String describe() {
            return errorClass + ": " + message;
        }
    }
}
