package com.ryuqq.dispatcher.core.contract;

import java.util.List;

/**
 * 워커에서 실행할 명령.
 *
 * <p>Command는 순서가 있는 문자열 인자 목록이며, Executor에게는 불투명(opaque)합니다.
 * 해석은 워커 측 Task Runner만 수행합니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 시 인자 목록을 방어적으로 복사하며, 이후 변경 불가</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * Command command = Command.of("dispatcher", "tasks", "run", "daily_etl", "extract", "2024-01-01T00:00:00Z");
 * </pre>
 *
 * @param arguments 명령 인자 (최소 1개, null 요소 불가)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Command(List<String> arguments) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException arguments가 null, 비어 있거나 null 요소를 포함하는 경우
     */
    public Command {
        if (arguments == null || arguments.isEmpty()) {
            throw new IllegalArgumentException("arguments cannot be null or empty");
        }
        for (String argument : arguments) {
            if (argument == null) {
                throw new IllegalArgumentException("arguments cannot contain null elements");
            }
        }
        arguments = List.copyOf(arguments);
    }

    /**
     * 가변 인자로 Command 생성.
     *
     * @param arguments 명령 인자
     * @return Command 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 인자인 경우
     */
    public static Command of(String... arguments) {
        if (arguments == null) {
            throw new IllegalArgumentException("arguments cannot be null or empty");
        }
        return new Command(List.of(arguments));
    }

    /**
     * 목록으로 Command 생성.
     *
     * @param arguments 명령 인자
     * @return Command 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 인자인 경우
     */
    public static Command of(List<String> arguments) {
        return new Command(arguments);
    }

    /**
     * 실행 프로그램 (첫 번째 인자).
     *
     * @return 프로그램 이름
     */
    public String program() {
        return arguments.get(0);
    }

    @Override
    public String toString() {
        return String.join(" ", arguments);
    }
}
