package com.ryuqq.dispatcher.core.contract;

import com.ryuqq.dispatcher.core.model.TaskInstanceKey;

import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * TaskInstanceKey와 ExecutionContext로부터 워커 명령을 생성합니다.
 *
 * <p>순수 함수입니다. 부수 효과와 I/O가 없으며, 동일한 입력에 대해 항상 동일한
 * 인자 순서를 반환합니다 (재시도 멱등성 및 테스트 용이성).</p>
 *
 * <p><strong>명령 형식:</strong></p>
 * <pre>
 * &lt;program&gt; tasks run &lt;workflowId&gt; &lt;taskId&gt; &lt;ISO-8601 timestamp&gt; --attempt &lt;n&gt;
 *     [--local] [--pool &lt;pool&gt;] [--mark-success] [--ignore-dependencies]
 *     [--ignore-depends-on-past] [--force] [--subdir &lt;path&gt;] [--cfg-path &lt;path&gt;]
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class CommandBuilder {

    // Utility class - prevent instantiation
    private CommandBuilder() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 명령 생성.
     *
     * @param key 태스크 인스턴스 키
     * @param context 실행 컨텍스트
     * @return 워커 명령
     * @throws IllegalArgumentException key 또는 context가 null인 경우
     */
    public static Command build(TaskInstanceKey key, ExecutionContext context) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }

        List<String> arguments = new ArrayList<>();
        arguments.add(context.program());
        arguments.add("tasks");
        arguments.add("run");
        arguments.add(key.workflowId());
        arguments.add(key.taskId());
        arguments.add(DateTimeFormatter.ISO_INSTANT.format(key.logicalTimestamp()));
        arguments.add("--attempt");
        arguments.add(String.valueOf(key.attemptNumber()));

        if (context.local()) {
            arguments.add("--local");
        }
        if (context.pool() != null) {
            arguments.add("--pool");
            arguments.add(context.pool());
        }
        if (context.markSuccess()) {
            arguments.add("--mark-success");
        }
        if (context.ignoreDependencies()) {
            arguments.add("--ignore-dependencies");
        }
        if (context.ignoreDependsOnPast()) {
            arguments.add("--ignore-depends-on-past");
        }
        if (context.force()) {
            arguments.add("--force");
        }
        if (context.subdir() != null) {
            arguments.add("--subdir");
            arguments.add(context.subdir());
        }
        if (context.cfgPath() != null) {
            arguments.add("--cfg-path");
            arguments.add(context.cfgPath());
        }

        return Command.of(arguments);
    }
}
