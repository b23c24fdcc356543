package com.ryuqq.dispatcher.core.contract;

/**
 * 명령 생성을 위한 실행 컨텍스트.
 *
 * <p>CommandBuilder가 TaskInstanceKey와 함께 사용하여 워커 명령을 구성합니다.
 * 모든 필드는 값 의미(value semantics)를 가지므로 동일한 컨텍스트는 항상 동일한 명령을 만듭니다.</p>
 *
 * <p><strong>필드 구성:</strong></p>
 * <ul>
 *   <li><strong>program:</strong> 워커에서 실행할 프로그램 (필수)</li>
 *   <li><strong>local:</strong> 워커 로컬 실행 여부 (--local)</li>
 *   <li><strong>pool:</strong> 리소스 풀 이름 (null 가능, --pool)</li>
 *   <li><strong>markSuccess:</strong> 실행 없이 성공 처리 (--mark-success)</li>
 *   <li><strong>ignoreDependencies:</strong> 업스트림 의존성 무시 (--ignore-dependencies)</li>
 *   <li><strong>ignoreDependsOnPast:</strong> 과거 실행 의존성 무시 (--ignore-depends-on-past)</li>
 *   <li><strong>force:</strong> 이전 상태와 무관하게 강제 실행 (--force)</li>
 *   <li><strong>subdir:</strong> 워크플로우 정의 경로 (null 가능, --subdir)</li>
 *   <li><strong>cfgPath:</strong> 워커 설정 파일 경로 (null 가능, --cfg-path)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ExecutionContext(
    String program,
    boolean local,
    String pool,
    boolean markSuccess,
    boolean ignoreDependencies,
    boolean ignoreDependsOnPast,
    boolean force,
    String subdir,
    String cfgPath
) {

    /**
     * 기본 프로그램 이름.
     */
    public static final String DEFAULT_PROGRAM = "dispatcher";

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException program이 null이거나 빈 문자열인 경우
     */
    public ExecutionContext {
        if (program == null || program.isBlank()) {
            throw new IllegalArgumentException("program cannot be null or blank");
        }
        // pool, subdir, cfgPath는 null 허용
    }

    /**
     * 기본 컨텍스트 (로컬 실행, 추가 플래그 없음).
     *
     * @return ExecutionContext 인스턴스
     */
    public static ExecutionContext defaults() {
        return new ExecutionContext(DEFAULT_PROGRAM, true, null, false, false, false, false, null, null);
    }

    /**
     * local만 변경한 새 인스턴스 생성.
     */
    public ExecutionContext withLocal(boolean local) {
        return new ExecutionContext(program, local, pool, markSuccess, ignoreDependencies, ignoreDependsOnPast, force, subdir, cfgPath);
    }

    /**
     * pool만 변경한 새 인스턴스 생성.
     */
    public ExecutionContext withPool(String pool) {
        return new ExecutionContext(program, local, pool, markSuccess, ignoreDependencies, ignoreDependsOnPast, force, subdir, cfgPath);
    }

    /**
     * markSuccess만 변경한 새 인스턴스 생성.
     */
    public ExecutionContext withMarkSuccess(boolean markSuccess) {
        return new ExecutionContext(program, local, pool, markSuccess, ignoreDependencies, ignoreDependsOnPast, force, subdir, cfgPath);
    }

    /**
     * ignoreDependencies만 변경한 새 인스턴스 생성.
     */
    public ExecutionContext withIgnoreDependencies(boolean ignoreDependencies) {
        return new ExecutionContext(program, local, pool, markSuccess, ignoreDependencies, ignoreDependsOnPast, force, subdir, cfgPath);
    }

    /**
     * ignoreDependsOnPast만 변경한 새 인스턴스 생성.
     */
    public ExecutionContext withIgnoreDependsOnPast(boolean ignoreDependsOnPast) {
        return new ExecutionContext(program, local, pool, markSuccess, ignoreDependencies, ignoreDependsOnPast, force, subdir, cfgPath);
    }

    /**
     * force만 변경한 새 인스턴스 생성.
     */
    public ExecutionContext withForce(boolean force) {
        return new ExecutionContext(program, local, pool, markSuccess, ignoreDependencies, ignoreDependsOnPast, force, subdir, cfgPath);
    }

    /**
     * subdir만 변경한 새 인스턴스 생성.
     */
    public ExecutionContext withSubdir(String subdir) {
        return new ExecutionContext(program, local, pool, markSuccess, ignoreDependencies, ignoreDependsOnPast, force, subdir, cfgPath);
    }

    /**
     * cfgPath만 변경한 새 인스턴스 생성.
     */
    public ExecutionContext withCfgPath(String cfgPath) {
        return new ExecutionContext(program, local, pool, markSuccess, ignoreDependencies, ignoreDependsOnPast, force, subdir, cfgPath);
    }
}
