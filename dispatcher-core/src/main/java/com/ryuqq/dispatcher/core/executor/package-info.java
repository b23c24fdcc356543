/**
 * Executor Domain Service - 태스크 디스패치 계약.
 *
 * <p>스케줄러가 의존하는 Executor 계약과 그 예외 분류를 정의합니다.</p>
 *
 * <h2>핵심 인터페이스</h2>
 * <ul>
 *   <li>{@link com.ryuqq.dispatcher.core.executor.Executor} - queue / trigger / sync / heartbeat / drain / shutdown</li>
 * </ul>
 *
 * <h2>예외 분류</h2>
 * <ul>
 *   <li>{@link com.ryuqq.dispatcher.core.executor.DuplicateKeyException} - 호출자 버그, 즉시 노출</li>
 *   <li>{@link com.ryuqq.dispatcher.core.executor.ExecutorFatalException} - Executor 전체 장애, heartbeat()에서 전파</li>
 *   <li>태스크별 조회 실패 - 예외가 아닌 Fail 결과로 기록</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.dispatcher.core.executor;
