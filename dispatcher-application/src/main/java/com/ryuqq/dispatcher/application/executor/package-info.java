/**
 * Application Layer - 브로커 중립 Executor 골격.
 *
 * <h2>구성 요소</h2>
 * <ul>
 *   <li>{@link com.ryuqq.dispatcher.application.executor.BaseExecutor} - queue / trigger / heartbeat / drain / cancel 공통 구현</li>
 *   <li>{@link com.ryuqq.dispatcher.application.executor.ExecutorState} - 단일 락으로 보호되는 상태 테이블</li>
 *   <li>{@link com.ryuqq.dispatcher.application.executor.EventBuffer} - 스케줄러 전달용 결과 버퍼</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (DistributedExecutor)
 *   ↓ extends
 * application (BaseExecutor)
 *   ↓ implements
 * core/executor (Executor interface)
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.dispatcher.application.executor;
