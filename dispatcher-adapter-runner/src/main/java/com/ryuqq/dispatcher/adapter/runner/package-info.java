/**
 * Runner Adapter 패키지.
 *
 * <p>MessageBroker SPI 위에서 동작하는 분산 Executor 구현을 제공합니다.</p>
 *
 * <h2>주요 구성 요소</h2>
 * <ul>
 *   <li>{@link com.ryuqq.dispatcher.adapter.runner.DistributedExecutor} - 디스패치, fan-out 상태 동기화, 종료</li>
 *   <li>{@link com.ryuqq.dispatcher.adapter.runner.DistributedExecutorConfig} - 설정 (Properties 로딩 포함)</li>
 *   <li>StatePoller - 고정 크기 풀에서의 핸들별 격리 조회</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.dispatcher.adapter.runner;
