package com.ryuqq.dispatcher.core.executor;

import com.ryuqq.dispatcher.core.contract.Command;
import com.ryuqq.dispatcher.core.model.QueueName;
import com.ryuqq.dispatcher.core.model.TaskInstanceKey;
import com.ryuqq.dispatcher.core.outcome.Outcome;

import java.util.Map;
import java.util.Set;

/**
 * 태스크 실행자 (스케줄러 대상 계약).
 *
 * <p>스케줄러가 실행하기로 결정한 태스크 인스턴스를 원격 워커로 전달하고,
 * 원격 상태를 비블로킹으로 추적하여 종료 결과를 이벤트 버퍼로 돌려줍니다.</p>
 *
 * <p><strong>책임:</strong></p>
 * <ul>
 *   <li>태스크 적재 (queue) - pending 큐에 추가</li>
 *   <li>디스패치 (triggerPending) - 병렬성 예산 내에서 브로커로 제출</li>
 *   <li>상태 동기화 (sync) - in-flight 태스크의 원격 상태 리컨실</li>
 *   <li>결과 전달 (drainEvents) - 종료 결과를 스케줄러에 반환</li>
 * </ul>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>적재된 키는 종료 결과가 기록되기 전까지 pending 또는 in-flight 중 정확히 한 곳에만 존재</li>
 *   <li>in-flight 수는 병렬성 예산을 초과하지 않음</li>
 *   <li>태스크별 오류는 해당 태스크의 결과(Fail)로만 기록되며, 예외로 전파되지 않음</li>
 * </ul>
 *
 * <p><strong>동시성:</strong></p>
 * <ul>
 *   <li>스케줄러는 단일 제어 스레드에서 heartbeat()를 주기적으로 호출합니다.</li>
 *   <li>shutdown(false)는 진행 중인 sync()/triggerPending()과 동시에 호출해도 안전해야 합니다.</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * executor.queue(key, command, QueueName.defaultQueue(), 10);
 *
 * // 스케줄러 루프
 * executor.heartbeat();
 * Map&lt;TaskInstanceKey, Outcome&gt; events = executor.drainEvents();
 *
 * executor.shutdown(true);
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface Executor {

    /**
     * 태스크 적재.
     *
     * <p>pending 큐에 (priority 내림차순, 적재 순서 오름차순)으로 추가합니다.
     * priority는 동순위 정렬용이며 선점을 보장하지 않습니다.</p>
     *
     * @param key 태스크 인스턴스 키
     * @param command 워커 명령
     * @param queue 대상 큐
     * @param priority 우선순위 (클수록 먼저)
     * @throws IllegalArgumentException 인자가 null인 경우
     * @throws DuplicateKeyException 이미 pending 또는 in-flight인 키인 경우
     * @throws IllegalStateException 이미 종료(shutdown)된 경우
     */
    void queue(TaskInstanceKey key, Command command, QueueName queue, int priority);

    /**
     * pending 항목을 병렬성 예산 내에서 브로커로 디스패치.
     *
     * @throws ExecutorFatalException 연속 디스패치 실패가 임계값에 도달한 경우
     */
    void triggerPending();

    /**
     * in-flight 태스크의 원격 상태 동기화.
     *
     * <p>모든 in-flight 키를 정확히 한 번씩 조회하고, 종료된 태스크는
     * 이벤트 버퍼에 기록한 뒤 in-flight에서 제거합니다.
     * 개별 조회 실패는 해당 키의 FAILED 결과로만 기록됩니다.</p>
     *
     * @throws ExecutorFatalException 복구 불가능한 Executor 수준 오류인 경우
     */
    void sync();

    /**
     * 주기적 하트비트: triggerPending() 후 sync().
     *
     * @throws ExecutorFatalException Executor 수준의 치명적 오류인 경우에만
     */
    void heartbeat();

    /**
     * 이벤트 버퍼의 모든 결과를 원자적으로 반환하고 비움.
     *
     * @return 키별 종료 결과 (비어 있을 수 있음)
     */
    Map<TaskInstanceKey, Outcome> drainEvents();

    /**
     * 지정한 워크플로우들의 결과만 반환하고 버퍼에서 제거.
     *
     * <p>다른 워크플로우의 결과는 버퍼에 남습니다.</p>
     *
     * @param workflowIds 대상 워크플로우 ID 집합
     * @return 키별 종료 결과 (비어 있을 수 있음)
     * @throws IllegalArgumentException workflowIds가 null인 경우
     */
    Map<TaskInstanceKey, Outcome> drainEvents(Set<String> workflowIds);

    /**
     * 태스크 취소.
     *
     * <p>pending이면 큐에서 제거하고, in-flight이면 원격 작업 취소를 요청한 뒤 제거합니다.
     * 두 경우 모두 이벤트 버퍼에 FAILED(CANCELLED)를 기록합니다.</p>
     *
     * @param key 태스크 인스턴스 키
     * @return 취소 대상이 존재했으면 true
     */
    boolean cancel(TaskInstanceKey key);

    /**
     * 키가 pending 또는 in-flight인지 확인.
     *
     * @param key 태스크 인스턴스 키
     * @return 존재 여부
     */
    boolean hasTask(TaskInstanceKey key);

    /**
     * pending 키 스냅샷.
     *
     * @return 불변 집합
     */
    Set<TaskInstanceKey> pendingKeys();

    /**
     * in-flight 키 스냅샷.
     *
     * @return 불변 집합
     */
    Set<TaskInstanceKey> inFlightKeys();

    /**
     * 전역 병렬성 예산 중 남은 슬롯 수.
     *
     * @return 남은 슬롯 수 (0 이상)
     */
    int openSlots();

    /**
     * Executor 종료.
     *
     * <p>waitForCompletion이면 in-flight가 비거나 타임아웃이 지날 때까지 동기화하며 대기하고,
     * 아니면 가능한 경우 원격 작업 취소를 요청한 뒤 즉시 반환합니다.
     * 어느 경우든 반환 전에 모든 트랜스포트 자원을 해제합니다.</p>
     *
     * @param waitForCompletion in-flight 완료 대기 여부
     */
    void shutdown(boolean waitForCompletion);
}
