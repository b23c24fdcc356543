package com.ryuqq.dispatcher.application.executor;

import com.ryuqq.dispatcher.core.model.TaskInstanceKey;
import com.ryuqq.dispatcher.core.outcome.Fail;
import com.ryuqq.dispatcher.core.outcome.Ok;
import com.ryuqq.dispatcher.core.outcome.Outcome;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * EventBuffer 유닛 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class EventBufferTest {

    private static final Instant TS = Instant.parse("2024-01-01T00:00:00Z");

    private final EventBuffer buffer = new EventBuffer();

    @Test
    void drain_두번_호출하면_두번째는_비어있음() {
        // given
        TaskInstanceKey key = TaskInstanceKey.of("wf", "t1", TS, 1);
        buffer.put(key, Ok.of());

        // when
        Map<TaskInstanceKey, Outcome> first = buffer.drain();
        Map<TaskInstanceKey, Outcome> second = buffer.drain();

        // then
        assertThat(first).containsEntry(key, Ok.of());
        assertThat(second).isEmpty();
        assertThat(buffer.size()).isZero();
    }

    @Test
    void drain_결과는_기록_순서를_유지하고_수정불가() {
        // given
        TaskInstanceKey a = TaskInstanceKey.of("wf", "a", TS, 1);
        TaskInstanceKey b = TaskInstanceKey.of("wf", "b", TS, 1);
        buffer.put(b, Ok.of());
        buffer.put(a, Fail.of(Fail.TASK_FAILED, "failed"));

        // when
        Map<TaskInstanceKey, Outcome> drained = buffer.drain();

        // then
        assertThat(drained.keySet()).containsExactly(b, a);
        assertThatThrownBy(() -> drained.put(a, Ok.of()))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void drain_워크플로우_필터는_대상만_제거함() {
        // given
        TaskInstanceKey etl = TaskInstanceKey.of("etl", "t1", TS, 1);
        TaskInstanceKey ml = TaskInstanceKey.of("ml", "t1", TS, 1);
        buffer.put(etl, Ok.of());
        buffer.put(ml, Ok.of());

        // when
        Map<TaskInstanceKey, Outcome> drained = buffer.drain(Set.of("etl"));

        // then
        assertThat(drained).containsOnlyKeys(etl);
        assertThat(buffer.size()).isEqualTo(1);
        assertThat(buffer.drain(Set.of())).isEmpty();
        assertThat(buffer.drain()).containsOnlyKeys(ml);
    }

    @Test
    void put_같은_키는_덮어씀() {
        // given
        TaskInstanceKey key = TaskInstanceKey.of("wf", "t1", TS, 1);
        buffer.put(key, Ok.of());

        // when
        buffer.put(key, Fail.of(Fail.CANCELLED, "cancelled"));

        // then
        assertThat(buffer.drain().get(key).isFail()).isTrue();
    }

    @Test
    void put_null_인자는_예외() {
        TaskInstanceKey key = TaskInstanceKey.of("wf", "t1", TS, 1);

        assertThatThrownBy(() -> buffer.put(null, Ok.of()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("key cannot be null");
        assertThatThrownBy(() -> buffer.put(key, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("outcome cannot be null");
    }

    @Test
    void put_동시_기록도_유실되지_않음() throws InterruptedException {
        // given
        int writers = 8;
        int perWriter = 200;
        ExecutorService pool = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);
        List<TaskInstanceKey> keys = new ArrayList<>();
        for (int w = 0; w < writers; w++) {
            for (int i = 0; i < perWriter; i++) {
                keys.add(TaskInstanceKey.of("wf", "w" + w + "_" + i, TS, 1));
            }
        }

        // when
        for (int w = 0; w < writers; w++) {
            List<TaskInstanceKey> slice = keys.subList(w * perWriter, (w + 1) * perWriter);
            pool.submit(() -> {
                start.await();
                for (TaskInstanceKey key : slice) {
                    buffer.put(key, Ok.of());
                }
                return null;
            });
        }
        start.countDown();
        pool.shutdown();
        assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        // then
        assertThat(buffer.drain()).hasSize(writers * perWriter);
    }
}
