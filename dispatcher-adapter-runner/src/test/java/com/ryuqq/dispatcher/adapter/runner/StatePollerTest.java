package com.ryuqq.dispatcher.adapter.runner;

import com.ryuqq.dispatcher.application.executor.InFlightEntry;
import com.ryuqq.dispatcher.core.model.QueueName;
import com.ryuqq.dispatcher.core.model.TaskInstanceKey;
import com.ryuqq.dispatcher.core.spi.RemoteTaskHandle;
import com.ryuqq.dispatcher.core.state.PollResult;
import com.ryuqq.dispatcher.core.state.TaskState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * StatePoller 유닛 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class StatePollerTest {

    private static final Instant TS = Instant.parse("2024-01-01T00:00:00Z");

    @Mock
    private RemoteTaskHandle handle;

    private final CountDownLatch release = new CountDownLatch(1);

    private StatePoller poller = new StatePoller(2, Duration.ofMillis(100));

    @AfterEach
    void tearDown() {
        release.countDown();
        poller.shutdownNow(Duration.ofMillis(100));
    }

    @Test
    void pollOne_정상_상태는_Observed() {
        // given
        when(handle.fetchState(Duration.ofMillis(100))).thenReturn(TaskState.RUNNING);

        // when
        PollResult result = poller.pollOne(handle);

        // then
        assertThat(result).isEqualTo(PollResult.observed(TaskState.RUNNING));
    }

    @Test
    void pollOne_예외는_LookupError로_변환() {
        // given
        when(handle.fetchState(any())).thenThrow(new ClassCastException("not a result"));

        // when
        PollResult result = poller.pollOne(handle);

        // then
        assertThat(result).isInstanceOf(PollResult.LookupError.class);
        assertThat(((PollResult.LookupError) result).errorClass()).isEqualTo("java.lang.ClassCastException");
    }

    @Test
    void pollOne_null_응답은_malformed_LookupError() {
        // given
        when(handle.fetchState(any())).thenReturn(null);
        when(handle.token()).thenReturn("tok-7");

        // when
        PollResult result = poller.pollOne(handle);

        // then
        PollResult.LookupError error = (PollResult.LookupError) result;
        assertThat(error.message()).contains("tok-7");
        assertThat(error.cause()).isNull();
    }

    @Test
    void pollAll_모든_항목을_정확히_한번씩_스냅샷_순서대로_조회() {
        // given
        Set<String> pollingThreads = ConcurrentHashMap.newKeySet();
        List<InFlightEntry> entries = new ArrayList<>();
        List<CountingHandle> handles = new ArrayList<>();
        for (int i = 0; i < 7; i++) {
            CountingHandle counting = new CountingHandle("tok-" + i, pollingThreads);
            handles.add(counting);
            entries.add(new InFlightEntry(TaskInstanceKey.of("wf", "t" + i, TS, 1), counting,
                QueueName.defaultQueue(), 0L));
        }

        // when
        List<StatePoller.Polled> results = poller.pollAll(entries);

        // then
        assertThat(results).extracting(StatePoller.Polled::entry).containsExactlyElementsOf(entries);
        assertThat(results).allMatch(p -> p.result().equals(PollResult.observed(TaskState.SUCCESS)));
        assertThat(handles).allMatch(h -> h.calls == 1);
        assertThat(pollingThreads).allMatch(name -> name.startsWith("dispatcher-poll-"));
    }

    @Test
    void pollAll_멈춘_조회_뒤에_대기한_조회는_시작_시점부터_타임아웃_계산() {
        // given
        poller.shutdownNow(Duration.ofMillis(100));
        poller = new StatePoller(1, Duration.ofMillis(50));
        InFlightEntry stuck = entry("stuck", new StuckHandle("tok-stuck", release));
        InFlightEntry fine = entry("fine", new CountingHandle("tok-fine", ConcurrentHashMap.newKeySet()));

        // when
        List<StatePoller.Polled> results = poller.pollAll(List.of(stuck, fine));

        // then
        assertThat(results).extracting(StatePoller.Polled::entry).containsExactly(stuck, fine);
        PollResult.LookupError timeout = (PollResult.LookupError) results.get(0).result();
        assertThat(timeout.errorClass()).isEqualTo("java.util.concurrent.TimeoutException");
        assertThat(timeout.message()).contains("exceeded 50ms");
        assertThat(results.get(1).result()).isEqualTo(PollResult.observed(TaskState.SUCCESS));
    }

    @Test
    void pollAll_인터럽트를_무시하는_조회가_남아도_다음_패스는_정상_조회() {
        // given
        poller.shutdownNow(Duration.ofMillis(100));
        poller = new StatePoller(1, Duration.ofMillis(50));
        poller.pollAll(List.of(entry("stuck", new StuckHandle("tok-stuck", release))));
        InFlightEntry next = entry("next", new CountingHandle("tok-next", ConcurrentHashMap.newKeySet()));

        // when
        long startedAt = System.nanoTime();
        List<StatePoller.Polled> results = poller.pollAll(List.of(next));
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt);

        // then
        assertThat(results).hasSize(1);
        assertThat(results.get(0).result()).isEqualTo(PollResult.observed(TaskState.SUCCESS));
        assertThat(elapsedMs).isLessThan(2_000);
    }

    @Test
    void pollAll_종료된_풀에서는_모두_LookupError() {
        // given
        InFlightEntry entry = new InFlightEntry(TaskInstanceKey.of("wf", "t", TS, 1), handle,
            QueueName.defaultQueue(), 0L);
        poller.shutdownNow(Duration.ofMillis(100));

        // when
        List<StatePoller.Polled> results = poller.pollAll(List.of(entry));

        // then
        assertThat(poller.isShutdown()).isTrue();
        assertThat(results).hasSize(1);
        assertThat(results.get(0).result()).isInstanceOf(PollResult.LookupError.class);
    }

    @Test
    void pollOne_설정된_타임아웃을_핸들에_전달() {
        // given
        when(handle.fetchState(any())).thenReturn(TaskState.PENDING);

        // when
        poller.pollOne(handle);

        // then
        verify(handle).fetchState(Duration.ofMillis(100));
    }

    private static InFlightEntry entry(String taskId, RemoteTaskHandle handle) {
        return new InFlightEntry(TaskInstanceKey.of("wf", taskId, TS, 1), handle, QueueName.defaultQueue(), 0L);
    }

    /**
     * 인터럽트를 무시하고 release 또는 10초가 지날 때까지 반환하지 않는 핸들.
     */
    private static final class StuckHandle implements RemoteTaskHandle {

        private final String token;
        private final CountDownLatch release;

        StuckHandle(String token, CountDownLatch release) {
            this.token = token;
            this.release = release;
        }

        @Override
        public String token() {
            return token;
        }

        @Override
        public TaskState fetchState(Duration timeout) {
            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
            while (release.getCount() > 0 && System.nanoTime() - deadline < 0) {
                try {
                    release.await(deadline - System.nanoTime(), TimeUnit.NANOSECONDS);
                } catch (InterruptedException ignored) {
                    // keeps blocking like a driver call that does not honour interrupts
                }
            }
            return TaskState.RUNNING;
        }

        @Override
        public boolean cancel() {
            return false;
        }
    }

    private static final class CountingHandle implements RemoteTaskHandle {

        private final String token;
        private final Set<String> threads;
        volatile int calls;

        CountingHandle(String token, Set<String> threads) {
            this.token = token;
            this.threads = threads;
        }

        @Override
        public String token() {
            return token;
        }

        @Override
        public synchronized TaskState fetchState(Duration timeout) {
            calls++;
            threads.add(Thread.currentThread().getName());
            return TaskState.SUCCESS;
        }

        @Override
        public boolean cancel() {
            return false;
        }
    }
}
