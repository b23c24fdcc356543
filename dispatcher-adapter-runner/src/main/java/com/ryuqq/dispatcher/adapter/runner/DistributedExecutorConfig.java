package com.ryuqq.dispatcher.adapter.runner;

import com.ryuqq.dispatcher.core.protection.ParallelismBudget;

import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

/**
 * DistributedExecutor 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>brokerUri: 브로커 연결 URI (기본 memory://localhost)</li>
 *   <li>resultBackendUri: 결과 백엔드 URI (기본 memory://localhost)</li>
 *   <li>parallelism: 전역 최대 in-flight 수 (기본 32)</li>
 *   <li>queueParallelism: 큐별 최대 in-flight 수 (기본 없음)</li>
 *   <li>pollConcurrency: 상태 조회 fan-out 스레드 수 (기본 16)</li>
 *   <li>maxConsecutiveDispatchFailures: 치명적 오류로 승격할 연속 디스패치 실패 수 (기본 3)</li>
 *   <li>pollTimeoutMs: 개별 상태 조회 타임아웃 (기본 1000ms)</li>
 *   <li>shutdownTimeoutMs: shutdown(true) 최대 대기 시간 (기본 60000ms)</li>
 *   <li>shutdownPollIntervalMs: shutdown(true) 중 sync 간격 (기본 1000ms)</li>
 * </ul>
 *
 * <p><strong>Properties 키 (접두사 {@value #PREFIX}):</strong></p>
 * <pre>
 * dispatcher.broker-uri=redis://broker:6379/0
 * dispatcher.result-backend-uri=db+postgresql://results
 * dispatcher.parallelism=64
 * dispatcher.queue-parallelism.gpu=4
 * dispatcher.poll-concurrency=16
 * dispatcher.max-consecutive-dispatch-failures=5
 * dispatcher.poll-timeout-ms=2000
 * dispatcher.shutdown-timeout-ms=120000
 * dispatcher.shutdown-poll-interval-ms=500
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param brokerUri 브로커 연결 URI
 * @param resultBackendUri 결과 백엔드 URI
 * @param parallelism 전역 병렬성 예산 (양수)
 * @param queueParallelism 큐별 병렬성 예산 (값은 양수)
 * @param pollConcurrency 상태 조회 동시성 (양수)
 * @param maxConsecutiveDispatchFailures 연속 디스패치 실패 임계값 (양수)
 * @param pollTimeoutMs 상태 조회 타임아웃 (밀리초, 양수)
 * @param shutdownTimeoutMs 종료 대기 타임아웃 (밀리초, 양수)
 * @param shutdownPollIntervalMs 종료 대기 중 sync 간격 (밀리초, 양수)
 */
public record DistributedExecutorConfig(
    String brokerUri,
    String resultBackendUri,
    int parallelism,
    Map<String, Integer> queueParallelism,
    int pollConcurrency,
    int maxConsecutiveDispatchFailures,
    long pollTimeoutMs,
    long shutdownTimeoutMs,
    long shutdownPollIntervalMs
) {

    public static final String PREFIX = "dispatcher.";

    private static final String DEFAULT_URI = "memory://localhost";
    private static final String QUEUE_PARALLELISM_PREFIX = PREFIX + "queue-parallelism.";

    /**
     * 기본 설정 생성자.
     */
    public DistributedExecutorConfig() {
        this(DEFAULT_URI, DEFAULT_URI, 32, Map.of(), 16, 3, 1000, 60000, 1000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public DistributedExecutorConfig {
        if (brokerUri == null || brokerUri.isBlank()) {
            throw new IllegalArgumentException("brokerUri cannot be null or blank");
        }
        if (resultBackendUri == null || resultBackendUri.isBlank()) {
            throw new IllegalArgumentException("resultBackendUri cannot be null or blank");
        }
        if (parallelism <= 0) {
            throw new IllegalArgumentException("parallelism must be positive (current: " + parallelism + ")");
        }
        if (queueParallelism == null) {
            throw new IllegalArgumentException("queueParallelism cannot be null");
        }
        if (pollConcurrency <= 0) {
            throw new IllegalArgumentException("pollConcurrency must be positive (current: " + pollConcurrency + ")");
        }
        if (maxConsecutiveDispatchFailures <= 0) {
            throw new IllegalArgumentException(
                "maxConsecutiveDispatchFailures must be positive (current: " + maxConsecutiveDispatchFailures + ")"
            );
        }
        if (pollTimeoutMs <= 0) {
            throw new IllegalArgumentException("pollTimeoutMs must be positive (current: " + pollTimeoutMs + ")");
        }
        if (shutdownTimeoutMs <= 0) {
            throw new IllegalArgumentException("shutdownTimeoutMs must be positive (current: " + shutdownTimeoutMs + ")");
        }
        if (shutdownPollIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "shutdownPollIntervalMs must be positive (current: " + shutdownPollIntervalMs + ")"
            );
        }
        queueParallelism = Map.copyOf(queueParallelism);
    }

    /**
     * Properties에서 설정 로드. 없는 키는 기본값을 사용합니다.
     *
     * @param properties 설정 원본
     * @return 설정 인스턴스
     * @throws IllegalArgumentException properties가 null이거나 숫자 형식이 잘못된 경우
     */
    public static DistributedExecutorConfig fromProperties(Properties properties) {
        if (properties == null) {
            throw new IllegalArgumentException("properties cannot be null");
        }
        DistributedExecutorConfig defaults = new DistributedExecutorConfig();

        Map<String, Integer> queueParallelism = new HashMap<>();
        for (String name : properties.stringPropertyNames()) {
            if (name.startsWith(QUEUE_PARALLELISM_PREFIX)) {
                String queue = name.substring(QUEUE_PARALLELISM_PREFIX.length());
                queueParallelism.put(queue, (int) parseLong(properties, name, 0));
            }
        }

        return new DistributedExecutorConfig(
            properties.getProperty(PREFIX + "broker-uri", defaults.brokerUri()).trim(),
            properties.getProperty(PREFIX + "result-backend-uri", defaults.resultBackendUri()).trim(),
            (int) parseLong(properties, PREFIX + "parallelism", defaults.parallelism()),
            queueParallelism,
            (int) parseLong(properties, PREFIX + "poll-concurrency", defaults.pollConcurrency()),
            (int) parseLong(properties, PREFIX + "max-consecutive-dispatch-failures", defaults.maxConsecutiveDispatchFailures()),
            parseLong(properties, PREFIX + "poll-timeout-ms", defaults.pollTimeoutMs()),
            parseLong(properties, PREFIX + "shutdown-timeout-ms", defaults.shutdownTimeoutMs()),
            parseLong(properties, PREFIX + "shutdown-poll-interval-ms", defaults.shutdownPollIntervalMs())
        );
    }

    /**
     * 병렬성 예산으로 변환.
     *
     * @return ParallelismBudget
     */
    public ParallelismBudget toBudget() {
        return new ParallelismBudget(parallelism, queueParallelism);
    }

    /**
     * brokerUri만 변경한 새 인스턴스 생성.
     */
    public DistributedExecutorConfig withBrokerUri(String brokerUri) {
        return new DistributedExecutorConfig(brokerUri, resultBackendUri, parallelism, queueParallelism, pollConcurrency, maxConsecutiveDispatchFailures, pollTimeoutMs, shutdownTimeoutMs, shutdownPollIntervalMs);
    }

    /**
     * resultBackendUri만 변경한 새 인스턴스 생성.
     */
    public DistributedExecutorConfig withResultBackendUri(String resultBackendUri) {
        return new DistributedExecutorConfig(brokerUri, resultBackendUri, parallelism, queueParallelism, pollConcurrency, maxConsecutiveDispatchFailures, pollTimeoutMs, shutdownTimeoutMs, shutdownPollIntervalMs);
    }

    /**
     * parallelism만 변경한 새 인스턴스 생성.
     */
    public DistributedExecutorConfig withParallelism(int parallelism) {
        return new DistributedExecutorConfig(brokerUri, resultBackendUri, parallelism, queueParallelism, pollConcurrency, maxConsecutiveDispatchFailures, pollTimeoutMs, shutdownTimeoutMs, shutdownPollIntervalMs);
    }

    /**
     * queueParallelism만 변경한 새 인스턴스 생성.
     */
    public DistributedExecutorConfig withQueueParallelism(Map<String, Integer> queueParallelism) {
        return new DistributedExecutorConfig(brokerUri, resultBackendUri, parallelism, queueParallelism, pollConcurrency, maxConsecutiveDispatchFailures, pollTimeoutMs, shutdownTimeoutMs, shutdownPollIntervalMs);
    }

    /**
     * pollConcurrency만 변경한 새 인스턴스 생성.
     */
    public DistributedExecutorConfig withPollConcurrency(int pollConcurrency) {
        return new DistributedExecutorConfig(brokerUri, resultBackendUri, parallelism, queueParallelism, pollConcurrency, maxConsecutiveDispatchFailures, pollTimeoutMs, shutdownTimeoutMs, shutdownPollIntervalMs);
    }

    /**
     * maxConsecutiveDispatchFailures만 변경한 새 인스턴스 생성.
     */
    public DistributedExecutorConfig withMaxConsecutiveDispatchFailures(int maxConsecutiveDispatchFailures) {
        return new DistributedExecutorConfig(brokerUri, resultBackendUri, parallelism, queueParallelism, pollConcurrency, maxConsecutiveDispatchFailures, pollTimeoutMs, shutdownTimeoutMs, shutdownPollIntervalMs);
    }

    /**
     * pollTimeoutMs만 변경한 새 인스턴스 생성.
     */
    public DistributedExecutorConfig withPollTimeoutMs(long pollTimeoutMs) {
        return new DistributedExecutorConfig(brokerUri, resultBackendUri, parallelism, queueParallelism, pollConcurrency, maxConsecutiveDispatchFailures, pollTimeoutMs, shutdownTimeoutMs, shutdownPollIntervalMs);
    }

    /**
     * shutdownTimeoutMs만 변경한 새 인스턴스 생성.
     */
    public DistributedExecutorConfig withShutdownTimeoutMs(long shutdownTimeoutMs) {
        return new DistributedExecutorConfig(brokerUri, resultBackendUri, parallelism, queueParallelism, pollConcurrency, maxConsecutiveDispatchFailures, pollTimeoutMs, shutdownTimeoutMs, shutdownPollIntervalMs);
    }

    /**
     * shutdownPollIntervalMs만 변경한 새 인스턴스 생성.
     */
    public DistributedExecutorConfig withShutdownPollIntervalMs(long shutdownPollIntervalMs) {
        return new DistributedExecutorConfig(brokerUri, resultBackendUri, parallelism, queueParallelism, pollConcurrency, maxConsecutiveDispatchFailures, pollTimeoutMs, shutdownTimeoutMs, shutdownPollIntervalMs);
    }

    private static long parseLong(Properties properties, String key, long defaultValue) {
        String raw = properties.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number for " + key + ": " + raw, e);
        }
    }
}
