package com.ryuqq.workmesh.adapter.runner;

/**
 * 실행 컨텍스트와 코디네이터 루프 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>pollIntervalMs: WorkRunner의 caller 큐 대기 시간 (기본 10ms)</li>
 *   <li>threadNamePrefix: 실행 스레드 이름 접두사 (기본 "workmesh-")</li>
 *   <li>stopJoinTimeoutMs: stopWork 시 실행 스레드 종료 대기 시간 (기본 2000ms)</li>
 *   <li>coordinatorIntervalMs: CoordinatorLoop의 pump 간격 (기본 10ms)</li>
 * </ul>
 *
 * @author WorkMesh Team
 * @since 1.0.0
 * @param pollIntervalMs caller 큐 대기 시간 (밀리초, 양수여야 함)
 * @param threadNamePrefix 스레드 이름 접두사 (null/blank 불가)
 * @param stopJoinTimeoutMs 종료 대기 시간 (밀리초, 0 이상)
 * @param coordinatorIntervalMs pump 간격 (밀리초, 양수여야 함)
 */
public record RunnerConfig(
    long pollIntervalMs,
    String threadNamePrefix,
    long stopJoinTimeoutMs,
    long coordinatorIntervalMs
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: pollIntervalMs=10ms, threadNamePrefix="workmesh-", stopJoinTimeoutMs=2000ms,
     * coordinatorIntervalMs=10ms</p>
     */
    public RunnerConfig() {
        this(10, "workmesh-", 2000, 10);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public RunnerConfig {
        if (pollIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "pollIntervalMs must be positive (current: " + pollIntervalMs + ")"
            );
        }
        if (threadNamePrefix == null || threadNamePrefix.isBlank()) {
            throw new IllegalArgumentException("threadNamePrefix cannot be null or blank");
        }
        if (stopJoinTimeoutMs < 0) {
            throw new IllegalArgumentException(
                "stopJoinTimeoutMs must not be negative (current: " + stopJoinTimeoutMs + ")"
            );
        }
        if (coordinatorIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "coordinatorIntervalMs must be positive (current: " + coordinatorIntervalMs + ")"
            );
        }
    }

    /**
     * pollIntervalMs만 변경한 새 인스턴스 생성.
     */
    public RunnerConfig withPollIntervalMs(long pollIntervalMs) {
        return new RunnerConfig(pollIntervalMs, threadNamePrefix, stopJoinTimeoutMs, coordinatorIntervalMs);
    }

    /**
     * threadNamePrefix만 변경한 새 인스턴스 생성.
     */
    public RunnerConfig withThreadNamePrefix(String threadNamePrefix) {
        return new RunnerConfig(pollIntervalMs, threadNamePrefix, stopJoinTimeoutMs, coordinatorIntervalMs);
    }

    /**
     * stopJoinTimeoutMs만 변경한 새 인스턴스 생성.
     */
    public RunnerConfig withStopJoinTimeoutMs(long stopJoinTimeoutMs) {
        return new RunnerConfig(pollIntervalMs, threadNamePrefix, stopJoinTimeoutMs, coordinatorIntervalMs);
    }

    /**
     * coordinatorIntervalMs만 변경한 새 인스턴스 생성.
     */
    public RunnerConfig withCoordinatorIntervalMs(long coordinatorIntervalMs) {
        return new RunnerConfig(pollIntervalMs, threadNamePrefix, stopJoinTimeoutMs, coordinatorIntervalMs);
    }
}
