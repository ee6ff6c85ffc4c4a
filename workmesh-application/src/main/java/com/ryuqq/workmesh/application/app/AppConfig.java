package com.ryuqq.workmesh.application.app;

import com.ryuqq.workmesh.application.proxy.CallMode;

/**
 * WorkApp 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>pollingIntervalMs: 응답/신호 큐 폴링 간격 (기본 10ms)</li>
 *   <li>callTimeoutMs: 원격 호출 최대 대기 시간, 0이면 무제한 (기본 0)</li>
 *   <li>startupTimeoutMs: readiness 신호 최대 대기 시간 (기본 10000ms)</li>
 *   <li>statusPollIntervalMs: Backend 상태 일괄 조회 간격 (기본 1000ms)</li>
 *   <li>callMode: 호출 모드 (기본 BLOCKING)</li>
 * </ul>
 *
 * <p><strong>튜닝 가이드:</strong></p>
 * <ul>
 *   <li>낮은 지연: pollingIntervalMs 감소 (10 → 1)</li>
 *   <li>원격 환경(컨테이너, 클라우드): startupTimeoutMs 증가 (10000 → 120000)</li>
 *   <li>비용이 큰 상태 조회 API: statusPollIntervalMs 증가</li>
 * </ul>
 *
 * @author WorkMesh Team
 * @since 1.0.0
 * @param pollingIntervalMs 큐 폴링 간격 (밀리초, 양수여야 함)
 * @param callTimeoutMs 호출 대기 시간 (밀리초, 0 이상, 0이면 무제한)
 * @param startupTimeoutMs readiness 대기 시간 (밀리초, 양수여야 함)
 * @param statusPollIntervalMs 상태 조회 간격 (밀리초, 양수여야 함)
 * @param callMode 호출 모드 (null 불가)
 */
public record AppConfig(
    long pollingIntervalMs,
    long callTimeoutMs,
    long startupTimeoutMs,
    long statusPollIntervalMs,
    CallMode callMode
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: pollingIntervalMs=10ms, callTimeoutMs=0 (무제한), startupTimeoutMs=10000ms,
     * statusPollIntervalMs=1000ms, callMode=BLOCKING</p>
     */
    public AppConfig() {
        this(10, 0, 10000, 1000, CallMode.BLOCKING);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public AppConfig {
        if (pollingIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "pollingIntervalMs must be positive (current: " + pollingIntervalMs + ")"
            );
        }
        if (callTimeoutMs < 0) {
            throw new IllegalArgumentException(
                "callTimeoutMs must not be negative (current: " + callTimeoutMs + ")"
            );
        }
        if (startupTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "startupTimeoutMs must be positive (current: " + startupTimeoutMs + ")"
            );
        }
        if (statusPollIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "statusPollIntervalMs must be positive (current: " + statusPollIntervalMs + ")"
            );
        }
        if (callMode == null) {
            throw new IllegalArgumentException("callMode cannot be null");
        }
    }

    /**
     * pollingIntervalMs만 변경한 새 인스턴스 생성.
     */
    public AppConfig withPollingIntervalMs(long pollingIntervalMs) {
        return new AppConfig(pollingIntervalMs, callTimeoutMs, startupTimeoutMs, statusPollIntervalMs, callMode);
    }

    /**
     * callTimeoutMs만 변경한 새 인스턴스 생성.
     */
    public AppConfig withCallTimeoutMs(long callTimeoutMs) {
        return new AppConfig(pollingIntervalMs, callTimeoutMs, startupTimeoutMs, statusPollIntervalMs, callMode);
    }

    /**
     * startupTimeoutMs만 변경한 새 인스턴스 생성.
     */
    public AppConfig withStartupTimeoutMs(long startupTimeoutMs) {
        return new AppConfig(pollingIntervalMs, callTimeoutMs, startupTimeoutMs, statusPollIntervalMs, callMode);
    }

    /**
     * statusPollIntervalMs만 변경한 새 인스턴스 생성.
     */
    public AppConfig withStatusPollIntervalMs(long statusPollIntervalMs) {
        return new AppConfig(pollingIntervalMs, callTimeoutMs, startupTimeoutMs, statusPollIntervalMs, callMode);
    }

    /**
     * callMode만 변경한 새 인스턴스 생성.
     */
    public AppConfig withCallMode(CallMode callMode) {
        return new AppConfig(pollingIntervalMs, callTimeoutMs, startupTimeoutMs, statusPollIntervalMs, callMode);
    }
}
