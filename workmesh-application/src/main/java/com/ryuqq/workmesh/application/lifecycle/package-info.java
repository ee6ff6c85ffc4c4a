/**
 * Work 수명 관리.
 *
 * <p>{@link com.ryuqq.workmesh.application.lifecycle.WorkManager}가 start/kill/restart를,
 * {@link com.ryuqq.workmesh.application.lifecycle.SignalMonitor}가 readiness/error 신호를 처리합니다.</p>
 */
package com.ryuqq.workmesh.application.lifecycle;
