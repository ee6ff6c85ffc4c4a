package com.ryuqq.workmesh.adapter.runner;

/**
 * {@link ComputeBackend}의 backend 핸들.
 *
 * @param instance 프로비저닝된 인스턴스
 * @param runner 인스턴스에서 실행 중인 실행 컨텍스트
 */
public record ComputeHandle(ComputeInstance instance, WorkRunner runner) {
}
