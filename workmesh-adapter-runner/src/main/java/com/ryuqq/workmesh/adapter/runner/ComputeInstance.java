package com.ryuqq.workmesh.adapter.runner;

/**
 * 프로비저닝된 인스턴스.
 *
 * @author WorkMesh Team
 * @since 1.0.0
 * @param instanceId 인스턴스 ID
 * @param host 접근 가능한 호스트 (IP 또는 DNS)
 */
public record ComputeInstance(String instanceId, String host) {

    public ComputeInstance {
        if (instanceId == null || instanceId.isBlank()) {
            throw new IllegalArgumentException("instanceId cannot be null or blank");
        }
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("host cannot be null or blank");
        }
    }
}
