package com.ryuqq.workmesh.adapter.runner;

/**
 * 인스턴스 생성 요청.
 *
 * @author WorkMesh Team
 * @since 1.0.0
 * @param workName 대상 Work 이름
 * @param queueId App의 큐 ID (인스턴스가 같은 큐에 붙기 위해 필요)
 * @param exposedPort 노출 포트 (0이면 없음)
 * @param workload 인스턴스 안에서 실행할 실행 컨텍스트
 */
public record ComputeRequest(String workName, String queueId, int exposedPort, Runnable workload) {

    public ComputeRequest {
        if (workName == null || workName.isBlank()) {
            throw new IllegalArgumentException("workName cannot be null or blank");
        }
        if (queueId == null || queueId.isBlank()) {
            throw new IllegalArgumentException("queueId cannot be null or blank");
        }
        if (workload == null) {
            throw new IllegalArgumentException("workload cannot be null");
        }
    }
}
