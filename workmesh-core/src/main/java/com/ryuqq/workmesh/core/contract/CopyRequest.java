package com.ryuqq.workmesh.core.contract;

import com.ryuqq.workmesh.core.model.WorkName;

/**
 * 원격 Work의 로컬 상태 사본 요청 (orchestrator-copy-request 큐).
 *
 * @param workName 대상 Work
 * @param requestId 요청 식별자 (응답과 짝지음)
 *
 * @author WorkMesh Team
 * @since 1.0.0
 */
public record CopyRequest(
    WorkName workName,
    long requestId
) implements QueueMessage {

    public CopyRequest {
        if (workName == null) {
            throw new IllegalArgumentException("workName cannot be null");
        }
        if (requestId <= 0) {
            throw new IllegalArgumentException("requestId must be positive (current: " + requestId + ")");
        }
    }
}
