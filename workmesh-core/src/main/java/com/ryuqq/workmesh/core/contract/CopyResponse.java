package com.ryuqq.workmesh.core.contract;

import com.ryuqq.workmesh.core.model.WorkName;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 원격 Work의 로컬 상태 사본 (orchestrator-copy-response 큐).
 *
 * @param workName 응답한 Work
 * @param requestId 대응하는 {@link CopyRequest#requestId()}
 * @param state 상태 사본 (읽기 전용)
 *
 * @author WorkMesh Team
 * @since 1.0.0
 */
public record CopyResponse(
    WorkName workName,
    long requestId,
    Map<String, Object> state
) implements QueueMessage {

    public CopyResponse {
        if (workName == null) {
            throw new IllegalArgumentException("workName cannot be null");
        }
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        state = Collections.unmodifiableMap(new LinkedHashMap<>(state));
    }
}
