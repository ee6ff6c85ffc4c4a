package com.ryuqq.workmesh.core.contract;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 정규 상태 트리의 읽기 전용 스냅샷 (api-state-publish 큐).
 *
 * @param version 스냅샷 버전 (Delta가 적용될 때마다 증가)
 * @param works Work 이름 → 상태 노드
 *
 * @author WorkMesh Team
 * @since 1.0.0
 */
public record StateSnapshot(
    long version,
    Map<String, Object> works
) implements QueueMessage {

    public StateSnapshot {
        if (version < 0) {
            throw new IllegalArgumentException("version must be non-negative (current: " + version + ")");
        }
        if (works == null) {
            throw new IllegalArgumentException("works cannot be null");
        }
        works = Collections.unmodifiableMap(new LinkedHashMap<>(works));
    }
}
