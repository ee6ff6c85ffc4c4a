package com.ryuqq.workmesh.core.contract;

import com.ryuqq.workmesh.core.model.WorkName;

import java.util.List;

/**
 * Work의 관찰 가능한 상태에 대한 경로 단위 부분 갱신.
 *
 * <p>deltaId는 Work별로 1부터 단조 증가하며, State Synchronizer는 이 순서대로만 적용합니다.
 * 이미 적용된 deltaId는 중복으로 버려지고, 앞선 deltaId가 도착하지 않은 Delta는 버퍼링됩니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * // works.root.trainer.metrics.loss = 0.42
 * Delta.set(WorkName.of("root.trainer"), 3, List.of("metrics", "loss"), 0.42);
 * </pre>
 *
 * @param workName Delta를 발생시킨 Work
 * @param deltaId Work 내 발생 순번 (1부터)
 * @param path Work 상태 노드 기준 상대 경로 (비어있을 수 없음)
 * @param operation SET 또는 REMOVE
 * @param value SET일 때의 값 (REMOVE면 무시, null 가능)
 *
 * @author WorkMesh Team
 * @since 1.0.0
 */
public record Delta(
    WorkName workName,
    long deltaId,
    List<String> path,
    Operation operation,
    Object value
) implements QueueMessage {

    /**
     * 경로에 대한 연산.
     */
    public enum Operation {
        /** 경로의 값을 설정 (중간 노드는 생성). */
        SET,
        /** 경로의 값을 제거. */
        REMOVE
    }

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나, deltaId가 양수가 아니거나, path가 비어있는 경우
     */
    public Delta {
        if (workName == null) {
            throw new IllegalArgumentException("workName cannot be null");
        }
        if (deltaId <= 0) {
            throw new IllegalArgumentException("deltaId must be positive (current: " + deltaId + ")");
        }
        if (path == null || path.isEmpty()) {
            throw new IllegalArgumentException("path cannot be null or empty");
        }
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        path = List.copyOf(path);
        for (String segment : path) {
            if (segment.isBlank()) {
                throw new IllegalArgumentException("path segments cannot be blank (path: " + path + ")");
            }
        }
    }

    public static Delta set(WorkName workName, long deltaId, List<String> path, Object value) {
        return new Delta(workName, deltaId, path, Operation.SET, value);
    }

    public static Delta remove(WorkName workName, long deltaId, List<String> path) {
        return new Delta(workName, deltaId, path, Operation.REMOVE, null);
    }
}
