package com.ryuqq.workmesh.core.contract;

import com.ryuqq.workmesh.core.model.WorkName;

/**
 * 실행 컨텍스트의 health 신호 (readiness 큐 / error 큐).
 *
 * <p>generation은 Work가 시작될 때마다 증가하는 번호입니다. kill된 이전 실행 컨텍스트가
 * 늦게 보낸 신호는 generation이 달라 무시됩니다.</p>
 *
 * @param workName 신호를 보낸 Work
 * @param kind READY 또는 ERROR
 * @param generation 실행 컨텍스트 세대 번호
 * @param errorType ERROR일 때 원인 분류 (READY면 null)
 * @param message ERROR일 때 메시지 (READY면 null)
 * @param emittedAt 발생 시각 (epoch millis)
 *
 * @author WorkMesh Team
 * @since 1.0.0
 */
public record WorkSignal(
    WorkName workName,
    Kind kind,
    long generation,
    String errorType,
    String message,
    long emittedAt
) implements QueueMessage {

    /**
     * 신호 종류.
     */
    public enum Kind {
        READY,
        ERROR
    }

    public WorkSignal {
        if (workName == null) {
            throw new IllegalArgumentException("workName cannot be null");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (kind == Kind.ERROR && (errorType == null || errorType.isBlank())) {
            throw new IllegalArgumentException("errorType cannot be null or blank for ERROR signal");
        }
    }

    public static WorkSignal ready(WorkName workName, long generation) {
        return new WorkSignal(workName, Kind.READY, generation, null, null, System.currentTimeMillis());
    }

    public static WorkSignal error(WorkName workName, long generation, Throwable error) {
        return new WorkSignal(workName, Kind.ERROR, generation,
            error.getClass().getName(), error.getMessage(), System.currentTimeMillis());
    }

    public boolean isReady() {
        return kind == Kind.READY;
    }
}
