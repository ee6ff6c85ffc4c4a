package com.ryuqq.workmesh.adapter.runner;

/**
 * {@link LocalBackend}의 backend 핸들: 실행 컨텍스트 하나와 그 전용 스레드.
 *
 * @author WorkMesh Team
 * @since 1.0.0
 * @param runner 실행 컨텍스트
 * @param thread 전용 스레드
 */
public record LocalHandle(WorkRunner runner, Thread thread) {

    public LocalHandle {
        if (runner == null || thread == null) {
            throw new IllegalArgumentException("runner and thread cannot be null");
        }
    }

    /**
     * @return 스레드가 살아있고 루프가 끝나지 않았으면 true
     */
    public boolean isAlive() {
        return thread.isAlive() && !runner.isFinished();
    }
}
