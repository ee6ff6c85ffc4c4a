package com.ryuqq.workmesh.core.statemachine;

/**
 * Work의 생명주기 상태.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * CREATED ──► STARTING ──► RUNNING ──┬─► STOPPING ──► STOPPED ──► STARTING
 *                │                   │
 *                │                   ├─► RESTARTING ──► STARTING
 *                │                   │        ▲
 *                └─► FAILED ◄────────┘        │
 *                      └──────────────────────┘
 * </pre>
 *
 * <p>kill()은 예외적으로 어떤 상태에서든 STOPPED로 강제 전이합니다
 * ({@link StatusTransition#forceStop(WorkStatus)}).</p>
 *
 * @author WorkMesh Team
 * @since 1.0.0
 */
public enum WorkStatus {

    /**
     * 등록됨 (아직 실행 컨텍스트 없음).
     */
    CREATED,

    /**
     * 실행 컨텍스트 생성 중 (readiness 신호 대기).
     */
    STARTING,

    /**
     * 실행 중 (요청 수락 가능).
     */
    RUNNING,

    /**
     * 종료 중.
     */
    STOPPING,

    /**
     * 종료됨.
     */
    STOPPED,

    /**
     * 재시작 중.
     */
    RESTARTING,

    /**
     * 치명적 실패 (명시적 재시작 전까지 스케줄링 불가).
     */
    FAILED;

    /**
     * 요청을 수락할 수 있는 상태인지 확인.
     *
     * @return RUNNING인 경우 true
     */
    public boolean isAlive() {
        return this == RUNNING;
    }

    /**
     * 더 이상 호출을 받을 수 없는 상태인지 확인.
     *
     * <p>STOPPED, FAILED는 start() 또는 restart() 없이는 빠져나갈 수 없습니다.</p>
     *
     * @return STOPPED 또는 FAILED인 경우 true
     */
    public boolean isTerminal() {
        return this == STOPPED || this == FAILED;
    }
}
