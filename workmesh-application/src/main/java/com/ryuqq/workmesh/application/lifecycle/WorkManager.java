package com.ryuqq.workmesh.application.lifecycle;

/**
 * Work 하나의 수명 관리.
 *
 * <p><strong>상태 전이:</strong></p>
 * <pre>
 * CREATED ─start→ STARTING ─ready→ RUNNING ─kill→ STOPPING → STOPPED
 *                    │                │
 *                    └──fail──→ FAILED ←┘
 * RUNNING/FAILED ─restart→ RESTARTING → STARTING
 * </pre>
 *
 * @author WorkMesh Team
 * @since 1.0.0
 */
public interface WorkManager {

    /**
     * 실행 컨텍스트 시작 후 readiness까지 대기. RUNNING이면 아무것도 하지 않습니다.
     *
     * @throws com.ryuqq.workmesh.core.error.ProvisioningException 시작 실패 (Work는 FAILED)
     * @throws IllegalStateException 현재 상태에서 시작할 수 없는 경우 (FAILED는 restart 필요)
     */
    void start();

    /**
     * 어떤 상태에서든 STOPPED로. 실행 컨텍스트가 이미 없어도 성공하며, 두 번째 호출은 아무것도 하지 않습니다.
     */
    void kill();

    /**
     * kill 후 start. 한 잠금 안에서 수행됩니다.
     */
    void restart();

    /**
     * @return RUNNING이면 true
     */
    boolean isAlive();
}
