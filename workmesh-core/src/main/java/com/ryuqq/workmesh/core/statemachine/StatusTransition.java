package com.ryuqq.workmesh.core.statemachine;

/**
 * Work 상태 전이 검증 및 실행.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>CREATED → STARTING</li>
 *   <li>STARTING → RUNNING, STARTING → FAILED</li>
 *   <li>RUNNING → STOPPING, RUNNING → RESTARTING, RUNNING → FAILED</li>
 *   <li>STOPPING → STOPPED</li>
 *   <li>STOPPED → STARTING</li>
 *   <li>RESTARTING → STARTING</li>
 *   <li>FAILED → RESTARTING</li>
 * </ul>
 *
 * <p>위 목록 외의 전이는 {@link IllegalStateException}으로 거부됩니다.
 * 단, kill()을 위한 {@link #forceStop(WorkStatus)}는 검증 없이 STOPPED를 반환합니다.</p>
 *
 * @author WorkMesh Team
 * @since 1.0.0
 */
public final class StatusTransition {

    // Utility class - prevent instantiation
    private StatusTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(WorkStatus from, WorkStatus to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (!isAllowed(from, to)) {
            throw new IllegalStateException(
                String.format("Invalid work status transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 상태 전이 허용 여부 조회 (예외 없음).
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @return 허용되는 전이이면 true
     */
    public static boolean isAllowed(WorkStatus from, WorkStatus to) {
        if (from == null || to == null) {
            return false;
        }
        return switch (from) {
            case CREATED, STOPPED, RESTARTING -> to == WorkStatus.STARTING;
            case STARTING -> to == WorkStatus.RUNNING || to == WorkStatus.FAILED;
            case RUNNING -> to == WorkStatus.STOPPING || to == WorkStatus.RESTARTING || to == WorkStatus.FAILED;
            case STOPPING -> to == WorkStatus.STOPPED;
            case FAILED -> to == WorkStatus.RESTARTING;
        };
    }

    /**
     * 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws IllegalArgumentException current 또는 next가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static WorkStatus transition(WorkStatus current, WorkStatus next) {
        validate(current, next);
        return next;
    }

    /**
     * 강제 종료 전이 (kill 전용).
     *
     * <p>어떤 상태에서든 STOPPED로 전이합니다. 이미 STOPPED여도 오류가 아닙니다.</p>
     *
     * @param current 현재 상태
     * @return STOPPED
     * @throws IllegalArgumentException current가 null인 경우
     */
    public static WorkStatus forceStop(WorkStatus current) {
        if (current == null) {
            throw new IllegalArgumentException("current cannot be null");
        }
        return WorkStatus.STOPPED;
    }
}
