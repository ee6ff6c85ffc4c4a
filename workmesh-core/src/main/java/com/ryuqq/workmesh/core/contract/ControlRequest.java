package com.ryuqq.workmesh.core.contract;

import com.ryuqq.workmesh.core.model.WorkName;

/**
 * App이 실행 컨텍스트에 보내는 제어 요청 (orchestrator-request 큐).
 *
 * @param workName 대상 Work
 * @param command 제어 명령
 *
 * @author WorkMesh Team
 * @since 1.0.0
 */
public record ControlRequest(
    WorkName workName,
    Command command
) implements QueueMessage {

    /**
     * 제어 명령 종류.
     */
    public enum Command {
        /** 현재 호출을 마친 뒤 실행 루프 종료. */
        STOP
    }

    public ControlRequest {
        if (workName == null) {
            throw new IllegalArgumentException("workName cannot be null");
        }
        if (command == null) {
            throw new IllegalArgumentException("command cannot be null");
        }
    }

    public static ControlRequest stop(WorkName workName) {
        return new ControlRequest(workName, Command.STOP);
    }
}
