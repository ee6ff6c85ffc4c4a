package com.ryuqq.workmesh.core.error;

/**
 * 응답 대기 중 Work가 kill되거나 실패하여 호출이 취소됨.
 *
 * @author WorkMesh Team
 * @since 1.0.0
 */
public class CallCancelledException extends WorkMeshException {

    public CallCancelledException(String workName, long sequence, String reason) {
        super("Call #" + sequence + " to work '" + workName + "' was cancelled: " + reason);
    }
}
