package com.ryuqq.workmesh.core.error;

/**
 * WorkMesh 예외 계층의 최상위 타입.
 *
 * <p>모든 WorkMesh 예외는 unchecked이며, 재시도 정책은 예외를 받은 호출자가 결정합니다.</p>
 *
 * @author WorkMesh Team
 * @since 1.0.0
 */
public class WorkMeshException extends RuntimeException {

    public WorkMeshException(String message) {
        super(message);
    }

    public WorkMeshException(String message, Throwable cause) {
        super(message, cause);
    }
}
