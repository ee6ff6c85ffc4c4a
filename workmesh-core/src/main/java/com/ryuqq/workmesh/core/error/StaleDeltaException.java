package com.ryuqq.workmesh.core.error;

/**
 * 더 이상 존재하지 않는 Work(또는 경로)를 가리키는 Delta.
 *
 * <p>전파되지 않습니다. State Synchronizer가 WARN 로그를 남기고 Delta를 버립니다.</p>
 *
 * @author WorkMesh Team
 * @since 1.0.0
 */
public class StaleDeltaException extends WorkMeshException {

    public StaleDeltaException(String message) {
        super(message);
    }
}
