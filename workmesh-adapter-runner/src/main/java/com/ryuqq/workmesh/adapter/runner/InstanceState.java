package com.ryuqq.workmesh.adapter.runner;

/**
 * 컴퓨트 인스턴스 상태.
 *
 * @author WorkMesh Team
 * @since 1.0.0
 */
public enum InstanceState {
    PENDING,
    RUNNING,
    TERMINATED,
    FAILED,
    NOT_FOUND
}
