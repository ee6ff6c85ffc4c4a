package com.ryuqq.workmesh.application.proxy;

/**
 * Run Proxy 호출 모드.
 *
 * @author WorkMesh Team
 * @since 1.0.0
 */
public enum CallMode {

    /** 응답을 기다렸다가 값을 반환 (call timeout 적용). */
    BLOCKING,

    /** 즉시 {@link CallHandle}을 반환. */
    FUTURE
}
