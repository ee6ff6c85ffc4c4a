package com.ryuqq.workmesh.core.contract;

/**
 * Queue Fabric을 통해 전달되는 모든 메시지의 공통 타입.
 *
 * <p>Sealed interface로 정의되어 큐에 실릴 수 있는 메시지 종류를 닫힌 집합으로 제한합니다.
 * 각 {@link com.ryuqq.workmesh.core.spi.QueueRole}은 이 중 허용되는 타입을 정의합니다.</p>
 *
 * @author WorkMesh Team
 * @since 1.0.0
 */
public sealed interface QueueMessage
    permits CallRequest, CallResponse, ControlRequest, CopyRequest, CopyResponse, Delta, WorkSignal, StateSnapshot {
}
