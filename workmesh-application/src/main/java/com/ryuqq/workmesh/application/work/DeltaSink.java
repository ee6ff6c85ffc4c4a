package com.ryuqq.workmesh.application.work;

import com.ryuqq.workmesh.core.contract.Delta;

/**
 * {@link WorkState}가 기록한 Delta를 받아가는 쪽 (보통 실행 컨텍스트의 delta 큐).
 *
 * @author WorkMesh Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface DeltaSink {

    void accept(Delta delta);
}
