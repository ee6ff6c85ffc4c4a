package com.ryuqq.workmesh.application.proxy;

import com.ryuqq.workmesh.application.work.WorkRun;
import com.ryuqq.workmesh.core.contract.CallArguments;

/**
 * 이미 교체된 진입 메서드의 표식.
 *
 * <p>{@link RunProxyInstaller}는 진입 메서드가 이 타입이면 다시 감싸지 않습니다.</p>
 *
 * @author WorkMesh Team
 * @since 1.0.0
 */
public interface WrappedRun extends WorkRun {

    /**
     * @return 감싸기 전의 진입 메서드
     */
    WorkRun unwrap();

    /**
     * 응답을 기다리지 않고 호출 전송.
     *
     * @param arguments 호출 인자
     * @return 호출 핸들
     */
    CallHandle submit(CallArguments arguments);
}
