package com.ryuqq.workmesh.application.work;

import com.ryuqq.workmesh.core.contract.CallArguments;

/**
 * Work의 진입 메서드.
 *
 * <p>외부 협력자가 제공하는 "이름 있는 호출 가능한 단위"의 호출 부분입니다.
 * 등록 전에는 로컬에서 직접 실행되고, App에 등록된 후에는 Run Proxy가 이 자리를 대신합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Work trainer = new Work(arguments -&gt; {
 *     int batch = ((Number) arguments.kwarg("batch")).intValue();
 *     return Map.of("loss", train(batch));
 * });
 * </pre>
 *
 * @author WorkMesh Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface WorkRun {

    /**
     * 진입 메서드 실행.
     *
     * @param arguments 위치 인자와 이름 인자
     * @return 반환값 (JSON으로 표현 가능한 값, null 가능)
     * @throws Exception Work가 던진 예외 (원격 실행 시 RemoteExecutionException으로 전달됨)
     */
    Object run(CallArguments arguments) throws Exception;
}
