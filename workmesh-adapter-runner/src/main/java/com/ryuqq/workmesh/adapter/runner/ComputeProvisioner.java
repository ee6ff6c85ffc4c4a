package com.ryuqq.workmesh.adapter.runner;

import com.ryuqq.workmesh.core.error.ProvisioningException;

import java.util.Collection;
import java.util.Map;

/**
 * 컴퓨트 인스턴스 프로비저너 SPI (컨테이너 엔진, 클라우드 API 등).
 *
 * <p>{@link ComputeBackend}가 이 인터페이스로 인스턴스를 만들고, 상태를 조회하고, 종료합니다.</p>
 *
 * <p><strong>구현 요구사항:</strong></p>
 * <ul>
 *   <li>provision: 인스턴스를 만들고 {@link ComputeRequest#workload()}를 그 안에서 실행</li>
 *   <li>terminate: 없는 인스턴스는 이미 종료된 것으로 취급 (예외 없음)</li>
 *   <li>describe: 여러 인스턴스를 한 번의 호출로 조회 (없는 id는 결과에서 빠지거나 NOT_FOUND)</li>
 * </ul>
 *
 * @author WorkMesh Team
 * @since 1.0.0
 */
public interface ComputeProvisioner {

    /**
     * 인스턴스 생성.
     *
     * @param request 생성 요청
     * @return 생성된 인스턴스
     * @throws ProvisioningException 쿼터 초과, 이미지 오류 등으로 만들 수 없는 경우
     */
    ComputeInstance provision(ComputeRequest request);

    /**
     * 인스턴스 종료 (멱등).
     *
     * @param instanceId 인스턴스 ID
     */
    void terminate(String instanceId);

    /**
     * 인스턴스 상태 일괄 조회.
     *
     * @param instanceIds 인스턴스 ID 목록
     * @return 인스턴스 ID → 상태
     */
    Map<String, InstanceState> describe(Collection<String> instanceIds);
}
