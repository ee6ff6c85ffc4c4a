package com.ryuqq.workmesh.application.backend;

import com.ryuqq.workmesh.application.app.WorkApp;
import com.ryuqq.workmesh.application.work.Work;
import com.ryuqq.workmesh.core.error.ProvisioningException;

import java.net.URI;
import java.util.List;
import java.util.Optional;

/**
 * Work 실행 환경 Backend.
 *
 * <p>Work마다 격리된 실행 컨텍스트(로컬 실행 스레드, 컨테이너, 클라우드 인스턴스 등)를 만들고
 * 그 수명을 관리합니다. 어떤 구현을 쓸지는 App 생성 시 주입으로 정해지며, 생성 후에는 바뀌지 않습니다.</p>
 *
 * <p><strong>부수 효과 범위:</strong> App의 큐 레지스트리와 대상 Work의 backend 핸들만 변경합니다.</p>
 *
 * <p><strong>재시도 정책:</strong> Backend는 조용히 재시도하지 않습니다.
 * 실패는 App(WorkManager)으로 전달되고, 재시작 여부는 호출자가 결정합니다.</p>
 *
 * @author WorkMesh Team
 * @since 1.0.0
 */
public interface Backend {

    /**
     * Work의 실행 컨텍스트 생성.
     *
     * <p>App 레지스트리의 큐 묶음을 실행 컨텍스트에 연결하고,
     * 실행 컨텍스트는 준비가 끝나면 readiness 큐에 READY 신호를 보냅니다.</p>
     *
     * @param app 소유 App
     * @param work 대상 Work (이름 필수, 상태 STARTING)
     * @throws ProvisioningException 실행 환경을 만들 수 없는 경우
     */
    void createWork(WorkApp app, Work work);

    /**
     * 주어진 Work들의 상태를 한 번에 조회해 반영.
     *
     * <p>반복 호출해도 안전하며, 실행 컨텍스트가 사라진 Work도 허용합니다.</p>
     *
     * @param works 대상 Work 목록
     */
    void updateWorkStatuses(List<Work> works);

    /**
     * Work의 실행 컨텍스트 종료. 이미 종료되었거나 없는 경우에도 예외를 던지지 않습니다.
     *
     * @param app 소유 App
     * @param work 대상 Work
     */
    void stopWork(WorkApp app, Work work);

    /**
     * 모든 Work의 실행 컨텍스트 종료 (멱등).
     *
     * @param works 대상 Work 목록
     */
    void stopAllWorks(List<Work> works);

    /**
     * 네트워크 포트를 노출한 Work의 접근 URL.
     *
     * @param work 대상 Work
     * @return URL (네트워크 표면이 없거나 아직 알 수 없으면 empty)
     */
    Optional<URI> resolveUrl(Work work);
}
