package com.ryuqq.workmesh.application.app;

import com.ryuqq.workmesh.core.model.QueueId;
import com.ryuqq.workmesh.core.model.WorkName;
import com.ryuqq.workmesh.core.spi.QueueFabric;
import com.ryuqq.workmesh.core.spi.QueueHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * App이 소유하는 큐 레지스트리.
 *
 * <p>App 전역 큐(delta, readiness, error, api-state-publish, api-delta)는 생성 시 한 번만 준비하고,
 * Work별 큐 묶음({@link WorkQueues})은 Work가 살아있는 동안 정확히 한 번 만들어집니다.</p>
 *
 * <p><strong>변경 시점:</strong> Work 등록({@link #register})과 해제({@link #release}) 때만 변경됩니다.
 * 조회는 잠금 없이 가능합니다.</p>
 *
 * @author WorkMesh Team
 * @since 1.0.0
 */
public final class QueueRegistry {

    private static final Logger log = LoggerFactory.getLogger(QueueRegistry.class);

    private final QueueFabric fabric;
    private final QueueId queueId;
    private final QueueHandle deltaQueue;
    private final QueueHandle readinessQueue;
    private final QueueHandle errorQueue;
    private final QueueHandle apiStatePublishQueue;
    private final QueueHandle apiDeltaQueue;
    private final Map<WorkName, WorkQueues> workQueues = new ConcurrentHashMap<>();

    /**
     * 레지스트리 생성 (App 전역 큐 준비).
     *
     * @param fabric Queue Fabric
     * @param queueId App의 큐 ID
     */
    public QueueRegistry(QueueFabric fabric, QueueId queueId) {
        if (fabric == null || queueId == null) {
            throw new IllegalArgumentException("fabric and queueId cannot be null");
        }
        this.fabric = fabric;
        this.queueId = queueId;
        this.deltaQueue = fabric.getDeltaQueue(queueId);
        this.readinessQueue = fabric.getReadinessQueue(queueId);
        this.errorQueue = fabric.getErrorQueue(queueId);
        this.apiStatePublishQueue = fabric.getApiStatePublishQueue(queueId);
        this.apiDeltaQueue = fabric.getApiDeltaQueue(queueId);
    }

    /**
     * Work 큐 묶음 등록. 이미 있으면 기존 묶음을 반환합니다.
     *
     * @param workName Work 이름
     * @return 큐 묶음
     */
    public synchronized WorkQueues register(WorkName workName) {
        if (workName == null) {
            throw new IllegalArgumentException("workName cannot be null");
        }
        WorkQueues existing = workQueues.get(workName);
        if (existing != null) {
            return existing;
        }
        String name = workName.getValue();
        WorkQueues created = new WorkQueues(
            workName,
            fabric.getOrchestratorRequestQueue(queueId, name),
            fabric.getOrchestratorResponseQueue(queueId, name),
            fabric.getOrchestratorCopyRequestQueue(queueId, name),
            fabric.getOrchestratorCopyResponseQueue(queueId, name),
            fabric.getCallerQueue(queueId, name)
        );
        workQueues.put(workName, created);
        log.debug("Queues registered for work '{}'", workName);
        return created;
    }

    public Optional<WorkQueues> find(WorkName workName) {
        return Optional.ofNullable(workQueues.get(workName));
    }

    /**
     * @throws IllegalStateException 등록되지 않은 Work인 경우
     */
    public WorkQueues require(WorkName workName) {
        WorkQueues queues = workQueues.get(workName);
        if (queues == null) {
            throw new IllegalStateException("No queues registered for work '" + workName + "'");
        }
        return queues;
    }

    public boolean isRegistered(WorkName workName) {
        return workQueues.containsKey(workName);
    }

    /**
     * Work 큐 묶음 해제 (남은 메시지는 버리고 채널 삭제).
     *
     * @param workName Work 이름
     * @return 해제했으면 true, 등록되어 있지 않았으면 false
     */
    public synchronized boolean release(WorkName workName) {
        WorkQueues removed = workQueues.remove(workName);
        if (removed == null) {
            return false;
        }
        int discarded = 0;
        for (QueueHandle queue : removed.all()) {
            discarded += queue.clear();
            fabric.delete(queue.name());
        }
        if (discarded > 0) {
            log.info("Discarded {} queued message(s) of work '{}'", discarded, workName);
        }
        return true;
    }

    /**
     * 모든 Work 큐 묶음 해제.
     */
    public synchronized void releaseAll() {
        for (WorkName workName : new ArrayList<>(workQueues.keySet())) {
            release(workName);
        }
    }

    public List<WorkName> registeredWorks() {
        return Collections.unmodifiableList(new ArrayList<>(workQueues.keySet()));
    }

    public QueueId queueId() {
        return queueId;
    }

    public QueueFabric fabric() {
        return fabric;
    }

    public QueueHandle deltaQueue() {
        return deltaQueue;
    }

    public QueueHandle readinessQueue() {
        return readinessQueue;
    }

    public QueueHandle errorQueue() {
        return errorQueue;
    }

    public QueueHandle apiStatePublishQueue() {
        return apiStatePublishQueue;
    }

    public QueueHandle apiDeltaQueue() {
        return apiDeltaQueue;
    }
}
