package com.ryuqq.workmesh.application.sync;

import com.ryuqq.workmesh.core.contract.Delta;
import com.ryuqq.workmesh.core.contract.QueueMessage;
import com.ryuqq.workmesh.core.contract.StateSnapshot;
import com.ryuqq.workmesh.core.error.StaleDeltaException;
import com.ryuqq.workmesh.core.model.WorkName;
import com.ryuqq.workmesh.core.spi.QueueHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;

/**
 * 정본 상태 트리의 유일한 소유자.
 *
 * <p>delta 큐(실행 컨텍스트가 보낸 Delta)와 api-delta 큐(외부 API가 보낸 Delta)를
 * 비블로킹으로 비우고, Work별 순서를 지켜 {@link StateTree}에 적용합니다.
 * 다른 컴포넌트는 스냅샷을 읽거나 Delta를 제출할 뿐 트리를 직접 바꾸지 않습니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * pump()
 *   1. delta 큐 drain → Work별 순서 정렬 (중복 버림, 빈 구간 버퍼링) → 트리 병합
 *   2. api-delta 큐 drain → 별도 카운터로 같은 처리
 *   3. 하나라도 적용했으면 api-state-publish 큐에 버전 있는 스냅샷 발행
 * </pre>
 *
 * <p>추적하지 않는(제거된) Work의 Delta는 {@link StaleDeltaException}으로 처리되어
 * WARN 로그를 남기고 버려집니다.</p>
 *
 * <p><strong>Thread-Safety:</strong> 모든 public 메서드는 인스턴스 모니터로 직렬화됩니다.</p>
 *
 * @author WorkMesh Team
 * @since 1.0.0
 */
public final class StateSynchronizer {

    private static final Logger log = LoggerFactory.getLogger(StateSynchronizer.class);

    private final QueueHandle deltaQueue;
    private final QueueHandle apiDeltaQueue;
    private final QueueHandle apiStatePublishQueue;
    private final StateTree tree = new StateTree();
    private final DeltaSequencer workSequencer = new DeltaSequencer();
    private final DeltaSequencer apiSequencer = new DeltaSequencer();

    /**
     * @param deltaQueue 실행 컨텍스트 Delta 큐
     * @param apiDeltaQueue 외부 API Delta 큐
     * @param apiStatePublishQueue 스냅샷 발행 큐
     */
    public StateSynchronizer(QueueHandle deltaQueue, QueueHandle apiDeltaQueue, QueueHandle apiStatePublishQueue) {
        if (deltaQueue == null || apiDeltaQueue == null || apiStatePublishQueue == null) {
            throw new IllegalArgumentException("queues cannot be null");
        }
        this.deltaQueue = deltaQueue;
        this.apiDeltaQueue = apiDeltaQueue;
        this.apiStatePublishQueue = apiStatePublishQueue;
    }

    public synchronized void track(WorkName workName) {
        track(workName, 0);
    }

    /**
     * 추적 시작. 이미 Delta를 내보낸 Work를 다시 추적할 때는 그 마지막 id부터 이어서 순서를 맞춥니다.
     *
     * @param workName 대상 Work
     * @param lastDeltaId 이미 발생한 마지막 deltaId (처음이면 0)
     */
    public synchronized void track(WorkName workName, long lastDeltaId) {
        if (lastDeltaId < 0) {
            throw new IllegalArgumentException("lastDeltaId cannot be negative: " + lastDeltaId);
        }
        tree.addWork(workName);
        workSequencer.seed(workName, lastDeltaId);
    }

    /**
     * 추적 해제. 이후 도착하는 이 Work의 Delta는 버려집니다.
     */
    public synchronized void untrack(WorkName workName) {
        tree.removeWork(workName);
        workSequencer.forget(workName);
        apiSequencer.forget(workName);
    }

    public synchronized boolean isTracked(WorkName workName) {
        return tree.contains(workName);
    }

    /**
     * 두 Delta 큐를 비우고 적용.
     *
     * @return 트리에 적용된 Delta 수
     */
    public synchronized int pump() {
        int applied = drain(deltaQueue, workSequencer) + drain(apiDeltaQueue, apiSequencer);
        if (applied > 0) {
            publishSnapshot();
        }
        return applied;
    }

    /**
     * 실행 컨텍스트 Delta를 큐를 거치지 않고 제출.
     *
     * @return 이번에 적용된 Delta 수 (버퍼에서 풀려난 것 포함)
     */
    public synchronized int submit(Delta delta) {
        if (delta == null) {
            throw new IllegalArgumentException("delta cannot be null");
        }
        return accept(delta, workSequencer);
    }

    private int drain(QueueHandle queue, DeltaSequencer sequencer) {
        int applied = 0;
        Optional<QueueMessage> message;
        while ((message = queue.pop(0)).isPresent()) {
            if (message.get() instanceof Delta delta) {
                applied += accept(delta, sequencer);
            } else {
                log.warn("Ignoring unexpected message on {}: {}", queue.name(), message.get());
            }
        }
        return applied;
    }

    private int accept(Delta delta, DeltaSequencer sequencer) {
        if (!tree.contains(delta.workName())) {
            log.warn("Dropping stale delta #{} for work '{}': work is not tracked",
                delta.deltaId(), delta.workName());
            return 0;
        }

        DeltaSequencer.Offer offer = sequencer.offer(delta);
        switch (offer.disposition()) {
            case DUPLICATE:
                log.debug("Dropping duplicate delta #{} for work '{}'", delta.deltaId(), delta.workName());
                return 0;
            case BUFFERED:
                log.debug("Buffering delta #{} for work '{}' (last applied: {})",
                    delta.deltaId(), delta.workName(), sequencer.lastApplied(delta.workName()));
                return 0;
            default:
                break;
        }

        int applied = 0;
        for (Delta ready : offer.ready()) {
            try {
                tree.apply(ready);
                applied++;
            } catch (StaleDeltaException e) {
                log.warn("Dropping stale delta: {}", e.getMessage());
            }
        }
        return applied;
    }

    private void publishSnapshot() {
        try {
            apiStatePublishQueue.push(new StateSnapshot(tree.version(), tree.snapshot()));
        } catch (IllegalStateException e) {
            log.warn("Failed to publish state snapshot v{}: {}", tree.version(), e.getMessage());
        }
    }

    /**
     * @return 전체 상태 트리의 깊은 사본 (Work 이름 → 상태)
     */
    public synchronized Map<String, Object> snapshot() {
        return tree.snapshot();
    }

    /**
     * 경로의 값 조회.
     *
     * @param workName Work 이름
     * @param path 경로 세그먼트 (비어있으면 Work 노드 전체)
     * @return 값 (없으면 null)
     */
    public synchronized Object valueAt(WorkName workName, String... path) {
        return tree.valueAt(workName, Arrays.asList(path));
    }

    public synchronized long version() {
        return tree.version();
    }

    public synchronized long lastAppliedDelta(WorkName workName) {
        return workSequencer.lastApplied(workName);
    }

    public synchronized int bufferedDeltas(WorkName workName) {
        return workSequencer.bufferedCount(workName);
    }
}
