package com.ryuqq.workmesh.application.lifecycle;

import com.ryuqq.workmesh.application.proxy.ProxyWorkRun;
import com.ryuqq.workmesh.application.work.Work;
import com.ryuqq.workmesh.core.contract.QueueMessage;
import com.ryuqq.workmesh.core.contract.WorkSignal;
import com.ryuqq.workmesh.core.model.WorkName;
import com.ryuqq.workmesh.core.spi.QueueHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.function.Function;

/**
 * readiness/error 신호 처리.
 *
 * <p>App 전역 readiness 큐와 error 큐를 비블로킹으로 비우고 Work 상태에 반영합니다.
 * 신호는 한 번만 소비됩니다.</p>
 *
 * <ul>
 *   <li>READY: STARTING → RUNNING</li>
 *   <li>ERROR: → FAILED, 마지막 오류 기록, 이미 도착한 응답 전달 후 남은 호출 취소</li>
 * </ul>
 *
 * <p>신호의 세대 번호가 Work의 현재 세대와 다르면 이미 kill된 실행 컨텍스트가 보낸 것이므로 무시합니다.</p>
 *
 * @author WorkMesh Team
 * @since 1.0.0
 */
public final class SignalMonitor {

    private static final Logger log = LoggerFactory.getLogger(SignalMonitor.class);

    private final QueueHandle readinessQueue;
    private final QueueHandle errorQueue;
    private final Function<WorkName, Optional<Work>> works;

    /**
     * @param readinessQueue readiness 큐
     * @param errorQueue error 큐
     * @param works 이름으로 Work 조회
     */
    public SignalMonitor(QueueHandle readinessQueue, QueueHandle errorQueue,
                         Function<WorkName, Optional<Work>> works) {
        if (readinessQueue == null || errorQueue == null || works == null) {
            throw new IllegalArgumentException("readinessQueue, errorQueue and works cannot be null");
        }
        this.readinessQueue = readinessQueue;
        this.errorQueue = errorQueue;
        this.works = works;
    }

    /**
     * readiness 큐, error 큐 순서로 비우고 처리.
     *
     * @return 처리한 신호 수 (무시한 신호 포함)
     */
    public synchronized int drain() {
        return drain(readinessQueue) + drain(errorQueue);
    }

    private int drain(QueueHandle queue) {
        int count = 0;
        Optional<QueueMessage> message;
        while ((message = queue.pop(0)).isPresent()) {
            count++;
            if (message.get() instanceof WorkSignal signal) {
                handle(signal);
            } else {
                log.warn("Ignoring unexpected message on {}: {}", queue.name(), message.get());
            }
        }
        return count;
    }

    private void handle(WorkSignal signal) {
        Optional<Work> target = works.apply(signal.workName());
        if (target.isEmpty()) {
            log.debug("Ignoring {} signal for unknown work '{}'", signal.kind(), signal.workName());
            return;
        }
        Work work = target.get();
        if (signal.generation() != work.generation()) {
            log.debug("Ignoring {} signal of generation {} for work '{}' (current generation {})",
                signal.kind(), signal.generation(), signal.workName(), work.generation());
            return;
        }

        if (signal.isReady()) {
            if (!work.markReady()) {
                log.debug("Ignoring READY for work '{}' in status {}", signal.workName(), work.status());
            }
            return;
        }

        String error = signal.errorType() + ": " + signal.message();
        if (work.markFailed(error)) {
            log.error("Work '{}' failed: {}", signal.workName(), error);
            if (work.entryPoint() instanceof ProxyWorkRun proxy) {
                // 신호보다 먼저 도착한 응답은 그대로 전달
                proxy.dispatchResponses();
                proxy.cancelPending("work '" + signal.workName() + "' failed (" + error + ")");
            }
        } else {
            log.warn("Ignoring ERROR for work '{}' in status {}: {}", signal.workName(), work.status(), error);
        }
    }
}
