package com.ryuqq.workmesh.adapter.runner;

import com.ryuqq.workmesh.application.app.WorkApp;
import com.ryuqq.workmesh.application.app.WorkQueues;
import com.ryuqq.workmesh.application.work.DeltaSink;
import com.ryuqq.workmesh.application.work.Work;
import com.ryuqq.workmesh.application.work.WorkRun;
import com.ryuqq.workmesh.core.codec.PayloadCodec;
import com.ryuqq.workmesh.core.contract.CallArguments;
import com.ryuqq.workmesh.core.contract.CallRequest;
import com.ryuqq.workmesh.core.contract.CallResponse;
import com.ryuqq.workmesh.core.contract.ControlRequest;
import com.ryuqq.workmesh.core.contract.CopyRequest;
import com.ryuqq.workmesh.core.contract.CopyResponse;
import com.ryuqq.workmesh.core.contract.Delta;
import com.ryuqq.workmesh.core.contract.QueueMessage;
import com.ryuqq.workmesh.core.contract.WorkSignal;
import com.ryuqq.workmesh.core.model.WorkName;
import com.ryuqq.workmesh.core.outcome.Fail;
import com.ryuqq.workmesh.core.outcome.Ok;
import com.ryuqq.workmesh.core.outcome.Outcome;
import com.ryuqq.workmesh.core.spi.QueueHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Work의 실행 컨텍스트 (실행 측 루프).
 *
 * <p>Backend가 만든 실행 환경(로컬 스레드, 컴퓨트 인스턴스) 안에서 돌아갑니다.</p>
 *
 * <p><strong>루프 흐름:</strong></p>
 * <pre>
 * 1. WorkState에 delta sink 연결, readiness 큐에 READY(generation) 전송
 * 2. while (running):
 *    a. orchestrator-request 큐: STOP이면 종료
 *    b. copy-request 큐: 로컬 상태 사본을 copy-response 큐로
 *    c. caller 큐 (pollIntervalMs 대기): 인자 디코딩 → 원래 진입 메서드 실행
 *       → Ok/Fail CallResponse를 orchestrator-response 큐로
 * 3. 종료 시 delta sink 해제
 * </pre>
 *
 * <p><strong>오류 처리:</strong></p>
 * <ul>
 *   <li>Work가 던진 Exception: Fail 응답, 루프는 계속 (Work는 RUNNING 유지)</li>
 *   <li>Work가 던진 Error 또는 루프 자체의 오류: Fail 응답 후 ERROR 신호, 루프 종료</li>
 *   <li>stop 이후 발생한 큐 오류: 조용히 종료 (큐는 이미 폐기됨)</li>
 * </ul>
 *
 * @author WorkMesh Team
 * @since 1.0.0
 */
public final class WorkRunner implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(WorkRunner.class);

    private final Work work;
    private final WorkName workName;
    private final long generation;
    private final WorkRun entryPoint;
    private final WorkQueues queues;
    private final QueueHandle deltaQueue;
    private final QueueHandle readinessQueue;
    private final QueueHandle errorQueue;
    private final PayloadCodec codec;
    private final long pollIntervalMs;
    private final DeltaSink deltaSink;
    private volatile boolean running = true;
    private volatile boolean finished;

    /**
     * App의 레지스트리에서 큐를 연결해 실행 컨텍스트 생성.
     *
     * @param app 소유 App
     * @param work 대상 Work (이름 있음, 큐 등록됨)
     * @param config 실행 설정
     * @return 실행 컨텍스트
     */
    public static WorkRunner attach(WorkApp app, Work work, RunnerConfig config) {
        WorkName name = work.name()
            .orElseThrow(() -> new IllegalStateException("work must be named before it can run"));
        return new WorkRunner(work, work.generation(), app.queues().require(name),
            app.queues().deltaQueue(), app.queues().readinessQueue(), app.queues().errorQueue(),
            app.codec(), config.pollIntervalMs());
    }

    WorkRunner(Work work, long generation, WorkQueues queues,
               QueueHandle deltaQueue, QueueHandle readinessQueue, QueueHandle errorQueue,
               PayloadCodec codec, long pollIntervalMs) {
        this.work = work;
        this.workName = queues.workName();
        this.generation = generation;
        this.entryPoint = work.originalEntryPoint();
        this.queues = queues;
        this.deltaQueue = deltaQueue;
        this.readinessQueue = readinessQueue;
        this.errorQueue = errorQueue;
        this.codec = codec;
        this.pollIntervalMs = pollIntervalMs;
        this.deltaSink = this::publishDelta;
    }

    @Override
    public void run() {
        work.state().attach(deltaSink);
        try {
            readinessQueue.push(WorkSignal.ready(workName, generation));
            log.debug("Execution context of work '{}' ready (generation {})", workName, generation);
            while (running && !Thread.currentThread().isInterrupted()) {
                step();
            }
        } catch (Error e) {
            crash(e);
        } catch (RuntimeException e) {
            if (running) {
                crash(e);
            } else {
                log.debug("Execution context of work '{}' ended after stop: {}", workName, e.getMessage());
            }
        } finally {
            work.state().detach(deltaSink);
            finished = true;
            log.debug("Execution context of work '{}' exited (generation {})", workName, generation);
        }
    }

    private void step() {
        Optional<ControlRequest> control = queues.request().pop(0, ControlRequest.class);
        if (control.isPresent() && control.get().command() == ControlRequest.Command.STOP) {
            running = false;
            return;
        }

        Optional<CopyRequest> copy = queues.copyRequest().pop(0, CopyRequest.class);
        copy.ifPresent(this::serveCopy);

        Optional<QueueMessage> message = queues.caller().pop(pollIntervalMs);
        if (message.isPresent() && message.get() instanceof CallRequest request) {
            handleCall(request);
        }
    }

    private void handleCall(CallRequest request) {
        Outcome outcome;
        Error fatal = null;
        try {
            CallArguments arguments = codec.decodeArguments(request.arguments());
            Object result = entryPoint.run(arguments);
            outcome = Ok.of(codec.encodeValue(result));
        } catch (Exception e) {
            log.debug("Work '{}' raised {} for call #{}", workName, e.getClass().getName(), request.sequence());
            outcome = Fail.from(e);
        } catch (Error e) {
            outcome = Fail.from(e);
            fatal = e;
        }
        queues.response().push(new CallResponse(workName, request.sequence(), outcome));
        if (fatal != null) {
            throw fatal;
        }
    }

    private void serveCopy(CopyRequest request) {
        Map<String, Object> normalized = new LinkedHashMap<>();
        if (codec.normalize(work.state().snapshot()) instanceof Map<?, ?> map) {
            map.forEach((key, value) -> normalized.put(String.valueOf(key), value));
        }
        queues.copyResponse().push(new CopyResponse(workName, request.requestId(), normalized));
    }

    private void publishDelta(Delta delta) {
        deltaQueue.push(new Delta(delta.workName(), delta.deltaId(), delta.path(),
            delta.operation(), codec.normalize(delta.value())));
    }

    private void crash(Throwable error) {
        running = false;
        log.error("Execution context of work '{}' crashed", workName, error);
        try {
            errorQueue.push(WorkSignal.error(workName, generation, error));
        } catch (RuntimeException e) {
            log.warn("Could not publish error signal for work '{}': {}", workName, e.getMessage());
        }
    }

    /**
     * 루프 종료 요청. orchestrator-request 큐에 STOP을 넣어 대기 중인 루프도 깨웁니다.
     */
    public void stop() {
        if (!running) {
            return;
        }
        running = false;
        try {
            queues.request().push(ControlRequest.stop(workName));
        } catch (IllegalStateException e) {
            log.debug("Request queue of work '{}' is already gone", workName);
        }
    }

    public boolean isRunning() {
        return running && !finished;
    }

    public boolean isFinished() {
        return finished;
    }

    public WorkName getWorkName() {
        return workName;
    }

    public long getGeneration() {
        return generation;
    }
}
