package com.ryuqq.workmesh.adapter.runner;

import com.ryuqq.workmesh.adapter.inmemory.fabric.InMemoryQueueFabric;
import com.ryuqq.workmesh.application.app.WorkQueues;
import com.ryuqq.workmesh.application.work.Work;
import com.ryuqq.workmesh.application.work.WorkRun;
import com.ryuqq.workmesh.core.codec.PayloadCodec;
import com.ryuqq.workmesh.core.contract.CallArguments;
import com.ryuqq.workmesh.core.contract.CallRequest;
import com.ryuqq.workmesh.core.contract.CallResponse;
import com.ryuqq.workmesh.core.contract.CopyRequest;
import com.ryuqq.workmesh.core.contract.CopyResponse;
import com.ryuqq.workmesh.core.contract.Delta;
import com.ryuqq.workmesh.core.contract.WorkSignal;
import com.ryuqq.workmesh.core.model.QueueId;
import com.ryuqq.workmesh.core.model.WorkName;
import com.ryuqq.workmesh.core.outcome.Fail;
import com.ryuqq.workmesh.core.outcome.Ok;
import com.ryuqq.workmesh.core.spi.QueueHandle;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * WorkRunner 유닛 테스트.
 *
 * <p>실제 큐(InMemory) 위에서 실행 컨텍스트의 한 세대를 검증합니다:</p>
 * <ul>
 *   <li>시작 시 READY 신호</li>
 *   <li>호출 처리와 Ok/Fail 응답</li>
 *   <li>Error 발생 시 ERROR 신호와 종료</li>
 *   <li>상태 Delta 발행과 상태 사본 요청</li>
 * </ul>
 *
 * @author WorkMesh Team
 * @since 1.0.0
 */
class WorkRunnerTest {

    private static final QueueId QUEUE_ID = QueueId.of("run1");
    private static final WorkName NAME = WorkName.of("root.trainer");
    private static final long WAIT_MS = 2000;

    private final PayloadCodec codec = new PayloadCodec();
    private InMemoryQueueFabric fabric;
    private WorkQueues queues;
    private Thread thread;
    private WorkRunner runner;

    @BeforeEach
    void setUp() {
        fabric = new InMemoryQueueFabric();
        String name = NAME.getValue();
        queues = new WorkQueues(NAME,
            fabric.getOrchestratorRequestQueue(QUEUE_ID, name),
            fabric.getOrchestratorResponseQueue(QUEUE_ID, name),
            fabric.getOrchestratorCopyRequestQueue(QUEUE_ID, name),
            fabric.getOrchestratorCopyResponseQueue(QUEUE_ID, name),
            fabric.getCallerQueue(QUEUE_ID, name));
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        if (runner != null) {
            runner.stop();
        }
        if (thread != null) {
            thread.join(WAIT_MS);
        }
    }

    private Work start(WorkRun run) {
        Work work = new Work(run);
        work.assignName(NAME);
        runner = new WorkRunner(work, 4, queues,
            fabric.getDeltaQueue(QUEUE_ID), fabric.getReadinessQueue(QUEUE_ID), fabric.getErrorQueue(QUEUE_ID),
            codec, 5);
        thread = new Thread(runner, "runner-test");
        thread.setDaemon(true);
        thread.start();
        return work;
    }

    private CallResponse call(long sequence, CallArguments arguments) {
        queues.caller().push(CallRequest.now(NAME, sequence, codec.encodeArguments(arguments)));
        return queues.response().pop(WAIT_MS, CallResponse.class).orElseThrow();
    }

    @Test
    void run_시작하면_현재_세대의_READY_신호를_보냄() {
        // given
        start(arguments -> null);

        // when
        WorkSignal signal = fabric.getReadinessQueue(QUEUE_ID).pop(WAIT_MS, WorkSignal.class).orElseThrow();

        // then
        assertThat(signal.isReady()).isTrue();
        assertThat(signal.generation()).isEqualTo(4);
        assertThat(signal.workName()).isEqualTo(NAME);
    }

    @Test
    void handleCall_정상_반환값은_Ok_응답으로_인코딩됨() {
        // given
        start(arguments -> Map.of("sum", ((Number) arguments.arg(0)).intValue() + ((Number) arguments.arg(1)).intValue()));

        // when
        CallResponse response = call(1, CallArguments.positional(2, 3));

        // then
        assertThat(response.sequence()).isEqualTo(1);
        assertThat(response.outcome()).isInstanceOf(Ok.class);
        assertThat(codec.decodeValue(((Ok) response.outcome()).value())).isEqualTo(Map.of("sum", 5));
    }

    @Test
    void handleCall_Exception은_Fail_응답이고_컨텍스트는_계속_동작함() {
        // given
        start(arguments -> {
            if (arguments.kwarg("fail") != null) {
                throw new IllegalArgumentException("bad input");
            }
            return "ok";
        });

        // when
        CallResponse failed = call(1, CallArguments.kwargs(Map.of("fail", true)));
        CallResponse next = call(2, CallArguments.none());

        // then
        Fail fail = (Fail) failed.outcome();
        assertThat(fail.errorType()).isEqualTo("java.lang.IllegalArgumentException");
        assertThat(fail.message()).isEqualTo("bad input");
        assertThat(next.outcome()).isInstanceOf(Ok.class);
        assertThat(runner.isRunning()).isTrue();
    }

    @Test
    void handleCall_Error는_Fail_응답_후_ERROR_신호를_보내고_종료됨() throws InterruptedException {
        // given
        start(arguments -> {
            throw new StackOverflowError("deep");
        });

        // when
        CallResponse response = call(1, CallArguments.none());
        WorkSignal signal = fabric.getErrorQueue(QUEUE_ID).pop(WAIT_MS, WorkSignal.class).orElseThrow();
        thread.join(WAIT_MS);

        // then
        assertThat(((Fail) response.outcome()).errorType()).isEqualTo("java.lang.StackOverflowError");
        assertThat(signal.kind()).isEqualTo(WorkSignal.Kind.ERROR);
        assertThat(signal.generation()).isEqualTo(4);
        assertThat(runner.isFinished()).isTrue();
    }

    @Test
    void publishDelta_호출_중_상태_변경은_정규화된_Delta로_발행됨() {
        // given
        Work[] holder = new Work[1];
        holder[0] = start(arguments -> {
            holder[0].state().set("metrics.steps", List.of(1, 2));
            return null;
        });

        // when
        call(1, CallArguments.none());
        Delta delta = fabric.getDeltaQueue(QUEUE_ID).pop(WAIT_MS, Delta.class).orElseThrow();

        // then
        assertThat(delta.deltaId()).isEqualTo(1);
        assertThat(delta.path()).containsExactly("metrics", "steps");
        assertThat(delta.value()).isEqualTo(List.of(1, 2));
    }

    @Test
    void serveCopy_상태_사본_요청에_같은_requestId로_응답함() {
        // given
        Work work = start(arguments -> null);
        work.state().set("epoch", 7);

        // when
        queues.copyRequest().push(new CopyRequest(NAME, 11));
        CopyResponse response = queues.copyResponse().pop(WAIT_MS, CopyResponse.class).orElseThrow();

        // then
        assertThat(response.requestId()).isEqualTo(11);
        assertThat(response.state()).isEqualTo(Map.of("epoch", 7));
    }

    @Test
    void stop_STOP_요청을_받으면_종료하고_sink를_해제함() throws InterruptedException {
        // given
        Work work = start(arguments -> null);
        QueueHandle deltaQueue = fabric.getDeltaQueue(QUEUE_ID);

        // when
        runner.stop();
        thread.join(WAIT_MS);
        work.state().set("after", true);

        // then
        assertThat(runner.isFinished()).isTrue();
        assertThat(runner.isRunning()).isFalse();
        assertThat(deltaQueue.size()).isZero();
    }
}
