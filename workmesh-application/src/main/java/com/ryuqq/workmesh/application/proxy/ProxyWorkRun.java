package com.ryuqq.workmesh.application.proxy;

import com.ryuqq.workmesh.application.app.WorkApp;
import com.ryuqq.workmesh.application.app.WorkQueues;
import com.ryuqq.workmesh.application.work.Work;
import com.ryuqq.workmesh.application.work.WorkRun;
import com.ryuqq.workmesh.core.codec.PayloadCodec;
import com.ryuqq.workmesh.core.contract.CallArguments;
import com.ryuqq.workmesh.core.contract.CallRequest;
import com.ryuqq.workmesh.core.contract.CallResponse;
import com.ryuqq.workmesh.core.contract.QueueMessage;
import com.ryuqq.workmesh.core.error.CallCancelledException;
import com.ryuqq.workmesh.core.error.CallTimeoutException;
import com.ryuqq.workmesh.core.error.RemoteExecutionException;
import com.ryuqq.workmesh.core.error.WorkMeshException;
import com.ryuqq.workmesh.core.model.WorkName;
import com.ryuqq.workmesh.core.outcome.Fail;
import com.ryuqq.workmesh.core.outcome.Ok;
import com.ryuqq.workmesh.core.statemachine.WorkStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 큐를 통한 원격 호출 진입 메서드.
 *
 * <p>호출 인자를 JSON으로 직렬화해 caller 큐에 {@link CallRequest}로 넣고,
 * orchestrator-response 큐의 {@link CallResponse}를 시퀀스 번호로 짝지어 결과를 돌려줍니다.
 * 응답 순서가 뒤바뀌어도 각 호출은 자기 시퀀스의 응답을 받습니다.</p>
 *
 * <p><strong>대기 방식:</strong> 기다리는 스레드가 직접 응답 큐를 poll합니다.
 * 꺼낸 응답이 다른 호출의 것이면 그 호출의 future를 완료시키고 계속 기다립니다.
 * 대기 중에는 App의 신호 큐도 함께 비워, 실패한 Work의 호출이 바로 취소되도록 합니다.</p>
 *
 * <p><strong>Thread-Safety:</strong> 여러 스레드가 동시에 호출해도 됩니다.</p>
 *
 * @author WorkMesh Team
 * @since 1.0.0
 */
public final class ProxyWorkRun implements WrappedRun {

    private static final Logger log = LoggerFactory.getLogger(ProxyWorkRun.class);

    private final WorkApp app;
    private final Work work;
    private final WorkName workName;
    private final WorkRun original;
    private final PayloadCodec codec;
    private final AtomicLong sequence = new AtomicLong();
    private final Map<Long, CompletableFuture<Object>> pending = new ConcurrentHashMap<>();

    ProxyWorkRun(WorkApp app, Work work, WorkRun original) {
        this.app = app;
        this.work = work;
        this.workName = work.name()
            .orElseThrow(() -> new IllegalStateException("work must be named before a proxy is installed"));
        this.original = original;
        this.codec = app.codec();
    }

    @Override
    public Object run(CallArguments arguments) {
        CallHandle handle = submit(arguments);
        if (app.config().callMode() == CallMode.FUTURE) {
            return handle;
        }
        return handle.await();
    }

    @Override
    public CallHandle submit(CallArguments arguments) {
        if (arguments == null) {
            throw new IllegalArgumentException("arguments cannot be null");
        }
        ensureCallable();

        long seq = sequence.incrementAndGet();
        CompletableFuture<Object> future = new CompletableFuture<>();
        pending.put(seq, future);
        try {
            WorkQueues queues = app.queues().require(workName);
            queues.caller().push(CallRequest.now(workName, seq, codec.encodeArguments(arguments)));
        } catch (RuntimeException e) {
            pending.remove(seq);
            throw e;
        }
        log.debug("Call #{} sent to work '{}'", seq, workName);
        return new CallHandle(this, workName, seq, future);
    }

    @Override
    public WorkRun unwrap() {
        return original;
    }

    private void ensureCallable() {
        WorkStatus status = work.status();
        if (status == WorkStatus.FAILED) {
            throw new IllegalStateException("Work '" + workName + "' has failed ("
                + work.lastError().orElse("unknown error") + "); restart it before calling run()");
        }
        if (status != WorkStatus.RUNNING) {
            throw new IllegalStateException("Work '" + workName + "' is not running (status: " + status + ")");
        }
    }

    /**
     * 응답 대기.
     *
     * @param seq 호출 시퀀스
     * @param future 호출 future
     * @param timeoutMs 최대 대기 시간 (0 이하이면 무제한)
     * @return 디코딩된 반환값
     */
    Object await(long seq, CompletableFuture<Object> future, long timeoutMs) {
        long pollMs = Math.max(1, app.config().pollingIntervalMs());
        long deadline = timeoutMs > 0 ? System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs) : 0;

        while (!future.isDone()) {
            long waitMs = pollMs;
            if (timeoutMs > 0) {
                long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
                if (remainingMs <= 0) {
                    // 타임아웃도 최종 결과로 남겨 이후 await가 같은 예외를 받도록 함
                    future.completeExceptionally(new CallTimeoutException(workName.getValue(), seq, timeoutMs));
                    pending.remove(seq, future);
                    break;
                }
                waitMs = Math.min(pollMs, remainingMs);
            }

            if (Thread.currentThread().isInterrupted()) {
                future.completeExceptionally(
                    new CallCancelledException(workName.getValue(), seq, "interrupted while waiting"));
                pending.remove(seq, future);
                break;
            }
            app.pumpSignals();
            if (future.isDone()) {
                break;
            }
            Optional<WorkQueues> queues = app.queues().find(workName);
            if (queues.isPresent()) {
                queues.get().response().pop(waitMs).ifPresent(this::dispatch);
            } else {
                sleep(waitMs);
            }
        }
        return resolve(future);
    }

    /**
     * 응답 큐를 비블로킹으로 비우고 대기 중인 호출에 전달 (FUTURE 모드에서 App pump가 호출).
     *
     * @return 처리한 응답 수
     */
    public int dispatchResponses() {
        Optional<WorkQueues> queues = app.queues().find(workName);
        if (queues.isEmpty()) {
            return 0;
        }
        int count = 0;
        Optional<QueueMessage> message;
        while ((message = queues.get().response().pop(0)).isPresent()) {
            dispatch(message.get());
            count++;
        }
        return count;
    }

    private void dispatch(QueueMessage message) {
        if (!(message instanceof CallResponse)) {
            log.warn("Unexpected message on response queue of work '{}': {}", workName, message);
            return;
        }
        CallResponse response = (CallResponse) message;
        CompletableFuture<Object> future = pending.remove(response.sequence());
        if (future == null) {
            log.warn("Dropping response #{} for work '{}': no call is waiting for it",
                response.sequence(), workName);
            return;
        }

        if (response.outcome() instanceof Ok ok) {
            try {
                future.complete(codec.decodeValue(ok.value()));
            } catch (IllegalArgumentException e) {
                future.completeExceptionally(e);
            }
        } else if (response.outcome() instanceof Fail fail) {
            future.completeExceptionally(
                new RemoteExecutionException(workName.getValue(), fail.errorType(), fail.message()));
        }
    }

    /**
     * 대기 중인 모든 호출 취소 (kill 또는 실패 시).
     *
     * @param reason 취소 사유
     * @return 취소된 호출 수
     */
    public int cancelPending(String reason) {
        int cancelled = 0;
        Iterator<Map.Entry<Long, CompletableFuture<Object>>> it = pending.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<Long, CompletableFuture<Object>> entry = it.next();
            it.remove();
            if (entry.getValue().completeExceptionally(
                new CallCancelledException(workName.getValue(), entry.getKey(), reason))) {
                cancelled++;
            }
        }
        if (cancelled > 0) {
            log.info("Cancelled {} pending call(s) of work '{}': {}", cancelled, workName, reason);
        }
        return cancelled;
    }

    public int pendingCount() {
        return pending.size();
    }

    long defaultTimeoutMs() {
        return app.config().callTimeoutMs();
    }

    private static Object resolve(CompletableFuture<Object> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new WorkMeshException("Call failed: " + cause, cause);
        }
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
