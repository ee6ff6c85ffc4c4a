package com.ryuqq.workmesh.application.proxy;

import com.ryuqq.workmesh.core.model.WorkName;

import java.util.concurrent.CompletableFuture;

/**
 * 원격 호출 핸들.
 *
 * <p>{@link ProxyWorkRun}이 보낸 호출 하나를 나타냅니다. 응답은 시퀀스 번호로 짝지어집니다.</p>
 *
 * <p><strong>가능한 결과:</strong></p>
 * <ul>
 *   <li>성공: 디코딩된 반환값</li>
 *   <li>원격 예외: {@link com.ryuqq.workmesh.core.error.RemoteExecutionException}</li>
 *   <li>시간 초과: {@link com.ryuqq.workmesh.core.error.CallTimeoutException}</li>
 *   <li>kill/실패로 취소: {@link com.ryuqq.workmesh.core.error.CallCancelledException}</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * CallHandle handle = trainer.submit(CallArguments.kwargs(Map.of("batch", 5)));
 * // ... 다른 작업
 * Object result = handle.await(5_000);
 * </pre>
 *
 * @author WorkMesh Team
 * @since 1.0.0
 */
public final class CallHandle {

    private final ProxyWorkRun proxy;
    private final WorkName workName;
    private final long sequence;
    private final CompletableFuture<Object> future;

    CallHandle(ProxyWorkRun proxy, WorkName workName, long sequence, CompletableFuture<Object> future) {
        if (proxy == null || workName == null || future == null) {
            throw new IllegalArgumentException("proxy, workName and future cannot be null");
        }
        this.proxy = proxy;
        this.workName = workName;
        this.sequence = sequence;
        this.future = future;
    }

    /**
     * 설정된 call timeout으로 응답 대기.
     *
     * @return 반환값
     */
    public Object await() {
        return proxy.await(sequence, future, proxy.defaultTimeoutMs());
    }

    /**
     * 응답 대기.
     *
     * @param timeoutMs 최대 대기 시간 (0 이하이면 무제한)
     * @return 반환값
     */
    public Object await(long timeoutMs) {
        return proxy.await(sequence, future, timeoutMs);
    }

    /**
     * @return 응답(또는 취소)이 도착했으면 true
     */
    public boolean isDone() {
        return future.isDone();
    }

    public WorkName getWorkName() {
        return workName;
    }

    public long getSequence() {
        return sequence;
    }

    @Override
    public String toString() {
        return "CallHandle{work=" + workName + ", sequence=" + sequence + ", done=" + future.isDone() + "}";
    }
}
