package com.ryuqq.workmesh.core.error;

/**
 * 설정된 시간 안에 응답이 오지 않음.
 *
 * <p>{@link RemoteExecutionException}과 구분되므로 호출자는 재시도 여부를 선택할 수 있습니다.</p>
 *
 * @author WorkMesh Team
 * @since 1.0.0
 */
public class CallTimeoutException extends WorkMeshException {

    private final long sequence;

    public CallTimeoutException(String workName, long sequence, long timeoutMs) {
        super("Call #" + sequence + " to work '" + workName + "' timed out after " + timeoutMs + "ms");
        this.sequence = sequence;
    }

    /**
     * @return 타임아웃된 호출의 sequence 번호
     */
    public long getSequence() {
        return sequence;
    }
}
