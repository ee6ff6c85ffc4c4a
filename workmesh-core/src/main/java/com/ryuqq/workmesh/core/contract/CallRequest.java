package com.ryuqq.workmesh.core.contract;

import com.ryuqq.workmesh.core.model.Payload;
import com.ryuqq.workmesh.core.model.WorkName;

/**
 * 원격 호출 요청 봉투 (caller 큐).
 *
 * <p>Run Proxy가 호출 인자를 직렬화하여 생성하며, Work 단위로 단조 증가하는
 * sequence 번호를 가집니다. 응답은 같은 sequence 번호로 짝지어집니다.</p>
 *
 * @param workName 대상 Work
 * @param sequence 호출 sequence 번호 (1부터 시작)
 * @param arguments 직렬화된 {@link CallArguments}
 * @param sentAt 요청 시각 (epoch millis)
 *
 * @author WorkMesh Team
 * @since 1.0.0
 */
public record CallRequest(
    WorkName workName,
    long sequence,
    Payload arguments,
    long sentAt
) implements QueueMessage {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 sequence가 양수가 아닌 경우
     */
    public CallRequest {
        if (workName == null) {
            throw new IllegalArgumentException("workName cannot be null");
        }
        if (sequence <= 0) {
            throw new IllegalArgumentException("sequence must be positive (current: " + sequence + ")");
        }
        if (arguments == null) {
            throw new IllegalArgumentException("arguments cannot be null");
        }
        if (sentAt < 0) {
            throw new IllegalArgumentException("sentAt must be non-negative (current: " + sentAt + ")");
        }
    }

    /**
     * 현재 시각으로 CallRequest 생성.
     */
    public static CallRequest now(WorkName workName, long sequence, Payload arguments) {
        return new CallRequest(workName, sequence, arguments, System.currentTimeMillis());
    }
}
