package com.ryuqq.workmesh.core.contract;

import com.ryuqq.workmesh.core.model.WorkName;
import com.ryuqq.workmesh.core.outcome.Outcome;

/**
 * 원격 호출 응답 봉투 (orchestrator-response 큐).
 *
 * @param workName 응답한 Work
 * @param sequence 대응하는 {@link CallRequest#sequence()}
 * @param outcome 실행 결과 (Ok 또는 Fail)
 *
 * @author WorkMesh Team
 * @since 1.0.0
 */
public record CallResponse(
    WorkName workName,
    long sequence,
    Outcome outcome
) implements QueueMessage {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 sequence가 양수가 아닌 경우
     */
    public CallResponse {
        if (workName == null) {
            throw new IllegalArgumentException("workName cannot be null");
        }
        if (sequence <= 0) {
            throw new IllegalArgumentException("sequence must be positive (current: " + sequence + ")");
        }
        if (outcome == null) {
            throw new IllegalArgumentException("outcome cannot be null");
        }
    }
}
