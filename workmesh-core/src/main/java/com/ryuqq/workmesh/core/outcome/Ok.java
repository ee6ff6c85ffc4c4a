package com.ryuqq.workmesh.core.outcome;

import com.ryuqq.workmesh.core.model.Payload;

/**
 * 성공 결과.
 *
 * <p>원격 Work의 진입 메서드가 정상 반환했음을 나타냅니다.</p>
 *
 * @param value 직렬화된 반환값 (반환값이 없으면 {@link Payload#empty()})
 *
 * @author WorkMesh Team
 * @since 1.0.0
 */
public record Ok(Payload value) implements Outcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException value가 null인 경우
     */
    public Ok {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
    }

    /**
     * 반환값 없는 성공 결과 생성.
     *
     * @return Ok 인스턴스
     */
    public static Ok empty() {
        return new Ok(Payload.empty());
    }

    /**
     * 성공 결과 생성.
     *
     * @param value 직렬화된 반환값
     * @return Ok 인스턴스
     */
    public static Ok of(Payload value) {
        return new Ok(value);
    }
}
