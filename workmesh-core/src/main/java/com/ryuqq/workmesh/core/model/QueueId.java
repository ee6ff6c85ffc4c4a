package com.ryuqq.workmesh.core.model;

import java.util.UUID;

/**
 * 프로세스 단위 큐 식별자.
 *
 * <p>하나의 App이 사용하는 모든 큐 이름의 접두어입니다. 같은 QueueFabric을
 * 공유하는 여러 App이 서로의 채널을 침범하지 않도록 구분합니다.</p>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~64자</li>
 *   <li>패턴: 영숫자, 하이픈(-)만 허용</li>
 * </ul>
 *
 * @author WorkMesh Team
 * @since 1.0.0
 */
public final class QueueId {

    private final String value;

    private QueueId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("QueueId cannot be null or blank");
        }
        if (value.length() > 64) {
            throw new IllegalArgumentException("QueueId length cannot exceed 64 characters");
        }
        if (!value.matches("^[a-zA-Z0-9\\-]+$")) {
            throw new IllegalArgumentException("QueueId contains invalid characters. Only alphanumeric and hyphen are allowed");
        }
        this.value = value;
    }

    /**
     * QueueId 생성.
     *
     * @param value QueueId 값
     * @return QueueId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static QueueId of(String value) {
        return new QueueId(value);
    }

    /**
     * 임의의 QueueId 생성 (UUID 앞 8자리).
     *
     * @return 새 QueueId
     */
    public static QueueId generate() {
        return new QueueId(UUID.randomUUID().toString().substring(0, 8));
    }

    /**
     * QueueId 값 조회.
     *
     * @return QueueId 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        QueueId queueId = (QueueId) o;
        return value.equals(queueId.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "QueueId{" + value + '}';
    }
}
