package com.ryuqq.workmesh.core.model;

/**
 * 큐를 건너는 호출 인자와 반환값의 직렬화된 형태 (JSON 텍스트).
 *
 * <p>Payload는 호출자와 원격 실행 컨텍스트 사이에서 값이 공유 메모리가 아닌
 * 직렬화된 사본으로만 전달되도록 보장합니다. 직렬화/역직렬화는
 * {@link com.ryuqq.workmesh.core.codec.PayloadCodec}이 담당합니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>인자: Payload.of("{\"args\":[],\"kwargs\":{\"batch\":5}}")</li>
 *   <li>반환값: Payload.of("{\"loss\":0.42}")</li>
 *   <li>반환값 없음: Payload.empty() → "null"</li>
 * </ul>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 *
 * @author WorkMesh Team
 * @since 1.0.0
 */
public final class Payload {

    private static final String JSON_NULL = "null";

    private final String value;

    private Payload(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Payload value cannot be null (use Payload.empty())");
        }
        this.value = value;
    }

    /**
     * Payload 생성.
     *
     * @param value JSON 텍스트
     * @return Payload 인스턴스
     * @throws IllegalArgumentException value가 null인 경우
     */
    public static Payload of(String value) {
        return new Payload(value);
    }

    /**
     * 빈 Payload 생성 (JSON null).
     *
     * @return 빈 Payload 인스턴스
     */
    public static Payload empty() {
        return new Payload(JSON_NULL);
    }

    /**
     * Payload 값 조회.
     *
     * @return JSON 텍스트
     */
    public String getValue() {
        return value;
    }

    /**
     * Payload가 비어있는지 확인.
     *
     * @return JSON null 또는 빈 문자열이면 true
     */
    public boolean isEmpty() {
        return value.isBlank() || JSON_NULL.equals(value.trim());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Payload payload = (Payload) o;
        return value.equals(payload.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "Payload{" + value.length() + " chars}";
    }
}
