package com.ryuqq.workmesh.core.model;

/**
 * Work의 고유 이름.
 *
 * <p>WorkName은 App 내에서 하나의 Work를 식별하며, 큐 이름과 상태 트리 경로의
 * 키로 사용됩니다. 부모 WorkFlow에 연결될 때 한 번 부여되고 이후 변경되지 않습니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 *   <li>패턴: 영숫자, 점(.), 하이픈(-), 언더스코어(_)만 허용</li>
 * </ul>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * WorkName.of("trainer");
 * WorkName.of("root.trainer");
 * WorkName.of("worker-1");
 * </pre>
 *
 * @author WorkMesh Team
 * @since 1.0.0
 */
public final class WorkName {

    private final String value;

    private WorkName(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("WorkName cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("WorkName length cannot exceed 255 characters");
        }
        if (!value.matches("^[a-zA-Z0-9.\\-_]+$")) {
            throw new IllegalArgumentException(
                "WorkName contains invalid characters: '" + value + "'. Only alphanumeric, dot, hyphen, and underscore are allowed");
        }
        this.value = value;
    }

    /**
     * WorkName 생성.
     *
     * @param value 이름 값
     * @return WorkName 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static WorkName of(String value) {
        return new WorkName(value);
    }

    /**
     * 하위 이름 생성 (점으로 연결).
     *
     * <p>WorkFlow가 자식 Work에 이름을 부여할 때 사용합니다.</p>
     *
     * @param childName 자식 이름
     * @return "{this}.{childName}" 형태의 WorkName
     * @throws IllegalArgumentException childName이 유효하지 않은 경우
     */
    public WorkName child(String childName) {
        if (childName == null || childName.isBlank()) {
            throw new IllegalArgumentException("childName cannot be null or blank");
        }
        if (childName.contains(".")) {
            throw new IllegalArgumentException("childName cannot contain '.' (current: " + childName + ")");
        }
        return new WorkName(value + "." + childName);
    }

    /**
     * 이름 값 조회.
     *
     * @return 이름 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkName workName = (WorkName) o;
        return value.equals(workName.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
