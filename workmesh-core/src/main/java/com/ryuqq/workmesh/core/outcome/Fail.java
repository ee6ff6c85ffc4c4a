package com.ryuqq.workmesh.core.outcome;

/**
 * 원격 실행 실패.
 *
 * <p>원격 Work의 진입 메서드가 예외를 던졌거나 실행 컨텍스트가 비정상 종료된 경우를
 * 나타냅니다. 원래 예외의 분류(클래스 이름)와 메시지를 보존하여 호출자 측에서
 * {@code RemoteExecutionException}으로 다시 던질 수 있게 합니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>errorType: "java.lang.IllegalStateException"</li>
 *   <li>errorType: "com.acme.train.DivergedLossException"</li>
 * </ul>
 *
 * @param errorType 원래 예외의 완전한 클래스 이름
 * @param message 오류 메시지 (null 가능)
 * @param cause 원인 체인 요약 (선택, null 가능)
 *
 * @author WorkMesh Team
 * @since 1.0.0
 */
public record Fail(
    String errorType,
    String message,
    String cause
) implements Outcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException errorType이 null이거나 빈 문자열인 경우
     */
    public Fail {
        if (errorType == null || errorType.isBlank()) {
            throw new IllegalArgumentException("errorType cannot be null or blank");
        }
        // message, cause는 null 허용
    }

    /**
     * 예외로부터 Fail 생성.
     *
     * @param error 원격에서 발생한 예외
     * @return Fail 인스턴스
     * @throws IllegalArgumentException error가 null인 경우
     */
    public static Fail from(Throwable error) {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
        Throwable root = error.getCause();
        String cause = root == null ? null : root.getClass().getName() + ": " + root.getMessage();
        return new Fail(error.getClass().getName(), error.getMessage(), cause);
    }

    /**
     * cause 없이 Fail 생성.
     *
     * @param errorType 오류 분류
     * @param message 오류 메시지
     * @return Fail 인스턴스
     */
    public static Fail of(String errorType, String message) {
        return new Fail(errorType, message, null);
    }

    /**
     * 단순 클래스 이름 조회 (패키지 제외).
     *
     * @return 예: "IllegalStateException"
     */
    public String simpleErrorType() {
        int idx = errorType.lastIndexOf('.');
        return idx < 0 ? errorType : errorType.substring(idx + 1);
    }
}
