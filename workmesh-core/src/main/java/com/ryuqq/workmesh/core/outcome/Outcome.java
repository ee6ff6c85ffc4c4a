package com.ryuqq.workmesh.core.outcome;

/**
 * 원격 호출 실행 결과.
 *
 * <p>Outcome은 두 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Ok}: 원격 Work가 값을 반환함</li>
 *   <li>{@link Fail}: 원격 Work가 예외를 던짐 (원래 예외의 분류 보존)</li>
 * </ul>
 *
 * <p>재시도 여부는 Outcome이 결정하지 않습니다. 실패를 받은 호출자가 판단합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * if (outcome instanceof Ok ok) {
 *     return codec.decodeValue(ok.value());
 * }
 * Fail fail = (Fail) outcome;
 * throw new RemoteExecutionException(workName, fail.errorType(), fail.message());
 * </pre>
 *
 * @author WorkMesh Team
 * @since 1.0.0
 */
public sealed interface Outcome permits Ok, Fail {

    /**
     * 결과가 성공인지 확인.
     *
     * @return 성공 여부
     */
    default boolean isOk() {
        return this instanceof Ok;
    }

    /**
     * 결과가 실패인지 확인.
     *
     * @return 실패 여부
     */
    default boolean isFail() {
        return this instanceof Fail;
    }
}
