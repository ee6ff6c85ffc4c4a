package com.ryuqq.workmesh.core.error;

/**
 * 원격 실행 중 Work가 던진 예외를 호출자 측에서 다시 던지는 예외.
 *
 * <p>원래 예외 객체는 큐를 건너지 않으므로 분류(클래스 이름)와 메시지만 보존됩니다.</p>
 *
 * @author WorkMesh Team
 * @since 1.0.0
 */
public class RemoteExecutionException extends WorkMeshException {

    private final String workName;
    private final String errorType;
    private final String remoteMessage;

    public RemoteExecutionException(String workName, String errorType, String remoteMessage) {
        super("Work '" + workName + "' raised " + errorType + ": " + remoteMessage);
        this.workName = workName;
        this.errorType = errorType;
        this.remoteMessage = remoteMessage;
    }

    /**
     * @return 호출된 Work 이름
     */
    public String getWorkName() {
        return workName;
    }

    /**
     * @return 원래 예외의 완전한 클래스 이름
     */
    public String getErrorType() {
        return errorType;
    }

    /**
     * @return 원래 예외 메시지 (null 가능)
     */
    public String getRemoteMessage() {
        return remoteMessage;
    }
}
