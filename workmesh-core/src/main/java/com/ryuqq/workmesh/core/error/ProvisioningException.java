package com.ryuqq.workmesh.core.error;

/**
 * Backend가 Work의 실행 컨텍스트를 만들지 못함.
 *
 * <p>쿼터 초과, 이미지 pull 실패, readiness 신호 미수신 등. Backend 내부에서 재시도하지 않고
 * App까지 전파됩니다.</p>
 *
 * @author WorkMesh Team
 * @since 1.0.0
 */
public class ProvisioningException extends WorkMeshException {

    private final String workName;

    public ProvisioningException(String workName, String message) {
        super("Failed to provision work '" + workName + "': " + message);
        this.workName = workName;
    }

    public ProvisioningException(String workName, String message, Throwable cause) {
        super("Failed to provision work '" + workName + "': " + message, cause);
        this.workName = workName;
    }

    /**
     * @return 프로비저닝에 실패한 Work 이름
     */
    public String getWorkName() {
        return workName;
    }
}
