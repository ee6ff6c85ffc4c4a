package com.ryuqq.workmesh.core.error;

/**
 * Work 구성 오류 (치명적, 재시도 불가).
 *
 * <p>대표적으로 부모 WorkFlow에 연결되지 않아 이름이 없는 Work를 실행하려는 경우,
 * 또는 같은 이름의 Work를 두 번 등록하는 경우에 발생합니다.</p>
 *
 * @author WorkMesh Team
 * @since 1.0.0
 */
public class ConfigurationException extends WorkMeshException {

    public ConfigurationException(String message) {
        super(message);
    }
}
