/**
 * Runtime 인터페이스.
 *
 * <p>코디네이터의 pump 계약입니다. 구현체는 {@link com.ryuqq.workmesh.application.app.WorkApp}이고,
 * adapter-runner 모듈의 {@code CoordinatorLoop}가 주기적으로 호출합니다.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.workmesh.application.runtime;
