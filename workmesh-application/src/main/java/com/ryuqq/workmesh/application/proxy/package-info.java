/**
 * Run Proxy.
 *
 * <p>등록된 Work의 진입 메서드를 큐 기반 원격 호출로 바꿉니다.
 * {@link com.ryuqq.workmesh.application.proxy.RunProxyInstaller}가 감싸고,
 * 첫 호출에서 {@link com.ryuqq.workmesh.application.proxy.DynamicRunWrapper}가
 * {@link com.ryuqq.workmesh.application.proxy.ProxyWorkRun}을 설치합니다.</p>
 */
package com.ryuqq.workmesh.application.proxy;
