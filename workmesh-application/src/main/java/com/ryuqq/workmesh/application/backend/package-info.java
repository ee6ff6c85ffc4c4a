/**
 * 실행 환경 Backend 계약.
 *
 * <p>구현은 {@code workmesh-adapter-runner} 모듈에 있습니다.</p>
 */
package com.ryuqq.workmesh.application.backend;
