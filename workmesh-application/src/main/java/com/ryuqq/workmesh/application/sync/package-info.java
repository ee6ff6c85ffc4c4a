/**
 * 상태 동기화.
 *
 * <p>실행 컨텍스트가 만든 Delta를 Work별 순서대로 정본 상태 트리에 병합합니다.</p>
 */
package com.ryuqq.workmesh.application.sync;
