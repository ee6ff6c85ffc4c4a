/**
 * Work 모델.
 *
 * <p>{@link com.ryuqq.workmesh.application.work.Work}는 이름 있는 호출 가능한 단위이고,
 * {@link com.ryuqq.workmesh.application.work.WorkFlow}가 이름을 부여합니다.
 * {@link com.ryuqq.workmesh.application.work.WorkState}는 실행 측에서 기록되는 관찰 상태입니다.</p>
 */
package com.ryuqq.workmesh.application.work;
