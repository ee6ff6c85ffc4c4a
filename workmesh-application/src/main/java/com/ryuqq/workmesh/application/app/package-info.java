/**
 * App 코디네이터.
 *
 * <p>{@link com.ryuqq.workmesh.application.app.WorkApp}이 Queue Fabric, Backend, Work별 WorkManager를 소유하고,
 * {@link com.ryuqq.workmesh.application.app.QueueRegistry}가 큐 묶음을 관리합니다.</p>
 */
package com.ryuqq.workmesh.application.app;
