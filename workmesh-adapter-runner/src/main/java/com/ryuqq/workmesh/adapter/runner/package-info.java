/**
 * Runner Adapter Layer - Backend 구현체와 실행 컨텍스트.
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.workmesh.adapter.runner.LocalBackend} - Work마다 전용 스레드</li>
 *   <li>{@link com.ryuqq.workmesh.adapter.runner.ComputeBackend} - {@link com.ryuqq.workmesh.adapter.runner.ComputeProvisioner}로 만든 인스턴스</li>
 *   <li>{@link com.ryuqq.workmesh.adapter.runner.WorkRunner} - 실행 측 루프</li>
 *   <li>{@link com.ryuqq.workmesh.adapter.runner.CoordinatorLoop} - App pump 스케줄러</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (LocalBackend, ComputeBackend, WorkRunner)
 *   ↓ implements
 * application (Backend interface, WorkApp)
 *   ↓ depends on
 * core (WorkName, QueueMessage, Outcome, WorkStatus, QueueFabric SPI)
 * </pre>
 *
 * @author WorkMesh Team
 * @since 1.0.0
 */
package com.ryuqq.workmesh.adapter.runner;
