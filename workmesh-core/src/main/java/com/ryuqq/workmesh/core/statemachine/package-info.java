/**
 * Work lifecycle state machine package.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.workmesh.core.statemachine.WorkStatus} - Work lifecycle states (enum)</li>
 *   <li>{@link com.ryuqq.workmesh.core.statemachine.StatusTransition} - Transition validation and execution</li>
 * </ul>
 *
 * <h2>State Transition Rules</h2>
 * <pre>
 * CREATED → STARTING → RUNNING
 * RUNNING → STOPPING → STOPPED → STARTING
 * RUNNING → RESTARTING → STARTING
 * STARTING | RUNNING → FAILED → RESTARTING
 * any → STOPPED (forceStop, kill only)
 * </pre>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * WorkStatus status = WorkStatus.CREATED;
 * status = StatusTransition.transition(status, WorkStatus.STARTING);
 * status = StatusTransition.transition(status, WorkStatus.RUNNING);
 *
 * // This will throw IllegalStateException
 * StatusTransition.validate(status, WorkStatus.CREATED);
 * </pre>
 *
 * @since 1.0.0
 * @author WorkMesh Team
 */
package com.ryuqq.workmesh.core.statemachine;
