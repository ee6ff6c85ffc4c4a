/**
 * Core value objects.
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.workmesh.core.model.WorkName} - Unique, dotted name of a Work</li>
 *   <li>{@link com.ryuqq.workmesh.core.model.QueueId} - Process-wide queue namespace</li>
 *   <li>{@link com.ryuqq.workmesh.core.model.Payload} - Serialized (JSON) call data</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> All value objects are immutable (final fields)</li>
 *   <li><strong>Validation:</strong> Constructor validation ensures data integrity</li>
 *   <li><strong>Type Safety:</strong> Strong typing prevents mixing up names and ids</li>
 * </ul>
 *
 * @since 1.0.0
 * @author WorkMesh Team
 */
package com.ryuqq.workmesh.core.model;
