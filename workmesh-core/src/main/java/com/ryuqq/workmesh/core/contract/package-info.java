/**
 * Queue message contracts.
 *
 * <p>Everything that crosses the Queue Fabric is one of the records in this package,
 * united by the sealed {@link com.ryuqq.workmesh.core.contract.QueueMessage} interface.</p>
 *
 * <h2>Call path</h2>
 * <ul>
 *   <li>{@link com.ryuqq.workmesh.core.contract.CallRequest} - caller queue, sequence-tagged</li>
 *   <li>{@link com.ryuqq.workmesh.core.contract.CallResponse} - orchestrator-response queue, same sequence</li>
 *   <li>{@link com.ryuqq.workmesh.core.contract.CallArguments} - positional and named arguments before serialization</li>
 * </ul>
 *
 * <h2>Control and state</h2>
 * <ul>
 *   <li>{@link com.ryuqq.workmesh.core.contract.ControlRequest} - orchestrator-request queue</li>
 *   <li>{@link com.ryuqq.workmesh.core.contract.CopyRequest} / {@link com.ryuqq.workmesh.core.contract.CopyResponse} - copy queues</li>
 *   <li>{@link com.ryuqq.workmesh.core.contract.Delta} - delta and api-delta queues</li>
 *   <li>{@link com.ryuqq.workmesh.core.contract.WorkSignal} - readiness and error queues</li>
 *   <li>{@link com.ryuqq.workmesh.core.contract.StateSnapshot} - api-state-publish queue</li>
 * </ul>
 *
 * @since 1.0.0
 * @author WorkMesh Team
 */
package com.ryuqq.workmesh.core.contract;
