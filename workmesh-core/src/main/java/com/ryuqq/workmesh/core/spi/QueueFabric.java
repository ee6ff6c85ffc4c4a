package com.ryuqq.workmesh.core.spi;

import com.ryuqq.workmesh.core.model.QueueId;

/**
 * Queue Fabric SPI: the set of named point-to-point channels connecting the caller,
 * orchestrator and remote execution roles.
 *
 * <p>A channel is identified by {@code (queueId, role, workName)}. Asking twice for the
 * same identity returns the same channel, which is how both endpoints end up connected.</p>
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Creating channels on first access</li>
 *   <li>Deleting channels when a Work is torn down</li>
 *   <li>Releasing all resources on close</li>
 * </ul>
 *
 * <p>Implementations must be thread-safe.</p>
 *
 * @author WorkMesh Team
 * @since 1.0.0
 */
public interface QueueFabric extends AutoCloseable {

    /**
     * Returns (creating if needed) the channel for the given identity.
     *
     * @param role channel role
     * @param queueId process-wide queue id
     * @param workName work name; required for per-Work roles, must be null otherwise
     * @return the channel
     * @throws IllegalArgumentException if role or queueId is null, or workName does not match the role
     */
    QueueHandle getQueue(QueueRole role, QueueId queueId, String workName);

    /**
     * Deletes a channel. Waiting messages are discarded; blocked pops return empty.
     * Deleting an unknown channel is a no-op.
     *
     * @param queueName channel name
     * @return true if a channel was deleted
     */
    boolean delete(String queueName);

    /**
     * Deletes every channel.
     */
    @Override
    void close();

    default QueueHandle getCallerQueue(QueueId queueId, String workName) {
        return getQueue(QueueRole.CALLER, queueId, workName);
    }

    default QueueHandle getOrchestratorRequestQueue(QueueId queueId, String workName) {
        return getQueue(QueueRole.ORCHESTRATOR_REQUEST, queueId, workName);
    }

    default QueueHandle getOrchestratorResponseQueue(QueueId queueId, String workName) {
        return getQueue(QueueRole.ORCHESTRATOR_RESPONSE, queueId, workName);
    }

    default QueueHandle getOrchestratorCopyRequestQueue(QueueId queueId, String workName) {
        return getQueue(QueueRole.ORCHESTRATOR_COPY_REQUEST, queueId, workName);
    }

    default QueueHandle getOrchestratorCopyResponseQueue(QueueId queueId, String workName) {
        return getQueue(QueueRole.ORCHESTRATOR_COPY_RESPONSE, queueId, workName);
    }

    default QueueHandle getDeltaQueue(QueueId queueId) {
        return getQueue(QueueRole.DELTA, queueId, null);
    }

    default QueueHandle getReadinessQueue(QueueId queueId) {
        return getQueue(QueueRole.READINESS, queueId, null);
    }

    default QueueHandle getErrorQueue(QueueId queueId) {
        return getQueue(QueueRole.ERROR, queueId, null);
    }

    default QueueHandle getApiStatePublishQueue(QueueId queueId) {
        return getQueue(QueueRole.API_STATE_PUBLISH, queueId, null);
    }

    default QueueHandle getApiDeltaQueue(QueueId queueId) {
        return getQueue(QueueRole.API_DELTA, queueId, null);
    }
}
