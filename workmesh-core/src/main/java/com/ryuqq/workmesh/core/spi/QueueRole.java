package com.ryuqq.workmesh.core.spi;

import com.ryuqq.workmesh.core.contract.CallRequest;
import com.ryuqq.workmesh.core.contract.CallResponse;
import com.ryuqq.workmesh.core.contract.ControlRequest;
import com.ryuqq.workmesh.core.contract.CopyRequest;
import com.ryuqq.workmesh.core.contract.CopyResponse;
import com.ryuqq.workmesh.core.contract.Delta;
import com.ryuqq.workmesh.core.contract.QueueMessage;
import com.ryuqq.workmesh.core.contract.StateSnapshot;
import com.ryuqq.workmesh.core.contract.WorkSignal;

/**
 * Role of a channel in the Queue Fabric.
 *
 * <p>Per-Work roles need a work name to be addressed; App-wide roles are addressed
 * by the queue id alone. Each role accepts exactly one message type.</p>
 *
 * @author WorkMesh Team
 * @since 1.0.0
 */
public enum QueueRole {

    CALLER("caller", true, CallRequest.class),
    ORCHESTRATOR_REQUEST("orchestrator_request", true, ControlRequest.class),
    ORCHESTRATOR_RESPONSE("orchestrator_response", true, CallResponse.class),
    ORCHESTRATOR_COPY_REQUEST("orchestrator_copy_request", true, CopyRequest.class),
    ORCHESTRATOR_COPY_RESPONSE("orchestrator_copy_response", true, CopyResponse.class),
    DELTA("delta", false, Delta.class),
    READINESS("readiness", false, WorkSignal.class),
    ERROR("error", false, WorkSignal.class),
    API_STATE_PUBLISH("api_state_publish", false, StateSnapshot.class),
    API_DELTA("api_delta", false, Delta.class);

    private final String suffix;
    private final boolean perWork;
    private final Class<? extends QueueMessage> messageType;

    QueueRole(String suffix, boolean perWork, Class<? extends QueueMessage> messageType) {
        this.suffix = suffix;
        this.perWork = perWork;
        this.messageType = messageType;
    }

    public String suffix() {
        return suffix;
    }

    /**
     * @return true if channels of this role exist once per Work
     */
    public boolean isPerWork() {
        return perWork;
    }

    public Class<? extends QueueMessage> messageType() {
        return messageType;
    }

    /**
     * Checks whether a message may travel on a channel of this role.
     *
     * @param message the message to check
     * @return true if the message type matches this role
     */
    public boolean accepts(QueueMessage message) {
        return messageType.isInstance(message);
    }

    /**
     * Builds the channel name for this role.
     *
     * <p>{@code {queueId}_{suffix}} for App-wide roles,
     * {@code {queueId}_{suffix}_{workName}} for per-Work roles.</p>
     *
     * @param queueId process-wide queue id
     * @param workName work name (required for per-Work roles, ignored otherwise)
     * @return channel name
     * @throws IllegalArgumentException if queueId is null, or workName is null for a per-Work role
     */
    public String queueName(String queueId, String workName) {
        if (queueId == null || queueId.isBlank()) {
            throw new IllegalArgumentException("queueId cannot be null or blank");
        }
        if (!perWork) {
            return queueId + "_" + suffix;
        }
        if (workName == null || workName.isBlank()) {
            throw new IllegalArgumentException("workName is required for queue role " + this);
        }
        return queueId + "_" + suffix + "_" + workName;
    }
}
