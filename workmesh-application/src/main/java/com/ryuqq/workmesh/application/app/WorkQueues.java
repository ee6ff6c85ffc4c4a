package com.ryuqq.workmesh.application.app;

import com.ryuqq.workmesh.core.model.WorkName;
import com.ryuqq.workmesh.core.spi.QueueHandle;

import java.util.List;

/**
 * Work 하나의 큐 묶음 (request, response, copy-request, copy-response, caller).
 *
 * @author WorkMesh Team
 * @since 1.0.0
 */
public record WorkQueues(
    WorkName workName,
    QueueHandle request,
    QueueHandle response,
    QueueHandle copyRequest,
    QueueHandle copyResponse,
    QueueHandle caller
) {

    public WorkQueues {
        if (workName == null || request == null || response == null
            || copyRequest == null || copyResponse == null || caller == null) {
            throw new IllegalArgumentException("workName and all queues are required");
        }
    }

    public List<QueueHandle> all() {
        return List.of(request, response, copyRequest, copyResponse, caller);
    }
}
